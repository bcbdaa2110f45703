package com.ulio.vigil.core;

import com.ulio.vigil.comms.AnomalyReporter;
import com.ulio.vigil.record.AnomalyRecord;
import com.ulio.vigil.telemetry.MetricSampler;
import com.ulio.vigil.telemetry.SystemSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

public class DetectionLoop implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(DetectionLoop.class);

    private final long samplingIntervalMs;
    private final MetricSampler sampler;
    private final DetectionEngine engine;
    private final AnomalyReporter reporter;
    private final AlertThrottle alertThrottle;
    private final int baselineSaveEveryTicks;

    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private volatile boolean exhausted;
    private long ticks;

    public DetectionLoop(
            long samplingIntervalMs,
            MetricSampler sampler,
            DetectionEngine engine,
            AnomalyReporter reporter,
            AlertThrottle alertThrottle,
            int baselineSaveEveryTicks
    ) {
        this.samplingIntervalMs = Math.max(0L, samplingIntervalMs);
        this.sampler = sampler;
        this.engine = engine;
        this.reporter = reporter;
        this.alertThrottle = alertThrottle;
        this.baselineSaveEveryTicks = Math.max(1, baselineSaveEveryTicks);
    }

    @Override
    public void run() {
        log.info("Starting anomaly detection loop (interval: {} ms)", samplingIntervalMs);
        try {
            while (!Thread.currentThread().isInterrupted() && !exhausted) {
                long tickStartMs = System.currentTimeMillis();

                try {
                    List<AnomalyRecord> anomalies = tick();
                    if (!anomalies.isEmpty()) {
                        log.info("Detected {} anomaly record(s)", anomalies.size());
                    }
                } catch (RuntimeException e) {
                    // A broken tick must not kill the loop.
                    log.error("Anomaly detection tick failed: {}", e.getMessage(), e);
                }

                if (!exhausted) {
                    sleepUntilNextTick(tickStartMs);
                }
            }
        } finally {
            shutdown();
        }
    }

    public List<AnomalyRecord> tick() {
        Optional<SystemSnapshot> snapshot = sampler.sample();
        if (snapshot.isEmpty()) {
            log.info("Metric sampler has no more snapshots; stopping");
            exhausted = true;
            return Collections.emptyList();
        }

        List<AnomalyRecord> anomalies = engine.detect(snapshot.get());
        for (AnomalyRecord record : anomalies) {
            publish(record);
        }

        if (++ticks % baselineSaveEveryTicks == 0) {
            engine.saveBaselines();
        }
        return anomalies;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }

        try {
            reporter.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close anomaly reporter: {}", e.getMessage());
        }

        if (sampler instanceof AutoCloseable) {
            try {
                ((AutoCloseable) sampler).close();
            } catch (Exception e) {
                log.warn("Failed to close metric sampler: {}", e.getMessage());
            }
        }

        engine.close();
    }

    private void publish(AnomalyRecord record) {
        try {
            reporter.report(record);
        } catch (RuntimeException e) {
            log.error("Anomaly reporter failed for {}: {}", record.getAnomalyId(), e.getMessage());
        }

        if (alertThrottle.shouldAlert(record)) {
            log.warn("ANOMALY DETECTED: {} = {} (baseline: {}, deviation: {}σ, change: {}%, severity: {})",
                    record.getMetricName(),
                    format(record.getCurrentValue()),
                    format(record.getBaselineValue()),
                    format(record.getDeviation()),
                    String.format(Locale.ROOT, "%+.1f", record.getPercentageChange()),
                    record.getSeverity().value());
        } else {
            log.debug("Anomaly {} within alert cooldown", record.getAnomalyId());
        }
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private void sleepUntilNextTick(long tickStartMs) {
        long elapsedMs = System.currentTimeMillis() - tickStartMs;
        long sleepMs = samplingIntervalMs - elapsedMs;
        if (sleepMs <= 0) {
            return;
        }

        try {
            Thread.sleep(sleepMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
