package com.ulio.vigil.core;

import com.ulio.vigil.action.ActionConditions;
import com.ulio.vigil.action.ActionRecommender;
import com.ulio.vigil.anomaly.Deviation;
import com.ulio.vigil.anomaly.DeviationEvaluator;
import com.ulio.vigil.baseline.BaselineSnapshot;
import com.ulio.vigil.baseline.BaselineStore;
import com.ulio.vigil.classifier.MetricClass;
import com.ulio.vigil.classifier.Severity;
import com.ulio.vigil.classifier.SeverityClassifier;
import com.ulio.vigil.record.AnomalyRecord;
import com.ulio.vigil.record.AnomalyRecordEmitter;
import com.ulio.vigil.telemetry.MonitoredMetrics;
import com.ulio.vigil.telemetry.Observation;
import com.ulio.vigil.telemetry.SystemSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class DetectionEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DetectionEngine.class);

    private final BaselineStore baselineStore;
    private final DeviationEvaluator deviationEvaluator;
    private final SeverityClassifier severityClassifier;
    private final ActionRecommender actionRecommender;
    private final AnomalyRecordEmitter recordEmitter;
    private final RecentAnomalies recentAnomalies;
    private final int baselineMinSamples;
    private final int confidenceMinSamples;

    public DetectionEngine(
            BaselineStore baselineStore,
            DeviationEvaluator deviationEvaluator,
            SeverityClassifier severityClassifier,
            ActionRecommender actionRecommender,
            AnomalyRecordEmitter recordEmitter,
            RecentAnomalies recentAnomalies,
            int baselineMinSamples,
            int confidenceMinSamples
    ) {
        this.baselineStore = baselineStore;
        this.deviationEvaluator = deviationEvaluator;
        this.severityClassifier = severityClassifier;
        this.actionRecommender = actionRecommender;
        this.recordEmitter = recordEmitter;
        this.recentAnomalies = recentAnomalies;
        this.baselineMinSamples = Math.max(1, baselineMinSamples);
        this.confidenceMinSamples = Math.max(this.baselineMinSamples, confidenceMinSamples);
    }

    public static DetectionEngine create(Config config, Clock clock) {
        Config resolved = config == null ? Config.defaults() : config;
        Path baselinePath = resolved.getBaselinePath().isEmpty() ? null : Path.of(resolved.getBaselinePath());

        return new DetectionEngine(
                new BaselineStore(clock, baselinePath),
                new DeviationEvaluator(),
                new SeverityClassifier(
                        resolved.getWarningDeviation(),
                        resolved.buildSeverityRules(),
                        resolved.buildMetricClasses()
                ),
                new ActionRecommender(),
                new AnomalyRecordEmitter(),
                new RecentAnomalies(resolved.getRecentAnomaliesMax()),
                resolved.getBaselineMinSamples(),
                resolved.getConfidenceMinSamples()
        );
    }

    public List<AnomalyRecord> detect(SystemSnapshot snapshot) {
        List<Observation> observations = MonitoredMetrics.observe(snapshot);
        if (observations.isEmpty()) {
            return Collections.emptyList();
        }

        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (Observation observation : observations) {
            evaluate(observation).ifPresent(anomalies::add);
        }
        return anomalies;
    }

    public Optional<AnomalyRecord> evaluate(Observation observation) {
        if (observation == null) {
            return Optional.empty();
        }

        double value = observation.getCurrentValue();
        if (!Double.isFinite(value)) {
            log.debug("Ignoring non-finite value for metric {}", observation.getMetricName());
            return Optional.empty();
        }

        Scored scored = baselineStore.observe(observation.getMetricName(), value, (before, after) -> {
            if (before.getSampleCount() < baselineMinSamples) {
                return new Scored(before, after, null);
            }
            return new Scored(before, after, deviationEvaluator.evaluate(before, value));
        });

        if (scored.deviation == null) {
            return Optional.empty();
        }

        String metricName = scored.after.getName();
        Deviation deviation = scored.deviation;
        Severity severity = severityClassifier.classify(deviation.getDeviation(), deviation.getPercentageChange(), metricName);
        if (!severity.isAnomalous()) {
            return Optional.empty();
        }

        MetricClass metricClass = severityClassifier.classOf(metricName);
        ActionConditions conditions = ActionConditions.from(observation, scored.after.getMean());
        List<String> actions = actionRecommender.recommend(metricName, deviation.getDirection(), severity, conditions);
        boolean lowConfidence = deviation.isZeroVariance() || scored.before.getSampleCount() < confidenceMinSamples;

        AnomalyRecord record = recordEmitter.emit(observation, scored.after, deviation, severity, metricClass, actions, lowConfidence);
        recentAnomalies.add(record);

        log.debug("Anomaly {}: value={} baseline={} deviation={} change={}% severity={}",
                record.getAnomalyId(), value, scored.before.getMean(), deviation.getDeviation(),
                deviation.getPercentageChange(), severity.value());
        return Optional.of(record);
    }

    public List<AnomalyRecord> recentAnomalies(int limit) {
        return recentAnomalies.recent(limit);
    }

    public Map<String, BaselineSnapshot> baselines() {
        return baselineStore.snapshots();
    }

    public boolean isWarmedUp(String metricName) {
        return baselineStore.snapshot(metricName)
                .map(snapshot -> snapshot.getSampleCount() >= baselineMinSamples)
                .orElse(false);
    }

    public void saveBaselines() {
        baselineStore.saveNow();
    }

    @Override
    public void close() {
        baselineStore.close();
    }

    private static final class Scored {
        private final BaselineSnapshot before;
        private final BaselineSnapshot after;
        private final Deviation deviation;

        private Scored(BaselineSnapshot before, BaselineSnapshot after, Deviation deviation) {
            this.before = before;
            this.after = after;
            this.deviation = deviation;
        }
    }
}
