package com.ulio.vigil.telemetry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

public class RequestMetricsRegistry implements MetricSampler {
    static final Duration WINDOW = Duration.ofMinutes(1);
    static final int MAX_ACTIVE_REQUESTS = 1000;
    static final int MAX_COMPLETED_REQUESTS = 10_000;
    static final int MAX_SEMAPHORE_WAITS = 1000;

    private final Clock clock;
    private final Supplier<ResourceUsage> resourceUsage;

    private final Map<String, Instant> activeRequests = new HashMap<>();
    private final Deque<CompletedRequest> completedRequests = new ArrayDeque<>();
    private final Deque<Double> semaphoreWaitsMs = new ArrayDeque<>();
    private long cacheHits;
    private long cacheMisses;

    public RequestMetricsRegistry(Clock clock, Supplier<ResourceUsage> resourceUsage) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.resourceUsage = resourceUsage == null
                ? () -> ResourceUsage.unavailable("resource collector not available")
                : resourceUsage;
    }

    public synchronized void startRequest(String requestId) {
        if (requestId == null || activeRequests.size() >= MAX_ACTIVE_REQUESTS) {
            return;
        }
        activeRequests.putIfAbsent(requestId, clock.instant());
    }

    public synchronized void completeRequest(String requestId, boolean failed) {
        if (requestId == null) {
            return;
        }

        Instant startedAt = activeRequests.remove(requestId);
        if (startedAt == null) {
            return;
        }

        Instant completedAt = clock.instant();
        double durationMs = Math.max(0L, Duration.between(startedAt, completedAt).toNanos()) / 1_000_000.0;
        completedRequests.addLast(new CompletedRequest(completedAt, durationMs, failed));
        while (completedRequests.size() > MAX_COMPLETED_REQUESTS) {
            completedRequests.removeFirst();
        }
    }

    public synchronized void recordCacheHit() {
        cacheHits++;
    }

    public synchronized void recordCacheMiss() {
        cacheMisses++;
    }

    public synchronized void recordSemaphoreWait(double waitMs) {
        if (!Double.isFinite(waitMs) || waitMs < 0.0) {
            return;
        }
        semaphoreWaitsMs.addLast(waitMs);
        while (semaphoreWaitsMs.size() > MAX_SEMAPHORE_WAITS) {
            semaphoreWaitsMs.removeFirst();
        }
    }

    @Override
    public Optional<SystemSnapshot> sample() {
        Instant now;
        SystemState state;
        EfficiencyMetrics efficiency;

        synchronized (this) {
            now = clock.instant();
            Instant windowStart = now.minus(WINDOW);

            long completed = 0;
            long errors = 0;
            double durationSumMs = 0.0;

            // newest last; stop at the first request that left the window
            Iterator<CompletedRequest> newestFirst = completedRequests.descendingIterator();
            while (newestFirst.hasNext()) {
                CompletedRequest request = newestFirst.next();
                if (request.completedAt.isBefore(windowStart)) {
                    break;
                }
                completed++;
                if (request.failed) {
                    errors++;
                }
                durationSumMs += request.durationMs;
            }

            double errorRate = (double) errors / Math.max(completed, 1L);
            double avgResponseTime = completed > 0 ? durationSumMs / completed : 0.0;
            state = new SystemState(activeRequests.size(), completed, errorRate, avgResponseTime);

            long cacheOps = cacheHits + cacheMisses;
            double cacheHitRate = cacheOps > 0 ? (double) cacheHits / cacheOps * 100.0 : 0.0;
            double semaphoreWaitAvg = semaphoreWaitsMs.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            efficiency = new EfficiencyMetrics(
                    completed / (double) WINDOW.toSeconds(),
                    cacheHitRate,
                    activeRequests.size(),
                    semaphoreWaitAvg
            );
        }

        // resource probe runs outside the registry lock
        return Optional.of(new SystemSnapshot(now, state, efficiency, resourceUsage.get()));
    }

    private static final class CompletedRequest {
        private final Instant completedAt;
        private final double durationMs;
        private final boolean failed;

        private CompletedRequest(Instant completedAt, double durationMs, boolean failed) {
            this.completedAt = completedAt;
            this.durationMs = durationMs;
            this.failed = failed;
        }
    }
}
