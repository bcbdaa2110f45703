package com.ulio.vigil.telemetry;

public class EfficiencyMetrics {
    private final double requestsPerSecond;
    private final double cacheHitRate;
    private final long queueDepth;
    private final double semaphoreWaitTimeAvgMs;

    public EfficiencyMetrics(double requestsPerSecond, double cacheHitRate, long queueDepth, double semaphoreWaitTimeAvgMs) {
        this.requestsPerSecond = sanitize(requestsPerSecond);
        this.cacheHitRate = sanitize(cacheHitRate);
        this.queueDepth = Math.max(0L, queueDepth);
        this.semaphoreWaitTimeAvgMs = sanitize(semaphoreWaitTimeAvgMs);
    }

    public double getRequestsPerSecond() {
        return requestsPerSecond;
    }

    public double getCacheHitRate() {
        return cacheHitRate;
    }

    public long getQueueDepth() {
        return queueDepth;
    }

    public double getSemaphoreWaitTimeAvgMs() {
        return semaphoreWaitTimeAvgMs;
    }

    private static double sanitize(double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            return 0.0;
        }
        return value;
    }
}
