package com.ulio.vigil.telemetry;

public class SystemState {
    private final long activeRequests;
    private final long completedRequests1min;
    private final double errorRate1min;
    private final double avgResponseTime1min;

    public SystemState(long activeRequests, long completedRequests1min, double errorRate1min, double avgResponseTime1min) {
        this.activeRequests = Math.max(0L, activeRequests);
        this.completedRequests1min = Math.max(0L, completedRequests1min);
        this.errorRate1min = sanitize(errorRate1min);
        this.avgResponseTime1min = sanitize(avgResponseTime1min);
    }

    public long getActiveRequests() {
        return activeRequests;
    }

    public long getCompletedRequests1min() {
        return completedRequests1min;
    }

    public double getErrorRate1min() {
        return errorRate1min;
    }

    public double getAvgResponseTime1min() {
        return avgResponseTime1min;
    }

    private static double sanitize(double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            return 0.0;
        }
        return value;
    }
}
