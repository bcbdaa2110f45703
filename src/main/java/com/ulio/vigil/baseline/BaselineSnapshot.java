package com.ulio.vigil.baseline;

import java.time.Instant;
import java.util.Objects;

public final class BaselineSnapshot {
    private final String name;
    private final long sampleCount;
    private final double mean;
    private final double stdDev;
    private final Instant lastUpdatedAt;

    public BaselineSnapshot(String name, long sampleCount, double mean, double stdDev, Instant lastUpdatedAt) {
        this.name = Objects.requireNonNull(name, "name");
        this.sampleCount = Math.max(0L, sampleCount);
        this.mean = Double.isFinite(mean) ? mean : 0.0;
        this.stdDev = Double.isFinite(stdDev) && stdDev > 0.0 ? stdDev : 0.0;
        this.lastUpdatedAt = lastUpdatedAt;
    }

    public static BaselineSnapshot empty(String name) {
        return new BaselineSnapshot(name, 0L, 0.0, 0.0, null);
    }

    public String getName() {
        return name;
    }

    public long getSampleCount() {
        return sampleCount;
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    public double getVariance() {
        return stdDev * stdDev;
    }

    // null until the first finite value
    public Instant getLastUpdatedAt() {
        return lastUpdatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BaselineSnapshot)) {
            return false;
        }
        BaselineSnapshot that = (BaselineSnapshot) o;
        return sampleCount == that.sampleCount
                && Double.compare(that.mean, mean) == 0
                && Double.compare(that.stdDev, stdDev) == 0
                && name.equals(that.name)
                && Objects.equals(lastUpdatedAt, that.lastUpdatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, sampleCount, mean, stdDev, lastUpdatedAt);
    }

    @Override
    public String toString() {
        return "BaselineSnapshot{name=" + name
                + ", sampleCount=" + sampleCount
                + ", mean=" + mean
                + ", stdDev=" + stdDev
                + ", lastUpdatedAt=" + lastUpdatedAt + "}";
    }
}
