package com.ulio.vigil.action;

import com.ulio.vigil.telemetry.EfficiencyMetrics;
import com.ulio.vigil.telemetry.Observation;

public final class ActionConditions {
    static final int QUEUE_BACKLOG_DEPTH = 10;
    static final double HIGH_ACTIVE_REQUESTS = 50.0;
    static final double HIGH_ERROR_RATE = 0.1;
    static final double LOW_CACHE_HIT_RATE = 50.0;
    static final double SEMAPHORE_CONTENTION_MS = 100.0;
    static final double HIGH_CPU_PERCENT = 80.0;
    static final double MEMORY_GROWTH_FACTOR = 1.5;

    private static final ActionConditions NONE = new Builder().build();

    private final boolean valueAboveDoubleBaseline;
    private final boolean queueBacklog;
    private final boolean highActiveRequests;
    private final boolean highErrorRate;
    private final boolean lowCacheHitRate;
    private final boolean semaphoreContention;
    private final boolean highCpu;
    private final boolean memoryGrowth;

    private ActionConditions(Builder builder) {
        this.valueAboveDoubleBaseline = builder.valueAboveDoubleBaseline;
        this.queueBacklog = builder.queueBacklog;
        this.highActiveRequests = builder.highActiveRequests;
        this.highErrorRate = builder.highErrorRate;
        this.lowCacheHitRate = builder.lowCacheHitRate;
        this.semaphoreContention = builder.semaphoreContention;
        this.highCpu = builder.highCpu;
        this.memoryGrowth = builder.memoryGrowth;
    }

    public static ActionConditions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    // baselineMean is the mean reported on the record
    public static ActionConditions from(Observation observation, double baselineMean) {
        if (observation == null) {
            return NONE;
        }

        double value = observation.getCurrentValue();
        EfficiencyMetrics efficiency = observation.getSnapshot().getEfficiency();

        return new Builder()
                .valueAboveDoubleBaseline(value > baselineMean * 2.0)
                .queueBacklog(efficiency != null && efficiency.getQueueDepth() > QUEUE_BACKLOG_DEPTH)
                .highActiveRequests(value > HIGH_ACTIVE_REQUESTS)
                .highErrorRate(value > HIGH_ERROR_RATE)
                .lowCacheHitRate(value < LOW_CACHE_HIT_RATE)
                .semaphoreContention(value > SEMAPHORE_CONTENTION_MS)
                .highCpu(value > HIGH_CPU_PERCENT)
                .memoryGrowth(value > baselineMean * MEMORY_GROWTH_FACTOR)
                .build();
    }

    public boolean isValueAboveDoubleBaseline() {
        return valueAboveDoubleBaseline;
    }

    public boolean isQueueBacklog() {
        return queueBacklog;
    }

    public boolean isHighActiveRequests() {
        return highActiveRequests;
    }

    public boolean isHighErrorRate() {
        return highErrorRate;
    }

    public boolean isLowCacheHitRate() {
        return lowCacheHitRate;
    }

    public boolean isSemaphoreContention() {
        return semaphoreContention;
    }

    public boolean isHighCpu() {
        return highCpu;
    }

    public boolean isMemoryGrowth() {
        return memoryGrowth;
    }

    public static final class Builder {
        private boolean valueAboveDoubleBaseline;
        private boolean queueBacklog;
        private boolean highActiveRequests;
        private boolean highErrorRate;
        private boolean lowCacheHitRate;
        private boolean semaphoreContention;
        private boolean highCpu;
        private boolean memoryGrowth;

        private Builder() {
        }

        public Builder valueAboveDoubleBaseline(boolean value) {
            this.valueAboveDoubleBaseline = value;
            return this;
        }

        public Builder queueBacklog(boolean value) {
            this.queueBacklog = value;
            return this;
        }

        public Builder highActiveRequests(boolean value) {
            this.highActiveRequests = value;
            return this;
        }

        public Builder highErrorRate(boolean value) {
            this.highErrorRate = value;
            return this;
        }

        public Builder lowCacheHitRate(boolean value) {
            this.lowCacheHitRate = value;
            return this;
        }

        public Builder semaphoreContention(boolean value) {
            this.semaphoreContention = value;
            return this;
        }

        public Builder highCpu(boolean value) {
            this.highCpu = value;
            return this;
        }

        public Builder memoryGrowth(boolean value) {
            this.memoryGrowth = value;
            return this;
        }

        public ActionConditions build() {
            return new ActionConditions(this);
        }
    }
}
