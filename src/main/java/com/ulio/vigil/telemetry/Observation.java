package com.ulio.vigil.telemetry;

import java.util.Objects;

public class Observation {
    private final String metricName;
    private final double currentValue;
    private final SystemSnapshot snapshot;

    public Observation(String metricName, double currentValue, SystemSnapshot snapshot) {
        this.metricName = metricName;
        this.currentValue = currentValue;
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
    }

    public String getMetricName() {
        return metricName;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public SystemSnapshot getSnapshot() {
        return snapshot;
    }
}
