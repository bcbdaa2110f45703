package com.ulio.vigil.telemetry;

import java.time.Instant;
import java.util.Objects;

public class SystemSnapshot {
    private final Instant timestamp;
    private final SystemState systemState;
    private final EfficiencyMetrics efficiency;
    private final ResourceUsage resourceUsage;

    public SystemSnapshot(Instant timestamp, SystemState systemState, EfficiencyMetrics efficiency, ResourceUsage resourceUsage) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.systemState = Objects.requireNonNull(systemState, "systemState");
        this.efficiency = efficiency;
        this.resourceUsage = resourceUsage == null
                ? ResourceUsage.unavailable("resource collector not available")
                : resourceUsage;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public SystemState getSystemState() {
        return systemState;
    }

    // null when the producer does not track efficiency metrics
    public EfficiencyMetrics getEfficiency() {
        return efficiency;
    }

    public ResourceUsage getResourceUsage() {
        return resourceUsage;
    }
}
