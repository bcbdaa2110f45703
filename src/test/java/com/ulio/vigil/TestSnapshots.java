package com.ulio.vigil;

import com.ulio.vigil.telemetry.EfficiencyMetrics;
import com.ulio.vigil.telemetry.ResourceUsage;
import com.ulio.vigil.telemetry.SystemSnapshot;
import com.ulio.vigil.telemetry.SystemState;

import java.time.Instant;

public final class TestSnapshots {
    public static final Instant T0 = Instant.parse("2025-12-30T12:00:00Z");

    private TestSnapshots() {
    }

    public static SystemSnapshot quiet() {
        return withQueueDepth(2);
    }

    public static SystemSnapshot quietAt(Instant timestamp) {
        return new SystemSnapshot(
                timestamp,
                new SystemState(3, 120, 0.0, 250.0),
                new EfficiencyMetrics(2.0, 80.0, 2, 5.0),
                ResourceUsage.unavailable("oshi not available")
        );
    }

    public static SystemSnapshot withQueueDepth(long queueDepth) {
        return new SystemSnapshot(
                T0,
                new SystemState(3, 120, 0.0, 250.0),
                new EfficiencyMetrics(2.0, 80.0, queueDepth, 5.0),
                ResourceUsage.unavailable("oshi not available")
        );
    }

    public static SystemSnapshot of(long activeRequests, double avgResponseTime, double requestsPerSecond, long queueDepth) {
        return new SystemSnapshot(
                T0,
                new SystemState(activeRequests, Math.round(requestsPerSecond * 60), 0.0, avgResponseTime),
                new EfficiencyMetrics(requestsPerSecond, 90.0, queueDepth, 1.0),
                ResourceUsage.available(12.5, 256.0, 40, 18)
        );
    }
}
