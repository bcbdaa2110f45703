package com.ulio.vigil.telemetry;

import com.ulio.vigil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RequestMetricsRegistryTest {

    private final MutableClock clock = MutableClock.at("2025-12-30T12:00:00Z");
    private final RequestMetricsRegistry registry =
            new RequestMetricsRegistry(clock, () -> ResourceUsage.available(20.0, 512.0, 64, 12));

    private void recordTraffic() {
        registry.startRequest("r1");
        registry.startRequest("r2");
        registry.startRequest("r3");
        clock.advance(Duration.ofMillis(100));
        registry.completeRequest("r1", false);
        clock.advance(Duration.ofMillis(200));
        registry.completeRequest("r2", true);

        registry.recordCacheHit();
        registry.recordCacheHit();
        registry.recordCacheHit();
        registry.recordCacheMiss();
        registry.recordSemaphoreWait(10.0);
        registry.recordSemaphoreWait(30.0);
    }

    @Test
    void sample_aggregatesLastMinute() {
        recordTraffic();

        SystemSnapshot snapshot = registry.sample().orElseThrow();

        SystemState state = snapshot.getSystemState();
        assertThat(state.getActiveRequests()).isEqualTo(1);
        assertThat(state.getCompletedRequests1min()).isEqualTo(2);
        assertThat(state.getErrorRate1min()).isEqualTo(0.5);
        assertThat(state.getAvgResponseTime1min()).isCloseTo(200.0, within(1e-9));

        EfficiencyMetrics efficiency = snapshot.getEfficiency();
        assertThat(efficiency.getRequestsPerSecond()).isCloseTo(2.0 / 60.0, within(1e-12));
        assertThat(efficiency.getCacheHitRate()).isEqualTo(75.0);
        assertThat(efficiency.getQueueDepth()).isEqualTo(1);
        assertThat(efficiency.getSemaphoreWaitTimeAvgMs()).isEqualTo(20.0);

        assertThat(snapshot.getTimestamp()).isEqualTo(clock.instant());
        assertThat(snapshot.getResourceUsage().getCpuPercent()).contains(20.0);
    }

    @Test
    void sample_dropsRequestsOutsideWindow() {
        recordTraffic();
        clock.advance(Duration.ofSeconds(61));

        SystemState state = registry.sample().orElseThrow().getSystemState();

        assertThat(state.getCompletedRequests1min()).isZero();
        assertThat(state.getErrorRate1min()).isZero();
        assertThat(state.getAvgResponseTime1min()).isZero();
        assertThat(state.getActiveRequests()).isEqualTo(1);
    }

    @Test
    void completeRequest_ignoresUnknownIds() {
        registry.completeRequest("never-started", true);
        registry.recordSemaphoreWait(-5.0);

        SystemSnapshot snapshot = registry.sample().orElseThrow();

        assertThat(snapshot.getSystemState().getCompletedRequests1min()).isZero();
        assertThat(snapshot.getEfficiency().getCacheHitRate()).isZero();
        assertThat(snapshot.getEfficiency().getSemaphoreWaitTimeAvgMs()).isZero();
    }

    @Test
    void sample_withoutProbeReportsUnavailableResources() {
        RequestMetricsRegistry bare = new RequestMetricsRegistry(clock, null);

        ResourceUsage usage = bare.sample().orElseThrow().getResourceUsage();

        assertThat(usage.isAvailable()).isFalse();
        assertThat(usage.getError()).isPresent();
    }
}
