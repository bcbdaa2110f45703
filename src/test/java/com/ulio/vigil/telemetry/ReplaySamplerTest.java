package com.ulio.vigil.telemetry;

import com.ulio.vigil.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ReplaySamplerTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = MutableClock.at("2025-12-30T12:00:00Z");

    @Test
    void sample_readsSnapshotsSkippingNoise() throws IOException {
        Path file = tempDir.resolve("snapshots.jsonl");
        Files.writeString(file, String.join("\n",
                "# recorded on staging",
                "{\"timestamp\": 1767096000.5, \"system_state\": {\"active_requests\": 7, \"completed_requests_1min\": 120,"
                        + " \"error_rate_1min\": 0.02, \"avg_response_time_1min\": 180.5},"
                        + " \"efficiency\": {\"requests_per_second\": 2.0, \"cache_hit_rate\": 81.0, \"queue_depth\": 3,"
                        + " \"semaphore_wait_time_avg_ms\": 4.5},"
                        + " \"resource_usage\": {\"cpu_percent\": 12.0, \"memory_mb\": 300.0, \"open_files\": 30, \"threads\": 9}}",
                "",
                "this is not json",
                "{\"efficiency\": {}}",
                "{\"timestamp\": \"2025-12-30T12:01:00Z\", \"system_state\": {\"active_requests\": 2},"
                        + " \"resource_usage\": {\"error\": \"oshi not available\"}}",
                "{\"system_state\": {}}",
                ""), StandardCharsets.UTF_8);

        try (ReplaySampler sampler = new ReplaySampler(file, clock)) {
            SystemSnapshot first = sampler.sample().orElseThrow();
            assertThat(first.getTimestamp()).isEqualTo(Instant.parse("2025-12-30T12:00:00.500Z"));
            assertThat(first.getSystemState().getActiveRequests()).isEqualTo(7);
            assertThat(first.getSystemState().getAvgResponseTime1min()).isEqualTo(180.5);
            assertThat(first.getEfficiency().getQueueDepth()).isEqualTo(3);
            assertThat(first.getResourceUsage().getMemoryMb()).contains(300.0);

            SystemSnapshot second = sampler.sample().orElseThrow();
            assertThat(second.getTimestamp()).isEqualTo(Instant.parse("2025-12-30T12:01:00Z"));
            assertThat(second.getEfficiency()).isNull();
            assertThat(second.getResourceUsage().getError()).contains("oshi not available");
            assertThat(MonitoredMetrics.observe(second)).hasSize(4);

            SystemSnapshot third = sampler.sample().orElseThrow();
            assertThat(third.getTimestamp()).isEqualTo(clock.instant());

            assertThat(sampler.sample()).isEmpty();
            assertThat(sampler.sample()).isEmpty();
        }
    }
}
