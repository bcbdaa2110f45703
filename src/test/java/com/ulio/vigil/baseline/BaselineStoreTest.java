package com.ulio.vigil.baseline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ulio.vigil.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BaselineStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void update_createsSeriesLazily() {
        MutableClock clock = MutableClock.at("2025-12-30T12:00:00Z");
        BaselineStore store = new BaselineStore(clock, null);

        assertThat(store.snapshot("active_requests")).isEmpty();

        BaselineSnapshot snapshot = store.update("active_requests", 4.0);

        assertThat(store.size()).isEqualTo(1);
        assertThat(snapshot.getName()).isEqualTo("active_requests");
        assertThat(snapshot.getSampleCount()).isEqualTo(1);
        assertThat(snapshot.getMean()).isEqualTo(4.0);
        assertThat(snapshot.getLastUpdatedAt()).isEqualTo(clock.instant());
    }

    @Test
    void update_mapsBlankNamesToUnknownSeries() {
        BaselineStore store = new BaselineStore();

        store.update(null, 1.0);
        store.update("  ", 3.0);

        assertThat(store.snapshots()).containsOnlyKeys("unknown");
        assertThat(store.snapshot("unknown").orElseThrow().getSampleCount()).isEqualTo(2);
    }

    @Test
    void update_nonFiniteValueLeavesSeriesUnchanged() {
        MutableClock clock = MutableClock.at("2025-12-30T12:00:00Z");
        BaselineStore store = new BaselineStore(clock, null);
        store.update("cache_hit_rate", 80.0);
        clock.advance(Duration.ofSeconds(5));

        BaselineSnapshot after = store.update("cache_hit_rate", Double.NaN);

        assertThat(after.getSampleCount()).isEqualTo(1);
        assertThat(after.getLastUpdatedAt()).isEqualTo(clock.instant().minusSeconds(5));
    }

    @Test
    void observe_handsObserverPreAndPostUpdateBaselines() {
        BaselineStore store = new BaselineStore();
        store.update("avg_response_time_1min", 100.0);
        store.update("avg_response_time_1min", 200.0);

        double[] seen = new double[4];
        store.observe("avg_response_time_1min", 600.0, (before, after) -> {
            seen[0] = before.getSampleCount();
            seen[1] = before.getMean();
            seen[2] = after.getSampleCount();
            seen[3] = after.getMean();
            return null;
        });

        assertThat(seen[0]).isEqualTo(2.0);
        assertThat(seen[1]).isEqualTo(150.0);
        assertThat(seen[2]).isEqualTo(3.0);
        assertThat(seen[3]).isEqualTo(300.0);
    }

    @Test
    void observe_concurrentUpdatesOnOneMetricAreNotLost() throws Exception {
        BaselineStore store = new BaselineStore();
        int threads = 8;
        int perThread = 2000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger torn = new AtomicInteger();

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        store.observe("queue_depth", i % 7, (before, after) -> {
                            if (after.getSampleCount() != before.getSampleCount() + 1) {
                                torn.incrementAndGet();
                            }
                            return null;
                        });
                        store.update("requests_per_second", 1.0);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(torn.get()).isZero();
        assertThat(store.snapshot("queue_depth").orElseThrow().getSampleCount()).isEqualTo((long) threads * perThread);
        assertThat(store.snapshot("requests_per_second").orElseThrow().getSampleCount()).isEqualTo((long) threads * perThread);
    }

    @Test
    void snapshots_areSortedByMetricName() {
        BaselineStore store = new BaselineStore();
        store.update("requests_per_second", 1.0);
        store.update("active_requests", 1.0);
        store.update("cache_hit_rate", 1.0);

        assertThat(store.snapshots().keySet())
                .containsExactly("active_requests", "cache_hit_rate", "requests_per_second");
    }

    @Test
    void close_persistsAndRestoresBaselines() {
        Path file = tempDir.resolve("state/baselines.json");
        MutableClock clock = MutableClock.at("2025-12-30T12:00:00Z");

        BaselineStore first = new BaselineStore(clock, file);
        first.update("avg_response_time_1min", 90.0);
        first.update("avg_response_time_1min", 110.0);
        first.update("active_requests", 7.0);
        first.close();

        assertThat(file).exists();

        BaselineStore restored = new BaselineStore(clock, file);
        BaselineSnapshot latency = restored.snapshot("avg_response_time_1min").orElseThrow();
        assertThat(latency.getSampleCount()).isEqualTo(2);
        assertThat(latency.getMean()).isEqualTo(100.0);
        assertThat(latency.getStdDev()).isCloseTo(Math.sqrt(200.0), within(1e-9));
        assertThat(latency.getLastUpdatedAt()).isEqualTo(clock.instant());
        assertThat(restored.snapshot("active_requests").orElseThrow().getMean()).isEqualTo(7.0);
    }

    @Test
    void update_doesNotTouchDiskUntilSaved() {
        Path file = tempDir.resolve("baselines.json");
        BaselineStore store = new BaselineStore(MutableClock.at("2025-12-30T12:00:00Z"), file);

        for (int i = 0; i < 500; i++) {
            store.update("active_requests", i);
            store.observe("queue_depth", i % 3, (before, after) -> null);
        }
        assertThat(file).doesNotExist();

        store.saveNow();
        assertThat(file).exists();
    }

    @Test
    void saveNow_concurrentSavesAlwaysLeaveReadableFile() throws Exception {
        Path file = tempDir.resolve("shared/baselines.json");
        BaselineStore store = new BaselineStore(MutableClock.at("2025-12-30T12:00:00Z"), file);
        ObjectMapper objectMapper = new ObjectMapper();
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        try {
            for (int round = 0; round < 100; round++) {
                CountDownLatch start = new CountDownLatch(1);
                List<Future<?>> futures = new ArrayList<>();
                for (int t = 0; t < threads; t++) {
                    String metric = "metric_" + t;
                    double value = round + t;
                    futures.add(executor.submit(() -> {
                        start.await();
                        store.update(metric, value);
                        store.saveNow();
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(30, TimeUnit.SECONDS);
                }

                JsonNode saved = objectMapper.readTree(file.toFile());
                assertThat(saved.path("metrics").size()).isEqualTo(threads);
            }
        } finally {
            executor.shutdownNow();
        }

        try (Stream<Path> leftovers = Files.list(file.getParent())) {
            assertThat(leftovers).containsExactly(file);
        }

        BaselineStore restored = new BaselineStore(MutableClock.at("2025-12-30T12:00:00Z"), file);
        assertThat(restored.size()).isEqualTo(threads);
        assertThat(restored.snapshot("metric_0").orElseThrow().getSampleCount()).isEqualTo(100);
    }

    @Test
    void constructor_startsFreshFromUnreadableFile() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{ not json", StandardCharsets.UTF_8);

        BaselineStore store = new BaselineStore(MutableClock.at("2025-12-30T12:00:00Z"), file);

        assertThat(store.size()).isZero();
    }

    @Test
    void constructor_skipsInvalidPersistedEntries() throws Exception {
        Path file = tempDir.resolve("partial.json");
        Files.writeString(file, "{\"metrics\":{"
                + "\"good\":{\"count\":2,\"mean\":5.0,\"m2\":2.0,\"lastUpdatedAt\":\"2025-12-30T11:00:00Z\"},"
                + "\"bad\":{\"count\":-4,\"mean\":1.0,\"m2\":0.0}}}", StandardCharsets.UTF_8);

        BaselineStore store = new BaselineStore(MutableClock.at("2025-12-30T12:00:00Z"), file);

        assertThat(store.snapshots()).containsOnlyKeys("good");
        assertThat(store.snapshot("good").orElseThrow().getStdDev()).isCloseTo(Math.sqrt(2.0), within(1e-12));
    }
}
