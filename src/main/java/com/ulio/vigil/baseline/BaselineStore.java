package com.ulio.vigil.baseline;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

public class BaselineStore implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BaselineStore.class);

    static final String UNKNOWN_METRIC = "unknown";

    @FunctionalInterface
    public interface Observer<T> {
        T onObserved(BaselineSnapshot before, BaselineSnapshot after);
    }

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ConcurrentHashMap<String, MetricSeries> series = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Path baselinePath;

    public BaselineStore() {
        this(Clock.systemUTC(), null);
    }

    public BaselineStore(Clock clock, Path baselinePath) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.baselinePath = baselinePath;
        loadFromDisk();
    }

    public BaselineSnapshot update(String metricName, double value) {
        return seriesFor(metricName).update(value, clock.instant());
    }

    // observer runs inside the series lock, between the before and after snapshots
    public <T> T observe(String metricName, double value, Observer<T> observer) {
        return seriesFor(metricName).observe(value, clock.instant(), observer);
    }

    public Optional<BaselineSnapshot> snapshot(String metricName) {
        MetricSeries existing = series.get(normalize(metricName));
        return existing == null ? Optional.empty() : Optional.of(existing.snapshot());
    }

    public Map<String, BaselineSnapshot> snapshots() {
        Map<String, BaselineSnapshot> sorted = new TreeMap<>();
        for (MetricSeries metricSeries : series.values()) {
            sorted.put(metricSeries.getName(), metricSeries.snapshot());
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(sorted));
    }

    public int size() {
        return series.size();
    }

    public synchronized void saveNow() {
        if (baselinePath == null) {
            return;
        }

        try {
            Path directory = baselinePath.toAbsolutePath().getParent();
            Files.createDirectories(directory);

            PersistedBaselines persisted = new PersistedBaselines();
            for (MetricSeries metricSeries : series.values()) {
                persisted.metrics.put(metricSeries.getName(), metricSeries.toState());
            }

            Path temp = Files.createTempFile(directory, baselinePath.getFileName().toString(), ".tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), persisted);
                replace(temp, baselinePath);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            log.warn("Failed to save baselines to {}: {}", baselinePath, e.getMessage());
        }
    }

    @Override
    public synchronized void close() {
        saveNow();
    }

    private static void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static String normalize(String metricName) {
        if (metricName == null || metricName.isBlank()) {
            return UNKNOWN_METRIC;
        }
        return metricName.trim();
    }

    private MetricSeries seriesFor(String metricName) {
        return series.computeIfAbsent(normalize(metricName), MetricSeries::new);
    }

    private void loadFromDisk() {
        if (baselinePath == null || !Files.exists(baselinePath)) {
            return;
        }

        try {
            PersistedBaselines persisted = objectMapper.readValue(baselinePath.toFile(), PersistedBaselines.class);
            if (persisted == null || persisted.metrics == null) {
                return;
            }

            int restored = 0;
            for (Map.Entry<String, MetricSeries.SeriesState> entry : persisted.metrics.entrySet()) {
                MetricSeries metricSeries = new MetricSeries(normalize(entry.getKey()));
                if (metricSeries.restore(entry.getValue())) {
                    series.put(metricSeries.getName(), metricSeries);
                    restored++;
                } else {
                    log.warn("Skipping invalid persisted baseline for metric {}", entry.getKey());
                }
            }
            log.info("Restored {} metric baselines from {}", restored, baselinePath);
        } catch (Exception e) {
            log.warn("Failed to load baselines from {}, starting fresh: {}", baselinePath, e.getMessage());
        }
    }

    static final class PersistedBaselines {
        public Map<String, MetricSeries.SeriesState> metrics = new LinkedHashMap<>();
    }
}
