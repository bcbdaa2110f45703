package com.ulio.vigil.baseline;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;

public final class MetricSeries {
    private final String name;
    private final RunningStat stat = new RunningStat();
    private Instant lastUpdatedAt;

    MetricSeries(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    public synchronized BaselineSnapshot snapshot() {
        return new BaselineSnapshot(name, stat.getCount(), stat.getMean(), stat.getStdDev(), lastUpdatedAt);
    }

    synchronized BaselineSnapshot update(double value, Instant now) {
        if (stat.add(value)) {
            lastUpdatedAt = now;
        }
        return snapshot();
    }

    synchronized <T> T observe(double value, Instant now, BaselineStore.Observer<T> observer) {
        BaselineSnapshot before = snapshot();
        BaselineSnapshot after = update(value, now);
        return observer.onObserved(before, after);
    }

    synchronized SeriesState toState() {
        SeriesState state = new SeriesState();
        state.count = stat.getCount();
        state.mean = stat.getMean();
        state.m2 = stat.getM2();
        state.lastUpdatedAt = lastUpdatedAt == null ? null : lastUpdatedAt.toString();
        return state;
    }

    synchronized boolean restore(SeriesState state) {
        if (state == null || !stat.restore(state.count, state.mean, state.m2)) {
            return false;
        }
        lastUpdatedAt = parseInstant(state.lastUpdatedAt);
        return true;
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            // Keeps the restored statistics, only the timestamp is lost.
            return null;
        }
    }

    static final class SeriesState {
        public long count;
        public double mean;
        public double m2;
        public String lastUpdatedAt;
    }
}
