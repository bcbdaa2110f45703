package com.ulio.vigil.telemetry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public final class ResourceUsage {
    private final Double cpuPercent;
    private final Double memoryMb;
    private final Long openFiles;
    private final Long threads;
    private final String error;

    private ResourceUsage(Double cpuPercent, Double memoryMb, Long openFiles, Long threads, String error) {
        this.cpuPercent = cpuPercent;
        this.memoryMb = memoryMb;
        this.openFiles = openFiles;
        this.threads = threads;
        this.error = error;
    }

    public static ResourceUsage available(double cpuPercent, double memoryMb, long openFiles, long threads) {
        return new ResourceUsage(sanitize(cpuPercent), sanitize(memoryMb), Math.max(0L, openFiles), Math.max(0L, threads), null);
    }

    public static ResourceUsage unavailable(String error) {
        String reason = error == null || error.isBlank() ? "resource collector not available" : error;
        return new ResourceUsage(null, null, null, null, reason);
    }

    public boolean isAvailable() {
        return error == null;
    }

    public Optional<Double> getCpuPercent() {
        return Optional.ofNullable(cpuPercent);
    }

    public Optional<Double> getMemoryMb() {
        return Optional.ofNullable(memoryMb);
    }

    public Optional<Long> getOpenFiles() {
        return Optional.ofNullable(openFiles);
    }

    public Optional<Long> getThreads() {
        return Optional.ofNullable(threads);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public Map<String, Object> asMap() {
        Map<String, Object> values = new LinkedHashMap<>();
        if (!isAvailable()) {
            values.put("error", error);
            return Collections.unmodifiableMap(values);
        }
        values.put("cpu_percent", cpuPercent);
        values.put("memory_mb", memoryMb);
        values.put("open_files", openFiles);
        values.put("threads", threads);
        return Collections.unmodifiableMap(values);
    }

    private static double sanitize(double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            return 0.0;
        }
        return value;
    }
}
