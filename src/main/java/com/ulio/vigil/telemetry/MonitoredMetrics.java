package com.ulio.vigil.telemetry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class MonitoredMetrics {
    public static final String ACTIVE_REQUESTS = "active_requests";
    public static final String COMPLETED_REQUESTS_1MIN = "completed_requests_1min";
    public static final String ERROR_RATE_1MIN = "error_rate_1min";
    public static final String AVG_RESPONSE_TIME_1MIN = "avg_response_time_1min";
    public static final String REQUESTS_PER_SECOND = "requests_per_second";
    public static final String CACHE_HIT_RATE = "cache_hit_rate";
    public static final String QUEUE_DEPTH = "queue_depth";
    public static final String SEMAPHORE_WAIT_TIME_AVG_MS = "semaphore_wait_time_avg_ms";
    public static final String CPU_PERCENT = "cpu_percent";
    public static final String MEMORY_MB = "memory_mb";

    private MonitoredMetrics() {
    }

    public static List<Observation> observe(SystemSnapshot snapshot) {
        if (snapshot == null) {
            return Collections.emptyList();
        }

        List<Observation> observations = new ArrayList<>(10);
        SystemState state = snapshot.getSystemState();
        observations.add(new Observation(AVG_RESPONSE_TIME_1MIN, state.getAvgResponseTime1min(), snapshot));
        observations.add(new Observation(ERROR_RATE_1MIN, state.getErrorRate1min(), snapshot));
        observations.add(new Observation(ACTIVE_REQUESTS, state.getActiveRequests(), snapshot));
        observations.add(new Observation(COMPLETED_REQUESTS_1MIN, state.getCompletedRequests1min(), snapshot));

        EfficiencyMetrics efficiency = snapshot.getEfficiency();
        if (efficiency != null) {
            observations.add(new Observation(REQUESTS_PER_SECOND, efficiency.getRequestsPerSecond(), snapshot));
            observations.add(new Observation(CACHE_HIT_RATE, efficiency.getCacheHitRate(), snapshot));
            observations.add(new Observation(QUEUE_DEPTH, efficiency.getQueueDepth(), snapshot));
            observations.add(new Observation(SEMAPHORE_WAIT_TIME_AVG_MS, efficiency.getSemaphoreWaitTimeAvgMs(), snapshot));
        }

        ResourceUsage resources = snapshot.getResourceUsage();
        resources.getCpuPercent().ifPresent(cpu -> observations.add(new Observation(CPU_PERCENT, cpu, snapshot)));
        resources.getMemoryMb().ifPresent(memory -> observations.add(new Observation(MEMORY_MB, memory, snapshot)));

        return Collections.unmodifiableList(observations);
    }
}
