package com.ulio.vigil.classifier;

import com.ulio.vigil.anomaly.Direction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public enum MetricClass {
    LATENCY(Direction.UP, 3.0, 100.0),
    CONCURRENCY(Direction.UP, 3.0, 100.0),
    THROUGHPUT(Direction.DOWN, 6.0, 90.0),
    ERROR_RATE(Direction.UP, 3.0, 100.0),
    CACHE(Direction.DOWN, 4.0, 50.0),
    RESOURCE(Direction.UP, 4.0, 50.0),
    GENERIC(null, 4.5, 0.0);

    private static final Map<String, MetricClass> DEFAULT_ASSIGNMENTS;

    static {
        Map<String, MetricClass> assignments = new LinkedHashMap<>();
        assignments.put("avg_response_time_1min", LATENCY);
        assignments.put("semaphore_wait_time_avg_ms", LATENCY);
        assignments.put("active_requests", CONCURRENCY);
        assignments.put("queue_depth", CONCURRENCY);
        assignments.put("requests_per_second", THROUGHPUT);
        assignments.put("completed_requests_1min", THROUGHPUT);
        assignments.put("error_rate_1min", ERROR_RATE);
        assignments.put("cache_hit_rate", CACHE);
        assignments.put("cpu_percent", RESOURCE);
        assignments.put("memory_mb", RESOURCE);
        DEFAULT_ASSIGNMENTS = Collections.unmodifiableMap(assignments);
    }

    private final Direction adverseDirection;
    private final double defaultCriticalDeviation;
    private final double defaultCriticalPercentChange;

    MetricClass(Direction adverseDirection, double defaultCriticalDeviation, double defaultCriticalPercentChange) {
        this.adverseDirection = adverseDirection;
        this.defaultCriticalDeviation = defaultCriticalDeviation;
        this.defaultCriticalPercentChange = defaultCriticalPercentChange;
    }

    public Direction getAdverseDirection() {
        return adverseDirection;
    }

    public SeverityRule defaultRule() {
        return new SeverityRule(adverseDirection, defaultCriticalDeviation, defaultCriticalPercentChange);
    }

    public static Map<String, MetricClass> defaultAssignments() {
        return DEFAULT_ASSIGNMENTS;
    }
}
