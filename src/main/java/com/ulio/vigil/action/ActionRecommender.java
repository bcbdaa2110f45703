package com.ulio.vigil.action;

import com.ulio.vigil.anomaly.Direction;
import com.ulio.vigil.classifier.Severity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ActionRecommender {
    public static final String CHECK_SLOW_UPSTREAMS = "Check for slow upstream services or database queries";
    public static final String REVIEW_RECENT_CHANGES = "Review recent code changes that might affect performance";
    public static final String SCALE_CONCURRENCY = "Consider increasing concurrency limits or scaling resources";
    public static final String CHECK_ERROR_LOGS = "Check error logs for patterns";
    public static final String REVIEW_COMPONENT_HEALTH = "Review component health status";
    public static final String CHECK_CONFIG_CHANGES = "Check for recent configuration changes";
    public static final String MONITOR_LOAD = "Monitor system load and resource usage";
    public static final String CHECK_STUCK_REQUESTS = "Check if requests are completing or getting stuck";
    public static final String REVIEW_CACHE_CONFIG = "Review cache configuration and TTL settings";
    public static final String GROW_CACHE = "Consider increasing cache size if memory allows";
    public static final String RAISE_CONCURRENCY_LIMITS = "Consider increasing concurrency limits";
    public static final String REVIEW_SEMAPHORE_LIMITS = "Review if semaphore limits are too restrictive";
    public static final String CHECK_CPU_OPERATIONS = "Check for CPU-intensive operations";
    public static final String OPTIMIZE_HOT_PATHS = "Consider optimizing hot code paths";
    public static final String REVIEW_CPU_CAPACITY = "Review if system needs more CPU resources";
    public static final String CHECK_MEMORY_LEAKS = "Check for memory leaks";
    public static final String REVIEW_MEMORY_PATTERNS = "Review memory usage patterns";
    public static final String CONSIDER_RESTART = "Consider restarting service if memory continues to grow";
    public static final String INVESTIGATE_IMMEDIATELY = "Investigate immediately - critical system issue detected";

    public List<String> recommend(String metricName, Direction direction, Severity severity, ActionConditions conditions) {
        if (severity == null || !severity.isAnomalous()) {
            return Collections.emptyList();
        }

        ActionConditions facts = conditions == null ? ActionConditions.none() : conditions;
        List<String> actions = new ArrayList<>(4);

        switch (metricName == null ? "" : metricName) {
            case "avg_response_time_1min":
                if (direction == Direction.UP && facts.isValueAboveDoubleBaseline()) {
                    actions.add(CHECK_SLOW_UPSTREAMS);
                    actions.add(REVIEW_RECENT_CHANGES);
                    if (facts.isQueueBacklog()) {
                        actions.add(SCALE_CONCURRENCY);
                    }
                }
                break;
            case "error_rate_1min":
                if (facts.isHighErrorRate()) {
                    actions.add(CHECK_ERROR_LOGS);
                    actions.add(REVIEW_COMPONENT_HEALTH);
                    actions.add(CHECK_CONFIG_CHANGES);
                }
                break;
            case "active_requests":
                if (facts.isHighActiveRequests()) {
                    actions.add(MONITOR_LOAD);
                    actions.add(CHECK_STUCK_REQUESTS);
                }
                break;
            case "cache_hit_rate":
                if (facts.isLowCacheHitRate()) {
                    actions.add(REVIEW_CACHE_CONFIG);
                    actions.add(GROW_CACHE);
                }
                break;
            case "semaphore_wait_time_avg_ms":
                if (facts.isSemaphoreContention()) {
                    actions.add(RAISE_CONCURRENCY_LIMITS);
                    actions.add(REVIEW_SEMAPHORE_LIMITS);
                }
                break;
            case "cpu_percent":
                if (facts.isHighCpu()) {
                    actions.add(CHECK_CPU_OPERATIONS);
                    actions.add(OPTIMIZE_HOT_PATHS);
                    actions.add(REVIEW_CPU_CAPACITY);
                }
                break;
            case "memory_mb":
                if (facts.isMemoryGrowth()) {
                    actions.add(CHECK_MEMORY_LEAKS);
                    actions.add(REVIEW_MEMORY_PATTERNS);
                    actions.add(CONSIDER_RESTART);
                }
                break;
            default:
                // requests_per_second and unknown metrics carry no metric-specific advice
                break;
        }

        if (severity == Severity.CRITICAL) {
            actions.add(INVESTIGATE_IMMEDIATELY);
        }

        return Collections.unmodifiableList(actions);
    }
}
