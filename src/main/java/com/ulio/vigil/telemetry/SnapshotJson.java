package com.ulio.vigil.telemetry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

public final class SnapshotJson {
    private SnapshotJson() {
    }

    public static void write(ObjectNode target, SystemSnapshot snapshot) {
        SystemState state = snapshot.getSystemState();
        ObjectNode systemState = target.putObject("system_state");
        systemState.put("active_requests", state.getActiveRequests());
        systemState.put("completed_requests_1min", state.getCompletedRequests1min());
        systemState.put("error_rate_1min", state.getErrorRate1min());
        systemState.put("avg_response_time_1min", state.getAvgResponseTime1min());

        EfficiencyMetrics efficiency = snapshot.getEfficiency();
        if (efficiency != null) {
            ObjectNode efficiencyNode = target.putObject("efficiency");
            efficiencyNode.put("requests_per_second", efficiency.getRequestsPerSecond());
            efficiencyNode.put("cache_hit_rate", efficiency.getCacheHitRate());
            efficiencyNode.put("queue_depth", efficiency.getQueueDepth());
            efficiencyNode.put("semaphore_wait_time_avg_ms", efficiency.getSemaphoreWaitTimeAvgMs());
        }

        ObjectNode resources = target.putObject("resource_usage");
        for (Map.Entry<String, Object> entry : snapshot.getResourceUsage().asMap().entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Double) {
                resources.put(entry.getKey(), (Double) value);
            } else if (value instanceof Long) {
                resources.put(entry.getKey(), (Long) value);
            } else {
                resources.put(entry.getKey(), String.valueOf(value));
            }
        }
    }

    public static SystemSnapshot read(JsonNode node, Instant fallbackTimestamp) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("snapshot must be a JSON object");
        }

        JsonNode stateNode = node.path("system_state");
        if (!stateNode.isObject()) {
            throw new IllegalArgumentException("snapshot is missing system_state");
        }

        SystemState state = new SystemState(
                stateNode.path("active_requests").asLong(0L),
                stateNode.path("completed_requests_1min").asLong(0L),
                stateNode.path("error_rate_1min").asDouble(0.0),
                stateNode.path("avg_response_time_1min").asDouble(0.0)
        );

        EfficiencyMetrics efficiency = null;
        JsonNode efficiencyNode = node.path("efficiency");
        if (efficiencyNode.isObject()) {
            efficiency = new EfficiencyMetrics(
                    efficiencyNode.path("requests_per_second").asDouble(0.0),
                    efficiencyNode.path("cache_hit_rate").asDouble(0.0),
                    efficiencyNode.path("queue_depth").asLong(0L),
                    efficiencyNode.path("semaphore_wait_time_avg_ms").asDouble(0.0)
            );
        }

        return new SystemSnapshot(readTimestamp(node, fallbackTimestamp), state, efficiency, readResources(node.path("resource_usage")));
    }

    private static ResourceUsage readResources(JsonNode node) {
        if (!node.isObject() || node.isEmpty()) {
            return ResourceUsage.unavailable("resource collector not available");
        }
        if (node.hasNonNull("error")) {
            return ResourceUsage.unavailable(node.get("error").asText());
        }
        return ResourceUsage.available(
                node.path("cpu_percent").asDouble(0.0),
                node.path("memory_mb").asDouble(0.0),
                node.path("open_files").asLong(0L),
                node.path("threads").asLong(0L)
        );
    }

    private static Instant readTimestamp(JsonNode node, Instant fallback) {
        JsonNode timestamp = node.path("timestamp");
        if (timestamp.isNumber()) {
            long micros = Math.round(timestamp.asDouble() * 1_000_000.0);
            return Instant.ofEpochSecond(Math.floorDiv(micros, 1_000_000L), Math.floorMod(micros, 1_000_000L) * 1000L);
        }
        if (timestamp.isTextual()) {
            try {
                return Instant.parse(timestamp.asText());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("invalid snapshot timestamp: " + timestamp.asText(), e);
            }
        }
        return fallback;
    }
}
