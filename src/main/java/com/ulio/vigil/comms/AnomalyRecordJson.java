package com.ulio.vigil.comms;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ulio.vigil.record.AnomalyRecord;
import com.ulio.vigil.telemetry.SnapshotJson;

import java.util.Locale;

public final class AnomalyRecordJson {
    private AnomalyRecordJson() {
    }

    public static ObjectNode toJson(ObjectMapper objectMapper, AnomalyRecord record) {
        ObjectNode root = objectMapper.createObjectNode();

        ObjectNode anomaly = root.putObject("anomaly");
        anomaly.put("metric_name", record.getMetricName());
        anomaly.put("current_value", record.getCurrentValue());
        anomaly.put("baseline_value", record.getBaselineValue());
        anomaly.put("deviation", record.getDeviation());
        anomaly.put("severity", record.getSeverity().value());
        anomaly.put("percentage_change", record.getPercentageChange());

        SnapshotJson.write(root, record.getObservation().getSnapshot());

        ObjectNode metadata = root.putObject("metadata");
        metadata.put("anomaly_id", record.getAnomalyId());
        metadata.put("timestamp", record.getDetectedAt().toString());
        metadata.put("metric_class", record.getMetricClass().name().toLowerCase(Locale.ROOT));
        metadata.put("direction", record.getDirection().name().toLowerCase(Locale.ROOT));
        metadata.put("baseline_samples", record.getBaselineSamples());
        metadata.put("low_confidence", record.isLowConfidence());

        ArrayNode actions = root.putArray("suggested_actions");
        for (String action : record.getSuggestedActions()) {
            actions.add(action);
        }

        root.put("resolution_status", record.getResolutionStatus().value());
        return root;
    }
}
