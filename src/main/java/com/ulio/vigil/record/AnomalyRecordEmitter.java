package com.ulio.vigil.record;

import com.ulio.vigil.anomaly.Deviation;
import com.ulio.vigil.baseline.BaselineSnapshot;
import com.ulio.vigil.classifier.MetricClass;
import com.ulio.vigil.classifier.Severity;
import com.ulio.vigil.telemetry.Observation;

import java.util.List;

public class AnomalyRecordEmitter {

    // detection time is the snapshot's timestamp, not the wall clock
    public AnomalyRecord emit(
            Observation observation,
            BaselineSnapshot baselineAfter,
            Deviation deviation,
            Severity severity,
            MetricClass metricClass,
            List<String> actions,
            boolean lowConfidence
    ) {
        if (severity == null || !severity.isAnomalous()) {
            throw new IllegalArgumentException("Cannot emit an anomaly record with severity " + severity);
        }

        return AnomalyRecord.builder()
                .detectedAt(observation.getSnapshot().getTimestamp())
                .metricName(baselineAfter.getName())
                .metricClass(metricClass)
                .currentValue(observation.getCurrentValue())
                .baselineValue(baselineAfter.getMean())
                .deviation(deviation.getDeviation())
                .percentageChange(deviation.getPercentageChange())
                .direction(deviation.getDirection())
                .severity(severity)
                .lowConfidence(lowConfidence)
                .baselineSamples(baselineAfter.getSampleCount())
                .suggestedActions(actions)
                .observation(observation)
                .build();
    }
}
