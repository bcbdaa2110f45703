package com.ulio.vigil.record;

import com.ulio.vigil.anomaly.Direction;
import com.ulio.vigil.classifier.MetricClass;
import com.ulio.vigil.classifier.Severity;
import com.ulio.vigil.telemetry.Observation;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

public final class AnomalyRecord {
    private final String anomalyId;
    private final Instant detectedAt;
    private final String metricName;
    private final MetricClass metricClass;
    private final double currentValue;
    private final double baselineValue;
    private final double deviation;
    private final double percentageChange;
    private final Direction direction;
    private final Severity severity;
    private final boolean lowConfidence;
    private final long baselineSamples;
    private final List<String> suggestedActions;
    private final Observation observation;
    private final AtomicReference<ResolutionStatus> resolutionStatus = new AtomicReference<>(ResolutionStatus.OPEN);

    private AnomalyRecord(Builder builder) {
        this.detectedAt = Objects.requireNonNull(builder.detectedAt, "detectedAt");
        this.metricName = Objects.requireNonNull(builder.metricName, "metricName");
        this.anomalyId = AnomalyIds.of(metricName, detectedAt);
        this.metricClass = builder.metricClass == null ? MetricClass.GENERIC : builder.metricClass;
        this.currentValue = builder.currentValue;
        this.baselineValue = builder.baselineValue;
        this.deviation = builder.deviation;
        this.percentageChange = builder.percentageChange;
        this.direction = builder.direction == null ? Direction.FLAT : builder.direction;
        this.severity = Objects.requireNonNull(builder.severity, "severity");
        this.lowConfidence = builder.lowConfidence;
        this.baselineSamples = builder.baselineSamples;
        this.suggestedActions = builder.suggestedActions == null
                ? Collections.emptyList()
                : List.copyOf(builder.suggestedActions);
        this.observation = Objects.requireNonNull(builder.observation, "observation");
    }

    static Builder builder() {
        return new Builder();
    }

    public String getAnomalyId() {
        return anomalyId;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public String getMetricName() {
        return metricName;
    }

    public MetricClass getMetricClass() {
        return metricClass;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public double getBaselineValue() {
        return baselineValue;
    }

    public double getDeviation() {
        return deviation;
    }

    public double getPercentageChange() {
        return percentageChange;
    }

    public Direction getDirection() {
        return direction;
    }

    public Severity getSeverity() {
        return severity;
    }

    public boolean isLowConfidence() {
        return lowConfidence;
    }

    public long getBaselineSamples() {
        return baselineSamples;
    }

    public List<String> getSuggestedActions() {
        return suggestedActions;
    }

    public Observation getObservation() {
        return observation;
    }

    public ResolutionStatus getResolutionStatus() {
        return resolutionStatus.get();
    }

    public boolean transitionTo(ResolutionStatus next) {
        while (true) {
            ResolutionStatus current = resolutionStatus.get();
            if (!current.canMoveTo(next)) {
                return false;
            }
            if (resolutionStatus.compareAndSet(current, next)) {
                return true;
            }
        }
    }

    @Override
    public String toString() {
        return "AnomalyRecord{anomalyId=" + anomalyId
                + ", severity=" + severity.value()
                + ", currentValue=" + currentValue
                + ", baselineValue=" + baselineValue
                + ", deviation=" + deviation
                + ", percentageChange=" + percentageChange
                + ", resolutionStatus=" + resolutionStatus.get().value() + "}";
    }

    static final class Builder {
        private Instant detectedAt;
        private String metricName;
        private MetricClass metricClass;
        private double currentValue;
        private double baselineValue;
        private double deviation;
        private double percentageChange;
        private Direction direction;
        private Severity severity;
        private boolean lowConfidence;
        private long baselineSamples;
        private List<String> suggestedActions;
        private Observation observation;

        Builder detectedAt(Instant value) {
            this.detectedAt = value;
            return this;
        }

        Builder metricName(String value) {
            this.metricName = value;
            return this;
        }

        Builder metricClass(MetricClass value) {
            this.metricClass = value;
            return this;
        }

        Builder currentValue(double value) {
            this.currentValue = value;
            return this;
        }

        Builder baselineValue(double value) {
            this.baselineValue = value;
            return this;
        }

        Builder deviation(double value) {
            this.deviation = value;
            return this;
        }

        Builder percentageChange(double value) {
            this.percentageChange = value;
            return this;
        }

        Builder direction(Direction value) {
            this.direction = value;
            return this;
        }

        Builder severity(Severity value) {
            this.severity = value;
            return this;
        }

        Builder lowConfidence(boolean value) {
            this.lowConfidence = value;
            return this;
        }

        Builder baselineSamples(long value) {
            this.baselineSamples = value;
            return this;
        }

        Builder suggestedActions(List<String> value) {
            this.suggestedActions = value;
            return this;
        }

        Builder observation(Observation value) {
            this.observation = value;
            return this;
        }

        AnomalyRecord build() {
            return new AnomalyRecord(this);
        }
    }
}
