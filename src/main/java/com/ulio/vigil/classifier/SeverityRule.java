package com.ulio.vigil.classifier;

import com.ulio.vigil.anomaly.Direction;

public final class SeverityRule {
    private final Direction adverseDirection;
    private final double criticalDeviation;
    private final double criticalPercentChange;

    // null adverse direction or a non-positive percent limit disables the percent check
    public SeverityRule(Direction adverseDirection, double criticalDeviation, double criticalPercentChange) {
        this.adverseDirection = adverseDirection == Direction.FLAT ? null : adverseDirection;
        this.criticalDeviation = Double.isFinite(criticalDeviation) && criticalDeviation > 0.0
                ? criticalDeviation
                : Double.MAX_VALUE;
        this.criticalPercentChange = Double.isFinite(criticalPercentChange) && criticalPercentChange > 0.0
                ? criticalPercentChange
                : 0.0;
    }

    public Direction getAdverseDirection() {
        return adverseDirection;
    }

    public double getCriticalDeviation() {
        return criticalDeviation;
    }

    public double getCriticalPercentChange() {
        return criticalPercentChange;
    }

    public SeverityRule withCriticalDeviation(double value) {
        return new SeverityRule(adverseDirection, value, criticalPercentChange);
    }

    public SeverityRule withCriticalPercentChange(double value) {
        return new SeverityRule(adverseDirection, criticalDeviation, value);
    }

    boolean escalates(double deviation, double percentageChange) {
        if (deviation >= criticalDeviation) {
            return true;
        }
        if (adverseDirection == null || criticalPercentChange <= 0.0) {
            return false;
        }
        Direction moved = Direction.of(percentageChange, 0.0);
        return moved == adverseDirection && Math.abs(percentageChange) >= criticalPercentChange;
    }

    @Override
    public String toString() {
        return "SeverityRule{adverseDirection=" + adverseDirection
                + ", criticalDeviation=" + criticalDeviation
                + ", criticalPercentChange=" + criticalPercentChange + "}";
    }
}
