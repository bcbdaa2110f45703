package com.ulio.vigil.anomaly;

public class Deviation {
    private final double deviation;
    private final double percentageChange;
    private final Direction direction;
    private final boolean zeroVariance;

    public Deviation(double deviation, double percentageChange, Direction direction, boolean zeroVariance) {
        this.deviation = sanitizeNonNegative(deviation);
        this.percentageChange = Double.isFinite(percentageChange) ? percentageChange : 0.0;
        this.direction = direction == null ? Direction.FLAT : direction;
        this.zeroVariance = zeroVariance;
    }

    public static Deviation none() {
        return new Deviation(0.0, 0.0, Direction.FLAT, false);
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

    public boolean isZeroVariance() {
        return zeroVariance;
    }

    @Override
    public String toString() {
        return "Deviation{deviation=" + deviation
                + ", percentageChange=" + percentageChange
                + ", direction=" + direction
                + ", zeroVariance=" + zeroVariance + "}";
    }

    private static double sanitizeNonNegative(double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            return 0.0;
        }
        return value;
    }
}
