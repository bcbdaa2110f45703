package com.ulio.vigil.anomaly;

import com.ulio.vigil.baseline.BaselineSnapshot;

public class DeviationEvaluator {
    public static final double MAX_DEVIATION = 1_000_000.0;
    public static final double ZERO_VARIANCE_DEVIATION = MAX_DEVIATION;
    public static final double PERCENT_CHANGE_SATURATION = 1_000_000.0;

    public Deviation evaluate(BaselineSnapshot baseline, double value) {
        if (baseline == null || !Double.isFinite(value)) {
            return Deviation.none();
        }

        double mean = baseline.getMean();
        double stdDev = baseline.getStdDev();
        Direction direction = Direction.of(value, mean);

        boolean zeroVariance = false;
        double deviation;
        if (stdDev > 0.0) {
            deviation = Math.min(MAX_DEVIATION, Math.abs(value - mean) / stdDev);
        } else if (value == mean) {
            deviation = 0.0;
        } else {
            deviation = ZERO_VARIANCE_DEVIATION;
            zeroVariance = true;
        }

        return new Deviation(deviation, percentageChange(value, mean), direction, zeroVariance);
    }

    static double percentageChange(double value, double mean) {
        if (mean == 0.0) {
            if (value == 0.0) {
                return 0.0;
            }
            return Math.copySign(PERCENT_CHANGE_SATURATION, value);
        }

        double change = (value - mean) / mean * 100.0;
        if (Double.isNaN(change)) {
            return 0.0;
        }
        if (Double.isInfinite(change)) {
            return Math.copySign(PERCENT_CHANGE_SATURATION, change);
        }
        return Math.max(-PERCENT_CHANGE_SATURATION, Math.min(PERCENT_CHANGE_SATURATION, change));
    }
}
