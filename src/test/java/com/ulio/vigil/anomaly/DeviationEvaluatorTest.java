package com.ulio.vigil.anomaly;

import com.ulio.vigil.baseline.BaselineSnapshot;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DeviationEvaluatorTest {

    private final DeviationEvaluator evaluator = new DeviationEvaluator();

    private static BaselineSnapshot baseline(double mean, double stdDev) {
        return new BaselineSnapshot("avg_response_time_1min", 50, mean, stdDev, null);
    }

    @Test
    void evaluate_standardizesDistanceFromMean() {
        Deviation deviation = evaluator.evaluate(baseline(100.0, 10.0), 150.0);

        assertThat(deviation.getDeviation()).isEqualTo(5.0);
        assertThat(deviation.getPercentageChange()).isEqualTo(50.0);
        assertThat(deviation.getDirection()).isEqualTo(Direction.UP);
        assertThat(deviation.isZeroVariance()).isFalse();
    }

    @Test
    void evaluate_dropIsNonNegativeDeviationWithNegativeChange() {
        Deviation deviation = evaluator.evaluate(baseline(2.0, 0.01), 0.0166);

        assertThat(deviation.getDeviation()).isGreaterThan(30.0);
        assertThat(deviation.getDeviation()).isCloseTo(198.34, within(1e-9));
        assertThat(deviation.getPercentageChange()).isCloseTo(-99.17, within(1e-9));
        assertThat(deviation.getDirection()).isEqualTo(Direction.DOWN);
    }

    @Test
    void evaluate_zeroVarianceWithDifferentValueUsesFiniteSentinel() {
        Deviation deviation = evaluator.evaluate(baseline(4.0, 0.0), 5.0);

        assertThat(deviation.getDeviation()).isEqualTo(DeviationEvaluator.ZERO_VARIANCE_DEVIATION);
        assertThat(Double.isFinite(deviation.getDeviation())).isTrue();
        assertThat(deviation.isZeroVariance()).isTrue();
        assertThat(deviation.getPercentageChange()).isEqualTo(25.0);
    }

    @Test
    void evaluate_zeroVarianceWithSameValueIsNoDeviation() {
        Deviation deviation = evaluator.evaluate(baseline(4.0, 0.0), 4.0);

        assertThat(deviation.getDeviation()).isZero();
        assertThat(deviation.isZeroVariance()).isFalse();
        assertThat(deviation.getDirection()).isEqualTo(Direction.FLAT);
    }

    @Test
    void evaluate_allZeroBaselineAndValueIsNoChange() {
        Deviation deviation = evaluator.evaluate(baseline(0.0, 0.0), 0.0);

        assertThat(deviation.getDeviation()).isZero();
        assertThat(deviation.getPercentageChange()).isZero();
    }

    @Test
    void evaluate_zeroMeanSaturatesPercentageChangeWithSignOfValue() {
        assertThat(evaluator.evaluate(baseline(0.0, 1.0), 3.0).getPercentageChange())
                .isEqualTo(DeviationEvaluator.PERCENT_CHANGE_SATURATION);
        assertThat(evaluator.evaluate(baseline(0.0, 1.0), -3.0).getPercentageChange())
                .isEqualTo(-DeviationEvaluator.PERCENT_CHANGE_SATURATION);
    }

    @Test
    void evaluate_nonFiniteValueDegradesToNoDeviation() {
        Deviation deviation = evaluator.evaluate(baseline(10.0, 1.0), Double.NaN);

        assertThat(deviation.getDeviation()).isZero();
        assertThat(deviation.getPercentageChange()).isZero();
    }

    @Test
    void evaluate_extremeDistanceIsCappedNotInfinite() {
        Deviation deviation = evaluator.evaluate(baseline(-Double.MAX_VALUE, Double.MIN_VALUE), Double.MAX_VALUE);

        assertThat(deviation.getDeviation()).isEqualTo(DeviationEvaluator.MAX_DEVIATION);
        assertThat(Double.isFinite(deviation.getPercentageChange())).isTrue();
    }

    @Test
    void evaluate_deviationGrowsWithDistanceFromMean() {
        BaselineSnapshot baseline = baseline(100.0, 10.0);
        double previous = -1.0;
        for (double distance = 0.0; distance <= 500.0; distance += 12.5) {
            double up = evaluator.evaluate(baseline, 100.0 + distance).getDeviation();
            double down = evaluator.evaluate(baseline, 100.0 - distance).getDeviation();

            assertThat(up).isGreaterThanOrEqualTo(previous).isEqualTo(down);
            previous = up;
        }
    }

    @Test
    void evaluate_doesNotMutateBaseline() {
        BaselineSnapshot baseline = baseline(100.0, 10.0);
        BaselineSnapshot copy = baseline(100.0, 10.0);

        evaluator.evaluate(baseline, 1_000.0);

        assertThat(baseline).isEqualTo(copy);
    }
}
