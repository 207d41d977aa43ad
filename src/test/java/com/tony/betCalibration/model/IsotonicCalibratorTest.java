package com.tony.betCalibration.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IsotonicCalibratorTest {

    @Test
    @DisplayName("Modifier les tableaux fournis ou renvoyés ne change pas le calibrateur")
    void knotsShouldNotLeak() {
        double[] xs = {0.2, 0.5, 0.8};
        double[] ys = {0.1, 0.4, 0.9};
        IsotonicCalibrator calibrator = new IsotonicCalibrator(xs, ys);
        double before = calibrator.apply(0.35);

        xs[1] = 0.9;
        ys[1] = 1.0;
        calibrator.xs()[0] = 0.7;
        calibrator.ys()[2] = 0.0;

        assertThat(calibrator.xs()).containsExactly(0.2, 0.5, 0.8);
        assertThat(calibrator.ys()).containsExactly(0.1, 0.4, 0.9);
        assertThat(calibrator.apply(0.35)).isEqualTo(before);
        assertThat(calibrator).isEqualTo(new IsotonicCalibrator(new double[]{0.2, 0.5, 0.8}, new double[]{0.1, 0.4, 0.9}));
    }
}
