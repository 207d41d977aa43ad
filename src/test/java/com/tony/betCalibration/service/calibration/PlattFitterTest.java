package com.tony.betCalibration.service.calibration;

import com.tony.betCalibration.exception.InsufficientDataException;
import com.tony.betCalibration.exception.ShapeMismatchException;
import com.tony.betCalibration.model.PlattCalibrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlattFitterTest {

    private PlattFitter fitter;

    @BeforeEach
    void setUp() {
        fitter = new PlattFitter();
    }

    @Test
    @DisplayName("Deux ajustements sur les mêmes données donnent exactement le même (a, b)")
    void fitShouldBeDeterministic() {
        double[][] data = noisyData(300, 11L);

        PlattCalibrator first = fitter.fit(data[0], data[1]);
        PlattCalibrator second = fitter.fit(data[0].clone(), data[1].clone());

        assertThat(second.a()).isEqualTo(first.a());
        assertThat(second.b()).isEqualTo(first.b());
    }

    @Test
    @DisplayName("Des labels corrélés à p donnent une pente positive")
    void fitShouldFindIncreasingMapping() {
        double[][] data = noisyData(500, 3L);

        PlattCalibrator model = fitter.fit(data[0], data[1]);

        assertThat(model.a()).isPositive();
        assertThat(model.apply(0.9)).isGreaterThan(model.apply(0.1));
    }

    @Test
    @DisplayName("Labels tous à 1 : pas d'exception, sortie finie et proche de 1")
    void fitShouldSurviveDegenerateLabels() {
        double[] p = {0.1, 0.2, 0.3, 0.4, 0.5, 0.6, 0.7, 0.8, 0.9, 0.95};
        double[] y = {1, 1, 1, 1, 1, 1, 1, 1, 1, 1};

        PlattCalibrator model = fitter.fit(p, y);

        assertThat(model.apply(0.5)).isFinite().isGreaterThan(0.9);
    }

    @Test
    void fitShouldRejectTooFewSamples() {
        assertThatThrownBy(() -> fitter.fit(new double[]{0.2, 0.8}, new double[]{0, 1}))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("3");
    }

    @Test
    void fitShouldRejectMismatchedLengths() {
        assertThatThrownBy(() -> fitter.fit(new double[]{0.2, 0.8, 0.5}, new double[]{0, 1}))
                .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    @DisplayName("Le minimum d'échantillons suit les paramètres d'ajustement")
    void fitShouldHonourCustomMinSamples() {
        FitSettings strict = new FitSettings(10, 1e-6, 100, 1e-8);
        double[][] data = noisyData(5, 1L);

        assertThatThrownBy(() -> fitter.fit(data[0], data[1], strict))
                .isInstanceOf(InsufficientDataException.class);
    }

    static double[][] noisyData(int n, long seed) {
        Random rnd = new Random(seed);
        double[] p = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            p[i] = rnd.nextDouble();
            y[i] = rnd.nextDouble() < p[i] ? 1.0 : 0.0;
        }
        return new double[][]{p, y};
    }
}
