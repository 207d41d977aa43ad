package com.tony.betCalibration.service.calibration;

import com.tony.betCalibration.model.CalibratorModel;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Jeu synthétique : probabilité vraie q uniforme, le modèle brut annonce q² (sous-estimation systématique).
 */
class CalibrationQualityTest {

    private static final double TOLERANCE = 1e-9;

    private static double[] raw;
    private static double[] outcomes;

    @BeforeAll
    static void generate() {
        Random rnd = new Random(7);
        int n = 5000;
        raw = new double[n];
        outcomes = new double[n];
        for (int i = 0; i < n; i++) {
            double q = rnd.nextDouble();
            raw[i] = q * q;
            outcomes[i] = rnd.nextDouble() < q ? 1.0 : 0.0;
        }
    }

    @Test
    @DisplayName("Platt améliore Brier et ECE sur des probabilités mal calibrées")
    void plattShouldImproveMetrics() {
        assertImproves(new PlattFitter().fit(raw, outcomes));
    }

    @Test
    @DisplayName("L'isotonique améliore Brier et ECE sur des probabilités mal calibrées")
    void isotonicShouldImproveMetrics() {
        assertImproves(new IsotonicFitter().fit(raw, outcomes));
    }

    @Test
    void kfoldVariantsShouldImproveMetrics() {
        KFoldCalibrator kfold = new KFoldCalibrator(new PlattFitter(), new IsotonicFitter(), Runnable::run);

        assertImproves(kfold.fitPlatt(raw, outcomes, 5, 0L, FitSettings.defaults()));
        assertImproves(kfold.fitIsotonic(raw, outcomes, 5, 0L));
    }

    private void assertImproves(CalibratorModel model) {
        double[] calibrated = model.applyAll(raw);

        double brierBefore = CalibrationMetrics.brierScore(outcomes, raw);
        double brierAfter = CalibrationMetrics.brierScore(outcomes, calibrated);
        double eceBefore = CalibrationMetrics.expectedCalibrationError(outcomes, raw);
        double eceAfter = CalibrationMetrics.expectedCalibrationError(outcomes, calibrated);

        assertThat(brierAfter).isLessThanOrEqualTo(brierBefore + TOLERANCE);
        assertThat(eceAfter).isLessThanOrEqualTo(eceBefore + TOLERANCE);
    }
}
