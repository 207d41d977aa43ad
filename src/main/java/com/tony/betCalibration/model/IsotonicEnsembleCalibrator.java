package com.tony.betCalibration.model;

import com.tony.betCalibration.service.calibration.SigmoidMath;

import java.util.List;

/**
 * Ensemble K-fold de modèles isotoniques : moyenne arithmétique des sorties individuelles.
 */
public record IsotonicEnsembleCalibrator(List<IsotonicCalibrator> models) implements CalibratorModel {

    public IsotonicEnsembleCalibrator {
        models = List.copyOf(models);
    }

    @Override
    public CalibratorKind kind() {
        return CalibratorKind.ISOTONIC_ENSEMBLE;
    }

    @Override
    public double apply(double rawProbability) {
        if (models.isEmpty()) return SigmoidMath.clampProbability(rawProbability);
        double sum = 0.0;
        for (IsotonicCalibrator model : models) {
            sum += model.apply(rawProbability);
        }
        return sum / models.size();
    }
}
