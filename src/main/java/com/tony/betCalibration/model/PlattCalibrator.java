package com.tony.betCalibration.model;

import com.tony.betCalibration.service.calibration.SigmoidMath;

/**
 * Platt Scaling : calibrée = sigmoid(a * p + b).
 */
public record PlattCalibrator(double a, double b) implements CalibratorModel {

    @Override
    public CalibratorKind kind() {
        return CalibratorKind.PLATT;
    }

    @Override
    public double apply(double rawProbability) {
        return SigmoidMath.sigmoid(a * rawProbability + b);
    }
}
