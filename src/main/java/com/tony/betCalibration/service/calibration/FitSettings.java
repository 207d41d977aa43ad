package com.tony.betCalibration.service.calibration;

/**
 * Paramètres d'un ajustement : taille minimale d'échantillon, critère d'arrêt et régularisation L2.
 */
public record FitSettings(int minSamples, double tolerance, int maxIterations, double regularization) {

    public static final int DEFAULT_MIN_SAMPLES = 3;
    public static final double DEFAULT_TOLERANCE = 1e-6;
    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final double DEFAULT_REGULARIZATION = 1e-8;

    public static FitSettings defaults() {
        return new FitSettings(DEFAULT_MIN_SAMPLES, DEFAULT_TOLERANCE, DEFAULT_MAX_ITERATIONS, DEFAULT_REGULARIZATION);
    }
}
