package com.tony.betCalibration.service.calibration;

/**
 * Fonctions logistiques partagées par l'ajustement et l'application des calibrateurs.
 */
public final class SigmoidMath {

    private static final double LOGIT_EPSILON = 1e-12;

    private SigmoidMath() {
    }

    /**
     * Sigmoïde stable : on branche sur le signe de x pour ne jamais calculer exp() d'un grand positif.
     */
    public static double sigmoid(double x) {
        if (x >= 0) {
            return 1.0 / (1.0 + Math.exp(-x));
        }
        double ex = Math.exp(x);
        return ex / (1.0 + ex);
    }

    /**
     * Logit d'une probabilité bornée à [1e-12, 1 - 1e-12] pour éviter les infinis.
     */
    public static double logit(double p) {
        double clamped = clamp(p, LOGIT_EPSILON, 1.0 - LOGIT_EPSILON);
        return Math.log(clamped / (1.0 - clamped));
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double clampProbability(double value) {
        return clamp(value, 0.0, 1.0);
    }
}
