package com.tony.betCalibration.service.backtest;

/**
 * Calculs de cotes décimales : espérance, Kelly, retrait de la marge du bookmaker.
 */
public final class OddsMath {

    private OddsMath() {
    }

    /**
     * Espérance par unité misée : p * (cote - 1) - (1 - p).
     */
    public static double expectedValue(double probability, double odds) {
        return probability * (odds - 1.0) - (1.0 - probability);
    }

    /**
     * Fraction de Kelly f* = (b * p - q) / b avec b = cote - 1. NaN si b <= 0.
     */
    public static double kellyFraction(double probability, double odds) {
        double b = odds - 1.0;
        if (b <= 0) return Double.NaN;
        return (b * probability - (1.0 - probability)) / b;
    }

    /**
     * Cote "juste" du côté over à partir des deux cotes du marché :
     * probabilités implicites normalisées à 1, puis inversées.
     */
    public static double removeVig(double overOdds, double underOdds) {
        if (!(overOdds > 0) || !(underOdds > 0)) {
            throw new IllegalArgumentException("Cotes invalides : " + overOdds + " / " + underOdds);
        }
        double pOver = 1.0 / overOdds;
        double pUnder = 1.0 / underOdds;
        double fairOver = pOver / (pOver + pUnder);
        return 1.0 / fairOver;
    }

    /**
     * Confiance ramenée à [0, 1] : une valeur > 1 est lue comme un pourcentage.
     */
    public static Double normalizeConfidence(Double confidence) {
        if (confidence == null || confidence.isNaN()) return null;
        return confidence > 1.0 ? confidence / 100.0 : confidence;
    }
}
