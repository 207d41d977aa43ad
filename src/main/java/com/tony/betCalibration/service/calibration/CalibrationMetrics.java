package com.tony.betCalibration.service.calibration;

import com.tony.betCalibration.exception.ShapeMismatchException;
import com.tony.betCalibration.model.ReliabilityBin;

import java.util.ArrayList;
import java.util.List;

/**
 * Mesures de qualité de calibration sur des vecteurs appariés (résultat observé, probabilité prédite).
 */
public final class CalibrationMetrics {

    public static final int DEFAULT_BINS = 10;

    private CalibrationMetrics() {
    }

    /**
     * Brier Score : erreur quadratique moyenne entre probabilité et issue binaire (0 = parfait).
     */
    public static double brierScore(double[] outcomes, double[] probabilities) {
        ShapeMismatchException.check(outcomes, probabilities);
        if (outcomes.length == 0) return Double.NaN;
        double sum = 0.0;
        for (int i = 0; i < outcomes.length; i++) {
            double diff = probabilities[i] - outcomes[i];
            sum += diff * diff;
        }
        return sum / outcomes.length;
    }

    public static double expectedCalibrationError(double[] outcomes, double[] probabilities) {
        return expectedCalibrationError(outcomes, probabilities, DEFAULT_BINS);
    }

    /**
     * ECE : somme pondérée (part de l'échantillon) des écarts |moyenne prédite - fréquence observée| par tranche.
     * Les tranches vides ne contribuent pas.
     */
    public static double expectedCalibrationError(double[] outcomes, double[] probabilities, int nBins) {
        ShapeMismatchException.check(outcomes, probabilities);
        if (nBins < 1) throw new IllegalArgumentException("nBins doit être >= 1");
        if (outcomes.length == 0) return 0.0;

        BinAccumulator acc = accumulate(outcomes, probabilities, nBins);
        double ece = 0.0;
        for (int b = 0; b < nBins; b++) {
            if (acc.counts[b] == 0) continue;
            double avgPred = acc.sumPred[b] / acc.counts[b];
            double avgObs = acc.sumObs[b] / acc.counts[b];
            ece += Math.abs(avgPred - avgObs) * ((double) acc.counts[b] / outcomes.length);
        }
        return ece;
    }

    /**
     * Données du diagramme de fiabilité : une entrée par tranche, y compris les tranches vides (à zéro).
     */
    public static List<ReliabilityBin> reliabilityDiagram(double[] outcomes, double[] probabilities, int nBins) {
        ShapeMismatchException.check(outcomes, probabilities);
        if (nBins < 1) throw new IllegalArgumentException("nBins doit être >= 1");

        BinAccumulator acc = accumulate(outcomes, probabilities, nBins);
        List<ReliabilityBin> bins = new ArrayList<>(nBins);
        double width = 1.0 / nBins;
        for (int b = 0; b < nBins; b++) {
            int count = acc.counts[b];
            bins.add(new ReliabilityBin(
                    b * width,
                    (b + 1) * width,
                    (b + 0.5) * width,
                    count == 0 ? 0.0 : acc.sumPred[b] / count,
                    count == 0 ? 0.0 : acc.sumObs[b] / count,
                    count));
        }
        return bins;
    }

    /**
     * Tranches de largeur égale sur [0, 1] ; p = 1.0 tombe dans la dernière.
     */
    static int binIndex(double probability, int nBins) {
        int idx = (int) Math.floor(probability * nBins);
        return Math.max(0, Math.min(nBins - 1, idx));
    }

    private static BinAccumulator accumulate(double[] outcomes, double[] probabilities, int nBins) {
        BinAccumulator acc = new BinAccumulator(nBins);
        for (int i = 0; i < outcomes.length; i++) {
            int b = binIndex(probabilities[i], nBins);
            acc.counts[b]++;
            acc.sumPred[b] += probabilities[i];
            acc.sumObs[b] += outcomes[i];
        }
        return acc;
    }

    private static final class BinAccumulator {
        final int[] counts;
        final double[] sumPred;
        final double[] sumObs;

        BinAccumulator(int nBins) {
            counts = new int[nBins];
            sumPred = new double[nBins];
            sumObs = new double[nBins];
        }
    }
}
