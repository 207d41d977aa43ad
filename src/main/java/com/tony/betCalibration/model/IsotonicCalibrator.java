package com.tony.betCalibration.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.tony.betCalibration.service.calibration.SigmoidMath;

import java.util.Arrays;

/**
 * Fonction en escalier monotone issue du PAV : un noeud (x, y) par bloc.
 * Interpolation linéaire entre les noeuds, valeurs bornées aux extrémités puis à [0, 1].
 */
public record IsotonicCalibrator(double[] xs, double[] ys) implements CalibratorModel {

    public IsotonicCalibrator {
        if (xs.length != ys.length) {
            throw new IllegalArgumentException("xs et ys doivent avoir la même taille");
        }
        // Copies : une instance peut être partagée par le cache du registre
        xs = xs.clone();
        ys = ys.clone();
    }

    @Override
    public double[] xs() {
        return xs.clone();
    }

    @Override
    public double[] ys() {
        return ys.clone();
    }

    public static IsotonicCalibrator empty() {
        return new IsotonicCalibrator(new double[0], new double[0]);
    }

    @Override
    public CalibratorKind kind() {
        return CalibratorKind.ISOTONIC;
    }

    public int size() {
        return xs.length;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return xs.length == 0;
    }

    @Override
    public double apply(double rawProbability) {
        if (Double.isNaN(rawProbability)) return Double.NaN;
        // Calibrateur vide : identité bornée
        if (isEmpty()) return SigmoidMath.clampProbability(rawProbability);

        int last = xs.length - 1;
        double value;
        if (rawProbability <= xs[0]) {
            value = ys[0];
        } else if (rawProbability >= xs[last]) {
            value = ys[last];
        } else {
            // premier noeud strictement au-dessus de p, donc xs[hi - 1] <= p < xs[hi]
            int hi = upperBound(rawProbability);
            int lo = hi - 1;
            double t = (rawProbability - xs[lo]) / (xs[hi] - xs[lo]);
            value = ys[lo] + t * (ys[hi] - ys[lo]);
        }
        return SigmoidMath.clampProbability(value);
    }

    private int upperBound(double p) {
        int lo = 0;
        int hi = xs.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (xs[mid] <= p) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IsotonicCalibrator other)) return false;
        return Arrays.equals(xs, other.xs) && Arrays.equals(ys, other.ys);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(xs) + Arrays.hashCode(ys);
    }

    @Override
    public String toString() {
        return "IsotonicCalibrator[knots=" + xs.length + "]";
    }
}
