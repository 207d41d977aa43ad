package com.tony.betCalibration.service.calibration;

import com.tony.betCalibration.exception.InsufficientDataException;
import com.tony.betCalibration.exception.ShapeMismatchException;
import com.tony.betCalibration.model.PlattCalibrator;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.springframework.stereotype.Component;

import java.util.Arrays;

@Component
@Slf4j
public class PlattFitter {

    public PlattCalibrator fit(double[] p, double[] y) {
        return fit(p, y, FitSettings.defaults());
    }

    /**
     * Ajuste sigmoid(a * p + b) par Newton-Raphson sur la log-vraisemblance régularisée (L2).
     * Matrice de design [p, 1], départ a = 1 et b = logit(moyenne des labels).
     */
    public PlattCalibrator fit(double[] p, double[] y, FitSettings settings) {
        ShapeMismatchException.check(p, y);
        if (p.length < settings.minSamples()) {
            throw new InsufficientDataException(p.length, settings.minSamples());
        }

        double lambda = settings.regularization();
        double meanLabel = Arrays.stream(y).average().orElse(0.5);
        double a = 1.0;
        double b = SigmoidMath.logit(meanLabel);

        int iteration = 0;
        while (iteration < settings.maxIterations()) {
            iteration++;

            // Gradient = X'(y - s) - λw ; Hessienne = -(X'SX) - λI avec S = diag(s(1-s))
            double g0 = 0, g1 = 0;
            double h00 = 0, h01 = 0, h11 = 0;
            for (int i = 0; i < p.length; i++) {
                double s = SigmoidMath.sigmoid(a * p[i] + b);
                double residual = y[i] - s;
                double weight = s * (1.0 - s);
                g0 += p[i] * residual;
                g1 += residual;
                h00 += p[i] * p[i] * weight;
                h01 += p[i] * weight;
                h11 += weight;
            }
            RealVector gradient = new ArrayRealVector(new double[]{g0 - lambda * a, g1 - lambda * b}, false);
            RealMatrix hessian = new Array2DRowRealMatrix(new double[][]{
                    {-h00 - lambda, -h01},
                    {-h01, -h11 - lambda}
            }, false);

            RealVector delta = solveNewtonStep(hessian, gradient);
            a -= delta.getEntry(0);
            b -= delta.getEntry(1);

            if (delta.getLInfNorm() < settings.tolerance()) break;
        }

        log.debug("Platt ajusté en {} itérations : a={}, b={} (n={})", iteration, a, b, p.length);
        return new PlattCalibrator(a, b);
    }

    private RealVector solveNewtonStep(RealMatrix hessian, RealVector gradient) {
        DecompositionSolver solver = new LUDecomposition(hessian).getSolver();
        if (solver.isNonSingular()) {
            return solver.solve(gradient);
        }
        // Hessienne singulière : pseudo-inverse (SVD), jamais remontée comme erreur
        log.debug("Hessienne singulière, passage à la pseudo-inverse");
        return new SingularValueDecomposition(hessian).getSolver().solve(gradient);
    }
}
