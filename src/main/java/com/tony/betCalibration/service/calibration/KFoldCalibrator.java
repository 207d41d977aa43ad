package com.tony.betCalibration.service.calibration;

import com.tony.betCalibration.exception.CalibrationFailedException;
import com.tony.betCalibration.exception.ShapeMismatchException;
import com.tony.betCalibration.model.IsotonicCalibrator;
import com.tony.betCalibration.model.IsotonicEnsembleCalibrator;
import com.tony.betCalibration.model.PlattCalibrator;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.util.MathArrays;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.BiFunction;
import java.util.stream.IntStream;

/**
 * Variantes K-fold : K ajustements indépendants (un par pli écarté), exécutés en parallèle puis agrégés.
 * Les plis écartés ne sont pas évalués ici, ils servent seulement à varier les données d'entraînement.
 */
@Component
@Slf4j
public class KFoldCalibrator {

    public static final int DEFAULT_FOLDS = 5;

    private final PlattFitter plattFitter;
    private final IsotonicFitter isotonicFitter;
    private final Executor executor;

    public KFoldCalibrator(PlattFitter plattFitter,
                           IsotonicFitter isotonicFitter,
                           @Qualifier("calibrationExecutor") Executor executor) {
        this.plattFitter = plattFitter;
        this.isotonicFitter = isotonicFitter;
        this.executor = executor;
    }

    /**
     * Platt K-fold : moyenne arithmétique des couples (a, b) des plis réussis.
     */
    public PlattCalibrator fitPlatt(double[] p, double[] y, int k, long seed, FitSettings settings) {
        List<PlattCalibrator> models = fitFolds(p, y, k, seed, "Platt",
                (px, yx) -> plattFitter.fit(px, yx, settings));

        double a = models.stream().mapToDouble(PlattCalibrator::a).average().orElseThrow();
        double b = models.stream().mapToDouble(PlattCalibrator::b).average().orElseThrow();
        return new PlattCalibrator(a, b);
    }

    /**
     * Isotonique K-fold : on garde les K jeux de noeuds, la sortie est la moyenne des sorties.
     */
    public IsotonicEnsembleCalibrator fitIsotonic(double[] p, double[] y, int k, long seed) {
        List<IsotonicCalibrator> models = fitFolds(p, y, k, seed, "Isotonique", isotonicFitter::fit);
        return new IsotonicEnsembleCalibrator(models);
    }

    private <M> List<M> fitFolds(double[] p, double[] y, int k, long seed, String method,
                                 BiFunction<double[], double[], M> fitter) {
        ShapeMismatchException.check(p, y);
        if (k < 2) {
            throw new IllegalArgumentException("k doit être >= 2 (reçu : " + k + ")");
        }
        if (p.length < k) {
            log.debug("{} K-fold : {} points pour {} plis, ajustement unique", method, p.length, k);
            return List.of(fitter.apply(p, y));
        }

        List<int[]> folds = splitFolds(p.length, k, seed);
        List<CompletableFuture<M>> futures = new ArrayList<>(k);
        for (int i = 0; i < k; i++) {
            int[] trainIdx = trainingIndices(folds, i);
            double[] pTrain = select(p, trainIdx);
            double[] yTrain = select(y, trainIdx);
            futures.add(CompletableFuture.supplyAsync(() -> fitter.apply(pTrain, yTrain), executor));
        }

        List<M> models = new ArrayList<>(k);
        for (int i = 0; i < futures.size(); i++) {
            try {
                models.add(futures.get(i).join());
            } catch (CompletionException e) {
                // Un pli en échec n'interrompt pas les autres
                log.warn("{} K-fold : pli {}/{} ignoré ({})", method, i + 1, k, rootMessage(e));
            }
        }

        if (!models.isEmpty()) {
            log.debug("{} K-fold : {}/{} plis ajustés", method, models.size(), k);
            return models;
        }

        log.warn("{} K-fold : tous les plis ont échoué, ajustement sur l'ensemble des données", method);
        try {
            return List.of(fitter.apply(p, y));
        } catch (RuntimeException e) {
            throw new CalibrationFailedException(method + " K-fold : échec des " + k + " plis et de l'ajustement complet", e);
        }
    }

    /**
     * Mélange déterministe des indices (graine fixe) puis découpage en k plis quasi égaux :
     * les (n mod k) premiers plis reçoivent un élément de plus.
     */
    static List<int[]> splitFolds(int n, int k, long seed) {
        int[] indices = IntStream.range(0, n).toArray();
        MathArrays.shuffle(indices, new Well19937c(seed));

        List<int[]> folds = new ArrayList<>(k);
        int base = n / k;
        int remainder = n % k;
        int start = 0;
        for (int i = 0; i < k; i++) {
            int size = base + (i < remainder ? 1 : 0);
            int[] fold = new int[size];
            System.arraycopy(indices, start, fold, 0, size);
            folds.add(fold);
            start += size;
        }
        return folds;
    }

    private static int[] trainingIndices(List<int[]> folds, int heldOut) {
        return IntStream.range(0, folds.size())
                .filter(j -> j != heldOut)
                .flatMap(j -> IntStream.of(folds.get(j)))
                .toArray();
    }

    private static double[] select(double[] values, int[] idx) {
        double[] out = new double[idx.length];
        for (int i = 0; i < idx.length; i++) {
            out[i] = values[idx[i]];
        }
        return out;
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        return cause.getMessage();
    }
}
