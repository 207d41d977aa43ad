package com.tony.betCalibration.service.calibration;

import com.tony.betCalibration.config.CalibrationProperties;
import com.tony.betCalibration.exception.CalibrationFailedException;
import com.tony.betCalibration.exception.CalibratorNotFoundException;
import com.tony.betCalibration.exception.InsufficientDataException;
import com.tony.betCalibration.exception.ShapeMismatchException;
import com.tony.betCalibration.model.CalibratorModel;
import com.tony.betCalibration.model.CalibratorRecord;
import com.tony.betCalibration.model.dto.CalibrationFitResult;
import com.tony.betCalibration.model.dto.MethodComparison;
import com.tony.betCalibration.model.entity.CalibrationRunEntity;
import com.tony.betCalibration.repository.CalibrationRunRepository;
import com.tony.betCalibration.service.registry.CalibratorRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Point d'entrée métier : ajuste, enregistre et applique les calibrateurs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CalibrationService {

    public static final String PLATT = "platt";
    public static final String ISOTONIC = "isotonic";

    private final PlattFitter plattFitter;
    private final IsotonicFitter isotonicFitter;
    private final KFoldCalibrator kFoldCalibrator;
    private final CalibratorRegistry registry;
    private final CalibrationRunRepository runRepository;
    private final CalibrationProperties properties;
    private final Clock clock;

    public CalibrationFitResult fitAndRegister(String name, double[] p, double[] y, String method, boolean kfold) {
        return fitAndRegister(name, p, y, method, kfold, null, null);
    }

    /**
     * Ajuste un calibrateur sur (p, y), mesure Brier/ECE avant et après, puis enregistre une nouvelle version.
     *
     * @param folds null = calibration.folds
     * @param seed  null = calibration.seed
     */
    public CalibrationFitResult fitAndRegister(String name, double[] p, double[] y, String method, boolean kfold,
                                               Integer folds, Long seed) {
        String m = normalizeMethod(method);
        checkInput(p, y);
        int k = folds != null ? folds : properties.getFolds();
        long s = seed != null ? seed : properties.getSeed();

        log.info("📊 Ajustement {}{} pour '{}' sur {} points", m, kfold ? " K-fold (k=" + k + ")" : "", name, p.length);
        CalibratorModel model = fit(m, kfold, p, y, k, s);

        double[] calibrated = applySafely(model, p);
        double brierBefore = CalibrationMetrics.brierScore(y, p);
        double brierAfter = CalibrationMetrics.brierScore(y, calibrated);
        double eceBefore = CalibrationMetrics.expectedCalibrationError(y, p, properties.getEceBins());
        double eceAfter = CalibrationMetrics.expectedCalibrationError(y, calibrated, properties.getEceBins());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("method", m);
        metadata.put("kfold", kfold);
        if (kfold) {
            metadata.put("folds", k);
            metadata.put("seed", s);
        }
        metadata.put("n_samples", p.length);
        metadata.put("brier_before", brierBefore);
        metadata.put("brier_after", brierAfter);
        metadata.put("ece_before", eceBefore);
        metadata.put("ece_after", eceAfter);

        CalibratorRecord record = registry.register(name, model, metadata);

        runRepository.save(CalibrationRunEntity.builder()
                .calibratorName(name)
                .versionId(record.getVersionId())
                .method(m)
                .kfold(kfold)
                .folds(kfold ? k : null)
                .sampleCount(p.length)
                .brierBefore(finiteOrNull(brierBefore))
                .brierAfter(finiteOrNull(brierAfter))
                .eceBefore(eceBefore)
                .eceAfter(eceAfter)
                .createdAt(clock.instant())
                .build());

        log.info("✅ '{}' v{} : Brier {} -> {}, ECE {} -> {}", name, record.getVersionId(),
                fmt(brierBefore), fmt(brierAfter), fmt(eceBefore), fmt(eceAfter));

        return CalibrationFitResult.builder()
                .record(record)
                .method(m)
                .kfold(kfold)
                .sampleCount(p.length)
                .brierBefore(brierBefore)
                .brierAfter(brierAfter)
                .eceBefore(eceBefore)
                .eceAfter(eceAfter)
                .build();
    }

    public double calibrate(String name, double rawProbability) {
        return applySafely(latestModel(name), rawProbability);
    }

    public double[] calibrateAll(String name, double[] rawProbabilities) {
        return calibrateAll(name, null, rawProbabilities);
    }

    /**
     * @param versionId null = dernière version
     */
    public double[] calibrateAll(String name, String versionId, double[] rawProbabilities) {
        CalibratorModel model = versionId == null ? latestModel(name) : registry.loadModel(name, versionId);
        return applySafely(model, rawProbabilities);
    }

    /**
     * Compare les méthodes sur les mêmes données (sans rien enregistrer). La première ligne est la référence brute.
     */
    public List<MethodComparison> compareMethods(double[] p, double[] y) {
        checkInput(p, y);
        int bins = properties.getEceBins();
        List<MethodComparison> rows = new ArrayList<>();
        rows.add(new MethodComparison("raw", CalibrationMetrics.brierScore(y, p),
                CalibrationMetrics.expectedCalibrationError(y, p, bins)));

        for (String m : List.of(PLATT, ISOTONIC)) {
            for (boolean kfold : new boolean[]{false, true}) {
                String label = kfold ? m + "_kfold" : m;
                try {
                    double[] calibrated = applySafely(fit(m, kfold, p, y, properties.getFolds(), properties.getSeed()), p);
                    rows.add(new MethodComparison(label, CalibrationMetrics.brierScore(y, calibrated),
                            CalibrationMetrics.expectedCalibrationError(y, calibrated, bins)));
                } catch (CalibrationFailedException e) {
                    log.warn("Comparatif : méthode {} ignorée ({})", label, e.getMessage());
                }
            }
        }
        return rows;
    }

    public List<CalibrationRunEntity> history(String name) {
        return runRepository.findByCalibratorNameOrderByCreatedAtDesc(name);
    }

    private CalibratorModel fit(String method, boolean kfold, double[] p, double[] y, int k, long seed) {
        FitSettings settings = properties.toFitSettings();
        if (PLATT.equals(method)) {
            return kfold ? kFoldCalibrator.fitPlatt(p, y, k, seed, settings) : plattFitter.fit(p, y, settings);
        }
        return kfold ? kFoldCalibrator.fitIsotonic(p, y, k, seed) : isotonicFitter.fit(p, y);
    }

    private CalibratorModel latestModel(String name) {
        return registry.loadLatestModel(name).orElseThrow(() -> new CalibratorNotFoundException(name));
    }

    private void checkInput(double[] p, double[] y) {
        ShapeMismatchException.check(p, y);
        if (p.length < properties.getMinSamples()) {
            throw new InsufficientDataException(p.length, properties.getMinSamples());
        }
    }

    private double[] applySafely(CalibratorModel model, double[] raw) {
        double[] out = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            out[i] = applySafely(model, raw[i]);
        }
        return out;
    }

    /**
     * Sortie non finie (paramètres dégénérés) : on garde la probabilité brute.
     */
    private double applySafely(CalibratorModel model, double raw) {
        double calibrated = model.apply(raw);
        if (!Double.isFinite(calibrated)) {
            log.warn("⚠️ Sortie non finie du calibrateur {} pour p={}, probabilité brute conservée", model.kind(), raw);
            return raw;
        }
        return SigmoidMath.clampProbability(calibrated);
    }

    static String normalizeMethod(String method) {
        String m = method == null ? PLATT : method.trim().toLowerCase(Locale.ROOT);
        if (!PLATT.equals(m) && !ISOTONIC.equals(m)) {
            throw new IllegalArgumentException("Méthode de calibration inconnue : " + method);
        }
        return m;
    }

    private static Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }

    private static String fmt(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }
}
