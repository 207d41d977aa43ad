package com.tony.betCalibration.config;

import com.tony.betCalibration.service.calibration.FitSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "calibration")
@Data
public class CalibrationProperties {
    // --- Ajustement (Newton-Raphson / PAV) ---
    private int minSamples = 3;
    private double tolerance = 1e-6;
    private int maxIterations = 100;
    private double regularization = 1e-8; // Uniquement pour garder la Hessienne inversible

    // --- K-fold ---
    private int folds = 5;
    private long seed = 0L;
    private int foldThreads = 4;

    // --- Métriques ---
    private int eceBins = 10;

    // --- Registre ---
    private String registryPath = "models_store/calibrators";
    private int retentionKeep = 10; // Versions conservées par nom (0 = pas de purge)
    private String retentionCron = "0 0 3 * * *";

    public FitSettings toFitSettings() {
        return new FitSettings(minSamples, tolerance, maxIterations, regularization);
    }
}
