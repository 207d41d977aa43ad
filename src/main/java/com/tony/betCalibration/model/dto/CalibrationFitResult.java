package com.tony.betCalibration.model.dto;

import com.tony.betCalibration.model.CalibratorRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Version enregistrée + effet de la calibration sur les données d'ajustement.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalibrationFitResult {
    private CalibratorRecord record;
    private String method;
    private boolean kfold;
    private int sampleCount;
    private double brierBefore;
    private double brierAfter;
    private double eceBefore;
    private double eceAfter;
}
