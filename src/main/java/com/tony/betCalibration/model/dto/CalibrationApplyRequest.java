package com.tony.betCalibration.model.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class CalibrationApplyRequest {

    @NotNull(message = "Les probabilités à calibrer sont requises")
    private double[] probabilities;

    // Null = dernière version enregistrée
    private String versionId;
}
