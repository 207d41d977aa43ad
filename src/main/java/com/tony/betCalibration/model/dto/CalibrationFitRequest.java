package com.tony.betCalibration.model.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class CalibrationFitRequest {

    @NotEmpty(message = "Les probabilités brutes sont requises")
    private double[] probabilities;

    @NotEmpty(message = "Les résultats observés (0/1) sont requis")
    private double[] outcomes;

    @Pattern(regexp = "(?i)platt|isotonic", message = "Méthode attendue : platt ou isotonic")
    private String method = "platt";

    private boolean kfold;

    // Null = valeurs de calibration.folds / calibration.seed
    @Min(value = 2, message = "Au moins 2 plis")
    private Integer folds;
    private Long seed;
}
