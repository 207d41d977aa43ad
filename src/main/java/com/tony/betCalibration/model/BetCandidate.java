package com.tony.betCalibration.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BetCandidate {
    @NotNull(message = "La date de l'événement est obligatoire")
    private LocalDateTime eventDate;

    private String selection; // Ex: "LeBron James - points"

    @DecimalMin(value = "0.0", message = "La probabilité doit être dans [0, 1]")
    @DecimalMax(value = "1.0", message = "La probabilité doit être dans [0, 1]")
    private double probability; // Probabilité calibrée

    @DecimalMin(value = "1.0", inclusive = false, message = "La cote décimale doit être > 1")
    private double odds;

    private Double confidence;     // 0-1 ou 0-100 (normalisée à la simulation)
    private Double line;           // Ligne du marché (over/under)
    private Double predictedValue; // Estimation ponctuelle du modèle, utilisée sans ligne
    private Double actualValue;    // null = résultat pas encore connu
    private Double oddsOpposite;   // Cote de l'autre côté du marché (retrait de la marge)

    @JsonIgnore
    public boolean isPending() {
        return actualValue == null || actualValue.isNaN();
    }

    /**
     * Gagné si le résultat réel dépasse la ligne, ou à défaut l'estimation du modèle (0 si absente).
     */
    @JsonIgnore
    public boolean isWinning() {
        double threshold;
        if (line != null && !line.isNaN()) threshold = line;
        else threshold = (predictedValue != null && !predictedValue.isNaN()) ? predictedValue : 0.0;
        return actualValue > threshold;
    }
}
