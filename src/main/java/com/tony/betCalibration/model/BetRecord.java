package com.tony.betCalibration.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Ligne du registre des paris : créée une seule fois par pari accepté.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BetRecord {
    private LocalDateTime eventDate;
    private String selection;
    private double probability;
    private Double confidence;
    private double expectedValue;
    private double odds;
    private double stake;
    private boolean won;
    private double profit;
    private double bankrollAfter;
}
