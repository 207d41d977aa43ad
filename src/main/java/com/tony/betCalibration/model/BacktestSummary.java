package com.tony.betCalibration.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BacktestSummary {
    private double initialBankroll;
    private double finalBankroll;
    private int totalBets;
    private int wins;
    private int losses;
    private double winRate;
    private double roi;

    // Indicateurs de risque (null = non défini)
    private Double sharpe;
    private double maxDrawdown;
    private Double cagr;

    // Qualité des probabilités sur tous les événements résolus
    private Double brierScore;
}
