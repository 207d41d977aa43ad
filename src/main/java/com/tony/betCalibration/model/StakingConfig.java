package com.tony.betCalibration.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StakingConfig {
    @Builder.Default
    private double initialBankroll = 1000.0;
    @Builder.Default
    private StakingMode stakingMode = StakingMode.KELLY;

    @Builder.Default
    private double flatStake = 10.0;
    private Double fixedFraction;
    private Double kellyCap;
    @Builder.Default
    private double maxFractionPerBet = 0.02;

    @Builder.Default
    private double minConfidence = 0.6;
    @Builder.Default
    private boolean requireEvPositive = true;

    // Sharpe multiplié par sqrt(nombre de paris) si demandé
    private boolean scaleSharpeBySqrtN;

    public double effectiveFixedFraction() {
        return fixedFraction != null ? fixedFraction : maxFractionPerBet;
    }

    public double effectiveKellyCap() {
        return kellyCap != null ? kellyCap : maxFractionPerBet;
    }
}
