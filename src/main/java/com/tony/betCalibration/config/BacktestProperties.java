package com.tony.betCalibration.config;

import com.tony.betCalibration.model.StakingConfig;
import com.tony.betCalibration.model.StakingMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "backtest")
@Data
public class BacktestProperties {
    private double initialBankroll = 1000.0;
    private StakingMode stakingMode = StakingMode.KELLY;

    // --- Paramètres de mise ---
    private double flatStake = 10.0;
    private Double fixedFraction;       // null = maxFractionPerBet
    private Double kellyCap;            // null = maxFractionPerBet
    private double maxFractionPerBet = 0.02;

    // --- Filtres ---
    private double minConfidence = 0.6;
    private boolean requireEvPositive = true;

    private String reportDir = "backtest_reports";

    /**
     * Configuration par défaut d'une simulation, surchargeable requête par requête.
     */
    public StakingConfig toStakingConfig() {
        return StakingConfig.builder()
                .initialBankroll(initialBankroll)
                .stakingMode(stakingMode)
                .flatStake(flatStake)
                .fixedFraction(fixedFraction)
                .kellyCap(kellyCap)
                .maxFractionPerBet(maxFractionPerBet)
                .minConfidence(minConfidence)
                .requireEvPositive(requireEvPositive)
                .build();
    }
}
