package com.tony.betCalibration.service.backtest;

import com.tony.betCalibration.model.StakingConfig;
import org.springframework.stereotype.Component;

@Component
public class StakeSizer {

    /**
     * Mise pour un pari selon le mode configuré, toujours bornée à [0, bankroll].
     */
    public double stake(StakingConfig config, double bankroll, double probability, double odds) {
        double raw = switch (config.getStakingMode()) {
            case FLAT, FIXED_AMOUNT -> config.getFlatStake();
            case FIXED_FRACTION -> bankroll * Math.min(config.effectiveFixedFraction(), config.getMaxFractionPerBet());
            case KELLY -> kellyStake(config, bankroll, probability, odds);
        };
        if (Double.isNaN(raw)) return 0.0;
        return Math.max(0.0, Math.min(raw, bankroll));
    }

    private double kellyStake(StakingConfig config, double bankroll, double probability, double odds) {
        // Cote sans gain possible : on retombe sur la mise fixe
        if (odds - 1.0 <= 0) return config.getFlatStake();

        double fraction = OddsMath.kellyFraction(probability, odds);
        fraction = Math.max(0.0, Math.min(fraction, config.effectiveKellyCap()));
        return bankroll * fraction;
    }
}
