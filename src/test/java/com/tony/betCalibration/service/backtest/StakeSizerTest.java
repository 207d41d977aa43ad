package com.tony.betCalibration.service.backtest;

import com.tony.betCalibration.model.StakingConfig;
import com.tony.betCalibration.model.StakingMode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StakeSizerTest {

    private final StakeSizer sizer = new StakeSizer();

    @Test
    void flatAndFixedAmountUseTheSameStake() {
        StakingConfig flat = StakingConfig.builder().stakingMode(StakingMode.FLAT).flatStake(25).build();
        StakingConfig fixed = flat.toBuilder().stakingMode(StakingMode.FIXED_AMOUNT).build();

        assertThat(sizer.stake(flat, 1000, 0.6, 2.0)).isEqualTo(25.0);
        assertThat(sizer.stake(fixed, 1000, 0.6, 2.0)).isEqualTo(25.0);
    }

    @Test
    void stakeNeverExceedsBankroll() {
        StakingConfig flat = StakingConfig.builder().stakingMode(StakingMode.FLAT).flatStake(500).build();

        assertThat(sizer.stake(flat, 120, 0.6, 2.0)).isEqualTo(120.0);
    }

    @Test
    void kellyUsesExplicitCapWhenProvided() {
        StakingConfig kelly = StakingConfig.builder().stakingMode(StakingMode.KELLY).kellyCap(0.1).build();

        assertThat(sizer.stake(kelly, 1000, 0.6, 2.0)).isCloseTo(100.0, within(1e-9));
        // Kelly négatif : pas de mise
        assertThat(sizer.stake(kelly, 1000, 0.3, 2.0)).isZero();
    }

    @Test
    void kellyWithoutPossibleGainFallsBackToFlatStake() {
        StakingConfig kelly = StakingConfig.builder().stakingMode(StakingMode.KELLY).flatStake(15).build();

        assertThat(sizer.stake(kelly, 1000, 0.9, 1.0)).isEqualTo(15.0);
    }

    @Test
    void fixedFractionDefaultsToMaxFraction() {
        StakingConfig config = StakingConfig.builder().stakingMode(StakingMode.FIXED_FRACTION).maxFractionPerBet(0.05).build();

        assertThat(sizer.stake(config, 2000, 0.6, 2.0)).isCloseTo(100.0, within(1e-9));
    }
}
