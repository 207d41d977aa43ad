package com.tony.betCalibration.model.dto;

import com.tony.betCalibration.model.BetCandidate;
import com.tony.betCalibration.model.StakingMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Candidats à simuler. Chaque paramètre de mise laissé à null reprend la valeur de backtest.* (application.yml).
 */
@Data
public class BacktestRequest {

    @NotNull
    @Valid
    private List<BetCandidate> candidates = new ArrayList<>();

    @Positive(message = "La bankroll initiale doit être strictement positive")
    private Double initialBankroll;
    private StakingMode stakingMode;
    private Double flatStake;
    private Double fixedFraction;
    private Double kellyCap;

    @DecimalMin("0.0") @DecimalMax("1.0")
    private Double maxFractionPerBet;
    private Double minConfidence;
    private Boolean requireEvPositive;
    private Boolean scaleSharpeBySqrtN;

    // --- Export CSV ---
    private boolean exportReport;
    private String runName;
}
