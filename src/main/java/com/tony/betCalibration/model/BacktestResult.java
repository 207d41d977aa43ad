package com.tony.betCalibration.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BacktestResult {
    private BacktestSummary summary;

    @Builder.Default
    private List<BetRecord> bets = new ArrayList<>();

    // Bankroll initiale puis solde après chaque pari, dans l'ordre chronologique
    @Builder.Default
    private List<BankrollPoint> trajectory = new ArrayList<>();

    @Builder.Default
    private List<ReliabilityBin> calibration = new ArrayList<>();
}
