package com.tony.betCalibration.model.entity;

import com.tony.betCalibration.model.StakingMode;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "backtest_run")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BacktestRunEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String runName;
    private Instant createdAt;

    @Enumerated(EnumType.STRING)
    private StakingMode stakingMode;

    private int candidateCount;

    // Résumé (copie à plat de BacktestSummary)
    private double initialBankroll;
    private double finalBankroll;
    private int totalBets;
    private int wins;
    private int losses;
    private double winRate;
    private double roi;
    private Double sharpe;
    private double maxDrawdown;
    private Double cagr;
    private Double brierScore;

    // Null si aucun rapport CSV n'a été demandé
    private String reportPath;
}
