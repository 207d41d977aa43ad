package com.tony.betCalibration.service.backtest;

import com.tony.betCalibration.model.*;
import com.tony.betCalibration.service.calibration.CalibrationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Simulation séquentielle d'une stratégie de mises. Chaque mise dépend de la bankroll laissée par les paris
 * précédents : traitement strictement ordonné, sur un seul thread.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BacktestEngine {

    private final StakeSizer stakeSizer;

    public BacktestResult run(List<BetCandidate> candidates, StakingConfig config) {
        if (!(config.getInitialBankroll() > 0)) {
            throw new IllegalArgumentException("La bankroll initiale doit être > 0");
        }
        if (candidates.stream().anyMatch(c -> c.getEventDate() == null)) {
            throw new IllegalArgumentException("Chaque candidat doit avoir une date d'événement");
        }

        // Tri stable : à date égale, l'ordre d'entrée est conservé
        List<BetCandidate> ordered = candidates.stream()
                .sorted(Comparator.comparing(BetCandidate::getEventDate))
                .toList();

        double initial = config.getInitialBankroll();
        double bankroll = initial;
        List<BetRecord> bets = new ArrayList<>();
        List<BankrollPoint> trajectory = new ArrayList<>();
        int skipped = 0;

        for (BetCandidate c : ordered) {
            // 1. Résultat inconnu : on ignore
            if (c.isPending()) {
                skipped++;
                continue;
            }

            double p = c.getProbability();
            double odds = effectiveOdds(c);
            if (!Double.isFinite(p) || !Double.isFinite(odds)) {
                skipped++;
                continue;
            }

            // 2. Filtre valeur attendue
            double ev = OddsMath.expectedValue(p, odds);
            if (config.isRequireEvPositive() && ev <= 0) {
                skipped++;
                continue;
            }

            // 3. Filtre confiance (seulement si fournie)
            Double confidence = OddsMath.normalizeConfidence(c.getConfidence());
            if (confidence != null && confidence < config.getMinConfidence()) {
                skipped++;
                continue;
            }

            // 4. Mise
            double stake = stakeSizer.stake(config, bankroll, p, odds);
            if (stake <= 0) {
                skipped++;
                continue;
            }

            // 5-6. Résolution et mise à jour de la bankroll
            boolean won = c.isWinning();
            double profit = won ? stake * (odds - 1.0) : -stake;
            if (trajectory.isEmpty()) {
                trajectory.add(new BankrollPoint(c.getEventDate(), initial));
            }
            bankroll += profit;
            trajectory.add(new BankrollPoint(c.getEventDate(), bankroll));

            bets.add(BetRecord.builder()
                    .eventDate(c.getEventDate())
                    .selection(c.getSelection())
                    .probability(p)
                    .confidence(confidence)
                    .expectedValue(ev)
                    .odds(odds)
                    .stake(stake)
                    .won(won)
                    .profit(profit)
                    .bankrollAfter(bankroll)
                    .build());
        }

        BacktestSummary summary = summarize(initial, bankroll, bets, trajectory, config);
        List<ReliabilityBin> calibration = calibrationTable(ordered, summary);

        log.info("📊 Backtest ({}) : {} paris placés, {} candidats ignorés", config.getStakingMode(), bets.size(), skipped);
        log.info("💰 Bankroll : {} -> {} (ROI {})", initial, String.format("%.2f", bankroll), String.format("%.4f", summary.getRoi()));

        return BacktestResult.builder()
                .summary(summary)
                .bets(bets)
                .trajectory(trajectory)
                .calibration(calibration)
                .build();
    }

    /**
     * Cote utilisée pour la simulation : cote "juste" quand la cote de l'autre côté du marché est connue.
     */
    private double effectiveOdds(BetCandidate c) {
        if (c.getOddsOpposite() == null) return c.getOdds();
        try {
            return OddsMath.removeVig(c.getOdds(), c.getOddsOpposite());
        } catch (IllegalArgumentException e) {
            log.debug("Retrait de marge impossible pour {} : {}", c.getSelection(), e.getMessage());
            return c.getOdds();
        }
    }

    private BacktestSummary summarize(double initial, double last, List<BetRecord> bets,
                                      List<BankrollPoint> trajectory, StakingConfig config) {
        int wins = (int) bets.stream().filter(BetRecord::isWon).count();
        double[] balances = trajectory.stream().mapToDouble(BankrollPoint::balance).toArray();
        double[] returns = bets.stream().mapToDouble(b -> b.getProfit() / initial).toArray();

        Double cagr = bets.isEmpty() ? null : PerformanceMetrics.cagr(initial, last,
                bets.get(0).getEventDate(), bets.get(bets.size() - 1).getEventDate());

        return BacktestSummary.builder()
                .initialBankroll(initial)
                .finalBankroll(last)
                .totalBets(bets.size())
                .wins(wins)
                .losses(bets.size() - wins)
                .winRate(PerformanceMetrics.winRate(wins, bets.size()))
                .roi(PerformanceMetrics.roi(initial, last))
                .sharpe(PerformanceMetrics.sharpe(returns, config.isScaleSharpeBySqrtN()))
                .maxDrawdown(PerformanceMetrics.maxDrawdown(balances))
                .cagr(cagr)
                .build();
    }

    /**
     * Brier Score et tableau de fiabilité sur tous les candidats résolus, pariés ou non.
     */
    private List<ReliabilityBin> calibrationTable(List<BetCandidate> ordered, BacktestSummary summary) {
        List<BetCandidate> resolved = ordered.stream()
                .filter(c -> !c.isPending() && Double.isFinite(c.getProbability()))
                .toList();
        if (resolved.isEmpty()) return List.of();

        double[] outcomes = resolved.stream().mapToDouble(c -> c.isWinning() ? 1.0 : 0.0).toArray();
        double[] probs = resolved.stream().mapToDouble(BetCandidate::getProbability).toArray();
        summary.setBrierScore(CalibrationMetrics.brierScore(outcomes, probs));
        return CalibrationMetrics.reliabilityDiagram(outcomes, probs, CalibrationMetrics.DEFAULT_BINS);
    }
}
