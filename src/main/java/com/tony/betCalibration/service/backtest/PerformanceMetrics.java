package com.tony.betCalibration.service.backtest;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Indicateurs de performance d'une trajectoire de bankroll.
 */
public final class PerformanceMetrics {

    private static final double SECONDS_PER_YEAR = 365.25 * 24 * 3600;

    private PerformanceMetrics() {
    }

    public static double roi(double initial, double last) {
        if (initial <= 0) return 0.0;
        return (last - initial) / initial;
    }

    public static double winRate(int wins, int totalBets) {
        return totalBets == 0 ? 0.0 : (double) wins / totalBets;
    }

    /**
     * Plus forte baisse depuis le plus haut courant, en fraction de ce plus haut (dans [0, 1]).
     */
    public static double maxDrawdown(double[] balances) {
        double peak = Double.NEGATIVE_INFINITY;
        double worst = 0.0;
        for (double balance : balances) {
            peak = Math.max(peak, balance);
            if (peak > 0) {
                worst = Math.max(worst, (peak - balance) / peak);
            }
        }
        return Math.min(worst, 1.0);
    }

    /**
     * Taux de croissance annuel composé entre le premier et le dernier pari. null si durée nulle ou ratio <= 0.
     */
    public static Double cagr(double initial, double last, LocalDateTime first, LocalDateTime end) {
        if (first == null || end == null || initial <= 0) return null;
        double years = Duration.between(first, end).getSeconds() / SECONDS_PER_YEAR;
        double ratio = last / initial;
        if (years <= 0 || ratio <= 0) return null;
        return Math.pow(ratio, 1.0 / years) - 1.0;
    }

    /**
     * Ratio moyenne / écart-type (population) des rendements par pari, sans taux sans risque.
     * null pour moins de 2 rendements ou une variance nulle.
     */
    public static Double sharpe(double[] returns, boolean scaleBySqrtN) {
        if (returns.length < 2) return null;
        double mean = new Mean().evaluate(returns);
        double std = new StandardDeviation(false).evaluate(returns);
        if (!(std > 0)) return null;
        double ratio = mean / std;
        return scaleBySqrtN ? ratio * Math.sqrt(returns.length) : ratio;
    }
}
