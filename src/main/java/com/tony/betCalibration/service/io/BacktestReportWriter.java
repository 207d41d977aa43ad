package com.tony.betCalibration.service.io;

import com.opencsv.CSVWriter;
import com.tony.betCalibration.config.BacktestProperties;
import com.tony.betCalibration.model.BacktestResult;
import com.tony.betCalibration.model.BacktestSummary;
import com.tony.betCalibration.model.BetRecord;
import com.tony.betCalibration.model.ReliabilityBin;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Export CSV d'un backtest : bets.csv (une ligne par pari), summary.csv et calibration.csv.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BacktestReportWriter {

    static final String[] BET_HEADER = {"event_date", "selection", "probability", "confidence", "expected_value",
            "decimal_odds", "stake", "won", "profit", "bankroll"};
    static final String[] SUMMARY_HEADER = {"initial_bankroll", "final_bankroll", "total_bets", "wins", "losses",
            "win_rate", "roi", "sharpe", "max_drawdown", "cagr", "brier_score"};
    static final String[] CALIBRATION_HEADER = {"bin_lower", "bin_upper", "mean_pred", "mean_obs", "count"};

    private final BacktestProperties properties;

    public Path write(BacktestResult result, String runName) {
        return write(result, Path.of(properties.getReportDir()), runName);
    }

    public Path write(BacktestResult result, Path outDir, String runName) {
        checkRunName(runName);
        Path base = outDir.toAbsolutePath().normalize();
        Path runDir = outDir.resolve(runName);
        if (!runDir.toAbsolutePath().normalize().getParent().equals(base)) {
            throw new IllegalArgumentException("Nom de run hors du répertoire de rapports : " + runName);
        }
        try {
            Files.createDirectories(runDir);
            writeCsv(runDir.resolve("bets.csv"), BET_HEADER, betRows(result.getBets()));
            writeCsv(runDir.resolve("summary.csv"), SUMMARY_HEADER, List.<String[]>of(summaryRow(result.getSummary())));
            if (!result.getCalibration().isEmpty()) {
                writeCsv(runDir.resolve("calibration.csv"), CALIBRATION_HEADER, calibrationRows(result.getCalibration()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Écriture du rapport " + runDir + " impossible", e);
        }
        log.info("📝 Rapport de backtest écrit dans {}", runDir.toAbsolutePath());
        return runDir;
    }

    /**
     * Un nom de run devient un unique répertoire sous reportDir : ni séparateur, ni '.' ou '..'.
     */
    public static void checkRunName(String runName) {
        if (runName == null || runName.isBlank()) {
            throw new IllegalArgumentException("Nom de run manquant");
        }
        if (runName.contains("/") || runName.contains("\\") || runName.equals(".") || runName.equals("..")) {
            throw new IllegalArgumentException("Nom de run invalide : " + runName);
        }
    }

    /**
     * Vue tabulaire du registre des paris (une ligne par pari, sans en-tête).
     */
    public static List<String[]> betRows(List<BetRecord> bets) {
        List<String[]> rows = new ArrayList<>(bets.size());
        for (BetRecord b : bets) {
            rows.add(new String[]{
                    String.valueOf(b.getEventDate()),
                    b.getSelection() == null ? "" : b.getSelection(),
                    num(b.getProbability()),
                    num(b.getConfidence()),
                    num(b.getExpectedValue()),
                    num(b.getOdds()),
                    num(b.getStake()),
                    String.valueOf(b.isWon()),
                    num(b.getProfit()),
                    num(b.getBankrollAfter())
            });
        }
        return rows;
    }

    static String[] summaryRow(BacktestSummary s) {
        return new String[]{
                num(s.getInitialBankroll()),
                num(s.getFinalBankroll()),
                String.valueOf(s.getTotalBets()),
                String.valueOf(s.getWins()),
                String.valueOf(s.getLosses()),
                num(s.getWinRate()),
                num(s.getRoi()),
                num(s.getSharpe()),
                num(s.getMaxDrawdown()),
                num(s.getCagr()),
                num(s.getBrierScore())
        };
    }

    private static List<String[]> calibrationRows(List<ReliabilityBin> bins) {
        return bins.stream()
                .map(b -> new String[]{num(b.lower()), num(b.upper()), num(b.meanPredicted()),
                        num(b.meanObserved()), String.valueOf(b.count())})
                .toList();
    }

    private static void writeCsv(Path file, String[] header, List<String[]> rows) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVWriter csv = new CSVWriter(writer)) {
            // guillemets seulement pour les champs qui contiennent séparateur, guillemet ou retour ligne
            csv.writeNext(header, false);
            csv.writeAll(rows, false);
        }
    }

    private static String num(Double value) {
        return value == null ? "" : Double.toString(value);
    }

    private static String num(double value) {
        return Double.toString(value);
    }
}
