package com.tony.betCalibration.service.backtest;

import com.tony.betCalibration.config.BacktestProperties;
import com.tony.betCalibration.model.BacktestResult;
import com.tony.betCalibration.model.BacktestSummary;
import com.tony.betCalibration.model.BetCandidate;
import com.tony.betCalibration.model.StakingConfig;
import com.tony.betCalibration.model.dto.BacktestRequest;
import com.tony.betCalibration.model.entity.BacktestRunEntity;
import com.tony.betCalibration.repository.BacktestRunRepository;
import com.tony.betCalibration.service.io.BacktestReportWriter;
import com.tony.betCalibration.service.io.CandidateCsvImporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.Reader;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Orchestration d'un backtest : configuration (défauts + surcharges), simulation, historique et export CSV.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BacktestService {

    private static final DateTimeFormatter RUN_NAME_FORMAT =
            DateTimeFormatter.ofPattern("'backtest_'yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private final BacktestEngine engine;
    private final BacktestRunRepository runRepository;
    private final BacktestReportWriter reportWriter;
    private final CandidateCsvImporter csvImporter;
    private final BacktestProperties properties;
    private final Clock clock;

    public BacktestResult run(BacktestRequest request) {
        StakingConfig config = resolveConfig(request);
        return run(request.getCandidates(), config, request.isExportReport(), request.getRunName());
    }

    /**
     * Backtest depuis des fichiers CSV (prédictions, résultats optionnels), paramètres de mise par défaut.
     */
    public BacktestResult runFromCsv(Reader predictions, Reader actuals, boolean exportReport) {
        List<BetCandidate> candidates = csvImporter.read(predictions, actuals);
        return run(candidates, properties.toStakingConfig(), exportReport, null);
    }

    public BacktestResult run(List<BetCandidate> candidates, StakingConfig config, boolean exportReport, String runName) {
        String name = runName != null && !runName.isBlank() ? runName : RUN_NAME_FORMAT.format(clock.instant());
        if (exportReport) {
            BacktestReportWriter.checkRunName(name);
        }
        log.info("🚀 Backtest '{}' : {} candidats, mode {}", name, candidates.size(), config.getStakingMode());

        BacktestResult result = engine.run(candidates, config);

        Path reportDir = exportReport ? reportWriter.write(result, name) : null;
        runRepository.save(toEntity(name, candidates.size(), config, result.getSummary(), reportDir));

        BacktestSummary s = result.getSummary();
        log.info("✅ Backtest '{}' terminé : {} paris, ROI {}, bankroll finale {}", name, s.getTotalBets(),
                s.getRoi(), s.getFinalBankroll());
        return result;
    }

    public List<BacktestRunEntity> history() {
        return runRepository.findAllByOrderByCreatedAtDesc();
    }

    /**
     * Paramètres de backtest.* surchargés par les champs non nuls de la requête.
     */
    StakingConfig resolveConfig(BacktestRequest request) {
        StakingConfig.StakingConfigBuilder builder = properties.toStakingConfig().toBuilder();
        if (request.getInitialBankroll() != null) builder.initialBankroll(request.getInitialBankroll());
        if (request.getStakingMode() != null) builder.stakingMode(request.getStakingMode());
        if (request.getFlatStake() != null) builder.flatStake(request.getFlatStake());
        if (request.getFixedFraction() != null) builder.fixedFraction(request.getFixedFraction());
        if (request.getKellyCap() != null) builder.kellyCap(request.getKellyCap());
        if (request.getMaxFractionPerBet() != null) builder.maxFractionPerBet(request.getMaxFractionPerBet());
        if (request.getMinConfidence() != null) builder.minConfidence(request.getMinConfidence());
        if (request.getRequireEvPositive() != null) builder.requireEvPositive(request.getRequireEvPositive());
        if (request.getScaleSharpeBySqrtN() != null) builder.scaleSharpeBySqrtN(request.getScaleSharpeBySqrtN());
        return builder.build();
    }

    private BacktestRunEntity toEntity(String name, int candidateCount, StakingConfig config,
                                       BacktestSummary s, Path reportDir) {
        return BacktestRunEntity.builder()
                .runName(name)
                .createdAt(clock.instant())
                .stakingMode(config.getStakingMode())
                .candidateCount(candidateCount)
                .initialBankroll(s.getInitialBankroll())
                .finalBankroll(s.getFinalBankroll())
                .totalBets(s.getTotalBets())
                .wins(s.getWins())
                .losses(s.getLosses())
                .winRate(s.getWinRate())
                .roi(s.getRoi())
                .sharpe(s.getSharpe())
                .maxDrawdown(s.getMaxDrawdown())
                .cagr(s.getCagr())
                .brierScore(s.getBrierScore())
                .reportPath(reportDir != null ? reportDir.toAbsolutePath().toString() : null)
                .build();
    }
}
