package com.tony.betCalibration.controller;

import com.tony.betCalibration.model.BacktestResult;
import com.tony.betCalibration.model.dto.BacktestRequest;
import com.tony.betCalibration.model.entity.BacktestRunEntity;
import com.tony.betCalibration.service.backtest.BacktestService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;

@RestController
@RequestMapping("/api/v1/backtests")
@RequiredArgsConstructor
@Slf4j
public class BacktestController {
    private final BacktestService backtestService;

    @PostMapping
    public ResponseEntity<BacktestResult> run(@Valid @RequestBody BacktestRequest request) {
        return ResponseEntity.ok(backtestService.run(request));
    }

    /**
     * Backtest depuis des CSV (multipart) : predictions obligatoire, actuals optionnel.
     */
    @PostMapping(value = "/csv", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<BacktestResult> runFromCsv(
            @RequestParam("predictions") MultipartFile predictions,
            @RequestParam(value = "actuals", required = false) MultipartFile actuals,
            @RequestParam(defaultValue = "false") boolean exportReport) throws IOException {

        log.info("📥 Backtest CSV : {} ({} octets)", predictions.getOriginalFilename(), predictions.getSize());
        try (Reader p = new InputStreamReader(predictions.getInputStream(), StandardCharsets.UTF_8);
             Reader a = actuals != null ? new InputStreamReader(actuals.getInputStream(), StandardCharsets.UTF_8) : null) {
            return ResponseEntity.ok(backtestService.runFromCsv(p, a, exportReport));
        }
    }

    @GetMapping
    public ResponseEntity<List<BacktestRunEntity>> history() {
        return ResponseEntity.ok(backtestService.history());
    }
}
