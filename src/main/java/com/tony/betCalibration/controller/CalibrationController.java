package com.tony.betCalibration.controller;

import com.tony.betCalibration.exception.CalibratorNotFoundException;
import com.tony.betCalibration.model.CalibratorRecord;
import com.tony.betCalibration.model.dto.CalibrationApplyRequest;
import com.tony.betCalibration.model.dto.CalibrationFitRequest;
import com.tony.betCalibration.model.dto.CalibrationFitResult;
import com.tony.betCalibration.model.dto.MethodComparison;
import com.tony.betCalibration.model.entity.CalibrationRunEntity;
import com.tony.betCalibration.service.calibration.CalibrationService;
import com.tony.betCalibration.service.registry.CalibratorRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/calibrators")
@RequiredArgsConstructor
public class CalibrationController {
    private final CalibrationService calibrationService;
    private final CalibratorRegistry registry;

    @GetMapping
    public ResponseEntity<List<String>> listCalibrators() {
        return ResponseEntity.ok(registry.listNames());
    }

    // Ajuste puis enregistre une nouvelle version
    @PostMapping("/{name}")
    public ResponseEntity<CalibrationFitResult> fit(@PathVariable String name,
                                                    @Valid @RequestBody CalibrationFitRequest request) {
        CalibrationFitResult result = calibrationService.fitAndRegister(name, request.getProbabilities(),
                request.getOutcomes(), request.getMethod(), request.isKfold(), request.getFolds(), request.getSeed());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @GetMapping("/{name}/versions")
    public ResponseEntity<List<CalibratorRecord>> listVersions(@PathVariable String name) {
        List<CalibratorRecord> versions = registry.listVersions(name);
        if (versions.isEmpty()) {
            throw new CalibratorNotFoundException(name);
        }
        return ResponseEntity.ok(versions);
    }

    @GetMapping("/{name}/latest")
    public ResponseEntity<CalibratorRecord> latest(@PathVariable String name) {
        return registry.latest(name)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{name}/runs")
    public ResponseEntity<List<CalibrationRunEntity>> runs(@PathVariable String name) {
        return ResponseEntity.ok(calibrationService.history(name));
    }

    @PostMapping("/{name}/apply")
    public ResponseEntity<Map<String, double[]>> apply(@PathVariable String name,
                                                       @Valid @RequestBody CalibrationApplyRequest request) {
        double[] calibrated = calibrationService.calibrateAll(name, request.getVersionId(), request.getProbabilities());
        return ResponseEntity.ok(Map.of("probabilities", calibrated));
    }

    // Comparatif brut / Platt / isotonique (+ K-fold), rien n'est enregistré
    @PostMapping("/compare")
    public ResponseEntity<List<MethodComparison>> compare(@Valid @RequestBody CalibrationFitRequest request) {
        return ResponseEntity.ok(calibrationService.compareMethods(request.getProbabilities(), request.getOutcomes()));
    }

    @DeleteMapping("/{name}/versions/{versionId}")
    public ResponseEntity<Void> deleteVersion(@PathVariable String name, @PathVariable String versionId) {
        return registry.delete(name, versionId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
