package com.tony.betCalibration.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fiche "metadata.json" d'une version de calibrateur. Jamais réécrite : une nouvelle calibration = une nouvelle version.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalibratorRecord {
    private String name;

    @JsonProperty("version_id")
    private String versionId;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("calibrator_path")
    private String calibratorPath;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
