package com.tony.betCalibration.model.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Trace d'un ajustement : quelle version a été enregistrée et ce qu'elle apporte sur les données d'apprentissage.
 */
@Entity
@Table(name = "calibration_run")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalibrationRunEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String calibratorName;
    private String versionId;
    private String method;      // platt | isotonic
    private boolean kfold;
    private Integer folds;
    private int sampleCount;

    // --- Métriques avant / après ---
    private Double brierBefore;
    private Double brierAfter;
    private Double eceBefore;
    private Double eceAfter;

    private Instant createdAt;
}
