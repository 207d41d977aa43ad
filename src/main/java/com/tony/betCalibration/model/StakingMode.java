package com.tony.betCalibration.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum StakingMode {
    FLAT,
    FIXED_AMOUNT, // Alias de FLAT
    FIXED_FRACTION,
    KELLY;

    /**
     * Accepte "kelly", "fixed_fraction", "fixed-amount", "FLAT"...
     */
    @JsonCreator
    public static StakingMode fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Mode de mise manquant");
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return StakingMode.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Mode de mise inconnu : " + code, e);
        }
    }
}
