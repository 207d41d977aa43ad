package com.tony.betCalibration.exception;

import lombok.Getter;

/**
 * Levée quand un ajustement de calibration est demandé avec moins de paires (probabilité, résultat)
 * que le minimum configuré.
 */
@Getter
public class InsufficientDataException extends RuntimeException {
    private final int available;
    private final int required;

    public InsufficientDataException(int available, int required) {
        super(String.format("Au moins %d paires prédiction/résultat sont nécessaires (reçu : %d)", required, available));
        this.available = available;
        this.required = required;
    }
}
