package com.tony.betCalibration.exception;

/**
 * Échec d'écriture ou de lecture dans le registre de calibrateurs (disque, JSON corrompu...).
 */
public class CalibratorPersistenceException extends RuntimeException {

    public CalibratorPersistenceException(String message) {
        super(message);
    }

    public CalibratorPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
