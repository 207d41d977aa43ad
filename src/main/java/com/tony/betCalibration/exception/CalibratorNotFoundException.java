package com.tony.betCalibration.exception;

public class CalibratorNotFoundException extends RuntimeException {

    public CalibratorNotFoundException(String name) {
        super("Aucun calibrateur enregistré pour : " + name);
    }

    public CalibratorNotFoundException(String name, String versionId) {
        super("Calibrateur introuvable : " + name + " (version " + versionId + ")");
    }
}
