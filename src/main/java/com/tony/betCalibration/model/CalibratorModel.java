package com.tony.betCalibration.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Calibrateur ajusté et immuable. Chaque variante porte sa propre règle d'application,
 * le tag "kind" sert à la (dé)sérialisation JSON du registre.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PlattCalibrator.class, name = "PLATT"),
        @JsonSubTypes.Type(value = IsotonicCalibrator.class, name = "ISOTONIC"),
        @JsonSubTypes.Type(value = IsotonicEnsembleCalibrator.class, name = "ISOTONIC_ENSEMBLE")
})
public interface CalibratorModel {

    CalibratorKind kind();

    /**
     * Probabilité calibrée pour une probabilité brute. Peut renvoyer NaN si les paramètres sont dégénérés :
     * c'est à l'appelant de retomber sur la probabilité brute.
     */
    double apply(double rawProbability);

    default double[] applyAll(double[] rawProbabilities) {
        double[] out = new double[rawProbabilities.length];
        for (int i = 0; i < rawProbabilities.length; i++) {
            out[i] = apply(rawProbabilities[i]);
        }
        return out;
    }
}
