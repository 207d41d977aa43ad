package com.tony.betCalibration.model.dto;

/**
 * Une ligne du comparatif des méthodes ("raw" = probabilités brutes, référence).
 */
public record MethodComparison(String method, double brierScore, double expectedCalibrationError) {
}
