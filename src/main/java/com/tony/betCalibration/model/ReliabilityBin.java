package com.tony.betCalibration.model;

/**
 * Une tranche du diagramme de fiabilité.
 */
public record ReliabilityBin(double lower, double upper, double center,
                             double meanPredicted, double meanObserved, int count) {
}
