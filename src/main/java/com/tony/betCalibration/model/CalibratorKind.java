package com.tony.betCalibration.model;

public enum CalibratorKind {
    PLATT,
    ISOTONIC,
    ISOTONIC_ENSEMBLE
}
