package com.tony.betCalibration.exception;

import lombok.Getter;

@Getter
public class ShapeMismatchException extends RuntimeException {
    private final int leftLength;
    private final int rightLength;

    public ShapeMismatchException(int leftLength, int rightLength) {
        super(String.format("Les deux vecteurs doivent avoir la même taille (%d != %d)", leftLength, rightLength));
        this.leftLength = leftLength;
        this.rightLength = rightLength;
    }

    /**
     * Vérifie que deux vecteurs appariés ont la même longueur.
     */
    public static void check(double[] left, double[] right) {
        if (left.length != right.length) {
            throw new ShapeMismatchException(left.length, right.length);
        }
    }
}
