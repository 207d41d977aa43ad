package com.tony.betCalibration.exception;

public class CalibrationFailedException extends RuntimeException {

    public CalibrationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
