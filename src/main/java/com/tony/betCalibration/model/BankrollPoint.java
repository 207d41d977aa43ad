package com.tony.betCalibration.model;

import java.time.LocalDateTime;

public record BankrollPoint(LocalDateTime timestamp, double balance) {
}
