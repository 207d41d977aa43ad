package com.tony.betCalibration.service.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ValueCoercerTest {

    @Test
    void numbersInSeveralFormats() {
        assertThat(ValueCoercer.toDouble("1.85").value()).isEqualTo(1.85);
        assertThat(ValueCoercer.toDouble(" -2e-3 ").value()).isEqualTo(-0.002);

        CoercionResult<Double> comma = ValueCoercer.toDouble("0,55");
        assertThat(comma.value()).isEqualTo(0.55);
        assertThat(comma.strategy()).isEqualTo("virgule décimale");
        assertThat(comma.rejections()).hasSize(1);

        assertThat(ValueCoercer.toDouble("62.5 %").value()).isCloseTo(0.625, within(1e-12));
    }

    @Test
    @DisplayName("Valeur non convertible : chaque stratégie explique son refus")
    void unparseableNumberShouldListRejections() {
        CoercionResult<Double> result = ValueCoercer.toDouble("n/a");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.toOptional()).isEmpty();
        assertThat(result.rejections()).hasSize(3);
        assertThat(result.describeFailure()).contains("décimal", "pourcentage");
    }

    @Test
    void blankValueIsAFailure() {
        assertThat(ValueCoercer.toDouble("  ").isSuccess()).isFalse();
        assertThat(ValueCoercer.toDouble(null).describeFailure()).isEqualTo("valeur vide");
    }

    @Test
    void datesInSeveralFormats() {
        assertThat(ValueCoercer.toDateTime("2024-03-15T19:30:00").value()).isEqualTo(LocalDateTime.of(2024, 3, 15, 19, 30));
        assertThat(ValueCoercer.toDateTime("2024-03-15 19:30").value()).isEqualTo(LocalDateTime.of(2024, 3, 15, 19, 30));
        assertThat(ValueCoercer.toDateTime("2024-03-15").value()).isEqualTo(LocalDateTime.of(2024, 3, 15, 0, 0));
        assertThat(ValueCoercer.toDateTime("15/03/2024").value()).isEqualTo(LocalDateTime.of(2024, 3, 15, 0, 0));
    }

    @Test
    @DisplayName("Date au bon format mais impossible : refus motivé, pas d'exception")
    void impossibleDateShouldBeRejectedWithReason() {
        CoercionResult<LocalDateTime> result = ValueCoercer.toDateTime("2024-13-45");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.describeFailure()).contains("ISO date :");
    }
}
