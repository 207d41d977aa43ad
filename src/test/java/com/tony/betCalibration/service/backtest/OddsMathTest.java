package com.tony.betCalibration.service.backtest;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class OddsMathTest {

    @Test
    void expectedValue() {
        assertThat(OddsMath.expectedValue(0.6, 2.0)).isCloseTo(0.2, within(1e-12));
        assertThat(OddsMath.expectedValue(0.5, 2.0)).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void kellyFraction() {
        assertThat(OddsMath.kellyFraction(0.6, 2.0)).isCloseTo(0.2, within(1e-12));
        assertThat(OddsMath.kellyFraction(0.3, 2.0)).isNegative();
        assertThat(OddsMath.kellyFraction(0.9, 1.0)).isNaN();
    }

    @Test
    void removeVig() {
        // 1/1.8 + 1/2.0 = 1.0556 -> côté over ramené à 0.5263 -> cote juste 1.9
        assertThat(OddsMath.removeVig(1.8, 2.0)).isCloseTo(1.9, within(1e-9));
        assertThat(OddsMath.removeVig(1.91, 1.91)).isCloseTo(2.0, within(1e-12));
        assertThatThrownBy(() -> OddsMath.removeVig(0.0, 1.9)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> OddsMath.removeVig(1.9, Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void normalizeConfidence() {
        assertThat(OddsMath.normalizeConfidence(72.0)).isCloseTo(0.72, within(1e-12));
        assertThat(OddsMath.normalizeConfidence(0.72)).isEqualTo(0.72);
        assertThat(OddsMath.normalizeConfidence(null)).isNull();
        assertThat(OddsMath.normalizeConfidence(Double.NaN)).isNull();
    }
}
