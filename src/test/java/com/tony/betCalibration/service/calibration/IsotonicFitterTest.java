package com.tony.betCalibration.service.calibration;

import com.tony.betCalibration.exception.ShapeMismatchException;
import com.tony.betCalibration.model.IsotonicCalibrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class IsotonicFitterTest {

    private IsotonicFitter fitter;

    @BeforeEach
    void setUp() {
        fitter = new IsotonicFitter();
    }

    @Test
    @DisplayName("Les noeuds sont croissants en x et non décroissants en y, quelles que soient les données")
    void knotsShouldBeMonotonicOnRandomData() {
        Random rnd = new Random(42);
        for (int trial = 0; trial < 50; trial++) {
            int n = 1 + rnd.nextInt(200);
            double[] p = new double[n];
            double[] y = new double[n];
            for (int i = 0; i < n; i++) {
                // Valeurs arrondies pour provoquer des ex aequo
                p[i] = Math.round(rnd.nextDouble() * 20) / 20.0;
                y[i] = rnd.nextBoolean() ? 1.0 : 0.0;
            }

            IsotonicCalibrator model = fitter.fit(p, y);

            for (int k = 1; k < model.size(); k++) {
                assertThat(model.ys()[k]).isGreaterThanOrEqualTo(model.ys()[k - 1]);
                assertThat(model.xs()[k]).isGreaterThanOrEqualTo(model.xs()[k - 1]);
            }
        }
    }

    @Test
    @DisplayName("PAV fusionne les voisins en violation et interpole entre les noeuds")
    void shouldPoolAdjacentViolators() {
        double[] p = {0.1, 0.2, 0.3, 0.4};
        double[] y = {1, 0, 1, 1};

        IsotonicCalibrator model = fitter.fit(p, y);

        assertThat(model.xs()).containsExactly(new double[]{0.15, 0.3, 0.4}, within(1e-12));
        assertThat(model.ys()).containsExactly(new double[]{0.5, 1.0, 1.0}, within(1e-12));
        assertThat(model.apply(0.05)).isEqualTo(0.5);
        assertThat(model.apply(0.225)).isCloseTo(0.75, within(1e-12));
        assertThat(model.apply(0.99)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Entrée vide : aucun noeud, l'application renvoie l'entrée bornée")
    void emptyInputShouldGiveClampedIdentity() {
        IsotonicCalibrator model = fitter.fit(new double[0], new double[0]);

        assertThat(model.isEmpty()).isTrue();
        assertThat(model.apply(0.3)).isEqualTo(0.3);
        assertThat(model.apply(1.5)).isEqualTo(1.0);
        assertThat(model.apply(-0.2)).isEqualTo(0.0);
    }

    @Test
    void singlePointShouldGiveConstantModel() {
        IsotonicCalibrator model = fitter.fit(new double[]{0.4}, new double[]{1});

        assertThat(model.size()).isEqualTo(1);
        assertThat(model.apply(0.1)).isEqualTo(1.0);
        assertThat(model.apply(0.9)).isEqualTo(1.0);
    }

    @Test
    void nanInputShouldPropagate() {
        IsotonicCalibrator model = fitter.fit(new double[]{0.2, 0.8}, new double[]{0, 1});

        assertThat(model.apply(Double.NaN)).isNaN();
    }

    @Test
    void shouldRejectMismatchedLengths() {
        assertThatThrownBy(() -> fitter.fit(new double[]{0.1, 0.2}, new double[]{1}))
                .isInstanceOf(ShapeMismatchException.class);
    }
}
