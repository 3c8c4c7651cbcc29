package com.tony.powerRank.engine.ml;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RandomForestRegressorTest {

    @Test
    @DisplayName("Devrait apprendre une fonction en escalier")
    void shouldLearnStepFunction() {
        // ARRANGE
        int n = 200;
        double[][] x = new double[n][];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            double v = i / (double) (n - 1);
            x[i] = new double[]{v};
            y[i] = v < 0.5 ? -1.0 : 2.0;
        }
        RandomForestRegressor model = new RandomForestRegressor(50, 18, 2, 42L);

        // ACT
        model.fit(x, y);

        // ASSERT
        assertThat(model.predict(x[20])).isCloseTo(-1.0, within(0.05));
        assertThat(model.predict(x[180])).isCloseTo(2.0, within(0.05));
    }

    @Test
    @DisplayName("Devrait capter une interaction que la régression linéaire manque")
    void shouldCaptureInteractionMissedByLinearModel() {
        // ARRANGE : y = 2 seulement quand les deux features dépassent 0.5
        double[][] x = new double[400][];
        double[] y = new double[400];
        int k = 0;
        for (int i = 0; i < 20; i++) {
            for (int j = 0; j < 20; j++) {
                double a = (i + 0.5) / 20;
                double b = (j + 0.5) / 20;
                x[k] = new double[]{a, b};
                y[k] = a > 0.5 && b > 0.5 ? 2.0 : 0.0;
                k++;
            }
        }
        RandomForestRegressor forest = new RandomForestRegressor(100, 18, 2, 42L);
        LinearResidualModel linear = new LinearResidualModel();

        // ACT
        forest.fit(x, y);
        linear.fit(x, y);

        // ASSERT
        double[] offDiagonal = {0.9, 0.1};
        assertThat(forest.predict(new double[]{0.9, 0.9})).isCloseTo(2.0, within(0.2));
        assertThat(forest.predict(offDiagonal)).isCloseTo(0.0, within(0.2));
        assertThat(Math.abs(linear.predict(offDiagonal))).isGreaterThan(0.3);
    }

    @Test
    @DisplayName("Devrait produire les mêmes prédictions à graine égale")
    void shouldBeDeterministicForSameSeed() {
        // ARRANGE
        double[][] x = new double[100][];
        double[] y = new double[100];
        for (int i = 0; i < 100; i++) {
            x[i] = new double[]{(i * 37 % 100) / 100.0, (i * 11 % 7) / 7.0};
            y[i] = 3 * x[i][0] - x[i][1] + ((i % 3) - 1) * 0.2;
        }
        RandomForestRegressor first = new RandomForestRegressor(40, 10, 2, 7L);
        RandomForestRegressor second = new RandomForestRegressor(40, 10, 2, 7L);

        // ACT
        first.fit(x, y);
        second.fit(x, y);

        // ASSERT
        assertThat(first.predictAll(x)).containsExactly(second.predictAll(x));
    }
}
