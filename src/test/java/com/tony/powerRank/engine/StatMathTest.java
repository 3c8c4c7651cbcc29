package com.tony.powerRank.engine;

import com.tony.powerRank.config.NormMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StatMathTest {

    @Test
    @DisplayName("Devrait renvoyer le point milieu quand l'échantillon est trop petit ou constant")
    void shouldReturnMidpointForDegenerateSamples() {
        assertThat(StatMath.percentile(new double[]{3.0})).containsExactly(0.5);
        assertThat(StatMath.spreadPercentile(new double[]{2.0, 2.0, 2.0})).containsExactly(0.5, 0.5, 0.5);
        assertThat(StatMath.zSigmoid(new double[]{1.0, 1.0})).containsExactly(0.5, 0.5);
    }

    @Test
    @DisplayName("Devrait étaler le percentile de 0 à 1 en conservant l'ordre")
    void shouldSpreadPercentile() {
        double[] pct = StatMath.spreadPercentile(new double[]{10, 30, 20});

        assertThat(pct).containsExactly(0.0, 1.0, 0.5);
    }

    @Test
    @DisplayName("Devrait donner le même percentile moyen aux ex-aequo")
    void shouldAverageTiedRanks() {
        double[] pct = StatMath.percentile(new double[]{1, 2, 2, 4});

        assertThat(pct[1]).isEqualTo(pct[2]);
        assertThat(pct[1]).isCloseTo(2.5 / 4, within(1e-12));
        assertThat(pct[3]).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Devrait centrer le z-score sigmoïde sur 0.5")
    void shouldCenterZScore() {
        double[] z = StatMath.normalize(new double[]{-1, 0, 1}, NormMode.ZSCORE);

        assertThat(z[1]).isCloseTo(0.5, within(1e-12));
        assertThat(z[0] + z[2]).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("Devrait écrêter uniquement les valeurs au-delà de z écarts-types")
    void shouldClipOutliers() {
        double[] values = {1, 1, 1, 1, 1, 1, 1, 1, 1, 20};

        double[] clipped = StatMath.clipToZ(values, 2.0);

        assertThat(clipped[9]).isLessThan(20.0);
        assertThat(clipped[0]).isEqualTo(1.0);
        // Moins de 3 valeurs : inchangé
        assertThat(StatMath.clipToZ(new double[]{0, 100}, 0.1)).containsExactly(0, 100);
    }
}
