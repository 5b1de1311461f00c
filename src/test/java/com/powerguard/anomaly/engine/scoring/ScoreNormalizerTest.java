package com.powerguard.anomaly.engine.scoring;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScoreNormalizerTest {

    private final ScoreNormalizer normalizer = new ScoreNormalizer();

    @Test
    void minMapsToZero_maxMapsToOne() {
        double[] normalized = normalizer.normalize(new double[]{-0.2, 0.1, 0.4});

        assertThat(normalized[0]).isEqualTo(0.0);
        assertThat(normalized[1]).isCloseTo(0.5, within(1e-12));
        assertThat(normalized[2]).isEqualTo(1.0);
    }

    @Test
    void preservesOrder() {
        double[] raw = {3.2, -1.0, 7.5, 0.0, 7.4, 2.2};
        double[] normalized = normalizer.normalize(raw);

        for (int i = 0; i < raw.length; i++) {
            for (int j = 0; j < raw.length; j++) {
                if (raw[i] > raw[j]) {
                    assertThat(normalized[i]).isGreaterThanOrEqualTo(normalized[j]);
                }
            }
        }
    }

    @Test
    void singleScore_normalizesToZero() {
        assertThat(normalizer.normalize(new double[]{0.83})).containsExactly(0.0);
    }

    @Test
    void equalScores_normalizeToZero() {
        assertThat(normalizer.normalize(new double[]{0.4, 0.4, 0.4})).containsExactly(0.0, 0.0, 0.0);
    }

    @Test
    void emptyBatch_returnsEmpty() {
        assertThat(normalizer.normalize(new double[0])).isEmpty();
    }

    @Test
    void nonFiniteScore_rejected() {
        assertThatThrownBy(() -> normalizer.normalize(new double[]{0.1, Double.NaN}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("index 1");
    }
}
