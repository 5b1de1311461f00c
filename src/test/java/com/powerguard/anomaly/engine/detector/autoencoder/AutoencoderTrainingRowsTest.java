package com.powerguard.anomaly.engine.detector.autoencoder;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class AutoencoderTrainingRowsTest {

    @Test
    void farthestRowFromMedian_isLeftOut() {
        double[][] rows = {
                {0.0, 0.1},
                {9.0, 9.0},
                {0.1, 0.0},
                {0.2, 0.1}
        };

        double[][] kept = AutoencoderDetector.trainingRows(rows, 0.1);

        assertThat(Arrays.asList(kept)).containsExactly(rows[0], rows[2], rows[3]);
    }

    @Test
    void twoRows_areBothKept() {
        double[][] rows = {{0.0}, {5.0}};

        assertThat(AutoencoderDetector.trainingRows(rows, 0.4)).isSameAs(rows);
    }

    @Test
    void zeroFraction_keepsEveryRow() {
        double[][] rows = {{0.0}, {0.1}, {50.0}};

        assertThat(AutoencoderDetector.trainingRows(rows, 0.0)).isSameAs(rows);
    }

    @Test
    void largeFraction_stillLeavesTwoRows() {
        double[][] rows = {{0.0}, {1.0}, {2.0}, {3.0}, {4.0}};

        assertThat(AutoencoderDetector.trainingRows(rows, 0.49)).hasNumberOfRows(3);
        assertThat(AutoencoderDetector.trainingRows(new double[][] {{0.0}, {1.0}, {2.0}}, 0.49))
                .hasNumberOfRows(2);
    }

    @Test
    void equalDistances_dropTheLaterRow() {
        double[][] rows = {{-1.0}, {0.0}, {1.0}};

        double[][] kept = AutoencoderDetector.trainingRows(rows, 0.1);

        assertThat(Arrays.asList(kept)).containsExactly(rows[0], rows[1]);
    }
}
