package com.powerguard.anomaly.engine.features;

import com.powerguard.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PopulationBaselineTest {

    @Test
    void zScore_usesPopulationStdDev() {
        PopulationBaseline baseline = PopulationBaseline.of(List.of(
                TestDataFactory.features(1.0, 0, 0.1, 0, 0),
                TestDataFactory.features(3.0, 0, 0.3, 0, 0)));

        assertThat(baseline.mean(Feature.HOURLY_AVG)).isEqualTo(2.0);
        assertThat(baseline.stdDev(Feature.HOURLY_AVG)).isEqualTo(1.0);
        assertThat(baseline.zScore(Feature.HOURLY_AVG, 3.0)).isEqualTo(1.0);
        assertThat(baseline.zScore(Feature.NIGHT_RATIO, 0.1)).isCloseTo(-1.0, within(1e-9));
    }

    @Test
    void constantFeature_hasZeroZScore() {
        PopulationBaseline baseline = PopulationBaseline.of(List.of(
                TestDataFactory.features(1.0, 2.0, 0.1, 0.2, 0.3),
                TestDataFactory.features(1.0, 2.0, 0.1, 0.2, 0.3)));

        for (Feature feature : Feature.values()) {
            assertThat(baseline.zScore(feature, 5.0)).isEqualTo(0.0);
        }
    }

    @Test
    void referenceVector_breaksTwoMeterSymmetry() {
        FeatureVector a = TestDataFactory.features(1.0, 0.0, 0.25, 0.1, 0.3);
        FeatureVector b = TestDataFactory.features(1.0, 20.0, 0.80, 0.1, 0.3);
        FeatureVector reference = TestDataFactory.features(1.0, 0.0, 0.25, 0.1, 0.3);

        PopulationBaseline baseline = PopulationBaseline.of(List.of(a, b), reference);

        assertThat(baseline.zScore(Feature.NIGHT_RATIO, a.getNightRatio()))
                .isCloseTo(-Math.sqrt(2) / 2, within(1e-9));
        assertThat(baseline.zScore(Feature.NIGHT_RATIO, b.getNightRatio()))
                .isCloseTo(Math.sqrt(2), within(1e-9));
    }
}
