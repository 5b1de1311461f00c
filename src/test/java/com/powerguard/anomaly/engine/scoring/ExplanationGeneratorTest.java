package com.powerguard.anomaly.engine.scoring;

import com.powerguard.anomaly.engine.features.Feature;
import com.powerguard.anomaly.engine.features.FeatureVector;
import com.powerguard.anomaly.engine.features.PopulationBaseline;
import com.powerguard.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExplanationGeneratorTest {

    private ExplanationGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new ExplanationGenerator(TestDataFactory.detectionConfig());
    }

    @Test
    void suspicious_namesTopDeviatingFeatures() {
        FeatureVector nightUser = TestDataFactory.features(1.0, 30.0, 0.9, 0.25, 0.3);
        List<FeatureVector> population = List.of(
                TestDataFactory.features(1.0, 4.0, 0.10, 0.25, 0.3),
                TestDataFactory.features(1.0, 4.2, 0.12, 0.25, 0.3),
                TestDataFactory.features(1.0, 3.8, 0.11, 0.25, 0.3),
                TestDataFactory.features(1.0, 4.1, 0.09, 0.25, 0.3),
                nightUser);

        String text = generator.explain(nightUser, PopulationBaseline.of(population), true);

        assertThat(text).startsWith("Unusually high");
        assertThat(text).contains("night-time usage");
        assertThat(text).contains("day-to-day consumption variability");
        assertThat(text).contains("relative to peers");
        assertThat(text).contains("night_ratio z=+");
    }

    @Test
    void lowDeviation_describedAsUnusuallyLow() {
        FeatureVector quiet = TestDataFactory.features(0.1, 4.0, 0.1, 0.25, 0.3);
        List<FeatureVector> population = List.of(
                TestDataFactory.features(1.0, 4.0, 0.1, 0.25, 0.3),
                TestDataFactory.features(1.1, 4.0, 0.1, 0.25, 0.3),
                TestDataFactory.features(0.9, 4.0, 0.1, 0.25, 0.3),
                quiet);

        String text = generator.explain(quiet, PopulationBaseline.of(population), true);

        assertThat(text).isEqualTo(
                "Unusually low average consumption relative to peers (hourly_avg z=-1.70).");
    }

    @Test
    void notSuspicious_saysWithinNormalBoundsEvenWithDeviation() {
        FeatureVector nightUser = TestDataFactory.features(1.0, 30.0, 0.9, 0.25, 0.3);
        PopulationBaseline baseline = PopulationBaseline.of(List.of(
                TestDataFactory.features(1.0, 4.0, 0.1, 0.25, 0.3), nightUser));

        assertThat(generator.explain(nightUser, baseline, false))
                .isEqualTo(ExplanationGenerator.WITHIN_NORMAL);
    }

    @Test
    void noDeviation_givesGenericText() {
        FeatureVector v = TestDataFactory.features(1.0, 4.0, 0.1, 0.25, 0.3);
        PopulationBaseline baseline = PopulationBaseline.of(List.of(v, v));

        assertThat(generator.explain(v, baseline, true))
                .isEqualTo(ExplanationGenerator.NO_DOMINANT_FEATURE);
    }

    @Test
    void equalDeviations_rankedInFeatureOrder() {
        // Two meters: every varying feature has |z| = 1
        FeatureVector a = TestDataFactory.features(1.0, 2.0, 0.1, 0.2, 0.3);
        FeatureVector b = TestDataFactory.features(2.0, 4.0, 0.3, 0.1, 0.3);
        PopulationBaseline baseline = PopulationBaseline.of(List.of(a, b));

        List<ExplanationGenerator.Deviation> ranked = generator.rank(b, baseline);

        assertThat(ranked).extracting(ExplanationGenerator.Deviation::feature).containsExactly(
                Feature.HOURLY_AVG, Feature.DAILY_VARIANCE, Feature.NIGHT_RATIO,
                Feature.PEAK_RATIO, Feature.WEEKEND_RATIO);
        assertThat(ranked.get(3).z()).isLessThan(0);
    }

    @Test
    void secondFeature_omittedBelowMinimumZ() {
        FeatureVector target = TestDataFactory.features(1.0, 4.0, 0.9, 0.253, 0.3);
        List<FeatureVector> population = List.of(
                TestDataFactory.features(1.0, 4.0, 0.10, 0.25, 0.3),
                TestDataFactory.features(1.0, 4.0, 0.12, 0.25, 0.3),
                TestDataFactory.features(1.0, 4.0, 0.11, 0.26, 0.3),
                TestDataFactory.features(1.0, 4.0, 0.09, 0.24, 0.3),
                target);

        String text = generator.explain(target, PopulationBaseline.of(population), true);

        assertThat(text).contains("night-time usage");
        assertThat(text).doesNotContain(" and ");
    }
}
