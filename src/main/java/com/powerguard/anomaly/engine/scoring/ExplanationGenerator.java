package com.powerguard.anomaly.engine.scoring;

import com.powerguard.anomaly.config.DetectionConfig;
import com.powerguard.anomaly.engine.features.Feature;
import com.powerguard.anomaly.engine.features.FeatureVector;
import com.powerguard.anomaly.engine.features.PopulationBaseline;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Templated justification for a meter's result.
 *
 * Suspicious meters name their one or two most deviating features (largest |z| against the run's
 * population baseline). Meters below the threshold are described as normal regardless of their z-scores.
 */
@Component
public class ExplanationGenerator {

    static final String WITHIN_NORMAL = "Consumption pattern within normal bounds relative to peers.";
    static final String NO_DOMINANT_FEATURE =
            "Consumption pattern differs from peers without a single dominant feature.";

    private static final double TIE_TOLERANCE = 1e-9;

    private final double secondaryMinZ;

    public ExplanationGenerator(DetectionConfig config) {
        this.secondaryMinZ = config.getExplanation().getSecondaryMinZ();
    }

    public String explain(FeatureVector features, PopulationBaseline baseline, boolean suspicious) {
        if (!suspicious) {
            return WITHIN_NORMAL;
        }

        List<Deviation> ranked = rank(features, baseline);
        Deviation top = ranked.get(0);
        if (Math.abs(top.z()) <= TIE_TOLERANCE) {
            return NO_DOMINANT_FEATURE;
        }

        List<Deviation> named = new ArrayList<>();
        named.add(top);
        if (ranked.size() > 1 && Math.abs(ranked.get(1).z()) >= secondaryMinZ) {
            named.add(ranked.get(1));
        }

        StringBuilder text = new StringBuilder();
        for (int i = 0; i < named.size(); i++) {
            if (i > 0) text.append(" and ");
            Deviation d = named.get(i);
            text.append(i == 0 ? "Unusually " : "unusually ")
                    .append(d.z() > 0 ? "high " : "low ")
                    .append(d.feature().getDescription());
        }
        text.append(" relative to peers (");
        for (int i = 0; i < named.size(); i++) {
            if (i > 0) text.append(", ");
            Deviation d = named.get(i);
            text.append(d.feature().getKey())
                    .append(" z=")
                    .append(String.format(Locale.ROOT, "%+.2f", d.z()));
        }
        return text.append(").").toString();
    }

    /**
     * Features by descending |z|. Values within the tie tolerance keep the fixed feature order.
     */
    List<Deviation> rank(FeatureVector features, PopulationBaseline baseline) {
        List<Deviation> deviations = new ArrayList<>(Feature.COUNT);
        for (Feature feature : Feature.values()) {
            deviations.add(new Deviation(feature, baseline.zScore(feature, features.get(feature))));
        }
        // Insertion sort: stable, and the tolerance comparison is not transitive enough for List.sort.
        for (int i = 1; i < deviations.size(); i++) {
            Deviation current = deviations.get(i);
            int j = i - 1;
            while (j >= 0 && Math.abs(current.z()) - Math.abs(deviations.get(j).z()) > TIE_TOLERANCE) {
                deviations.set(j + 1, deviations.get(j));
                j--;
            }
            deviations.set(j + 1, current);
        }
        return deviations;
    }

    record Deviation(Feature feature, double z) {}
}
