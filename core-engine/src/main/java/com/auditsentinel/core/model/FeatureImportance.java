package com.auditsentinel.core.model;

import java.util.List;
import java.util.Map;

/**
 * Which features drove the anomalies of a run.
 *
 * @since 1.0.0
 */
public final class FeatureImportance {

    private final String analysisMethod;
    private final List<Map.Entry<String, Double>> topFeatures;

    public FeatureImportance(String analysisMethod, List<Map.Entry<String, Double>> topFeatures) {
        this.analysisMethod = analysisMethod;
        this.topFeatures = List.copyOf(topFeatures);
    }

    public static FeatureImportance empty() {
        return new FeatureImportance("none", List.of());
    }

    public String getAnalysisMethod() {
        return analysisMethod;
    }

    /**
     * @return feature name / normalised importance pairs, most important first
     */
    public List<Map.Entry<String, Double>> getTopFeatures() {
        return topFeatures;
    }

    @Override
    public String toString() {
        return "FeatureImportance{" + analysisMethod + ", " + topFeatures + '}';
    }
}
