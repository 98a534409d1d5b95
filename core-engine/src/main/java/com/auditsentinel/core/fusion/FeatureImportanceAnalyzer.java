package com.auditsentinel.core.fusion;

import com.auditsentinel.core.detection.model.IsolationForest;
import com.auditsentinel.core.feature.FeatureBatch;
import com.auditsentinel.core.feature.FeatureStatistics;
import com.auditsentinel.core.model.FeatureImportance;
import com.auditsentinel.core.model.IntegratedAnomaly;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Explains which features drove the anomalies of a run.
 *
 * <p>
 * An isolation forest is trained on the robust-scaled batch; for every
 * anomalous record each feature is credited with the drop in isolation score
 * when it alone is replaced by its batch mean. Credits are averaged over the
 * anomalies, normalised to sum to 1, and the top features reported.
 * </p>
 *
 * @since 1.0.0
 */
public class FeatureImportanceAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(FeatureImportanceAnalyzer.class);

    public static final String METHOD = "isolation_forest_contribution";

    static final int DEFAULT_TOP_FEATURES = 20;

    private final int topFeatures;
    private final int numTrees;
    private final long seed;

    public FeatureImportanceAnalyzer() {
        this(DEFAULT_TOP_FEATURES, 100, 42L);
    }

    public FeatureImportanceAnalyzer(int topFeatures, int numTrees, long seed) {
        if (topFeatures < 1 || numTrees < 1) {
            throw new IllegalArgumentException("topFeatures and numTrees must be >= 1");
        }
        this.topFeatures = topFeatures;
        this.numTrees = numTrees;
        this.seed = seed;
    }

    /**
     * @param batch     features of the run
     * @param anomalies fused anomalies of the run
     * @return importance ranking, or {@link FeatureImportance#empty()} when
     *         there is nothing to attribute
     */
    public FeatureImportance analyze(FeatureBatch batch, List<IntegratedAnomaly> anomalies) {
        if (batch.size() < 2 || anomalies.isEmpty()) {
            return FeatureImportance.empty();
        }

        double[][] scaled = FeatureStatistics.robustScale(batch.toMatrix());
        double[] means = FeatureStatistics.columnMeans(scaled);
        IsolationForest forest = IsolationForest.train(scaled, numTrees, scaled.length, seed);

        Set<String> flagged = anomalies.stream().map(IntegratedAnomaly::getRecordId).collect(Collectors.toSet());
        double[] totals = new double[batch.dimensions()];
        int attributed = 0;
        for (int i = 0; i < batch.size(); i++) {
            if (!flagged.contains(batch.recordId(i))) {
                continue;
            }
            double[] contributions = forest.featureContributions(scaled[i], means);
            for (int f = 0; f < totals.length; f++) {
                totals[f] += contributions[f];
            }
            attributed++;
        }

        double sum = 0.0;
        for (double t : totals) {
            sum += t;
        }
        if (attributed == 0 || !(sum > 0)) {
            LOG.debug("No feature contributions to attribute for {} anomaly(ies)", anomalies.size());
            return FeatureImportance.empty();
        }

        List<String> names = batch.getFeatureNames();
        Map<String, Double> normalised = new HashMap<>();
        for (int f = 0; f < totals.length; f++) {
            normalised.put(names.get(f), totals[f] / sum);
        }

        List<Map.Entry<String, Double>> ranked = new ArrayList<>();
        normalised.entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(topFeatures)
                .forEach(e -> ranked.add(new AbstractMap.SimpleImmutableEntry<>(e.getKey(), e.getValue())));
        return new FeatureImportance(METHOD, ranked);
    }
}
