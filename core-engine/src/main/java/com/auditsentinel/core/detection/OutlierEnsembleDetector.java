package com.auditsentinel.core.detection;

import com.auditsentinel.core.detection.model.IsolationForest;
import com.auditsentinel.core.detection.model.ModelHandles;
import com.auditsentinel.core.feature.FeatureBatch;
import com.auditsentinel.core.feature.FeatureStatistics;
import com.auditsentinel.core.model.AnomalyCandidate;
import com.auditsentinel.core.model.AnomalyType;
import com.auditsentinel.core.model.DetectorConfig;
import com.auditsentinel.core.model.DetectorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Unsupervised tree-ensemble detector backed by an {@link IsolationForest}
 * trained on the current batch.
 *
 * <h3>Decision</h3>
 * <p>
 * With {@code s(x)} the isolation score, the decision value is
 * {@code -s(x) - offset} where {@code offset} is the contamination percentile
 * of {@code -s} over the batch. Records with a negative decision are flagged,
 * with confidence {@code 1 / (1 + exp(steepness * decision))}, so a record
 * right at the cutoff gets 0.5 and clearer outliers approach 1.
 * </p>
 *
 * <h3>Parameters</h3>
 * <ul>
 * <li>{@code numTrees} (default {@value #DEFAULT_TREES})</li>
 * <li>{@code sampleSize} (default {@value #DEFAULT_SAMPLE_SIZE})</li>
 * <li>{@code seed} (default {@value #DEFAULT_SEED})</li>
 * <li>{@code steepness} (default {@value #DEFAULT_STEEPNESS})</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class OutlierEnsembleDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(OutlierEnsembleDetector.class);

    static final int DEFAULT_TREES = 100;
    static final int DEFAULT_SAMPLE_SIZE = 256;
    static final long DEFAULT_SEED = 42L;
    static final double DEFAULT_STEEPNESS = 10.0;

    private final String name;
    private final double contamination;
    private final int numTrees;
    private final int sampleSize;
    private final long seed;
    private final double steepness;

    /**
     * @param config        detector configuration
     * @param contamination expected anomaly share in (0, 0.5]
     * @throws IllegalArgumentException if a parameter is out of range
     */
    public OutlierEnsembleDetector(DetectorConfig config, double contamination) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        this.name = Objects.requireNonNull(config.getName(), "Detector name must not be null");
        this.contamination = contamination;
        this.numTrees = config.intParameter("numTrees", DEFAULT_TREES);
        this.sampleSize = config.intParameter("sampleSize", DEFAULT_SAMPLE_SIZE);
        this.seed = config.longParameter("seed", DEFAULT_SEED);
        this.steepness = config.doubleParameter("steepness", DEFAULT_STEEPNESS);

        if (!(contamination > 0 && contamination <= 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got: " + contamination);
        }
        if (numTrees < 1 || sampleSize < 2) {
            throw new IllegalArgumentException("numTrees must be >= 1 and sampleSize >= 2 for detector '"
                    + name + "'");
        }
        if (!(steepness > 0)) {
            throw new IllegalArgumentException("steepness must be > 0 for detector '" + name + "'");
        }
    }

    @Override
    public List<AnomalyCandidate> detect(FeatureBatch batch, ModelHandles models) {
        if (batch.size() < 2) {
            LOG.debug("Detector [{}]: batch of {} cannot be isolated, skipping", name, batch.size());
            return List.of();
        }

        double[][] scaled = FeatureStatistics.robustScale(batch.toMatrix());
        IsolationForest forest = IsolationForest.train(scaled, numTrees, sampleSize, seed);
        double[] scores = forest.anomalyScores(scaled);

        double[] negated = new double[scores.length];
        for (int i = 0; i < scores.length; i++) {
            negated[i] = -scores[i];
        }
        double offset = FeatureStatistics.percentile(negated, 100.0 * contamination);

        List<AnomalyCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            double decision = negated[i] - offset;
            if (decision >= 0) {
                continue;
            }
            double confidence = 1.0 / (1.0 + Math.exp(steepness * decision));
            LOG.debug("Detector [{}] flagged {}: score={} decision={}", name, batch.recordId(i), scores[i],
                    decision);
            candidates.add(AnomalyCandidate.builder()
                    .recordId(batch.recordId(i))
                    .detectorName(name)
                    .rawScore(scores[i])
                    .confidence(confidence)
                    .anomalyType(AnomalyType.STATISTICAL)
                    .explanation(String.format("isolation score %.3f above the %.0f%% contamination cutoff",
                            scores[i], contamination * 100))
                    .build());
        }
        return candidates;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public DetectorType getType() {
        return DetectorType.OUTLIER_ENSEMBLE;
    }

    @Override
    public boolean requiresFittedModel() {
        return false;
    }
}
