package com.auditsentinel.core.detection;

import com.auditsentinel.core.detection.model.Dbscan;
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
 * Flags records that fall outside every dense region of the (robust-scaled)
 * feature space.
 *
 * <p>
 * Membership is binary: every noise point gets the same
 * {@code baselineConfidence} and a raw score of 1. Parameters: {@code eps}
 * (default 0.5), {@code minSamples} (default 5), {@code baselineConfidence}
 * (default 0.8).
 * </p>
 *
 * @since 1.0.0
 */
public class DensityClusterDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DensityClusterDetector.class);

    private final String name;
    private final Dbscan dbscan;
    private final double baselineConfidence;

    public DensityClusterDetector(DetectorConfig config) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        this.name = Objects.requireNonNull(config.getName(), "Detector name must not be null");
        this.dbscan = new Dbscan(config.doubleParameter("eps", 0.5), config.intParameter("minSamples", 5));
        this.baselineConfidence = config.doubleParameter("baselineConfidence", 0.8);
        if (!(baselineConfidence >= 0 && baselineConfidence <= 1)) {
            throw new IllegalArgumentException("baselineConfidence must be in [0, 1], got: " + baselineConfidence);
        }
    }

    @Override
    public List<AnomalyCandidate> detect(FeatureBatch batch, ModelHandles models) {
        int[] labels = dbscan.fit(FeatureStatistics.robustScale(batch.toMatrix()));

        List<AnomalyCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] != Dbscan.NOISE) {
                continue;
            }
            candidates.add(AnomalyCandidate.builder()
                    .recordId(batch.recordId(i))
                    .detectorName(name)
                    .rawScore(1.0)
                    .confidence(baselineConfidence)
                    .anomalyType(AnomalyType.PATTERN)
                    .explanation("outside every dense cluster (eps=" + dbscan.getEps()
                            + ", minSamples=" + dbscan.getMinSamples() + ")")
                    .build());
        }
        LOG.debug("Detector [{}]: {} of {} record(s) are noise", name, candidates.size(), labels.length);
        return candidates;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public DetectorType getType() {
        return DetectorType.DENSITY_CLUSTER;
    }

    @Override
    public boolean requiresFittedModel() {
        return false;
    }
}
