package com.auditsentinel.core.detection;

import com.auditsentinel.core.detection.model.LogisticClassifier;
import com.auditsentinel.core.detection.model.ModelHandles;
import com.auditsentinel.core.feature.FeatureBatch;
import com.auditsentinel.core.model.AnomalyCandidate;
import com.auditsentinel.core.model.AnomalyType;
import com.auditsentinel.core.model.DetectorConfig;
import com.auditsentinel.core.model.DetectorType;
import com.auditsentinel.core.model.FeatureVector;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Scores records with a previously fitted {@link LogisticClassifier} and
 * flags those whose anomaly probability exceeds the detector threshold.
 *
 * <p>
 * Without a registered model the detector is skipped, never failed.
 * </p>
 *
 * @since 1.0.0
 */
public class SupervisedClassifierDetector implements AnomalyDetector {

    private final String name;
    private final double threshold;

    public SupervisedClassifierDetector(DetectorConfig config) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        this.name = Objects.requireNonNull(config.getName(), "Detector name must not be null");
        this.threshold = config.getThreshold();
        if (!(threshold >= 0 && threshold < 1)) {
            throw new IllegalArgumentException("threshold must be in [0, 1), got: " + threshold);
        }
    }

    @Override
    public List<AnomalyCandidate> detect(FeatureBatch batch, ModelHandles models) {
        LogisticClassifier classifier = models.require(name, LogisticClassifier.class);

        List<AnomalyCandidate> candidates = new ArrayList<>();
        for (FeatureVector vector : batch.getVectors()) {
            double probability = classifier.probability(vector);
            if (probability > threshold) {
                candidates.add(AnomalyCandidate.builder()
                        .recordId(vector.getRecordId())
                        .detectorName(name)
                        .rawScore(probability)
                        .confidence(probability)
                        .anomalyType(AnomalyType.BUSINESS)
                        .explanation(String.format("classifier probability %.3f > %.2f", probability, threshold))
                        .build());
            }
        }
        return candidates;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public DetectorType getType() {
        return DetectorType.SUPERVISED_CLASSIFIER;
    }

    @Override
    public boolean requiresFittedModel() {
        return true;
    }
}
