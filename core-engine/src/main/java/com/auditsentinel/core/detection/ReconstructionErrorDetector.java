package com.auditsentinel.core.detection;

import com.auditsentinel.core.detection.model.ModelHandles;
import com.auditsentinel.core.detection.model.PcaReconstructionModel;
import com.auditsentinel.core.exception.DetectorExecutionException;
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
 * Auto-encoding detector: records a {@link PcaReconstructionModel} cannot
 * reconstruct well are flagged.
 *
 * <p>
 * The cutoff is the {@code 100 * (1 - contamination)} percentile of the
 * batch's reconstruction errors; a flagged record's confidence is
 * {@code min(error / cutoff, 3) / 3}. By default ({@code fitOnBatch: true})
 * the model is fitted on the robust-scaled batch with {@code components}
 * principal components (default 2). With {@code fitOnBatch: false} the model
 * registered for this detector is used, and the detector is skipped when
 * there is none.
 * </p>
 *
 * @since 1.0.0
 */
public class ReconstructionErrorDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ReconstructionErrorDetector.class);

    /** Error-to-cutoff ratio that maps to full confidence. */
    static final double CONFIDENCE_CAP = 3.0;

    private final String name;
    private final double contamination;
    private final int components;
    private final boolean fitOnBatch;

    public ReconstructionErrorDetector(DetectorConfig config, double contamination) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        this.name = Objects.requireNonNull(config.getName(), "Detector name must not be null");
        this.contamination = contamination;
        this.components = config.intParameter("components", 2);
        this.fitOnBatch = config.booleanParameter("fitOnBatch", true);
        if (!(contamination > 0 && contamination <= 0.5)) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got: " + contamination);
        }
        if (components < 1) {
            throw new IllegalArgumentException("components must be >= 1, got: " + components);
        }
    }

    @Override
    public List<AnomalyCandidate> detect(FeatureBatch batch, ModelHandles models) {
        double[][] scaled = FeatureStatistics.robustScale(batch.toMatrix());
        PcaReconstructionModel model;
        if (fitOnBatch) {
            if (batch.size() < 2) {
                LOG.debug("Detector [{}]: batch of {} is too small to fit on, skipping", name, batch.size());
                return List.of();
            }
            model = PcaReconstructionModel.fit(batch.getFeatureNames(), scaled, components);
        } else {
            model = models.require(name, PcaReconstructionModel.class);
            if (!model.accepts(batch.getFeatureNames())) {
                throw new DetectorExecutionException("Registered model for detector '" + name
                        + "' was fitted on a different feature schema");
            }
        }

        double[] errors = model.reconstructionErrors(scaled);
        double cutoff = FeatureStatistics.percentile(errors, 100.0 * (1.0 - contamination));
        if (!(cutoff > 0)) {
            LOG.debug("Detector [{}]: reconstruction cutoff is 0, nothing to flag", name);
            return List.of();
        }

        List<AnomalyCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < errors.length; i++) {
            if (errors[i] <= cutoff) {
                continue;
            }
            double confidence = Math.min(errors[i] / cutoff, CONFIDENCE_CAP) / CONFIDENCE_CAP;
            candidates.add(AnomalyCandidate.builder()
                    .recordId(batch.recordId(i))
                    .detectorName(name)
                    .rawScore(errors[i])
                    .confidence(confidence)
                    .anomalyType(AnomalyType.PATTERN)
                    .explanation(String.format("reconstruction error %.4f exceeds cutoff %.4f", errors[i], cutoff))
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
        return DetectorType.RECONSTRUCTION_ERROR;
    }

    @Override
    public boolean requiresFittedModel() {
        return !fitOnBatch;
    }
}
