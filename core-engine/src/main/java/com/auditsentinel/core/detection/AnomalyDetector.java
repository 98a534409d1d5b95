package com.auditsentinel.core.detection;

import com.auditsentinel.core.detection.model.ModelHandles;
import com.auditsentinel.core.exception.ModelUnavailableException;
import com.auditsentinel.core.feature.FeatureBatch;
import com.auditsentinel.core.model.AnomalyCandidate;
import com.auditsentinel.core.model.DetectorType;

import java.util.List;

/**
 * Contract for all anomaly detectors.
 * <p>
 * A detector scores a whole batch at once and returns one candidate per
 * record it considers anomalous. Implementations hold only their
 * configuration; anything trained on a batch lives for that call, and fitted
 * models arrive through {@link ModelHandles}. Detectors must not modify the
 * batch, which is shared with the other detectors of the run.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Score a batch.
     *
     * @param batch  features of the run, non-empty
     * @param models fitted models available to this run
     * @return candidates, at most one per record; empty if nothing is flagged
     * @throws ModelUnavailableException if the detector needs a model that is
     *                                   not registered
     */
    List<AnomalyCandidate> detect(FeatureBatch batch, ModelHandles models);

    /**
     * @return configured detector name, unique within an engine configuration
     */
    String getName();

    DetectorType getType();

    /**
     * @return {@code true} if this detector cannot run without a previously
     *         fitted model
     */
    boolean requiresFittedModel();
}
