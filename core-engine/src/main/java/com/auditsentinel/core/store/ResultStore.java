package com.auditsentinel.core.store;

import com.auditsentinel.core.model.DetectionRun;
import com.auditsentinel.core.model.DetectorPerformance;
import com.auditsentinel.core.model.ExpertFeedback;
import com.auditsentinel.core.model.IntegratedAnomaly;

import java.util.List;
import java.util.Optional;

/**
 * Append-mostly store for the outputs of detection runs and the feedback
 * experts give on them.
 *
 * <p>
 * Used for tuning, never on the scoring path. Implementations must be safe
 * for concurrent use and report write failures as
 * {@link com.auditsentinel.core.exception.PersistenceException}.
 * </p>
 *
 * @since 1.0.0
 */
public interface ResultStore {

    void appendRun(DetectionRun run);

    void appendAnomalies(List<IntegratedAnomaly> anomalies);

    void appendPerformance(List<DetectorPerformance> performance);

    void appendFeedback(ExpertFeedback feedback);

    List<DetectionRun> listRuns();

    /**
     * @return anomalies of one run, in ranking order
     */
    List<IntegratedAnomaly> findAnomalies(String runId);

    Optional<IntegratedAnomaly> findAnomaly(String anomalyId);

    List<DetectorPerformance> listPerformance();

    /**
     * @return feedback on one anomaly, oldest first
     */
    List<ExpertFeedback> findFeedback(String anomalyId);

    List<ExpertFeedback> listFeedback();
}
