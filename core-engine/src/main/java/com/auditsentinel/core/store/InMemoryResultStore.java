package com.auditsentinel.core.store;

import com.auditsentinel.core.model.DetectionRun;
import com.auditsentinel.core.model.DetectorPerformance;
import com.auditsentinel.core.model.ExpertFeedback;
import com.auditsentinel.core.model.IntegratedAnomaly;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link ResultStore} kept in memory; the default for tests and for
 * deployments that do not need history across restarts.
 *
 * @since 1.0.0
 */
public class InMemoryResultStore implements ResultStore {

    private final List<DetectionRun> runs = new CopyOnWriteArrayList<>();
    private final List<IntegratedAnomaly> anomalies = new CopyOnWriteArrayList<>();
    private final List<DetectorPerformance> performance = new CopyOnWriteArrayList<>();
    private final List<ExpertFeedback> feedback = new CopyOnWriteArrayList<>();

    @Override
    public void appendRun(DetectionRun run) {
        runs.add(Objects.requireNonNull(run, "run must not be null"));
    }

    @Override
    public void appendAnomalies(List<IntegratedAnomaly> batch) {
        anomalies.addAll(Objects.requireNonNull(batch, "anomalies must not be null"));
    }

    @Override
    public void appendPerformance(List<DetectorPerformance> rows) {
        performance.addAll(Objects.requireNonNull(rows, "performance must not be null"));
    }

    @Override
    public void appendFeedback(ExpertFeedback entry) {
        feedback.add(Objects.requireNonNull(entry, "feedback must not be null"));
    }

    @Override
    public List<DetectionRun> listRuns() {
        return List.copyOf(runs);
    }

    @Override
    public List<IntegratedAnomaly> findAnomalies(String runId) {
        return anomalies.stream().filter(a -> Objects.equals(a.getRunId(), runId)).toList();
    }

    @Override
    public Optional<IntegratedAnomaly> findAnomaly(String anomalyId) {
        return anomalies.stream().filter(a -> Objects.equals(a.getAnomalyId(), anomalyId)).findFirst();
    }

    @Override
    public List<DetectorPerformance> listPerformance() {
        return List.copyOf(performance);
    }

    @Override
    public List<ExpertFeedback> findFeedback(String anomalyId) {
        return feedback.stream().filter(f -> Objects.equals(f.getAnomalyId(), anomalyId)).toList();
    }

    @Override
    public List<ExpertFeedback> listFeedback() {
        return List.copyOf(feedback);
    }
}
