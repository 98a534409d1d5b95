package com.auditsentinel.core.model;

import java.time.Instant;

/**
 * One per-detector performance row, appended to the result store for every
 * detector that was scheduled in a run, whether or not fusion kept its
 * candidates.
 *
 * @since 1.0.0
 */
public class DetectorPerformance {

    private String runId;
    private String detectorName;
    private DetectorStatus status;
    private int datasetSize;
    private long executionTimeMs;
    private int candidateCount;
    private Instant evaluatedAt;

    /** No-arg constructor required by Jackson. */
    public DetectorPerformance() {
    }

    public DetectorPerformance(String runId, DetectorRunResult result, int datasetSize) {
        this.runId = runId;
        this.detectorName = result.getDetectorName();
        this.status = result.getStatus();
        this.datasetSize = datasetSize;
        this.executionTimeMs = result.getExecutionTimeMs();
        this.candidateCount = result.getCandidateCount();
        this.evaluatedAt = result.getStartedAt();
    }

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }

    public String getDetectorName() {
        return detectorName;
    }

    public void setDetectorName(String detectorName) {
        this.detectorName = detectorName;
    }

    public DetectorStatus getStatus() {
        return status;
    }

    public void setStatus(DetectorStatus status) {
        this.status = status;
    }

    public int getDatasetSize() {
        return datasetSize;
    }

    public void setDatasetSize(int datasetSize) {
        this.datasetSize = datasetSize;
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    public void setExecutionTimeMs(long executionTimeMs) {
        this.executionTimeMs = executionTimeMs;
    }

    public int getCandidateCount() {
        return candidateCount;
    }

    public void setCandidateCount(int candidateCount) {
        this.candidateCount = candidateCount;
    }

    public Instant getEvaluatedAt() {
        return evaluatedAt;
    }

    public void setEvaluatedAt(Instant evaluatedAt) {
        this.evaluatedAt = evaluatedAt;
    }

    @Override
    public String toString() {
        return "DetectorPerformance{" +
                "runId='" + runId + '\'' +
                ", detector='" + detectorName + '\'' +
                ", status=" + status +
                ", candidates=" + candidateCount +
                ", executionTimeMs=" + executionTimeMs +
                '}';
    }
}
