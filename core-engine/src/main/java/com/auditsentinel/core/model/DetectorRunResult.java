package com.auditsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Raw result of one detector in one run: its candidates plus timing.
 *
 * @since 1.0.0
 */
public final class DetectorRunResult {

    private final String detectorName;
    private final DetectorStatus status;
    private final List<AnomalyCandidate> candidates;
    private final Instant startedAt;
    private final long executionTimeMs;
    private final String error;

    private DetectorRunResult(String detectorName, DetectorStatus status, List<AnomalyCandidate> candidates,
            Instant startedAt, long executionTimeMs, String error) {
        this.detectorName = Objects.requireNonNull(detectorName, "detectorName must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.candidates = List.copyOf(candidates);
        this.startedAt = startedAt;
        this.executionTimeMs = executionTimeMs;
        this.error = error;
    }

    public static DetectorRunResult success(String detectorName, List<AnomalyCandidate> candidates,
            Instant startedAt, long executionTimeMs) {
        return new DetectorRunResult(detectorName, DetectorStatus.SUCCESS, candidates, startedAt,
                executionTimeMs, null);
    }

    public static DetectorRunResult skipped(String detectorName, String reason, Instant startedAt,
            long executionTimeMs) {
        return new DetectorRunResult(detectorName, DetectorStatus.SKIPPED, List.of(), startedAt,
                executionTimeMs, reason);
    }

    public static DetectorRunResult failed(String detectorName, String error, Instant startedAt,
            long executionTimeMs) {
        return new DetectorRunResult(detectorName, DetectorStatus.FAILED, List.of(), startedAt,
                executionTimeMs, error);
    }

    public static DetectorRunResult timedOut(String detectorName, Instant startedAt, long executionTimeMs) {
        return new DetectorRunResult(detectorName, DetectorStatus.TIMED_OUT, List.of(), startedAt,
                executionTimeMs, "Detector did not finish within the run timeout");
    }

    public String getDetectorName() {
        return detectorName;
    }

    public DetectorStatus getStatus() {
        return status;
    }

    /**
     * @return {@code true} if the detector was skipped for lack of a fitted model
     */
    public boolean isSkipped() {
        return status == DetectorStatus.SKIPPED;
    }

    /**
     * @return {@code true} if the detector failed or timed out
     */
    @JsonIgnore
    public boolean isDegraded() {
        return status == DetectorStatus.FAILED || status == DetectorStatus.TIMED_OUT;
    }

    public List<AnomalyCandidate> getCandidates() {
        return candidates;
    }

    public int getCandidateCount() {
        return candidates.size();
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    /**
     * @return failure message or skip reason, {@code null} on success
     */
    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "DetectorRunResult{" +
                "detector='" + detectorName + '\'' +
                ", status=" + status +
                ", candidates=" + candidates.size() +
                ", executionTimeMs=" + executionTimeMs +
                '}';
    }
}
