package com.auditsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one detection run, returned to the caller and consumed by the
 * report renderer (which reads only {@link #getAnomalies()}).
 *
 * <p>
 * A report either carries results ({@link ReportStatus#SUCCESS} or
 * {@link ReportStatus#DEGRADED}) or a single structured {@link ReportError}
 * ({@link ReportStatus#ERROR} or {@link ReportStatus#CANCELLED}); callers
 * never need to guess whether a result is partial.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DetectionReport {

    private final String runId;
    private final ReportStatus status;
    private final ReportError error;
    private final int totalRecords;
    private final List<IntegratedAnomaly> anomalies;
    private final Map<String, DetectorRunResult> detectorResults;
    private final Map<String, Double> performanceMetrics;
    private final FeatureImportance featureImportance;
    private final Instant startedAt;
    private final Instant completedAt;
    private final boolean persisted;
    private final String persistenceError;

    private DetectionReport(Builder b) {
        this.runId = b.runId;
        this.status = Objects.requireNonNull(b.status, "status must not be null");
        this.error = b.error;
        this.totalRecords = b.totalRecords;
        this.anomalies = b.anomalies != null ? List.copyOf(b.anomalies) : List.of();
        this.detectorResults = b.detectorResults != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(b.detectorResults))
                : Map.of();
        this.performanceMetrics = b.performanceMetrics != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(b.performanceMetrics))
                : Map.of();
        this.featureImportance = b.featureImportance;
        this.startedAt = b.startedAt;
        this.completedAt = b.completedAt;
        this.persisted = b.persisted;
        this.persistenceError = b.persistenceError;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build a report for a run that was aborted before fusion.
     *
     * @param runId        run identifier
     * @param status       {@link ReportStatus#ERROR} or {@link ReportStatus#CANCELLED}
     * @param code         machine-readable error code
     * @param message      human-readable message
     * @param totalRecords number of records received
     * @param startedAt    run start
     * @return the error report
     */
    public static DetectionReport failure(String runId, ReportStatus status, String code, String message,
            int totalRecords, Instant startedAt) {
        return builder()
                .runId(runId)
                .status(status)
                .error(new ReportError(code, message))
                .totalRecords(totalRecords)
                .startedAt(startedAt)
                .completedAt(Instant.now())
                .build();
    }

    /**
     * Fluent builder for {@link DetectionReport}.
     */
    public static class Builder {
        private String runId;
        private ReportStatus status;
        private ReportError error;
        private int totalRecords;
        private List<IntegratedAnomaly> anomalies;
        private Map<String, DetectorRunResult> detectorResults;
        private Map<String, Double> performanceMetrics;
        private FeatureImportance featureImportance;
        private Instant startedAt;
        private Instant completedAt;
        private boolean persisted;
        private String persistenceError;

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder status(ReportStatus status) {
            this.status = status;
            return this;
        }

        public Builder error(ReportError error) {
            this.error = error;
            return this;
        }

        public Builder totalRecords(int totalRecords) {
            this.totalRecords = totalRecords;
            return this;
        }

        public Builder anomalies(List<IntegratedAnomaly> anomalies) {
            this.anomalies = anomalies;
            return this;
        }

        public Builder detectorResults(Map<String, DetectorRunResult> detectorResults) {
            this.detectorResults = detectorResults;
            return this;
        }

        public Builder performanceMetrics(Map<String, Double> performanceMetrics) {
            this.performanceMetrics = performanceMetrics;
            return this;
        }

        public Builder featureImportance(FeatureImportance featureImportance) {
            this.featureImportance = featureImportance;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder persisted(boolean persisted) {
            this.persisted = persisted;
            return this;
        }

        public Builder persistenceError(String persistenceError) {
            this.persistenceError = persistenceError;
            return this;
        }

        public DetectionReport build() {
            return new DetectionReport(this);
        }
    }

    /**
     * Copy this report with the outcome of persisting it.
     */
    public DetectionReport withPersistence(boolean persisted, String persistenceError) {
        return builder()
                .runId(runId)
                .status(status)
                .error(error)
                .totalRecords(totalRecords)
                .anomalies(anomalies)
                .detectorResults(detectorResults)
                .performanceMetrics(performanceMetrics)
                .featureImportance(featureImportance)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .persisted(persisted)
                .persistenceError(persistenceError)
                .build();
    }

    public String getRunId() {
        return runId;
    }

    public ReportStatus getStatus() {
        return status;
    }

    public ReportError getError() {
        return error;
    }

    public int getTotalRecords() {
        return totalRecords;
    }

    public int getAnomaliesFound() {
        return anomalies.size();
    }

    public List<IntegratedAnomaly> getAnomalies() {
        return anomalies;
    }

    public Map<String, DetectorRunResult> getDetectorResults() {
        return detectorResults;
    }

    public Map<String, Double> getPerformanceMetrics() {
        return performanceMetrics;
    }

    public FeatureImportance getFeatureImportance() {
        return featureImportance;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public boolean isPersisted() {
        return persisted;
    }

    public String getPersistenceError() {
        return persistenceError;
    }

    @Override
    public String toString() {
        return "DetectionReport{" +
                "runId='" + runId + '\'' +
                ", status=" + status +
                ", totalRecords=" + totalRecords +
                ", anomaliesFound=" + anomalies.size() +
                (error != null ? ", error=" + error : "") +
                '}';
    }

    /**
     * Structured error carried by a failed or cancelled report.
     */
    public static final class ReportError {
        private final String code;
        private final String message;

        public ReportError(String code, String message) {
            this.code = Objects.requireNonNull(code, "code must not be null");
            this.message = message;
        }

        public String getCode() {
            return code;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return code + ": " + message;
        }
    }
}
