package com.auditsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The fused, ranked and explained anomaly surfaced to callers.
 *
 * <p>
 * Exactly one instance exists per flagged record in a run. Serialized to JSON
 * in detection reports and appended to the result store.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. It enforces that {@code recordId},
 * {@code severity} and {@code detectedAt} are present; omitting any of them
 * throws a {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public class IntegratedAnomaly implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Generated identifier, the key expert feedback refers to. */
    private String anomalyId;

    /** Run that produced this anomaly. */
    private String runId;

    /** Identity of the flagged record. */
    private String recordId;

    private AnomalyType anomalyType;

    /** Weighted mean of the contributing candidates' confidences. */
    private double confidence;

    /** Weighted mean of the contributing candidates' raw scores. */
    private double combinedScore;

    private Severity severity;

    /** Names of the detectors that flagged the record, sorted. */
    private List<String> contributingDetectors;

    /** Human-readable explanation assembled from every contributing detector. */
    private String explanation;

    /** Copy of the record and feature values at detection time. */
    private Map<String, Object> context;

    private Instant detectedAt;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public IntegratedAnomaly() {
    }

    private IntegratedAnomaly(Builder builder) {
        this.anomalyId = builder.anomalyId;
        this.runId = builder.runId;
        this.recordId = Objects.requireNonNull(builder.recordId, "recordId must not be null");
        this.anomalyType = builder.anomalyType;
        this.confidence = builder.confidence;
        this.combinedScore = builder.combinedScore;
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.contributingDetectors = builder.contributingDetectors != null
                ? new ArrayList<>(builder.contributingDetectors)
                : new ArrayList<>();
        this.explanation = builder.explanation;
        this.context = builder.context != null ? new LinkedHashMap<>(builder.context) : null;
        this.detectedAt = Objects.requireNonNull(builder.detectedAt, "detectedAt must not be null");
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link IntegratedAnomaly} instances.
     */
    public static class Builder {
        private String anomalyId;
        private String runId;
        private String recordId;
        private AnomalyType anomalyType;
        private double confidence;
        private double combinedScore;
        private Severity severity;
        private List<String> contributingDetectors;
        private String explanation;
        private Map<String, Object> context;
        private Instant detectedAt;

        public Builder anomalyId(String anomalyId) {
            this.anomalyId = anomalyId;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder recordId(String recordId) {
            this.recordId = recordId;
            return this;
        }

        public Builder anomalyType(AnomalyType anomalyType) {
            this.anomalyType = anomalyType;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder combinedScore(double combinedScore) {
            this.combinedScore = combinedScore;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder contributingDetectors(List<String> contributingDetectors) {
            this.contributingDetectors = contributingDetectors;
            return this;
        }

        public Builder explanation(String explanation) {
            this.explanation = explanation;
            return this;
        }

        public Builder context(Map<String, Object> context) {
            this.context = context;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        /**
         * @return a new {@link IntegratedAnomaly}
         * @throws NullPointerException if a required field is missing
         */
        public IntegratedAnomaly build() {
            return new IntegratedAnomaly(this);
        }
    }

    /**
     * Copy this anomaly with run-level identifiers filled in.
     *
     * @param runId     owning run
     * @param anomalyId generated id
     * @return a new instance; this one is left untouched
     */
    public IntegratedAnomaly withIds(String runId, String anomalyId) {
        return builder()
                .anomalyId(anomalyId)
                .runId(runId)
                .recordId(recordId)
                .anomalyType(anomalyType)
                .confidence(confidence)
                .combinedScore(combinedScore)
                .severity(severity)
                .contributingDetectors(contributingDetectors)
                .explanation(explanation)
                .context(context)
                .detectedAt(detectedAt)
                .build();
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getAnomalyId() {
        return anomalyId;
    }

    public void setAnomalyId(String anomalyId) {
        this.anomalyId = anomalyId;
    }

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }

    public String getRecordId() {
        return recordId;
    }

    public void setRecordId(String recordId) {
        this.recordId = recordId;
    }

    public AnomalyType getAnomalyType() {
        return anomalyType;
    }

    public void setAnomalyType(AnomalyType anomalyType) {
        this.anomalyType = anomalyType;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public double getCombinedScore() {
        return combinedScore;
    }

    public void setCombinedScore(double combinedScore) {
        this.combinedScore = combinedScore;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    /**
     * @return unmodifiable list of contributing detector names
     */
    public List<String> getContributingDetectors() {
        return contributingDetectors != null
                ? Collections.unmodifiableList(contributingDetectors)
                : List.of();
    }

    public void setContributingDetectors(List<String> contributingDetectors) {
        this.contributingDetectors = contributingDetectors != null
                ? new ArrayList<>(contributingDetectors)
                : new ArrayList<>();
    }

    public String getExplanation() {
        return explanation;
    }

    public void setExplanation(String explanation) {
        this.explanation = explanation;
    }

    /**
     * @return unmodifiable context snapshot, or {@code null} if not set
     */
    public Map<String, Object> getContext() {
        return context != null ? Collections.unmodifiableMap(context) : null;
    }

    public void setContext(Map<String, Object> context) {
        this.context = context != null ? new LinkedHashMap<>(context) : null;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public void setDetectedAt(Instant detectedAt) {
        this.detectedAt = detectedAt;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof IntegratedAnomaly that))
            return false;
        return Objects.equals(anomalyId, that.anomalyId)
                && Objects.equals(runId, that.runId)
                && Objects.equals(recordId, that.recordId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(anomalyId, runId, recordId);
    }

    @Override
    public String toString() {
        return "IntegratedAnomaly{" +
                "recordId='" + recordId + '\'' +
                ", severity=" + severity +
                ", confidence=" + confidence +
                ", combinedScore=" + combinedScore +
                ", detectors=" + contributingDetectors +
                '}';
    }
}
