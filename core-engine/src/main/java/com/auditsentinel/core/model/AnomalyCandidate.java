package com.auditsentinel.core.model;

import java.util.Objects;

/**
 * One detector's unfused verdict on one record.
 *
 * <p>
 * Candidates live only for the duration of a single run and are consumed by
 * the fusion engine. Use the {@link Builder}; {@code recordId},
 * {@code detectorName} and {@code anomalyType} are required, and the
 * confidence must lie in [0, 1].
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyCandidate {

    private final String recordId;
    private final String detectorName;
    private final double rawScore;
    private final double confidence;
    private final AnomalyType anomalyType;
    private final String explanation;

    private AnomalyCandidate(Builder builder) {
        this.recordId = Objects.requireNonNull(builder.recordId, "recordId must not be null");
        this.detectorName = Objects.requireNonNull(builder.detectorName, "detectorName must not be null");
        this.anomalyType = Objects.requireNonNull(builder.anomalyType, "anomalyType must not be null");
        if (!(builder.confidence >= 0.0 && builder.confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got: " + builder.confidence);
        }
        if (!Double.isFinite(builder.rawScore)) {
            throw new IllegalArgumentException("rawScore must be finite, got: " + builder.rawScore);
        }
        this.rawScore = builder.rawScore;
        this.confidence = builder.confidence;
        this.explanation = builder.explanation != null ? builder.explanation : "";
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnomalyCandidate}.
     */
    public static class Builder {
        private String recordId;
        private String detectorName;
        private double rawScore;
        private double confidence;
        private AnomalyType anomalyType;
        private String explanation;

        public Builder recordId(String recordId) {
            this.recordId = recordId;
            return this;
        }

        public Builder detectorName(String detectorName) {
            this.detectorName = detectorName;
            return this;
        }

        public Builder rawScore(double rawScore) {
            this.rawScore = rawScore;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder anomalyType(AnomalyType anomalyType) {
            this.anomalyType = anomalyType;
            return this;
        }

        public Builder explanation(String explanation) {
            this.explanation = explanation;
            return this;
        }

        public AnomalyCandidate build() {
            return new AnomalyCandidate(this);
        }
    }

    public String getRecordId() {
        return recordId;
    }

    public String getDetectorName() {
        return detectorName;
    }

    public double getRawScore() {
        return rawScore;
    }

    public double getConfidence() {
        return confidence;
    }

    public AnomalyType getAnomalyType() {
        return anomalyType;
    }

    public String getExplanation() {
        return explanation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyCandidate that))
            return false;
        return Double.compare(rawScore, that.rawScore) == 0
                && Double.compare(confidence, that.confidence) == 0
                && recordId.equals(that.recordId)
                && detectorName.equals(that.detectorName)
                && anomalyType == that.anomalyType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(recordId, detectorName, rawScore, confidence, anomalyType);
    }

    @Override
    public String toString() {
        return "AnomalyCandidate{" +
                "recordId='" + recordId + '\'' +
                ", detector='" + detectorName + '\'' +
                ", rawScore=" + rawScore +
                ", confidence=" + confidence +
                ", type=" + anomalyType +
                '}';
    }
}
