package com.auditsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Auditor feedback on one integrated anomaly, keyed by anomaly id.
 *
 * @since 1.0.0
 */
public class ExpertFeedback {

    private String feedbackId;
    private String anomalyId;
    private FeedbackType feedbackType;
    private String expertName;
    private String comments;
    private Instant feedbackTime;

    /** No-arg constructor required by Jackson. */
    public ExpertFeedback() {
    }

    public ExpertFeedback(String feedbackId, String anomalyId, FeedbackType feedbackType, String expertName,
            String comments, Instant feedbackTime) {
        this.feedbackId = Objects.requireNonNull(feedbackId, "feedbackId must not be null");
        this.anomalyId = Objects.requireNonNull(anomalyId, "anomalyId must not be null");
        this.feedbackType = Objects.requireNonNull(feedbackType, "feedbackType must not be null");
        this.expertName = expertName;
        this.comments = comments;
        this.feedbackTime = Objects.requireNonNull(feedbackTime, "feedbackTime must not be null");
    }

    public String getFeedbackId() {
        return feedbackId;
    }

    public void setFeedbackId(String feedbackId) {
        this.feedbackId = feedbackId;
    }

    public String getAnomalyId() {
        return anomalyId;
    }

    public void setAnomalyId(String anomalyId) {
        this.anomalyId = anomalyId;
    }

    public FeedbackType getFeedbackType() {
        return feedbackType;
    }

    public void setFeedbackType(FeedbackType feedbackType) {
        this.feedbackType = feedbackType;
    }

    public String getExpertName() {
        return expertName;
    }

    public void setExpertName(String expertName) {
        this.expertName = expertName;
    }

    public String getComments() {
        return comments;
    }

    public void setComments(String comments) {
        this.comments = comments;
    }

    public Instant getFeedbackTime() {
        return feedbackTime;
    }

    public void setFeedbackTime(Instant feedbackTime) {
        this.feedbackTime = feedbackTime;
    }

    @Override
    public String toString() {
        return "ExpertFeedback{" +
                "anomalyId='" + anomalyId + '\'' +
                ", type=" + feedbackType +
                ", expert='" + expertName + '\'' +
                '}';
    }
}
