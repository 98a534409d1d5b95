package com.auditsentinel.server;

import com.auditsentinel.core.model.FeedbackType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body of {@code POST /feedback}.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FeedbackRequest {

    private String anomalyId;
    private FeedbackType feedbackType;
    private String expertName;
    private String comments;

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
}
