package com.auditsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Verdict of an auditor on a reported anomaly.
 *
 * @since 1.0.0
 */
public enum FeedbackType {
    CONFIRMED("confirmed"),
    FALSE_POSITIVE("false_positive"),
    NEEDS_REVIEW("needs_review");

    private final String value;

    FeedbackType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
