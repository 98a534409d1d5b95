package com.auditsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of an anomaly, as reported by the detector that found it.
 *
 * @since 1.0.0
 */
public enum AnomalyType {

    /** Deviation from the batch distribution. */
    STATISTICAL("statistical"),

    /** Record does not fit any recurring pattern of the batch. */
    PATTERN("pattern"),

    /** Violation of an auditor-authored business rule. */
    BUSINESS("business"),

    /** Irregular timing. */
    TEMPORAL("temporal"),

    /** Unusual given the surrounding records. */
    CONTEXTUAL("contextual");

    private final String value;

    AnomalyType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
