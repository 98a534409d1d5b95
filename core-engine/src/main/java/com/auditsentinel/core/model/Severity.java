package com.auditsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Four-level severity of an integrated anomaly.
 *
 * @since 1.0.0
 */
public enum Severity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
