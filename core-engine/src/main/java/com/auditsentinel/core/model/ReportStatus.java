package com.auditsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Top-level status of a detection report.
 *
 * @since 1.0.0
 */
public enum ReportStatus {

    /** Every scheduled detector completed or was legitimately skipped. */
    SUCCESS("success"),

    /**
     * Report is usable but incomplete: a detector failed or timed out, or
     * weighted fusion was disabled for the run.
     */
    DEGRADED("degraded"),

    /** Run aborted; see the report's error. */
    ERROR("error"),

    /** Run abandoned by the caller before completion; nothing was persisted. */
    CANCELLED("cancelled");

    private final String value;

    ReportStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
