package com.auditsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of one detector within one run.
 *
 * @since 1.0.0
 */
public enum DetectorStatus {

    /** Detector ran to completion (possibly with zero candidates). */
    SUCCESS("success"),

    /** Detector needs a fitted model and none was available. Not an error. */
    SKIPPED("skipped"),

    /** Detector threw; it contributes no candidates. */
    FAILED("failed"),

    /** Detector exceeded the run's detector timeout and was cancelled. */
    TIMED_OUT("timed_out");

    private final String value;

    DetectorStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
