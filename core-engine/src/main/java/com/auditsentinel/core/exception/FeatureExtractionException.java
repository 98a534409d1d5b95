package com.auditsentinel.core.exception;

/**
 * The record batch is malformed and cannot be turned into features. Aborts the run.
 *
 * @since 1.0.0
 */
public class FeatureExtractionException extends AnomalyEngineException {

    private static final long serialVersionUID = 1L;

    public FeatureExtractionException(String message) {
        super(message);
    }

    public FeatureExtractionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "FEATURE_EXTRACTION_ERROR";
    }
}
