package com.auditsentinel.core.exception;

/**
 * Base class of every error raised by the anomaly engine.
 *
 * @since 1.0.0
 */
public abstract class AnomalyEngineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected AnomalyEngineException(String message) {
        super(message);
    }

    protected AnomalyEngineException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return stable, machine-readable error code used in detection reports
     */
    public abstract String getCode();
}
