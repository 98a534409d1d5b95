package com.auditsentinel.core.exception;

/**
 * A result store read or write failed. Never invalidates a report that has already been computed.
 *
 * @since 1.0.0
 */
public class PersistenceException extends AnomalyEngineException {

    private static final long serialVersionUID = 1L;

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "PERSISTENCE_ERROR";
    }
}
