package com.auditsentinel.core.exception;

/**
 * Bad or missing engine or detector configuration. Aborts a run before any detector executes.
 *
 * @since 1.0.0
 */
public class ConfigurationException extends AnomalyEngineException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "CONFIGURATION_ERROR";
    }
}
