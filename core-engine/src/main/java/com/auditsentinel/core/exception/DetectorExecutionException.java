package com.auditsentinel.core.exception;

/**
 * A single detector failed. Recovered by the detector registry: the detector contributes no candidates and the run continues.
 *
 * @since 1.0.0
 */
public class DetectorExecutionException extends AnomalyEngineException {

    private static final long serialVersionUID = 1L;

    public DetectorExecutionException(String message) {
        super(message);
    }

    public DetectorExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "DETECTOR_EXECUTION_ERROR";
    }
}
