package com.auditsentinel.core.exception;

/**
 * Thrown by a detector that needs a fitted model when none is registered.
 *
 * <p>
 * This is not a failure: the detector registry reports the detector as
 * skipped, distinct from a detector that crashed.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelUnavailableException extends AnomalyEngineException {

    private static final long serialVersionUID = 1L;

    private final String detectorName;

    public ModelUnavailableException(String detectorName) {
        super("No fitted model available for detector '" + detectorName + "'");
        this.detectorName = detectorName;
    }

    public String getDetectorName() {
        return detectorName;
    }

    @Override
    public String getCode() {
        return "MODEL_UNAVAILABLE";
    }
}
