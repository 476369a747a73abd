package com.gsm.fraud.exception;

/**
 * Raised when the fitted transform and the classifier weights do not fit together,
 * or when either artifact is malformed. Signals a corrupted or mismatched deployment.
 */
public class ModelConfigurationException extends ScoringException {

    public ModelConfigurationException(String message) {
        super(message);
    }

    public ModelConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
