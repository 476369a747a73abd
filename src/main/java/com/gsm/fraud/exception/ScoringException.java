package com.gsm.fraud.exception;

/**
 * Base type for every failure raised by the scoring pipeline.
 */
public class ScoringException extends RuntimeException {

    public ScoringException(String message) {
        super(message);
    }

    public ScoringException(String message, Throwable cause) {
        super(message, cause);
    }
}
