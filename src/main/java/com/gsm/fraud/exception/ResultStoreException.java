package com.gsm.fraud.exception;

public class ResultStoreException extends ScoringException {

    public ResultStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
