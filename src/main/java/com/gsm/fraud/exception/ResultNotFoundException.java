package com.gsm.fraud.exception;

public class ResultNotFoundException extends ScoringException {

    private final String resultId;

    public ResultNotFoundException(String resultId) {
        super("No such result: " + resultId);
        this.resultId = resultId;
    }

    public String getResultId() {
        return resultId;
    }
}
