package com.gsm.fraud.exception;

import java.util.List;

/**
 * Raised when an uploaded batch is missing required columns or has no data rows.
 * The whole batch is rejected: nothing is scored and nothing is persisted.
 */
public class SchemaValidationException extends ScoringException {

    private final List<String> missingColumns;

    public SchemaValidationException(String message) {
        this(message, List.of());
    }

    public SchemaValidationException(String message, List<String> missingColumns) {
        super(message);
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
