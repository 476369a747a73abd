package com.gsm.fraud.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Classification {
    FRAUD("Fraud"),
    LEGITIMATE("Legitimate");

    private final String label;

    Classification(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static Classification fromLabel(String label) {
        for (Classification c : values()) {
            if (c.label.equalsIgnoreCase(label) || c.name().equalsIgnoreCase(label)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown classification: " + label);
    }
}
