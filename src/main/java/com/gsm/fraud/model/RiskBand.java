package com.gsm.fraud.model;

/**
 * Reporting-only banding of a fraud probability. Derived on demand, never persisted.
 */
public enum RiskBand {
    LOW,
    MEDIUM,
    HIGH;

    public static RiskBand fromProbability(double probability) {
        if (probability > 0.7) return HIGH;
        if (probability >= 0.3) return MEDIUM;
        return LOW;
    }
}
