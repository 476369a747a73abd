package com.gsm.fraud.engine.features;

/**
 * Numeric features in their frozen vector order. The ordinal of each constant is its
 * position in the feature vector; the one-hot location block follows the last one.
 */
public enum NumericFeature {
    INITIAL_CALL_COUNT("initial_call_count"),
    AVERAGE_CALL_DURATION("average_call_duration"),
    DEVICE_SWITCH_COUNT("device_switch_count"),
    DAYS_SINCE_FIRST_REG("days_since_first_reg");

    public static final int COUNT = values().length;

    private final String featureName;

    NumericFeature(String featureName) {
        this.featureName = featureName;
    }

    public String getFeatureName() {
        return featureName;
    }
}
