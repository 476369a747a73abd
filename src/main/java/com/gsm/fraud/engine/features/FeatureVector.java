package com.gsm.fraud.engine.features;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Transformer output for one record, together with what had to be imputed on the way.
 */
public final class FeatureVector {

    private final double[] values;
    private final Set<NumericFeature> imputedFeatures;
    private final LocationCategory location;

    FeatureVector(double[] values, EnumSet<NumericFeature> imputedFeatures, LocationCategory location) {
        this.values = values;
        this.imputedFeatures = Collections.unmodifiableSet(imputedFeatures);
        this.location = location;
    }

    public double[] values() {
        return Arrays.copyOf(values, values.length);
    }

    public int dimension() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public Set<NumericFeature> getImputedFeatures() { return imputedFeatures; }
    public LocationCategory getLocation() { return location; }

    public boolean isUnknownLocation() {
        return !location.isKnown();
    }
}
