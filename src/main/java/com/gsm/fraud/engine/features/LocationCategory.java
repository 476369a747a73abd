package com.gsm.fraud.engine.features;

import java.util.Objects;

/**
 * A resolved location value: either a category of the fitted vocabulary (with its one-hot
 * position) or {@link #UNKNOWN}, which encodes as an all-zero block.
 */
public final class LocationCategory {

    public static final LocationCategory UNKNOWN = new LocationCategory(-1, null);

    private final int index;
    private final String label;

    private LocationCategory(int index, String label) {
        this.index = index;
        this.label = label;
    }

    static LocationCategory known(int index, String label) {
        return new LocationCategory(index, label);
    }

    public boolean isKnown() {
        return index >= 0;
    }

    public int getIndex() { return index; }
    public String getLabel() { return label; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LocationCategory)) return false;
        LocationCategory that = (LocationCategory) o;
        return index == that.index && Objects.equals(label, that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, label);
    }

    @Override
    public String toString() {
        return isKnown() ? "LocationCategory[" + index + "=" + label + "]" : "LocationCategory[UNKNOWN]";
    }
}
