package com.gsm.fraud.engine.features;

import com.gsm.fraud.exception.ModelConfigurationException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Parameters learned once from training data and frozen for every inference call:
 * per-feature scaler statistics, the location vocabulary and the reference registration date.
 * Instances are immutable and safe to share across threads.
 */
public final class FittedTransformState {

    private final LocalDate referenceDate;
    private final Map<NumericFeature, ScalerParameters> scalers;
    private final LocationVocabulary locationVocabulary;

    public FittedTransformState(LocalDate referenceDate,
                                Map<NumericFeature, ScalerParameters> scalers,
                                LocationVocabulary locationVocabulary) {
        if (referenceDate == null) {
            throw new ModelConfigurationException("Fitted transform has no reference date");
        }
        for (NumericFeature feature : NumericFeature.values()) {
            if (!scalers.containsKey(feature)) {
                throw new ModelConfigurationException(
                        "Fitted transform has no scaler for feature " + feature.getFeatureName());
            }
        }
        this.referenceDate = referenceDate;
        this.scalers = Collections.unmodifiableMap(new EnumMap<>(scalers));
        this.locationVocabulary = locationVocabulary;
    }

    /**
     * Builds the state from its artifact form. The numeric features must be listed in
     * exactly the frozen vector order; anything else means the artifact was fitted for a
     * different feature layout.
     */
    public static FittedTransformState fromArtifact(TransformArtifact artifact) {
        LocalDate referenceDate;
        try {
            referenceDate = LocalDate.parse(artifact.getReferenceDate());
        } catch (DateTimeParseException | NullPointerException e) {
            throw new ModelConfigurationException(
                    "Invalid reference date in fitted transform: " + artifact.getReferenceDate(), e);
        }

        List<TransformArtifact.NumericFeatureParams> params = artifact.getNumericFeatures();
        if (params == null || params.size() != NumericFeature.COUNT) {
            throw new ModelConfigurationException(String.format(
                    "Fitted transform declares %d numeric features, expected %d",
                    params == null ? 0 : params.size(), NumericFeature.COUNT));
        }

        Map<NumericFeature, ScalerParameters> scalers = new EnumMap<>(NumericFeature.class);
        for (NumericFeature feature : NumericFeature.values()) {
            TransformArtifact.NumericFeatureParams p = params.get(feature.ordinal());
            if (!feature.getFeatureName().equals(p.getName())) {
                throw new ModelConfigurationException(String.format(
                        "Numeric feature %d is '%s', expected '%s'",
                        feature.ordinal(), p.getName(), feature.getFeatureName()));
            }
            if (p.getStdDev() < 0 || Double.isNaN(p.getStdDev()) || Double.isNaN(p.getMean())) {
                throw new ModelConfigurationException(
                        "Invalid scaler parameters for feature " + p.getName());
            }
            scalers.put(feature, new ScalerParameters(p.getMean(), p.getStdDev()));
        }

        List<String> vocabulary = artifact.getLocationVocabulary() != null
                ? artifact.getLocationVocabulary()
                : List.of();
        try {
            return new FittedTransformState(referenceDate, scalers, new LocationVocabulary(vocabulary));
        } catch (IllegalArgumentException e) {
            throw new ModelConfigurationException("Invalid location vocabulary: " + e.getMessage(), e);
        }
    }

    /** Length of every feature vector produced with this state. */
    public int dimension() {
        return NumericFeature.COUNT + locationVocabulary.size();
    }

    /** Feature names in vector order. */
    public List<String> featureNames() {
        List<String> names = new ArrayList<>(dimension());
        for (NumericFeature feature : NumericFeature.values()) {
            names.add(feature.getFeatureName());
        }
        for (String category : locationVocabulary.getCategories()) {
            names.add("location_" + category);
        }
        return names;
    }

    public ScalerParameters scaler(NumericFeature feature) {
        return scalers.get(feature);
    }

    public LocalDate getReferenceDate() { return referenceDate; }
    public LocationVocabulary getLocationVocabulary() { return locationVocabulary; }
}
