package com.gsm.fraud.engine.features;

import com.gsm.fraud.model.SubscriberRecord;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.List;

/**
 * Maps a subscriber record to the fixed-length feature vector the classifier was trained on.
 *
 * Layout:
 *   [0] initial_call_count      (standardized)
 *   [1] average_call_duration   (standardized)
 *   [2] device_switch_count     (standardized)
 *   [3] days_since_first_reg    (standardized)
 *   [4..] one-hot location block in vocabulary order; all zeros for an unknown location
 *
 * Missing, unparseable or negative numeric cells are imputed with the fit-time mean of
 * that feature. Identifier columns never reach the vector. The transformer holds no
 * mutable state and can be shared across threads.
 */
public class FeatureTransformer {

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
    );

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("yyyy/MM/dd")
    );

    private final FittedTransformState state;

    public FeatureTransformer(FittedTransformState state) {
        this.state = state;
    }

    public FeatureVector transform(SubscriberRecord record) {
        double[] features = new double[state.dimension()];
        EnumSet<NumericFeature> imputed = EnumSet.noneOf(NumericFeature.class);

        features[NumericFeature.INITIAL_CALL_COUNT.ordinal()] =
                scaledNumeric(NumericFeature.INITIAL_CALL_COUNT, parseNonNegative(record.getInitialCallCount()), imputed);
        features[NumericFeature.AVERAGE_CALL_DURATION.ordinal()] =
                scaledNumeric(NumericFeature.AVERAGE_CALL_DURATION, parseNonNegative(record.getAverageCallDuration()), imputed);
        features[NumericFeature.DEVICE_SWITCH_COUNT.ordinal()] =
                scaledNumeric(NumericFeature.DEVICE_SWITCH_COUNT, parseNonNegative(record.getDeviceSwitchCount()), imputed);
        features[NumericFeature.DAYS_SINCE_FIRST_REG.ordinal()] =
                scaledNumeric(NumericFeature.DAYS_SINCE_FIRST_REG, daysSinceReference(record.getRegistrationDate()), imputed);

        LocationCategory location = state.getLocationVocabulary().resolve(record.getLocation());
        if (location.isKnown()) {
            features[NumericFeature.COUNT + location.getIndex()] = 1.0;
        }

        return new FeatureVector(features, imputed, location);
    }

    public FittedTransformState getState() {
        return state;
    }

    private double scaledNumeric(NumericFeature feature, Double rawValue, EnumSet<NumericFeature> imputed) {
        ScalerParameters scaler = state.scaler(feature);
        double value;
        if (rawValue == null) {
            imputed.add(feature);
            value = scaler.getMean();
        } else {
            value = rawValue;
        }
        return scaler.scale(value);
    }

    private Double daysSinceReference(String rawDate) {
        LocalDate date = parseDate(rawDate);
        if (date == null) {
            return null;
        }
        return (double) ChronoUnit.DAYS.between(state.getReferenceDate(), date);
    }

    static Double parseNonNegative(String cell) {
        if (cell == null) {
            return null;
        }
        String trimmed = cell.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            double value = Double.parseDouble(trimmed);
            if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
                return null;
            }
            return value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static LocalDate parseDate(String cell) {
        if (cell == null || cell.isBlank()) {
            return null;
        }
        String trimmed = cell.trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            LocalDate date = parseDate(trimmed, format);
            if (date != null) {
                return date;
            }
        }
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            LocalDate date = parseDateTime(trimmed, format);
            if (date != null) {
                return date;
            }
        }
        return null;
    }

    private static LocalDate parseDate(String text, DateTimeFormatter format) {
        try {
            return LocalDate.parse(text, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static LocalDate parseDateTime(String text, DateTimeFormatter format) {
        try {
            return LocalDateTime.parse(text, format).toLocalDate();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
