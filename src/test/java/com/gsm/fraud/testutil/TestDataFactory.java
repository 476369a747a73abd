package com.gsm.fraud.testutil;

import com.gsm.fraud.engine.ScoringModel;
import com.gsm.fraud.engine.classifier.Activation;
import com.gsm.fraud.engine.classifier.DenseLayer;
import com.gsm.fraud.engine.classifier.FraudClassifier;
import com.gsm.fraud.engine.features.FittedTransformState;
import com.gsm.fraud.engine.features.TransformArtifact;
import com.gsm.fraud.model.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 *
 * The test transform uses round scaler parameters (initial_call_count 50/10,
 * average_call_duration 100/20, device_switch_count 2/1, days_since_first_reg 365/100,
 * reference date 2023-01-01) so expected feature values can be worked out by hand.
 * The test classifier only looks at device_switch_count: p = sigmoid(2 * z), so 4 switches
 * scores ~0.98, 0 switches ~0.02 and exactly 2 switches scores 0.5.
 */
public final class TestDataFactory {

    public static final String TEST_MODEL_VERSION = "test-1";

    private TestDataFactory() {}

    public static TransformArtifact transformArtifact() {
        return TransformArtifact.builder()
                .referenceDate("2023-01-01")
                .numericFeatures(List.of(
                        numeric("initial_call_count", 50, 10),
                        numeric("average_call_duration", 100, 20),
                        numeric("device_switch_count", 2, 1),
                        numeric("days_since_first_reg", 365, 100)))
                .locationVocabulary(List.of("rural", "suburban", "urban"))
                .build();
    }

    public static TransformArtifact.NumericFeatureParams numeric(String name, double mean, double stdDev) {
        return TransformArtifact.NumericFeatureParams.builder()
                .name(name)
                .mean(mean)
                .stdDev(stdDev)
                .build();
    }

    public static FittedTransformState transformState() {
        return FittedTransformState.fromArtifact(transformArtifact());
    }

    public static FraudClassifier deviceSwitchClassifier() {
        double[][] weights = new double[7][1];
        weights[2][0] = 2.0;
        return new FraudClassifier(TEST_MODEL_VERSION,
                List.of(new DenseLayer(weights, new double[]{0.0}, Activation.SIGMOID)));
    }

    public static ScoringModel scoringModel() {
        return ScoringModel.of(transformState(), deviceSwitchClassifier());
    }

    public static List<String> row(String subscriberId, String deviceSwitchCount) {
        return Arrays.asList(subscriberId, "356938035643809", "2023-06-01", "urban", "40", "90", deviceSwitchCount);
    }

    @SafeVarargs
    public static RawBatch rawBatch(List<String>... rows) {
        return RawBatch.builder()
                .headers(new ArrayList<>(SubscriberColumns.REQUIRED))
                .rows(new ArrayList<>(Arrays.asList(rows)))
                .sourceName("subscribers.csv")
                .build();
    }

    public static SubscriberRecord record(String subscriberId, String initialCalls, String avgDuration,
                                          String deviceSwitches, String registrationDate, String location) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(SubscriberColumns.SUBSCRIBER_ID, subscriberId);
        fields.put(SubscriberColumns.IMEI, "356938035643809");
        fields.put(SubscriberColumns.REGISTRATION_DATE, registrationDate);
        fields.put(SubscriberColumns.LOCATION, location);
        fields.put(SubscriberColumns.INITIAL_CALL_COUNT, initialCalls);
        fields.put(SubscriberColumns.AVERAGE_CALL_DURATION, avgDuration);
        fields.put(SubscriberColumns.DEVICE_SWITCH_COUNT, deviceSwitches);
        return new SubscriberRecord(0, fields);
    }

    public static Prediction prediction(String subscriberId, double probability) {
        boolean fraud = probability > 0.5;
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(SubscriberColumns.SUBSCRIBER_ID, subscriberId);
        fields.put(SubscriberColumns.LOCATION, "urban");
        return Prediction.builder()
                .subscriberId(subscriberId)
                .fraudProbability(probability)
                .predictedFraud(fraud ? 1 : 0)
                .classification(fraud ? Classification.FRAUD : Classification.LEGITIMATE)
                .record(fields)
                .build();
    }

    public static List<Prediction> predictions(double... probabilities) {
        List<Prediction> predictions = new ArrayList<>();
        for (int i = 0; i < probabilities.length; i++) {
            predictions.add(prediction("SUB-" + (i + 1), probabilities[i]));
        }
        return predictions;
    }

    public static ScoringResult scoringResult(String resultId, double... probabilities) {
        List<Prediction> predictions = predictions(probabilities);
        int frauds = (int) predictions.stream().filter(p -> p.getPredictedFraud() == 1).count();
        double avg = Arrays.stream(probabilities).average().orElse(0.0);
        return ScoringResult.builder()
                .resultId(resultId)
                .sourceName("subscribers.csv")
                .modelVersion(TEST_MODEL_VERSION)
                .createdAt(1739886764000L)
                .summary(BatchSummary.builder()
                        .total(predictions.size())
                        .predictedFrauds(frauds)
                        .legitCount(predictions.size() - frauds)
                        .avgProb(avg)
                        .build())
                .predictions(predictions)
                .build();
    }
}
