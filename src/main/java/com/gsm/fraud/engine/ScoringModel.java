package com.gsm.fraud.engine;

import com.gsm.fraud.engine.classifier.FraudClassifier;
import com.gsm.fraud.engine.features.FeatureTransformer;
import com.gsm.fraud.engine.features.FeatureVector;
import com.gsm.fraud.engine.features.FittedTransformState;
import com.gsm.fraud.exception.ModelConfigurationException;
import com.gsm.fraud.model.SubscriberRecord;

/**
 * The validated pairing of a fitted transform and the classifier trained on its output.
 * Built once at startup and shared read-only by every scoring call.
 */
public final class ScoringModel {

    private final FeatureTransformer transformer;
    private final FraudClassifier classifier;

    private ScoringModel(FeatureTransformer transformer, FraudClassifier classifier) {
        this.transformer = transformer;
        this.classifier = classifier;
    }

    public static ScoringModel of(FittedTransformState state, FraudClassifier classifier) {
        if (state.dimension() != classifier.inputDimension()) {
            throw new ModelConfigurationException(String.format(
                    "Fitted transform produces %d features but classifier %s expects %d",
                    state.dimension(), classifier.getVersion(), classifier.inputDimension()));
        }
        return new ScoringModel(new FeatureTransformer(state), classifier);
    }

    public FeatureVector transform(SubscriberRecord record) {
        return transformer.transform(record);
    }

    public double predict(FeatureVector vector) {
        return classifier.predict(vector.values());
    }

    public FittedTransformState getTransformState() { return transformer.getState(); }
    public FraudClassifier getClassifier() { return classifier; }
}
