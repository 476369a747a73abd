package com.gsm.fraud.engine.classifier;

import com.gsm.fraud.exception.ModelConfigurationException;

import java.util.List;

/**
 * Inference-time feed-forward network. This type has no dropout stage and no training
 * flag: a prediction is a pure function of the immutable layer weights, so the same
 * feature vector always yields the same probability and concurrent calls need no locking.
 */
public final class FraudClassifier {

    private final String version;
    private final List<DenseLayer> layers;

    public FraudClassifier(String version, List<DenseLayer> layers) {
        if (layers.isEmpty()) {
            throw new ModelConfigurationException("Classifier has no layers");
        }
        for (int i = 1; i < layers.size(); i++) {
            if (layers.get(i).inputSize() != layers.get(i - 1).units()) {
                throw new ModelConfigurationException(String.format(
                        "Layer %d expects %d inputs but layer %d produces %d",
                        i, layers.get(i).inputSize(), i - 1, layers.get(i - 1).units()));
            }
        }
        DenseLayer output = layers.get(layers.size() - 1);
        if (output.units() != 1 || output.getActivation() != Activation.SIGMOID) {
            throw new ModelConfigurationException("Classifier must end in a single sigmoid unit");
        }
        this.version = version;
        this.layers = List.copyOf(layers);
    }

    /**
     * @return fraud probability in [0, 1]
     */
    public double predict(double[] features) {
        if (features.length != inputDimension()) {
            throw new ModelConfigurationException(String.format(
                    "Feature vector has %d values but the classifier expects %d",
                    features.length, inputDimension()));
        }
        double[] activations = features;
        for (DenseLayer layer : layers) {
            activations = layer.forward(activations);
        }
        return activations[0];
    }

    public int inputDimension() {
        return layers.get(0).inputSize();
    }

    public String getVersion() { return version; }
    public List<DenseLayer> getLayers() { return layers; }
}
