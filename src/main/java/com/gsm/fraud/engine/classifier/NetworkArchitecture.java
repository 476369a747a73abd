package com.gsm.fraud.engine.classifier;

import com.gsm.fraud.exception.ModelConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * The fixed network shape every deployed artifact must have:
 * Dense(128, relu) → Dense(64, relu) → Dense(32, relu) → Dense(1, sigmoid).
 *
 * During training each hidden layer is followed by dropout (0.3, 0.2, 0.1). Dropout is a
 * training-only behavior and has no counterpart in {@link FraudClassifier}; the rates are
 * kept here only so the architecture can be reported.
 */
public final class NetworkArchitecture {

    public static final int[] HIDDEN_UNITS = {128, 64, 32};
    public static final double[] TRAINING_DROPOUT = {0.3, 0.2, 0.1};

    private NetworkArchitecture() {}

    /**
     * Validates the artifact against the fixed architecture and builds the inference network.
     */
    public static FraudClassifier build(ClassifierArtifact artifact) {
        List<ClassifierArtifact.LayerParams> params = artifact.getLayers();
        int expectedLayers = HIDDEN_UNITS.length + 1;
        if (params == null || params.size() != expectedLayers) {
            throw new ModelConfigurationException(String.format(
                    "Classifier artifact has %d dense layers, expected %d",
                    params == null ? 0 : params.size(), expectedLayers));
        }

        List<DenseLayer> layers = new ArrayList<>(expectedLayers);
        int inputs = artifact.getInputDimension();
        for (int i = 0; i < expectedLayers; i++) {
            ClassifierArtifact.LayerParams p = params.get(i);
            boolean hidden = i < HIDDEN_UNITS.length;
            int expectedUnits = hidden ? HIDDEN_UNITS[i] : 1;
            Activation expectedActivation = hidden ? Activation.RELU : Activation.SIGMOID;

            if (p.getUnits() != expectedUnits || p.getActivation() != expectedActivation) {
                throw new ModelConfigurationException(String.format(
                        "Layer %d is Dense(%d, %s), expected Dense(%d, %s)",
                        i, p.getUnits(), p.getActivation(), expectedUnits, expectedActivation));
            }
            if (p.getWeights() == null || p.getWeights().length != inputs
                    || p.getBiases() == null || p.getBiases().length != expectedUnits) {
                throw new ModelConfigurationException(String.format(
                        "Layer %d weights do not match shape [%d][%d]", i, inputs, expectedUnits));
            }
            try {
                layers.add(new DenseLayer(p.getWeights(), p.getBiases(), p.getActivation()));
            } catch (IllegalArgumentException e) {
                throw new ModelConfigurationException("Layer " + i + ": " + e.getMessage(), e);
            }
            inputs = expectedUnits;
        }

        return new FraudClassifier(artifact.getVersion(), layers);
    }
}
