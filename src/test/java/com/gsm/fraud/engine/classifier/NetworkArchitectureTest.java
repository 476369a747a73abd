package com.gsm.fraud.engine.classifier;

import com.gsm.fraud.exception.ModelConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NetworkArchitectureTest {

    @Test
    void build_fullArchitecture_producesInferenceNetwork() {
        FraudClassifier classifier = NetworkArchitecture.build(artifact(7, new int[]{128, 64, 32, 1}));

        assertThat(classifier.getVersion()).isEqualTo("arch-test");
        assertThat(classifier.inputDimension()).isEqualTo(7);
        assertThat(classifier.getLayers()).extracting(DenseLayer::units).containsExactly(128, 64, 32, 1);
        assertThat(classifier.getLayers()).extracting(DenseLayer::getActivation)
                .containsExactly(Activation.RELU, Activation.RELU, Activation.RELU, Activation.SIGMOID);

        double p = classifier.predict(new double[]{1, -1, 0.5, 0, 0, 1, 0});
        assertThat(p).isBetween(0.0, 1.0);
    }

    @Test
    void build_wrongHiddenWidth_rejected() {
        assertThatThrownBy(() -> NetworkArchitecture.build(artifact(7, new int[]{64, 64, 32, 1})))
                .isInstanceOf(ModelConfigurationException.class)
                .hasMessageContaining("expected Dense(128, RELU)");
    }

    @Test
    void build_missingLayer_rejected() {
        assertThatThrownBy(() -> NetworkArchitecture.build(artifact(7, new int[]{128, 64, 1})))
                .isInstanceOf(ModelConfigurationException.class)
                .hasMessageContaining("expected 4");
    }

    @Test
    void build_wrongActivation_rejected() {
        ClassifierArtifact artifact = artifact(7, new int[]{128, 64, 32, 1});
        artifact.getLayers().get(1).setActivation(Activation.SIGMOID);

        assertThatThrownBy(() -> NetworkArchitecture.build(artifact))
                .isInstanceOf(ModelConfigurationException.class);
    }

    @Test
    void build_weightsDoNotMatchDeclaredInput_rejected() {
        ClassifierArtifact artifact = artifact(7, new int[]{128, 64, 32, 1});
        artifact.setInputDimension(9);

        assertThatThrownBy(() -> NetworkArchitecture.build(artifact))
                .isInstanceOf(ModelConfigurationException.class)
                .hasMessageContaining("[9][128]");
    }

    private static ClassifierArtifact artifact(int inputDimension, int[] units) {
        List<ClassifierArtifact.LayerParams> layers = new ArrayList<>();
        int inputs = inputDimension;
        for (int i = 0; i < units.length; i++) {
            double[][] weights = new double[inputs][units[i]];
            for (int r = 0; r < inputs; r++) {
                for (int c = 0; c < units[i]; c++) {
                    weights[r][c] = ((r * 31 + c * 17) % 11 - 5) / 100.0;
                }
            }
            boolean last = i == units.length - 1;
            layers.add(ClassifierArtifact.LayerParams.builder()
                    .units(units[i])
                    .activation(last ? Activation.SIGMOID : Activation.RELU)
                    .weights(weights)
                    .biases(new double[units[i]])
                    .build());
            inputs = units[i];
        }
        return ClassifierArtifact.builder()
                .version("arch-test")
                .inputDimension(inputDimension)
                .layers(layers)
                .build();
    }
}
