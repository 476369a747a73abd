package com.gsm.fraud.engine.classifier;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * On-disk form of the trained network ({@code classifier.json}). Dropout layers are not
 * part of the artifact; only dense layers carry weights.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClassifierArtifact {

    private String version;

    private int inputDimension;

    private List<LayerParams> layers;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LayerParams {
        private int units;
        private Activation activation;
        // [inputs][units]
        private double[][] weights;
        private double[] biases;
    }
}
