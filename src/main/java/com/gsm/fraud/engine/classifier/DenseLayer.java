package com.gsm.fraud.engine.classifier;

/**
 * Fully connected layer: {@code out[j] = activation(bias[j] + sum_i in[i] * weights[i][j])}.
 * Weights are stored input-major ({@code [inputs][units]}), the layout Keras uses for kernels.
 * Arrays are copied on construction and never exposed, so a layer is immutable.
 */
public final class DenseLayer {

    private final double[][] weights;
    private final double[] biases;
    private final Activation activation;

    public DenseLayer(double[][] weights, double[] biases, Activation activation) {
        if (weights.length == 0) {
            throw new IllegalArgumentException("Dense layer needs at least one input");
        }
        int units = biases.length;
        this.weights = new double[weights.length][];
        for (int i = 0; i < weights.length; i++) {
            if (weights[i] == null || weights[i].length != units) {
                throw new IllegalArgumentException(String.format(
                        "Weight row %d has %d columns, expected %d",
                        i, weights[i] == null ? 0 : weights[i].length, units));
            }
            this.weights[i] = weights[i].clone();
        }
        this.biases = biases.clone();
        this.activation = activation;
    }

    public double[] forward(double[] input) {
        double[] out = biases.clone();
        for (int i = 0; i < input.length; i++) {
            double x = input[i];
            if (x == 0.0) continue;
            double[] row = weights[i];
            for (int j = 0; j < out.length; j++) {
                out[j] += x * row[j];
            }
        }
        for (int j = 0; j < out.length; j++) {
            out[j] = activation.apply(out[j]);
        }
        return out;
    }

    public int inputSize() { return weights.length; }
    public int units() { return biases.length; }
    public Activation getActivation() { return activation; }
}
