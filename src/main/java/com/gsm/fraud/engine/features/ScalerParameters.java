package com.gsm.fraud.engine.features;

/**
 * Standardization parameters of one numeric feature, learned at fit time.
 * The mean doubles as the imputation value for missing or unparseable cells.
 */
public final class ScalerParameters {

    private final double mean;
    private final double stdDev;

    public ScalerParameters(double mean, double stdDev) {
        this.mean = mean;
        this.stdDev = stdDev;
    }

    public double scale(double value) {
        if (stdDev == 0.0) {
            return 0.0;
        }
        return (value - mean) / stdDev;
    }

    public double getMean() { return mean; }
    public double getStdDev() { return stdDev; }
}
