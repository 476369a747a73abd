package com.gsm.fraud.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordBatchScored(int total, int predictedFrauds, double avgProb) {
        Counter.builder("scoring.batch.count")
                .tag("outcome", "scored")
                .register(registry)
                .increment();

        Counter.builder("scoring.prediction.count")
                .tag("classification", "Fraud")
                .register(registry)
                .increment(predictedFrauds);

        Counter.builder("scoring.prediction.count")
                .tag("classification", "Legitimate")
                .register(registry)
                .increment(total - predictedFrauds);

        DistributionSummary.builder("scoring.batch.avg_probability")
                .register(registry)
                .record(avgProb);
    }

    public void recordBatchRejected(String reason) {
        Counter.builder("scoring.batch.count")
                .tag("outcome", "rejected")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordImputation(String feature, long count) {
        Counter.builder("scoring.imputation.count")
                .tag("feature", feature)
                .register(registry)
                .increment(count);
    }

    public void recordUnknownLocations(long count) {
        Counter.builder("scoring.location.unknown.count")
                .register(registry)
                .increment(count);
    }
}
