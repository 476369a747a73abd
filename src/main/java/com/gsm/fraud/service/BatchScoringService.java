package com.gsm.fraud.service;

import com.gsm.fraud.config.MetricsConfig;
import com.gsm.fraud.config.ScoringConfig;
import com.gsm.fraud.engine.SchemaValidator;
import com.gsm.fraud.engine.ScoringModel;
import com.gsm.fraud.engine.features.FeatureVector;
import com.gsm.fraud.engine.features.NumericFeature;
import com.gsm.fraud.exception.ModelConfigurationException;
import com.gsm.fraud.exception.SchemaValidationException;
import com.gsm.fraud.model.BatchSummary;
import com.gsm.fraud.model.Prediction;
import com.gsm.fraud.model.RawBatch;
import com.gsm.fraud.model.ResultListing;
import com.gsm.fraud.model.RiskBand;
import com.gsm.fraud.model.ScoringResult;
import com.gsm.fraud.model.SubscriberRecord;
import com.gsm.fraud.repository.ResultStore;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Main orchestrator for batch scoring.
 *
 * Flow:
 * 1. Validate the column set and build subscriber records (SchemaValidationException aborts)
 * 2. Transform every record into a feature vector with the fitted transform
 * 3. Score each vector with the classifier
 * 4. Apply the 0.5 threshold and aggregate the batch summary
 * 5. Persist summary + predictions in the result store
 * 6. Return the stored result with its identifier
 *
 * Nothing is persisted unless every step before it succeeded.
 */
@Service
public class BatchScoringService {

    private static final Logger log = LoggerFactory.getLogger(BatchScoringService.class);

    private final SchemaValidator schemaValidator;
    private final ScoringModel scoringModel;
    private final BatchDecisionService decisionService;
    private final ResultStore resultStore;
    private final MetricsConfig metricsConfig;
    private final ScoringConfig scoringConfig;

    public BatchScoringService(SchemaValidator schemaValidator,
                               ScoringModel scoringModel,
                               BatchDecisionService decisionService,
                               ResultStore resultStore,
                               MetricsConfig metricsConfig,
                               ScoringConfig scoringConfig) {
        this.schemaValidator = schemaValidator;
        this.scoringModel = scoringModel;
        this.decisionService = decisionService;
        this.resultStore = resultStore;
        this.metricsConfig = metricsConfig;
        this.scoringConfig = scoringConfig;
    }

    /**
     * Scores a whole batch and persists it. Returns the complete prediction set; any display
     * truncation is up to the caller.
     */
    @Observed(name = "scoring.batch", contextualName = "score-batch")
    public ScoringResult scoreBatch(RawBatch batch) {
        List<SubscriberRecord> records;
        try {
            records = schemaValidator.validate(batch);
        } catch (SchemaValidationException e) {
            metricsConfig.recordBatchRejected("schema");
            log.warn("Rejected batch {}: {}", batch != null ? batch.getSourceName() : null, e.getMessage());
            throw e;
        }

        int n = records.size();
        Prediction[] predictions = new Prediction[n];
        FeatureVector[] vectors = new FeatureVector[n];

        IntStream rows = IntStream.range(0, n);
        if (n >= scoringConfig.getParallelRowThreshold()) {
            rows = rows.parallel();
        }
        try {
            rows.forEach(i -> {
                SubscriberRecord record = records.get(i);
                FeatureVector vector = scoringModel.transform(record);
                double probability = scoringModel.predict(vector);
                vectors[i] = vector;
                predictions[i] = decisionService.decide(record, probability);
            });
        } catch (ModelConfigurationException e) {
            metricsConfig.recordBatchRejected("config");
            log.error("Model configuration error while scoring batch {}: {}", batch.getSourceName(), e.getMessage());
            throw e;
        }

        recordDataQuality(batch.getSourceName(), vectors);

        List<Prediction> predictionList = Arrays.asList(predictions);
        BatchSummary summary = decisionService.summarize(predictionList);

        ScoringResult stored = resultStore.save(ScoringResult.builder()
                .sourceName(batch.getSourceName())
                .modelVersion(scoringModel.getClassifier().getVersion())
                .summary(summary)
                .predictions(predictionList)
                .build());

        metricsConfig.recordBatchScored(summary.getTotal(), summary.getPredictedFrauds(), summary.getAvgProb());
        if (summary.getPredictedFrauds() * 2 > summary.getTotal()) {
            log.warn("High fraud batch {}: {} of {} rows predicted fraudulent",
                    batch.getSourceName(), summary.getPredictedFrauds(), summary.getTotal());
        }
        log.info("Scored batch {} as result {}: total={}, frauds={}, legit={}, avgProb={}",
                batch.getSourceName(), stored.getResultId(), summary.getTotal(),
                summary.getPredictedFrauds(), summary.getLegitCount(),
                String.format("%.4f", summary.getAvgProb()));
        return stored;
    }

    public ScoringResult getResult(String resultId) {
        return resultStore.load(resultId);
    }

    public List<ResultListing> listResults() {
        return resultStore.list();
    }

    public void purgeResult(String resultId) {
        resultStore.purge(resultId);
    }

    public Map<RiskBand, Long> riskBands(String resultId) {
        return decisionService.riskBands(resultStore.load(resultId).getPredictions());
    }

    private void recordDataQuality(String sourceName, FeatureVector[] vectors) {
        Map<NumericFeature, Long> imputed = new EnumMap<>(NumericFeature.class);
        long unknownLocations = 0;
        for (FeatureVector vector : vectors) {
            for (NumericFeature feature : vector.getImputedFeatures()) {
                imputed.merge(feature, 1L, Long::sum);
            }
            if (vector.isUnknownLocation()) {
                unknownLocations++;
            }
        }

        imputed.forEach((feature, count) -> {
            metricsConfig.recordImputation(feature.getFeatureName(), count);
            log.debug("Batch {}: imputed {} for {} rows", sourceName, feature.getFeatureName(), count);
        });
        if (unknownLocations > 0) {
            metricsConfig.recordUnknownLocations(unknownLocations);
            log.debug("Batch {}: {} rows with a location outside the fitted vocabulary", sourceName, unknownLocations);
        }
    }
}
