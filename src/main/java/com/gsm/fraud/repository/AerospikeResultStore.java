package com.gsm.fraud.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gsm.fraud.config.AerospikeConfig;
import com.gsm.fraud.exception.ResultNotFoundException;
import com.gsm.fraud.exception.ResultStoreException;
import com.gsm.fraud.model.BatchSummary;
import com.gsm.fraud.model.Prediction;
import com.gsm.fraud.model.ResultListing;
import com.gsm.fraud.model.ScoringResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Result store backed by one Aerospike record per result in the {@code scoring_results} set.
 *
 * A single-record put is atomic, so readers never see half a result. Writes use a
 * CREATE_ONLY policy: if a generated identifier already exists the put fails with
 * KEY_EXISTS_ERROR and a fresh identifier is tried.
 */
@Repository
@ConditionalOnProperty(prefix = "scoring.result-store", name = "type", havingValue = "aerospike")
public class AerospikeResultStore implements ResultStore {

    private static final Logger log = LoggerFactory.getLogger(AerospikeResultStore.class);

    private static final int MAX_ID_ATTEMPTS = 3;

    static final String BIN_RESULT_ID = "resultId";
    static final String BIN_SOURCE_NAME = "sourceName";
    static final String BIN_MODEL_VERSION = "modelVersion";
    static final String BIN_CREATED_AT = "createdAt";
    static final String BIN_TOTAL = "total";
    static final String BIN_FRAUDS = "frauds";
    static final String BIN_LEGIT = "legitCount";
    static final String BIN_AVG_PROB = "avgProb";
    static final String BIN_PREDICTIONS = "predictions";

    private static final String[] LISTING_BINS = {
            BIN_RESULT_ID, BIN_SOURCE_NAME, BIN_CREATED_AT, BIN_TOTAL, BIN_FRAUDS, BIN_LEGIT, BIN_AVG_PROB
    };

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;
    // Strictly increasing within this process so same-millisecond saves keep their order
    private final AtomicLong lastCreatedAt = new AtomicLong();

    public AerospikeResultStore(AerospikeClient client,
                                @Qualifier("aerospikeNamespace") String namespace,
                                @Qualifier("createOnlyWritePolicy") WritePolicy writePolicy,
                                @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public ScoringResult save(ScoringResult result) {
        String predictionsJson = serializePredictions(result.getPredictions());
        BatchSummary summary = result.getSummary();

        for (int attempt = 1; attempt <= MAX_ID_ATTEMPTS; attempt++) {
            String resultId = UUID.randomUUID().toString();
            long createdAt = lastCreatedAt.updateAndGet(prev -> Math.max(prev + 1, System.currentTimeMillis()));
            Key key = new Key(namespace, AerospikeConfig.SET_SCORING_RESULTS, resultId);

            try {
                client.put(writePolicy, key,
                        new Bin(BIN_RESULT_ID, resultId),
                        new Bin(BIN_SOURCE_NAME, result.getSourceName()),
                        new Bin(BIN_MODEL_VERSION, result.getModelVersion()),
                        new Bin(BIN_CREATED_AT, createdAt),
                        new Bin(BIN_TOTAL, summary.getTotal()),
                        new Bin(BIN_FRAUDS, summary.getPredictedFrauds()),
                        new Bin(BIN_LEGIT, summary.getLegitCount()),
                        new Bin(BIN_AVG_PROB, summary.getAvgProb()),
                        new Bin(BIN_PREDICTIONS, predictionsJson));
            } catch (AerospikeException e) {
                if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                    log.warn("Result id {} already taken, retrying ({}/{})", resultId, attempt, MAX_ID_ATTEMPTS);
                    continue;
                }
                log.error("Failed to persist result {}", resultId, e);
                throw new ResultStoreException("Failed to persist result " + resultId, e);
            }

            log.info("Saved result {} ({} predictions) to Aerospike", resultId, summary.getTotal());
            return result.toBuilder()
                    .resultId(resultId)
                    .createdAt(createdAt)
                    .build();
        }

        throw new ResultStoreException("Could not allocate a unique result id after " + MAX_ID_ATTEMPTS + " attempts", null);
    }

    @Override
    public ScoringResult load(String resultId) {
        if (resultId == null || resultId.isBlank()) {
            throw new ResultNotFoundException(resultId);
        }
        Key key = new Key(namespace, AerospikeConfig.SET_SCORING_RESULTS, resultId);
        Record record;
        try {
            record = client.get(readPolicy, key);
        } catch (AerospikeException e) {
            throw new ResultStoreException("Failed to read result " + resultId, e);
        }
        if (record == null) {
            throw new ResultNotFoundException(resultId);
        }

        return ScoringResult.builder()
                .resultId(resultId)
                .sourceName(record.getString(BIN_SOURCE_NAME))
                .modelVersion(record.getString(BIN_MODEL_VERSION))
                .createdAt(record.getLong(BIN_CREATED_AT))
                .summary(mapSummary(record))
                .predictions(deserializePredictions(resultId, record.getString(BIN_PREDICTIONS)))
                .build();
    }

    @Override
    public List<ResultListing> list() {
        List<ResultListing> listings = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_SCORING_RESULTS,
                (key, record) -> {
                    ResultListing listing = ResultListing.builder()
                            .resultId(record.getString(BIN_RESULT_ID))
                            .sourceName(record.getString(BIN_SOURCE_NAME))
                            .createdAt(record.getLong(BIN_CREATED_AT))
                            .summary(mapSummary(record))
                            .build();
                    synchronized (listings) {
                        listings.add(listing);
                    }
                }, LISTING_BINS);

        listings.sort(Comparator.comparingLong(ResultListing::getCreatedAt).reversed()
                .thenComparing(ResultListing::getResultId));
        return listings;
    }

    @Override
    public void purge(String resultId) {
        if (resultId == null || resultId.isBlank()) {
            throw new ResultNotFoundException(resultId);
        }
        Key key = new Key(namespace, AerospikeConfig.SET_SCORING_RESULTS, resultId);
        boolean existed;
        try {
            existed = client.delete(null, key);
        } catch (AerospikeException e) {
            throw new ResultStoreException("Failed to purge result " + resultId, e);
        }
        if (!existed) {
            throw new ResultNotFoundException(resultId);
        }
        log.info("Purged result {}", resultId);
    }

    private BatchSummary mapSummary(Record record) {
        return BatchSummary.builder()
                .total(record.getInt(BIN_TOTAL))
                .predictedFrauds(record.getInt(BIN_FRAUDS))
                .legitCount(record.getInt(BIN_LEGIT))
                .avgProb(record.getDouble(BIN_AVG_PROB))
                .build();
    }

    private String serializePredictions(List<Prediction> predictions) {
        try {
            return objectMapper.writeValueAsString(predictions != null ? predictions : List.of());
        } catch (JsonProcessingException e) {
            throw new ResultStoreException("Failed to serialize predictions", e);
        }
    }

    private List<Prediction> deserializePredictions(String resultId, String json) {
        if (json == null || json.isEmpty()) return List.of();
        try {
            return objectMapper.readValue(json, new TypeReference<List<Prediction>>() {});
        } catch (JsonProcessingException e) {
            throw new ResultStoreException("Failed to deserialize predictions of result " + resultId, e);
        }
    }
}
