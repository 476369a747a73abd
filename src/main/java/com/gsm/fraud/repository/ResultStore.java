package com.gsm.fraud.repository;

import com.gsm.fraud.model.ResultListing;
import com.gsm.fraud.model.ScoringResult;

import java.util.List;

/**
 * Durable, append-only history of scored batches.
 *
 * Implementations must assign identifiers that never collide, even under concurrent saves,
 * and must never expose a partially written result to readers.
 */
public interface ResultStore {

    /**
     * Persists the result under a newly generated identifier. Any identifier already set on
     * {@code result} is ignored.
     *
     * @return the stored result, carrying its identifier and creation time
     */
    ScoringResult save(ScoringResult result);

    /**
     * @throws com.gsm.fraud.exception.ResultNotFoundException if no result has this identifier
     */
    ScoringResult load(String resultId);

    /**
     * @return every stored result without its predictions, most recent first
     */
    List<ResultListing> list();

    /**
     * Removes a result permanently.
     *
     * @throws com.gsm.fraud.exception.ResultNotFoundException if no result has this identifier
     */
    void purge(String resultId);
}
