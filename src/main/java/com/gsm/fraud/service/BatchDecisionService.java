package com.gsm.fraud.service;

import com.gsm.fraud.model.BatchSummary;
import com.gsm.fraud.model.Classification;
import com.gsm.fraud.model.Prediction;
import com.gsm.fraud.model.RiskBand;
import com.gsm.fraud.model.SubscriberRecord;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns classifier probabilities into decisions and batch statistics.
 *
 * The fraud threshold is fixed at 0.5 so that summaries of different batches stay
 * comparable; a probability of exactly 0.5 is Legitimate.
 */
@Service
public class BatchDecisionService {

    public static final double FRAUD_THRESHOLD = 0.5;

    public Prediction decide(SubscriberRecord record, double fraudProbability) {
        int predictedFraud = fraudProbability > FRAUD_THRESHOLD ? 1 : 0;
        return Prediction.builder()
                .subscriberId(record.getSubscriberId())
                .fraudProbability(fraudProbability)
                .predictedFraud(predictedFraud)
                .classification(predictedFraud == 1 ? Classification.FRAUD : Classification.LEGITIMATE)
                .record(record.getFields())
                .build();
    }

    /**
     * Aggregates a batch. avgProb is the arithmetic mean of the probabilities, 0 for an empty list.
     */
    public BatchSummary summarize(List<Prediction> predictions) {
        int total = predictions.size();
        int frauds = 0;
        double probabilitySum = 0.0;
        for (Prediction prediction : predictions) {
            if (prediction.getPredictedFraud() == 1) {
                frauds++;
            }
            probabilitySum += prediction.getFraudProbability();
        }

        return BatchSummary.builder()
                .total(total)
                .predictedFrauds(frauds)
                .legitCount(total - frauds)
                .avgProb(total == 0 ? 0.0 : probabilitySum / total)
                .build();
    }

    /**
     * Counts predictions per reporting risk band. Every band is present, possibly with 0.
     */
    public Map<RiskBand, Long> riskBands(List<Prediction> predictions) {
        Map<RiskBand, Long> counts = new EnumMap<>(RiskBand.class);
        for (RiskBand band : RiskBand.values()) {
            counts.put(band, 0L);
        }
        for (Prediction prediction : predictions) {
            counts.merge(RiskBand.fromProbability(prediction.getFraudProbability()), 1L, Long::sum);
        }
        return counts;
    }
}
