package com.gsm.fraud.service;

import com.gsm.fraud.config.MetricsConfig;
import com.gsm.fraud.config.ScoringConfig;
import com.gsm.fraud.engine.SchemaValidator;
import com.gsm.fraud.exception.ResultNotFoundException;
import com.gsm.fraud.exception.SchemaValidationException;
import com.gsm.fraud.model.*;
import com.gsm.fraud.repository.ResultStore;
import com.gsm.fraud.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchScoringServiceTest {

    @Mock private ResultStore resultStore;
    @Mock private MetricsConfig metricsConfig;

    private BatchScoringService scoringService;
    private ScoringConfig scoringConfig;

    @BeforeEach
    void setUp() {
        scoringConfig = new ScoringConfig();
        scoringService = new BatchScoringService(
                new SchemaValidator(),
                TestDataFactory.scoringModel(),
                new BatchDecisionService(),
                resultStore,
                metricsConfig,
                scoringConfig);
    }

    private void storeAssignsId(String resultId) {
        when(resultStore.save(any(ScoringResult.class))).thenAnswer(inv ->
                ((ScoringResult) inv.getArgument(0)).toBuilder()
                        .resultId(resultId)
                        .createdAt(1739886764000L)
                        .build());
    }

    @Test
    void scoreBatch_validBatch_persistsSummaryAndPredictions() {
        storeAssignsId("R-1");
        RawBatch batch = TestDataFactory.rawBatch(
                TestDataFactory.row("SUB-1", "4"),
                TestDataFactory.row("SUB-2", "0"),
                TestDataFactory.row("SUB-3", "2"));

        ScoringResult result = scoringService.scoreBatch(batch);

        assertThat(result.getResultId()).isEqualTo("R-1");
        assertThat(result.getModelVersion()).isEqualTo(TestDataFactory.TEST_MODEL_VERSION);
        assertThat(result.getSourceName()).isEqualTo("subscribers.csv");
        assertThat(result.getSummary().getTotal()).isEqualTo(3);
        assertThat(result.getSummary().getPredictedFrauds()).isEqualTo(1);
        assertThat(result.getSummary().getLegitCount()).isEqualTo(2);
        assertThat(result.getPredictions()).extracting(Prediction::getClassification)
                .containsExactly(Classification.FRAUD, Classification.LEGITIMATE, Classification.LEGITIMATE);

        double expectedAvg = result.getPredictions().stream().mapToDouble(Prediction::getFraudProbability).average().orElseThrow();
        assertThat(result.getSummary().getAvgProb()).isCloseTo(expectedAvg, within(1e-12));

        verify(resultStore, times(1)).save(any(ScoringResult.class));
        verify(metricsConfig).recordBatchScored(eq(3), eq(1), anyDouble());
    }

    @Test
    void scoreBatch_missingColumn_nothingScoredOrPersisted() {
        List<String> headers = new ArrayList<>(SubscriberColumns.REQUIRED);
        headers.remove(SubscriberColumns.DEVICE_SWITCH_COUNT);
        RawBatch batch = RawBatch.builder()
                .headers(headers)
                .rows(List.of(Arrays.asList("SUB-1", "356938035643809", "2023-06-01", "urban", "40", "90")))
                .sourceName("broken.csv")
                .build();

        assertThatThrownBy(() -> scoringService.scoreBatch(batch))
                .isInstanceOf(SchemaValidationException.class);

        verify(resultStore, never()).save(any());
        verify(metricsConfig).recordBatchRejected("schema");
        verify(metricsConfig, never()).recordBatchScored(anyInt(), anyInt(), anyDouble());
    }

    @Test
    void scoreBatch_largeBatch_keepsInputOrderWhenParallel() {
        storeAssignsId("R-2");
        scoringConfig.setParallelRowThreshold(4);
        List<List<String>> rows = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            rows.add(TestDataFactory.row("SUB-" + i, i % 2 == 0 ? "4" : "0"));
        }
        RawBatch batch = RawBatch.builder()
                .headers(new ArrayList<>(SubscriberColumns.REQUIRED))
                .rows(rows)
                .build();

        ScoringResult result = scoringService.scoreBatch(batch);

        assertThat(result.getPredictions()).hasSize(200);
        for (int i = 0; i < 200; i++) {
            Prediction prediction = result.getPredictions().get(i);
            assertThat(prediction.getSubscriberId()).isEqualTo("SUB-" + i);
            assertThat(prediction.getPredictedFraud()).isEqualTo(i % 2 == 0 ? 1 : 0);
        }
        assertThat(result.getSummary().getPredictedFrauds()).isEqualTo(100);
    }

    @Test
    void scoreBatch_dirtyCells_recordDataQualityMetrics() {
        storeAssignsId("R-3");
        List<String> blankDuration = TestDataFactory.row("SUB-1", "1");
        blankDuration.set(5, null);
        List<String> unseenLocation = TestDataFactory.row("SUB-2", "1");
        unseenLocation.set(3, "offshore");

        scoringService.scoreBatch(TestDataFactory.rawBatch(blankDuration, unseenLocation));

        verify(metricsConfig).recordImputation("average_call_duration", 1L);
        verify(metricsConfig).recordUnknownLocations(1L);
    }

    @Test
    void scoreBatch_persistedPredictionsCarryOriginalRow() {
        storeAssignsId("R-4");

        scoringService.scoreBatch(TestDataFactory.rawBatch(TestDataFactory.row("SUB-1", "4")));

        ArgumentCaptor<ScoringResult> captor = ArgumentCaptor.forClass(ScoringResult.class);
        verify(resultStore).save(captor.capture());
        ScoringResult saved = captor.getValue();
        assertThat(saved.getResultId()).isNull();
        assertThat(saved.getPredictions().get(0).getRecord())
                .containsEntry("IMEI", "356938035643809")
                .containsEntry("location", "urban");
    }

    @Test
    void getResult_unknownId_propagatesNotFound() {
        when(resultStore.load("nope")).thenThrow(new ResultNotFoundException("nope"));

        assertThatThrownBy(() -> scoringService.getResult("nope"))
                .isInstanceOf(ResultNotFoundException.class);
    }

    @Test
    void riskBands_derivedFromStoredPredictions() {
        when(resultStore.load("R-5")).thenReturn(TestDataFactory.scoringResult("R-5", 0.15, 0.85, 0.35, 0.92, 0.08));

        Map<RiskBand, Long> bands = scoringService.riskBands("R-5");

        assertThat(bands).containsEntry(RiskBand.LOW, 2L)
                .containsEntry(RiskBand.MEDIUM, 1L)
                .containsEntry(RiskBand.HIGH, 2L);
    }
}
