package com.gsm.fraud.controller;

import com.gsm.fraud.model.ResultListing;
import com.gsm.fraud.model.RiskBand;
import com.gsm.fraud.model.ScoringResult;
import com.gsm.fraud.service.BatchScoringService;
import com.gsm.fraud.service.CsvBatchCodec;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/results")
@Tag(name = "Results", description = "Saved scoring results: listing, retrieval, export and purge")
public class ResultController {

    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final BatchScoringService scoringService;
    private final CsvBatchCodec csvBatchCodec;

    public ResultController(BatchScoringService scoringService, CsvBatchCodec csvBatchCodec) {
        this.scoringService = scoringService;
        this.csvBatchCodec = csvBatchCodec;
    }

    @Operation(summary = "List saved results",
            description = "Returns identifier, source file name, creation time and summary of every saved result, most recent first.")
    @GetMapping
    public ResponseEntity<List<ResultListing>> listResults() {
        return ResponseEntity.ok(scoringService.listResults());
    }

    @Operation(summary = "Get a saved result",
            description = "Returns the summary and predictions of a saved result. The summary always covers the whole batch; " +
                    "limit only truncates the returned prediction list for display.")
    @GetMapping("/{resultId}")
    public ResponseEntity<ScoringResult> getResult(
            @Parameter(description = "Result identifier")
            @PathVariable String resultId,
            @Parameter(description = "Maximum number of predictions to return", example = "200")
            @RequestParam(required = false) Integer limit) {
        ScoringResult result = scoringService.getResult(resultId);
        if (limit != null && limit >= 0 && result.getPredictions() != null
                && limit < result.getPredictions().size()) {
            result = result.toBuilder()
                    .predictions(result.getPredictions().subList(0, limit))
                    .build();
        }
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Risk band breakdown",
            description = "Counts predictions per risk band: HIGH (> 0.7), MEDIUM (0.3 - 0.7), LOW (< 0.3). Computed on request.")
    @GetMapping("/{resultId}/risk-bands")
    public ResponseEntity<Map<RiskBand, Long>> getRiskBands(@PathVariable String resultId) {
        return ResponseEntity.ok(scoringService.riskBands(resultId));
    }

    @Operation(summary = "Download predictions as CSV",
            description = "Original columns followed by fraud_probability, predicted_fraud and classification.")
    @GetMapping("/{resultId}/download")
    public ResponseEntity<byte[]> download(@PathVariable String resultId) {
        ScoringResult result = scoringService.getResult(resultId);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            csvBatchCodec.write(result.getPredictions(), out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render result " + resultId + " as CSV", e);
        }

        String filename = "predictions_" + resultId + ".csv";
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(filename).build().toString())
                .body(out.toByteArray());
    }

    @Operation(summary = "Purge a saved result", description = "Permanently removes a result from the store.")
    @DeleteMapping("/{resultId}")
    public ResponseEntity<Void> purge(@PathVariable String resultId) {
        scoringService.purgeResult(resultId);
        return ResponseEntity.noContent().build();
    }
}
