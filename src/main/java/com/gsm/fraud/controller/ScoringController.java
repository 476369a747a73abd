package com.gsm.fraud.controller;

import com.gsm.fraud.exception.SchemaValidationException;
import com.gsm.fraud.model.RawBatch;
import com.gsm.fraud.model.ScoreBatchRequest;
import com.gsm.fraud.model.ScoringResult;
import com.gsm.fraud.service.BatchScoringService;
import com.gsm.fraud.service.CsvBatchCodec;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

@RestController
@RequestMapping("/api/v1/scoring")
@Tag(name = "Scoring", description = "Score subscriber registration batches for fraud")
public class ScoringController {

    private static final Logger log = LoggerFactory.getLogger(ScoringController.class);

    private final BatchScoringService scoringService;
    private final CsvBatchCodec csvBatchCodec;

    public ScoringController(BatchScoringService scoringService, CsvBatchCodec csvBatchCodec) {
        this.scoringService = scoringService;
        this.csvBatchCodec = csvBatchCodec;
    }

    @Operation(summary = "Upload a subscriber CSV for scoring",
            description = "Parses the CSV, validates the column set, scores every row and persists the result. " +
                    "Returns the result identifier, the batch summary and every prediction.")
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ScoringResult> upload(@RequestParam("file") MultipartFile file) throws IOException {
        String filename = file.getOriginalFilename();
        if (file.isEmpty()) {
            throw new SchemaValidationException("Uploaded file " + filename + " is empty");
        }
        if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            throw new SchemaValidationException("Invalid file type for " + filename + ": please upload a CSV file");
        }

        log.info("Received upload {} ({} bytes)", filename, file.getSize());
        RawBatch batch;
        try (InputStream in = file.getInputStream()) {
            batch = csvBatchCodec.read(in, filename);
        }
        ScoringResult result = scoringService.scoreBatch(batch);
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Score a pre-parsed batch",
            description = "Scores rows that were already parsed by the caller (column names plus rows of cells).")
    @PostMapping("/batches")
    public ResponseEntity<ScoringResult> scoreBatch(@RequestBody ScoreBatchRequest request) {
        ScoringResult result = scoringService.scoreBatch(request.toRawBatch());
        return ResponseEntity.ok(result);
    }
}
