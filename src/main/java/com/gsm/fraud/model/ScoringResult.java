package com.gsm.fraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A persisted scored batch. Written once by the result store and never modified.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Scored batch: summary plus every prediction")
public class ScoringResult {

    @Schema(description = "Generated result identifier", example = "3f0c2a1e-6d2b-4b8e-9a57-0d4c1f7e2b11")
    private String resultId;

    @Schema(description = "Name of the uploaded file, if any", example = "subscribers_march.csv")
    private String sourceName;

    @Schema(description = "Version of the classifier artifact that produced the scores", example = "2024.03")
    private String modelVersion;

    @Schema(description = "Creation timestamp in epoch milliseconds", example = "1739886764000")
    private long createdAt;

    private BatchSummary summary;

    private List<Prediction> predictions;
}
