package com.gsm.fraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Aggregate over all predictions of a batch")
public class BatchSummary {

    @Schema(description = "Number of scored rows", example = "5")
    private int total;

    @Schema(description = "Rows classified as Fraud", example = "2")
    private int predictedFrauds;

    @Schema(description = "Rows classified as Legitimate (total - predictedFrauds)", example = "3")
    private int legitCount;

    @Schema(description = "Mean fraud probability over the batch", example = "0.47")
    private double avgProb;
}
