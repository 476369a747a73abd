package com.gsm.fraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Fraud prediction for a single subscriber row")
public class Prediction {

    @Schema(description = "Subscriber identifier from the upload", example = "SUB-1001")
    private String subscriberId;

    @Schema(description = "Classifier output in [0, 1]", example = "0.8512")
    private double fraudProbability;

    @Schema(description = "1 when fraudProbability > 0.5, else 0", example = "1", allowableValues = {"0", "1"})
    private int predictedFraud;

    @Schema(description = "Label derived from predictedFraud", example = "Fraud")
    private Classification classification;

    @Schema(description = "All columns of the original row, including extra columns")
    private Map<String, String> record;
}
