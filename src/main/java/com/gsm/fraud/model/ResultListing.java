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
@Schema(description = "Entry of the saved uploads listing")
public class ResultListing {

    @Schema(description = "Result identifier", example = "3f0c2a1e-6d2b-4b8e-9a57-0d4c1f7e2b11")
    private String resultId;

    @Schema(description = "Name of the uploaded file, if any", example = "subscribers_march.csv")
    private String sourceName;

    @Schema(description = "Creation timestamp in epoch milliseconds", example = "1739886764000")
    private long createdAt;

    private BatchSummary summary;

    public static ResultListing of(ScoringResult result) {
        return ResultListing.builder()
                .resultId(result.getResultId())
                .sourceName(result.getSourceName())
                .createdAt(result.getCreatedAt())
                .summary(result.getSummary())
                .build();
    }
}
