package com.gsm.fraud.engine.features;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * On-disk form of the fitted transform ({@code transform.json}).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TransformArtifact {

    // ISO date, e.g. 2023-01-01
    private String referenceDate;

    private List<NumericFeatureParams> numericFeatures;

    private List<String> locationVocabulary;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NumericFeatureParams {
        private String name;
        private double mean;
        private double stdDev;
    }
}
