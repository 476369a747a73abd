package com.gsm.fraud.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "scoring")
public class ScoringConfig {

    // Batches with at least this many rows are scored with a parallel stream.
    private int parallelRowThreshold = 512;

    private Artifacts artifacts = new Artifacts();

    private ResultStore resultStore = new ResultStore();

    @Data
    public static class Artifacts {
        // Spring resource locations: classpath:, file: or a plain path
        private String transformLocation = "classpath:model/transform.json";
        private String classifierLocation = "classpath:model/classifier.json";
    }

    @Data
    public static class ResultStore {
        // "file" or "aerospike"
        private String type = "file";
        private String directory = "data/results";
    }
}
