package com.gsm.fraud.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gsm.fraud.config.ScoringConfig;
import com.gsm.fraud.engine.classifier.ClassifierArtifact;
import com.gsm.fraud.engine.classifier.FraudClassifier;
import com.gsm.fraud.engine.classifier.NetworkArchitecture;
import com.gsm.fraud.engine.features.FittedTransformState;
import com.gsm.fraud.engine.features.TransformArtifact;
import com.gsm.fraud.exception.ModelConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads the fitted transform and classifier artifacts (JSON) from their configured locations.
 */
@Repository
public class ModelArtifactRepository {

    private static final Logger log = LoggerFactory.getLogger(ModelArtifactRepository.class);

    private final ResourceLoader resourceLoader;
    private final ScoringConfig scoringConfig;
    private final ObjectMapper objectMapper;

    public ModelArtifactRepository(ResourceLoader resourceLoader, ScoringConfig scoringConfig) {
        this.resourceLoader = resourceLoader;
        this.scoringConfig = scoringConfig;
        this.objectMapper = new ObjectMapper();
    }

    public FittedTransformState loadTransformState() {
        String location = scoringConfig.getArtifacts().getTransformLocation();
        TransformArtifact artifact = read(location, TransformArtifact.class);
        FittedTransformState state = FittedTransformState.fromArtifact(artifact);
        log.info("Loaded fitted transform from {}: {} features", location, state.dimension());
        return state;
    }

    public FraudClassifier loadClassifier() {
        String location = scoringConfig.getArtifacts().getClassifierLocation();
        ClassifierArtifact artifact = read(location, ClassifierArtifact.class);
        FraudClassifier classifier = NetworkArchitecture.build(artifact);
        log.info("Loaded classifier {} from {}: input dimension {}",
                classifier.getVersion(), location, classifier.inputDimension());
        return classifier;
    }

    private <T> T read(String location, Class<T> type) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ModelConfigurationException("Model artifact not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, type);
        } catch (IOException e) {
            throw new ModelConfigurationException("Failed to read model artifact " + location, e);
        }
    }
}
