package com.gsm.fraud.config;

import com.gsm.fraud.engine.ScoringModel;
import com.gsm.fraud.engine.classifier.FraudClassifier;
import com.gsm.fraud.engine.features.FittedTransformState;
import com.gsm.fraud.repository.ModelArtifactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Loads the fitted transform and classifier once at startup. A mismatched pair fails
 * context startup with a ModelConfigurationException.
 */
@Configuration
public class ModelArtifactConfig {

    private static final Logger log = LoggerFactory.getLogger(ModelArtifactConfig.class);

    @Bean
    public ScoringModel scoringModel(ModelArtifactRepository artifactRepository) {
        FittedTransformState state = artifactRepository.loadTransformState();
        FraudClassifier classifier = artifactRepository.loadClassifier();
        ScoringModel model = ScoringModel.of(state, classifier);

        log.info("Scoring model ready: classifier={}, features={}, locations={}, referenceDate={}",
                classifier.getVersion(), state.dimension(),
                state.getLocationVocabulary().getCategories(), state.getReferenceDate());
        return model;
    }
}
