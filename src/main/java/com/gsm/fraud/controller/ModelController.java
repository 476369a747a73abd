package com.gsm.fraud.controller;

import com.gsm.fraud.engine.ScoringModel;
import com.gsm.fraud.engine.classifier.DenseLayer;
import com.gsm.fraud.engine.classifier.NetworkArchitecture;
import com.gsm.fraud.engine.features.FittedTransformState;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/model")
@Tag(name = "Model", description = "Metadata of the loaded transform and classifier")
public class ModelController {

    private final ScoringModel scoringModel;

    public ModelController(ScoringModel scoringModel) {
        this.scoringModel = scoringModel;
    }

    @Operation(summary = "Get loaded model metadata",
            description = "Returns the classifier version, the feature layout (names in vector order), the location " +
                    "vocabulary, the reference registration date and the dense layer shapes.")
    @GetMapping
    public ResponseEntity<Map<String, Object>> getModelMetadata() {
        FittedTransformState state = scoringModel.getTransformState();

        List<Map<String, Object>> layers = new ArrayList<>();
        List<DenseLayer> denseLayers = scoringModel.getClassifier().getLayers();
        for (int i = 0; i < denseLayers.size(); i++) {
            DenseLayer layer = denseLayers.get(i);
            Map<String, Object> description = new LinkedHashMap<>();
            description.put("units", layer.units());
            description.put("activation", layer.getActivation().jsonName());
            boolean hidden = i < denseLayers.size() - 1;
            if (hidden && i < NetworkArchitecture.TRAINING_DROPOUT.length) {
                description.put("trainingDropout", NetworkArchitecture.TRAINING_DROPOUT[i]);
            }
            layers.add(description);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("version", scoringModel.getClassifier().getVersion());
        metadata.put("featureCount", state.dimension());
        metadata.put("featureNames", state.featureNames());
        metadata.put("locationVocabulary", state.getLocationVocabulary().getCategories());
        metadata.put("referenceDate", state.getReferenceDate().toString());
        metadata.put("layers", layers);
        return ResponseEntity.ok(metadata);
    }
}
