package com.gsm.fraud.controller;

import com.gsm.fraud.engine.ScoringModel;
import com.gsm.fraud.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ModelController.class)
class ModelControllerTest {

    @TestConfiguration
    static class TestModelConfig {
        @Bean
        ScoringModel scoringModel() {
            return TestDataFactory.scoringModel();
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Test
    void getModelMetadata_describesLoadedArtifacts() throws Exception {
        mockMvc.perform(get("/api/v1/model"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value(TestDataFactory.TEST_MODEL_VERSION))
                .andExpect(jsonPath("$.featureCount").value(7))
                .andExpect(jsonPath("$.featureNames[0]").value("initial_call_count"))
                .andExpect(jsonPath("$.featureNames[4]").value("location_rural"))
                .andExpect(jsonPath("$.locationVocabulary.length()").value(3))
                .andExpect(jsonPath("$.referenceDate").value("2023-01-01"))
                .andExpect(jsonPath("$.layers[0].activation").value("sigmoid"));
    }
}
