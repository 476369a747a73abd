package com.gsm.fraud.controller;

import com.gsm.fraud.exception.ModelConfigurationException;
import com.gsm.fraud.exception.SchemaValidationException;
import com.gsm.fraud.model.RawBatch;
import com.gsm.fraud.service.BatchScoringService;
import com.gsm.fraud.service.CsvBatchCodec;
import com.gsm.fraud.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ScoringController.class)
@Import(CsvBatchCodec.class)
class ScoringControllerTest {

    private static final String CSV =
            "subscriber_id,IMEI,registration_date,location,initial_call_count,average_call_duration,device_switch_count\n" +
            "SUB-1,356938035643809,2023-04-12,urban,42,63.5,1\n" +
            "SUB-2,356938035643810,2023-04-13,rural,7,,4\n";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BatchScoringService scoringService;

    @Test
    void upload_csv_scoresParsedBatch() throws Exception {
        when(scoringService.scoreBatch(any(RawBatch.class)))
                .thenReturn(TestDataFactory.scoringResult("R-1", 0.2, 0.9));
        MockMultipartFile file = new MockMultipartFile(
                "file", "march.csv", "text/csv", CSV.getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/v1/scoring/upload").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.resultId").value("R-1"))
                .andExpect(jsonPath("$.summary.total").value(2))
                .andExpect(jsonPath("$.predictions[1].classification").value("Fraud"));

        ArgumentCaptor<RawBatch> captor = ArgumentCaptor.forClass(RawBatch.class);
        verify(scoringService).scoreBatch(captor.capture());
        assertThat(captor.getValue().getSourceName()).isEqualTo("march.csv");
        assertThat(captor.getValue().getRows()).hasSize(2);
        assertThat(captor.getValue().getRows().get(1).get(5)).isNull();
    }

    @Test
    void upload_nonCsvFile_rejected() throws Exception {
        MockMultipartFile file = new MockMultipartFile(
                "file", "march.xlsx", "application/octet-stream", new byte[]{1, 2, 3});

        mockMvc.perform(multipart("/api/v1/scoring/upload").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.error").value("Schema Error"))
                .andExpect(jsonPath("$.message").value(containsString("march.xlsx")));

        verify(scoringService, never()).scoreBatch(any());
    }

    @Test
    void upload_emptyFile_rejected() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "march.csv", "text/csv", new byte[0]);

        mockMvc.perform(multipart("/api/v1/scoring/upload").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.error").value("Schema Error"))
                .andExpect(jsonPath("$.timestamp").exists());

        verify(scoringService, never()).scoreBatch(any());
    }

    @Test
    void upload_withoutFilePart_returns400() throws Exception {
        mockMvc.perform(multipart("/api/v1/scoring/upload"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Bad Request"));

        verify(scoringService, never()).scoreBatch(any());
    }

    @Test
    void upload_missingColumn_returnsSchemaError() throws Exception {
        when(scoringService.scoreBatch(any(RawBatch.class)))
                .thenThrow(new SchemaValidationException("Missing required columns: device_switch_count",
                        List.of("device_switch_count")));
        MockMultipartFile file = new MockMultipartFile(
                "file", "march.csv", "text/csv", CSV.getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/v1/scoring/upload").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.error").value("Schema Error"))
                .andExpect(jsonPath("$.details.missingColumns[0]").value("device_switch_count"));
    }

    @Test
    void scoreBatch_json_convertsCellsToStrings() throws Exception {
        when(scoringService.scoreBatch(any(RawBatch.class)))
                .thenReturn(TestDataFactory.scoringResult("R-2", 0.3));

        mockMvc.perform(post("/api/v1/scoring/batches")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"columns": ["subscriber_id", "initial_call_count", "average_call_duration"],
                                 "rows": [["SUB-1", 42, null]],
                                 "sourceName": "crm"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.resultId").value("R-2"));

        ArgumentCaptor<RawBatch> captor = ArgumentCaptor.forClass(RawBatch.class);
        verify(scoringService).scoreBatch(captor.capture());
        assertThat(captor.getValue().getSourceName()).isEqualTo("crm");
        assertThat(captor.getValue().getRows().get(0)).containsExactly("SUB-1", "42", null);
    }

    @Test
    void scoreBatch_mismatchedArtifacts_returnsServerError() throws Exception {
        when(scoringService.scoreBatch(any(RawBatch.class)))
                .thenThrow(new ModelConfigurationException("Fitted transform produces 7 features but classifier v2 expects 8"));

        mockMvc.perform(post("/api/v1/scoring/batches")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"columns\": [\"subscriber_id\"], \"rows\": [[\"SUB-1\"]]}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Configuration Error"))
                .andExpect(jsonPath("$.message").value(containsString("expects 8")));
    }
}
