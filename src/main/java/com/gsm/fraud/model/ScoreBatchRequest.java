package com.gsm.fraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Pre-parsed batch: column names plus rows of string or number cells")
public class ScoreBatchRequest {

    @Schema(description = "Column names, in row order",
            example = "[\"subscriber_id\",\"IMEI\",\"registration_date\",\"location\",\"initial_call_count\",\"average_call_duration\",\"device_switch_count\"]")
    private List<String> columns;

    @Schema(description = "Data rows; null or empty cells count as missing",
            example = "[[\"SUB-1001\",\"356938035643809\",\"2023-04-12\",\"urban\",42,63.5,1]]")
    private List<List<Object>> rows;

    @Schema(description = "Optional label stored with the result", example = "crm-export-2024-03")
    private String sourceName;

    public RawBatch toRawBatch() {
        List<List<String>> stringRows = new ArrayList<>();
        if (rows != null) {
            for (List<Object> row : rows) {
                List<String> cells = new ArrayList<>();
                if (row != null) {
                    for (Object cell : row) {
                        cells.add(cell == null ? null : String.valueOf(cell));
                    }
                }
                stringRows.add(cells);
            }
        }
        return RawBatch.builder()
                .headers(columns)
                .rows(stringRows)
                .sourceName(sourceName)
                .build();
    }
}
