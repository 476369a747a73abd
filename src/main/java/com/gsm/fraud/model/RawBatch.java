package com.gsm.fraud.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * An uploaded batch as parsed from CSV: one header row and any number of data rows.
 * Cells are kept as raw strings; a {@code null} cell means the value is missing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawBatch {

    private List<String> headers;

    private List<List<String>> rows;

    // Uploaded file name, if the batch came from a file
    private String sourceName;
}
