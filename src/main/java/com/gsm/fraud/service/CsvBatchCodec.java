package com.gsm.fraud.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.gsm.fraud.exception.SchemaValidationException;
import com.gsm.fraud.model.Prediction;
import com.gsm.fraud.model.RawBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads uploaded subscriber CSVs into raw batches and writes scored results back out as CSV.
 */
@Component
public class CsvBatchCodec {

    private static final Logger log = LoggerFactory.getLogger(CsvBatchCodec.class);

    // Some exported samples start with an informational line before the real header
    private static final String PREAMBLE_MARKER = "Here are the contents";

    public static final String COL_FRAUD_PROBABILITY = "fraud_probability";
    public static final String COL_PREDICTED_FRAUD = "predicted_fraud";
    public static final String COL_CLASSIFICATION = "classification";

    private final CsvMapper csvMapper;

    public CsvBatchCodec() {
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    /**
     * Parses a CSV stream: first row is the header, the rest are data rows. Empty cells
     * become {@code null} (missing).
     */
    public RawBatch read(InputStream in, String sourceName) {
        List<String[]> lines = new ArrayList<>();
        try (MappingIterator<String[]> it = csvMapper.readerFor(String[].class).readValues(in)) {
            while (it.hasNextValue()) {
                lines.add(it.nextValue());
            }
        } catch (IOException | RuntimeJsonMappingException e) {
            throw new SchemaValidationException("Failed to read CSV " + sourceName + ": " + e.getMessage());
        }

        if (!lines.isEmpty() && isPreamble(lines.get(0))) {
            log.debug("Skipping informational first line in {}", sourceName);
            lines.remove(0);
        }
        if (lines.isEmpty()) {
            throw new SchemaValidationException("CSV " + sourceName + " has no header row");
        }

        List<String> headers = Arrays.asList(lines.get(0));
        List<List<String>> rows = new ArrayList<>(lines.size() - 1);
        for (int i = 1; i < lines.size(); i++) {
            List<String> row = new ArrayList<>(lines.get(i).length);
            for (String cell : lines.get(i)) {
                row.add(cell == null || cell.isEmpty() ? null : cell);
            }
            rows.add(row);
        }

        return RawBatch.builder()
                .headers(headers)
                .rows(rows)
                .sourceName(sourceName)
                .build();
    }

    /**
     * Writes predictions as CSV: every original column in first-seen order, followed by
     * fraud_probability, predicted_fraud and classification.
     */
    public void write(List<Prediction> predictions, OutputStream out) throws IOException {
        Set<String> columns = new LinkedHashSet<>();
        for (Prediction prediction : predictions) {
            if (prediction.getRecord() != null) {
                columns.addAll(prediction.getRecord().keySet());
            }
        }
        columns.add(COL_FRAUD_PROBABILITY);
        columns.add(COL_PREDICTED_FRAUD);
        columns.add(COL_CLASSIFICATION);

        CsvSchema.Builder schemaBuilder = CsvSchema.builder();
        for (String column : columns) {
            schemaBuilder.addColumn(column);
        }
        CsvSchema schema = schemaBuilder.build().withHeader();

        try (SequenceWriter writer = csvMapper.writer(schema).writeValues(out)) {
            for (Prediction prediction : predictions) {
                Map<String, Object> row = new LinkedHashMap<>();
                if (prediction.getRecord() != null) {
                    row.putAll(prediction.getRecord());
                }
                row.put(COL_FRAUD_PROBABILITY, prediction.getFraudProbability());
                row.put(COL_PREDICTED_FRAUD, prediction.getPredictedFraud());
                row.put(COL_CLASSIFICATION, prediction.getClassification().getLabel());
                writer.write(row);
            }
        }
    }

    private boolean isPreamble(String[] firstLine) {
        for (String cell : firstLine) {
            if (cell != null && cell.contains(PREAMBLE_MARKER)) {
                return true;
            }
        }
        return false;
    }
}
