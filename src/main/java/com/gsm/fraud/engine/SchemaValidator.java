package com.gsm.fraud.engine;

import com.gsm.fraud.exception.SchemaValidationException;
import com.gsm.fraud.model.RawBatch;
import com.gsm.fraud.model.SubscriberColumns;
import com.gsm.fraud.model.SubscriberRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks a raw batch against the subscriber schema and turns its rows into records.
 *
 * Only the column set is validated here. Cell-level problems (blank or malformed numbers,
 * unseen locations) are left to the feature transformer, which imputes instead of rejecting.
 */
@Component
public class SchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(SchemaValidator.class);

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    public List<SubscriberRecord> validate(RawBatch batch) {
        if (batch == null || batch.getHeaders() == null || batch.getHeaders().isEmpty()) {
            throw new SchemaValidationException("Batch has no header row", SubscriberColumns.REQUIRED);
        }

        List<String> headers = normalizeHeaders(batch.getHeaders());

        List<String> missing = new ArrayList<>();
        for (String required : SubscriberColumns.REQUIRED) {
            if (!headers.contains(required)) {
                missing.add(required);
            }
        }
        if (!missing.isEmpty()) {
            throw new SchemaValidationException("Missing required columns: " + String.join(", ", missing), missing);
        }

        List<List<String>> rows = batch.getRows() != null ? batch.getRows() : List.of();
        if (rows.isEmpty()) {
            throw new SchemaValidationException("Batch contains no data rows");
        }

        List<SubscriberRecord> records = new ArrayList<>(rows.size());
        Set<String> seenIds = new HashSet<>();
        int duplicates = 0;
        for (int r = 0; r < rows.size(); r++) {
            List<String> row = rows.get(r) != null ? rows.get(r) : List.of();
            Map<String, String> fields = new LinkedHashMap<>();
            for (int c = 0; c < headers.size(); c++) {
                // First occurrence wins for repeated header names
                fields.putIfAbsent(headers.get(c), c < row.size() ? row.get(c) : null);
            }
            SubscriberRecord record = new SubscriberRecord(r, fields);
            String subscriberId = record.getSubscriberId();
            if (subscriberId != null && !seenIds.add(subscriberId)) {
                duplicates++;
            }
            records.add(record);
        }

        if (duplicates > 0) {
            log.warn("Batch {} contains {} duplicate subscriber_id values", batch.getSourceName(), duplicates);
        }
        return records;
    }

    private List<String> normalizeHeaders(List<String> rawHeaders) {
        List<String> headers = new ArrayList<>(rawHeaders.size());
        for (int i = 0; i < rawHeaders.size(); i++) {
            String header = rawHeaders.get(i) == null ? "" : rawHeaders.get(i).trim();
            if (i == 0 && !header.isEmpty() && header.charAt(0) == BYTE_ORDER_MARK) {
                header = header.substring(1).trim();
            }
            headers.add(header);
        }
        if (!headers.contains(SubscriberColumns.SUBSCRIBER_ID)) {
            int legacy = headers.indexOf(SubscriberColumns.LEGACY_ID);
            if (legacy >= 0) {
                headers.set(legacy, SubscriberColumns.SUBSCRIBER_ID);
            }
        }
        return headers;
    }
}
