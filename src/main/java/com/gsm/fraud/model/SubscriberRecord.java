package com.gsm.fraud.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One validated subscriber row. All columns of the upload are kept, in upload order,
 * so that extra columns can be reported back next to the prediction.
 */
public class SubscriberRecord {

    private final int rowIndex;
    private final Map<String, String> fields;

    public SubscriberRecord(int rowIndex, Map<String, String> fields) {
        this.rowIndex = rowIndex;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public int getRowIndex() { return rowIndex; }
    public Map<String, String> getFields() { return fields; }

    public String getSubscriberId() { return fields.get(SubscriberColumns.SUBSCRIBER_ID); }
    public String getRegistrationDate() { return fields.get(SubscriberColumns.REGISTRATION_DATE); }
    public String getLocation() { return fields.get(SubscriberColumns.LOCATION); }
    public String getInitialCallCount() { return fields.get(SubscriberColumns.INITIAL_CALL_COUNT); }
    public String getAverageCallDuration() { return fields.get(SubscriberColumns.AVERAGE_CALL_DURATION); }
    public String getDeviceSwitchCount() { return fields.get(SubscriberColumns.DEVICE_SWITCH_COUNT); }
}
