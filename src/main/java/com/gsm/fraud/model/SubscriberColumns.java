package com.gsm.fraud.model;

import java.util.List;

/**
 * Column names of the subscriber registration schema.
 */
public final class SubscriberColumns {

    public static final String SUBSCRIBER_ID = "subscriber_id";
    public static final String IMEI = "IMEI";
    public static final String REGISTRATION_DATE = "registration_date";
    public static final String LOCATION = "location";
    public static final String INITIAL_CALL_COUNT = "initial_call_count";
    public static final String AVERAGE_CALL_DURATION = "average_call_duration";
    public static final String DEVICE_SWITCH_COUNT = "device_switch_count";

    // Legacy exports use "id" for the subscriber identifier
    public static final String LEGACY_ID = "id";

    public static final List<String> REQUIRED = List.of(
            SUBSCRIBER_ID,
            IMEI,
            REGISTRATION_DATE,
            LOCATION,
            INITIAL_CALL_COUNT,
            AVERAGE_CALL_DURATION,
            DEVICE_SWITCH_COUNT
    );

    private SubscriberColumns() {}
}
