package com.secops.riskengine.engine;

import lombok.Value;

/**
 * Identifies one threshold counter: a user, a time bucket, an event type and
 * (for rules with a count field) one distinct field value.
 */
@Value
public class TrackingKey {
    String userId;
    String timeBucket;
    String eventType;
    // null when the rule has no count field
    String fieldValue;

    /** Key under which the counter's one alert is recorded. */
    public String alertKey() {
        return fieldValue == null ? eventType : eventType + "-" + fieldValue;
    }
}
