package com.secops.riskengine.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AnomalyType {
    UNUSUAL_HOURS,
    RAPID_LOCATION_CHANGE,
    WEEKEND_ACTIVITY;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
