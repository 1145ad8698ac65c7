package com.secops.riskengine.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RiskLevel {
    NONE,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Any critical contributor forces CRITICAL and any high contributor forces HIGH,
     * whatever the numeric score. Otherwise the score decides.
     */
    public static RiskLevel derive(int criticalCount, int highCount, double riskScore, boolean hasSignals) {
        if (criticalCount > 0) return CRITICAL;
        if (highCount > 0) return HIGH;
        if (riskScore >= 100) return CRITICAL;
        if (riskScore >= 75) return HIGH;
        if (riskScore >= 50) return MEDIUM;
        if (riskScore > 20) return LOW;
        return hasSignals ? LOW : NONE;
    }
}
