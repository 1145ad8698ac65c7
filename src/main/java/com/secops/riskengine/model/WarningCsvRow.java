package com.secops.riskengine.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Flattened report row: the user's base columns plus one warning.
 */
@Value
@Builder(toBuilder = true)
public class WarningCsvRow {

    public static final String NOT_AVAILABLE = "N/A";
    public static final String NO_RISKS = "No security risks detected";

    String username;
    String userId;
    String firstLoginDate;
    String lastLoginDate;
    int loginDaysCount;
    int uniqueIPs;
    int scannedLogsCount;
    String scannedEventTypes;
    long riskScore;
    String riskLevel;
    int anomalyCount;
    int criticalEvents;
    int highRiskEvents;
    String riskFactorsExplanation;

    String date;
    String time;
    String warning;
    String severity;
    String eventType;
    String clientIp;
    String sessionKey;
    @Builder.Default
    Map<String, String> context = Map.of();
}
