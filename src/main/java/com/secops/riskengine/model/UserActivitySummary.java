package com.secops.riskengine.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Schema(description = "Per-user activity and risk summary")
public class UserActivitySummary {

    String userId;
    String username;
    LoginStats loginStats;
    WarningCounts warningsCount;

    @Schema(description = "Event type -> number of scanned logs that contained this user")
    Map<String, Integer> scannedLogs;

    List<Anomaly> anomalies;

    @Schema(example = "100")
    long riskScore;

    @Schema(example = "critical")
    RiskLevel riskLevel;

    int criticalEvents;
    int highRiskEvents;

    @Schema(description = "Display strings for each score contribution")
    List<String> riskFactors;

    @Value
    @Builder
    public static class LoginStats {
        int totalDays;
        @Schema(example = "2024-01-02")
        String firstLogin;
        @Schema(example = "2024-01-15")
        String lastLogin;
        int uniqueIPs;
        int uniqueLocations;
    }

    @Value
    @Builder
    public static class WarningCounts {
        int total;
        int critical;
        int high;
        int medium;
        // warnings without a severity are counted as low
        int low;
    }
}
