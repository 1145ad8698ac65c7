package com.secops.riskengine.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
@Schema(description = "Outcome of one monitoring run")
public class MonitoringReport {

    @Schema(example = "3f2a7c1e-9b1d-4d7e-a1f0-2b9c6e8d4a11")
    String runId;

    Instant generatedAt;

    List<LocalDate> loginDays;

    List<UserActivitySummary> users;

    @Schema(description = "All warnings raised during the run, deduplicated")
    List<Warning> warnings;

    List<CorrelationResult> correlations;

    @Schema(description = "Users at or above the correlation threshold, highest score first")
    List<CorrelationResult> highRiskUsers;

    @Schema(description = "Number of event logs processed", example = "12")
    int scannedSources;

    @Schema(description = "Ids of event logs that could not be read")
    List<String> failedSources;
}
