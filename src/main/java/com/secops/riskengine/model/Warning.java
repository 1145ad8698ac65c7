package com.secops.riskengine.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * A rule-triggered security warning. Two warnings are the same warning when they
 * share user, date and message; the remaining fields describe the event that raised it.
 */
@Value
@Builder(toBuilder = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@Schema(description = "Security warning raised by a rule or custom detector")
public class Warning {

    @EqualsAndHashCode.Include
    @Schema(example = "005xx000001Sv6A")
    String userId;

    @Schema(example = "jane.doe@example.com")
    String username;

    @EqualsAndHashCode.Include
    @Schema(example = "2024-01-15")
    LocalDate date;

    @Schema(description = "Time of the triggering event, when known")
    Instant timestamp;

    @EqualsAndHashCode.Include
    @Schema(example = "Report Export (00O5e000001AbCd)")
    String message;

    @Schema(example = "critical")
    Severity severity;

    @Schema(example = "ReportExport")
    String eventType;

    String sessionKey;

    String clientIp;

    @Schema(description = "Selected fields of the triggering row")
    @Builder.Default
    Map<String, String> context = Map.of();
}
