package com.secops.riskengine.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
@Schema(description = "Login-pattern anomaly derived from a user's login history")
public class Anomaly {

    @Schema(example = "rapid_location_change")
    AnomalyType type;

    @Schema(example = "critical")
    Severity severity;

    @Schema(description = "Multiplier applied to the severity points when scoring", example = "2.0")
    Double severityMultiplier;

    @Schema(example = "Suspicious login location change: New York, US -> Los Angeles, US (0.75 hours)")
    String description;

    @Builder.Default
    Map<String, Object> details = Map.of();

    @Schema(description = "When the anomalous login happened, if the anomaly is tied to one login")
    Instant occurredAt;
}
