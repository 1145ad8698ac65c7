package com.secops.riskengine.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a custom detector that fired. A null message falls back to the rule description.
 */
@Value
@Builder
public class DetectionResult {
    String message;
    @Builder.Default
    double severityMultiplier = 1.0;
}
