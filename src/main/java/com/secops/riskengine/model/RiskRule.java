package com.secops.riskengine.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Threshold rule for one event type, optionally paired with a custom detector.
 * Immutable for the duration of a run.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Risk rule applied to one event type")
public class RiskRule {

    @Schema(description = "Event type the rule applies to", example = "ReportExport")
    String eventType;

    @Schema(description = "Short description used as the warning message", example = "Report Export")
    String description;

    @Schema(description = "Why this activity is risky",
            example = "Every report export is a potential data exfiltration risk")
    String rationale;

    @Schema(description = "Severity of warnings raised by the threshold", example = "critical")
    Severity severity;

    @Schema(description = "Number of events in the window that raises a warning", example = "1")
    int threshold;

    @Schema(description = "Counting window", example = "day")
    @Builder.Default
    TimeWindow timeWindow = TimeWindow.NONE;

    @Schema(description = "Event field whose distinct values are counted separately", example = "REPORT_ID")
    String countField;

    @Schema(description = "When non-empty, only events whose count field has one of these values are considered",
            example = "[\"A\", \"X\", \"W\"]")
    @Builder.Default
    List<String> countedValues = List.of();

    @Schema(description = "Custom detector evaluated alongside the threshold", example = "DOCUMENT_DOWNLOAD")
    DetectorType customDetector;

    @Schema(description = "Whether the rule is active", example = "true")
    @Builder.Default
    boolean enabled = true;

    public boolean hasCountField() {
        return countField != null && !countField.isBlank();
    }

    public boolean counts(String fieldValue) {
        return countedValues == null || countedValues.isEmpty() || countedValues.contains(fieldValue);
    }
}
