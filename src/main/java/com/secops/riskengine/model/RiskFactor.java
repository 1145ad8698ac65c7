package com.secops.riskengine.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "One contribution to a user's risk score")
public class RiskFactor {

    public enum Source { WARNING, ANOMALY }

    Source source;

    @Schema(example = "40")
    long points;

    @Schema(example = "Security warning - ReportExport: Report Export (R1)")
    String description;

    public String display() {
        return description + " (" + points + " points)";
    }
}
