package com.secops.riskengine.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Risk score and level computed from a user's warnings and anomalies")
public class RiskAssessment {

    @Schema(example = "100")
    long riskScore;

    @Schema(example = "critical")
    RiskLevel riskLevel;

    List<RiskFactor> riskFactors;

    int criticalCount;

    int highCount;
}
