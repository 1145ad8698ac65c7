package com.secops.riskengine.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Correlation records and score for one user")
public class CorrelationResult {

    String userId;
    String username;
    List<CorrelationRecord> correlations;

    @Schema(description = "Sum of correlation weights", example = "12.3")
    double correlationScore;

    public int getCorrelationCount() {
        return correlations.size();
    }
}
