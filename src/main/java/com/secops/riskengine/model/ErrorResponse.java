package com.secops.riskengine.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@Schema(description = "Error body returned when a request cannot be served")
public class ErrorResponse {

    Instant timestamp;

    @Schema(example = "422")
    int status;

    @Schema(example = "Monitoring Precondition Failed")
    String error;

    @Schema(example = "No users to monitor")
    String message;
}
