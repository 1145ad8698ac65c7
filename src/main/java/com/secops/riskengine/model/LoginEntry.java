package com.secops.riskengine.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One entry of a user's login history")
public class LoginEntry {

    @Schema(description = "Login time (ISO-8601)", example = "2024-01-15T09:00:00Z")
    private String loginTime;

    @Schema(example = "203.0.113.10")
    private String sourceIp;

    @Schema(description = "Platform login geo id, if known", example = "04Fxx0000004CAA")
    private String loginGeoId;
}
