package com.secops.riskengine.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A platform user selected for monitoring")
public class MonitoredUser {

    @Schema(example = "005xx000001Sv6A")
    private String userId;

    @Schema(example = "jane.doe@example.com")
    private String username;
}
