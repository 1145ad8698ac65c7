package com.secops.riskengine.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Input of one monitoring run")
public class MonitoringRequest {

    @Builder.Default
    private List<MonitoredUser> users = new ArrayList<>();

    @Schema(description = "User id -> login history")
    @Builder.Default
    private Map<String, List<LoginEntry>> loginHistory = new LinkedHashMap<>();

    @Builder.Default
    private List<EventLog> eventLogs = new ArrayList<>();
}
