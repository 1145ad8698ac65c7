package com.secops.riskengine.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One event log file: rows of a single event type for a single day")
public class EventLog {

    @Schema(example = "0ATxx0000000001")
    private String id;

    @Schema(example = "ReportExport")
    private String eventType;

    @Schema(example = "2024-01-15")
    private String logDate;

    @Schema(description = "Rows in log order, keyed by column name")
    @Builder.Default
    private List<Map<String, String>> rows = new ArrayList<>();
}
