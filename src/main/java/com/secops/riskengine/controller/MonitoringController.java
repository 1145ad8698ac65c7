package com.secops.riskengine.controller;

import com.secops.riskengine.model.MonitoringReport;
import com.secops.riskengine.model.MonitoringRequest;
import com.secops.riskengine.service.MonitoringRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/monitoring")
@Tag(name = "Monitoring", description = "Run behavior monitoring over login history and event logs")
public class MonitoringController {

    private final MonitoringRunService runService;

    public MonitoringController(MonitoringRunService runService) {
        this.runService = runService;
    }

    @Operation(summary = "Run a monitoring pass",
            description = "Evaluates the supplied event logs against the rule catalog, detects login anomalies, " +
                    "scores every user and correlates warnings with login behavior. " +
                    "Returns 422 when there are no active rules or no users.")
    @PostMapping("/runs")
    public ResponseEntity<MonitoringReport> run(@RequestBody MonitoringRequest request) {
        return ResponseEntity.ok(runService.run(request));
    }
}
