package com.secops.riskengine.controller;

import com.secops.riskengine.model.RiskRule;
import com.secops.riskengine.service.RuleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/rules")
@Tag(name = "Rules", description = "Inspect the risk rule catalog")
public class RuleController {

    private final RuleService ruleService;

    public RuleController(RuleService ruleService) {
        this.ruleService = ruleService;
    }

    @Operation(summary = "List all risk rules",
            description = "Returns the rule catalog loaded at startup, including overrides, thresholds and custom detectors.")
    @GetMapping
    public ResponseEntity<List<RiskRule>> listRules() {
        return ResponseEntity.ok(ruleService.getAllRules());
    }

    @Operation(summary = "Get the rule for an event type")
    @GetMapping("/{eventType}")
    public ResponseEntity<RiskRule> getRule(
            @Parameter(description = "Event type", example = "ReportExport")
            @PathVariable String eventType) {
        RiskRule rule = ruleService.getRule(eventType);
        if (rule == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(rule);
    }
}
