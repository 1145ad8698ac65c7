package com.secops.riskengine.engine;

import com.secops.riskengine.config.MetricsConfig;
import com.secops.riskengine.service.RiskScoringService;
import com.secops.riskengine.service.RuleService;
import org.springframework.stereotype.Component;

/**
 * Creates a fresh {@link RiskDetectionEngine} for each run, wired to the shared
 * stateless collaborators and the current rule catalog.
 */
@Component
public class RiskDetectionEngineFactory {

    private final RuleService ruleService;
    private final DetectorRegistry detectorRegistry;
    private final AnomalyDetector anomalyDetector;
    private final CorrelationEngine correlationEngine;
    private final RiskScoringService scoringService;
    private final MetricsConfig metricsConfig;

    public RiskDetectionEngineFactory(RuleService ruleService, DetectorRegistry detectorRegistry,
                                      AnomalyDetector anomalyDetector, CorrelationEngine correlationEngine,
                                      RiskScoringService scoringService, MetricsConfig metricsConfig) {
        this.ruleService = ruleService;
        this.detectorRegistry = detectorRegistry;
        this.anomalyDetector = anomalyDetector;
        this.correlationEngine = correlationEngine;
        this.scoringService = scoringService;
        this.metricsConfig = metricsConfig;
    }

    public RiskDetectionEngine create() {
        return new RiskDetectionEngine(ruleService.getCatalog(), detectorRegistry, anomalyDetector,
                correlationEngine, scoringService, metricsConfig);
    }
}
