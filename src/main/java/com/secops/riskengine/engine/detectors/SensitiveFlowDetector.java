package com.secops.riskengine.engine.detectors;

import com.secops.riskengine.config.RiskDetectionConfig;
import com.secops.riskengine.model.DetectorType;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Flags manual execution of administrative or mass-change flows.
 */
@Component
public class SensitiveFlowDetector extends KeywordMatchDetector {

    private final RiskDetectionConfig config;

    public SensitiveFlowDetector(RiskDetectionConfig config) {
        this.config = config;
    }

    @Override
    public DetectorType getSupportedDetectorType() {
        return DetectorType.SENSITIVE_FLOW;
    }

    @Override
    protected String fieldName() {
        return "FLOW_NAME";
    }

    @Override
    protected List<String> keywords() {
        return config.getDetectors().getSensitiveFlowPatterns();
    }

    @Override
    protected double severityMultiplier() {
        return 2.0;
    }

    @Override
    protected String describe(String value) {
        return "Sensitive flow executed: " + value;
    }
}
