package com.secops.riskengine.engine.detectors;

import com.secops.riskengine.config.RiskDetectionConfig;
import com.secops.riskengine.model.DetectorType;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Flags guest (public site) users performing create, update or delete operations.
 */
@Component
public class GuestSensitiveActionDetector extends KeywordMatchDetector {

    private final RiskDetectionConfig config;

    public GuestSensitiveActionDetector(RiskDetectionConfig config) {
        this.config = config;
    }

    @Override
    public DetectorType getSupportedDetectorType() {
        return DetectorType.GUEST_SENSITIVE_ACTION;
    }

    @Override
    protected String fieldName() {
        return "ACTION";
    }

    @Override
    protected List<String> keywords() {
        return config.getDetectors().getGuestSensitiveActions();
    }

    @Override
    protected double severityMultiplier() {
        return 2.0;
    }

    @Override
    protected String describe(String value) {
        return "Guest user performed " + value + " operation";
    }
}
