package com.secops.riskengine.engine.detectors;

import com.secops.riskengine.config.RiskDetectionConfig;
import com.secops.riskengine.model.DetectorType;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Flags assignment of permission sets whose name suggests elevated privileges.
 * A multiplier of 2.5 raises the rule severity by one level.
 */
@Component
public class PrivilegedPermissionSetDetector extends KeywordMatchDetector {

    private final RiskDetectionConfig config;

    public PrivilegedPermissionSetDetector(RiskDetectionConfig config) {
        this.config = config;
    }

    @Override
    public DetectorType getSupportedDetectorType() {
        return DetectorType.PRIVILEGED_PERMISSION_SET;
    }

    @Override
    protected String fieldName() {
        return "PERMISSION_SET_NAME";
    }

    @Override
    protected List<String> keywords() {
        return config.getDetectors().getPrivilegedPermissionSets();
    }

    @Override
    protected double severityMultiplier() {
        return 2.5;
    }

    @Override
    protected String describe(String value) {
        return "High privilege permission set assigned: " + value;
    }
}
