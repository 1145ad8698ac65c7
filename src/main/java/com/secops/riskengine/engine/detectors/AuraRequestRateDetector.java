package com.secops.riskengine.engine.detectors;

import com.secops.riskengine.model.DetectorType;
import org.springframework.stereotype.Component;

@Component
public class AuraRequestRateDetector extends RateThresholdDetector {

    @Override
    public DetectorType getSupportedDetectorType() {
        return DetectorType.AURA_REQUEST_RATE;
    }

    @Override
    protected String activityLabel() {
        return "High AuraRequest rate";
    }

    @Override
    protected String unit() {
        return "requests";
    }
}
