package com.secops.riskengine.engine.detectors;

import com.secops.riskengine.model.DetectorType;
import org.springframework.stereotype.Component;

/**
 * Flags a burst of internal content shares, which may stage data for exfiltration.
 */
@Component
public class ContentSharingRateDetector extends RateThresholdDetector {

    @Override
    public DetectorType getSupportedDetectorType() {
        return DetectorType.CONTENT_SHARING_RATE;
    }

    @Override
    protected String activityLabel() {
        return "High content sharing rate";
    }

    @Override
    protected String unit() {
        return "shares";
    }
}
