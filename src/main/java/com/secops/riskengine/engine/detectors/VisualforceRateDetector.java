package com.secops.riskengine.engine.detectors;

import com.secops.riskengine.model.DetectorType;
import org.springframework.stereotype.Component;

/**
 * Flags page scraping or automation through Visualforce pages.
 */
@Component
public class VisualforceRateDetector extends RateThresholdDetector {

    @Override
    public DetectorType getSupportedDetectorType() {
        return DetectorType.VISUALFORCE_RATE;
    }

    @Override
    protected String activityLabel() {
        return "High Visualforce request rate";
    }

    @Override
    protected String unit() {
        return "requests";
    }
}
