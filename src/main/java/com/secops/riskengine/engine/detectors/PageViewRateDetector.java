package com.secops.riskengine.engine.detectors;

import com.secops.riskengine.model.DetectorType;
import org.springframework.stereotype.Component;

@Component
public class PageViewRateDetector extends RateThresholdDetector {

    @Override
    public DetectorType getSupportedDetectorType() {
        return DetectorType.PAGE_VIEW_RATE;
    }

    @Override
    protected String activityLabel() {
        return "High Lightning page view rate";
    }

    @Override
    protected String unit() {
        return "views";
    }
}
