package com.secops.riskengine.engine.detectors;

import com.secops.riskengine.model.DetectorType;
import org.springframework.stereotype.Component;

/**
 * Flags bulk reconnaissance through search: many searches by one user within an hour.
 */
@Component
public class SearchRateDetector extends RateThresholdDetector {

    @Override
    public DetectorType getSupportedDetectorType() {
        return DetectorType.SEARCH_RATE;
    }

    @Override
    protected String activityLabel() {
        return "High search rate";
    }

    @Override
    protected String unit() {
        return "searches";
    }
}
