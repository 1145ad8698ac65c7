package com.secops.riskengine.engine.detectors;

import com.secops.riskengine.engine.DetectorTrackingStore.RateTracker;
import com.secops.riskengine.model.ActivityEvent;
import com.secops.riskengine.model.DetectorType;
import org.springframework.stereotype.Component;

/**
 * Flags dashboard harvesting. Stricter than the other rate detectors: the span must be
 * at least 5 seconds and the rate at least 20 requests per minute. The message reports
 * how many distinct dashboards were opened.
 */
@Component
public class DashboardRateDetector extends RateThresholdDetector {

    private static final double MIN_REQUESTS_PER_MINUTE = 20.0;

    @Override
    public DetectorType getSupportedDetectorType() {
        return DetectorType.DASHBOARD_RATE;
    }

    @Override
    protected String activityLabel() {
        return "High Dashboard access rate";
    }

    @Override
    protected String unit() {
        return "requests";
    }

    @Override
    protected long minimumWindowMillis() {
        return 5000;
    }

    @Override
    protected long minimumDisplaySeconds() {
        return 5;
    }

    @Override
    protected void onTracked(RateTracker tracker, ActivityEvent event) {
        tracker.addDistinct(event.field("DASHBOARD_ID"));
    }

    @Override
    protected boolean rateQualifies(RateWindow window) {
        return window.perMinute() >= MIN_REQUESTS_PER_MINUTE;
    }

    @Override
    protected String describe(ActivityEvent event, RateTracker tracker, RateWindow window) {
        return super.describe(event, tracker, window)
                + " across " + tracker.distinctCount() + " unique dashboards";
    }
}
