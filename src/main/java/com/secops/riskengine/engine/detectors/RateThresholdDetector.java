package com.secops.riskengine.engine.detectors;

import com.secops.riskengine.engine.CustomDetector;
import com.secops.riskengine.engine.DetectorTrackingStore;
import com.secops.riskengine.engine.DetectorTrackingStore.RateTracker;
import com.secops.riskengine.model.ActivityEvent;
import com.secops.riskengine.model.DetectionResult;
import com.secops.riskengine.model.RiskRule;

import java.util.Optional;

/**
 * Base for detectors that flag a high event rate per user and hour.
 *
 * Logic: events are tracked per (user, date, hour). Once the count reaches the rule's
 * threshold and the observed span is at least {@link #minimumWindowMillis()}, the
 * detector fires once for that hour with the count, span and rate.
 *
 * Example: 120 searches between 10:00:05 and 10:00:45 for threshold 100 gives
 * "120 searches in 40 seconds (3.0 searches/sec)".
 */
public abstract class RateThresholdDetector implements CustomDetector {

    /** Message prefix, e.g. "High search rate". */
    protected abstract String activityLabel();

    /** Plural noun for the counted events, e.g. "searches". */
    protected abstract String unit();

    protected double severityMultiplier() {
        return 1.5;
    }

    protected long minimumWindowMillis() {
        return 1000;
    }

    /** Lower bound for the seconds shown when the span is under a minute. */
    protected long minimumDisplaySeconds() {
        return 1;
    }

    protected boolean isRelevant(ActivityEvent event) {
        return true;
    }

    protected String trackingKey(ActivityEvent event) {
        return event.getUserId() + "|" + event.getDate() + "|" + event.getHourOfDay();
    }

    protected void onTracked(RateTracker tracker, ActivityEvent event) {
    }

    protected boolean rateQualifies(RateWindow window) {
        return true;
    }

    protected String describe(ActivityEvent event, RateTracker tracker, RateWindow window) {
        return String.format("%s detected for user %s during hour %d: %d %s in %s (%s)",
                activityLabel(), event.getUserId(), event.getHourOfDay(),
                tracker.getCount(), unit(), window.timeDisplay(), window.rateDisplay(unit()));
    }

    @Override
    public Optional<DetectionResult> detect(ActivityEvent event, RiskRule rule, DetectorTrackingStore tracking) {
        if (event.getUserId() == null || event.getTimestamp() == null || event.getDate() == null) {
            return Optional.empty();
        }
        if (!isRelevant(event)) {
            return Optional.empty();
        }

        RateTracker tracker = tracking.track(
                getSupportedDetectorType() + "|" + trackingKey(event), event.getTimestamp());
        onTracked(tracker, event);

        if (tracker.getCount() < Math.max(1, rule.getThreshold())) {
            return Optional.empty();
        }
        long spanMillis = tracker.span().toMillis();
        if (spanMillis < minimumWindowMillis()) {
            return Optional.empty();
        }

        RateWindow window = RateWindow.of(tracker.getCount(), spanMillis, minimumDisplaySeconds());
        if (!rateQualifies(window) || !tracker.markAlerted()) {
            return Optional.empty();
        }

        return Optional.of(DetectionResult.builder()
                .message(describe(event, tracker, window))
                .severityMultiplier(severityMultiplier())
                .build());
    }

    /**
     * Count over an observed span, displayed in seconds under a minute and in minutes otherwise.
     */
    protected record RateWindow(long count, long amount, boolean seconds) {

        static RateWindow of(long count, long spanMillis, long minimumSeconds) {
            if (spanMillis < 60_000) {
                return new RateWindow(count, Math.max(minimumSeconds, Math.round(spanMillis / 1000.0)), true);
            }
            return new RateWindow(count, Math.max(1, Math.round(spanMillis / 60_000.0)), false);
        }

        double rate() {
            return (double) count / amount;
        }

        double perMinute() {
            return seconds ? rate() * 60 : rate();
        }

        String timeDisplay() {
            String word = seconds ? "second" : "minute";
            return amount + " " + word + (amount != 1 ? "s" : "");
        }

        String rateDisplay(String unit) {
            return (Math.round(rate() * 100) / 100.0) + " " + unit + (seconds ? "/sec" : "/min");
        }
    }
}
