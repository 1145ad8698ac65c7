package com.secops.riskengine.engine.detectors;

import com.secops.riskengine.engine.DetectorTrackingStore.RateTracker;
import com.secops.riskengine.model.ActivityEvent;
import com.secops.riskengine.model.DetectorType;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Flags repeated high-risk Apex executions: anonymous Apex (A), execute anonymous (X)
 * and web service (W). Other execution types are normal page functionality and are
 * ignored. Tracked per user, hour and execution type.
 */
@Component
public class ApexExecutionRateDetector extends RateThresholdDetector {

    private static final Set<String> HIGH_RISK_TYPES = Set.of("A", "X", "W");

    private static final Map<String, String> EXECUTION_TYPES = Map.ofEntries(
            Map.entry("A", "Anonymous Apex"),
            Map.entry("B", "Batch Apex"),
            Map.entry("F", "Future Method"),
            Map.entry("H", "Scheduled Apex"),
            Map.entry("I", "Inbound Email"),
            Map.entry("L", "Lightning"),
            Map.entry("M", "Remote Action"),
            Map.entry("Q", "Queueable Apex"),
            Map.entry("R", "Regular Apex"),
            Map.entry("S", "Scheduled Apex"),
            Map.entry("T", "Trigger"),
            Map.entry("V", "Visualforce"),
            Map.entry("W", "Web Service"),
            Map.entry("X", "Execute Anonymous"));

    @Override
    public DetectorType getSupportedDetectorType() {
        return DetectorType.APEX_EXECUTION_RATE;
    }

    @Override
    protected String activityLabel() {
        return "High rate of Apex executions";
    }

    @Override
    protected String unit() {
        return "executions";
    }

    @Override
    protected double severityMultiplier() {
        return 3.0;
    }

    @Override
    protected boolean isRelevant(ActivityEvent event) {
        return HIGH_RISK_TYPES.contains(event.field("QUIDDITY"));
    }

    @Override
    protected String trackingKey(ActivityEvent event) {
        return super.trackingKey(event) + "|" + event.field("QUIDDITY");
    }

    @Override
    protected String describe(ActivityEvent event, RateTracker tracker, RateWindow window) {
        String executionType = EXECUTION_TYPES.getOrDefault(event.field("QUIDDITY"), "Unknown Type");
        String entryPoint = event.field("ENTRY_POINT");
        return String.format("High rate of %s executions detected for user %s during hour %d%s: %d executions in %s (%s)",
                executionType, event.getUserId(), event.getHourOfDay(),
                entryPoint != null ? " via " + entryPoint : "",
                tracker.getCount(), window.timeDisplay(), window.rateDisplay(unit()));
    }
}
