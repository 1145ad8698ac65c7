package com.secops.riskengine.engine;

import com.secops.riskengine.config.MetricsConfig;
import com.secops.riskengine.model.ActivityEvent;
import com.secops.riskengine.model.DetectionResult;
import com.secops.riskengine.model.RiskRule;
import com.secops.riskengine.model.Severity;
import com.secops.riskengine.model.TimeWindow;
import com.secops.riskengine.model.Warning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Evaluates activity events against the rule catalog.
 *
 * Each event is matched to the rule for its event type and goes through two
 * independent paths:
 * 1. Threshold: the event is counted under its tracking key; when the count reaches
 *    the rule threshold the key alerts, once.
 * 2. Custom detector: the rule's detector, if any, inspects the event and may raise
 *    its own warning with an enhanced severity.
 * Warnings are checked against the run-wide warning log, so only new ones are returned.
 *
 * One instance per engine; not shared between runs.
 */
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final RuleCatalog catalog;
    private final CounterStore counterStore;
    private final WarningLog warningLog;
    private final DetectorRegistry detectorRegistry;
    private final DetectorTrackingStore trackingStore;
    private final MetricsConfig metricsConfig;
    private final UnaryOperator<String> usernameLookup;

    public RuleEngine(RuleCatalog catalog, CounterStore counterStore, WarningLog warningLog,
                      DetectorRegistry detectorRegistry, DetectorTrackingStore trackingStore,
                      MetricsConfig metricsConfig, UnaryOperator<String> usernameLookup) {
        this.catalog = catalog;
        this.counterStore = counterStore;
        this.warningLog = warningLog;
        this.detectorRegistry = detectorRegistry;
        this.trackingStore = trackingStore;
        this.metricsConfig = metricsConfig;
        this.usernameLookup = usernameLookup;
    }

    /**
     * Evaluate one event.
     *
     * @return warnings raised by this event that were not already logged
     */
    public List<Warning> evaluate(ActivityEvent event) {
        Optional<RiskRule> match = catalog.findActive(event.getEventType());
        if (match.isEmpty()) {
            return List.of();
        }
        RiskRule rule = match.get();

        String userId = event.getUserId();
        LocalDate date = event.getDate();
        if (userId == null || date == null) {
            log.debug("Skipping {} event without user or date: {}", event.getEventType(), event);
            return List.of();
        }
        if (rule.getTimeWindow() == TimeWindow.HOUR && event.getTimestamp() == null) {
            log.debug("Skipping {} event without timestamp for hourly rule, user {}", event.getEventType(), userId);
            return List.of();
        }

        String fieldValue = rule.hasCountField() ? event.fieldValue(rule.getCountField()) : null;
        if (fieldValue != null && !rule.counts(fieldValue)) {
            return List.of();
        }

        List<Warning> emitted = new ArrayList<>();
        applyThreshold(event, rule, userId, date, fieldValue, emitted);
        applyCustomDetector(event, rule, emitted);
        return emitted;
    }

    private void applyThreshold(ActivityEvent event, RiskRule rule, String userId, LocalDate date,
                                String fieldValue, List<Warning> emitted) {
        String bucket = rule.getTimeWindow().bucket(date, event.getHourOfDay(), event.getSessionKey());
        TrackingKey key = new TrackingKey(userId, bucket, rule.getEventType(), fieldValue);
        CounterState state = counterStore.increment(key, event.getTimestamp());

        if (state.getCount() >= rule.getThreshold() && state.markAlerted(key.alertKey())) {
            String message = fieldValue != null
                    ? rule.getDescription() + " (" + fieldValue + ")"
                    : rule.getDescription();
            record(event, rule, message, rule.getSeverity(), emitted);
        }
    }

    private void applyCustomDetector(ActivityEvent event, RiskRule rule, List<Warning> emitted) {
        Optional<CustomDetector> detector = detectorRegistry.find(rule.getCustomDetector());
        if (detector.isEmpty()) {
            if (rule.getCustomDetector() != null) {
                log.warn("No detector registered for type: {}, rule: {}",
                        rule.getCustomDetector(), rule.getEventType());
            }
            return;
        }

        try {
            Optional<DetectionResult> result = detector.get().detect(event, rule, trackingStore);
            if (result.isPresent()) {
                DetectionResult detection = result.get();
                Severity severity = Severity.enhance(rule.getSeverity(), detection.getSeverityMultiplier());
                String message = detection.getMessage() != null ? detection.getMessage() : rule.getDescription();
                record(event, rule, message, severity, emitted);
            }
        } catch (Exception e) {
            metricsConfig.recordDetectorFailure(rule.getCustomDetector().name());
            log.warn("Error in custom detector {} for {} event of user {}: {}",
                    rule.getCustomDetector(), rule.getEventType(), event.getUserId(), e.getMessage(), e);
            // Skip this detector's contribution; the threshold path and other events are unaffected
        }
    }

    private void record(ActivityEvent event, RiskRule rule, String message, Severity severity,
                        List<Warning> emitted) {
        String username = usernameLookup.apply(event.getUserId());
        Warning warning = Warning.builder()
                .userId(event.getUserId())
                .username(username != null ? username : event.getUsername())
                .date(event.getDate())
                .timestamp(event.getTimestamp())
                .message(message)
                .severity(severity)
                .eventType(rule.getEventType())
                .sessionKey(event.getSessionKey())
                .clientIp(event.getClientIp())
                .context(event.contextFields())
                .build();

        if (warningLog.record(warning)) {
            emitted.add(warning);
            metricsConfig.recordWarning(rule.getEventType(), severity != null ? severity.getValue() : "unknown");
            log.warn("{} {} [{}]", severity != null ? severity.getValue() : "unknown", message,
                    warning.getUsername() != null ? warning.getUsername() : warning.getUserId());
        }
    }
}
