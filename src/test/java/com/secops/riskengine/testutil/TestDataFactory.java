package com.secops.riskengine.testutil;

import com.secops.riskengine.config.MetricsConfig;
import com.secops.riskengine.engine.CounterStore;
import com.secops.riskengine.engine.CustomDetector;
import com.secops.riskengine.engine.DetectorRegistry;
import com.secops.riskengine.engine.DetectorTrackingStore;
import com.secops.riskengine.engine.RuleCatalog;
import com.secops.riskengine.engine.RuleEngine;
import com.secops.riskengine.engine.WarningLog;
import com.secops.riskengine.model.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    public static final String USER_ID = "005xx000001Sv6A";
    public static final String USERNAME = "jane.doe@example.com";

    private TestDataFactory() {}

    public static MetricsConfig metrics() {
        return new MetricsConfig(new SimpleMeterRegistry());
    }

    /**
     * Row for {@code userId} at {@code timestamp}, followed by alternating field names and values.
     */
    public static Map<String, String> row(String userId, String timestamp, String... fieldsAndValues) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("USER_ID_DERIVED", userId);
        if (timestamp != null) {
            row.put("TIMESTAMP_DERIVED", timestamp);
        }
        for (int i = 0; i + 1 < fieldsAndValues.length; i += 2) {
            row.put(fieldsAndValues[i], fieldsAndValues[i + 1]);
        }
        return row;
    }

    public static ActivityEvent event(String eventType, Map<String, String> row) {
        return ActivityEvent.of(eventType, row, ZoneOffset.UTC);
    }

    public static ActivityEvent event(String eventType, String userId, String timestamp, String... fieldsAndValues) {
        return event(eventType, row(userId, timestamp, fieldsAndValues));
    }

    public static RiskRule createRule(String eventType, int threshold, Severity severity, TimeWindow window,
                                      String countField) {
        return RiskRule.builder()
                .eventType(eventType)
                .description("Test rule " + eventType)
                .rationale("Test")
                .severity(severity)
                .threshold(threshold)
                .timeWindow(window)
                .countField(countField)
                .build();
    }

    public static RuleEngine createRuleEngine(List<RiskRule> rules, CustomDetector... detectors) {
        return createRuleEngine(new RuleCatalog(rules), new WarningLog(), detectors);
    }

    public static RuleEngine createRuleEngine(RuleCatalog catalog, WarningLog warningLog, CustomDetector... detectors) {
        return new RuleEngine(catalog, new CounterStore(), warningLog, new DetectorRegistry(List.of(detectors)),
                new DetectorTrackingStore(), metrics(), userId -> null);
    }

    public static Warning createWarning(String userId, String timestamp, String message, Severity severity) {
        Instant at = Instant.parse(timestamp);
        return Warning.builder()
                .userId(userId)
                .username(USERNAME)
                .date(LocalDate.ofInstant(at, ZoneOffset.UTC))
                .timestamp(at)
                .message(message)
                .severity(severity)
                .eventType("ReportExport")
                .sessionKey("session-1")
                .clientIp("203.0.113.10")
                .build();
    }

    public static LoginRecord login(String timestamp, String sourceIp) {
        return LoginRecord.of(Instant.parse(timestamp), sourceIp, null, ZoneOffset.UTC);
    }

    public static UserActivity createUser(LoginRecord... logins) {
        UserActivity activity = new UserActivity(USER_ID, USERNAME);
        activity.addLoginHistory(List.of(logins));
        return activity;
    }

    public static Anomaly createAnomaly(AnomalyType type, Severity severity, Double multiplier, String occurredAt) {
        return Anomaly.builder()
                .type(type)
                .severity(severity)
                .severityMultiplier(multiplier)
                .description("Test anomaly " + type.getValue())
                .occurredAt(occurredAt != null ? Instant.parse(occurredAt) : null)
                .build();
    }
}
