package com.secops.riskengine.engine.detectors;

import com.secops.riskengine.engine.CustomDetector;
import com.secops.riskengine.engine.DetectorTrackingStore;
import com.secops.riskengine.model.ActivityEvent;
import com.secops.riskengine.model.DetectionResult;
import com.secops.riskengine.model.RiskRule;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Base for detectors that fire when one field of the event contains a sensitive keyword
 * (case-insensitive). Stateless.
 */
public abstract class KeywordMatchDetector implements CustomDetector {

    protected abstract String fieldName();

    protected abstract List<String> keywords();

    protected abstract double severityMultiplier();

    protected abstract String describe(String value);

    @Override
    public Optional<DetectionResult> detect(ActivityEvent event, RiskRule rule, DetectorTrackingStore tracking) {
        String value = event.field(fieldName());
        if (value == null) {
            return Optional.empty();
        }
        String lower = value.toLowerCase(Locale.ROOT);
        boolean matches = keywords().stream()
                .anyMatch(keyword -> lower.contains(keyword.toLowerCase(Locale.ROOT)));
        if (!matches) {
            return Optional.empty();
        }
        return Optional.of(DetectionResult.builder()
                .message(describe(value))
                .severityMultiplier(severityMultiplier())
                .build());
    }
}
