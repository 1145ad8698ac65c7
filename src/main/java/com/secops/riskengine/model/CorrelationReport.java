package com.secops.riskengine.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Correlation results keyed by user id, in the order users were analyzed.
 */
public class CorrelationReport {

    private final Map<String, CorrelationResult> results;

    public CorrelationReport(Map<String, CorrelationResult> results) {
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public Map<String, CorrelationResult> asMap() {
        return results;
    }

    public Optional<CorrelationResult> getUserCorrelations(String userId) {
        return Optional.ofNullable(results.get(userId));
    }

    public List<CorrelationResult> getAllCorrelations() {
        return new ArrayList<>(results.values());
    }

    /**
     * Users whose correlation score is at or above {@code threshold}, highest score first.
     */
    public List<CorrelationResult> getHighRiskUsers(double threshold) {
        return results.values().stream()
                .filter(result -> result.getCorrelationScore() >= threshold)
                .sorted(Comparator.comparingDouble(CorrelationResult::getCorrelationScore).reversed())
                .toList();
    }
}
