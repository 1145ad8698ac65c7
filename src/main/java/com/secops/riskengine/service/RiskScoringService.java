package com.secops.riskengine.service;

import com.secops.riskengine.model.Anomaly;
import com.secops.riskengine.model.AnomalyType;
import com.secops.riskengine.model.RiskAssessment;
import com.secops.riskengine.model.RiskFactor;
import com.secops.riskengine.model.RiskLevel;
import com.secops.riskengine.model.Severity;
import com.secops.riskengine.model.UserActivity;
import com.secops.riskengine.model.Warning;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes a user's risk score and level from their warnings and anomalies.
 * Stateless: every call recomputes from scratch, so repeated calls on unchanged
 * activity return equal results.
 */
@Service
public class RiskScoringService {

    private static final long CRITICAL_POINTS = 40;
    private static final long LOCATION_CHANGE_CRITICAL_POINTS = 50;
    private static final long HIGH_POINTS = 25;
    private static final long MEDIUM_POINTS = 15;
    private static final long LOW_POINTS = 5;
    private static final long UNKNOWN_POINTS = 2;

    /**
     * Score = Σ points of every warning and anomaly, where points come from severity
     * and are scaled by the anomaly's severity multiplier when present.
     * Any critical contributor makes the level CRITICAL, any high one at least HIGH.
     */
    public RiskAssessment score(UserActivity activity) {
        List<RiskFactor> factors = new ArrayList<>();
        long total = 0;
        int critical = 0;
        int high = 0;

        for (Warning warning : activity.getWarnings()) {
            long points = basePoints(warning.getSeverity());
            total += points;
            if (warning.getSeverity() == Severity.CRITICAL) critical++;
            if (warning.getSeverity() == Severity.HIGH) high++;
            factors.add(RiskFactor.builder()
                    .source(RiskFactor.Source.WARNING)
                    .points(points)
                    .description("Security warning - " + warning.getEventType() + ": " + warning.getMessage())
                    .build());
        }

        for (Anomaly anomaly : activity.getAnomalies()) {
            long points = anomalyPoints(anomaly);
            total += points;
            if (anomaly.getSeverity() == Severity.CRITICAL) critical++;
            if (anomaly.getSeverity() == Severity.HIGH) high++;
            factors.add(RiskFactor.builder()
                    .source(RiskFactor.Source.ANOMALY)
                    .points(points)
                    .description("Anomaly - " + anomaly.getType().getValue() + ": " + anomaly.getDescription())
                    .build());
        }

        return RiskAssessment.builder()
                .riskScore(total)
                .riskLevel(RiskLevel.derive(critical, high, total, activity.hasSignals()))
                .riskFactors(List.copyOf(factors))
                .criticalCount(critical)
                .highCount(high)
                .build();
    }

    private static long anomalyPoints(Anomaly anomaly) {
        long base = anomaly.getType() == AnomalyType.RAPID_LOCATION_CHANGE && anomaly.getSeverity() == Severity.CRITICAL
                ? LOCATION_CHANGE_CRITICAL_POINTS
                : basePoints(anomaly.getSeverity());
        if (anomaly.getSeverityMultiplier() == null) {
            return base;
        }
        return Math.round(base * anomaly.getSeverityMultiplier());
    }

    private static long basePoints(Severity severity) {
        if (severity == null) {
            return UNKNOWN_POINTS;
        }
        return switch (severity) {
            case CRITICAL -> CRITICAL_POINTS;
            case HIGH -> HIGH_POINTS;
            case MEDIUM -> MEDIUM_POINTS;
            case LOW -> LOW_POINTS;
        };
    }
}
