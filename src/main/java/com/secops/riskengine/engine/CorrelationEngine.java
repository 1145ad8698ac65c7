package com.secops.riskengine.engine;

import com.secops.riskengine.config.RiskDetectionConfig;
import com.secops.riskengine.model.Anomaly;
import com.secops.riskengine.model.CorrelationRecord;
import com.secops.riskengine.model.CorrelationReport;
import com.secops.riskengine.model.CorrelationResult;
import com.secops.riskengine.model.Severity;
import com.secops.riskengine.model.UserActivity;
import com.secops.riskengine.model.Warning;
import com.secops.riskengine.util.IpAddresses;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Cross-references each user's warnings with their login behavior.
 *
 * Temporal records link a warning to an anomaly that happened within the correlation
 * window. Behavioral records flag warnings raised outside the user's normal hours,
 * on a weekend for a user who rarely works weekends, or from an IP the user has not
 * logged in from.
 */
@Component
public class CorrelationEngine {

    private static final Logger log = LoggerFactory.getLogger(CorrelationEngine.class);

    private final RiskDetectionConfig config;

    public CorrelationEngine(RiskDetectionConfig config) {
        this.config = config;
    }

    public CorrelationReport analyzeAll(Collection<UserActivity> users) {
        return analyzeAll(users, config.getCorrelation());
    }

    @Observed(name = "correlation.analyze_all", contextualName = "correlate-users")
    public CorrelationReport analyzeAll(Collection<UserActivity> users, RiskDetectionConfig.Correlation settings) {
        Map<String, CorrelationResult> results = new LinkedHashMap<>();
        for (UserActivity user : users) {
            results.put(user.getUserId(), analyze(user, settings));
        }

        CorrelationReport report = new CorrelationReport(results);
        List<CorrelationResult> highRisk = report.getHighRiskUsers(settings.getHighRiskThreshold());
        for (CorrelationResult result : highRisk) {
            log.warn("High correlated risk for user {}: score {} from {} correlations",
                    result.getUsername() != null ? result.getUsername() : result.getUserId(),
                    String.format(Locale.ROOT, "%.2f", result.getCorrelationScore()), result.getCorrelationCount());
        }
        return report;
    }

    CorrelationResult analyze(UserActivity user, RiskDetectionConfig.Correlation settings) {
        LoginPatterns patterns = LoginPatterns.of(user, config.getAnomaly());
        ZoneId zone = config.zone();

        List<CorrelationRecord> records = new ArrayList<>();
        for (Warning warning : user.getWarnings()) {
            Instant warningTime = warningTime(warning, zone);
            if (warningTime == null) {
                log.debug("Skipping correlation for warning without date: {}", warning.getMessage());
                continue;
            }
            records.addAll(temporal(user, warning, warningTime, settings));
            records.addAll(behavioral(user, warning, warningTime.atZone(zone), patterns, settings.getWeights()));
        }

        double score = records.stream().mapToDouble(CorrelationRecord::getWeight).sum();
        return CorrelationResult.builder()
                .userId(user.getUserId())
                .username(user.getUsername())
                .correlations(List.copyOf(records))
                .correlationScore(score)
                .build();
    }

    private List<CorrelationRecord> temporal(UserActivity user, Warning warning, Instant warningTime,
                                             RiskDetectionConfig.Correlation settings) {
        long windowMillis = (long) (settings.getWindowHours() * 3_600_000L);
        List<CorrelationRecord> records = new ArrayList<>();

        for (Anomaly anomaly : user.getAnomalies()) {
            if (anomaly.getOccurredAt() == null) {
                continue;
            }
            long diffMillis = Duration.between(anomaly.getOccurredAt(), warningTime).abs().toMillis();
            if (diffMillis > windowMillis) {
                continue;
            }

            double hoursDiff = diffMillis / 3_600_000.0;
            records.add(CorrelationRecord.builder()
                    .userId(user.getUserId())
                    .type(CorrelationRecord.Type.TEMPORAL)
                    .subtype(anomaly.getType().getValue())
                    .weight(temporalWeight(anomaly, warning.getSeverity(), hoursDiff, settings.getWeights()))
                    .description(String.format(Locale.ROOT, "%s occurred within %.2f hours of %s warning",
                            anomaly.getDescription(), hoursDiff, warning.getEventType()))
                    .warningMessage(warning.getMessage())
                    .build());
        }
        return records;
    }

    /**
     * weight = base weight of the anomaly type x warning severity factor x proximity factor.
     */
    static double temporalWeight(Anomaly anomaly, Severity severity, double hoursDiff,
                                 RiskDetectionConfig.Weights weights) {
        double weight = switch (anomaly.getType()) {
            case UNUSUAL_HOURS -> weights.getUnusualLoginTime();
            case RAPID_LOCATION_CHANGE -> weights.getRapidLocationChange();
            case WEEKEND_ACTIVITY -> weights.getWeekendActivity();
        };

        if (severity != null) {
            weight *= switch (severity) {
                case CRITICAL -> 2.0;
                case HIGH -> 1.5;
                case MEDIUM -> 1.2;
                case LOW -> 1.0;
            };
        }

        if (hoursDiff < 0.5) {
            weight *= 1.5;
        } else if (hoursDiff < 1.0) {
            weight *= 1.2;
        }
        return weight;
    }

    private List<CorrelationRecord> behavioral(UserActivity user, Warning warning, ZonedDateTime warningTime,
                                               LoginPatterns patterns, RiskDetectionConfig.Weights weights) {
        List<CorrelationRecord> records = new ArrayList<>();

        int hour = warningTime.getHour();
        if (!patterns.isNormalHour(hour)) {
            records.add(behavioralRecord(user, warning, "outside_business_hours", weights.getOutsideBusinessHours(),
                    String.format(Locale.ROOT, "Security event occurred outside normal working hours (%d:00)", hour)));
        }

        DayOfWeek day = warningTime.getDayOfWeek();
        boolean weekend = day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
        if (weekend && patterns.isRareWeekendUser()) {
            records.add(behavioralRecord(user, warning, "weekend_activity", weights.getWeekendActivity(),
                    "Security event occurred on weekend for user who rarely works weekends"));
        }

        Set<String> knownIps = patterns.getKnownIps();
        String clientIp = warning.getClientIp();
        if (IpAddresses.isKnown(clientIp) && knownIps.size() >= 2 && !knownIps.contains(clientIp)) {
            records.add(behavioralRecord(user, warning, "unusual_ip", weights.getMultipleLocations(),
                    "Security event from unusual IP address: " + clientIp));
        }
        return records;
    }

    private static CorrelationRecord behavioralRecord(UserActivity user, Warning warning, String subtype,
                                                      double weight, String description) {
        return CorrelationRecord.builder()
                .userId(user.getUserId())
                .type(CorrelationRecord.Type.BEHAVIORAL)
                .subtype(subtype)
                .weight(weight)
                .description(description)
                .warningMessage(warning.getMessage())
                .build();
    }

    // Start of the warning's date when the triggering event carried no timestamp
    private static Instant warningTime(Warning warning, ZoneId zone) {
        if (warning.getTimestamp() != null) {
            return warning.getTimestamp();
        }
        return warning.getDate() != null ? warning.getDate().atStartOfDay(zone).toInstant() : null;
    }
}
