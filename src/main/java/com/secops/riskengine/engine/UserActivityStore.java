package com.secops.riskengine.engine;

import com.secops.riskengine.model.LoginRecord;
import com.secops.riskengine.model.RiskAssessment;
import com.secops.riskengine.model.RiskFactor;
import com.secops.riskengine.model.Severity;
import com.secops.riskengine.model.UserActivity;
import com.secops.riskengine.model.UserActivitySummary;
import com.secops.riskengine.model.Warning;
import com.secops.riskengine.model.WarningCsvRow;
import com.secops.riskengine.service.RiskScoringService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Per-user activity for one run, keyed by user id in registration order.
 * Scores are never stored; {@link #assess}, {@link #getSummary} and {@link #getCsvData}
 * recompute them on every call.
 */
public class UserActivityStore {

    private static final Logger log = LoggerFactory.getLogger(UserActivityStore.class);

    private static final String NO_RISK_FACTORS = "No risk factors detected";

    private final Map<String, UserActivity> users = new LinkedHashMap<>();
    private final RiskScoringService scoringService;

    public UserActivityStore(RiskScoringService scoringService) {
        this.scoringService = scoringService;
    }

    public UserActivity register(String userId, String username) {
        return users.computeIfAbsent(userId, id -> new UserActivity(id, username));
    }

    public Optional<UserActivity> get(String userId) {
        return Optional.ofNullable(users.get(userId));
    }

    public boolean contains(String userId) {
        return userId != null && users.containsKey(userId);
    }

    public Collection<UserActivity> all() {
        return Collections.unmodifiableCollection(users.values());
    }

    public int size() {
        return users.size();
    }

    /**
     * @return false when the user is unknown or their history was already loaded
     */
    public boolean addLoginHistory(String userId, Collection<LoginRecord> records) {
        UserActivity activity = users.get(userId);
        if (activity == null) {
            log.warn("Ignoring login history for unmonitored user {}", userId);
            return false;
        }
        if (!activity.addLoginHistory(records)) {
            log.warn("Login history for user {} already loaded; ignoring {} additional records",
                    userId, records.size());
            return false;
        }
        return true;
    }

    public void addWarning(Warning warning) {
        UserActivity activity = users.get(warning.getUserId());
        if (activity != null) {
            activity.addWarning(warning);
        }
    }

    public void recordScannedLog(String userId, String eventType) {
        UserActivity activity = users.get(userId);
        if (activity != null) {
            activity.recordScannedLog(eventType);
        }
    }

    /** Union of every monitored user's login days. */
    public SortedSet<LocalDate> allLoginDays() {
        SortedSet<LocalDate> days = new TreeSet<>();
        users.values().forEach(activity -> days.addAll(activity.getLoginDays()));
        return days;
    }

    public RiskAssessment assess(String userId) {
        return scoringService.score(require(userId));
    }

    public UserActivitySummary getSummary(String userId) {
        UserActivity activity = require(userId);
        RiskAssessment assessment = scoringService.score(activity);
        SortedSet<LocalDate> loginDays = activity.getLoginDays();

        return UserActivitySummary.builder()
                .userId(activity.getUserId())
                .username(activity.getUsername())
                .loginStats(UserActivitySummary.LoginStats.builder()
                        .totalDays(loginDays.size())
                        .firstLogin(loginDays.isEmpty() ? null : loginDays.first().toString())
                        .lastLogin(loginDays.isEmpty() ? null : loginDays.last().toString())
                        .uniqueIPs(activity.getIpAddresses().size())
                        .uniqueLocations(activity.getKnownLocations().size())
                        .build())
                .warningsCount(countWarnings(activity.getWarnings()))
                .scannedLogs(activity.getScannedLogs())
                .anomalies(activity.getAnomalies())
                .riskScore(assessment.getRiskScore())
                .riskLevel(assessment.getRiskLevel())
                .criticalEvents(assessment.getCriticalCount())
                .highRiskEvents(assessment.getHighCount())
                .riskFactors(assessment.getRiskFactors().stream().map(RiskFactor::display).toList())
                .build();
    }

    /**
     * One row per warning, each repeating the user's base columns. A user without
     * warnings gets a single placeholder row.
     */
    public List<WarningCsvRow> getCsvData(String userId) {
        UserActivity activity = require(userId);
        RiskAssessment assessment = scoringService.score(activity);
        WarningCsvRow base = baseRow(activity, assessment);

        if (activity.getWarnings().isEmpty()) {
            return List.of(base.toBuilder()
                    .date(WarningCsvRow.NOT_AVAILABLE)
                    .time(WarningCsvRow.NOT_AVAILABLE)
                    .warning(WarningCsvRow.NO_RISKS)
                    .severity("none")
                    .eventType(WarningCsvRow.NOT_AVAILABLE)
                    .clientIp(WarningCsvRow.NOT_AVAILABLE)
                    .sessionKey(WarningCsvRow.NOT_AVAILABLE)
                    .build());
        }

        List<WarningCsvRow> rows = new ArrayList<>();
        for (Warning warning : activity.getWarnings()) {
            rows.add(base.toBuilder()
                    .date(orNotAvailable(warning.getDate()))
                    .time(orNotAvailable(warning.getTimestamp()))
                    .warning(orNotAvailable(warning.getMessage()))
                    .severity(warning.getSeverity() != null ? warning.getSeverity().getValue() : Severity.LOW.getValue())
                    .eventType(orNotAvailable(warning.getEventType()))
                    .clientIp(orNotAvailable(warning.getClientIp()))
                    .sessionKey(orNotAvailable(warning.getSessionKey()))
                    .context(warning.getContext())
                    .build());
        }
        return rows;
    }

    private WarningCsvRow baseRow(UserActivity activity, RiskAssessment assessment) {
        SortedSet<LocalDate> loginDays = activity.getLoginDays();
        List<RiskFactor> factors = assessment.getRiskFactors();

        return WarningCsvRow.builder()
                .username(activity.getUsername())
                .userId(activity.getUserId())
                .firstLoginDate(loginDays.isEmpty() ? WarningCsvRow.NOT_AVAILABLE : loginDays.first().toString())
                .lastLoginDate(loginDays.isEmpty() ? WarningCsvRow.NOT_AVAILABLE : loginDays.last().toString())
                .loginDaysCount(loginDays.size())
                .uniqueIPs(activity.getIpAddresses().size())
                .scannedLogsCount(activity.getScannedLogs().values().stream().mapToInt(Integer::intValue).sum())
                .scannedEventTypes(String.join(", ", activity.getScannedLogs().keySet()))
                .riskScore(assessment.getRiskScore())
                .riskLevel(assessment.getRiskLevel().getValue())
                .anomalyCount(activity.getAnomalies().size())
                .criticalEvents(assessment.getCriticalCount())
                .highRiskEvents(assessment.getHighCount())
                .riskFactorsExplanation(factors.isEmpty()
                        ? NO_RISK_FACTORS
                        : factors.stream().map(RiskFactor::display).collect(Collectors.joining("; ")))
                .build();
    }

    private static UserActivitySummary.WarningCounts countWarnings(List<Warning> warnings) {
        int critical = 0;
        int high = 0;
        int medium = 0;
        int low = 0;
        for (Warning warning : warnings) {
            Severity severity = warning.getSeverity() != null ? warning.getSeverity() : Severity.LOW;
            switch (severity) {
                case CRITICAL -> critical++;
                case HIGH -> high++;
                case MEDIUM -> medium++;
                case LOW -> low++;
            }
        }
        return UserActivitySummary.WarningCounts.builder()
                .total(warnings.size())
                .critical(critical)
                .high(high)
                .medium(medium)
                .low(low)
                .build();
    }

    private static String orNotAvailable(Object value) {
        return value != null ? value.toString() : WarningCsvRow.NOT_AVAILABLE;
    }

    private UserActivity require(String userId) {
        UserActivity activity = users.get(userId);
        if (activity == null) {
            throw new IllegalArgumentException("Unknown user: " + userId);
        }
        return activity;
    }
}
