package com.secops.riskengine.engine;

import com.secops.riskengine.config.RiskDetectionConfig;
import com.secops.riskengine.model.AnomalyType;
import com.secops.riskengine.model.CorrelationRecord;
import com.secops.riskengine.model.CorrelationReport;
import com.secops.riskengine.model.CorrelationResult;
import com.secops.riskengine.model.LoginRecord;
import com.secops.riskengine.model.Severity;
import com.secops.riskengine.model.UserActivity;
import com.secops.riskengine.model.Warning;
import com.secops.riskengine.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CorrelationEngineTest {

    private final RiskDetectionConfig config = new RiskDetectionConfig();
    private final CorrelationEngine engine = new CorrelationEngine(config);

    private static UserActivity userWithoutHistory(String userId) {
        UserActivity user = new UserActivity(userId, userId + "@example.com");
        user.addLoginHistory(List.of());
        return user;
    }

    private static List<CorrelationRecord> temporalRecords(CorrelationResult result) {
        return result.getCorrelations().stream()
                .filter(record -> record.getType() == CorrelationRecord.Type.TEMPORAL)
                .toList();
    }

    private CorrelationResult correlate(UserActivity user) {
        return engine.analyzeAll(List.of(user)).getUserCorrelations(user.getUserId()).orElseThrow();
    }

    @Test
    void analyzeAll_criticalWarningNinetyMinutesFromLocationChange_noProximityBonus() {
        UserActivity user = userWithoutHistory("U1");
        user.addWarning(TestDataFactory.createWarning("U1", "2024-01-15T10:00:00Z", "Report Export (R1)", Severity.CRITICAL));
        user.replaceAnomalies(List.of(TestDataFactory.createAnomaly(
                AnomalyType.RAPID_LOCATION_CHANGE, Severity.CRITICAL, 2.0, "2024-01-15T11:30:00Z")));

        CorrelationResult result = correlate(user);

        assertThat(result.getCorrelations()).hasSize(1);
        CorrelationRecord record = result.getCorrelations().get(0);
        assertThat(record.getType()).isEqualTo(CorrelationRecord.Type.TEMPORAL);
        assertThat(record.getSubtype()).isEqualTo("rapid_location_change");
        assertThat(record.getWeight()).isCloseTo(2.5 * 2.0 * 1.0, within(1e-9));
        assertThat(record.getWarningMessage()).isEqualTo("Report Export (R1)");
        assertThat(result.getCorrelationScore()).isCloseTo(5.0, within(1e-9));
    }

    @Test
    void analyzeAll_exactlyAtWindow_included() {
        UserActivity user = userWithoutHistory("U1");
        user.addWarning(TestDataFactory.createWarning("U1", "2024-01-15T10:00:00Z", "Report Export (R1)", Severity.HIGH));
        user.replaceAnomalies(List.of(TestDataFactory.createAnomaly(
                AnomalyType.RAPID_LOCATION_CHANGE, Severity.HIGH, null, "2024-01-15T12:00:00Z")));

        assertThat(temporalRecords(correlate(user))).hasSize(1);
    }

    @Test
    void analyzeAll_justPastWindow_excluded() {
        UserActivity user = userWithoutHistory("U1");
        user.addWarning(TestDataFactory.createWarning("U1", "2024-01-15T10:00:00Z", "Report Export (R1)", Severity.HIGH));
        user.replaceAnomalies(List.of(TestDataFactory.createAnomaly(
                AnomalyType.RAPID_LOCATION_CHANGE, Severity.HIGH, null, "2024-01-15T12:00:00.001Z")));

        assertThat(temporalRecords(correlate(user))).isEmpty();
    }

    @Test
    void analyzeAll_anomalyBeforeWarning_usesAbsoluteDifference() {
        UserActivity user = userWithoutHistory("U1");
        user.addWarning(TestDataFactory.createWarning("U1", "2024-01-15T10:00:00Z", "Report Export (R1)", Severity.MEDIUM));
        user.replaceAnomalies(List.of(TestDataFactory.createAnomaly(
                AnomalyType.RAPID_LOCATION_CHANGE, Severity.HIGH, null, "2024-01-15T09:40:00Z")));

        List<CorrelationRecord> records = temporalRecords(correlate(user));

        // 20 minutes apart: close proximity bonus
        assertThat(records.get(0).getWeight()).isCloseTo(2.5 * 1.2 * 1.5, within(1e-9));
    }

    @Test
    void analyzeAll_withinTheHour_smallerProximityBonus() {
        UserActivity user = userWithoutHistory("U1");
        user.addWarning(TestDataFactory.createWarning("U1", "2024-01-15T10:00:00Z", "Report Export (R1)", Severity.LOW));
        user.replaceAnomalies(List.of(TestDataFactory.createAnomaly(
                AnomalyType.RAPID_LOCATION_CHANGE, Severity.HIGH, null, "2024-01-15T10:45:00Z")));

        assertThat(temporalRecords(correlate(user)).get(0).getWeight()).isCloseTo(2.5 * 1.0 * 1.2, within(1e-9));
    }

    @Test
    void analyzeAll_anomalyWithoutTime_noTemporalRecord() {
        UserActivity user = userWithoutHistory("U1");
        user.addWarning(TestDataFactory.createWarning("U1", "2024-01-15T10:00:00Z", "Report Export (R1)", Severity.CRITICAL));
        user.replaceAnomalies(List.of(TestDataFactory.createAnomaly(AnomalyType.UNUSUAL_HOURS, Severity.MEDIUM, null, null)));

        assertThat(correlate(user).getCorrelations()).isEmpty();
    }

    @Test
    void analyzeAll_warningWithoutDateOrTime_skippedOthersKept() {
        UserActivity user = userWithoutHistory("U1");
        Warning dated = TestDataFactory.createWarning("U1", "2024-01-15T10:00:00Z", "Report Export (R1)", Severity.CRITICAL);
        user.addWarning(dated.toBuilder().message("undated").date(null).timestamp(null).build());
        user.addWarning(dated);
        user.replaceAnomalies(List.of(TestDataFactory.createAnomaly(
                AnomalyType.RAPID_LOCATION_CHANGE, Severity.CRITICAL, 2.0, "2024-01-15T10:10:00Z")));

        assertThat(correlate(user).getCorrelations())
                .extracting(CorrelationRecord::getWarningMessage)
                .containsExactly("Report Export (R1)");
    }

    @Test
    void analyzeAll_warningOutsideUsualBehavior_behavioralRecords() {
        List<LoginRecord> logins = new ArrayList<>();
        LocalDate day = LocalDate.of(2024, 1, 1);
        while (logins.size() < 20) {
            if (day.getDayOfWeek() != DayOfWeek.SATURDAY && day.getDayOfWeek() != DayOfWeek.SUNDAY) {
                String ip = logins.size() % 2 == 0 ? "203.0.113.10" : "203.0.113.11";
                logins.add(TestDataFactory.login(day + "T09:00:00Z", ip));
            }
            day = day.plusDays(1);
        }
        UserActivity user = new UserActivity("U1", "jane");
        user.addLoginHistory(logins);
        // Saturday night, from an address the user never logged in from
        user.addWarning(TestDataFactory.createWarning("U1", "2024-02-03T22:00:00Z", "Data export", Severity.HIGH)
                .toBuilder().clientIp("198.51.100.77").build());

        CorrelationResult result = correlate(user);

        assertThat(result.getCorrelations())
                .extracting(CorrelationRecord::getSubtype)
                .containsExactlyInAnyOrder("outside_business_hours", "weekend_activity", "unusual_ip");
        assertThat(result.getCorrelations()).allMatch(record -> record.getType() == CorrelationRecord.Type.BEHAVIORAL);
        assertThat(result.getCorrelationScore()).isCloseTo(1.3 + 1.2 + 2.0, within(1e-9));
    }

    @Test
    void analyzeAll_knownIpAndNormalHour_noBehavioralRecords() {
        UserActivity user = TestDataFactory.createUser(
                TestDataFactory.login("2024-01-15T09:00:00Z", "203.0.113.10"),
                TestDataFactory.login("2024-01-16T09:00:00Z", "203.0.113.11"));
        user.addWarning(TestDataFactory.createWarning(user.getUserId(), "2024-01-16T09:30:00Z", "Report Export (R1)", Severity.HIGH));

        assertThat(correlate(user).getCorrelations()).isEmpty();
    }

    @Test
    void getHighRiskUsers_thresholdInclusive_sortedDescending() {
        UserActivity low = userWithoutHistory("LOW");
        UserActivity exact = userWithoutHistory("EXACT");
        UserActivity top = userWithoutHistory("TOP");
        UserActivity quiet = userWithoutHistory("QUIET");

        // 2 critical warnings near a location change: 2 x (2.5 x 2.0 x 1.5) = 15
        for (String message : List.of("a", "b")) {
            top.addWarning(TestDataFactory.createWarning("TOP", "2024-01-15T10:00:00Z", message, Severity.CRITICAL));
        }
        top.replaceAnomalies(List.of(TestDataFactory.createAnomaly(
                AnomalyType.RAPID_LOCATION_CHANGE, Severity.CRITICAL, 2.0, "2024-01-15T10:05:00Z")));

        // 4 low warnings 90 minutes away from a location change: 4 x 2.5 = 10
        for (String message : List.of("a", "b", "c", "d")) {
            exact.addWarning(TestDataFactory.createWarning("EXACT", "2024-01-15T10:00:00Z", message, Severity.LOW));
        }
        exact.replaceAnomalies(List.of(TestDataFactory.createAnomaly(
                AnomalyType.RAPID_LOCATION_CHANGE, Severity.CRITICAL, 2.0, "2024-01-15T11:30:00Z")));

        low.addWarning(TestDataFactory.createWarning("LOW", "2024-01-15T10:00:00Z", "a", Severity.LOW));
        low.replaceAnomalies(List.of(TestDataFactory.createAnomaly(
                AnomalyType.RAPID_LOCATION_CHANGE, Severity.CRITICAL, 2.0, "2024-01-15T11:30:00Z")));

        CorrelationReport report = engine.analyzeAll(List.of(low, exact, top, quiet));

        assertThat(report.getHighRiskUsers(10.0))
                .extracting(CorrelationResult::getUserId)
                .containsExactly("TOP", "EXACT");
        assertThat(report.getUserCorrelations("QUIET").orElseThrow().getCorrelationScore()).isZero();
        assertThat(report.getAllCorrelations()).hasSize(4);
    }

    @Test
    void analyzeAll_customWeights_applied() {
        RiskDetectionConfig.Correlation settings = new RiskDetectionConfig.Correlation();
        settings.getWeights().setRapidLocationChange(4.0);
        UserActivity user = userWithoutHistory("U1");
        user.addWarning(TestDataFactory.createWarning("U1", "2024-01-15T10:00:00Z", "x", Severity.LOW));
        user.replaceAnomalies(List.of(TestDataFactory.createAnomaly(
                AnomalyType.RAPID_LOCATION_CHANGE, Severity.CRITICAL, 2.0, "2024-01-15T11:30:00Z")));

        CorrelationReport report = engine.analyzeAll(List.of(user), settings);

        assertThat(report.getUserCorrelations("U1").orElseThrow().getCorrelationScore()).isCloseTo(4.0, within(1e-9));
    }
}
