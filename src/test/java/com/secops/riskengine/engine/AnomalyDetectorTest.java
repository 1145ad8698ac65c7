package com.secops.riskengine.engine;

import com.secops.riskengine.config.MetricsConfig;
import com.secops.riskengine.config.RiskDetectionConfig;
import com.secops.riskengine.model.Anomaly;
import com.secops.riskengine.model.AnomalyType;
import com.secops.riskengine.model.GeoLocation;
import com.secops.riskengine.model.LoginRecord;
import com.secops.riskengine.model.RiskAssessment;
import com.secops.riskengine.model.RiskLevel;
import com.secops.riskengine.model.Severity;
import com.secops.riskengine.model.UserActivity;
import com.secops.riskengine.service.GeoLocationService;
import com.secops.riskengine.service.RiskScoringService;
import com.secops.riskengine.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnomalyDetectorTest {

    private static final String IP_NEW_YORK = "203.0.113.10";
    private static final String IP_LOS_ANGELES = "198.51.100.20";
    private static final String IP_NEW_YORK_2 = "203.0.113.99";

    @Mock
    private GeoLocationService geoLocationService;

    private SimpleMeterRegistry registry;
    private AnomalyDetector detector;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        detector = detectorAt("2024-01-16T00:00:00Z");
    }

    private AnomalyDetector detectorAt(String now) {
        return new AnomalyDetector(geoLocationService, new RiskDetectionConfig(),
                Clock.fixed(Instant.parse(now), ZoneOffset.UTC), new MetricsConfig(registry));
    }

    @Test
    void analyze_newYorkThenLosAngeles_criticalLocationChange() {
        when(geoLocationService.lookup(IP_NEW_YORK)).thenReturn(Optional.of(new GeoLocation("US", "New York")));
        when(geoLocationService.lookup(IP_LOS_ANGELES)).thenReturn(Optional.of(new GeoLocation("US", "Los Angeles")));
        UserActivity user = TestDataFactory.createUser(
                TestDataFactory.login("2024-01-15T09:00:00Z", IP_NEW_YORK),
                TestDataFactory.login("2024-01-15T09:45:00Z", IP_LOS_ANGELES));

        List<Anomaly> anomalies = detector.analyze(user);

        assertThat(anomalies).hasSize(1);
        Anomaly anomaly = anomalies.get(0);
        assertThat(anomaly.getType()).isEqualTo(AnomalyType.RAPID_LOCATION_CHANGE);
        assertThat(anomaly.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(anomaly.getSeverityMultiplier()).isEqualTo(2.0);
        assertThat(anomaly.getDetails()).containsEntry("hours", 0.75).containsEntry("geoInfo", true);
        assertThat(anomaly.getDescription())
                .isEqualTo("Suspicious login location change: New York, US -> Los Angeles, US (0.75 hours)");
        assertThat(anomaly.getOccurredAt()).isEqualTo(Instant.parse("2024-01-15T09:45:00Z"));
        assertThat(user.getAnomalies()).containsExactly(anomaly);

        RiskAssessment assessment = new RiskScoringService().score(user);
        assertThat(assessment.getRiskScore()).isEqualTo(100);
        assertThat(assessment.getRiskLevel()).isEqualTo(RiskLevel.CRITICAL);
    }

    @Test
    void analyze_sameCityDifferentIps_noAnomaly() {
        when(geoLocationService.lookup(anyString())).thenReturn(Optional.of(new GeoLocation("US", "New York")));
        UserActivity user = TestDataFactory.createUser(
                TestDataFactory.login("2024-01-15T09:00:00Z", IP_NEW_YORK),
                TestDataFactory.login("2024-01-15T09:30:00Z", IP_NEW_YORK_2),
                TestDataFactory.login("2024-01-15T10:00:00Z", IP_NEW_YORK));

        assertThat(detector.analyze(user)).isEmpty();
        // Each address is resolved once per analysis
        verify(geoLocationService, times(1)).lookup(IP_NEW_YORK);
    }

    @Test
    void analyze_geoUnavailable_fallsBackToIpChange() {
        when(geoLocationService.lookup(IP_NEW_YORK)).thenReturn(Optional.of(new GeoLocation("US", "New York")));
        when(geoLocationService.lookup("192.0.2.44")).thenReturn(Optional.empty());
        UserActivity user = TestDataFactory.createUser(
                TestDataFactory.login("2024-01-15T09:00:00Z", IP_NEW_YORK),
                TestDataFactory.login("2024-01-15T10:30:00Z", "192.0.2.44"));

        List<Anomaly> anomalies = detector.analyze(user);

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(anomalies.get(0).getSeverityMultiplier()).isNull();
        assertThat(anomalies.get(0).getDetails()).containsEntry("geoInfo", false).containsEntry("hours", 1.5);
        assertThat(anomalies.get(0).getDescription()).isEqualTo("Rapid IP change: 203.0.113.10 -> 192.0.2.44 (1.50 hours)");
        assertThat(registry.get("geo.lookup.failure.count").counter().count()).isEqualTo(1.0);
    }

    @Test
    void analyze_geoLookupThrows_fallsBackToIpChange() {
        when(geoLocationService.lookup(anyString())).thenThrow(new IllegalStateException("geo service down"));
        UserActivity user = TestDataFactory.createUser(
                TestDataFactory.login("2024-01-15T09:00:00Z", IP_NEW_YORK),
                TestDataFactory.login("2024-01-15T09:20:00Z", IP_LOS_ANGELES));

        List<Anomaly> anomalies = detector.analyze(user);

        assertThat(anomalies).extracting(Anomaly::getSeverity).containsExactly(Severity.HIGH);
    }

    @Test
    void analyze_gapOfFourHoursOrMore_notExamined() {
        UserActivity user = TestDataFactory.createUser(
                TestDataFactory.login("2024-01-15T09:00:00Z", IP_NEW_YORK),
                TestDataFactory.login("2024-01-15T13:00:00Z", IP_LOS_ANGELES));

        assertThat(detector.analyze(user)).isEmpty();
        verify(geoLocationService, times(0)).lookup(anyString());
    }

    @Test
    void analyze_unsortedHistory_examinesChronologicalPairs() {
        when(geoLocationService.lookup(IP_NEW_YORK)).thenReturn(Optional.of(new GeoLocation("US", "New York")));
        when(geoLocationService.lookup(IP_LOS_ANGELES)).thenReturn(Optional.of(new GeoLocation("US", "Los Angeles")));
        UserActivity user = TestDataFactory.createUser(
                TestDataFactory.login("2024-01-15T09:45:00Z", IP_LOS_ANGELES),
                TestDataFactory.login("2024-01-14T20:00:00Z", IP_LOS_ANGELES),
                TestDataFactory.login("2024-01-15T09:00:00Z", IP_NEW_YORK));

        assertThat(detector.analyze(user)).extracting(Anomaly::getType)
                .containsExactly(AnomalyType.RAPID_LOCATION_CHANGE);
    }

    @Test
    void analyze_singleLogin_empty() {
        UserActivity user = TestDataFactory.createUser(TestDataFactory.login("2024-01-15T03:00:00Z", IP_NEW_YORK));

        assertThat(detector.analyze(user)).isEmpty();
        assertThat(user.getAnomalies()).isEmpty();
    }

    @Test
    void analyze_recentLoginAtRareHour_unusualHours() {
        List<LoginRecord> logins = new ArrayList<>();
        LocalDate day = LocalDate.of(2024, 1, 1);
        for (int i = 0; i < 50; i++) {
            logins.add(TestDataFactory.login(day.plusDays(i) + "T09:00:00Z", IP_NEW_YORK));
        }
        logins.add(TestDataFactory.login("2024-02-19T03:00:00Z", IP_NEW_YORK));
        UserActivity user = TestDataFactory.createUser(logins.toArray(LoginRecord[]::new));

        List<Anomaly> anomalies = detectorAt("2024-02-20T12:00:00Z").analyze(user);

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getType()).isEqualTo(AnomalyType.UNUSUAL_HOURS);
        assertThat(anomalies.get(0).getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(anomalies.get(0).getDescription()).isEqualTo("Unusual login hours detected: 3");
        assertThat(anomalies.get(0).getDetails()).containsEntry("unusualHours", List.of(3));
    }

    @Test
    void analyze_rareWeekendUserLogsInOnSaturday_weekendActivity() {
        List<LoginRecord> logins = new ArrayList<>();
        LocalDate day = LocalDate.of(2024, 1, 1);
        while (logins.size() < 20) {
            if (day.getDayOfWeek() != DayOfWeek.SATURDAY && day.getDayOfWeek() != DayOfWeek.SUNDAY) {
                logins.add(TestDataFactory.login(day + "T09:00:00Z", IP_NEW_YORK));
            }
            day = day.plusDays(1);
        }
        logins.add(TestDataFactory.login("2024-02-03T09:00:00Z", IP_NEW_YORK));
        UserActivity user = TestDataFactory.createUser(logins.toArray(LoginRecord[]::new));

        List<Anomaly> anomalies = detectorAt("2024-02-05T12:00:00Z").analyze(user);

        assertThat(anomalies).extracting(Anomaly::getType).containsExactly(AnomalyType.WEEKEND_ACTIVITY);
        assertThat(anomalies.get(0).getSeverity()).isEqualTo(Severity.LOW);
    }

    @Test
    void analyze_fewLogins_neverRareWeekendUser() {
        UserActivity user = TestDataFactory.createUser(
                TestDataFactory.login("2024-01-12T09:00:00Z", IP_NEW_YORK),
                TestDataFactory.login("2024-01-13T09:00:00Z", IP_NEW_YORK));

        assertThat(detector.analyze(user)).isEmpty();
    }

    @Test
    void analyze_calledTwice_replacesAnomalies() {
        when(geoLocationService.lookup(IP_NEW_YORK)).thenReturn(Optional.of(new GeoLocation("US", "New York")));
        when(geoLocationService.lookup(IP_LOS_ANGELES)).thenReturn(Optional.of(new GeoLocation("US", "Los Angeles")));
        UserActivity user = TestDataFactory.createUser(
                TestDataFactory.login("2024-01-15T09:00:00Z", IP_NEW_YORK),
                TestDataFactory.login("2024-01-15T09:45:00Z", IP_LOS_ANGELES));

        detector.analyze(user);
        detector.analyze(user);

        assertThat(user.getAnomalies()).hasSize(1);
    }

    @Test
    void analyze_loginsWithoutAddress_noLocationChange() {
        UserActivity user = TestDataFactory.createUser(
                TestDataFactory.login("2024-01-15T09:00:00Z", null),
                TestDataFactory.login("2024-01-15T09:30:00Z", IP_NEW_YORK),
                TestDataFactory.login("2024-01-15T10:00:00Z", "unknown"));

        assertThat(detector.analyze(user)).isEmpty();
        verify(geoLocationService, times(0)).lookup(anyString());
        RiskAssessment assessment = new RiskScoringService().score(user);
        assertThat(assessment.getRiskScore()).isZero();
        assertThat(assessment.getRiskLevel()).isEqualTo(RiskLevel.NONE);
    }

    private static List<LoginRecord> dailyBaselineAtTen(int count) {
        List<LoginRecord> logins = new ArrayList<>();
        LocalDate day = LocalDate.of(2023, 7, 1);
        for (int i = 0; i < count; i++) {
            logins.add(TestDataFactory.login(day.plusDays(i) + "T10:00:00Z", IP_NEW_YORK));
        }
        return logins;
    }

    @Test
    void analyze_rareHourLoginJustOlderThanRecentWindow_notUnusual() {
        List<LoginRecord> logins = dailyBaselineAtTen(160);
        logins.add(TestDataFactory.login("2024-01-09T22:59:59Z", IP_NEW_YORK));
        UserActivity user = TestDataFactory.createUser(logins.toArray(LoginRecord[]::new));

        assertThat(detectorAt("2024-01-16T23:00:00Z").analyze(user)).isEmpty();
    }

    @Test
    void analyze_rareHourLoginExactlyAtRecentWindowStart_unusual() {
        List<LoginRecord> logins = dailyBaselineAtTen(160);
        logins.add(TestDataFactory.login("2024-01-09T23:00:00Z", IP_NEW_YORK));
        UserActivity user = TestDataFactory.createUser(logins.toArray(LoginRecord[]::new));

        List<Anomaly> anomalies = detectorAt("2024-01-16T23:00:00Z").analyze(user);

        assertThat(anomalies).extracting(Anomaly::getType).containsExactly(AnomalyType.UNUSUAL_HOURS);
        assertThat(anomalies.get(0).getDetails()).containsEntry("unusualHours", List.of(23));
    }

    private static List<LoginRecord> weekdayBaseline() {
        List<LoginRecord> logins = new ArrayList<>();
        LocalDate day = LocalDate.of(2023, 12, 1);
        while (logins.size() < 20) {
            if (day.getDayOfWeek() != DayOfWeek.SATURDAY && day.getDayOfWeek() != DayOfWeek.SUNDAY) {
                logins.add(TestDataFactory.login(day + "T09:00:00Z", IP_NEW_YORK));
            }
            day = day.plusDays(1);
        }
        return logins;
    }

    @Test
    void analyze_saturdayLoginJustOlderThanRecentWindow_noWeekendActivity() {
        List<LoginRecord> logins = weekdayBaseline();
        logins.add(TestDataFactory.login("2024-01-13T22:59:59Z", IP_NEW_YORK));
        UserActivity user = TestDataFactory.createUser(logins.toArray(LoginRecord[]::new));

        assertThat(detectorAt("2024-01-20T23:00:00Z").analyze(user)).isEmpty();
    }

    @Test
    void analyze_saturdayLoginExactlyAtRecentWindowStart_weekendActivity() {
        List<LoginRecord> logins = weekdayBaseline();
        logins.add(TestDataFactory.login("2024-01-13T23:00:00Z", IP_NEW_YORK));
        UserActivity user = TestDataFactory.createUser(logins.toArray(LoginRecord[]::new));

        assertThat(detectorAt("2024-01-20T23:00:00Z").analyze(user))
                .extracting(Anomaly::getType)
                .contains(AnomalyType.WEEKEND_ACTIVITY);
    }
}
