package com.secops.riskengine.engine;

import com.secops.riskengine.config.MetricsConfig;
import com.secops.riskengine.config.RiskDetectionConfig;
import com.secops.riskengine.model.Anomaly;
import com.secops.riskengine.model.AnomalyType;
import com.secops.riskengine.model.GeoLocation;
import com.secops.riskengine.model.LoginRecord;
import com.secops.riskengine.model.Severity;
import com.secops.riskengine.model.UserActivity;
import com.secops.riskengine.service.GeoLocationService;
import com.secops.riskengine.util.IpAddresses;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Derives login-pattern anomalies from a user's login history:
 * unusual login hours, rapid location changes and atypical weekend logins.
 *
 * Each call recomputes the full anomaly list and replaces the user's previous one.
 */
@Component
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    private static final double LOCATION_CHANGE_MULTIPLIER = 2.0;

    private final GeoLocationService geoLocationService;
    private final RiskDetectionConfig config;
    private final Clock clock;
    private final MetricsConfig metricsConfig;

    public AnomalyDetector(GeoLocationService geoLocationService, RiskDetectionConfig config,
                           Clock clock, MetricsConfig metricsConfig) {
        this.geoLocationService = geoLocationService;
        this.config = config;
        this.clock = clock;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "anomalies.analyze", contextualName = "analyze-login-anomalies")
    public List<Anomaly> analyze(UserActivity activity) {
        List<LoginRecord> logins = activity.getLoginTimes();
        if (logins.size() < 2) {
            activity.replaceAnomalies(List.of());
            return List.of();
        }

        RiskDetectionConfig.Anomaly settings = config.getAnomaly();
        LoginPatterns patterns = LoginPatterns.of(activity, settings);
        Instant recentFrom = Instant.now(clock).minus(Duration.ofDays(settings.getRecentDays()));
        List<LoginRecord> recent = logins.stream()
                .filter(login -> !login.getDatetime().isBefore(recentFrom))
                .toList();

        List<Anomaly> anomalies = new ArrayList<>();
        detectUnusualHours(recent, patterns).ifPresent(anomalies::add);
        anomalies.addAll(detectLocationChanges(logins, settings));
        detectWeekendActivity(recent, patterns).ifPresent(anomalies::add);

        anomalies.forEach(anomaly -> metricsConfig.recordAnomaly(anomaly.getType().getValue()));
        if (!anomalies.isEmpty()) {
            log.info("Detected {} login anomalies for user {}", anomalies.size(), activity.getUserId());
        }
        activity.replaceAnomalies(anomalies);
        return anomalies;
    }

    private Optional<Anomaly> detectUnusualHours(List<LoginRecord> recent, LoginPatterns patterns) {
        TreeSet<Integer> unusual = new TreeSet<>();
        for (LoginRecord login : recent) {
            if (!patterns.isNormalHour(login.getHourOfDay())) {
                unusual.add(login.getHourOfDay());
            }
        }
        if (unusual.isEmpty()) {
            return Optional.empty();
        }

        String hours = unusual.stream().map(String::valueOf).collect(Collectors.joining(", "));
        return Optional.of(Anomaly.builder()
                .type(AnomalyType.UNUSUAL_HOURS)
                .severity(Severity.MEDIUM)
                .description("Unusual login hours detected: " + hours)
                .details(Map.of(
                        "unusualHours", List.copyOf(unusual),
                        "normalHours", List.copyOf(patterns.getNormalHours())))
                .build());
    }

    private List<Anomaly> detectLocationChanges(List<LoginRecord> logins, RiskDetectionConfig.Anomaly settings) {
        List<LoginRecord> sorted = logins.stream()
                .sorted(Comparator.comparing(LoginRecord::getDatetime))
                .toList();
        long windowMillis = (long) (settings.getRapidChangeHours() * 3_600_000L);
        Map<String, Optional<GeoLocation>> resolved = new HashMap<>();

        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 1; i < sorted.size(); i++) {
            LoginRecord prev = sorted.get(i - 1);
            LoginRecord curr = sorted.get(i);
            // a login without an address says nothing about where the user was
            if (!IpAddresses.isKnown(prev.getSourceIp()) || !IpAddresses.isKnown(curr.getSourceIp())) {
                continue;
            }
            if (Objects.equals(prev.getSourceIp(), curr.getSourceIp())) {
                continue;
            }
            Duration gap = Duration.between(prev.getDatetime(), curr.getDatetime());
            if (gap.toMillis() >= windowMillis) {
                continue;
            }

            double hours = Math.round(gap.toMillis() / 36_000.0) / 100.0;
            Optional<GeoLocation> prevLocation = resolved.computeIfAbsent(prev.getSourceIp(), this::locate);
            Optional<GeoLocation> currLocation = resolved.computeIfAbsent(curr.getSourceIp(), this::locate);

            if (prevLocation.isEmpty() || currLocation.isEmpty()) {
                anomalies.add(ipChangeAnomaly(prev, curr, hours));
            } else if (!prevLocation.get().sameCountryAndCity(currLocation.get())) {
                anomalies.add(locationChangeAnomaly(prev, curr, prevLocation.get(), currLocation.get(), hours));
            }
        }
        return anomalies;
    }

    private Optional<GeoLocation> locate(String ip) {
        try {
            Optional<GeoLocation> location = geoLocationService.lookup(ip);
            if (location.isEmpty()) {
                metricsConfig.recordGeoLookupFailure();
                log.debug("No geolocation available for IP {}", ip);
            }
            return location;
        } catch (RuntimeException e) {
            metricsConfig.recordGeoLookupFailure();
            log.debug("Geolocation lookup failed for IP {}: {}", ip, e.getMessage());
            return Optional.empty();
        }
    }

    private Anomaly locationChangeAnomaly(LoginRecord prev, LoginRecord curr,
                                          GeoLocation from, GeoLocation to, double hours) {
        Map<String, Object> details = baseDetails(prev, curr, hours);
        details.put("prevLocation", from.display());
        details.put("currLocation", to.display());
        details.put("geoInfo", true);

        return Anomaly.builder()
                .type(AnomalyType.RAPID_LOCATION_CHANGE)
                .severity(Severity.CRITICAL)
                .severityMultiplier(LOCATION_CHANGE_MULTIPLIER)
                .description(String.format(Locale.ROOT, "Suspicious login location change: %s -> %s (%.2f hours)",
                        from.display(), to.display(), hours))
                .details(details)
                .occurredAt(curr.getDatetime())
                .build();
    }

    // Geolocation unavailable: all we know is that the IP changed quickly
    private Anomaly ipChangeAnomaly(LoginRecord prev, LoginRecord curr, double hours) {
        Map<String, Object> details = baseDetails(prev, curr, hours);
        details.put("geoInfo", false);

        return Anomaly.builder()
                .type(AnomalyType.RAPID_LOCATION_CHANGE)
                .severity(Severity.HIGH)
                .description(String.format(Locale.ROOT, "Rapid IP change: %s -> %s (%.2f hours)",
                        prev.getSourceIp(), curr.getSourceIp(), hours))
                .details(details)
                .occurredAt(curr.getDatetime())
                .build();
    }

    private static Map<String, Object> baseDetails(LoginRecord prev, LoginRecord curr, double hours) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("from", prev.getSourceIp());
        details.put("to", curr.getSourceIp());
        details.put("hours", hours);
        details.put("prevTime", prev.getDatetime().toString());
        details.put("currTime", curr.getDatetime().toString());
        return details;
    }

    private Optional<Anomaly> detectWeekendActivity(List<LoginRecord> recent, LoginPatterns patterns) {
        if (!patterns.isRareWeekendUser()) {
            return Optional.empty();
        }
        List<Instant> weekendLogins = recent.stream()
                .filter(LoginRecord::isWeekend)
                .map(LoginRecord::getDatetime)
                .toList();
        if (weekendLogins.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(Anomaly.builder()
                .type(AnomalyType.WEEKEND_ACTIVITY)
                .severity(Severity.LOW)
                .description(String.format(Locale.ROOT, "Unusual weekend activity: %d recent weekend logins (usual weekend ratio %.0f%%)",
                        weekendLogins.size(), patterns.getWeekendRatio() * 100))
                .details(Map.of(
                        "weekendLogins", weekendLogins.size(),
                        "weekendRatio", patterns.getWeekendRatio()))
                .build());
    }
}
