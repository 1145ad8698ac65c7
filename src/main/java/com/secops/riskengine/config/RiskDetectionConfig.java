package com.secops.riskengine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "risk")
public class RiskDetectionConfig {

    // Zone used to derive login hours, weekdays and event dates.
    private String zoneId = "UTC";

    private Processing processing = new Processing();

    private Rules rules = new Rules();

    private Anomaly anomaly = new Anomaly();

    private Correlation correlation = new Correlation();

    private Detectors detectors = new Detectors();

    private Geo geo = new Geo();

    public ZoneId zone() {
        return ZoneId.of(zoneId);
    }

    @Data
    public static class Processing {
        // Number of event sources fetched concurrently per batch
        private int batchSize = 5;
        // Maximum number of sources scanned per run. 0 = unlimited.
        private int scanLimit = 0;
        // Only scan sources whose log date is a login day of some monitored user
        private boolean restrictToLoginDays = true;
    }

    @Data
    public static class Rules {
        // Optional JSON file with per-event-type rule overrides. Blank = defaults only.
        private String overrideFile = "";
    }

    @Data
    public static class Anomaly {
        private int recentDays = 7;
        // An hour is "normal" when its login count >= factor * average logins per hour
        private double normalHourFactor = 0.5;
        // Consecutive logins from different IPs closer than this are examined for relocation
        private double rapidChangeHours = 4.0;
        private int weekendMinLogins = 10;
        private double rareWeekendRatio = 0.1;
    }

    @Data
    public static class Correlation {
        private double windowHours = 2.0;
        private double highRiskThreshold = 10.0;
        private Weights weights = new Weights();
    }

    @Data
    public static class Weights {
        private double unusualLoginTime = 1.5;
        private double rapidLocationChange = 2.5;
        private double weekendActivity = 1.2;
        private double outsideBusinessHours = 1.3;
        private double multipleLocations = 2.0;
    }

    @Data
    public static class Detectors {
        private List<String> allowedCalloutDomains = new ArrayList<>(List.of("api.salesforce.com", "yourcompany.com"));
        private List<String> guestSensitiveActions = new ArrayList<>(List.of("create", "update", "delete"));
        private List<String> sensitiveFlowPatterns = new ArrayList<>(List.of("admin", "delete", "purge", "mass", "bulk"));
        private List<String> privilegedPermissionSets = new ArrayList<>(List.of("admin", "manage", "delete", "all"));
        private long bulkRecordLimit = 10_000;
    }

    @Data
    public static class Geo {
        // IP (exact) or IP prefix (ending in '.' or ':') -> location
        private Map<String, Location> locations = new LinkedHashMap<>();
    }

    @Data
    public static class Location {
        private String country;
        private String city;
    }
}
