package com.secops.riskengine.engine;

import com.secops.riskengine.config.RiskDetectionConfig;
import com.secops.riskengine.model.LoginRecord;
import com.secops.riskengine.model.UserActivity;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Baseline login behavior of one user: which hours are normal and whether the user
 * rarely works weekends.
 */
public final class LoginPatterns {

    private final Set<Integer> normalHours;
    private final int weekendLogins;
    private final int weekdayLogins;
    private final boolean rareWeekendUser;
    private final Set<String> knownIps;

    private LoginPatterns(Set<Integer> normalHours, int weekendLogins, int weekdayLogins,
                          boolean rareWeekendUser, Set<String> knownIps) {
        this.normalHours = normalHours;
        this.weekendLogins = weekendLogins;
        this.weekdayLogins = weekdayLogins;
        this.rareWeekendUser = rareWeekendUser;
        this.knownIps = knownIps;
    }

    public static LoginPatterns of(UserActivity activity, RiskDetectionConfig.Anomaly settings) {
        List<LoginRecord> logins = activity.getLoginTimes();

        int[] hourCounts = new int[24];
        int weekend = 0;
        for (LoginRecord login : logins) {
            hourCounts[login.getHourOfDay()]++;
            if (login.isWeekend()) {
                weekend++;
            }
        }

        // An hour is normal if it has at least half the average logins per hour
        double avgPerHour = logins.size() / 24.0;
        Set<Integer> normal = new TreeSet<>();
        for (int hour = 0; hour < 24; hour++) {
            if (hourCounts[hour] >= avgPerHour * settings.getNormalHourFactor()) {
                normal.add(hour);
            }
        }

        boolean rare = logins.size() >= settings.getWeekendMinLogins()
                && (double) weekend / logins.size() < settings.getRareWeekendRatio();

        return new LoginPatterns(Collections.unmodifiableSet(normal), weekend, logins.size() - weekend,
                rare, activity.getIpAddresses().keySet());
    }

    public Set<Integer> getNormalHours() {
        return normalHours;
    }

    public boolean isNormalHour(int hour) {
        return normalHours.contains(hour);
    }

    public int getWeekendLogins() {
        return weekendLogins;
    }

    public int getWeekdayLogins() {
        return weekdayLogins;
    }

    public double getWeekendRatio() {
        int total = weekendLogins + weekdayLogins;
        return total == 0 ? 0.0 : (double) weekendLogins / total;
    }

    /** Only meaningful with enough history; false below the minimum login count. */
    public boolean isRareWeekendUser() {
        return rareWeekendUser;
    }

    public Set<String> getKnownIps() {
        return knownIps;
    }
}
