package com.secops.riskengine.model;

import com.secops.riskengine.util.IpAddresses;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Per-user state for one monitoring run: login history, warnings and anomalies.
 * Risk score and level are not stored here; they are always recomputed from this state.
 */
public class UserActivity {

    private final String userId;
    private final String username;
    private final SortedSet<LocalDate> loginDays = new TreeSet<>();
    private final List<LoginRecord> loginTimes = new ArrayList<>();
    private final Map<String, Integer> ipAddresses = new LinkedHashMap<>();
    private final Set<String> knownLocations = new LinkedHashSet<>();
    private final List<Warning> warnings = new ArrayList<>();
    private final Map<String, Integer> scannedLogs = new LinkedHashMap<>();
    private List<Anomaly> anomalies = List.of();
    private boolean historyLoaded;

    public UserActivity(String userId, String username) {
        this.userId = userId;
        this.username = username;
    }

    /**
     * Load the full login history. Accepted once; returns false if history was already loaded.
     */
    public boolean addLoginHistory(Collection<LoginRecord> records) {
        if (historyLoaded) {
            return false;
        }
        historyLoaded = true;
        for (LoginRecord record : records) {
            loginDays.add(record.getDate());
            loginTimes.add(record);
            if (IpAddresses.isKnown(record.getSourceIp())) {
                ipAddresses.merge(record.getSourceIp(), 1, Integer::sum);
            }
            if (record.getLoginGeoId() != null) {
                knownLocations.add(record.getLoginGeoId());
            }
        }
        return true;
    }

    public void addWarning(Warning warning) {
        warnings.add(warning);
    }

    public void replaceAnomalies(List<Anomaly> detected) {
        this.anomalies = List.copyOf(detected);
    }

    public void recordScannedLog(String eventType) {
        scannedLogs.merge(eventType, 1, Integer::sum);
    }

    public String getUserId() {
        return userId;
    }

    public String getUsername() {
        return username;
    }

    public boolean isHistoryLoaded() {
        return historyLoaded;
    }

    public SortedSet<LocalDate> getLoginDays() {
        return Collections.unmodifiableSortedSet(loginDays);
    }

    public List<LoginRecord> getLoginTimes() {
        return Collections.unmodifiableList(loginTimes);
    }

    public Map<String, Integer> getIpAddresses() {
        return Collections.unmodifiableMap(ipAddresses);
    }

    public Set<String> getKnownLocations() {
        return Collections.unmodifiableSet(knownLocations);
    }

    public List<Warning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public List<Anomaly> getAnomalies() {
        return anomalies;
    }

    public Map<String, Integer> getScannedLogs() {
        return Collections.unmodifiableMap(scannedLogs);
    }

    public boolean hasSignals() {
        return !warnings.isEmpty() || !anomalies.isEmpty();
    }
}
