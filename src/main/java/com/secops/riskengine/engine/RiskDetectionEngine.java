package com.secops.riskengine.engine;

import com.secops.riskengine.config.MetricsConfig;
import com.secops.riskengine.model.ActivityEvent;
import com.secops.riskengine.model.Anomaly;
import com.secops.riskengine.model.CorrelationReport;
import com.secops.riskengine.model.LoginRecord;
import com.secops.riskengine.model.UserActivity;
import com.secops.riskengine.model.Warning;
import com.secops.riskengine.service.RiskScoringService;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.SortedSet;

/**
 * State of one monitoring run: counters, warning log, detector tracking and user activity.
 * Instances are independent of each other; create one per run through
 * {@link RiskDetectionEngineFactory}.
 *
 * Event sources are read concurrently, so every mutator is synchronized on the engine.
 */
public class RiskDetectionEngine {

    private final RuleCatalog catalog;
    private final CounterStore counterStore = new CounterStore();
    private final WarningLog warningLog = new WarningLog();
    private final DetectorTrackingStore trackingStore = new DetectorTrackingStore();
    private final UserActivityStore userStore;
    private final RuleEngine ruleEngine;
    private final AnomalyDetector anomalyDetector;
    private final CorrelationEngine correlationEngine;

    public RiskDetectionEngine(RuleCatalog catalog, DetectorRegistry detectorRegistry,
                               AnomalyDetector anomalyDetector, CorrelationEngine correlationEngine,
                               RiskScoringService scoringService, MetricsConfig metricsConfig) {
        this.catalog = catalog;
        this.anomalyDetector = anomalyDetector;
        this.correlationEngine = correlationEngine;
        this.userStore = new UserActivityStore(scoringService);
        this.ruleEngine = new RuleEngine(catalog, counterStore, warningLog, detectorRegistry, trackingStore,
                metricsConfig, userId -> userStore.get(userId).map(UserActivity::getUsername).orElse(null));
    }

    public synchronized UserActivity registerUser(String userId, String username) {
        return userStore.register(userId, username);
    }

    public synchronized boolean addLoginHistory(String userId, Collection<LoginRecord> records) {
        return userStore.addLoginHistory(userId, records);
    }

    public synchronized List<Anomaly> analyzeAnomalies(String userId) {
        return userStore.get(userId)
                .map(anomalyDetector::analyze)
                .orElse(List.of());
    }

    /**
     * Evaluate one event of a monitored user and attach any new warnings to that user.
     * Events of users that were not registered are ignored.
     */
    public synchronized List<Warning> process(ActivityEvent event) {
        if (!userStore.contains(event.getUserId())) {
            return List.of();
        }
        List<Warning> warnings = ruleEngine.evaluate(event);
        warnings.forEach(userStore::addWarning);
        return warnings;
    }

    public synchronized void recordScannedLog(String userId, String eventType) {
        userStore.recordScannedLog(userId, eventType);
    }

    public synchronized CorrelationReport correlate() {
        return correlationEngine.analyzeAll(userStore.all());
    }

    public synchronized boolean isMonitored(String userId) {
        return userStore.contains(userId);
    }

    public synchronized SortedSet<LocalDate> allLoginDays() {
        return userStore.allLoginDays();
    }

    public synchronized List<Warning> getWarnings() {
        return warningLog.all();
    }

    public RuleCatalog getCatalog() {
        return catalog;
    }

    // Read-side accessors below are meant for after the run has finished processing
    public UserActivityStore getUserStore() {
        return userStore;
    }

    public CounterStore getCounterStore() {
        return counterStore;
    }
}
