package com.secops.riskengine.service;

import com.secops.riskengine.config.MetricsConfig;
import com.secops.riskengine.config.RiskDetectionConfig;
import com.secops.riskengine.engine.RiskDetectionEngine;
import com.secops.riskengine.engine.RiskDetectionEngineFactory;
import com.secops.riskengine.model.ActivityEvent;
import com.secops.riskengine.model.CorrelationReport;
import com.secops.riskengine.model.CorrelationResult;
import com.secops.riskengine.model.EventLog;
import com.secops.riskengine.model.LoginEntry;
import com.secops.riskengine.model.LoginRecord;
import com.secops.riskengine.model.MonitoredUser;
import com.secops.riskengine.model.MonitoringReport;
import com.secops.riskengine.model.MonitoringRequest;
import com.secops.riskengine.model.RiskRule;
import com.secops.riskengine.model.UserActivitySummary;
import com.secops.riskengine.util.Timestamps;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs one monitoring pass.
 *
 * Flow:
 * 1. Fail fast when there are no active rules or no users to monitor
 * 2. Register users and load their login history
 * 3. Detect login anomalies per user
 * 4. Select the event sources to scan (login days only, optional scan limit)
 * 5. Fetch sources concurrently in fixed-size batches and feed every row to the engine
 * 6. Score and correlate users, then assemble the report
 *
 * A source that cannot be fetched is logged, counted and listed in the report;
 * the rest of the run proceeds.
 */
@Service
public class MonitoringRunService {

    private static final Logger log = LoggerFactory.getLogger(MonitoringRunService.class);

    private static final String LOG_DATE_FIELD = "LOG_DATE";

    private final RiskDetectionEngineFactory engineFactory;
    private final RuleService ruleService;
    private final RiskDetectionConfig config;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;
    private final Clock clock;

    public MonitoringRunService(RiskDetectionEngineFactory engineFactory, RuleService ruleService,
                                RiskDetectionConfig config, MetricsConfig metricsConfig,
                                Tracer tracer, Clock clock) {
        this.engineFactory = engineFactory;
        this.ruleService = ruleService;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
        this.clock = clock;
    }

    /**
     * Run with the users, login history and event logs carried by the request.
     */
    public MonitoringReport run(MonitoringRequest request) {
        ZoneId zone = config.zone();
        Map<String, List<LoginRecord>> history = new LinkedHashMap<>();
        if (request.getLoginHistory() != null) {
            request.getLoginHistory().forEach((userId, entries) -> history.put(userId, toLoginRecords(userId, entries, zone)));
        }

        List<EventSource> sources = new ArrayList<>();
        if (request.getEventLogs() != null) {
            for (EventLog eventLog : request.getEventLogs()) {
                sources.add(new InlineEventSource(eventLog));
            }
        }
        return run(request.getUsers(), history, sources);
    }

    @Observed(name = "monitoring.run", contextualName = "monitoring-run")
    public MonitoringReport run(List<MonitoredUser> users, Map<String, List<LoginRecord>> loginHistory,
                                List<EventSource> sources) {
        checkPreconditions(users);

        String runId = UUID.randomUUID().toString();
        log.info("Starting monitoring run {} for {} users and {} event sources", runId, users.size(), sources.size());

        RiskDetectionEngine engine = engineFactory.create();
        for (MonitoredUser user : users) {
            engine.registerUser(user.getUserId(), user.getUsername());
        }
        for (MonitoredUser user : users) {
            engine.addLoginHistory(user.getUserId(), loginHistory.getOrDefault(user.getUserId(), List.of()));
            engine.analyzeAnomalies(user.getUserId());
        }

        SortedSet<LocalDate> loginDays = engine.allLoginDays();
        List<EventSource> selected = selectSources(sources, loginDays);
        List<String> failedSources = processSources(engine, selected);

        CorrelationReport correlations = engine.correlate();
        List<CorrelationResult> highRisk = correlations.getHighRiskUsers(config.getCorrelation().getHighRiskThreshold());

        List<UserActivitySummary> summaries = new ArrayList<>();
        for (MonitoredUser user : users) {
            summaries.add(engine.getUserStore().getSummary(user.getUserId()));
        }
        long maxScore = summaries.stream().mapToLong(UserActivitySummary::getRiskScore).max().orElse(0);
        metricsConfig.recordRun(summaries.size(), maxScore);
        metricsConfig.updateHighRiskUserCount(highRisk.size());

        log.info("Monitoring run {} complete: {} sources scanned, {} failed, {} warnings, {} high-risk users",
                runId, selected.size() - failedSources.size(), failedSources.size(),
                engine.getWarnings().size(), highRisk.size());

        return MonitoringReport.builder()
                .runId(runId)
                .generatedAt(Instant.now(clock))
                .loginDays(List.copyOf(loginDays))
                .users(summaries)
                .warnings(engine.getWarnings())
                .correlations(correlations.getAllCorrelations())
                .highRiskUsers(highRisk)
                .scannedSources(selected.size() - failedSources.size())
                .failedSources(failedSources)
                .build();
    }

    private void checkPreconditions(List<MonitoredUser> users) {
        boolean hasActiveRules = ruleService.getCatalog() != null
                && ruleService.getAllRules().stream().anyMatch(RiskRule::isEnabled);
        if (!hasActiveRules) {
            throw new MonitoringPreconditionException("No risk rules loaded; cannot start monitoring");
        }
        if (users == null || users.isEmpty()) {
            throw new MonitoringPreconditionException("No users to monitor");
        }
    }

    List<EventSource> selectSources(List<EventSource> sources, Collection<LocalDate> loginDays) {
        RiskDetectionConfig.Processing processing = config.getProcessing();
        List<EventSource> selected = new ArrayList<>();
        for (EventSource source : sources) {
            boolean onLoginDay = source.getLogDate() != null && loginDays.contains(source.getLogDate());
            if (processing.isRestrictToLoginDays() && !onLoginDay) {
                log.debug("Skipping source {} ({}): {} is not a login day",
                        source.getId(), source.getEventType(), source.getLogDate());
                continue;
            }
            selected.add(source);
        }

        int limit = processing.getScanLimit();
        if (limit > 0 && selected.size() > limit) {
            log.info("Limiting scan to {} of {} event sources", limit, selected.size());
            return new ArrayList<>(selected.subList(0, limit));
        }
        return selected;
    }

    /**
     * @return ids of the sources that could not be fetched
     */
    private List<String> processSources(RiskDetectionEngine engine, List<EventSource> sources) {
        List<String> failed = new ArrayList<>();
        if (sources.isEmpty()) {
            return failed;
        }

        int batchSize = Math.max(1, config.getProcessing().getBatchSize());
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(batchSize, sources.size()));
        try {
            for (int start = 0; start < sources.size(); start += batchSize) {
                List<EventSource> batch = sources.subList(start, Math.min(start + batchSize, sources.size()));
                log.debug("Processing batch of {} sources starting at {}", batch.size(), start);

                List<CompletableFuture<Boolean>> futures = batch.stream()
                        .map(source -> CompletableFuture.supplyAsync(() -> processSource(engine, source), executor))
                        .toList();
                for (int i = 0; i < batch.size(); i++) {
                    if (!futures.get(i).join()) {
                        failed.add(batch.get(i).getId());
                    }
                }
            }
        } finally {
            executor.shutdown();
        }
        return failed;
    }

    private boolean processSource(RiskDetectionEngine engine, EventSource source) {
        Span span = tracer.nextSpan()
                .name("source.process." + source.getEventType())
                .tag("source.id", String.valueOf(source.getId()))
                .tag("source.event_type", String.valueOf(source.getEventType()))
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            List<Map<String, String>> rows = source.fetchRows();
            ZoneId zone = config.zone();
            Set<String> usersSeen = new LinkedHashSet<>();
            int warnings = 0;

            for (Map<String, String> row : rows) {
                ActivityEvent event = ActivityEvent.of(source.getEventType(), withLogDate(row, source), zone);
                warnings += engine.process(event).size();
                if (event.getUserId() != null) {
                    usersSeen.add(event.getUserId());
                }
            }
            for (String userId : usersSeen) {
                if (engine.isMonitored(userId)) {
                    engine.recordScannedLog(userId, source.getEventType());
                }
            }

            span.tag("source.rows", String.valueOf(rows.size()));
            span.tag("source.warnings", String.valueOf(warnings));
            log.debug("Processed source {} ({}): {} rows, {} new warnings",
                    source.getId(), source.getEventType(), rows.size(), warnings);
            return true;
        } catch (Exception e) {
            span.error(e);
            metricsConfig.recordSourceFetchFailure(String.valueOf(source.getEventType()));
            log.error("Error processing source {} ({}): {}",
                    source.getId(), source.getEventType(), e.getMessage(), e);
            // A failed source contributes no rows; the rest of the batch continues
            return false;
        } finally {
            span.end();
        }
    }

    // Rows without their own date fall back to the log's date
    private static Map<String, String> withLogDate(Map<String, String> row, EventSource source) {
        if (source.getLogDate() == null || row.containsKey(LOG_DATE_FIELD)) {
            return row;
        }
        Map<String, String> copy = new LinkedHashMap<>(row);
        copy.put(LOG_DATE_FIELD, source.getLogDate().toString());
        return copy;
    }

    private static List<LoginRecord> toLoginRecords(String userId, List<LoginEntry> entries, ZoneId zone) {
        List<LoginRecord> records = new ArrayList<>();
        if (entries == null) {
            return records;
        }
        for (LoginEntry entry : entries) {
            Instant loginTime = Timestamps.parse(entry.getLoginTime(), zone);
            if (loginTime == null) {
                log.debug("Skipping login of user {} with unreadable time: {}", userId, entry.getLoginTime());
                continue;
            }
            records.add(LoginRecord.of(loginTime, entry.getSourceIp(), entry.getLoginGeoId(), zone));
        }
        return records;
    }
}
