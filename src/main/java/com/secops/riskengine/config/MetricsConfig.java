package com.secops.riskengine.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger highRiskUserCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.highRiskUserCount = registry.gauge("monitoring.high_risk.users", new AtomicInteger(0));
    }

    public void recordWarning(String eventType, String severity) {
        Counter.builder("warning.emitted.count")
                .tag("event_type", eventType)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordDetectorFailure(String detectorType) {
        Counter.builder("detector.failure.count")
                .tag("detector", detectorType)
                .register(registry)
                .increment();
    }

    public void recordGeoLookupFailure() {
        Counter.builder("geo.lookup.failure.count")
                .register(registry)
                .increment();
    }

    public void recordSourceFetchFailure(String eventType) {
        Counter.builder("source.fetch.failure.count")
                .tag("event_type", eventType)
                .register(registry)
                .increment();
    }

    public void recordAnomaly(String anomalyType) {
        Counter.builder("anomaly.detected.count")
                .tag("anomaly_type", anomalyType)
                .register(registry)
                .increment();
    }

    public void recordRun(int usersMonitored, double maxRiskScore) {
        Counter.builder("monitoring.run.count")
                .register(registry)
                .increment();

        DistributionSummary.builder("monitoring.run.users")
                .register(registry)
                .record(usersMonitored);

        DistributionSummary.builder("monitoring.run.max_risk_score")
                .register(registry)
                .record(maxRiskScore);
    }

    public void updateHighRiskUserCount(int count) {
        highRiskUserCount.set(count);
    }
}
