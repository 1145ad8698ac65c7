package com.secops.riskengine.engine.detectors;

import com.secops.riskengine.engine.DetectorTrackingStore;
import com.secops.riskengine.model.DetectionResult;
import com.secops.riskengine.model.RiskRule;
import com.secops.riskengine.model.Severity;
import com.secops.riskengine.model.TimeWindow;
import com.secops.riskengine.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class DashboardRateDetectorTest {

    private final DetectorTrackingStore tracking = new DetectorTrackingStore();
    private final DashboardRateDetector detector = new DashboardRateDetector();
    private final RiskRule rule = TestDataFactory.createRule("Dashboard", 3, Severity.MEDIUM, TimeWindow.HOUR, null);

    private Optional<DetectionResult> view(String timestamp, String dashboardId) {
        return detector.detect(TestDataFactory.event("Dashboard", "U1", timestamp, "DASHBOARD_ID", dashboardId),
                rule, tracking);
    }

    @Test
    void detect_fastAccess_reportsUniqueDashboards() {
        view("2024-01-15T09:00:00Z", "D1");
        view("2024-01-15T09:00:02Z", "D2");
        Optional<DetectionResult> result = view("2024-01-15T09:00:06Z", "D1");

        assertThat(result).isPresent();
        assertThat(result.get().getMessage()).isEqualTo(
                "High Dashboard access rate detected for user U1 during hour 9: 3 requests in 6 seconds "
                        + "(0.5 requests/sec) across 2 unique dashboards");
    }

    @Test
    void detect_spanUnderFiveSeconds_notYet() {
        view("2024-01-15T09:00:00Z", "D1");
        view("2024-01-15T09:00:01Z", "D2");

        assertThat(view("2024-01-15T09:00:03Z", "D3")).isEmpty();
    }

    @Test
    void detect_slowAccess_belowTwentyPerMinute_silent() {
        view("2024-01-15T09:00:00Z", "D1");
        view("2024-01-15T09:00:25Z", "D2");

        assertThat(view("2024-01-15T09:00:50Z", "D3")).isEmpty();
    }
}
