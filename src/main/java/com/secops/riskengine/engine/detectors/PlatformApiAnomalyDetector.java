package com.secops.riskengine.engine.detectors;

import com.secops.riskengine.engine.CustomDetector;
import com.secops.riskengine.engine.DetectorTrackingStore;
import com.secops.riskengine.model.ActivityEvent;
import com.secops.riskengine.model.DetectionResult;
import com.secops.riskengine.model.DetectorType;
import com.secops.riskengine.model.RiskRule;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Passes through anomalies the platform itself detected. Always fires.
 */
@Component
public class PlatformApiAnomalyDetector implements CustomDetector {

    @Override
    public DetectorType getSupportedDetectorType() {
        return DetectorType.PLATFORM_API_ANOMALY;
    }

    @Override
    public Optional<DetectionResult> detect(ActivityEvent event, RiskRule rule, DetectorTrackingStore tracking) {
        String score = event.field("SCORE");
        String type = event.field("EVENT_TYPE");
        return Optional.of(DetectionResult.builder()
                .message(String.format("API anomaly: %s score | %s",
                        score != null ? score : "Unknown", type != null ? type : "Unknown type"))
                .severityMultiplier(3.0)
                .build());
    }
}
