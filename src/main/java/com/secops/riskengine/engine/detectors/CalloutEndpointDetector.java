package com.secops.riskengine.engine.detectors;

import com.secops.riskengine.config.RiskDetectionConfig;
import com.secops.riskengine.engine.CustomDetector;
import com.secops.riskengine.engine.DetectorTrackingStore;
import com.secops.riskengine.model.ActivityEvent;
import com.secops.riskengine.model.DetectionResult;
import com.secops.riskengine.model.DetectorType;
import com.secops.riskengine.model.RiskRule;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Flags outbound callouts to endpoints outside the approved domains
 * ({@code risk.detectors.allowed-callout-domains}).
 */
@Component
public class CalloutEndpointDetector implements CustomDetector {

    private final RiskDetectionConfig config;

    public CalloutEndpointDetector(RiskDetectionConfig config) {
        this.config = config;
    }

    @Override
    public DetectorType getSupportedDetectorType() {
        return DetectorType.CALLOUT_ENDPOINT;
    }

    @Override
    public Optional<DetectionResult> detect(ActivityEvent event, RiskRule rule, DetectorTrackingStore tracking) {
        String endpoint = event.field("ENDPOINT_URL");
        if (endpoint == null) {
            return Optional.empty();
        }
        boolean allowed = config.getDetectors().getAllowedCalloutDomains().stream()
                .anyMatch(endpoint::contains);
        if (allowed) {
            return Optional.empty();
        }
        return Optional.of(DetectionResult.builder()
                .message("Callout to non-approved endpoint: " + endpoint)
                .severityMultiplier(2.0)
                .build());
    }
}
