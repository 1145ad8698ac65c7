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
 * Flags every document download.
 */
@Component
public class DocumentDownloadDetector implements CustomDetector {

    @Override
    public DetectorType getSupportedDetectorType() {
        return DetectorType.DOCUMENT_DOWNLOAD;
    }

    @Override
    public Optional<DetectionResult> detect(ActivityEvent event, RiskRule rule, DetectorTrackingStore tracking) {
        if (event.getUserId() == null || event.getTimestamp() == null) {
            return Optional.empty();
        }

        String documentId = event.field("DOCUMENT_ID");
        return Optional.of(DetectionResult.builder()
                .message(String.format("Document download detected for user %s during hour %d: %s",
                        event.getUserId(), event.getHourOfDay(),
                        documentId != null ? documentId : "Unknown document"))
                .severityMultiplier(2.0)
                .build());
    }
}
