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
 * Flags bulk API jobs that processed more records than {@code risk.detectors.bulk-record-limit}.
 */
@Component
public class BulkApiVolumeDetector implements CustomDetector {

    private final RiskDetectionConfig config;

    public BulkApiVolumeDetector(RiskDetectionConfig config) {
        this.config = config;
    }

    @Override
    public DetectorType getSupportedDetectorType() {
        return DetectorType.BULK_API_VOLUME;
    }

    @Override
    public Optional<DetectionResult> detect(ActivityEvent event, RiskRule rule, DetectorTrackingStore tracking) {
        String processed = event.field("RECORDS_PROCESSED");
        if (processed == null) {
            return Optional.empty();
        }
        long records;
        try {
            records = Long.parseLong(processed.trim());
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        if (records <= config.getDetectors().getBulkRecordLimit()) {
            return Optional.empty();
        }
        return Optional.of(DetectionResult.builder()
                .message("Large bulk operation with " + records + " records")
                .severityMultiplier(2.0)
                .build());
    }
}
