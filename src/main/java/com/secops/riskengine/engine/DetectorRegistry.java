package com.secops.riskengine.engine;

import com.secops.riskengine.model.DetectorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class DetectorRegistry {

    private static final Logger log = LoggerFactory.getLogger(DetectorRegistry.class);

    private final Map<DetectorType, CustomDetector> detectorMap = new EnumMap<>(DetectorType.class);

    public DetectorRegistry(List<CustomDetector> detectors) {
        // Auto-register all detector implementations
        for (CustomDetector detector : detectors) {
            detectorMap.put(detector.getSupportedDetectorType(), detector);
            log.info("Registered custom detector: {} -> {}",
                    detector.getSupportedDetectorType(), detector.getClass().getSimpleName());
        }
    }

    public Optional<CustomDetector> find(DetectorType type) {
        return Optional.ofNullable(type).map(detectorMap::get);
    }

    public int size() {
        return detectorMap.size();
    }
}
