package com.secops.riskengine.engine;

import com.secops.riskengine.model.ActivityEvent;
import com.secops.riskengine.model.DetectionResult;
import com.secops.riskengine.model.DetectorType;
import com.secops.riskengine.model.RiskRule;

import java.util.Optional;

/**
 * Strategy interface for custom detection logic attached to a rule.
 * Each implementation handles exactly one DetectorType. Implementations hold no
 * state of their own; anything they need to remember goes in the tracking store.
 */
public interface CustomDetector {

    /**
     * @return the detector type this implementation handles
     */
    DetectorType getSupportedDetectorType();

    /**
     * Inspect one event.
     *
     * @param event    the activity row being evaluated
     * @param rule     the rule the detector is attached to
     * @param tracking per-engine state for rate-style detectors
     * @return a result if the detector fires for this event
     */
    Optional<DetectionResult> detect(ActivityEvent event, RiskRule rule, DetectorTrackingStore tracking);
}
