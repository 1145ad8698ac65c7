package com.secops.riskengine.service;

/**
 * A monitoring run cannot start: no active rules, or no users to monitor.
 */
public class MonitoringPreconditionException extends RuntimeException {

    public MonitoringPreconditionException(String message) {
        super(message);
    }
}
