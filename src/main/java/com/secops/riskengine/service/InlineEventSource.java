package com.secops.riskengine.service;

import com.secops.riskengine.model.EventLog;
import com.secops.riskengine.util.Timestamps;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Event source whose rows were supplied with the monitoring request.
 */
public class InlineEventSource implements EventSource {

    private final EventLog eventLog;

    public InlineEventSource(EventLog eventLog) {
        this.eventLog = eventLog;
    }

    @Override
    public String getId() {
        return eventLog.getId();
    }

    @Override
    public String getEventType() {
        return eventLog.getEventType();
    }

    @Override
    public LocalDate getLogDate() {
        return Timestamps.parseDate(eventLog.getLogDate());
    }

    @Override
    public List<Map<String, String>> fetchRows() {
        return eventLog.getRows() != null ? eventLog.getRows() : List.of();
    }
}
