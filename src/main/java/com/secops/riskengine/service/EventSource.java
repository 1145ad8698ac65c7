package com.secops.riskengine.service;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * One event log: rows of a single event type, usually for a single day.
 * Rows are returned in log order.
 */
public interface EventSource {

    String getId();

    String getEventType();

    /** Day the log covers, or null when unknown. */
    LocalDate getLogDate();

    List<Map<String, String>> fetchRows() throws IOException;
}
