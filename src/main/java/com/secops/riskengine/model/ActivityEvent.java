package com.secops.riskengine.model;

import com.secops.riskengine.util.Timestamps;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One activity row from an event log, tagged with its event type.
 * Field names vary between log types, so the standard accessors read the first
 * populated field from a list of known aliases.
 */
public final class ActivityEvent {

    public static final String UNKNOWN = "unknown";

    private static final List<String> USER_ID_FIELDS = List.of("USER_ID_DERIVED");
    private static final List<String> USERNAME_FIELDS = List.of("USERNAME", "USER_NAME");
    private static final List<String> TIMESTAMP_FIELDS =
            List.of("TIMESTAMP_DERIVED", "EVENT_TIME", "TIMESTAMP", "LOGIN_TIME", "CREATED_DATE");
    private static final List<String> DATE_FIELDS = List.of("EVENT_DATE", "LOG_DATE");
    private static final List<String> SESSION_FIELDS =
            List.of("SESSION_KEY", "SESSION_ID", "SESSIONKEY", "SESSION_IDENTIFIER");
    private static final List<String> CLIENT_IP_FIELDS = List.of("CLIENT_IP", "SOURCE_IP", "IP_ADDRESS", "SOURCEIP");

    // Count fields known to appear under different names in different log types
    private static final List<List<String>> COUNT_FIELD_ALIASES = List.of(
            List.of("URL", "ENDPOINT_URL", "URI"),
            List.of("COMPONENT_TYPE", "COMPONENT_NAME", "COMPONENT"),
            List.of("LINKED_ENTITY_ID", "RELATED_RECORD_ID", "ENTITY_ID"),
            List.of("DOCUMENT_ID", "CONTENT_ID", "CONTENT_DOCUMENT_ID"),
            List.of("DASHBOARD_ID", "DASHBOARD_NAME"),
            List.of("ACTION", "METHOD", "OPERATION_TYPE", "OPERATION"));

    // Copied onto warnings, in this order, when present
    private static final List<String> CONTEXT_FIELDS = List.of(
            "RECORDS_PROCESSED", "URI", "ACTION", "ENTITY_NAME", "DELEGATED_USERNAME", "DASHBOARD_ID",
            "QUERY_STRING", "PAGE_NAME", "COMPONENT_NAME", "ENDPOINT_URL", "FLOW_NAME",
            "APEX_CLASS_NAME", "FILE_TYPE", "RELATED_RECORD_ID", "QUIDDITY");

    private final String eventType;
    private final Map<String, String> fields;
    private final ZoneId zone;
    private final Instant timestamp;
    private final LocalDate date;

    private ActivityEvent(String eventType, Map<String, String> fields, ZoneId zone) {
        this.eventType = eventType;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.zone = zone;
        this.timestamp = Timestamps.parse(first(TIMESTAMP_FIELDS), zone);
        this.date = timestamp != null
                ? timestamp.atZone(zone).toLocalDate()
                : Timestamps.parseDate(first(DATE_FIELDS));
    }

    public static ActivityEvent of(String eventType, Map<String, String> fields, ZoneId zone) {
        return new ActivityEvent(eventType, fields == null ? Map.of() : fields, zone);
    }

    public String getEventType() {
        return eventType;
    }

    public Map<String, String> getFields() {
        return fields;
    }

    /** Value of a field, or null when absent or blank. */
    public String field(String name) {
        String value = fields.get(name);
        return StringUtils.hasText(value) ? value : null;
    }

    public String getUserId() {
        return first(USER_ID_FIELDS);
    }

    public String getUsername() {
        return first(USERNAME_FIELDS);
    }

    /** Parsed event time, or null when the row carries no parseable timestamp. */
    public Instant getTimestamp() {
        return timestamp;
    }

    /** Event date derived from the timestamp, falling back to the row's date fields. */
    public LocalDate getDate() {
        return date;
    }

    /** Hour of day in the configured zone, or -1 without a timestamp. */
    public int getHourOfDay() {
        return timestamp == null ? -1 : timestamp.atZone(zone).getHour();
    }

    public String getSessionKey() {
        String session = first(SESSION_FIELDS);
        return session != null ? session : "unknown-session";
    }

    public String getClientIp() {
        return first(CLIENT_IP_FIELDS);
    }

    /**
     * Value of a rule's count field. Known alias groups are tried first, then the
     * field itself. Missing values read as {@value #UNKNOWN}.
     */
    public String fieldValue(String countField) {
        for (List<String> aliases : COUNT_FIELD_ALIASES) {
            if (aliases.contains(countField)) {
                String value = first(aliases);
                if (value != null) {
                    return value;
                }
            }
        }
        String direct = field(countField);
        return direct != null ? direct : UNKNOWN;
    }

    public Map<String, String> contextFields() {
        Map<String, String> context = new LinkedHashMap<>();
        for (String name : CONTEXT_FIELDS) {
            String value = field(name);
            if (value != null) {
                context.put(name, value);
            }
        }
        return context;
    }

    private String first(List<String> names) {
        for (String name : names) {
            String value = field(name);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "ActivityEvent{" + eventType + ", user=" + getUserId() + ", time=" + timestamp + "}";
    }
}
