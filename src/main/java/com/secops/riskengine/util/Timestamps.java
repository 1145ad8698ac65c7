package com.secops.riskengine.util;

import org.springframework.util.StringUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Lenient parsing for the timestamp shapes found in platform event logs.
 */
public class Timestamps {

    // Event log files carry e.g. 20240115093012.345
    private static final DateTimeFormatter PLATFORM_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss.SSS");

    private static final List<BiFunction<String, ZoneId, Instant>> PARSERS = List.of(
            (value, zone) -> Instant.parse(value),
            (value, zone) -> OffsetDateTime.parse(value).toInstant(),
            (value, zone) -> LocalDateTime.parse(value).atZone(zone).toInstant(),
            (value, zone) -> LocalDateTime.parse(value, PLATFORM_FORMAT).atZone(zone).toInstant());

    private Timestamps() {
    }

    /**
     * Parse an ISO instant, ISO offset date-time, ISO local date-time (in {@code zone})
     * or the platform's compact format. Returns null when the text matches none of them.
     */
    public static Instant parse(String text, ZoneId zone) {
        if (!StringUtils.hasText(text)) {
            return null;
        }
        String value = text.trim();
        for (BiFunction<String, ZoneId, Instant> parser : PARSERS) {
            try {
                return parser.apply(value, zone);
            } catch (DateTimeParseException e) {
                // not this shape
                continue;
            }
        }
        return null;
    }

    /**
     * Parse a calendar date from the leading {@code yyyy-MM-dd} of {@code text}, or null.
     */
    public static LocalDate parseDate(String text) {
        if (!StringUtils.hasText(text)) {
            return null;
        }
        String value = text.trim();
        if (value.length() > 10) {
            value = value.substring(0, 10);
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
