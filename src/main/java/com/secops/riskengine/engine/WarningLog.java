package com.secops.riskengine.engine;

import com.secops.riskengine.model.Warning;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Run-wide list of warnings, deduplicated by user, date and message.
 */
public class WarningLog {

    private final Map<String, Warning> warnings = new LinkedHashMap<>();

    /**
     * @return true if the warning was new and stored, false if an equal one was already logged
     */
    public boolean record(Warning warning) {
        return warnings.putIfAbsent(dedupKey(warning), warning) == null;
    }

    public List<Warning> all() {
        return new ArrayList<>(warnings.values());
    }

    public int size() {
        return warnings.size();
    }

    private static String dedupKey(Warning warning) {
        return Objects.toString(warning.getUserId()) + '|' + warning.getDate() + '|' + warning.getMessage();
    }
}
