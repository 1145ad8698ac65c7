package com.secops.riskengine.engine;

import com.secops.riskengine.model.RiskRule;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable registry of at most one rule per event type.
 */
public final class RuleCatalog {

    private final Map<String, RiskRule> rules;

    public RuleCatalog(Collection<RiskRule> rules) {
        Map<String, RiskRule> byType = new LinkedHashMap<>();
        for (RiskRule rule : rules) {
            if (byType.putIfAbsent(rule.getEventType(), rule) != null) {
                throw new IllegalArgumentException("Duplicate rule for event type: " + rule.getEventType());
            }
        }
        this.rules = Collections.unmodifiableMap(byType);
    }

    public Optional<RiskRule> find(String eventType) {
        return Optional.ofNullable(eventType).map(rules::get);
    }

    /** The rule for {@code eventType} if it exists and is enabled. */
    public Optional<RiskRule> findActive(String eventType) {
        return find(eventType).filter(RiskRule::isEnabled);
    }

    public List<RiskRule> all() {
        return new ArrayList<>(rules.values());
    }

    public boolean contains(String eventType) {
        return rules.containsKey(eventType);
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }
}
