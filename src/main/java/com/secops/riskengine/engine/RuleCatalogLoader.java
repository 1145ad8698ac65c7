package com.secops.riskengine.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.secops.riskengine.config.RiskDetectionConfig;
import com.secops.riskengine.model.RiskRule;
import com.secops.riskengine.seeder.DefaultRiskRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the startup rule catalog: the built-in rules, merged with the optional
 * override file. Overrides are keyed by event type and replace individual fields.
 *
 * <pre>
 * { "ReportExport": { "threshold": 3, "severity": "high" } }
 * </pre>
 *
 * Custom detectors are code and cannot be overridden; unknown event types are ignored.
 */
@Component
public class RuleCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleCatalogLoader.class);

    private static final List<String> PROTECTED_FIELDS = List.of("customDetector", "customDetection", "eventType");

    private final ObjectMapper objectMapper;
    private final RiskDetectionConfig config;

    public RuleCatalogLoader(ObjectMapper objectMapper, RiskDetectionConfig config) {
        this.objectMapper = objectMapper;
        this.config = config;
    }

    public RuleCatalog load() {
        RuleCatalog defaults = new RuleCatalog(DefaultRiskRules.create());
        String overrideFile = config.getRules().getOverrideFile();
        if (!StringUtils.hasText(overrideFile)) {
            log.info("Loaded {} default risk rules (no override file configured)", defaults.size());
            return defaults;
        }
        return mergeFile(defaults, Path.of(overrideFile));
    }

    public RuleCatalog mergeFile(RuleCatalog base, Path overrideFile) {
        if (!Files.exists(overrideFile)) {
            log.info("Rule override file not found: {}. Using {} default rules.", overrideFile, base.size());
            return base;
        }
        try {
            JsonNode overrides = objectMapper.readTree(overrideFile.toFile());
            return merge(base, overrides);
        } catch (IOException e) {
            log.error("Error loading rule overrides from {}: {}. Keeping default rules.",
                    overrideFile, e.getMessage(), e);
            return base;
        }
    }

    public RuleCatalog merge(RuleCatalog base, JsonNode overrides) {
        if (overrides == null || !overrides.isObject()) {
            log.warn("Rule overrides must be a JSON object keyed by event type; ignoring");
            return base;
        }

        Map<String, RiskRule> merged = new LinkedHashMap<>();
        base.all().forEach(rule -> merged.put(rule.getEventType(), rule));

        Iterator<Map.Entry<String, JsonNode>> entries = overrides.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String eventType = entry.getKey();
            RiskRule existing = merged.get(eventType);
            if (existing == null) {
                log.warn("Ignoring override for unknown event type: {}", eventType);
                continue;
            }
            if (!entry.getValue().isObject()) {
                log.warn("Ignoring override for {}: expected an object", eventType);
                continue;
            }

            ObjectNode patch = entry.getValue().deepCopy();
            for (String field : PROTECTED_FIELDS) {
                if (patch.remove(field) != null) {
                    log.warn("Field '{}' of rule {} cannot be overridden; ignoring it", field, eventType);
                }
            }

            ObjectNode target = objectMapper.valueToTree(existing);
            target.setAll(patch);
            try {
                merged.put(eventType, objectMapper.treeToValue(target, RiskRule.class));
                log.info("Custom rule config loaded for {}", eventType);
            } catch (JsonProcessingException e) {
                log.warn("Invalid override for {}: {}. Keeping existing rule.", eventType, e.getOriginalMessage());
            }
        }

        return new RuleCatalog(merged.values());
    }
}
