package com.secops.riskengine.service;

import com.secops.riskengine.engine.RuleCatalog;
import com.secops.riskengine.engine.RuleCatalogLoader;
import com.secops.riskengine.model.RiskRule;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Holds the rule catalog loaded at startup. The catalog is read-only afterwards.
 */
@Service
public class RuleService {

    private static final Logger log = LoggerFactory.getLogger(RuleService.class);

    private final RuleCatalogLoader catalogLoader;
    private volatile RuleCatalog catalog;

    public RuleService(RuleCatalogLoader catalogLoader) {
        this.catalogLoader = catalogLoader;
    }

    @PostConstruct
    public void init() {
        catalog = catalogLoader.load();
        log.info("Rule catalog ready: {} rules, {} enabled", catalog.size(),
                catalog.all().stream().filter(RiskRule::isEnabled).count());
    }

    public RuleCatalog getCatalog() {
        return catalog;
    }

    public List<RiskRule> getAllRules() {
        return catalog.all();
    }

    public RiskRule getRule(String eventType) {
        return catalog.find(eventType).orElse(null);
    }
}
