package io.coordmesh.policy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.coordmesh.config.CoordMeshConfig;
import io.coordmesh.storage.PolicyRuleStore;
import io.coordmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rule-set authorization with default deny. A matching forbid overrides every permit; among matching permits the
 * lowest priority number wins. Rules are read from the {@code policy_rules} table, or from a rules file in the data
 * root when one exists, and cached for a TTL.
 */
public final class DeclarativePolicyEngine implements PolicyEngine {
    private static final Logger log = LoggerFactory.getLogger(DeclarativePolicyEngine.class);
    private static final Comparator<PolicyRule> BY_PRIORITY =
            Comparator.comparingInt(PolicyRule::priority).thenComparing(PolicyRule::id);

    private final PolicyRuleStore store;
    private final Path rulesFile;
    private final Clock clock;
    private final Object loadLock;
    private volatile long cacheTtlMs;
    private volatile RuleCache cache;

    public DeclarativePolicyEngine(PolicyRuleStore store, Path rulesFile) {
        this(store, rulesFile, Clock.systemUTC());
    }

    public DeclarativePolicyEngine(PolicyRuleStore store, Path rulesFile, Clock clock) {
        this.store = store;
        this.rulesFile = rulesFile;
        this.clock = clock;
        this.loadLock = new Object();
        this.cacheTtlMs = CoordMeshConfig.DEFAULT_POLICY_CACHE_TTL_MS;
    }

    public void applySettings(long cacheTtlMs) {
        this.cacheTtlMs = Math.max(0L, cacheTtlMs);
    }

    @Override
    public String name() {
        return DECLARATIVE;
    }

    @Override
    public void invalidate() {
        cache = null;
    }

    @Override
    public PolicyDecision evaluate(PolicyRequest request) {
        RuleCache rules;
        try {
            rules = rules();
        } catch (RuntimeException e) {
            log.warn("Policy rules unavailable, denying {}: {}", request.action(), e.getMessage());
            return PolicyDecision.deny(DECLARATIVE, "policy_evaluation_error: " + e.getMessage());
        }
        int trust = request.effectiveTrustLevel();
        PolicyRule permit = null;
        for (PolicyRule rule : rules.rules()) {
            if (!rule.matches(request.action(), request.resource(), trust)) {
                continue;
            }
            if (rule.forbid()) {
                return PolicyDecision.deny(DECLARATIVE, "forbid: " + rule.name(), rule.id());
            }
            if (permit == null) {
                permit = rule;
            }
        }
        if (permit != null) {
            return PolicyDecision.allow(DECLARATIVE, "permit: " + permit.name(), permit.id());
        }
        return PolicyDecision.deny(DECLARATIVE, "default_deny");
    }

    public List<PolicyRule> activeRules() {
        return rules().rules();
    }

    public String activeSource() {
        return rules().source();
    }

    private RuleCache rules() {
        long nowMs = clock.millis();
        RuleCache current = cache;
        if (current != null && nowMs < current.expiresAtMs()) {
            return current;
        }
        synchronized (loadLock) {
            current = cache;
            if (current != null && nowMs < current.expiresAtMs()) {
                return current;
            }
            RuleCache loaded = load(nowMs);
            cache = loaded;
            return loaded;
        }
    }

    private RuleCache load(long nowMs) {
        List<PolicyRule> rules = new ArrayList<>();
        String source;
        if (rulesFile != null && Files.isRegularFile(rulesFile)) {
            try {
                RuleFile file = Jsons.mapper().readValue(rulesFile.toFile(), RuleFile.class);
                if (file != null && file.rules() != null) {
                    rules.addAll(file.rules());
                }
            } catch (IOException e) {
                throw new RuntimeException("Failed to read policy rules file: " + rulesFile, e);
            }
            source = rulesFile.toString();
        } else {
            for (PolicyRuleStore.RuleRow row : store.list(true)) {
                rules.add(new PolicyRule(
                        row.ruleId(),
                        row.name(),
                        row.effect(),
                        row.actions(),
                        row.resourcePattern(),
                        row.minTrust(),
                        row.maxTrust(),
                        row.priority(),
                        row.description(),
                        row.enabled()
                ));
            }
            source = "store";
        }
        rules.sort(BY_PRIORITY);
        log.debug("Loaded {} policy rules from {}", rules.size(), source);
        return new RuleCache(List.copyOf(rules), source, nowMs + cacheTtlMs);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record RuleFile(List<PolicyRule> rules) {
    }

    private record RuleCache(List<PolicyRule> rules, String source, long expiresAtMs) {
    }
}
