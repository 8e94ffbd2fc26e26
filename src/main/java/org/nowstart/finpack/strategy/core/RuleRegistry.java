package org.nowstart.finpack.strategy.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import org.nowstart.finpack.data.exception.BacktestException;

/**
 * Rules of one family keyed by their normalized identifier.
 */
public abstract class RuleRegistry<R extends Rule<? extends RuleParams>> {

    private final String family;
    private final List<R> rules;
    private final ObjectMapper objectMapper;
    private Map<String, R> rulesById = Map.of();

    protected RuleRegistry(String family, List<R> rules, ObjectMapper objectMapper) {
        this.family = family;
        this.rules = rules;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        Map<String, R> byId = new HashMap<>();
        for (R rule : rules) {
            String id = normalize(rule.id());
            R previous = byId.put(id, rule);
            if (previous != null) {
                throw new IllegalStateException("Duplicate " + family + " registered for id=" + id);
            }
        }
        rulesById = Map.copyOf(byId);
    }

    public R getRequired(String id) {
        R rule = rulesById.get(normalize(id));
        if (rule == null) {
            throw new BacktestException(BacktestException.UNKNOWN_RULE, "Unknown " + family + ": " + id);
        }
        return rule;
    }

    public List<String> ids() {
        return List.copyOf(new TreeSet<>(rulesById.keySet()));
    }

    /**
     * Overlays {@code overrides} on the rule's defaults. Unknown keys and out-of-range values are rejected.
     */
    protected <P extends RuleParams> P bindParams(Rule<P> rule, Map<String, Object> overrides) {
        if (rule.defaultParams() instanceof NoParams) {
            if (overrides != null && !overrides.isEmpty()) {
                throw new BacktestException(
                        BacktestException.INVALID_RULE_PARAMS,
                        family + "=" + rule.id() + " takes no params, got " + overrides.keySet()
                );
            }
            return rule.defaultParams();
        }
        try {
            ObjectNode merged = objectMapper.valueToTree(rule.defaultParams());
            if (overrides != null && !overrides.isEmpty()) {
                merged.setAll((ObjectNode) objectMapper.valueToTree(canonicalKeys(merged, overrides)));
            }
            return objectMapper.readerFor(rule.parameterType())
                    .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .readValue(merged);
        } catch (IOException | IllegalArgumentException e) {
            throw new BacktestException(
                    BacktestException.INVALID_RULE_PARAMS,
                    "Invalid params for " + family + "=" + rule.id() + ": " + e.getMessage(),
                    e
            );
        }
    }

    /**
     * Maps {@code top-n}, {@code top_n} or {@code topn} onto the {@code topN} property of the defaults.
     * Keys matching no property are kept so that binding rejects them.
     */
    private Map<String, Object> canonicalKeys(ObjectNode defaults, Map<String, Object> overrides) {
        Map<String, String> properties = new HashMap<>();
        for (Iterator<String> names = defaults.fieldNames(); names.hasNext(); ) {
            String name = names.next();
            properties.put(simplify(name), name);
        }
        Map<String, Object> canonical = new LinkedHashMap<>();
        overrides.forEach((key, value) -> canonical.put(properties.getOrDefault(simplify(key), key), value));
        return canonical;
    }

    private static String simplify(String key) {
        return key.replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
    }

    private String normalize(String id) {
        if (id == null || id.isBlank()) {
            throw new BacktestException(BacktestException.INVALID_REQUEST, family + " id is required");
        }
        return id.trim().toLowerCase(Locale.ROOT);
    }
}
