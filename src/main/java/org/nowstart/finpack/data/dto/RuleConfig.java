package org.nowstart.finpack.data.dto;

import java.util.Map;

/**
 * One configured rule: a stable identifier, an on/off switch and raw parameter overrides.
 */
public record RuleConfig(
        String id,
        boolean enabled,
        Map<String, Object> params
) {
    public RuleConfig {
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public static RuleConfig enabled(String id) {
        return new RuleConfig(id, true, Map.of());
    }

    public static RuleConfig enabled(String id, Map<String, Object> params) {
        return new RuleConfig(id, true, params);
    }
}
