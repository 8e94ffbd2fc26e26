package org.nowstart.finpack.strategy.core;

public record RuleDescription(
        String kind,
        String id,
        String category,
        RuleParams params
) {
}
