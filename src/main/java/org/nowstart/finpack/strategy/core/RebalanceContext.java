package org.nowstart.finpack.strategy.core;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public record RebalanceContext(
        List<String> currentHoldings,
        List<String> targets,
        EvaluationContext evaluation
) {
    public boolean hasNewTarget() {
        Set<String> held = new HashSet<>(currentHoldings);
        return targets.stream().anyMatch(ticker -> !held.contains(ticker));
    }

    public boolean targetsDifferFromHoldings() {
        return !new HashSet<>(currentHoldings).equals(new HashSet<>(targets));
    }
}
