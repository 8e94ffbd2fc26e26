package org.nowstart.finpack.data.dto;

import java.util.List;

public record SellDecision(
        boolean shouldSell,
        String reason
) {
    private static final SellDecision HOLD = new SellDecision(false, "");

    public static SellDecision hold() {
        return HOLD;
    }

    public static SellDecision sell(String reason) {
        return new SellDecision(true, reason);
    }

    public static SellDecision combine(List<SellDecision> decisions) {
        List<String> reasons = decisions.stream()
                .filter(SellDecision::shouldSell)
                .map(SellDecision::reason)
                .toList();
        if (reasons.isEmpty()) {
            return HOLD;
        }
        return new SellDecision(true, String.join("; ", reasons));
    }
}
