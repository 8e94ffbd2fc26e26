package org.nowstart.finpack.data.dto;

import java.util.List;

public record RebalanceResult(
        List<TradeResult> sells,
        List<TradeResult> buys
) {
    public static RebalanceResult empty() {
        return new RebalanceResult(List.of(), List.of());
    }
}
