package org.nowstart.finpack.data.dto;

import java.time.LocalDate;
import java.util.Map;

/**
 * End-of-day portfolio state. {@code holdings} is a value copy so a day can be inspected
 * without replaying the trade log.
 */
public record EquitySnapshot(
        LocalDate date,
        double cash,
        double holdingsValue,
        double equity,
        Map<String, HoldingSnapshot> holdings,
        int positionCount
) {
    public EquitySnapshot {
        holdings = holdings == null ? Map.of() : Map.copyOf(holdings);
    }
}
