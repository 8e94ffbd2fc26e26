package org.nowstart.finpack.data.dto;

import java.time.LocalDate;
import org.nowstart.finpack.data.type.Country;

public record HoldingSnapshot(
        double shares,
        double avgCost,
        double currentPrice,
        double marketValue,
        double unrealizedPct,
        LocalDate entryDate,
        String industry,
        Country country,
        double exchangeRate
) {
}
