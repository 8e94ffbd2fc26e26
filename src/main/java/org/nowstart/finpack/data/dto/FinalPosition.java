package org.nowstart.finpack.data.dto;

import java.time.LocalDate;
import org.nowstart.finpack.data.type.Country;

public record FinalPosition(
        String ticker,
        double shares,
        double avgCost,
        Country country,
        LocalDate entryDate,
        double lastPrice,
        double exchangeRate,
        double marketValue,
        double unrealizedPct
) {
}
