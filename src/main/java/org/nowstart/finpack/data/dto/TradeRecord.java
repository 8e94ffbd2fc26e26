package org.nowstart.finpack.data.dto;

import java.time.LocalDate;
import lombok.Builder;
import org.nowstart.finpack.data.type.Country;
import org.nowstart.finpack.data.type.TradeAction;

/**
 * Immutable trade-log entry. Prices and {@code amount} are in the instrument's native
 * currency, {@code ledgerAmount} and {@code fee} in the ledger currency. Profit fields
 * are only set for sells.
 */
@Builder
public record TradeRecord(
        TradeAction action,
        String ticker,
        LocalDate date,
        Country country,
        double shares,
        double price,
        double amount,
        double ledgerAmount,
        double exchangeRate,
        double fee,
        double cashFlow,
        Double profit,
        Double profitLedger,
        Double profitPct,
        LocalDate entryDate,
        Integer holdingDays,
        String reason
) {
}
