package org.nowstart.finpack.data.type;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Locale;

/**
 * Listing country of an instrument. The ledger is kept in TWD, so only US listings
 * need a currency conversion.
 */
public enum Country {
    US(true),
    TW(false);

    private final boolean foreignCurrency;

    Country(boolean foreignCurrency) {
        this.foreignCurrency = foreignCurrency;
    }

    public boolean foreignCurrency() {
        return foreignCurrency;
    }

    public double toLedger(double nativeAmount, double exchangeRate) {
        return foreignCurrency ? nativeAmount * exchangeRate : nativeAmount;
    }

    public double effectiveRate(double exchangeRate) {
        return foreignCurrency ? exchangeRate : 1.0;
    }

    @JsonCreator
    public static Country from(String raw) {
        if (raw == null || raw.isBlank()) {
            return US;
        }
        return Country.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
