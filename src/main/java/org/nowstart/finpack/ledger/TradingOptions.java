package org.nowstart.finpack.ledger;

import org.nowstart.finpack.data.type.Country;

/**
 * Order sizing switches.
 *
 * @param twLotSize           share multiple for TW listings
 * @param fractionalShares    allow fractional share counts for US listings
 * @param allowPartialFill    shrink an unaffordable buy to what the cash covers instead of rejecting it
 * @param defaultExchangeRate USD/TWD rate used when the input has no rate at all
 */
public record TradingOptions(
        int twLotSize,
        boolean fractionalShares,
        boolean allowPartialFill,
        double defaultExchangeRate
) {
    public static final int DEFAULT_TW_LOT_SIZE = 1000;
    public static final double DEFAULT_EXCHANGE_RATE = 32.0;

    private static final double FRACTION_SCALE = 1_000_000.0;

    public TradingOptions {
        if (twLotSize <= 0) {
            throw new IllegalArgumentException("tw-lot-size must be > 0");
        }
        if (!Double.isFinite(defaultExchangeRate) || defaultExchangeRate <= 0.0) {
            throw new IllegalArgumentException("default-exchange-rate must be > 0");
        }
    }

    public static TradingOptions defaults() {
        return new TradingOptions(DEFAULT_TW_LOT_SIZE, false, true, DEFAULT_EXCHANGE_RATE);
    }

    /**
     * Rounds a raw share count down to what the market accepts.
     */
    public double roundShares(double rawShares, Country country) {
        if (!Double.isFinite(rawShares) || rawShares <= 0.0) {
            return 0.0;
        }
        if (country == Country.TW) {
            return Math.floor(rawShares / twLotSize) * twLotSize;
        }
        if (fractionalShares) {
            return Math.floor(rawShares * FRACTION_SCALE) / FRACTION_SCALE;
        }
        return Math.floor(rawShares);
    }
}
