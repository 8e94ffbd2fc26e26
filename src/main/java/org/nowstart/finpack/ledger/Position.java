package org.nowstart.finpack.ledger;

import java.time.LocalDate;
import lombok.Getter;
import org.nowstart.finpack.data.type.Country;

/**
 * Open holding owned by {@link Portfolio}. Average cost stays in the native currency.
 * The streak counters belong to sell conditions and live as long as the position is open.
 */
@Getter
public class Position {

    private final String ticker;
    private final Country country;
    private final LocalDate entryDate;
    private double shares;
    private double avgCost;
    private double highestPrice;
    private int consecutiveRankFailures;
    private int consecutiveWeakPeriods;

    Position(String ticker, Country country, LocalDate entryDate, double shares, double price) {
        this.ticker = ticker;
        this.country = country;
        this.entryDate = entryDate;
        this.shares = shares;
        this.avgCost = price;
        this.highestPrice = price;
    }

    void add(double addedShares, double nativeAmount) {
        double totalShares = shares + addedShares;
        avgCost = (shares * avgCost + nativeAmount) / totalShares;
        shares = totalShares;
    }

    void reduce(double soldShares) {
        shares -= soldShares;
    }

    public void observePrice(double price) {
        if (Double.isFinite(price) && price > highestPrice) {
            highestPrice = price;
        }
    }

    /**
     * Updates the rank-failure streak with one period's outcome and returns the new length.
     */
    public int recordRankCheck(boolean failed) {
        consecutiveRankFailures = failed ? consecutiveRankFailures + 1 : 0;
        return consecutiveRankFailures;
    }

    /**
     * Updates the relative-weakness streak; only a period where every metric failed extends it.
     */
    public int recordWeaknessCheck(boolean weak) {
        consecutiveWeakPeriods = weak ? consecutiveWeakPeriods + 1 : 0;
        return consecutiveWeakPeriods;
    }

    public double costBasis() {
        return shares * avgCost;
    }
}
