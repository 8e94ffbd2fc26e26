package org.nowstart.finpack.ledger;

/**
 * Commission for one market: {@code max(amount * rate, minFee)}, both in the ledger currency.
 */
public record FeeRule(
        double rate,
        double minFee
) {
    public FeeRule {
        if (!Double.isFinite(rate) || rate < 0.0 || rate > 1.0) {
            throw new IllegalArgumentException("fee rate must be in [0, 1]");
        }
        if (!Double.isFinite(minFee) || minFee < 0.0) {
            throw new IllegalArgumentException("fee min-fee must be >= 0");
        }
    }

    public double fee(double amount) {
        return Math.max(amount * rate, minFee);
    }
}
