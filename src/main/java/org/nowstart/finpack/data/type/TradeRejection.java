package org.nowstart.finpack.data.type;

public enum TradeRejection {
    INSUFFICIENT_CASH("insufficient_cash"),
    INSUFFICIENT_SHARES("insufficient_shares"),
    MAX_POSITIONS_REACHED("max_positions_reached"),
    AMOUNT_TOO_SMALL("amount_too_small"),
    NO_POSITION("no_position");

    private final String code;

    TradeRejection(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
