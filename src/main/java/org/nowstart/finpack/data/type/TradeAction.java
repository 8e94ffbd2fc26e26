package org.nowstart.finpack.data.type;

public enum TradeAction {
    BUY,
    SELL
}
