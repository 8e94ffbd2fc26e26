package org.nowstart.finpack.data.type;

public enum RankingMetric {
    SHARPE,
    GROWTH
}
