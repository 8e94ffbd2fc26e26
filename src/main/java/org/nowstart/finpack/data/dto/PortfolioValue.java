package org.nowstart.finpack.data.dto;

public record PortfolioValue(
        double cash,
        double positionValue,
        double totalValue
) {
}
