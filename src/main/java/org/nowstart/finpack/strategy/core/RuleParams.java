package org.nowstart.finpack.strategy.core;

/**
 * Marker for the typed parameter record owned by a buy, sell or rebalance rule.
 */
public interface RuleParams {
}
