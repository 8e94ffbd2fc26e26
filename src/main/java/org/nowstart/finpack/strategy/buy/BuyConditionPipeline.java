package org.nowstart.finpack.strategy.buy;

import java.util.List;
import org.nowstart.finpack.data.type.ConditionCategory;
import org.nowstart.finpack.strategy.core.EvaluationContext;

/**
 * Enabled buy conditions in configuration order.
 *
 * <p>A conditions narrow the universe one after another, then B conditions narrow what is left.
 * Only the last C condition runs: selectors pick and order the final list, so stacking them has
 * no meaning and earlier ones are ignored.
 */
public final class BuyConditionPipeline {

    private final List<ConfiguredBuyCondition<?>> conditions;

    public BuyConditionPipeline(List<ConfiguredBuyCondition<?>> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    public List<ConfiguredBuyCondition<?>> conditions() {
        return conditions;
    }

    public boolean hasCategory(ConditionCategory category) {
        return conditions.stream().anyMatch(condition -> condition.category() == category);
    }

    public List<String> apply(List<String> universe, EvaluationContext context) {
        List<String> result = List.copyOf(universe);
        for (ConfiguredBuyCondition<?> condition : byCategory(ConditionCategory.A)) {
            result = condition.filter(result, context);
        }
        for (ConfiguredBuyCondition<?> condition : byCategory(ConditionCategory.B)) {
            result = condition.filter(result, context);
        }
        List<ConfiguredBuyCondition<?>> selectors = byCategory(ConditionCategory.C);
        if (!selectors.isEmpty()) {
            result = selectors.get(selectors.size() - 1).filter(result, context);
        }
        return List.copyOf(result);
    }

    private List<ConfiguredBuyCondition<?>> byCategory(ConditionCategory category) {
        return conditions.stream().filter(condition -> condition.category() == category).toList();
    }
}
