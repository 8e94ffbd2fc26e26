package org.nowstart.finpack.strategy.sell;

import java.util.Locale;
import org.nowstart.finpack.data.dto.SellDecision;
import org.nowstart.finpack.ledger.Position;
import org.nowstart.finpack.strategy.core.EvaluationContext;
import org.nowstart.finpack.strategy.core.RuleParams;
import org.nowstart.finpack.strategy.core.SellCondition;
import org.springframework.stereotype.Component;

/**
 * Stop loss on the decline from the average cost, or from the highest price seen since entry
 * when {@code fromHighest} is set. {@code threshold} is a fraction (0.40 = 40%).
 */
@Component
public class DrawdownCondition implements SellCondition<DrawdownCondition.Params> {

    public static final String ID = "drawdown";

    public record Params(double threshold, boolean fromHighest) implements RuleParams {
        public Params {
            if (!(threshold > 0.0) || threshold > 1.0) {
                throw new IllegalArgumentException("threshold must be in (0, 1]");
            }
        }
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Class<Params> parameterType() {
        return Params.class;
    }

    @Override
    public Params defaultParams() {
        return new Params(0.40, false);
    }

    @Override
    public SellDecision check(Position position, EvaluationContext context, Params params) {
        Double price = context.price(position.getTicker());
        if (price == null || !(position.getAvgCost() > 0.0)) {
            return SellDecision.hold();
        }

        double reference = params.fromHighest()
                ? Math.max(position.getAvgCost(), position.getHighestPrice())
                : position.getAvgCost();
        double drawdown = (reference - price) / reference;
        if (drawdown >= params.threshold()) {
            return SellDecision.sell(String.format(Locale.US, "drawdown %.1f%% reached stop %.1f%%",
                    drawdown * 100.0, params.threshold() * 100.0));
        }
        return SellDecision.hold();
    }
}
