package org.nowstart.finpack.strategy.sell;

import java.util.List;
import org.nowstart.finpack.data.dto.SellDecision;
import org.nowstart.finpack.ledger.Position;
import org.nowstart.finpack.strategy.core.EvaluationContext;
import org.nowstart.finpack.strategy.core.RuleParams;
import org.nowstart.finpack.strategy.core.SellCondition;
import org.springframework.stereotype.Component;

/**
 * Sells a holding the buy pipeline has not picked on any of the last {@code periods} days.
 * Sell conditions run before today's selection, so the window ends yesterday.
 */
@Component
public class NotSelectedCondition implements SellCondition<NotSelectedCondition.Params> {

    public static final String ID = "not_selected";

    public record Params(int periods) implements RuleParams {
        public Params {
            if (periods <= 0) {
                throw new IllegalArgumentException("periods must be > 0");
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
        return new Params(3);
    }

    @Override
    public SellDecision check(Position position, EvaluationContext context, Params params) {
        List<List<String>> recent = context.selectionHistory().recent(params.periods());
        if (recent.size() < params.periods()) {
            return SellDecision.hold();
        }
        boolean neverSelected = recent.stream().noneMatch(selected -> selected.contains(position.getTicker()));
        if (neverSelected) {
            return SellDecision.sell("not selected for " + params.periods() + " periods");
        }
        return SellDecision.hold();
    }
}
