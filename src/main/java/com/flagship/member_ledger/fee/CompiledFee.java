package com.flagship.member_ledger.fee;

import com.flagship.member_ledger.fee.condition.FeeCondition;
import com.flagship.member_ledger.fee.condition.FeeConditionParser;
import com.flagship.member_ledger.fee.condition.FeeContext;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A fee definition together with its parsed condition.
 */
@Value
public class CompiledFee {
    FeeDefinition definition;
    FeeCondition condition;

    /**
     * Compiles a stored definition. Stored conditions were validated on save, so a
     * parse failure here means the stored data was edited behind our back.
     */
    public static CompiledFee compile(FeeDefinition definition) {
        return new CompiledFee(definition, FeeConditionParser.parse(definition.getCondition()));
    }

    public boolean appliesTo(FeeContext context) {
        return condition.evaluate(context);
    }

    public Long getId() {
        return definition.getId();
    }

    public FeeKind getKind() {
        return definition.getKind();
    }

    public BigDecimal getAmount() {
        return definition.getAmount();
    }
}
