package com.flagship.member_ledger.fee;

import com.flagship.member_ledger.fee.condition.FeeContext;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pure fee aggregation.
 *
 * The owed total is the sum of the amounts of all fees whose condition holds, clamped
 * at zero and rounded half-up to cents. Nothing here touches the database.
 */
public final class FeeCalculator {

    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);

    private FeeCalculator() {
    }

    /**
     * Amount of every applicable fee, keyed by fee id.
     */
    public static Map<Long, BigDecimal> computeFees(FeeContext context, Collection<CompiledFee> fees) {
        Map<Long, BigDecimal> applied = new LinkedHashMap<>();
        for (CompiledFee fee : fees) {
            if (fee.appliesTo(context)) {
                applied.put(fee.getId(), fee.getAmount());
            }
        }
        return applied;
    }

    public static BigDecimal totalOwed(FeeContext context, Collection<CompiledFee> fees) {
        return calculate(context, fees).getAmount();
    }

    public static RegistrationFee calculate(FeeContext context, Collection<CompiledFee> fees) {
        Map<Long, BigDecimal> applied = new LinkedHashMap<>();
        Map<FeeKind, BigDecimal> byKind = new EnumMap<>(FeeKind.class);
        BigDecimal sum = ZERO;

        for (CompiledFee fee : fees) {
            if (!fee.appliesTo(context)) {
                continue;
            }
            applied.put(fee.getId(), fee.getAmount());
            byKind.merge(fee.getKind(), fee.getAmount(), BigDecimal::add);
            sum = sum.add(fee.getAmount());
        }

        return new RegistrationFee(
                clamp(sum),
                Collections.unmodifiableMap(applied),
                Collections.unmodifiableMap(byKind));
    }

    /**
     * Evaluates the fees for both membership states of the registrant.
     */
    public static RegistrationFeeData calculateBoth(FeeContext context, Collection<CompiledFee> fees) {
        return new RegistrationFeeData(
                calculate(context.withMember(true), fees),
                calculate(context.withMember(false), fees),
                context.isMember());
    }

    private static BigDecimal clamp(BigDecimal sum) {
        BigDecimal rounded = sum.setScale(2, RoundingMode.HALF_UP);
        return rounded.signum() < 0 ? ZERO : rounded;
    }
}
