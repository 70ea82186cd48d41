package com.flagship.member_ledger.fee;

import com.flagship.member_ledger.fee.condition.FeeContext;
import com.flagship.member_ledger.observability.FinanceMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Applies an event's fee definitions to its registrations.
 *
 * Keeps {@code amount_owed} of every registration equal to the clamped sum of the fees
 * whose condition holds for it. Recalculation runs inside the caller's transaction, so a
 * fee change and the recomputed totals commit together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeeAggregationService {

    private final FeeDefinitionRepository feeRepository;
    private final EventDataRepository eventDataRepository;
    private final FinanceMetrics financeMetrics;

    @Transactional(readOnly = true)
    public List<CompiledFee> loadCompiledFees(Long eventId) {
        return feeRepository.findByEventIdOrderByIdAsc(eventId).stream()
            .map(FeeDefinitionEntity::toDomain)
            .map(CompiledFee::compile)
            .toList();
    }

    /**
     * Recomputes and stores {@code amount_owed} for every registration of the event.
     *
     * @return number of registrations whose stored amount changed
     */
    @Transactional
    public int recalculateEvent(Long eventId) {
        long startTime = System.currentTimeMillis();
        EventSnapshot event = requireEvent(eventId);
        List<CompiledFee> fees = loadCompiledFees(eventId);

        int changed = 0;
        for (RegistrationSnapshot registration : eventDataRepository.findRegistrations(eventId)) {
            BigDecimal owed = FeeCalculator.totalOwed(registration.toFeeContext(event), fees);
            if (owed.compareTo(registration.getAmountOwed()) != 0) {
                eventDataRepository.updateAmountOwed(registration.getId(), owed);
                changed++;
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        financeMetrics.recordFeeRecalculation(changed, duration);
        log.info("Recalculated fees: eventId={}, fees={}, changedRegistrations={}, duration={}ms",
                eventId, fees.size(), changed, duration);
        return changed;
    }

    /**
     * Recomputes {@code amount_owed} of a single registration, e.g. after its parts or
     * fields changed.
     */
    @Transactional
    public RegistrationFeeData recalculateRegistration(Long registrationId) {
        RegistrationSnapshot registration = requireRegistration(registrationId);
        EventSnapshot event = requireEvent(registration.getEventId());
        RegistrationFeeData data = FeeCalculator.calculateBoth(
            registration.toFeeContext(event), loadCompiledFees(event.getId()));
        eventDataRepository.updateAmountOwed(registrationId, data.getAmount());
        return data;
    }

    @Transactional(readOnly = true)
    public RegistrationFeeData calculateRegistrationFee(Long registrationId) {
        RegistrationSnapshot registration = requireRegistration(registrationId);
        EventSnapshot event = requireEvent(registration.getEventId());
        return FeeCalculator.calculateBoth(registration.toFeeContext(event), loadCompiledFees(event.getId()));
    }

    /**
     * Dry run against hypothetical registration data. Nothing is stored.
     */
    @Transactional(readOnly = true)
    public RegistrationFeeData precomputeFee(Long eventId, FeePreview preview) {
        EventSnapshot event = requireEvent(eventId);
        FeeContext context = FeeContext.builder()
            .presentParts(preview.getPresentParts())
            .fields(preview.getFields())
            .member(preview.isMember())
            .orga(preview.isOrga())
            .anyPart(!preview.getPresentParts().isEmpty())
            .allParts(event.coversAllParts(preview.getPresentParts()))
            .build();
        return FeeCalculator.calculateBoth(context, loadCompiledFees(eventId));
    }

    @Transactional(readOnly = true)
    public FeeStats getFeeStats(Long eventId) {
        EventSnapshot event = requireEvent(eventId);
        List<CompiledFee> fees = loadCompiledFees(eventId);

        Map<FeeKind, BigDecimal> owed = new EnumMap<>(FeeKind.class);
        Map<FeeKind, BigDecimal> paid = new EnumMap<>(FeeKind.class);
        for (RegistrationSnapshot registration : eventDataRepository.findRegistrations(eventId)) {
            RegistrationFee fee = FeeCalculator.calculate(registration.toFeeContext(event), fees);
            fee.getByKind().forEach((kind, amount) -> owed.merge(kind, amount, BigDecimal::add));
            if (registration.isFullyPaid()) {
                fee.getByKind().forEach((kind, amount) -> paid.merge(kind, amount, BigDecimal::add));
            }
        }
        return new FeeStats(eventId, Collections.unmodifiableMap(owed), Collections.unmodifiableMap(paid));
    }

    /**
     * Books a payment (or, with a negative amount, a refund) for an event registration.
     * Over-payment is allowed.
     *
     * @return the new paid amount
     */
    @Transactional
    public BigDecimal bookRegistrationPayment(Long registrationId, BigDecimal amount) {
        if (amount == null || amount.signum() == 0) {
            throw new IllegalArgumentException("Payment amount must not be zero");
        }
        requireRegistration(registrationId);
        BigDecimal paid = eventDataRepository.addAmountPaid(registrationId, FeeDefinition.normalizeAmount(amount));
        log.info("Booked registration payment: registrationId={}, amount={}, amountPaid={}",
                registrationId, amount, paid);
        return paid;
    }

    EventSnapshot requireEvent(Long eventId) {
        return eventDataRepository.findEvent(eventId)
            .orElseThrow(() -> new IllegalArgumentException("Event not found: " + eventId));
    }

    private RegistrationSnapshot requireRegistration(Long registrationId) {
        return eventDataRepository.findRegistration(registrationId)
            .orElseThrow(() -> new IllegalArgumentException("Registration not found: " + registrationId));
    }
}
