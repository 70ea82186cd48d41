package com.flagship.member_ledger.fee;

import com.flagship.member_ledger.fee.condition.FeeConditionParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Administration of event fee definitions.
 *
 * Every change:
 * 1. checks the event is neither locked nor archived
 * 2. validates the condition against the event's fields and parts
 * 3. recalculates {@code amount_owed} of all registrations in the same transaction
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeeDefinitionService {

    private final FeeDefinitionRepository feeRepository;
    private final FeeAggregationService aggregationService;

    @Transactional
    public FeeDefinition createFee(Long eventId, String title, FeeKind kind,
                                   BigDecimal amount, String condition, String notes) {
        EventSnapshot event = requireModifiableEvent(eventId);
        FeeDefinition fee = FeeDefinition.create(eventId, title, kind, amount, condition, notes);
        validateCondition(event, fee);

        FeeDefinition saved = feeRepository.saveAndFlush(FeeDefinitionEntity.fromDomain(fee)).toDomain();
        log.info("Created fee: eventId={}, feeId={}, kind={}, amount={}",
                eventId, saved.getId(), saved.getKind(), saved.getAmount());

        aggregationService.recalculateEvent(eventId);
        return saved;
    }

    @Transactional
    public FeeDefinition updateFee(Long eventId, Long feeId, String title, FeeKind kind,
                                   BigDecimal amount, String condition, String notes) {
        EventSnapshot event = requireModifiableEvent(eventId);
        FeeDefinitionEntity entity = requireFee(eventId, feeId);

        FeeDefinition updated = entity.toDomain().update(title, kind, amount, condition, notes);
        validateCondition(event, updated);
        entity.updateFromDomain(updated);
        feeRepository.saveAndFlush(entity);
        log.info("Updated fee: eventId={}, feeId={}, amount={}", eventId, feeId, updated.getAmount());

        aggregationService.recalculateEvent(eventId);
        return updated;
    }

    @Transactional
    public void deleteFee(Long eventId, Long feeId) {
        requireModifiableEvent(eventId);
        FeeDefinitionEntity entity = requireFee(eventId, feeId);
        feeRepository.delete(entity);
        feeRepository.flush();
        log.info("Deleted fee: eventId={}, feeId={}", eventId, feeId);

        aggregationService.recalculateEvent(eventId);
    }

    @Transactional(readOnly = true)
    public List<FeeDefinition> listFees(Long eventId) {
        return feeRepository.findByEventIdOrderByIdAsc(eventId).stream()
            .map(FeeDefinitionEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public Optional<FeeDefinition> findFee(Long eventId, Long feeId) {
        return feeRepository.findByIdAndEventId(feeId, eventId).map(FeeDefinitionEntity::toDomain);
    }

    private void validateCondition(EventSnapshot event, FeeDefinition fee) {
        FeeConditionParser.parseAndValidate(fee.getCondition(), event.getFieldNames(), event.getPartShortnames());
    }

    private EventSnapshot requireModifiableEvent(Long eventId) {
        EventSnapshot event = aggregationService.requireEvent(eventId);
        if (!event.isFeeChangeAllowed()) {
            throw new IllegalStateException(
                String.format("Fees of event %d are frozen (locked=%s, archived=%s)",
                    eventId, event.isLocked(), event.isArchived()));
        }
        return event;
    }

    private FeeDefinitionEntity requireFee(Long eventId, Long feeId) {
        return feeRepository.findByIdAndEventId(feeId, eventId)
            .orElseThrow(() -> new IllegalArgumentException("Fee not found: " + feeId));
    }
}
