package com.flagship.member_ledger.lastschrift;

import com.flagship.member_ledger.event.MandateRevokedEvent;
import com.flagship.member_ledger.ledger.FinanceActor;
import com.flagship.member_ledger.ledger.FinanceLogCode;
import com.flagship.member_ledger.ledger.LedgerService;
import com.flagship.member_ledger.ledger.Persona;
import com.flagship.member_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Lifecycle of direct debit mandates: grant, change, revoke and delete.
 *
 * Every change is logged in the finance log (without a balance delta). Locking the
 * persona row on grant keeps concurrent grants for one persona apart; the partial
 * unique index on active mandates backs this up.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MandateService {

    /** SEPA mandates have to be kept for 14 months after the last debit; we keep 18. */
    static final Duration RETENTION = Duration.ofDays(18 * 30);

    private final MandateRepository mandateRepository;
    private final LastschriftTransactionRepository transactionRepository;
    private final LedgerService ledgerService;
    private final OutboxService outboxService;

    @Transactional
    public Mandate grant(Long personaId, BigDecimal donation, String iban, String accountOwner,
                         String accountAddress, String notes, FinanceActor actor) {
        Persona persona = ledgerService.lockPersona(personaId);
        if (persona.isArchived()) {
            throw new IllegalStateException("Persona " + personaId + " is archived");
        }
        Mandate mandate = Mandate.grant(personaId, donation, iban, accountOwner, accountAddress, notes,
            actor.getPersonaId());
        if (mandateRepository.existsByPersonaIdAndRevokedAtIsNull(personaId)) {
            throw new IllegalStateException("Multiple active mandates are disallowed.");
        }

        Mandate saved = mandateRepository.save(MandateEntity.fromDomain(mandate)).toDomain();
        ledgerService.appendLog(FinanceLogCode.GRANT_LASTSCHRIFT, actor, personaId, null, null, null, notes);
        log.info("Mandate granted: mandateId={}, personaId={}, donation={}",
            saved.getId(), personaId, saved.getDonation());
        return saved;
    }

    /**
     * Changes donation, account holder and notes of an active mandate.
     */
    @Transactional
    public Mandate update(Long mandateId, BigDecimal donation, String accountOwner, String accountAddress,
                          String notes, FinanceActor actor) {
        MandateEntity entity = lock(mandateId);
        Mandate updated = entity.toDomain().withDetails(donation, accountOwner, accountAddress, notes);
        entity.updateFromDomain(updated);
        mandateRepository.save(entity);

        ledgerService.appendLog(FinanceLogCode.MODIFY_LASTSCHRIFT, actor, updated.getPersonaId(),
            null, null, null, null);
        log.info("Mandate modified: mandateId={}, donation={}", mandateId, updated.getDonation());
        return updated;
    }

    /**
     * Revokes a mandate. Open transactions stay open and can still be finalized.
     *
     * @throws IllegalStateException if the mandate is already revoked
     */
    @Transactional
    public Mandate revoke(Long mandateId, FinanceActor actor, String reason) {
        MandateEntity entity = lock(mandateId);
        Mandate revoked = entity.toDomain().revoke(Instant.now());
        entity.updateFromDomain(revoked);
        mandateRepository.save(entity);

        ledgerService.appendLog(FinanceLogCode.REVOKE_LASTSCHRIFT, actor, revoked.getPersonaId(),
            null, null, null, reason);
        outboxService.saveEvent(MandateRevokedEvent.from(revoked, reason));
        log.info("Mandate revoked: mandateId={}, personaId={}, reason={}",
            mandateId, revoked.getPersonaId(), reason);
        return revoked;
    }

    /**
     * Revokes the active mandate of a persona, if there is one.
     */
    @Transactional
    public Optional<Mandate> revokeActiveMandate(Long personaId, FinanceActor actor, String reason) {
        return mandateRepository.findByPersonaIdAndRevokedAtIsNull(personaId)
            .map(entity -> revoke(entity.getId(), actor, reason));
    }

    /**
     * Deletes a mandate that was revoked at least 18 months ago and never had a
     * transaction.
     */
    @Transactional
    public void delete(Long mandateId, FinanceActor actor) {
        MandateEntity entity = lock(mandateId);
        Mandate mandate = entity.toDomain();
        if (mandate.isActive() || mandate.getRevokedAt().plus(RETENTION).isAfter(Instant.now())) {
            throw new IllegalStateException(
                "Mandate " + mandateId + " can only be deleted 18 months after revocation");
        }
        if (transactionRepository.existsByMandateId(mandateId)) {
            throw new IllegalStateException("Mandate " + mandateId + " still has transactions");
        }
        mandateRepository.delete(entity);
        ledgerService.appendLog(FinanceLogCode.LASTSCHRIFT_DELETED, actor, mandate.getPersonaId(),
            null, null, null, null);
        log.info("Mandate deleted: mandateId={}, personaId={}", mandateId, mandate.getPersonaId());
    }

    @Transactional(readOnly = true)
    public boolean hasActiveMandate(Long personaId) {
        return mandateRepository.existsByPersonaIdAndRevokedAtIsNull(personaId);
    }

    @Transactional(readOnly = true)
    public Optional<Mandate> findById(Long mandateId) {
        return mandateRepository.findById(mandateId).map(MandateEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Mandate> findActiveMandate(Long personaId) {
        return mandateRepository.findByPersonaIdAndRevokedAtIsNull(personaId).map(MandateEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Mandate> findByPersona(Long personaId) {
        return mandateRepository.findByPersonaIdOrderByGrantedAtDesc(personaId).stream()
            .map(MandateEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<Mandate> findAll(boolean activeOnly) {
        List<MandateEntity> entities = activeOnly
            ? mandateRepository.findByRevokedAtIsNullOrderByIdAsc()
            : mandateRepository.findAllByOrderByIdAsc();
        return entities.stream().map(MandateEntity::toDomain).toList();
    }

    private MandateEntity lock(Long mandateId) {
        return mandateRepository.findByIdForUpdate(mandateId)
            .orElseThrow(() -> new IllegalArgumentException("Mandate not found: " + mandateId));
    }
}
