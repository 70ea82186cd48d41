package com.flagship.member_ledger.membership;

import com.flagship.member_ledger.config.FinanceProperties;
import com.flagship.member_ledger.event.MembershipChangedEvent;
import com.flagship.member_ledger.lastschrift.MandateService;
import com.flagship.member_ledger.ledger.FinanceActor;
import com.flagship.member_ledger.ledger.FinanceLogCode;
import com.flagship.member_ledger.ledger.LedgerService;
import com.flagship.member_ledger.ledger.LedgerUpdate;
import com.flagship.member_ledger.ledger.Persona;
import com.flagship.member_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Membership state machine of a persona, driven by money:
 * no membership, trial member, member, lapsed, archived.
 *
 * All balance and flag writes go through {@link LedgerService}; membership changes
 * are published as {@link MembershipChangedEvent}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MembershipService {

    private final LedgerService ledgerService;
    private final MandateService mandateService;
    private final OutboxService outboxService;
    private final FinanceProperties financeProperties;

    /**
     * Books a money transfer. A trial member whose balance now covers the fee ends the
     * trial; a non-member whose balance covers the fee becomes a member.
     */
    @Transactional
    public MoneyTransferResult receiveMoneyTransfer(MoneyTransfer transfer, FinanceActor actor) {
        validate(transfer);
        Persona persona = ledgerService.lockPersona(transfer.getPersonaId());
        if (persona.isArchived()) {
            throw new IllegalStateException("Persona " + persona.getId() + " is archived");
        }
        if (persona.getBalance().add(transfer.getAmount()).signum() < 0) {
            throw new IllegalArgumentException(String.format(
                "Transfer of %s would make the balance of persona %d negative",
                transfer.getAmount().toPlainString(), persona.getId()));
        }

        LedgerUpdate credit = ledgerService.applyDelta(persona.getId(), transfer.getAmount(),
            FinanceLogCode.INCREASE_BALANCE, actor, transfer.getTransactionDate(), transfer.getNote());

        Persona after = credit.getAfter();
        boolean coversFee = after.getBalance().compareTo(financeProperties.getMembershipFee()) >= 0;
        LedgerUpdate membershipChange = null;
        if (coversFee && after.isMember() && after.isTrialMember()) {
            membershipChange = applyMembershipChange(after.getId(), true, false,
                FinanceLogCode.END_TRIAL_MEMBERSHIP, actor, null);
        } else if (coversFee && !after.isMember()) {
            membershipChange = applyMembershipChange(after.getId(), true, false,
                FinanceLogCode.GAIN_MEMBERSHIP, actor, null);
        }
        return new MoneyTransferResult(credit, membershipChange);
    }

    /**
     * Books a list of money transfers all or nothing.
     *
     * @throws MoneyTransferBatchException naming the first rejected line
     */
    @Transactional
    public List<MoneyTransferResult> processMoneyTransfers(List<MoneyTransfer> transfers, FinanceActor actor) {
        if (transfers == null || transfers.isEmpty()) {
            throw new IllegalArgumentException("No money transfers given");
        }
        List<MoneyTransferResult> results = new ArrayList<>(transfers.size());
        for (int i = 0; i < transfers.size(); i++) {
            try {
                results.add(receiveMoneyTransfer(transfers.get(i), actor));
            } catch (IllegalArgumentException | IllegalStateException e) {
                log.warn("Money transfer batch rejected at line {}: {}", i + 1, e.getMessage());
                throw new MoneyTransferBatchException(i, e);
            }
        }
        log.info("Money transfer batch booked: lines={}", results.size());
        return results;
    }

    /**
     * Sets a balance to an absolute value. A change note is required.
     *
     * @return empty if the balance already had that value
     */
    @Transactional
    public Optional<LedgerUpdate> correctBalance(Long personaId, BigDecimal newBalance, String note,
                                                 FinanceActor actor) {
        if (note == null || note.isBlank()) {
            throw new IllegalArgumentException("A change note is required for balance corrections");
        }
        Persona persona = ledgerService.lockPersona(personaId);
        if (persona.isArchived()) {
            throw new IllegalStateException("Persona " + personaId + " is archived");
        }
        return ledgerService.setBalance(personaId, newBalance, FinanceLogCode.MANUAL_BALANCE_CORRECTION,
            actor, note);
    }

    /**
     * Grants or removes membership. Losing membership revokes the active mandate.
     */
    @Transactional
    public LedgerUpdate changeMembership(Long personaId, boolean member, FinanceActor actor, String note) {
        Persona persona = ledgerService.lockPersona(personaId);
        if (persona.isArchived()) {
            throw new IllegalStateException("Persona " + personaId + " is archived");
        }
        if (persona.isMember() == member) {
            throw new IllegalStateException(String.format("Persona %d is %s a member",
                personaId, member ? "already" : "not"));
        }
        if (member) {
            return applyMembershipChange(personaId, true, false, FinanceLogCode.GAIN_MEMBERSHIP, actor, note);
        }
        LedgerUpdate update = applyMembershipChange(personaId, false, false,
            FinanceLogCode.LOSE_MEMBERSHIP, actor, note);
        mandateService.revokeActiveMandate(personaId, actor, "Membership lost");
        return update;
    }

    /**
     * Makes a non-member a trial member.
     */
    @Transactional
    public LedgerUpdate startTrialMembership(Long personaId, FinanceActor actor) {
        Persona persona = ledgerService.lockPersona(personaId);
        if (persona.isArchived() || persona.isMember()) {
            throw new IllegalStateException("Only non-members can start a trial membership");
        }
        return applyMembershipChange(personaId, true, true, FinanceLogCode.START_TRIAL_MEMBERSHIP, actor, null);
    }

    /**
     * Grants membership to a persona that is not a member yet.
     *
     * @return empty if the persona already was a member
     */
    @Transactional
    public Optional<LedgerUpdate> grantMembershipIfMissing(Long personaId, FinanceActor actor, String note) {
        Persona persona = ledgerService.lockPersona(personaId);
        if (persona.isMember() || persona.isArchived()) {
            return Optional.empty();
        }
        return Optional.of(applyMembershipChange(personaId, true, false, FinanceLogCode.GAIN_MEMBERSHIP,
            actor, note));
    }

    /**
     * Archives a persona. Only non-members without an active mandate can be archived;
     * the remaining balance is removed.
     */
    @Transactional
    public LedgerUpdate archivePersona(Long personaId, FinanceActor actor, String note) {
        Persona persona = ledgerService.lockPersona(personaId);
        if (persona.isMember()) {
            throw new IllegalStateException("Members cannot be archived");
        }
        if (mandateService.hasActiveMandate(personaId)) {
            throw new IllegalStateException("Persona " + personaId + " still has an active direct debit mandate");
        }
        LedgerUpdate update = ledgerService.archive(personaId, actor, note);
        log.info("Persona archived: personaId={}, removedBalance={}", personaId, update.getBefore().getBalance());
        return update;
    }

    /**
     * Writes new membership flags and publishes the change.
     */
    @Transactional
    public LedgerUpdate applyMembershipChange(Long personaId, boolean member, boolean trialMember,
                                              FinanceLogCode code, FinanceActor actor, String note) {
        LedgerUpdate update = ledgerService.updateMembership(personaId, member, trialMember, code, actor, note);
        outboxService.saveEvent(MembershipChangedEvent.from(update));
        return update;
    }

    private void validate(MoneyTransfer transfer) {
        if (transfer == null || transfer.getPersonaId() == null) {
            throw new IllegalArgumentException("Persona is required");
        }
        BigDecimal amount = transfer.getAmount();
        if (amount == null || amount.signum() == 0) {
            throw new IllegalArgumentException("Amount must not be zero");
        }
        if (amount.stripTrailingZeros().scale() > 2) {
            throw new IllegalArgumentException("Amount must not have more than two decimal places: " + amount);
        }
    }
}
