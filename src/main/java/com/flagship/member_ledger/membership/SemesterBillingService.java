package com.flagship.member_ledger.membership;

import com.flagship.member_ledger.config.FinanceProperties;
import com.flagship.member_ledger.lastschrift.MandateService;
import com.flagship.member_ledger.ledger.FinanceActor;
import com.flagship.member_ledger.ledger.FinanceLogCode;
import com.flagship.member_ledger.ledger.LedgerService;
import com.flagship.member_ledger.ledger.Persona;
import com.flagship.member_ledger.observability.FinanceMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Semester billing: charges the membership fee once per period.
 *
 * Per member, in id order:
 * 1. Trial members end their trial; nothing is charged
 * 2. Members whose balance covers the fee are charged
 * 3. Members with too little balance but an active mandate are deferred (the next
 *    direct debit pays)
 * 4. Everybody else loses membership; the balance is not touched
 *
 * A fee is never charged partially and a balance never goes negative. Each persona is
 * one transaction; the period row remembers the last persona handled.
 *
 * Once the balance update is done, former members whose membership lapsed longer than
 * the grace period ago and who have no active mandate are archived, the same way.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SemesterBillingService {

    private final PeriodRepository periodRepository;
    private final LedgerService ledgerService;
    private final MembershipService membershipService;
    private final MandateService mandateService;
    private final FinanceProperties financeProperties;
    private final FinanceMetrics financeMetrics;

    @Transactional(readOnly = true)
    public Period currentPeriod() {
        return periodRepository.findCurrent();
    }

    /**
     * Handles the next member of the current period's balance update.
     *
     * @return empty once every member is handled (the period is then marked done)
     */
    @Transactional
    public Optional<BillingStep> processBalanceStep(FinanceActor actor) {
        Period period = periodRepository.lockCurrent();
        if (period.isBalanceDone()) {
            return Optional.empty();
        }

        Optional<Long> next = periodRepository.findNextMember(period.getBalanceState());
        if (next.isEmpty()) {
            periodRepository.markBalanceDone(period.getId());
            log.info("Balance update of period {} finished: trialEnded={}, deducted={}, deferred={}, lapsed={}, total={}",
                    period.getId(), period.getBalanceTrialMembers(), period.getBalanceDeductedMembers(),
                    period.getBalanceDeferredMembers(), period.getBalanceLapsedMembers(), period.getBalanceTotal());
            return Optional.empty();
        }

        Long personaId = next.get();
        Persona persona = ledgerService.lockPersona(personaId);
        BigDecimal fee = financeProperties.getMembershipFee();
        BigDecimal deducted = null;
        BillingOutcome outcome;

        if (!persona.isMember() || persona.isArchived()) {
            outcome = BillingOutcome.SKIPPED;
        } else if (persona.isTrialMember()) {
            membershipService.applyMembershipChange(personaId, true, false,
                FinanceLogCode.END_TRIAL_MEMBERSHIP, actor, null);
            outcome = BillingOutcome.TRIAL_ENDED;
        } else if (persona.getBalance().compareTo(fee) >= 0) {
            ledgerService.applyDelta(personaId, fee.negate(), FinanceLogCode.DEDUCT_MEMBERSHIP_FEE,
                actor, null, "Period " + period.getId());
            deducted = fee;
            outcome = BillingOutcome.FEE_DEDUCTED;
        } else if (mandateService.hasActiveMandate(personaId)) {
            outcome = BillingOutcome.DEFERRED;
        } else {
            membershipService.applyMembershipChange(personaId, false, false,
                FinanceLogCode.LOSE_MEMBERSHIP, actor, "Balance too low in period " + period.getId());
            outcome = BillingOutcome.MEMBERSHIP_LOST;
        }

        Period updated = period.afterStep(personaId, outcome, deducted);
        periodRepository.saveProgress(updated);
        financeMetrics.recordBillingOutcome(outcome.name());
        log.debug("Balance update step: period={}, personaId={}, outcome={}", period.getId(), personaId, outcome);
        return Optional.of(new BillingStep(personaId, outcome, updated));
    }

    /**
     * Looks at the next non-member for automatic archival.
     *
     * @return empty once every non-member is handled (archival is then marked done)
     * @throws IllegalStateException if the balance update of the period is not finished
     */
    @Transactional
    public Optional<ArchivalStep> processArchivalStep(FinanceActor actor) {
        Period period = periodRepository.lockCurrent();
        if (period.isArchivalDone()) {
            return Optional.empty();
        }
        if (!period.isBalanceDone()) {
            throw new IllegalStateException("Balance update of period " + period.getId() + " is not finished");
        }

        Optional<Long> next = periodRepository.findNextArchivalCandidate(period.getArchivalState());
        if (next.isEmpty()) {
            periodRepository.markArchivalDone(period.getId());
            log.info("Archival of period {} finished: archived={}", period.getId(), period.getArchivalCount());
            return Optional.empty();
        }

        Long personaId = next.get();
        boolean archived = isAutomaticallyArchivable(personaId);
        if (archived) {
            membershipService.archivePersona(personaId, actor,
                "Archived automatically after membership lapsed");
            financeMetrics.recordBillingOutcome("ARCHIVED");
        }

        Period updated = period.afterArchivalStep(personaId, archived);
        periodRepository.saveArchivalProgress(updated);
        log.debug("Archival step: period={}, personaId={}, archived={}", period.getId(), personaId, archived);
        return Optional.of(new ArchivalStep(personaId, archived, updated));
    }

    /**
     * A non-member whose membership lapsed more than the grace period ago and who has
     * no active mandate. Personas that never were members are kept.
     */
    @Transactional(readOnly = true)
    public boolean isAutomaticallyArchivable(Long personaId) {
        Optional<Persona> persona = ledgerService.findPersona(personaId);
        if (persona.isEmpty() || persona.get().isMember() || persona.get().isArchived()) {
            return false;
        }
        if (mandateService.hasActiveMandate(personaId)) {
            return false;
        }
        Instant cutoff = Instant.now().minus(financeProperties.getArchivalGracePeriod());
        return ledgerService.lastLoggedAt(personaId, FinanceLogCode.LOSE_MEMBERSHIP)
            .map(lapsedAt -> lapsedAt.isBefore(cutoff))
            .orElse(false);
    }

    /**
     * Starts the next period. The balance update of the current one must be finished.
     */
    @Transactional
    public Period advancePeriod() {
        Period current = periodRepository.lockCurrent();
        if (!current.isBalanceDone()) {
            throw new IllegalStateException("Balance update of period " + current.getId() + " is not finished");
        }
        Period next = periodRepository.createNext(current);
        log.info("Advanced to period {}", next.getId());
        return next;
    }
}
