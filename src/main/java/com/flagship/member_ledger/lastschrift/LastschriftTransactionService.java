package com.flagship.member_ledger.lastschrift;

import com.flagship.member_ledger.config.FinanceProperties;
import com.flagship.member_ledger.event.LastschriftTransactionFinalizedEvent;
import com.flagship.member_ledger.event.LastschriftTransactionIssuedEvent;
import com.flagship.member_ledger.ledger.FinanceActor;
import com.flagship.member_ledger.ledger.FinanceLogCode;
import com.flagship.member_ledger.ledger.LedgerService;
import com.flagship.member_ledger.ledger.Persona;
import com.flagship.member_ledger.membership.MembershipService;
import com.flagship.member_ledger.membership.Period;
import com.flagship.member_ledger.membership.PeriodRepository;
import com.flagship.member_ledger.observability.CorrelationContext;
import com.flagship.member_ledger.observability.FinanceMetrics;
import com.flagship.member_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Direct debit transactions: issuing, finalizing, rolling back and skipping.
 *
 * Batch operations book every item in its own transaction and report rejected or
 * failed items instead of failing. A successful debit credits the persona's balance
 * and grants membership, a failed or charged back one revokes the mandate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LastschriftTransactionService {

    private static final Duration NEW_MANDATE_AGE = Duration.ofDays(2 * 365);
    private static final int SKIP_LOOKBACK_YEARS = 3;

    private final LastschriftTransactionRepository transactionRepository;
    private final MandateRepository mandateRepository;
    private final MandateService mandateService;
    private final MembershipService membershipService;
    private final LedgerService ledgerService;
    private final PeriodRepository periodRepository;
    private final OutboxService outboxService;
    private final FinanceProperties financeProperties;
    private final FinanceMetrics financeMetrics;
    private final PlatformTransactionManager transactionManager;

    /**
     * Issues one OPEN transaction per mandate. Each mandate is booked in its own
     * transaction.
     *
     * @param mandateIds mandates to debit; empty means every mandate that is open for
     *                   debit in the current billing year
     */
    public BatchReport<LastschriftTransaction> generateTransactions(List<Long> mandateIds, FinanceActor actor) {
        long startTime = System.currentTimeMillis();
        Period period = periodRepository.findCurrent();
        LocalDate paymentDate = PaymentDateCalculator.paymentDate(
            LocalDate.now(financeProperties.getSepa().getTimeZone()),
            financeProperties.getSepa().getPaymentOffsetDays());

        List<Long> candidates;
        if (mandateIds == null || mandateIds.isEmpty()) {
            candidates = mandateRepository.findByRevokedAtIsNullOrderByIdAsc().stream()
                .map(MandateEntity::toDomain)
                .filter(mandate -> isOpenForDebit(mandate, period))
                .map(Mandate::getId)
                .toList();
        } else {
            candidates = new ArrayList<>(new LinkedHashSet<>(mandateIds));
        }

        List<LastschriftTransaction> issued = new ArrayList<>();
        List<BatchItemError> errors = new ArrayList<>();
        for (Long mandateId : candidates) {
            runItem("generate", mandateId, issued, errors, () -> {
                Mandate mandate = mandateRepository.findByIdForUpdate(mandateId)
                    .map(MandateEntity::toDomain)
                    .orElseThrow(() -> rejected("generate", mandateId, BatchItemError.Code.UNKNOWN_MANDATE,
                        "Mandate not found"));
                if (!mandate.isActive()) {
                    throw rejected("generate", mandateId, BatchItemError.Code.MANDATE_REVOKED,
                        "Mandate is revoked");
                }
                if (transactionRepository.existsByMandateIdAndStatus(mandateId, TransactionStatus.OPEN)) {
                    throw rejected("generate", mandateId, BatchItemError.Code.OPEN_TRANSACTION_EXISTS,
                        "Mandate already has an open transaction");
                }
                if (debitedThisBillingYear(mandateId, period)) {
                    throw rejected("generate", mandateId, BatchItemError.Code.ALREADY_DEBITED_THIS_PERIOD,
                        "Mandate was already debited or skipped in this billing year");
                }
                BigDecimal amount = financeProperties.annualMembershipFee().add(mandate.getDonation());
                if (amount.signum() <= 0) {
                    throw rejected("generate", mandateId, BatchItemError.Code.NON_POSITIVE_AMOUNT,
                        "Amount " + amount.toPlainString() + " is not positive");
                }
                return issue(mandate, period, amount, paymentDate, actor);
            });
        }

        financeMetrics.recordLastschriftBatch("generate", System.currentTimeMillis() - startTime);
        log.info("Direct debits generated: issued={}, rejected={}, paymentDate={}",
            issued.size(), errors.size(), paymentDate);
        return new BatchReport<>(issued, errors);
    }

    /**
     * Applies the bank's answer to open transactions. Unknown and already final
     * transactions are reported, never applied twice. Each transaction is booked in
     * its own transaction.
     */
    public BatchReport<LastschriftTransaction> finalizeTransactions(List<Long> transactionIds,
                                                                    TransactionOutcome outcome,
                                                                    FinanceActor actor) {
        if (transactionIds == null || transactionIds.isEmpty()) {
            throw new IllegalArgumentException("No transactions given");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("Outcome is required");
        }
        long startTime = System.currentTimeMillis();
        List<LastschriftTransaction> finalized = new ArrayList<>();
        List<BatchItemError> errors = new ArrayList<>();

        for (Long transactionId : transactionIds) {
            runItem("finalize", transactionId, finalized, errors, () -> {
                LastschriftTransactionEntity entity = transactionRepository.findById(transactionId)
                    .orElseThrow(() -> rejected("finalize", transactionId, BatchItemError.Code.UNKNOWN_TRANSACTION,
                        "Transaction not found"));
                if (!entity.getStatus().equals(TransactionStatus.OPEN)) {
                    throw rejected("finalize", transactionId, BatchItemError.Code.ALREADY_FINAL,
                        "Transaction is already " + entity.getStatus());
                }
                return finalizeOne(entity, outcome, actor);
            });
        }

        financeMetrics.recordLastschriftBatch("finalize", System.currentTimeMillis() - startTime);
        log.info("Direct debits finalized: outcome={}, finalized={}, rejected={}",
            outcome, finalized.size(), errors.size());
        return new BatchReport<>(finalized, errors);
    }

    /**
     * The debtor's bank charged back a successful debit. The amount is taken off the
     * balance again (never below zero) and the mandate is revoked.
     */
    @Transactional
    public LastschriftTransaction rollbackTransaction(Long transactionId, FinanceActor actor) {
        LastschriftTransactionEntity entity = transactionRepository.findById(transactionId)
            .orElseThrow(() -> new IllegalArgumentException("Transaction not found: " + transactionId));
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, transactionId.toString());
        try {
            LastschriftTransaction rolledBack = entity.toDomain()
                .rollback(financeProperties.getSepa().getRollbackFee());
            entity.updateFromDomain(rolledBack);
            transactionRepository.save(entity);

            Mandate mandate = requireMandate(rolledBack.getMandateId());
            Persona persona = ledgerService.lockPersona(mandate.getPersonaId());
            BigDecimal newBalance = persona.getBalance().subtract(rolledBack.getAmount()).max(BigDecimal.ZERO);
            String note = "Direct debit charged back";
            if (ledgerService.setBalance(persona.getId(), newBalance,
                    FinanceLogCode.LASTSCHRIFT_TRANSACTION_REVOKED, actor, note).isEmpty()) {
                ledgerService.appendLog(FinanceLogCode.LASTSCHRIFT_TRANSACTION_REVOKED, actor, persona.getId(),
                    null, null, null, note);
            }
            if (mandate.isActive()) {
                mandateService.revoke(mandate.getId(), actor, note);
            }

            outboxService.saveEvent(LastschriftTransactionFinalizedEvent.from(rolledBack, mandate.getPersonaId()));
            financeMetrics.recordLastschriftTransaction(TransactionStatus.ROLLBACK.name());
            log.warn("Direct debit rolled back: transactionId={}, personaId={}, amount={}",
                transactionId, persona.getId(), rolledBack.getAmount());
            return rolledBack;
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    /**
     * Records a SKIPPED pseudo transaction so the mandate is not debited in this
     * billing year.
     *
     * @throws IllegalStateException if skipping would leave the mandate unused for too
     *                               long, or the mandate cannot be debited at all
     */
    @Transactional
    public LastschriftTransaction skipMandate(Long mandateId, FinanceActor actor) {
        Mandate mandate = mandateRepository.findByIdForUpdate(mandateId)
            .map(MandateEntity::toDomain)
            .orElseThrow(() -> new IllegalArgumentException("Mandate not found: " + mandateId));
        if (!mandate.isActive()) {
            throw new IllegalStateException("Mandate " + mandateId + " is revoked");
        }
        if (transactionRepository.existsByMandateIdAndStatus(mandateId, TransactionStatus.OPEN)) {
            throw new IllegalStateException("Mandate " + mandateId + " has an open transaction");
        }
        Period period = periodRepository.findCurrent();
        if (!maySkip(mandate, period)) {
            throw new IllegalStateException(
                "Mandate " + mandateId + " was unused for too long, skipping would invalidate it");
        }

        LastschriftTransaction skipped = transactionRepository.save(LastschriftTransactionEntity.fromDomain(
            LastschriftTransaction.skipped(mandateId, period.getId(), actor.getPersonaId()))).toDomain();
        ledgerService.appendLog(FinanceLogCode.LASTSCHRIFT_TRANSACTION_SKIP, actor, mandate.getPersonaId(),
            null, null, null, null);
        financeMetrics.recordLastschriftTransaction(TransactionStatus.SKIPPED.name());
        log.info("Direct debit skipped: mandateId={}, periodId={}", mandateId, period.getId());
        return skipped;
    }

    /**
     * Active, nothing open, and no success, open or skipped transaction in the current
     * billing year.
     */
    @Transactional(readOnly = true)
    public boolean isOpenForDebit(Mandate mandate, Period period) {
        if (!mandate.isActive()) {
            return false;
        }
        if (transactionRepository.existsByMandateIdAndStatus(mandate.getId(), TransactionStatus.OPEN)) {
            return false;
        }
        return !debitedThisBillingYear(mandate.getId(), period);
    }

    /**
     * Mandates unused for three years expire, so a skip needs a young mandate or a
     * recent success.
     */
    @Transactional(readOnly = true)
    public boolean maySkip(Mandate mandate, Period period) {
        if (mandate.getGrantedAt().isAfter(Instant.now().minus(NEW_MANDATE_AGE))) {
            return true;
        }
        int firstPeriod = period.getId() - SKIP_LOOKBACK_YEARS * financeProperties.getPeriodsPerYear() + 1;
        return transactionRepository.existsSincePeriod(mandate.getId(),
            EnumSet.of(TransactionStatus.SUCCESS), firstPeriod);
    }

    @Transactional(readOnly = true)
    public Optional<LastschriftTransaction> findById(Long transactionId) {
        return transactionRepository.findById(transactionId).map(LastschriftTransactionEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<LastschriftTransaction> findByMandate(Long mandateId) {
        return transactionRepository.findByMandateIdOrderByIdDesc(mandateId).stream()
            .map(LastschriftTransactionEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<LastschriftTransaction> findOpen() {
        return transactionRepository.findByStatusOrderByIdAsc(TransactionStatus.OPEN).stream()
            .map(LastschriftTransactionEntity::toDomain)
            .toList();
    }

    private LastschriftTransaction issue(Mandate mandate, Period period, BigDecimal amount,
                                         LocalDate paymentDate, FinanceActor actor) {
        LastschriftTransaction transaction = transactionRepository.save(LastschriftTransactionEntity.fromDomain(
            LastschriftTransaction.issue(mandate.getId(), period.getId(), amount, paymentDate,
                actor.getPersonaId()))).toDomain();
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, transaction.getId().toString());
        try {
            ledgerService.appendLog(FinanceLogCode.LASTSCHRIFT_TRANSACTION_ISSUE, actor, mandate.getPersonaId(),
                null, null, null, amount.toPlainString());
            outboxService.saveEvent(LastschriftTransactionIssuedEvent.from(transaction, mandate.getPersonaId()));
            financeMetrics.recordLastschriftTransaction(TransactionStatus.OPEN.name());
            log.debug("Direct debit issued: mandateId={}, amount={}", mandate.getId(), amount);
            return transaction;
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    private LastschriftTransaction finalizeOne(LastschriftTransactionEntity entity, TransactionOutcome outcome,
                                               FinanceActor actor) {
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, entity.getId().toString());
        try {
            LastschriftTransaction result = entity.toDomain()
                .finalizeWith(outcome, financeProperties.getSepa().getRollbackFee());
            entity.updateFromDomain(result);
            transactionRepository.save(entity);

            Mandate mandate = requireMandate(result.getMandateId());
            Long personaId = mandate.getPersonaId();
            switch (outcome) {
                case SUCCESS -> {
                    ledgerService.applyDelta(personaId, result.getAmount(), outcome.getLogCode(), actor,
                        result.getPaymentDate(), "Successful direct debit");
                    membershipService.grantMembershipIfMissing(personaId, actor, "Successful direct debit");
                }
                case FAILURE -> {
                    ledgerService.appendLog(outcome.getLogCode(), actor, personaId, null, null, null,
                        result.getTally().toPlainString());
                    if (mandate.isActive()) {
                        mandateService.revoke(mandate.getId(), actor, "Direct debit failed");
                    }
                }
                case CANCELLED -> ledgerService.appendLog(outcome.getLogCode(), actor, personaId, null, null, null,
                    result.getTally().toPlainString());
            }

            outboxService.saveEvent(LastschriftTransactionFinalizedEvent.from(result, personaId));
            financeMetrics.recordLastschriftTransaction(result.getStatus().name());
            log.info("Direct debit finalized: personaId={}, status={}, tally={}",
                personaId, result.getStatus(), result.getTally());
            return result;
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    private boolean debitedThisBillingYear(Long mandateId, Period period) {
        int firstPeriod = period.getId() - financeProperties.getPeriodsPerYear() + 1;
        return transactionRepository.existsSincePeriod(mandateId,
            EnumSet.of(TransactionStatus.SUCCESS, TransactionStatus.OPEN, TransactionStatus.SKIPPED), firstPeriod);
    }

    /**
     * Runs one batch item in a transaction of its own. Rejections and database
     * failures of the item end up in {@code errors}, the rest of the batch goes on.
     */
    private <T> void runItem(String operation, Long itemId, List<T> done, List<BatchItemError> errors,
                             Supplier<T> step) {
        TransactionTemplate itemTransaction = new TransactionTemplate(transactionManager);
        itemTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        try {
            done.add(itemTransaction.execute(status -> step.get()));
        } catch (ItemRejectedException e) {
            errors.add(e.getError());
        } catch (DataAccessException | TransactionException e) {
            log.error("Direct debit {} failed for item {}", operation, itemId, e);
            errors.add(reject(operation, itemId, BatchItemError.Code.ITEM_FAILED,
                String.valueOf(e.getMostSpecificCause().getMessage())));
        }
    }

    private Mandate requireMandate(Long mandateId) {
        return mandateRepository.findById(mandateId)
            .map(MandateEntity::toDomain)
            .orElseThrow(() -> new IllegalStateException("Transaction refers to missing mandate " + mandateId));
    }

    private BatchItemError reject(String operation, Long itemId, BatchItemError.Code code, String message) {
        log.warn("Direct debit {} rejected item {}: {}", operation, itemId, message);
        financeMetrics.recordBatchItemRejected(operation, code.name());
        return new BatchItemError(itemId, code, message);
    }

    private ItemRejectedException rejected(String operation, Long itemId, BatchItemError.Code code, String message) {
        return new ItemRejectedException(reject(operation, itemId, code, message));
    }

    private static final class ItemRejectedException extends RuntimeException {

        private final BatchItemError error;

        ItemRejectedException(BatchItemError error) {
            super(error.getMessage(), null, false, false);
            this.error = error;
        }

        BatchItemError getError() {
            return error;
        }
    }
}
