package com.flagship.member_ledger.lastschrift.sepa;

import com.flagship.member_ledger.config.FinanceProperties;
import com.flagship.member_ledger.lastschrift.BatchItemError;
import com.flagship.member_ledger.lastschrift.IbanValidator;
import com.flagship.member_ledger.lastschrift.LastschriftTransaction;
import com.flagship.member_ledger.lastschrift.LastschriftTransactionEntity;
import com.flagship.member_ledger.lastschrift.LastschriftTransactionRepository;
import com.flagship.member_ledger.lastschrift.Mandate;
import com.flagship.member_ledger.lastschrift.MandateEntity;
import com.flagship.member_ledger.lastschrift.MandateReference;
import com.flagship.member_ledger.lastschrift.MandateRepository;
import com.flagship.member_ledger.lastschrift.TransactionStatus;
import com.flagship.member_ledger.ledger.LedgerService;
import com.flagship.member_ledger.ledger.Persona;
import com.flagship.member_ledger.observability.FinanceMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds the pain.008 file for open direct debits.
 *
 * Exporting does not change any state; the same open transactions can be exported
 * again until they are finalized. Items whose data the bank would reject (bad IBAN,
 * over-long texts) are left out and reported.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SepaPainService {

    static final int MAX_NAME_LENGTH = 70;
    static final int MAX_REMITTANCE_LENGTH = 140;
    static final int MAX_ID_LENGTH = 35;

    private static final String MESSAGE_ID_ALPHABET =
        "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    private final LastschriftTransactionRepository transactionRepository;
    private final MandateRepository mandateRepository;
    private final LedgerService ledgerService;
    private final FinanceProperties financeProperties;
    private final FinanceMetrics financeMetrics;
    private final SepaPainWriter writer = new SepaPainWriter();

    /**
     * @param mandateId restrict to the open transaction of one mandate; null for all
     */
    @Transactional(readOnly = true)
    public SepaPainDocument createDocument(Long mandateId) {
        long startTime = System.currentTimeMillis();
        FinanceProperties.Sepa sepa = financeProperties.getSepa();
        SepaCreditor creditor = SepaCreditor.from(sepa);
        validateCreditor(creditor);

        List<LastschriftTransaction> open = (mandateId == null
            ? transactionRepository.findByStatusOrderByIdAsc(TransactionStatus.OPEN)
            : transactionRepository.findByMandateIdAndStatus(mandateId, TransactionStatus.OPEN))
            .stream()
            .map(LastschriftTransactionEntity::toDomain)
            .toList();

        Set<Long> mandateIds = open.stream().map(LastschriftTransaction::getMandateId).collect(Collectors.toSet());
        Map<Long, Mandate> mandates = mandateRepository.findAllById(mandateIds).stream()
            .map(MandateEntity::toDomain)
            .collect(Collectors.toMap(Mandate::getId, Function.identity()));
        Set<Long> collectedBefore = mandateIds.isEmpty()
            ? Set.of()
            : new HashSet<>(transactionRepository.findMandatesWithStatus(mandateIds,
                EnumSet.of(TransactionStatus.SUCCESS, TransactionStatus.ROLLBACK)));

        List<SepaDirectDebit> included = new ArrayList<>();
        List<BatchItemError> excluded = new ArrayList<>();
        for (LastschriftTransaction transaction : open) {
            Mandate mandate = mandates.get(transaction.getMandateId());
            Optional<Persona> persona = ledgerService.findPersona(mandate.getPersonaId());
            if (persona.isEmpty()) {
                excluded.add(exclude(transaction, "Persona " + mandate.getPersonaId() + " not found"));
                continue;
            }
            SequenceType type = collectedBefore.contains(mandate.getId()) ? SequenceType.RCUR : SequenceType.FRST;
            SepaDirectDebit debit = toDirectDebit(transaction, mandate, persona.get(), type);
            Optional<String> problem = validate(debit);
            if (problem.isPresent()) {
                excluded.add(exclude(transaction, problem.get()));
                continue;
            }
            included.add(debit);
        }

        String messageId = messageId(Instant.now());
        String xml = writer.write(messageId, LocalDateTime.now(sepa.getTimeZone()), creditor, included);
        SepaPainDocument document = new SepaPainDocument(messageId, xml, included.size(),
            SepaPainWriter.controlSum(included), included, excluded);

        financeMetrics.recordLastschriftBatch("sepa-pain", System.currentTimeMillis() - startTime);
        log.info("SEPA direct debit file created: messageId={}, transactions={}, controlSum={}, excluded={}",
            messageId, document.getNumberOfTransactions(), document.getControlSum(), excluded.size());
        return document;
    }

    SepaDirectDebit toDirectDebit(LastschriftTransaction transaction, Mandate mandate, Persona persona,
                                  SequenceType type) {
        FinanceProperties.Sepa sepa = financeProperties.getSepa();
        String reference = MandateReference.of(sepa.getMandatePrefix(), persona.getId(), mandate.getId());
        String owner = mandate.getAccountOwner() != null ? mandate.getAccountOwner() : persona.getFullName();
        return new SepaDirectDebit(
            transaction.getId(),
            mandate.getId(),
            SepaText.asciify(reference + "-" + transaction.getId()),
            SepaText.asciify(reference),
            mandate.mandateDate(sepa.getInitialisationDate(), sepa.getCutoffDate(), sepa.getTimeZone()),
            transaction.getAmount(),
            SepaText.asciify(owner),
            mandate.getIban(),
            remittance(persona),
            type,
            transaction.getPaymentDate()
        );
    }

    /**
     * Remittance text from the configured template, cut to the 140 characters SEPA
     * allows.
     */
    String remittance(Persona persona) {
        String text = financeProperties.getSepa().getRemittanceTemplate()
            .replace("{id}", "DB-" + persona.getId() + "-" + MandateReference.checkDigit(persona.getId()))
            .replace("{given}", persona.getGivenNames())
            .replace("{family}", persona.getFamilyName());
        return SepaText.asciify(text, MAX_REMITTANCE_LENGTH);
    }

    static String messageId(Instant now) {
        StringBuilder id = new StringBuilder(String.format(Locale.ROOT, "%d.%06d-",
            now.getEpochSecond(), now.getNano() / 1000));
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < 10; i++) {
            id.append(MESSAGE_ID_ALPHABET.charAt(random.nextInt(MESSAGE_ID_ALPHABET.length())));
        }
        return id.toString();
    }

    private Optional<String> validate(SepaDirectDebit debit) {
        if (!IbanValidator.isValid(debit.getDebtorIban())) {
            return Optional.of("Invalid IBAN");
        }
        if (debit.getAmount().signum() <= 0) {
            return Optional.of("Amount must be positive");
        }
        if (debit.getDebtorName().isBlank() || debit.getDebtorName().length() > MAX_NAME_LENGTH) {
            return Optional.of("Account owner must have 1 to " + MAX_NAME_LENGTH + " characters");
        }
        if (debit.getMandateReference().length() > MAX_ID_LENGTH || debit.getEndToEndId().length() > MAX_ID_LENGTH) {
            return Optional.of("Mandate reference too long");
        }
        if (debit.getCollectionDate() == null) {
            return Optional.of("Transaction has no payment date");
        }
        return Optional.empty();
    }

    private void validateCreditor(SepaCreditor creditor) {
        if (!"DE".equals(creditor.getCountry())) {
            throw new IllegalStateException("Unsupported creditor country: " + creditor.getCountry());
        }
        if (creditor.getName().length() > MAX_NAME_LENGTH
                || creditor.getAddressLine1().length() > MAX_NAME_LENGTH
                || creditor.getAddressLine2().length() > MAX_NAME_LENGTH) {
            throw new IllegalStateException("Creditor name and address lines are limited to "
                + MAX_NAME_LENGTH + " characters");
        }
        if (creditor.getCreditorId().length() > MAX_ID_LENGTH) {
            throw new IllegalStateException("Creditor identifier too long");
        }
        if (!IbanValidator.isValid(creditor.getIban())) {
            throw new IllegalStateException("Creditor IBAN is invalid");
        }
    }

    private BatchItemError exclude(LastschriftTransaction transaction, String reason) {
        log.warn("Direct debit left out of SEPA file: transactionId={}, reason={}", transaction.getId(), reason);
        financeMetrics.recordBatchItemRejected("sepa-pain", BatchItemError.Code.INVALID_SEPA_DATA.name());
        return new BatchItemError(transaction.getId(), BatchItemError.Code.INVALID_SEPA_DATA, reason);
    }
}
