package com.flagship.member_ledger.lastschrift;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Mandate and transaction state transitions, without the database.
 */
class MandateTest {

    private static final ZoneId BERLIN = ZoneId.of("Europe/Berlin");
    private static final LocalDate INITIALISATION = LocalDate.of(2013, 7, 30);
    private static final LocalDate CUTOFF = LocalDate.of(2013, 10, 14);
    private static final BigDecimal ROLLBACK_FEE = new BigDecimal("4.50");

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private static Mandate mandateGrantedAt(Instant grantedAt) {
        return new Mandate(7L, 3L, new BigDecimal("0.00"), "DE89370400440532013000", null, null,
                grantedAt, null, null, 1L);
    }

    @Test
    @DisplayName("Granting normalizes IBAN, donation and blank owner")
    void testGrant() {
        printTestHeader("Grant Mandate");

        Mandate mandate = Mandate.grant(3L, null, "de89 3704 0044 0532 0130 00", "  ", "", "signed on paper", 1L);

        assertNull(mandate.getId());
        assertTrue(mandate.isActive());
        assertEquals("DE89370400440532013000", mandate.getIban());
        assertEquals(new BigDecimal("0.00"), mandate.getDonation());
        assertNull(mandate.getAccountOwner());
        assertNull(mandate.getAccountAddress());
        assertNotNull(mandate.getGrantedAt());
        printSuccess("Mandate granted");
    }

    @Test
    @DisplayName("Negative or sub-cent donations and invalid IBANs are rejected")
    void testGrantValidation() {
        printTestHeader("Grant Validation");

        assertThrows(IllegalArgumentException.class,
                () -> Mandate.grant(3L, new BigDecimal("-1.00"), "DE89370400440532013000", null, null, null, 1L));
        assertThrows(IllegalArgumentException.class,
                () -> Mandate.grant(3L, new BigDecimal("1.005"), "DE89370400440532013000", null, null, null, 1L));
        assertThrows(IllegalArgumentException.class,
                () -> Mandate.grant(3L, null, "DE89370400440532013001", null, null, null, 1L));
        assertThrows(IllegalArgumentException.class,
                () -> Mandate.grant(null, null, "DE89370400440532013000", null, null, null, 1L));
        printSuccess("Invalid mandates rejected");
    }

    @Test
    @DisplayName("Revocation is terminal")
    void testRevoke() {
        printTestHeader("Revoke Mandate");

        Mandate revoked = mandateGrantedAt(Instant.parse("2020-01-01T10:00:00Z")).revoke(Instant.now());

        assertFalse(revoked.isActive());
        assertThrows(IllegalStateException.class, () -> revoked.revoke(Instant.now()));
        assertThrows(IllegalStateException.class,
                () -> revoked.withDetails(BigDecimal.TEN, null, null, null));
        printSuccess("Revoked mandate cannot change");
    }

    @Test
    @DisplayName("Details change but the IBAN stays fixed")
    void testWithDetails() {
        printTestHeader("Update Details");

        Mandate updated = mandateGrantedAt(Instant.parse("2020-01-01T10:00:00Z"))
                .withDetails(new BigDecimal("5"), "Anna Example", "Somewhere 1", "raised donation");

        assertEquals(new BigDecimal("5.00"), updated.getDonation());
        assertEquals("Anna Example", updated.getAccountOwner());
        assertEquals("DE89370400440532013000", updated.getIban());
        assertEquals(7L, updated.getId());
        printSuccess("Details updated");
    }

    @Test
    @DisplayName("Mandates older than the SEPA switch report the cutoff date")
    void testMandateDate() {
        printTestHeader("Mandate Date");

        Mandate migrated = mandateGrantedAt(Instant.parse("2010-05-01T12:00:00Z"));
        Mandate recent = mandateGrantedAt(Instant.parse("2021-03-04T23:30:00Z"));
        Mandate onInitialisation = mandateGrantedAt(Instant.parse("2013-07-30T08:00:00Z"));

        assertEquals(CUTOFF, migrated.mandateDate(INITIALISATION, CUTOFF, BERLIN));
        assertEquals(LocalDate.of(2021, 3, 5), recent.mandateDate(INITIALISATION, CUTOFF, BERLIN),
                "calendar day is taken in the association's zone");
        assertEquals(INITIALISATION, onInitialisation.mandateDate(INITIALISATION, CUTOFF, BERLIN));
        printSuccess("Mandate dates derived");
    }

    @Test
    @DisplayName("Transaction outcomes set status and tally")
    void testTransactionOutcomes() {
        printTestHeader("Transaction Outcomes");

        LastschriftTransaction open = LastschriftTransaction.issue(7L, 1, new BigDecimal("13"),
                LocalDate.of(2026, 11, 4), 1L);
        assertTrue(open.isOpen());
        assertNull(open.getTally());
        assertEquals(new BigDecimal("13.00"), open.getAmount());

        LastschriftTransaction success = open.finalizeWith(TransactionOutcome.SUCCESS, ROLLBACK_FEE);
        assertEquals(TransactionStatus.SUCCESS, success.getStatus());
        assertEquals(new BigDecimal("13.00"), success.getTally());
        assertNotNull(success.getProcessedAt());

        LastschriftTransaction failure = open.finalizeWith(TransactionOutcome.FAILURE, ROLLBACK_FEE);
        assertEquals(new BigDecimal("-4.50"), failure.getTally());

        LastschriftTransaction cancelled = open.finalizeWith(TransactionOutcome.CANCELLED, ROLLBACK_FEE);
        assertEquals(new BigDecimal("0.00"), cancelled.getTally());

        assertThrows(IllegalStateException.class,
                () -> success.finalizeWith(TransactionOutcome.FAILURE, ROLLBACK_FEE));
        printSuccess("Outcomes applied");
    }

    @Test
    @DisplayName("Only successful transactions can be rolled back")
    void testRollback() {
        printTestHeader("Rollback");

        LastschriftTransaction open = LastschriftTransaction.issue(7L, 1, new BigDecimal("13.00"),
                LocalDate.of(2026, 11, 4), 1L);
        assertThrows(IllegalStateException.class, () -> open.rollback(ROLLBACK_FEE));

        LastschriftTransaction rolledBack = open.finalizeWith(TransactionOutcome.SUCCESS, ROLLBACK_FEE)
                .rollback(ROLLBACK_FEE);
        assertEquals(TransactionStatus.ROLLBACK, rolledBack.getStatus());
        assertEquals(new BigDecimal("-4.50"), rolledBack.getTally());
        assertThrows(IllegalStateException.class, () -> rolledBack.rollback(ROLLBACK_FEE));
        printSuccess("Rollback rules enforced");
    }

    @Test
    @DisplayName("Non-positive amounts cannot be issued; skipped transactions are final")
    void testIssueValidationAndSkip() {
        printTestHeader("Issue Validation");

        assertThrows(IllegalArgumentException.class,
                () -> LastschriftTransaction.issue(7L, 1, BigDecimal.ZERO, LocalDate.now(), 1L));
        assertThrows(IllegalArgumentException.class,
                () -> LastschriftTransaction.issue(7L, 1, null, LocalDate.now(), 1L));

        LastschriftTransaction skipped = LastschriftTransaction.skipped(7L, 1, 1L);
        assertEquals(TransactionStatus.SKIPPED, skipped.getStatus());
        assertTrue(skipped.getStatus().isFinal());
        assertEquals(new BigDecimal("0.00"), skipped.getTally());
        printSuccess("Issue rules enforced");
    }
}
