package com.flagship.member_ledger.membership;

import com.flagship.member_ledger.event.MembershipChangedEvent;
import com.flagship.member_ledger.lastschrift.MandateService;
import com.flagship.member_ledger.ledger.FinanceActor;
import com.flagship.member_ledger.ledger.FinanceLogCode;
import com.flagship.member_ledger.ledger.LedgerService;
import com.flagship.member_ledger.ledger.LedgerUpdate;
import com.flagship.member_ledger.ledger.Persona;
import com.flagship.member_ledger.outbox.OutboxEvent;
import com.flagship.member_ledger.outbox.OutboxService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Membership state machine: money transfers, trial memberships, manual changes and
 * archival.
 */
@SpringBootTest
@Testcontainers
class MembershipServiceTest {

    private static final String IBAN = "DE89370400440532013000";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("member_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private MembershipService membershipService;

    @Autowired
    private PersonaService personaService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private MandateService mandateService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private Persona newPersona(boolean member, boolean trial) {
        return personaService.createPersona("Bertalotta", "Beispiel", member, trial, FinanceActor.system());
    }

    private Persona reload(Long personaId) {
        return ledgerService.findPersona(personaId).orElseThrow();
    }

    private List<String> loggedCodes(Long personaId) {
        return jdbcTemplate.queryForList(
            "SELECT code FROM finance_log WHERE persona_id = ? ORDER BY id", String.class, personaId);
    }

    @Test
    @DisplayName("New personas start at zero and log how they joined")
    void testCreatePersona() {
        printTestHeader("Create Persona");

        Persona guest = newPersona(false, false);
        Persona member = newPersona(true, false);
        Persona trial = newPersona(false, true);

        assertEquals(0, BigDecimal.ZERO.compareTo(guest.getBalance()));
        assertTrue(loggedCodes(guest.getId()).isEmpty());
        assertEquals(List.of("NEW_MEMBER"), loggedCodes(member.getId()));
        assertTrue(trial.isMember(), "Trial implies member");
        assertEquals(List.of("START_TRIAL_MEMBERSHIP"), loggedCodes(trial.getId()));
        assertThrows(IllegalArgumentException.class, () ->
            personaService.createPersona(" ", "Beispiel", false, false, FinanceActor.system()));

        printSuccess("Personas created");
    }

    @Test
    @DisplayName("A transfer covering the fee makes a non-member a member")
    void testMoneyTransfer_GainsMembership() {
        printTestHeader("Transfer Gains Membership");

        Persona persona = newPersona(false, false);
        MoneyTransfer small = new MoneyTransfer(persona.getId(), new BigDecimal("2.00"),
            LocalDate.of(2026, 10, 1), "Teilzahlung");
        MoneyTransfer rest = new MoneyTransfer(persona.getId(), new BigDecimal("2.00"),
            LocalDate.of(2026, 10, 2), "Rest");

        MoneyTransferResult first = membershipService.receiveMoneyTransfer(small, FinanceActor.of(persona.getId()));
        printOutput("After first", first.getPersona());
        assertFalse(first.isMembershipGained());
        assertFalse(first.getPersona().isMember());

        MoneyTransferResult second = membershipService.receiveMoneyTransfer(rest, FinanceActor.of(persona.getId()));
        printOutput("After second", second.getPersona());
        assertTrue(second.isMembershipGained());
        assertTrue(second.getPersona().isMember());
        assertEquals(0, new BigDecimal("4.00").compareTo(second.getPersona().getBalance()));
        assertEquals(List.of("INCREASE_BALANCE", "INCREASE_BALANCE", "GAIN_MEMBERSHIP"),
            loggedCodes(persona.getId()));

        List<OutboxEvent> events = outboxService.getEventsForAggregate(Persona.AGGREGATE_TYPE,
            persona.getId().toString());
        assertEquals(1, events.size());
        assertEquals(MembershipChangedEvent.EVENT_TYPE, events.get(0).getEventType());
        assertTrue(events.get(0).getPayload().contains("GAIN_MEMBERSHIP"));

        printSuccess("Membership gained and published");
    }

    @Test
    @DisplayName("A transfer covering the fee ends a trial membership")
    void testMoneyTransfer_EndsTrial() {
        printTestHeader("Transfer Ends Trial");

        Persona persona = newPersona(false, true);
        MoneyTransferResult result = membershipService.receiveMoneyTransfer(
            new MoneyTransfer(persona.getId(), new BigDecimal("10.00"), null, null), FinanceActor.system());
        printOutput("Result", result.getPersona());

        assertTrue(result.isTrialEnded());
        assertTrue(result.getPersona().isMember());
        assertFalse(result.getPersona().isTrialMember());

        printSuccess("Trial ended");
    }

    @Test
    @DisplayName("Transfers are rejected for archived personas and when they would go negative")
    void testMoneyTransfer_Rejections() {
        printTestHeader("Transfer Rejections");

        Persona persona = newPersona(false, false);
        membershipService.receiveMoneyTransfer(
            new MoneyTransfer(persona.getId(), new BigDecimal("1.00"), null, null), FinanceActor.system());

        assertThrows(IllegalArgumentException.class, () -> membershipService.receiveMoneyTransfer(
            new MoneyTransfer(persona.getId(), new BigDecimal("-1.01"), null, null), FinanceActor.system()));
        assertThrows(IllegalArgumentException.class, () -> membershipService.receiveMoneyTransfer(
            new MoneyTransfer(persona.getId(), new BigDecimal("0.00"), null, null), FinanceActor.system()));
        assertThrows(IllegalArgumentException.class, () -> membershipService.receiveMoneyTransfer(
            new MoneyTransfer(persona.getId(), new BigDecimal("1.005"), null, null), FinanceActor.system()));

        membershipService.archivePersona(persona.getId(), FinanceActor.system(), "Ausgetreten");
        assertThrows(IllegalStateException.class, () -> membershipService.receiveMoneyTransfer(
            new MoneyTransfer(persona.getId(), new BigDecimal("5.00"), null, null), FinanceActor.system()));

        printSuccess("Invalid transfers rejected");
    }

    @Test
    @DisplayName("A batch with one bad line books nothing")
    void testProcessMoneyTransfers_AllOrNothing() {
        printTestHeader("Batch All Or Nothing");

        Persona first = newPersona(false, false);
        Persona second = newPersona(false, false);
        List<MoneyTransfer> batch = List.of(
            new MoneyTransfer(first.getId(), new BigDecimal("10.00"), null, "Zeile 1"),
            new MoneyTransfer(second.getId(), new BigDecimal("5.00"), null, "Zeile 2"),
            new MoneyTransfer(999_999L, new BigDecimal("5.00"), null, "Zeile 3"));
        printInput("Lines", batch.size());

        MoneyTransferBatchException e = assertThrows(MoneyTransferBatchException.class, () ->
            membershipService.processMoneyTransfers(batch, FinanceActor.system()));
        printOutput("Error", e.getMessage());

        assertEquals(2, e.getLineIndex());
        assertEquals(0, BigDecimal.ZERO.compareTo(reload(first.getId()).getBalance()));
        assertEquals(0, BigDecimal.ZERO.compareTo(reload(second.getId()).getBalance()));
        assertTrue(loggedCodes(first.getId()).isEmpty());

        List<MoneyTransferResult> booked = membershipService.processMoneyTransfers(batch.subList(0, 2),
            FinanceActor.system());
        assertEquals(2, booked.size());
        assertTrue(booked.get(0).isMembershipGained());
        assertTrue(booked.get(1).isMembershipGained());

        printSuccess("Batch is atomic");
    }

    @Test
    @DisplayName("Balance corrections need a note and log the difference")
    void testCorrectBalance() {
        printTestHeader("Correct Balance");

        Persona persona = newPersona(true, false);
        assertThrows(IllegalArgumentException.class, () ->
            membershipService.correctBalance(persona.getId(), new BigDecimal("3.00"), " ", FinanceActor.system()));

        Optional<LedgerUpdate> update = membershipService.correctBalance(persona.getId(), new BigDecimal("3.00"),
            "Barzahlung auf der Akademie", FinanceActor.system());
        printOutput("Update", update.map(LedgerUpdate::getEntry).orElse(null));

        assertTrue(update.isPresent());
        assertEquals(FinanceLogCode.MANUAL_BALANCE_CORRECTION, update.get().getEntry().getCode());
        assertEquals(0, new BigDecimal("3.00").compareTo(update.get().getEntry().getDelta()));
        assertTrue(membershipService.correctBalance(persona.getId(), new BigDecimal("3.00"), "Again",
            FinanceActor.system()).isEmpty());

        printSuccess("Correction logged");
    }

    @Test
    @DisplayName("Losing membership revokes the active mandate")
    void testChangeMembership_LoseRevokesMandate() {
        printTestHeader("Lose Membership");

        Persona persona = newPersona(true, false);
        mandateService.grant(persona.getId(), new BigDecimal("2.00"), IBAN, null, null, null, FinanceActor.system());
        assertThrows(IllegalStateException.class, () ->
            membershipService.changeMembership(persona.getId(), true, FinanceActor.system(), null));

        LedgerUpdate update = membershipService.changeMembership(persona.getId(), false, FinanceActor.system(),
            "Austritt");
        printOutput("After", update.getAfter());

        assertFalse(update.getAfter().isMember());
        assertFalse(mandateService.hasActiveMandate(persona.getId()));
        assertEquals(List.of("NEW_MEMBER", "GRANT_LASTSCHRIFT", "LOSE_MEMBERSHIP", "REVOKE_LASTSCHRIFT"),
            loggedCodes(persona.getId()));

        LedgerUpdate regained = membershipService.changeMembership(persona.getId(), true, FinanceActor.system(),
            null);
        assertTrue(regained.getAfter().isMember());

        printSuccess("Membership lost and mandate revoked");
    }

    @Test
    @DisplayName("Only non-members can start a trial")
    void testStartTrialMembership() {
        printTestHeader("Start Trial");

        Persona guest = newPersona(false, false);
        Persona member = newPersona(true, false);

        LedgerUpdate update = membershipService.startTrialMembership(guest.getId(), FinanceActor.system());
        assertTrue(update.getAfter().isTrialMember());
        assertThrows(IllegalStateException.class, () ->
            membershipService.startTrialMembership(member.getId(), FinanceActor.system()));
        assertThrows(IllegalStateException.class, () ->
            membershipService.startTrialMembership(guest.getId(), FinanceActor.system()));

        printSuccess("Trial rules enforced");
    }

    @Test
    @DisplayName("Archival requires a non-member without active mandate")
    void testArchivePersona() {
        printTestHeader("Archive Persona");

        Persona member = newPersona(true, false);
        assertThrows(IllegalStateException.class, () ->
            membershipService.archivePersona(member.getId(), FinanceActor.system(), null));

        Persona guest = newPersona(false, false);
        mandateService.grant(guest.getId(), BigDecimal.ZERO, IBAN, null, null, null, FinanceActor.system());
        assertThrows(IllegalStateException.class, () ->
            membershipService.archivePersona(guest.getId(), FinanceActor.system(), null));

        mandateService.revokeActiveMandate(guest.getId(), FinanceActor.system(), "Widerruf");
        membershipService.receiveMoneyTransfer(
            new MoneyTransfer(guest.getId(), new BigDecimal("3.00"), null, null), FinanceActor.system());
        LedgerUpdate update = membershipService.archivePersona(guest.getId(), FinanceActor.system(), "Archiv");
        printOutput("Entry", update.getEntry());

        assertTrue(update.getAfter().isArchived());
        assertEquals(0, new BigDecimal("-3.00").compareTo(update.getEntry().getDelta()));
        assertTrue(ledgerService.verifyConsistency(guest.getId()));

        printSuccess("Archival rules enforced");
    }
}
