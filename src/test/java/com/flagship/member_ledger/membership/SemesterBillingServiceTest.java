package com.flagship.member_ledger.membership;

import com.flagship.member_ledger.lastschrift.MandateService;
import com.flagship.member_ledger.ledger.FinanceActor;
import com.flagship.member_ledger.ledger.LedgerService;
import com.flagship.member_ledger.ledger.Persona;
import org.junit.jupiter.api.BeforeEach;
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
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Semester balance update over a small association: one member of every kind.
 */
@SpringBootTest
@Testcontainers
class SemesterBillingServiceTest {

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
    private SemesterBillingService billingService;

    @Autowired
    private BalanceUpdateRunner balanceUpdateRunner;

    @Autowired
    private PersonaService personaService;

    @Autowired
    private MembershipService membershipService;

    @Autowired
    private MandateService mandateService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Long rich;
    private Long poorWithMandate;
    private Long poor;
    private Long trial;
    private Long guest;

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute(
            "TRUNCATE money_transfer_requests, finance_log, lastschrift_transactions, lastschrift_mandates, " +
            "registration_parts, registrations, event_fees, event_orgas, event_fields, event_parts, events, " +
            "outbox_events, processed_events, personas, org_periods RESTART IDENTITY CASCADE");
        jdbcTemplate.update("INSERT INTO org_periods (id) VALUES (1)");

        rich = member("Reich", "10.00");
        poorWithMandate = member("Lastschrift", "1.00");
        mandateService.grant(poorWithMandate, BigDecimal.ZERO, "DE89370400440532013000", null, null, null,
            FinanceActor.system());
        poor = member("Arm", "2.00");
        trial = personaService.createPersona("Tina", "Testlauf", false, true, FinanceActor.system()).getId();
        guest = personaService.createPersona("Gustav", "Gast", false, false, FinanceActor.system()).getId();
        membershipService.correctBalance(guest, new BigDecimal("50.00"), "Guthaben", FinanceActor.system());
    }

    private Long member(String familyName, String balance) {
        Long id = personaService.createPersona("Max", familyName, true, false, FinanceActor.system()).getId();
        membershipService.correctBalance(id, new BigDecimal(balance), "Startguthaben", FinanceActor.system());
        return id;
    }

    private Persona persona(Long id) {
        return ledgerService.findPersona(id).orElseThrow();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("The balance update handles every member once")
    void testRunBalanceUpdate_AllOutcomes() {
        printTestHeader("Balance Update");

        BalanceUpdateReport report = balanceUpdateRunner.runBalanceUpdate(FinanceActor.system());
        Period period = report.getPeriod();
        printOutput("Report", report);

        assertEquals(4, report.getProcessed(), "Only members are visited");
        assertTrue(period.isBalanceDone());
        assertEquals(1, period.getBalanceTrialMembers());
        assertEquals(1, period.getBalanceDeductedMembers());
        assertEquals(1, period.getBalanceDeferredMembers());
        assertEquals(1, period.getBalanceLapsedMembers());
        assertEquals(0, new BigDecimal("4.00").compareTo(period.getBalanceTotal()));

        assertEquals(0, new BigDecimal("6.00").compareTo(persona(rich).getBalance()));
        assertTrue(persona(rich).isMember());

        assertEquals(0, new BigDecimal("1.00").compareTo(persona(poorWithMandate).getBalance()));
        assertTrue(persona(poorWithMandate).isMember());

        assertEquals(0, new BigDecimal("2.00").compareTo(persona(poor).getBalance()),
            "A fee is never charged partially");
        assertFalse(persona(poor).isMember());
        assertFalse(mandateService.hasActiveMandate(poor));

        assertTrue(persona(trial).isMember());
        assertFalse(persona(trial).isTrialMember());

        assertEquals(0, new BigDecimal("50.00").compareTo(persona(guest).getBalance()));
        assertEquals(0L, ledgerService.countInconsistentPersonas());

        printSuccess("Every kind of member handled");
    }

    @Test
    @DisplayName("Running the balance update again charges nobody twice")
    void testRunBalanceUpdate_Rerun() {
        printTestHeader("Balance Update Rerun");

        balanceUpdateRunner.runBalanceUpdate(FinanceActor.system());
        BalanceUpdateReport second = balanceUpdateRunner.runBalanceUpdate(FinanceActor.system());
        printOutput("Second run", second);

        assertEquals(0, second.getProcessed());
        assertEquals(0, new BigDecimal("6.00").compareTo(persona(rich).getBalance()));
        assertTrue(billingService.processBalanceStep(FinanceActor.system()).isEmpty());

        printSuccess("Rerun is a no-op");
    }

    @Test
    @DisplayName("An interrupted balance update resumes after the last handled member")
    void testProcessBalanceStep_Resumes() {
        printTestHeader("Balance Update Resume");

        Optional<BillingStep> first = billingService.processBalanceStep(FinanceActor.system());
        printOutput("First step", first);
        assertTrue(first.isPresent());
        assertEquals(rich, first.get().getPersonaId());
        assertEquals(BillingOutcome.FEE_DEDUCTED, first.get().getOutcome());
        assertEquals(rich, billingService.currentPeriod().getBalanceState());
        assertTrue(billingService.currentPeriod().isBalanceStarted());

        BalanceUpdateReport rest = balanceUpdateRunner.runBalanceUpdate(FinanceActor.system());
        printOutput("Remaining", rest);

        assertEquals(3, rest.getProcessed());
        assertEquals(0, new BigDecimal("6.00").compareTo(persona(rich).getBalance()));

        printSuccess("Resumed without charging twice");
    }

    @Test
    @DisplayName("A member who left before their turn is not charged")
    void testProcessBalanceStep_SkipsFormerMember() {
        printTestHeader("Skip Former Member");

        billingService.processBalanceStep(FinanceActor.system());
        membershipService.changeMembership(poor, false, FinanceActor.system(), "Austritt");
        BalanceUpdateReport report = balanceUpdateRunner.runBalanceUpdate(FinanceActor.system());

        assertEquals(2, report.getProcessed());
        assertEquals(0, report.getPeriod().getBalanceLapsedMembers());
        assertEquals(0, new BigDecimal("2.00").compareTo(persona(poor).getBalance()));

        printSuccess("Former member left alone");
    }

    @Test
    @DisplayName("The next period starts only after the balance update")
    void testAdvancePeriod() {
        printTestHeader("Advance Period");

        assertThrows(IllegalStateException.class, () -> billingService.advancePeriod());

        balanceUpdateRunner.runBalanceUpdate(FinanceActor.system());
        Period next = billingService.advancePeriod();
        printOutput("Next period", next);

        assertEquals(2, next.getId());
        assertFalse(next.isBalanceStarted());
        assertEquals(2, billingService.currentPeriod().getId());
        assertThrows(IllegalStateException.class, () -> billingService.advancePeriod());

        BalanceUpdateReport secondSemester = balanceUpdateRunner.runBalanceUpdate(FinanceActor.system());
        assertEquals(3, secondSemester.getProcessed());
        assertEquals(0, new BigDecimal("2.00").compareTo(persona(rich).getBalance()));

        printSuccess("Periods advance in order");
    }

    private Long formerMember(String familyName, String balance, int yearsSinceLapse) {
        Long id = personaService.createPersona("Erika", familyName, false, false, FinanceActor.system()).getId();
        membershipService.correctBalance(id, new BigDecimal(balance), "Restguthaben", FinanceActor.system());
        jdbcTemplate.update(
            "INSERT INTO finance_log (ctime, code, persona_id, change_note) " +
            "VALUES (now() - make_interval(years => ?), 'LOSE_MEMBERSHIP', ?, 'Ausgetreten')",
            yearsSinceLapse, id);
        return id;
    }

    @Test
    @DisplayName("Former members are archived once the grace period after their lapse is over")
    void testRunArchival() {
        printTestHeader("Automatic Archival");

        Long longGone = formerMember("Lange", "3.00", 3);
        Long longGoneWithMandate = formerMember("Mandat", "0.00", 3);
        mandateService.grant(longGoneWithMandate, null, "DE02120300000000202051", null, null, null,
            FinanceActor.system());
        Long recentlyGone = formerMember("Kurz", "1.00", 1);

        assertThrows(IllegalStateException.class, () -> billingService.processArchivalStep(FinanceActor.system()),
            "Archival waits for the balance update");
        balanceUpdateRunner.runBalanceUpdate(FinanceActor.system());

        ArchivalReport report = balanceUpdateRunner.runArchival(FinanceActor.system());
        printOutput("Report", report);

        // poor, guest and the three former members
        assertEquals(5, report.getProcessed());
        assertEquals(1, report.getArchived());
        assertTrue(report.getPeriod().isArchivalDone());
        assertEquals(1, report.getPeriod().getArchivalCount());

        assertTrue(persona(longGone).isArchived());
        assertEquals(0, BigDecimal.ZERO.compareTo(persona(longGone).getBalance()));
        assertEquals(1, jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM finance_log WHERE persona_id = ? AND code = 'REMOVE_BALANCE_ON_ARCHIVAL'",
            Integer.class, longGone));

        assertFalse(persona(longGoneWithMandate).isArchived(), "An active mandate keeps the persona");
        assertFalse(persona(recentlyGone).isArchived(), "Still within the grace period");
        assertFalse(persona(poor).isArchived(), "Lapsed in this very period");
        assertFalse(persona(guest).isArchived(), "Never was a member");
        assertEquals(0L, ledgerService.countInconsistentPersonas());

        ArchivalReport rerun = balanceUpdateRunner.runArchival(FinanceActor.system());
        assertEquals(0, rerun.getProcessed());
        assertTrue(billingService.processArchivalStep(FinanceActor.system()).isEmpty());

        printSuccess("Only long lapsed former members archived");
    }

    @Test
    @DisplayName("An interrupted archival resumes after the last handled persona")
    void testProcessArchivalStep_Resumes() {
        printTestHeader("Archival Resume");

        Long longGone = formerMember("Lange", "0.00", 3);
        balanceUpdateRunner.runBalanceUpdate(FinanceActor.system());

        Optional<ArchivalStep> first = billingService.processArchivalStep(FinanceActor.system());
        printOutput("First step", first);
        assertTrue(first.isPresent());
        assertEquals(poor, first.get().getPersonaId());
        assertFalse(first.get().isArchived());
        assertEquals(poor, billingService.currentPeriod().getArchivalState());
        assertTrue(billingService.currentPeriod().isArchivalStarted());

        ArchivalReport rest = balanceUpdateRunner.runArchival(FinanceActor.system());
        assertEquals(2, rest.getProcessed());
        assertEquals(1, rest.getArchived());
        assertTrue(persona(longGone).isArchived());

        printSuccess("Archival resumed");
    }
}
