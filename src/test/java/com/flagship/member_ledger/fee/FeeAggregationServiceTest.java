package com.flagship.member_ledger.fee;

import com.flagship.member_ledger.fee.condition.FeeConditionException;
import com.flagship.member_ledger.ledger.FinanceActor;
import com.flagship.member_ledger.membership.PersonaService;
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
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Fee definitions of an academy with two halves, applied to three registrations.
 */
@SpringBootTest
@Testcontainers
class FeeAggregationServiceTest {

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
    private FeeAggregationService aggregationService;

    @Autowired
    private FeeDefinitionService feeDefinitionService;

    @Autowired
    private PersonaService personaService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Long eventId;
    private Long anna;
    private Long bert;
    private Long orga;

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute(
            "TRUNCATE money_transfer_requests, finance_log, lastschrift_transactions, lastschrift_mandates, " +
            "outbox_events, processed_events, registration_parts, registrations, event_fees, event_orgas, " +
            "event_fields, event_parts, events, personas, org_periods RESTART IDENTITY CASCADE");
        jdbcTemplate.update("INSERT INTO org_periods (id) VALUES (1)");

        eventId = jdbcTemplate.queryForObject(
            "INSERT INTO events (title) VALUES ('Sommerakademie') RETURNING id", Long.class);
        Long firstHalf = part("1.H.");
        Long secondHalf = part("2.H.");
        jdbcTemplate.update("INSERT INTO event_fields (event_id, field_name) VALUES (?, 'donate')", eventId);

        Long annaPersona = persona("Anna");
        Long bertPersona = persona("Bert");
        Long orgaPersona = persona("Olga");
        jdbcTemplate.update("INSERT INTO event_orgas (event_id, persona_id) VALUES (?, ?)", eventId, orgaPersona);

        anna = registration(annaPersona, true, "{\"donate\": true}");
        registrationPart(anna, firstHalf, RegistrationPartStatus.PARTICIPANT);
        registrationPart(anna, secondHalf, RegistrationPartStatus.PARTICIPANT);

        bert = registration(bertPersona, false, "{\"donate\": false}");
        registrationPart(bert, firstHalf, RegistrationPartStatus.APPLIED);
        registrationPart(bert, secondHalf, RegistrationPartStatus.CANCELLED);

        orga = registration(orgaPersona, true, "{}");
        registrationPart(orga, firstHalf, RegistrationPartStatus.GUEST);
    }

    private Long part(String shortname) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO event_parts (event_id, shortname) VALUES (?, ?) RETURNING id", Long.class, eventId, shortname);
    }

    private Long persona(String givenNames) {
        return personaService.createPersona(givenNames, "Akademie", false, false, FinanceActor.system()).getId();
    }

    private Long registration(Long personaId, boolean member, String fields) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO registrations (event_id, persona_id, is_member, fields) VALUES (?, ?, ?, ?::jsonb) " +
            "RETURNING id",
            Long.class, eventId, personaId, member, fields);
    }

    private void registrationPart(Long registrationId, Long partId, RegistrationPartStatus status) {
        jdbcTemplate.update("INSERT INTO registration_parts (registration_id, part_id, status) VALUES (?, ?, ?)",
            registrationId, partId, status.name());
    }

    private void createAcademyFees() {
        feeDefinitionService.createFee(eventId, "Erste Hälfte", FeeKind.REGULAR, new BigDecimal("120"),
            "part.1.H.", null);
        feeDefinitionService.createFee(eventId, "Zweite Hälfte", FeeKind.REGULAR, new BigDecimal("120"),
            "part.2.H.", null);
        feeDefinitionService.createFee(eventId, "Externenaufschlag", FeeKind.SURCHARGE, new BigDecimal("8"),
            "any_part and not is_member", null);
        feeDefinitionService.createFee(eventId, "Ganze Akademie", FeeKind.DISCOUNT, new BigDecimal("-20"),
            "all_parts", null);
        feeDefinitionService.createFee(eventId, "Solidarspende", FeeKind.SOLIDARY_DONATION, new BigDecimal("15.50"),
            "field.donate", null);
        feeDefinitionService.createFee(eventId, "Orgarabatt", FeeKind.DISCOUNT, new BigDecimal("-50"),
            "is_orga", "Orgas zahlen nichts");
    }

    private BigDecimal amountOwed(Long registrationId) {
        return jdbcTemplate.queryForObject("SELECT amount_owed FROM registrations WHERE id = ?",
            BigDecimal.class, registrationId);
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
    @DisplayName("Creating fees keeps every amount owed up to date")
    void testCreateFee_RecalculatesRegistrations() {
        printTestHeader("Create Fees");

        createAcademyFees();

        printOutput("Anna", amountOwed(anna));
        printOutput("Bert", amountOwed(bert));
        printOutput("Orga", amountOwed(orga));
        assertEquals(new BigDecimal("235.50"), amountOwed(anna));
        assertEquals(new BigDecimal("128.00"), amountOwed(bert));
        assertEquals(new BigDecimal("0.00"), amountOwed(orga), "Discounts never make the total negative");
        assertEquals(0, aggregationService.recalculateEvent(eventId), "Nothing left to change");

        printSuccess("Amounts owed follow the fee definitions");
    }

    @Test
    @DisplayName("Updating and deleting a fee recalculates as well")
    void testUpdateAndDeleteFee() {
        printTestHeader("Update And Delete Fee");

        createAcademyFees();
        FeeDefinition surcharge = feeDefinitionService.listFees(eventId).stream()
            .filter(fee -> fee.getKind() == FeeKind.SURCHARGE)
            .findFirst()
            .orElseThrow();

        FeeDefinition updated = feeDefinitionService.updateFee(eventId, surcharge.getId(), "Externenaufschlag",
            FeeKind.SURCHARGE, new BigDecimal("12.00"), "any_part and not is_member", null);
        printOutput("Updated", updated);
        assertEquals(new BigDecimal("132.00"), amountOwed(bert));
        assertEquals(new BigDecimal("235.50"), amountOwed(anna));

        feeDefinitionService.deleteFee(eventId, surcharge.getId());
        assertEquals(new BigDecimal("120.00"), amountOwed(bert));
        assertTrue(feeDefinitionService.findFee(eventId, surcharge.getId()).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> feeDefinitionService.deleteFee(eventId, surcharge.getId()));

        printSuccess("Fee changes recalculated");
    }

    @Test
    @DisplayName("Conditions naming unknown parts or fields are rejected")
    void testCreateFee_InvalidCondition() {
        printTestHeader("Invalid Condition");

        FeeConditionException unknownPart = assertThrows(FeeConditionException.class, () ->
            feeDefinitionService.createFee(eventId, "Dritte Hälfte", FeeKind.REGULAR, new BigDecimal("120"),
                "part.3.H.", null));
        printOutput("Error", unknownPart.getMessage());

        assertThrows(FeeConditionException.class, () ->
            feeDefinitionService.createFee(eventId, "Spende", FeeKind.OTHER_DONATION, new BigDecimal("5"),
                "field.unknown", null));
        assertThrows(FeeConditionException.class, () ->
            feeDefinitionService.createFee(eventId, "Kaputt", FeeKind.REGULAR, new BigDecimal("5"),
                "part.1.H. and", null));
        assertThrows(IllegalArgumentException.class, () ->
            feeDefinitionService.createFee(eventId, "Krumm", FeeKind.REGULAR, new BigDecimal("5.001"), null, null));

        assertTrue(feeDefinitionService.listFees(eventId).isEmpty());
        printSuccess("Invalid definitions not stored");
    }

    @Test
    @DisplayName("Fees of a locked or archived event are frozen")
    void testCreateFee_LockedEvent() {
        printTestHeader("Locked Event");

        jdbcTemplate.update("UPDATE events SET is_locked = TRUE WHERE id = ?", eventId);
        assertThrows(IllegalStateException.class, () ->
            feeDefinitionService.createFee(eventId, "Teilnahme", FeeKind.REGULAR, new BigDecimal("120"), null, null));

        jdbcTemplate.update("UPDATE events SET is_locked = FALSE, is_archived = TRUE WHERE id = ?", eventId);
        assertThrows(IllegalStateException.class, () ->
            feeDefinitionService.createFee(eventId, "Teilnahme", FeeKind.REGULAR, new BigDecimal("120"), null, null));

        assertThrows(IllegalArgumentException.class, () ->
            feeDefinitionService.createFee(999_999L, "Teilnahme", FeeKind.REGULAR, new BigDecimal("120"), null, null));

        printSuccess("Frozen events rejected");
    }

    @Test
    @DisplayName("A registration's fee is reported for both membership states")
    void testCalculateRegistrationFee() {
        printTestHeader("Registration Fee");

        createAcademyFees();

        RegistrationFeeData bertFee = aggregationService.calculateRegistrationFee(bert);
        printOutput("Bert", bertFee);
        assertFalse(bertFee.isMember());
        assertEquals(new BigDecimal("128.00"), bertFee.getAmount());
        assertEquals(new BigDecimal("120.00"), bertFee.getMemberFee().getAmount());
        assertEquals(new BigDecimal("8.00"), bertFee.getNonmemberSurcharge());

        RegistrationFeeData annaFee = aggregationService.calculateRegistrationFee(anna);
        assertEquals(new BigDecimal("15.50"), annaFee.getDonation());
        assertEquals(4, annaFee.getFee().getAppliedFees().size(),
            "Neither the surcharge nor the orga discount applies");

        printSuccess("Member and non-member fee computed");
    }

    @Test
    @DisplayName("A dry run evaluates hypothetical registrations without storing anything")
    void testPrecomputeFee() {
        printTestHeader("Precompute Fee");

        createAcademyFees();

        RegistrationFeeData preview = aggregationService.precomputeFee(eventId,
            new FeePreview(Set.of("1.H.", "2.H."), Map.of("donate", false), false, false));
        printOutput("Preview", preview);

        assertEquals(new BigDecimal("228.00"), preview.getAmount());
        assertEquals(new BigDecimal("220.00"), preview.getMemberFee().getAmount());

        RegistrationFeeData nothing = aggregationService.precomputeFee(eventId,
            new FeePreview(Set.of(), Map.of(), true, false));
        assertEquals(new BigDecimal("0.00"), nothing.getAmount());
        assertEquals(new BigDecimal("235.50"), amountOwed(anna));

        printSuccess("Dry run computed");
    }

    @Test
    @DisplayName("Statistics only count fully paid registrations as paid")
    void testFeeStats() {
        printTestHeader("Fee Statistics");

        createAcademyFees();
        assertEquals(new BigDecimal("235.50"), aggregationService.bookRegistrationPayment(anna, new BigDecimal("235.50")));
        aggregationService.bookRegistrationPayment(bert, new BigDecimal("100.00"));

        FeeStats stats = aggregationService.getFeeStats(eventId);
        printOutput("Stats", stats);

        assertEquals(new BigDecimal("360.00"), stats.getOwed().get(FeeKind.REGULAR));
        assertEquals(new BigDecimal("8.00"), stats.getOwed().get(FeeKind.SURCHARGE));
        assertEquals(new BigDecimal("-70.00"), stats.getOwed().get(FeeKind.DISCOUNT));
        assertEquals(new BigDecimal("15.50"), stats.getOwed().get(FeeKind.SOLIDARY_DONATION));

        assertEquals(new BigDecimal("240.00"), stats.getPaid().get(FeeKind.REGULAR));
        assertNull(stats.getPaid().get(FeeKind.SURCHARGE), "Partial payments are not attributed");
        assertEquals(new BigDecimal("15.50"), stats.getPaid().get(FeeKind.SOLIDARY_DONATION));

        printSuccess("Statistics computed");
    }

    @Test
    @DisplayName("Payments and refunds change the paid amount")
    void testBookRegistrationPayment() {
        printTestHeader("Registration Payment");

        assertEquals(new BigDecimal("50.00"), aggregationService.bookRegistrationPayment(bert, new BigDecimal("50")));
        assertEquals(new BigDecimal("30.00"), aggregationService.bookRegistrationPayment(bert, new BigDecimal("-20")));
        assertThrows(IllegalArgumentException.class, () ->
            aggregationService.bookRegistrationPayment(bert, BigDecimal.ZERO));
        assertThrows(IllegalArgumentException.class, () ->
            aggregationService.bookRegistrationPayment(999_999L, BigDecimal.ONE));

        printSuccess("Payments booked");
    }
}
