package com.flagship.member_ledger.lastschrift;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Collection dates are moved off weekends and TARGET2 holidays.
 */
class PaymentDateCalculatorTest {

    private static final int OFFSET = 17;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printResult(LocalDate issued, LocalDate payment) {
        System.out.println("INPUT  - Issued: " + issued + " (+" + OFFSET + " days)");
        System.out.println("OUTPUT - Payment date: " + payment + " (" + payment.getDayOfWeek() + ")");
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private LocalDate paymentDate(LocalDate issued) {
        LocalDate payment = PaymentDateCalculator.paymentDate(issued, OFFSET);
        printResult(issued, payment);
        return payment;
    }

    @Test
    @DisplayName("Easter Sunday is computed for several years")
    void testEasterSunday() {
        printTestHeader("Easter Sunday");

        assertEquals(LocalDate.of(2024, 3, 31), PaymentDateCalculator.easterSunday(2024));
        assertEquals(LocalDate.of(2025, 4, 20), PaymentDateCalculator.easterSunday(2025));
        assertEquals(LocalDate.of(2026, 4, 5), PaymentDateCalculator.easterSunday(2026));
        assertEquals(LocalDate.of(2027, 3, 28), PaymentDateCalculator.easterSunday(2027));
        printSuccess("Easter dates correct");
    }

    @Test
    @DisplayName("A plain business day is kept")
    void testBusinessDayKept() {
        printTestHeader("Plain Business Day");

        assertEquals(LocalDate.of(2026, 9, 18), paymentDate(LocalDate.of(2026, 9, 1)));
        assertEquals(LocalDate.of(2026, 4, 2), paymentDate(LocalDate.of(2026, 3, 16)));
        printSuccess("Date unchanged");
    }

    @Test
    @DisplayName("Saturday moves to Monday")
    void testWeekendMovesToMonday() {
        printTestHeader("Weekend");

        assertEquals(LocalDate.of(2026, 9, 21), paymentDate(LocalDate.of(2026, 9, 2)));
        printSuccess("Moved to Monday");
    }

    @Test
    @DisplayName("Good Friday and Easter Monday move to the Tuesday after Easter")
    void testEasterHolidays() {
        printTestHeader("Easter Holidays");

        assertEquals(LocalDate.of(2025, 4, 22), paymentDate(LocalDate.of(2025, 4, 1)), "Good Friday");
        assertEquals(LocalDate.of(2025, 4, 22), paymentDate(LocalDate.of(2025, 4, 4)), "Easter Monday");
        assertEquals(LocalDate.of(2026, 4, 7), paymentDate(LocalDate.of(2026, 3, 18)), "Easter Saturday");
        assertEquals(LocalDate.of(2026, 4, 7), paymentDate(LocalDate.of(2026, 3, 19)), "Easter Sunday");
        printSuccess("Easter holidays skipped");
    }

    @Test
    @DisplayName("Fixed holidays are skipped without landing on a weekend")
    void testFixedHolidays() {
        printTestHeader("Fixed Holidays");

        assertEquals(LocalDate.of(2026, 1, 2), paymentDate(LocalDate.of(2025, 12, 15)), "New Year");
        assertEquals(LocalDate.of(2026, 5, 4), paymentDate(LocalDate.of(2026, 4, 14)), "Labour Day on a Friday");
        assertEquals(LocalDate.of(2025, 12, 29), paymentDate(LocalDate.of(2025, 12, 8)), "Christmas on a Thursday");
        assertEquals(LocalDate.of(2026, 12, 28), paymentDate(LocalDate.of(2026, 12, 8)), "Christmas on a Friday");
        assertEquals(LocalDate.of(2027, 12, 27), paymentDate(LocalDate.of(2027, 12, 8)), "Christmas on a Saturday");
        printSuccess("Holidays skipped");
    }

    @Test
    @DisplayName("Every computed date is a TARGET2 business day")
    void testResultIsAlwaysBusinessDay() {
        printTestHeader("Always A Business Day");

        LocalDate issued = LocalDate.of(2024, 1, 1);
        for (int i = 0; i < 3 * 366; i++) {
            LocalDate day = issued.plusDays(i);
            LocalDate payment = PaymentDateCalculator.paymentDate(day, OFFSET);
            assertTrue(PaymentDateCalculator.isBusinessDay(payment), "Not a business day: " + payment);
            assertFalse(payment.isBefore(day.plusDays(OFFSET)), "Moved backwards: " + payment);
        }
        printSuccess("Three years of dates checked");
    }

    @Test
    @DisplayName("Business day check knows weekends and holidays")
    void testIsBusinessDay() {
        printTestHeader("Business Day Check");

        assertFalse(PaymentDateCalculator.isBusinessDay(LocalDate.of(2026, 4, 3)), "Good Friday");
        assertFalse(PaymentDateCalculator.isBusinessDay(LocalDate.of(2026, 4, 6)), "Easter Monday");
        assertFalse(PaymentDateCalculator.isBusinessDay(LocalDate.of(2026, 12, 26)), "Boxing Day");
        assertFalse(PaymentDateCalculator.isBusinessDay(LocalDate.of(2026, 10, 18)), "Sunday");
        assertTrue(PaymentDateCalculator.isBusinessDay(LocalDate.of(2026, 4, 7)));
        printSuccess("Business days classified");
    }
}
