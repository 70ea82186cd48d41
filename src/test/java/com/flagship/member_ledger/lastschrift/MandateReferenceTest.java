package com.flagship.member_ledger.lastschrift;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MandateReferenceTest {

    @Test
    @DisplayName("Check digit is the weighted mod-11 checksum")
    void testCheckDigit() {
        assertEquals('9', MandateReference.checkDigit(1));
        assertEquals('7', MandateReference.checkDigit(2));
        assertEquals('5', MandateReference.checkDigit(3));
        assertEquals('8', MandateReference.checkDigit(10));
        assertEquals('6', MandateReference.checkDigit(42));
        assertEquals('5', MandateReference.checkDigit(12345));
    }

    @Test
    @DisplayName("Ten is written as X")
    void testCheckDigitTen() {
        // 6 * 2 = 12, -12 mod 11 = 10
        assertEquals('X', MandateReference.checkDigit(6));
    }

    @Test
    @DisplayName("Reference combines prefix, persona and mandate id")
    void testReference() {
        assertEquals("CDE-I25-2-7-3-5", MandateReference.of("CDE-I25", 2, 3));
        assertEquals("CDE-I25-42-6-10-8", MandateReference.of("CDE-I25", 42, 10));
    }

    @Test
    @DisplayName("Non-positive ids have no check digit")
    void testNonPositiveRejected() {
        assertThrows(IllegalArgumentException.class, () -> MandateReference.checkDigit(0));
        assertThrows(IllegalArgumentException.class, () -> MandateReference.checkDigit(-5));
    }
}
