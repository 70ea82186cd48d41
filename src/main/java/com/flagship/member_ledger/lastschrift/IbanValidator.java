package com.flagship.member_ledger.lastschrift;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Map;

/**
 * IBAN normalisation and ISO 13616 checksum validation.
 *
 * Only countries of the SEPA area are accepted, with their fixed IBAN lengths.
 */
public final class IbanValidator {

    private static final BigInteger NINETY_SEVEN = BigInteger.valueOf(97);

    private static final Map<String, Integer> LENGTHS = Map.ofEntries(
        Map.entry("AD", 24), Map.entry("AT", 20), Map.entry("BE", 16), Map.entry("BG", 22),
        Map.entry("CH", 21), Map.entry("CY", 28), Map.entry("CZ", 24), Map.entry("DE", 22),
        Map.entry("DK", 18), Map.entry("EE", 20), Map.entry("ES", 24), Map.entry("FI", 18),
        Map.entry("FR", 27), Map.entry("GB", 22), Map.entry("GI", 23), Map.entry("GR", 27),
        Map.entry("HR", 21), Map.entry("HU", 28), Map.entry("IE", 22), Map.entry("IS", 26),
        Map.entry("IT", 27), Map.entry("LI", 21), Map.entry("LT", 20), Map.entry("LU", 20),
        Map.entry("LV", 21), Map.entry("MC", 27), Map.entry("MT", 31), Map.entry("NL", 18),
        Map.entry("NO", 15), Map.entry("PL", 28), Map.entry("PT", 25), Map.entry("RO", 24),
        Map.entry("SE", 24), Map.entry("SI", 19), Map.entry("SK", 24), Map.entry("SM", 27),
        Map.entry("VA", 22)
    );

    private IbanValidator() {
    }

    /**
     * Strips whitespace, upper-cases and validates.
     *
     * @return the IBAN in electronic format, e.g. {@code DE89370400440532013000}
     * @throws IllegalArgumentException naming the first problem found
     */
    public static String normalize(String iban) {
        if (iban == null || iban.isBlank()) {
            throw new IllegalArgumentException("IBAN is required");
        }
        String value = iban.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        if (value.length() < 5) {
            throw new IllegalArgumentException("IBAN is too short: " + iban);
        }
        for (char c : value.toCharArray()) {
            if (!(c >= '0' && c <= '9') && !(c >= 'A' && c <= 'Z')) {
                throw new IllegalArgumentException("Invalid character in IBAN: " + c);
            }
        }
        String country = value.substring(0, 2);
        Integer expected = LENGTHS.get(country);
        if (expected == null) {
            throw new IllegalArgumentException("Unknown or unsupported country code: " + country);
        }
        if (value.length() != expected) {
            throw new IllegalArgumentException(String.format(
                "Invalid length %d for country code %s, expected %d", value.length(), country, expected));
        }
        if (!hasValidChecksum(value)) {
            throw new IllegalArgumentException("Invalid IBAN checksum: " + value);
        }
        return value;
    }

    public static boolean isValid(String iban) {
        try {
            normalize(iban);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    // country code and check digits move to the end, letters become 10..35
    private static boolean hasValidChecksum(String iban) {
        String rearranged = iban.substring(4) + iban.substring(0, 4);
        StringBuilder digits = new StringBuilder(rearranged.length() * 2);
        for (char c : rearranged.toCharArray()) {
            if (Character.isDigit(c)) {
                digits.append(c);
            } else {
                digits.append(10 + c - 'A');
            }
        }
        return new BigInteger(digits.toString()).mod(NINETY_SEVEN).intValue() == 1;
    }
}
