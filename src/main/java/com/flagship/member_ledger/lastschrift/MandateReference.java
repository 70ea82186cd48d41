package com.flagship.member_ledger.lastschrift;

/**
 * Builds the SEPA mandate reference of a mandate:
 * {@code <prefix>-<persona id>-<check>-<mandate id>-<check>}, e.g. {@code CDE-I25-2-7-3-5}.
 *
 * The check character is a weighted mod-11 sum over the decimal digits, using
 * {@code X} for ten.
 */
public final class MandateReference {

    private static final String CHECK_CHARACTERS = "0123456789X";

    private MandateReference() {
    }

    public static String of(String prefix, long personaId, long mandateId) {
        return prefix + "-" + personaId + "-" + checkDigit(personaId)
            + "-" + mandateId + "-" + checkDigit(mandateId);
    }

    /**
     * Check character of a positive number. The least significant digit has weight 2,
     * the next one 3, and so on.
     */
    public static char checkDigit(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("Only positive ids have a check digit: " + value);
        }
        String digits = Long.toString(value);
        int sum = 0;
        for (int i = 0; i < digits.length(); i++) {
            int digit = digits.charAt(digits.length() - 1 - i) - '0';
            sum += (i + 2) * digit;
        }
        return CHECK_CHARACTERS.charAt(Math.floorMod(-sum, 11));
    }
}
