package com.flagship.member_ledger.lastschrift.sepa;

import java.text.Normalizer;
import java.util.Map;

/**
 * Restricts free text to the character set banks accept in SEPA files.
 *
 * German umlauts and ligatures are transliterated, other accented letters lose their
 * accent, anything else outside {@code A-Z a-z 0-9 / - ? : ( ) . , +} and space
 * becomes a space.
 */
public final class SepaText {

    private static final String ALLOWED_PUNCTUATION = " /-?:().,+";

    private static final Map<Character, String> TRANSLITERATIONS = Map.ofEntries(
        Map.entry('ä', "ae"), Map.entry('Ä', "AE"), Map.entry('æ', "ae"), Map.entry('Æ', "AE"),
        Map.entry('ö', "oe"), Map.entry('Ö', "Oe"), Map.entry('ø', "oe"), Map.entry('Ø', "Oe"),
        Map.entry('œ', "oe"), Map.entry('Œ', "Oe"),
        Map.entry('ü', "ue"), Map.entry('Ü', "Ue"),
        Map.entry('ß', "ss"),
        Map.entry('ł', "l"), Map.entry('Ł', "L")
    );

    private SepaText() {
    }

    public static String asciify(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder result = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            String transliterated = TRANSLITERATIONS.get(c);
            if (transliterated != null) {
                result.append(transliterated);
                continue;
            }
            char base = stripAccent(c);
            if (isAllowed(base)) {
                result.append(base);
            } else {
                result.append(' ');
            }
        }
        return result.toString();
    }

    /**
     * Asciifies and cuts to {@code maxLength} characters.
     */
    public static String asciify(String text, int maxLength) {
        String ascii = asciify(text);
        return ascii.length() <= maxLength ? ascii : ascii.substring(0, maxLength);
    }

    private static char stripAccent(char c) {
        if (c < 128) {
            return c;
        }
        String decomposed = Normalizer.normalize(String.valueOf(c), Normalizer.Form.NFD);
        return decomposed.charAt(0);
    }

    private static boolean isAllowed(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
            || ALLOWED_PUNCTUATION.indexOf(c) >= 0;
    }
}
