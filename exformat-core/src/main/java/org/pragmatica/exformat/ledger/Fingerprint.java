package org.pragmatica.exformat.ledger;

import java.util.regex.Pattern;

/**
 * Whitespace- and punctuation-insensitive identity of a source line.
 * <p>
 * Two different lines may share a fingerprint; a comment may then be reattached
 * to the wrong one of them.
 */
public final class Fingerprint {
    private static final Pattern NON_WORD = Pattern.compile("\\W+", Pattern.UNICODE_CHARACTER_CLASS);

    private Fingerprint() {}

    public static String of(String line) {
        return NON_WORD.matcher(line)
                       .replaceAll("");
    }
}
