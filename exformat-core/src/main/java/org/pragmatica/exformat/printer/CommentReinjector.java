package org.pragmatica.exformat.printer;

import org.pragmatica.exformat.ledger.Fingerprint;
import org.pragmatica.exformat.ledger.SourceLedger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Puts trailing comments back after the rendered lines they belonged to.
 * <p>
 * A rendered line receives the oldest pending comment recorded for a source line with the
 * same {@link Fingerprint}.
 */
public final class CommentReinjector {
    private static final Logger log = LoggerFactory.getLogger(CommentReinjector.class);

    private CommentReinjector() {}

    /**
     * Strip trailing whitespace from every line and append the matching trailing comments.
     * The result ends with exactly one newline.
     */
    public static String reinject(String rendered, SourceLedger ledger) {
        var lines = rendered.split("\n", -1);
        var builder = new StringBuilder(rendered.length() + 16);

        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                builder.append('\n');
            }

            var line = lines[i].stripTrailing();
            var fingerprint = Fingerprint.of(line);

            builder.append(line);

            if (!fingerprint.isEmpty()) {
                ledger.pollInlineComment(fingerprint)
                      .ifPresent(comment -> builder.append(' ')
                                                   .append(comment));
            }
        }

        var pending = ledger.pendingInlineComments();

        if (pending > 0) {
            log.debug("{} trailing comment(s) found no matching line", pending);
        }
        if (!ledger.unkeyedComments()
                   .isEmpty()) {
            log.debug("Dropped trailing comment(s) without a line fingerprint: {}", ledger.unkeyedComments());
        }
        return ensureTrailingNewline(builder.toString());
    }

    /**
     * Ensure the text ends with exactly one newline.
     */
    private static String ensureTrailingNewline(String output) {
        var end = output.length();

        while (end > 0 && output.charAt(end - 1) == '\n') {
            end--;
        }
        return output.substring(0, end) + "\n";
    }
}
