package org.pragmatica.exformat.ledger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line-indexed view of the original source used to recover comments and blank lines.
 * <p>
 * Whole-line comments are handed out once, to the first node that claims them, and are
 * then marked {@link LineKind#CONSUMED}. Trailing comments are queued per line
 * {@link Fingerprint} and handed out in source order. A trailing comment after punctuation
 * only ({@code ] # done}) has no fingerprint to match and is kept aside as unkeyed.
 * <p>
 * Not thread-safe; one instance serves a single formatting invocation.
 */
public final class SourceLedger {
    public enum LineKind {
        BLANK,
        COMMENT,
        CODE,
        CONSUMED
    }

    private static final Logger log = LoggerFactory.getLogger(SourceLedger.class);

    private static final Pattern CLOSING_ONLY = Pattern.compile("^(?:[)\\]},]|>>)+$");

    private final List<String> lines;
    private final LineKind[] kinds;
    private final Map<String, Deque<String>> inlineComments;
    private final List<String> unkeyedComments;

    private SourceLedger(List<String> lines,
                         LineKind[] kinds,
                         Map<String, Deque<String>> inlineComments,
                         List<String> unkeyedComments) {
        this.lines = lines;
        this.kinds = kinds;
        this.inlineComments = inlineComments;
        this.unkeyedComments = unkeyedComments;
    }

    public static SourceLedger sourceLedger(String content) {
        var rawLines = content.split("\n", -1);
        var scan = CommentScanner.scan(content);
        var lines = new ArrayList<String>(rawLines.length);
        var kinds = new LineKind[rawLines.length + 1];
        var inlineComments = new HashMap<String, Deque<String>>();
        var unkeyedComments = new ArrayList<String>();

        for (int i = 0; i < rawLines.length; i++) {
            var number = i + 1;
            var trimmed = rawLines[i].strip();

            lines.add(trimmed);
            kinds[number] = classify(trimmed, scan.startsInLiteral(number));

            var inline = scan.inlineComments()
                             .get(number);

            if (inline != null) {
                var fingerprint = Fingerprint.of(rawLines[i].substring(0, inline.column()));

                if (fingerprint.isEmpty()) {
                    log.debug("Trailing comment at line {} follows punctuation only and cannot be placed: {}",
                              number,
                              inline.text());
                    unkeyedComments.add(inline.text());
                } else {
                    inlineComments.computeIfAbsent(fingerprint, key -> new ArrayDeque<>())
                                  .addLast(inline.text());
                }
            }
        }
        return new SourceLedger(List.copyOf(lines), kinds, inlineComments, List.copyOf(unkeyedComments));
    }

    private static LineKind classify(String trimmed, boolean insideLiteral) {
        if (insideLiteral) {
            return LineKind.CODE;
        }
        if (trimmed.isEmpty()) {
            return LineKind.BLANK;
        }
        return trimmed.startsWith("#")
               ? LineKind.COMMENT
               : LineKind.CODE;
    }

    public int lineCount() {
        return lines.size();
    }

    /**
     * Trimmed text of a 1-based line, empty outside the source.
     */
    public String line(int number) {
        return inRange(number)
               ? lines.get(number - 1)
               : "";
    }

    /**
     * Kind of a 1-based line. Lines outside the source read as code, which ends every walk.
     */
    public LineKind kind(int number) {
        return inRange(number)
               ? kinds[number]
               : LineKind.CODE;
    }

    public boolean isBlank(int number) {
        return kind(number) == LineKind.BLANK;
    }

    /**
     * First whitespace-separated token of a line, empty for blank or unknown lines.
     */
    public String firstToken(int number) {
        var text = line(number);
        var end = 0;

        while (end < text.length() && !Character.isWhitespace(text.charAt(end))) {
            end++;
        }
        return text.substring(0, end);
    }

    public boolean isClosingOnly(int number) {
        return kind(number) == LineKind.CODE && CLOSING_ONLY.matcher(line(number))
                                                            .matches();
    }

    /**
     * Claim the comment lines directly above {@code from}, walking upward over blank and
     * comment lines but not below {@code floor}. Each comment is returned as its own line,
     * preceded by an empty line when a blank line separated it from the code above.
     */
    public String takePrefixComments(int from, int floor) {
        var collected = new ArrayList<String>();

        for (var current = from; current >= floor; current--) {
            var kind = kind(current);

            if (kind == LineKind.BLANK) {
                continue;
            }
            if (kind != LineKind.COMMENT) {
                break;
            }

            var above = current - 1;
            var separator = above >= floor && isBlank(above)
                            ? "\n"
                            : "";

            collected.add(separator + line(current) + "\n");
            kinds[current] = LineKind.CONSUMED;
        }

        var builder = new StringBuilder();

        for (int i = collected.size() - 1; i >= 0; i--) {
            builder.append(collected.get(i));
        }
        return builder.toString();
    }

    /**
     * Claim the comment lines following a statement that ends at {@code from - 1}.
     * Blank lines, lines already claimed and lines holding only closing delimiters are
     * skipped. Each comment is returned prefixed by a line break.
     */
    public String takeSuffixComments(int from) {
        var builder = new StringBuilder();

        for (var current = from; inRange(current); current++) {
            var kind = kind(current);

            if (kind == LineKind.BLANK || kind == LineKind.CONSUMED || isClosingOnly(current)) {
                continue;
            }
            if (kind != LineKind.COMMENT) {
                break;
            }

            builder.append('\n');

            if (isBlank(current - 1)) {
                builder.append('\n');
            }
            builder.append(line(current));
            kinds[current] = LineKind.CONSUMED;
        }
        return builder.toString();
    }

    /**
     * Next pending trailing comment recorded for lines with the given fingerprint.
     */
    public Optional<String> pollInlineComment(String fingerprint) {
        var queue = inlineComments.get(fingerprint);

        return queue == null
               ? Optional.empty()
               : Optional.ofNullable(queue.pollFirst());
    }

    /**
     * Trailing comments whose line holds no word characters before the {@code #}.
     */
    public List<String> unkeyedComments() {
        return unkeyedComments;
    }

    public int pendingInlineComments() {
        return inlineComments.values()
                             .stream()
                             .mapToInt(Deque::size)
                             .sum();
    }

    private boolean inRange(int number) {
        return number >= 1 && number <= lines.size();
    }
}
