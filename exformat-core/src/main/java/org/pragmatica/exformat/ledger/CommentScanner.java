package org.pragmatica.exformat.ledger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Lexical scan of Elixir source locating comments.
 * <p>
 * Tracks strings, char lists, heredocs, sigils and {@code #{...}} interpolation so that
 * a {@code #} inside a literal is never taken for a comment, and reports which lines
 * begin inside a multi-line literal.
 */
public final class CommentScanner {
    /**
     * Comment following code on the same line.
     *
     * @param line   1-based line number
     * @param column 0-based column of the {@code #}
     * @param text   comment text starting with {@code #}, trailing whitespace removed
     */
    public record InlineComment(int line, int column, String text) {}

    /**
     * Result of a scan.
     *
     * @param literalLines   lines whose first character lies inside a string, heredoc or sigil
     * @param inlineComments trailing comments by line
     */
    public record Scan(Set<Integer> literalLines, Map<Integer, InlineComment> inlineComments) {
        public Scan {
            literalLines = Set.copyOf(literalLines);
            inlineComments = Map.copyOf(inlineComments);
        }

        public boolean startsInLiteral(int line) {
            return literalLines.contains(line);
        }
    }

    private static final String SIGIL_OPENERS = "/|\"'([{<";
    private static final String SIGIL_CLOSERS = "/|\"')]}>";

    private sealed interface Frame permits Code, Text {}

    /// Code nested in an interpolation when {@code interpolation} is set; braces are counted to find its end.
    private static final class Code implements Frame {
        private final boolean interpolation;
        private int braces;

        private Code(boolean interpolation) {
            this.interpolation = interpolation;
        }
    }

    private record Text(String terminator, boolean interpolates) implements Frame {}

    private final String source;
    private final Deque<Frame> frames = new ArrayDeque<>();
    private final Set<Integer> literalLines = new HashSet<>();
    private final Map<Integer, InlineComment> inlineComments = new HashMap<>();
    private int pos;
    private int line = 1;
    private int lineStart;

    private CommentScanner(String source) {
        this.source = source;
        frames.push(new Code(false));
    }

    public static Scan scan(String source) {
        return new CommentScanner(source).run();
    }

    private Scan run() {
        while (pos < source.length()) {
            if (frames.peek() instanceof Text text) {
                scanText(text);
            } else {
                scanCode((Code) frames.peek());
            }
        }
        return new Scan(literalLines, inlineComments);
    }

    private void scanCode(Code frame) {
        var c = source.charAt(pos);

        switch (c) {
            case '\n' -> newLine();
            case '#' -> comment();
            case '"', '\'' -> openQuote(c);
            case '~' -> sigilOrOperator();
            case '?' -> charLiteralOrOperator();
            case '{' -> {
                frame.braces++;
                pos++;
            }
            case '}' -> {
                if (frame.interpolation && frame.braces == 0) {
                    frames.pop();
                } else {
                    frame.braces--;
                }
                pos++;
            }
            default -> pos++;
        }
    }

    private void scanText(Text frame) {
        var c = source.charAt(pos);

        if (c == '\n') {
            newLine();
            return;
        }
        if (c == '\\') {
            pos += pos + 1 < source.length() && source.charAt(pos + 1) != '\n'
                   ? 2
                   : 1;
            return;
        }
        if (frame.interpolates() && source.startsWith("#{", pos)) {
            frames.push(new Code(true));
            pos += 2;
            return;
        }
        if (source.startsWith(frame.terminator(), pos)) {
            frames.pop();
            pos += frame.terminator()
                        .length();
            return;
        }
        pos++;
    }

    private void newLine() {
        pos++;
        line++;
        lineStart = pos;

        if (frames.peek() instanceof Text) {
            literalLines.add(line);
        }
    }

    private void comment() {
        var end = source.indexOf('\n', pos);
        end = end < 0
              ? source.length()
              : end;

        if (!source.substring(lineStart, pos)
                   .isBlank()) {
            var text = source.substring(pos, end)
                             .stripTrailing();
            inlineComments.putIfAbsent(line, new InlineComment(line, pos - lineStart, text));
        }
        pos = end;
    }

    private void openQuote(char quote) {
        var triple = String.valueOf(quote)
                           .repeat(3);

        if (source.startsWith(triple, pos)) {
            frames.push(new Text(triple, true));
            pos += 3;
        } else {
            frames.push(new Text(String.valueOf(quote), true));
            pos++;
        }
    }

    private void sigilOrOperator() {
        var letterAt = pos + 1;

        if (letterAt + 1 < source.length() && Character.isLetter(source.charAt(letterAt))) {
            var letter = source.charAt(letterAt);
            var delimiterAt = letterAt + 1;
            var opener = source.charAt(delimiterAt);
            var index = SIGIL_OPENERS.indexOf(opener);

            if (index >= 0) {
                var interpolates = Character.isLowerCase(letter);
                var triple = String.valueOf(opener)
                                   .repeat(3);

                if ((opener == '"' || opener == '\'') && source.startsWith(triple, delimiterAt)) {
                    frames.push(new Text(triple, interpolates));
                    pos = delimiterAt + 3;
                } else {
                    frames.push(new Text(String.valueOf(SIGIL_CLOSERS.charAt(index)), interpolates));
                    pos = delimiterAt + 1;
                }
                return;
            }
        }
        pos++;
    }

    private void charLiteralOrOperator() {
        if (pos > 0 && isIdentifierChar(source.charAt(pos - 1)) || pos + 1 >= source.length()) {
            pos++;
            return;
        }

        var next = source.charAt(pos + 1);

        if (Character.isWhitespace(next)) {
            pos++;
        } else if (next == '\\') {
            pos = Math.min(source.length(), pos + 3);
        } else {
            pos += 2;
        }
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '?' || c == '!';
    }
}
