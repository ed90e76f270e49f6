package org.pragmatica.exformat.printer;

import org.pragmatica.exformat.ast.LiteralFormat;

import java.math.BigInteger;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Source notation of literal values.
 */
public final class Literals {
    private static final Pattern IDENTIFIER = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_@]*[?!]?");
    private static final Pattern ALIAS = Pattern.compile("[A-Z][\\p{L}\\p{N}_]*(\\.[A-Z][\\p{L}\\p{N}_]*)*");
    private static final Set<String> BARE_ATOMS = Set.of("true", "false", "nil");
    private static final Set<String> OPERATOR_ATOMS = Set.of("+", "-", "*", "/", "==", "!=", "===", "!==", "<", ">", "<=",
                                                             ">=", "&&", "||", "!", "<>", "++", "--", "|>", "=", "..",
                                                             "...", "&", "@", "^", "~~~", "<<<", ">>>", "|||", "&&&",
                                                             "^^^", "=~", "::", "<-", "\\\\", "<~", "~>", "<<~", "~>>",
                                                             "<~>", "<|>", "->", "%", "{}", "%{}", "<<>>", ".");
    private static final int GROUPING_THRESHOLD = 6;

    private Literals() {}

    /**
     * Integer in its source notation.
     */
    public static String integer(Number value, LiteralFormat format) {
        var number = value instanceof BigInteger big
                     ? big
                     : BigInteger.valueOf(value.longValue());

        return switch (format) {
            case HEXADECIMAL -> "0x" + number.toString(16)
                                             .toUpperCase(Locale.ROOT);
            case OCTAL -> "0o" + number.toString(8);
            case BINARY -> "0b" + number.toString(2);
            case CHAR -> character(number.intValueExact()).orElseGet(number::toString);
            default -> grouped(number.toString());
        };
    }

    /// Underscores every three digits, for numbers of six digits or more.
    static String grouped(String digits) {
        var sign = digits.startsWith("-")
                   ? "-"
                   : "";
        var body = digits.substring(sign.length());

        if (body.length() < GROUPING_THRESHOLD) {
            return digits;
        }

        var builder = new StringBuilder();
        var head = body.length() % 3;

        if (head > 0) {
            builder.append(body, 0, head);
        }
        for (int i = head; i < body.length(); i += 3) {
            if (builder.length() > 0) {
                builder.append('_');
            }
            builder.append(body, i, i + 3);
        }
        return sign + builder;
    }

    /**
     * Character literal {@code ?c}; empty for control characters without a named escape.
     */
    public static Optional<String> character(int codepoint) {
        var escape = characterEscape(codepoint);

        if (escape != null) {
            return Optional.of("?" + escape);
        }
        if (Character.isISOControl(codepoint)) {
            return Optional.empty();
        }
        return Optional.of("?" + new String(Character.toChars(codepoint)));
    }

    private static String characterEscape(int codepoint) {
        return switch (codepoint) {
            case ' ' -> "\\s";
            case 0 -> "\\0";
            case '\\' -> "\\\\";
            case '"' -> "\\\"";
            default -> controlEscape(codepoint);
        };
    }

    private static String controlEscape(int codepoint) {
        return switch (codepoint) {
            case '\n' -> "\\n";
            case '\t' -> "\\t";
            case '\r' -> "\\r";
            case 0x0B -> "\\v";
            case '\f' -> "\\f";
            case '\b' -> "\\b";
            case 0x07 -> "\\a";
            case 0x1B -> "\\e";
            default -> null;
        };
    }

    public static String floating(double value) {
        return Double.toString(value)
                     .replace('E', 'e');
    }

    /**
     * Double-quoted string.
     */
    public static String string(String value) {
        return "\"" + escape(value, '"') + "\"";
    }

    /**
     * Single-quoted char list.
     */
    public static String charList(String value) {
        return "'" + escape(value, '\'') + "'";
    }

    /**
     * Escape text placed between {@code quote} characters.
     */
    public static String escape(String value, char quote) {
        var builder = new StringBuilder(value.length());

        for (int i = 0; i < value.length(); i++) {
            var c = value.charAt(i);

            if (c == quote || c == '\\') {
                builder.append('\\')
                       .append(c);
            } else if (c == '#' && i + 1 < value.length() && value.charAt(i + 1) == '{') {
                builder.append("\\#");
            } else if (c == 0) {
                builder.append("\\0");
            } else if (controlEscape(c) != null) {
                builder.append(controlEscape(c));
            } else if (Character.isISOControl(c)) {
                builder.append(String.format("\\x%02X", (int) c));
            } else {
                builder.append(c);
            }
        }
        return builder.toString();
    }

    /**
     * Atom as written in code: {@code true}, {@code :ok}, {@code :"with space"}.
     */
    public static String atom(String name) {
        if (BARE_ATOMS.contains(name)) {
            return name;
        }
        if (IDENTIFIER.matcher(name)
                      .matches() || OPERATOR_ATOMS.contains(name)) {
            return ":" + name;
        }
        if (name.startsWith("Elixir.") && ALIAS.matcher(name.substring("Elixir.".length()))
                                                .matches()) {
            return name.substring("Elixir.".length());
        }
        return ":" + string(name);
    }

    /**
     * Key of a keyword list entry including the colon: {@code key:} or {@code "odd key":}.
     */
    public static String keywordKey(String name) {
        return IDENTIFIER.matcher(name)
                         .matches()
               ? name + ":"
               : string(name) + ":";
    }

    /**
     * Generic notation for values outside the modeled literal shapes.
     */
    public static String inspect(Object value) {
        if (value == null) {
            return "nil";
        }
        if (value instanceof String text) {
            return string(text);
        }
        if (value instanceof Boolean flag) {
            return flag.toString();
        }
        if (value instanceof Double || value instanceof Float) {
            return floating(((Number) value).doubleValue());
        }
        if (value instanceof Long || value instanceof Integer || value instanceof BigInteger) {
            return integer((Number) value, LiteralFormat.DECIMAL);
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream()
                             .map(Literals::inspect)
                             .collect(Collectors.joining(", ", "[", "]"));
        }
        if (value instanceof Map<?, ?> map) {
            return map.entrySet()
                      .stream()
                      .map(entry -> inspect(entry.getKey()) + " => " + inspect(entry.getValue()))
                      .collect(Collectors.joining(", ", "%{", "}"));
        }
        return value.toString();
    }
}
