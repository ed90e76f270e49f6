package org.pragmatica.exformat;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configuration for the Elixir formatter.
 *
 * @param lineWidth      maximal width of a single-line layout, in code points
 * @param parenlessCalls local calls always rendered without argument parentheses
 */
public record FormatterConfig(int lineWidth, Set<String> parenlessCalls) {
    public static final String LINE_WIDTH = "line-width";
    public static final String PARENLESS_CALLS = "parenless-calls";

    /**
     * Default formatter configuration.
     */
    public static final FormatterConfig DEFAULT = new FormatterConfig(80,
                                                                      Set.of("use",
                                                                             "import",
                                                                             "not",
                                                                             "alias",
                                                                             "try",
                                                                             "raise",
                                                                             "reraise",
                                                                             "defexception",
                                                                             "require"));

    public FormatterConfig {
        if (lineWidth <= 0) {
            throw new IllegalArgumentException("Line width must be positive: " + lineWidth);
        }
        parenlessCalls = Set.copyOf(parenlessCalls);
    }

    /**
     * Factory method for default config.
     */
    public static FormatterConfig defaultConfig() {
        return DEFAULT;
    }

    /**
     * Read configuration from properties. Missing keys keep their defaults;
     * {@code parenless-calls} replaces the default set.
     */
    public static FormatterConfig fromProperties(Properties properties) throws FormattingError {
        var config = DEFAULT;
        var width = properties.getProperty(LINE_WIDTH);

        if (width != null) {
            config = config.withLineWidth(parseLineWidth(width.strip()));
        }

        var calls = properties.getProperty(PARENLESS_CALLS);

        if (calls != null) {
            config = new FormatterConfig(config.lineWidth(), parseCallNames(calls));
        }
        return config;
    }

    /**
     * Builder-style method to set line width.
     */
    public FormatterConfig withLineWidth(int lineWidth) {
        return new FormatterConfig(lineWidth, parenlessCalls);
    }

    /**
     * Builder-style method to add a call rendered without parentheses.
     */
    public FormatterConfig withParenlessCall(String name) {
        var names = new HashSet<>(parenlessCalls);
        names.add(name);
        return new FormatterConfig(lineWidth, names);
    }

    private static int parseLineWidth(String value) throws FormattingError {
        int width;

        try {
            width = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw FormattingError.invalidConfig(LINE_WIDTH, value, "not an integer");
        }

        if (width <= 0) {
            throw FormattingError.invalidConfig(LINE_WIDTH, value, "must be positive");
        }
        return width;
    }

    private static Set<String> parseCallNames(String value) throws FormattingError {
        var names = Arrays.stream(value.split(","))
                          .map(String::strip)
                          .filter(name -> !name.isEmpty())
                          .collect(Collectors.toSet());

        for (var name : names) {
            if (!name.matches("[a-z_][a-zA-Z0-9_]*[?!]?")) {
                throw FormattingError.invalidConfig(PARENLESS_CALLS, name, "not a valid function name");
            }
        }
        return names;
    }
}
