package org.pragmatica.exformat;

/**
 * Errors raised while formatting Elixir sources.
 */
public abstract sealed class FormattingError extends Exception {
    private FormattingError(String message) {
        super(message);
    }

    /**
     * Source could not be parsed by the parser collaborator.
     */
    public static final class ParseError extends FormattingError {
        private final String fileName;
        private final int line;
        private final int column;
        private final String detail;

        private ParseError(String fileName, int line, int column, String detail) {
            super(String.format("Parse error in %s at %d:%d: %s", fileName, line, column, detail));
            this.fileName = fileName;
            this.line = line;
            this.column = column;
            this.detail = detail;
        }

        public String fileName() {
            return fileName;
        }

        public int line() {
            return line;
        }

        public int column() {
            return column;
        }

        public String detail() {
            return detail;
        }
    }

    /**
     * Configuration value rejected while loading {@link FormatterConfig}.
     */
    public static final class InvalidConfig extends FormattingError {
        private final String key;
        private final String value;
        private final String reason;

        private InvalidConfig(String key, String value, String reason) {
            super(String.format("Invalid value '%s' for %s: %s", value, key, reason));
            this.key = key;
            this.value = value;
            this.reason = reason;
        }

        public String key() {
            return key;
        }

        public String value() {
            return value;
        }

        public String reason() {
            return reason;
        }
    }

    public static ParseError parseError(String fileName, int line, int column, String detail) {
        return new ParseError(fileName, line, column, detail);
    }

    public static InvalidConfig invalidConfig(String key, String value, String reason) {
        return new InvalidConfig(key, value, reason);
    }
}
