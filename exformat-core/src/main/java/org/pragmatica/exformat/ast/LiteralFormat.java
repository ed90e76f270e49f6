package org.pragmatica.exformat.ast;

/**
 * Source notation of a literal, as reported by the parser.
 */
public enum LiteralFormat {
    DECIMAL,
    HEXADECIMAL,
    OCTAL,
    BINARY,
    CHAR,
    PLAIN_STRING,
    CHAR_LIST,
    BYTE_STRING_HEREDOC,
    CHAR_LIST_HEREDOC,
    NONE;

    public boolean isHeredoc() {
        return this == BYTE_STRING_HEREDOC || this == CHAR_LIST_HEREDOC;
    }
}
