package org.pragmatica.exformat;

import org.pragmatica.exformat.shared.SourceFile;

/**
 * Elixir source formatter.
 */
public interface Formatter {
    /**
     * Format source into canonical layout.
     */
    SourceFile format(SourceFile source) throws FormattingError;

    /**
     * Check whether source already has canonical layout.
     */
    boolean isFormatted(SourceFile source) throws FormattingError;

    FormatterConfig config();
}
