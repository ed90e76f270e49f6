package org.pragmatica.exformat;

import org.pragmatica.exformat.ast.Node;
import org.pragmatica.exformat.shared.SourceFile;

/**
 * Parser collaborator turning Elixir source text into a syntax tree.
 * <p>
 * Implementations must report the originating line of every node they know it for;
 * the formatter uses line numbers to place comments and blank lines.
 */
@FunctionalInterface
public interface SourceParser {
    Node parse(SourceFile source) throws FormattingError;
}
