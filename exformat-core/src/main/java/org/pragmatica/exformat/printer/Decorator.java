package org.pragmatica.exformat.printer;

import org.pragmatica.exformat.ast.Node;

/**
 * Hook applied by the renderer to the text of every node.
 */
@FunctionalInterface
public interface Decorator {
    Decorator IDENTITY = (node, text) -> text;

    String decorate(Node node, String text);
}
