package org.pragmatica.exformat.printer;

import org.pragmatica.exformat.ast.Node;

/**
 * Restores comments and blank lines recorded in node metadata around the rendered text.
 */
public final class LayoutDecorator implements Decorator {
    public static final LayoutDecorator INSTANCE = new LayoutDecorator();

    private LayoutDecorator() {}

    @Override
    public String decorate(Node node, String text) {
        var meta = node.meta();

        if (meta.prefixComments()
                .isEmpty() && !meta.prefixBlank() && meta.suffixComments()
                                                         .isEmpty()) {
            return text;
        }

        var builder = new StringBuilder(meta.prefixComments());

        if (meta.prefixBlank()) {
            builder.append('\n');
        }
        return builder.append(text)
                      .append(meta.suffixComments())
                      .toString();
    }
}
