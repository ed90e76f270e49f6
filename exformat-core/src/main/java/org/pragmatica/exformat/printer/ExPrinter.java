package org.pragmatica.exformat.printer;

import org.pragmatica.exformat.FormatterConfig;
import org.pragmatica.exformat.annotate.AnnotatedTree;

/**
 * Printer producing canonical Elixir source from an annotated tree.
 *
 * Key style features:
 * - 2 space indentation
 * - containers break one element per line past the configured line width
 * - comments and blank lines restored from the original source
 */
public final class ExPrinter {
    private final FormatterConfig config;

    private ExPrinter(FormatterConfig config) {
        this.config = config;
    }

    /**
     * Factory method to create a printer.
     */
    public static ExPrinter exPrinter(FormatterConfig config) {
        return new ExPrinter(config);
    }

    /**
     * Print the tree, decorating nodes with their comments and reattaching trailing comments.
     */
    public String print(AnnotatedTree tree) {
        var renderer = ExRenderer.exRenderer(config.lineWidth(), tree.ledger(), LayoutDecorator.INSTANCE);
        var rendered = renderer.render(tree.root(), tree.renderState());
        return CommentReinjector.reinject(rendered, tree.ledger());
    }
}
