package org.pragmatica.exformat.annotate;

import org.pragmatica.exformat.ast.Node;
import org.pragmatica.exformat.ledger.SourceLedger;

import java.util.Set;

/**
 * Syntax tree with layout metadata filled in, ready for rendering.
 *
 * @param root           annotated root node
 * @param parenlessCalls configured and discovered parenless call names
 * @param ledger         ledger of the source the tree was parsed from
 */
public record AnnotatedTree(Node root, Set<String> parenlessCalls, SourceLedger ledger) {
    public AnnotatedTree {
        parenlessCalls = Set.copyOf(parenlessCalls);
    }

    public RenderState renderState() {
        return RenderState.renderState(parenlessCalls);
    }
}
