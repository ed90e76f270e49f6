package org.pragmatica.exformat.annotate;

import org.pragmatica.exformat.ast.BinaryOperator;
import org.pragmatica.exformat.ast.Meta;
import org.pragmatica.exformat.ast.Node;
import org.pragmatica.exformat.ast.Node.AccessIndex;
import org.pragmatica.exformat.ast.Node.AnonymousFunction;
import org.pragmatica.exformat.ast.Node.AtomLiteral;
import org.pragmatica.exformat.ast.Node.BinaryOp;
import org.pragmatica.exformat.ast.Node.Bitstring;
import org.pragmatica.exformat.ast.Node.Block;
import org.pragmatica.exformat.ast.Node.Call;
import org.pragmatica.exformat.ast.Node.Capture;
import org.pragmatica.exformat.ast.Node.Clause;
import org.pragmatica.exformat.ast.Node.ClauseList;
import org.pragmatica.exformat.ast.Node.GuardedExpression;
import org.pragmatica.exformat.ast.Node.Interpolation;
import org.pragmatica.exformat.ast.Node.ListLiteral;
import org.pragmatica.exformat.ast.Node.Literal;
import org.pragmatica.exformat.ast.Node.MapLiteral;
import org.pragmatica.exformat.ast.Node.ModulePath;
import org.pragmatica.exformat.ast.Node.Range;
import org.pragmatica.exformat.ast.Node.RawValue;
import org.pragmatica.exformat.ast.Node.Sigil;
import org.pragmatica.exformat.ast.Node.StructLiteral;
import org.pragmatica.exformat.ast.Node.TupleLiteral;
import org.pragmatica.exformat.ast.Node.TwoElementTuple;
import org.pragmatica.exformat.ast.Node.UnaryOp;
import org.pragmatica.exformat.ast.Node.Variable;
import org.pragmatica.exformat.ast.NodeVisitor;
import org.pragmatica.exformat.ledger.SourceLedger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single top-down pass attaching layout metadata to a parsed tree.
 * <p>
 * For every node with a known line the pass claims the comment lines above it from the
 * {@link SourceLedger}, records whether a blank line precedes it and remembers the line of
 * the node visited before it. The last statement of the file, of every {@code do}-block
 * section and of the last clause of a clause list claims the comments that follow it.
 * <p>
 * Along the way, bare function names in definition heads and pipe targets become explicit
 * zero-argument calls, and local calls taking a {@code do} keyword are recorded as parenless.
 */
public final class AnnotationPass implements NodeVisitor<AnnotationPass.Step<Node>, AnnotationPass.Cursor> {
    private static final Logger log = LoggerFactory.getLogger(AnnotationPass.class);

    private static final Set<String> DEFINITIONS = Set.of("def", "defp", "defmacro", "defmacrop", "defdelegate");

    /**
     * Traversal context: line of the previously visited node and the parenless call names seen so far.
     */
    public record Cursor(int prevLine, Set<String> parenless) {
        public Cursor {
            parenless = Set.copyOf(parenless);
        }

        Cursor advanceTo(int line) {
            return new Cursor(line, parenless);
        }

        Cursor withParenless(String name) {
            if (parenless.contains(name)) {
                return this;
            }
            var names = new HashSet<>(parenless);
            names.add(name);
            return new Cursor(prevLine, names);
        }
    }

    /**
     * Annotated value together with the cursor after it.
     */
    public record Step<T>(T value, Cursor cursor) {}

    private final SourceLedger ledger;

    private AnnotationPass(SourceLedger ledger) {
        this.ledger = ledger;
    }

    public static AnnotatedTree annotate(Node root, SourceLedger ledger, Set<String> parenlessCalls) {
        var pass = new AnnotationPass(ledger);
        var step = pass.annotate(root, new Cursor(1, parenlessCalls));
        var annotated = pass.withSuffixComments(step.value());
        var parenless = step.cursor()
                            .parenless();

        if (log.isDebugEnabled()) {
            var discovered = new HashSet<>(parenless);
            discovered.removeAll(parenlessCalls);
            log.debug("Discovered parenless calls: {}", discovered);
        }
        return new AnnotatedTree(annotated, parenless, ledger);
    }

    Step<Node> annotate(Node node, Cursor cursor) {
        var normalized = normalizeZeroArity(node);
        var current = discoverParenless(normalized, cursor);
        var meta = normalized.meta();

        if (!meta.hasLine()) {
            return normalized.accept(this, current);
        }

        var start = normalized.firstLine();
        var prefix = ledger.takePrefixComments(start - 1, current.prevLine());
        var blank = start - 1 >= current.prevLine() && ledger.isBlank(start - 1);
        var updated = meta.withPrevLine(current.prevLine())
                          .withPrefix(prefix, blank);

        return normalized.withMeta(updated)
                         .accept(this, current.advanceTo(meta.line()));
    }

    private Step<List<Node>> annotateAll(List<? extends Node> nodes, Cursor cursor) {
        var result = new ArrayList<Node>(nodes.size());
        var current = cursor;

        for (var node : nodes) {
            var step = annotate(node, current);
            result.add(step.value());
            current = step.cursor();
        }
        return new Step<>(result, current);
    }

    private Step<List<Clause>> annotateClauses(List<Clause> clauses, Cursor cursor, boolean trailingComments) {
        var result = new ArrayList<Clause>(clauses.size());
        var current = cursor;

        for (var clause : clauses) {
            var step = annotate(clause, current);
            result.add((Clause) step.value());
            current = step.cursor();
        }
        if (trailingComments) {
            var last = result.get(result.size() - 1);
            result.set(result.size() - 1, new Clause(last.patterns(), withSuffixComments(last.body()), last.meta()));
        }
        return new Step<>(result, current);
    }

    private Step<Optional<Node>> annotateOptional(Optional<Node> node, Cursor cursor) {
        if (node.isEmpty()) {
            return new Step<>(Optional.empty(), cursor);
        }
        var step = annotate(node.get(), cursor);
        return new Step<>(Optional.of(step.value()), step.cursor());
    }

    /**
     * Attach the comments following the last statement of {@code statement}.
     */
    private Node withSuffixComments(Node statement) {
        if (statement instanceof Block block && block.expressions()
                                                     .size() > 1) {
            var expressions = new ArrayList<>(block.expressions());
            var last = expressions.size() - 1;
            expressions.set(last, withSuffixComments(expressions.get(last)));
            return new Block(expressions, block.meta());
        }

        var lastLine = statement.lastLine();

        if (lastLine == 0) {
            return statement;
        }

        var suffix = ledger.takeSuffixComments(lastLine + 1);

        if (suffix.isEmpty()) {
            return statement;
        }
        var meta = statement.meta();
        return statement.withMeta(meta.withSuffixComments(meta.suffixComments() + suffix));
    }

    private static Node normalizeZeroArity(Node node) {
        if (node instanceof Call call
            && call.localName()
                   .filter(DEFINITIONS::contains)
                   .isPresent()
            && !call.arguments()
                    .isEmpty()
            && call.arguments()
                   .get(0) instanceof Variable head) {
            var arguments = new ArrayList<>(call.arguments());
            arguments.set(0, zeroArityCall(head));
            return new Call(call.target(), arguments, call.meta());
        }
        if (node instanceof BinaryOp op && op.operator() == BinaryOperator.PIPE && op.right() instanceof Variable target) {
            return new BinaryOp(op.operator(), op.left(), zeroArityCall(target), op.meta());
        }
        return node;
    }

    private static Call zeroArityCall(Variable variable) {
        return new Call(new Call.Local(variable.name()), List.of(), variable.meta());
    }

    private static Cursor discoverParenless(Node node, Cursor cursor) {
        if (node instanceof Call call && call.hasDoKeyword()) {
            return call.localName()
                       .map(cursor::withParenless)
                       .orElse(cursor);
        }
        return cursor;
    }

    // ===== Variants =====

    @Override
    public Step<Node> visitVariable(Variable node, Cursor cursor) {
        return new Step<>(node, cursor);
    }

    @Override
    public Step<Node> visitModulePath(ModulePath node, Cursor cursor) {
        return new Step<>(node, cursor);
    }

    @Override
    public Step<Node> visitBlock(Block node, Cursor cursor) {
        var expressions = annotateAll(node.expressions(), cursor);
        return new Step<>(new Block(expressions.value(), node.meta()), expressions.cursor());
    }

    @Override
    public Step<Node> visitBitstring(Bitstring node, Cursor cursor) {
        var parts = annotateAll(node.parts(), cursor);
        return new Step<>(new Bitstring(parts.value(), node.format(), node.meta()), parts.cursor());
    }

    @Override
    public Step<Node> visitInterpolation(Interpolation node, Cursor cursor) {
        var expression = annotate(node.expression(), cursor);
        return new Step<>(new Interpolation(expression.value(), node.meta()), expression.cursor());
    }

    @Override
    public Step<Node> visitTwoElementTuple(TwoElementTuple node, Cursor cursor) {
        var left = annotate(node.left(), cursor);
        var right = annotate(node.right(), left.cursor());
        var pair = new TwoElementTuple(left.value(), right.value(), node.meta());

        return new Step<>(node.meta()
                              .hasLine()
                          ? pair
                          : hoistComments(pair),
                          right.cursor());
    }

    /// A pair without a line of its own takes over the comments claimed by its first element,
    /// so that they render above the whole entry.
    private static TwoElementTuple hoistComments(TwoElementTuple pair) {
        if (hasPrefix(pair.left())) {
            return new TwoElementTuple(stripPrefix(pair.left()), pair.right(), prefixFrom(pair.meta(), pair.left()));
        }
        if (hasPrefix(pair.right())) {
            return new TwoElementTuple(pair.left(), stripPrefix(pair.right()), prefixFrom(pair.meta(), pair.right()));
        }
        return pair;
    }

    private static boolean hasPrefix(Node node) {
        return !node.meta()
                    .prefixComments()
                    .isEmpty() || node.meta()
                                      .prefixBlank();
    }

    private static Node stripPrefix(Node node) {
        return node.withMeta(node.meta()
                                 .withPrefix("", false));
    }

    private static Meta prefixFrom(Meta target, Node source) {
        return target.withPrefix(source.meta()
                                       .prefixComments(),
                                 source.meta()
                                       .prefixBlank());
    }

    @Override
    public Step<Node> visitTupleLiteral(TupleLiteral node, Cursor cursor) {
        var elements = annotateAll(node.elements(), cursor);
        return new Step<>(new TupleLiteral(elements.value(), node.meta()), elements.cursor());
    }

    @Override
    public Step<Node> visitMapLiteral(MapLiteral node, Cursor cursor) {
        var entries = annotateAll(node.entries(), cursor);
        return new Step<>(new MapLiteral(entries.value(), node.meta()), entries.cursor());
    }

    @Override
    public Step<Node> visitStructLiteral(StructLiteral node, Cursor cursor) {
        var name = annotate(node.name(), cursor);
        var map = annotate(node.map(), name.cursor());
        return new Step<>(new StructLiteral(name.value(), (MapLiteral) map.value(), node.meta()), map.cursor());
    }

    @Override
    public Step<Node> visitAnonymousFunction(AnonymousFunction node, Cursor cursor) {
        var clauses = annotateClauses(node.clauses(),
                                      cursor,
                                      node.clauses()
                                          .size() > 1);
        return new Step<>(new AnonymousFunction(clauses.value(), node.meta()), clauses.cursor());
    }

    @Override
    public Step<Node> visitRange(Range node, Cursor cursor) {
        var from = annotate(node.from(), cursor);
        var to = annotate(node.to(), from.cursor());
        var step = annotateOptional(node.step(), to.cursor());
        return new Step<>(new Range(from.value(), to.value(), step.value(), node.meta()), step.cursor());
    }

    @Override
    public Step<Node> visitClauseList(ClauseList node, Cursor cursor) {
        var clauses = annotateClauses(node.clauses(), cursor, true);
        return new Step<>(new ClauseList(clauses.value(), node.meta()), clauses.cursor());
    }

    @Override
    public Step<Node> visitClause(Clause node, Cursor cursor) {
        var patterns = annotateAll(node.patterns(), cursor);
        var body = annotate(node.body(), patterns.cursor());
        return new Step<>(new Clause(patterns.value(), body.value(), node.meta()), body.cursor());
    }

    @Override
    public Step<Node> visitGuardedExpression(GuardedExpression node, Cursor cursor) {
        var subjects = annotateAll(node.subjects(), cursor);
        var guard = annotate(node.guard(), subjects.cursor());
        return new Step<>(new GuardedExpression(subjects.value(), guard.value(), node.meta()), guard.cursor());
    }

    @Override
    public Step<Node> visitBinaryOp(BinaryOp node, Cursor cursor) {
        var left = annotate(node.left(), cursor);
        var right = annotate(node.right(), left.cursor());
        return new Step<>(new BinaryOp(node.operator(), left.value(), right.value(), node.meta()), right.cursor());
    }

    @Override
    public Step<Node> visitUnaryOp(UnaryOp node, Cursor cursor) {
        var operand = annotate(node.operand(), cursor);
        return new Step<>(new UnaryOp(node.operator(), operand.value(), node.meta()), operand.cursor());
    }

    @Override
    public Step<Node> visitCapture(Capture node, Cursor cursor) {
        if (node.form() instanceof Capture.ArityReference reference) {
            var module = annotateOptional(reference.module(), cursor);
            var form = new Capture.ArityReference(module.value(), reference.name(), reference.arity());
            return new Step<>(new Capture(form, node.meta()), module.cursor());
        }
        if (node.form() instanceof Capture.CapturedExpression expression) {
            var body = annotate(expression.body(), cursor);
            return new Step<>(new Capture(new Capture.CapturedExpression(body.value()), node.meta()), body.cursor());
        }
        return new Step<>(node, cursor);
    }

    @Override
    public Step<Node> visitAccessIndex(AccessIndex node, Cursor cursor) {
        var base = annotate(node.base(), cursor);
        var key = annotate(node.key(), base.cursor());
        return new Step<>(new AccessIndex(base.value(), key.value(), node.meta()), key.cursor());
    }

    @Override
    public Step<Node> visitCall(Call node, Cursor cursor) {
        var target = annotateTarget(node.target(), cursor);
        var blocks = node.doBlocks();

        if (blocks.isEmpty()) {
            var arguments = annotateAll(node.arguments(), target.cursor());
            return new Step<>(new Call(target.value(), arguments.value(), node.meta()), arguments.cursor());
        }

        var leading = annotateAll(node.leadingArguments(), target.cursor());
        var sections = annotateBlockSections(blocks.get(), leading.cursor());
        var arguments = new ArrayList<>(leading.value());
        arguments.add(sections.value());
        return new Step<>(new Call(target.value(), arguments, node.meta()), sections.cursor());
    }

    private Step<Call.Target> annotateTarget(Call.Target target, Cursor cursor) {
        if (target instanceof Call.Remote remote) {
            var receiver = annotate(remote.receiver(), cursor);
            return new Step<>(new Call.Remote(receiver.value(), remote.name()), receiver.cursor());
        }
        if (target instanceof Call.Applied applied) {
            var function = annotate(applied.function(), cursor);
            return new Step<>(new Call.Applied(function.value()), function.cursor());
        }
        return new Step<>(target, cursor);
    }

    /// Each section claims its trailing comments before the next section is visited.
    private Step<Node> annotateBlockSections(ListLiteral sections, Cursor cursor) {
        var pairs = new ArrayList<Node>(sections.elements()
                                                .size());
        var current = cursor;

        for (var element : sections.elements()) {
            var pair = (TwoElementTuple) element;
            var key = annotate(pair.left(), current);
            var value = annotate(pair.right(), key.cursor());

            pairs.add(new TwoElementTuple(key.value(), withSuffixComments(value.value()), pair.meta()));
            current = value.cursor();
        }
        return new Step<>(new ListLiteral(pairs, sections.meta()), current);
    }

    @Override
    public Step<Node> visitListLiteral(ListLiteral node, Cursor cursor) {
        var elements = annotateAll(node.elements(), cursor);
        return new Step<>(new ListLiteral(elements.value(), node.meta()), elements.cursor());
    }

    @Override
    public Step<Node> visitAtomLiteral(AtomLiteral node, Cursor cursor) {
        return new Step<>(node, cursor);
    }

    @Override
    public Step<Node> visitLiteral(Literal node, Cursor cursor) {
        return new Step<>(node, cursor);
    }

    @Override
    public Step<Node> visitSigil(Sigil node, Cursor cursor) {
        var parts = annotateAll(node.parts(), cursor);
        return new Step<>(new Sigil(node.letter(), parts.value(), node.modifiers(), node.delimiter(), node.meta()),
                          parts.cursor());
    }

    @Override
    public Step<Node> visitRawValue(RawValue node, Cursor cursor) {
        return new Step<>(node, cursor);
    }
}
