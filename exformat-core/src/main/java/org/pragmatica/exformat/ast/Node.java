package org.pragmatica.exformat.ast;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Elixir syntax tree node.
 * <p>
 * The set of variants is closed: every consumer dispatches through {@link NodeVisitor},
 * so adding a variant is a compile error in every renderer and traversal until handled.
 * Every variant carries layout {@link Meta}.
 */
public sealed interface Node
        permits Node.Variable, Node.ModulePath, Node.Block, Node.Bitstring, Node.Interpolation,
                Node.TwoElementTuple, Node.TupleLiteral, Node.MapLiteral, Node.StructLiteral,
                Node.AnonymousFunction, Node.Range, Node.ClauseList, Node.Clause, Node.GuardedExpression,
                Node.BinaryOp, Node.UnaryOp, Node.Capture, Node.AccessIndex, Node.Call, Node.ListLiteral,
                Node.AtomLiteral, Node.Literal, Node.Sigil, Node.RawValue {

    Meta meta();

    Node withMeta(Meta meta);

    <R, A> R accept(NodeVisitor<R, A> visitor, A arg);

    /**
     * Direct sub-nodes in source order.
     */
    List<Node> children();

    default Node at(int line) {
        return withMeta(meta().withLine(line));
    }

    default Node spanning(int line, int endLine) {
        return withMeta(meta().withLine(line)
                              .withEndLine(endLine));
    }

    /**
     * Smallest known line in this subtree, 0 when no node has a line.
     */
    default int firstLine() {
        var first = meta().line();
        for (var child : children()) {
            var childFirst = child.firstLine();
            if (childFirst > 0 && (first == 0 || childFirst < first)) {
                first = childFirst;
            }
        }
        return first;
    }

    /**
     * Greatest known line or closing line in this subtree, 0 when unknown.
     */
    default int lastLine() {
        var last = Math.max(meta().line(), meta().endLine());
        for (var child : children()) {
            last = Math.max(last, child.lastLine());
        }
        return last;
    }

    private static List<Node> concat(List<? extends Node> head, Node... tail) {
        var result = new ArrayList<Node>(head);
        result.addAll(Arrays.asList(tail));
        return List.copyOf(result);
    }

    // ===== Variants =====

    record Variable(String name, Meta meta) implements Node {
        public static Variable variable(String name) {
            return new Variable(name, Meta.NONE);
        }

        @Override
        public Variable withMeta(Meta meta) {
            return new Variable(name, meta);
        }

        @Override
        public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
            return visitor.visitVariable(this, arg);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /// Alias such as {@code Foo.Bar}.
    record ModulePath(List<String> segments, Meta meta) implements Node {
        public ModulePath {
            segments = List.copyOf(segments);
        }

        public static ModulePath modulePath(String dotted) {
            return new ModulePath(List.of(dotted.split("\\.")), Meta.NONE);
        }

        @Override
        public ModulePath withMeta(Meta meta) {
            return new ModulePath(segments, meta);
        }

        @Override
        public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
            return visitor.visitModulePath(this, arg);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    record Block(List<Node> expressions, Meta meta) implements Node {
        public Block {
            expressions = List.copyOf(expressions);
        }

        public static Block block(Node... expressions) {
            return new Block(List.of(expressions), Meta.NONE);
        }

        public boolean isSingle() {
            return expressions.size() == 1;
        }

        @Override
        public Block withMeta(Meta meta) {
            return new Block(expressions, meta);
        }

        @Override
        public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
            return visitor.visitBlock(this, arg);
        }

        @Override
        public List<Node> children() {
            return expressions;
        }
    }

    /// {@code <<...>>}. Also carries interpolated strings, char lists and heredocs,
    /// whose parts are string {@link Literal} segments and {@link Interpolation}s.
    record Bitstring(List<Node> parts, LiteralFormat format, Meta meta) implements Node {
        public Bitstring {
            parts = List.copyOf(parts);
        }

        public static Bitstring bitstring(Node... parts) {
            return new Bitstring(List.of(parts), LiteralFormat.NONE, Meta.NONE);
        }

        public static Bitstring interpolated(LiteralFormat format, Node... parts) {
            return new Bitstring(List.of(parts), format, Meta.NONE);
        }

        public boolean isInterpolated() {
            if (parts.isEmpty()) {
                return false;
            }
            var textOrInterpolation = parts.stream()
                                           .allMatch(part -> part instanceof Interpolation || isTextSegment(part));
            var hasInterpolation = parts.stream()
                                        .anyMatch(part -> part instanceof Interpolation);
            return textOrInterpolation && (hasInterpolation || format != LiteralFormat.NONE);
        }

        private static boolean isTextSegment(Node part) {
            return part instanceof Literal literal && literal.value() instanceof String;
        }

        @Override
        public Bitstring withMeta(Meta meta) {
            return new Bitstring(parts, format, meta);
        }

        @Override
        public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
            return visitor.visitBitstring(this, arg);
        }

        @Override
        public List<Node> children() {
            return parts;
        }
    }

    record Interpolation(Node expression, Meta meta) implements Node {
        public static Interpolation interpolation(Node expression) {
            return new Interpolation(expression, Meta.NONE);
        }

        @Override
        public Interpolation withMeta(Meta meta) {
            return new Interpolation(expression, meta);
        }

        @Override
        public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
            return visitor.visitInterpolation(this, arg);
        }

        @Override
        public List<Node> children() {
            return List.of(expression);
        }
    }

    /// Two-element tuple. Keyword list entries and map entries are tuples as well.
    record TwoElementTuple(Node left, Node right, Meta meta) implements Node {
        public static TwoElementTuple pair(Node left, Node right) {
            return new TwoElementTuple(left, right, Meta.NONE);
        }

        public static TwoElementTuple keyword(String key, Node value) {
            return new TwoElementTuple(AtomLiteral.atom(key), value, Meta.NONE);
        }

        public boolean isKeywordPair() {
            return left instanceof AtomLiteral;
        }

        public Optional<String> keywordKey() {
            return left instanceof AtomLiteral atom
                   ? Optional.of(atom.name())
                   : Optional.empty();
        }

        @Override
        public TwoElementTuple withMeta(Meta meta) {
            return new TwoElementTuple(left, right, meta);
        }

        @Override
        public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
            return visitor.visitTwoElementTuple(this, arg);
        }

        @Override
        public List<Node> children() {
            return List.of(left, right);
        }
    }

    record TupleLiteral(List<Node> elements, Meta meta) implements Node {
        public TupleLiteral {
            elements = List.copyOf(elements);
        }

        public static TupleLiteral tuple(Node... elements) {
            return new TupleLiteral(List.of(elements), Meta.NONE);
        }

        @Override
        public TupleLiteral withMeta(Meta meta) {
            return new TupleLiteral(elements, meta);
        }

        @Override
        public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
            return visitor.visitTupleLiteral(this, arg);
        }

        @Override
        public List<Node> children() {
            return elements;
        }
    }

    /// {@code %{...}}. The update form {@code %{map | k: v}} is a single {@code |} entry.
    record MapLiteral(List<Node> entries, Meta meta) implements Node {
        public MapLiteral {
            entries = List.copyOf(entries);
        }

        public static MapLiteral map(Node... entries) {
            return new MapLiteral(List.of(entries), Meta.NONE);
        }

        public Optional<BinaryOp> updateForm() {
            if (entries.size() == 1 && entries.get(0) instanceof BinaryOp op && op.operator() == BinaryOperator.BAR) {
                return Optional.of(op);
            }
            return Optional.empty();
        }

        @Override
        public MapLiteral withMeta(Meta meta) {
            return new MapLiteral(entries, meta);
        }

        @Override
        public MapLiteral at(int line) {
            return withMeta(meta.withLine(line));
        }

        @Override
        public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
            return visitor.visitMapLiteral(this, arg);
        }

        @Override
        public List<Node> children() {
            return entries;
        }
    }

    record StructLiteral(Node name, MapLiteral map, Meta meta) implements Node {
        public static StructLiteral struct(Node name, MapLiteral map) {
            return new StructLiteral(name, map, Meta.NONE);
        }

        @Override
        public StructLiteral withMeta(Meta meta) {
            return new StructLiteral(name, map, meta);
        }

        @Override
        public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
            return visitor.visitStructLiteral(this, arg);
        }

        @Override
        public List<Node> children() {
            return List.of(name, map);
        }
    }

    record AnonymousFunction(List<Clause> clauses, Meta meta) implements Node {
        public AnonymousFunction {
            clauses = List.copyOf(clauses);
            if (clauses.isEmpty()) {
                throw new IllegalArgumentException("Anonymous function requires at least one clause");
            }
        }

        public static AnonymousFunction fn(Clause... clauses) {
            return new AnonymousFunction(List.of(clauses), Meta.NONE);
        }

        @Override
        public AnonymousFunction withMeta(Meta meta) {
            return new AnonymousFunction(clauses, meta);
        }

        @Override
        public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
            return visitor.visitAnonymousFunction(this, arg);
        }

        @Override
        public List<Node> children() {
            return List.copyOf(clauses);
        }
    }

    record Range(Node from, Node to, Optional<Node> step, Meta meta) implements Node {
        public static Range range(Node from, Node to) {
            return new Range(from, to, Optional.empty(), Meta.NONE);
        }

        public static Range range(Node from, Node to, Node step) {
            return new Range(from, to, Optional.of(step), Meta.NONE);
        }

        @Override
        public Range withMeta(Meta meta) {
            return new Range(from, to, step, meta);
        }

        @Override
        public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
            return visitor.visitRange(this, arg);
        }

        @Override
        public List<Node> children() {
            return Stream.concat(Stream.of(from, to), step.stream())
                         .toList();
        }
    }

    /// Clauses of {@code case}, {@code cond}, {@code receive} and friends.
    record ClauseList(List<Clause> clauses, Meta meta) implements Node {
        public ClauseList {
            clauses = List.copyOf(clauses);
            if (clauses.isEmpty()) {
                throw new IllegalArgumentException("Clause list requires at least one clause");
            }
        }

        public static ClauseList clauses(Clause... clauses) {
            return new ClauseList(List.of(clauses), Meta.NONE);
        }

        @Override
        public ClauseList withMeta(Meta meta) {
            return new ClauseList(clauses, meta);
        }

        @Override
        public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
            return visitor.visitClauseList(this, arg);
        }

        @Override
        public List<Node> children() {
            return List.copyOf(clauses);
        }
    }

    /// {@code patterns -> body}.
    record Clause(List<Node> patterns, Node body, Meta meta) implements Node {
        public Clause {
            patterns = List.copyOf(patterns);
        }

        public static Clause clause(List<Node> patterns, Node body) {
            return new Clause(patterns, body, Meta.NONE);
        }

        public static Clause clause(Node pattern, Node body) {
            return new Clause(List.of(pattern), body, Meta.NONE);
        }

        @Override
        public Clause withMeta(Meta meta) {
            return new Clause(patterns, body, meta);
        }

        @Override
        public Clause at(int line) {
            return withMeta(meta.withLine(line));
        }

        @Override
        public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
            return visitor.visitClause(this, arg);
        }

        @Override
        public List<Node> children() {
            return concat(patterns, body);
        }
    }

    /// {@code subject when guard}; several subjects render as {@code (a, b) when guard}.
    record GuardedExpression(List<Node> subjects, Node guard, Meta meta) implements Node {
        public GuardedExpression {
            subjects = List.copyOf(subjects);
            if (subjects.isEmpty()) {
                throw new IllegalArgumentException("Guarded expression requires a subject");
            }
        }

        public static GuardedExpression guarded(Node subject, Node guard) {
            return new GuardedExpression(List.of(subject), guard, Meta.NONE);
        }

        public static GuardedExpression guarded(List<Node> subjects, Node guard) {
            return new GuardedExpression(subjects, guard, Meta.NONE);
        }

        @Override
        public GuardedExpression withMeta(Meta meta) {
            return new GuardedExpression(subjects, guard, meta);
        }

        @Override
        public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
            return visitor.visitGuardedExpression(this, arg);
        }

        @Override
        public List<Node> children() {
            return concat(subjects, guard);
        }
    }

    record BinaryOp(BinaryOperator operator, Node left, Node right, Meta meta) implements Node {
        public static BinaryOp binary(String operator, Node left, Node right) {
            return new BinaryOp(BinaryOperator.of(operator), left, right, Meta.NONE);
        }

        @Override
        public BinaryOp withMeta(Meta meta) {
            return new BinaryOp(operator, left, right, meta);
        }

        @Override
        public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
            return visitor.visitBinaryOp(this, arg);
        }

        @Override
        public List<Node> children() {
            return List.of(left, right);
        }
    }

    record UnaryOp(UnaryOperator operator, Node operand, Meta meta) implements Node {
        public static UnaryOp unary(String operator, Node operand) {
            return new UnaryOp(UnaryOperator.of(operator), operand, Meta.NONE);
        }

        @Override
        public UnaryOp withMeta(Meta meta) {
            return new UnaryOp(operator, operand, meta);
        }

        @Override
        public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
            return visitor.visitUnaryOp(this, arg);
        }

        @Override
        public List<Node> children() {
            return List.of(operand);
        }
    }

    record Capture(Form form, Meta meta) implements Node {
        public sealed interface Form permits ArityReference, CapturedExpression, Placeholder {}

        /// {@code &name/arity} or {@code &Mod.name/arity}.
        public record ArityReference(Optional<Node> module, String name, int arity) implements Form {}

        /// {@code &(expr)}.
        public record CapturedExpression(Node body) implements Form {}

        /// {@code &1}.
        public record Placeholder(int index) implements Form {}

        public static Capture reference(String name, int arity) {
            return new Capture(new ArityReference(Optional.empty(), name, arity), Meta.NONE);
        }

        public static Capture reference(Node module, String name, int arity) {
            return new Capture(new ArityReference(Optional.of(module), name, arity), Meta.NONE);
        }

        public static Capture capture(Node body) {
            return new Capture(new CapturedExpression(body), Meta.NONE);
        }

        public static Capture placeholder(int index) {
            return new Capture(new Placeholder(index), Meta.NONE);
        }

        @Override
        public Capture withMeta(Meta meta) {
            return new Capture(form, meta);
        }

        @Override
        public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
            return visitor.visitCapture(this, arg);
        }

        @Override
        public List<Node> children() {
            if (form instanceof ArityReference reference) {
                return reference.module()
                                .stream()
                                .toList();
            }
            if (form instanceof CapturedExpression expression) {
                return List.of(expression.body());
            }
            return List.of();
        }
    }

    record AccessIndex(Node base, Node key, Meta meta) implements Node {
        public static AccessIndex access(Node base, Node key) {
            return new AccessIndex(base, key, Meta.NONE);
        }

        @Override
        public AccessIndex withMeta(Meta meta) {
            return new AccessIndex(base, key, meta);
        }

        @Override
        public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
            return visitor.visitAccessIndex(this, arg);
        }

        @Override
        public List<Node> children() {
            return List.of(base, key);
        }
    }

    record Call(Target target, List<Node> arguments, Meta meta) implements Node {
        /// Keys of a trailing keyword list that render as {@code do ... end} sections, in canonical order.
        public static final List<String> BLOCK_KEYWORDS = List.of("do", "catch", "rescue", "after", "else");

        public sealed interface Target permits Local, Remote, Applied {}

        /// {@code name(args)}.
        public record Local(String name) implements Target {}

        /// {@code receiver.name(args)}.
        public record Remote(Node receiver, String name) implements Target {}

        /// {@code function.(args)}.
        public record Applied(Node function) implements Target {}

        public Call {
            arguments = List.copyOf(arguments);
        }

        public static Call call(String name, Node... arguments) {
            return new Call(new Local(name), List.of(arguments), Meta.NONE);
        }

        public static Call call(String name, List<Node> arguments) {
            return new Call(new Local(name), arguments, Meta.NONE);
        }

        public static Call remote(Node receiver, String name, Node... arguments) {
            return new Call(new Remote(receiver, name), List.of(arguments), Meta.NONE);
        }

        public static Call apply(Node function, Node... arguments) {
            return new Call(new Applied(function), List.of(arguments), Meta.NONE);
        }

        public Optional<String> localName() {
            return target instanceof Local local
                   ? Optional.of(local.name())
                   : Optional.empty();
        }

        public Optional<ListLiteral> trailingKeywords() {
            if (arguments.isEmpty()) {
                return Optional.empty();
            }
            return arguments.get(arguments.size() - 1) instanceof ListLiteral list && list.isKeywordList()
                   ? Optional.of(list)
                   : Optional.empty();
        }

        /// Trailing keyword list made only of block keywords and starting with {@code do}.
        public Optional<ListLiteral> doBlocks() {
            return trailingKeywords().filter(Call::isDoBlockList);
        }

        /// Trailing keyword list that holds a {@code do} key anywhere.
        public boolean hasDoKeyword() {
            return trailingKeywords().map(list -> list.keywordKeys()
                                                      .contains("do"))
                                     .orElse(false);
        }

        public List<Node> leadingArguments() {
            return arguments.isEmpty()
                   ? List.of()
                   : arguments.subList(0, arguments.size() - 1);
        }

        private static boolean isDoBlockList(ListLiteral list) {
            var keys = list.keywordKeys();
            return keys.get(0)
                       .equals("do") && BLOCK_KEYWORDS.containsAll(keys);
        }

        @Override
        public Call withMeta(Meta meta) {
            return new Call(target, arguments, meta);
        }

        @Override
        public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
            return visitor.visitCall(this, arg);
        }

        @Override
        public List<Node> children() {
            if (target instanceof Remote remote) {
                return concat(List.of(remote.receiver()), arguments.toArray(Node[]::new));
            }
            if (target instanceof Applied applied) {
                return concat(List.of(applied.function()), arguments.toArray(Node[]::new));
            }
            return arguments;
        }
    }

    record ListLiteral(List<Node> elements, Meta meta) implements Node {
        public ListLiteral {
            elements = List.copyOf(elements);
        }

        public static ListLiteral list(Node... elements) {
            return new ListLiteral(List.of(elements), Meta.NONE);
        }

        public static ListLiteral keywords(TwoElementTuple... pairs) {
            return new ListLiteral(List.of(pairs), Meta.NONE);
        }

        public boolean isKeywordList() {
            return !elements.isEmpty() && elements.stream()
                                                  .allMatch(ListLiteral::isKeywordPair);
        }

        public List<String> keywordKeys() {
            return elements.stream()
                           .map(element -> ((TwoElementTuple) element).keywordKey()
                                                                      .orElseThrow())
                           .toList();
        }

        private static boolean isKeywordPair(Node element) {
            return element instanceof TwoElementTuple pair && pair.isKeywordPair();
        }

        @Override
        public ListLiteral withMeta(Meta meta) {
            return new ListLiteral(elements, meta);
        }

        @Override
        public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
            return visitor.visitListLiteral(this, arg);
        }

        @Override
        public List<Node> children() {
            return elements;
        }
    }

    /// Atom without the leading colon: {@code ok} for {@code :ok}, {@code true} for {@code true}.
    record AtomLiteral(String name, Meta meta) implements Node {
        public static AtomLiteral atom(String name) {
            return new AtomLiteral(name, Meta.NONE);
        }

        @Override
        public AtomLiteral withMeta(Meta meta) {
            return new AtomLiteral(name, meta);
        }

        @Override
        public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
            return visitor.visitAtomLiteral(this, arg);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /// Number, string or character literal with its source notation.
    /// Values are {@link Long}, {@link BigInteger}, {@link Double} or {@link String}.
    record Literal(Object value, LiteralFormat format, Meta meta) implements Node {
        public static Literal integer(long value) {
            return new Literal(value, LiteralFormat.DECIMAL, Meta.NONE);
        }

        public static Literal integer(long value, LiteralFormat format) {
            return new Literal(value, format, Meta.NONE);
        }

        public static Literal integer(BigInteger value) {
            return new Literal(value, LiteralFormat.DECIMAL, Meta.NONE);
        }

        public static Literal floating(double value) {
            return new Literal(value, LiteralFormat.NONE, Meta.NONE);
        }

        public static Literal character(int codepoint) {
            return new Literal((long) codepoint, LiteralFormat.CHAR, Meta.NONE);
        }

        public static Literal string(String value) {
            return new Literal(value, LiteralFormat.PLAIN_STRING, Meta.NONE);
        }

        public static Literal charList(String value) {
            return new Literal(value, LiteralFormat.CHAR_LIST, Meta.NONE);
        }

        public static Literal heredoc(String value) {
            return new Literal(value, LiteralFormat.BYTE_STRING_HEREDOC, Meta.NONE);
        }

        public static Literal charListHeredoc(String value) {
            return new Literal(value, LiteralFormat.CHAR_LIST_HEREDOC, Meta.NONE);
        }

        @Override
        public Literal withMeta(Meta meta) {
            return new Literal(value, format, meta);
        }

        @Override
        public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
            return visitor.visitLiteral(this, arg);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /// {@code ~r/.../i}. Parts follow the same rules as an interpolated {@link Bitstring}.
    /// {@code delimiter} is the opening delimiter: a single character or a heredoc triple quote.
    record Sigil(char letter, List<Node> parts, String modifiers, String delimiter, Meta meta) implements Node {
        public Sigil {
            parts = List.copyOf(parts);
            if (!Character.isLetter(letter)) {
                throw new IllegalArgumentException("Sigil name must be a letter: " + letter);
            }
        }

        public static Sigil sigil(char letter, String delimiter, String modifiers, Node... parts) {
            return new Sigil(letter, List.of(parts), modifiers, delimiter, Meta.NONE);
        }

        public boolean isHeredoc() {
            return delimiter.length() == 3;
        }

        @Override
        public Sigil withMeta(Meta meta) {
            return new Sigil(letter, parts, modifiers, delimiter, meta);
        }

        @Override
        public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
            return visitor.visitSigil(this, arg);
        }

        @Override
        public List<Node> children() {
            return parts;
        }
    }

    /// Term outside the modeled grammar surface; rendered by literal inspection.
    record RawValue(Object value, Meta meta) implements Node {
        public static RawValue raw(Object value) {
            return new RawValue(value, Meta.NONE);
        }

        @Override
        public RawValue withMeta(Meta meta) {
            return new RawValue(value, meta);
        }

        @Override
        public <R, A> R accept(NodeVisitor<R, A> visitor, A arg) {
            return visitor.visitRawValue(this, arg);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }
}
