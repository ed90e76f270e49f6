package org.pragmatica.exformat.printer;

import org.pragmatica.exformat.annotate.RenderState;
import org.pragmatica.exformat.ast.Associativity;
import org.pragmatica.exformat.ast.BinaryOperator;
import org.pragmatica.exformat.ast.LiteralFormat;
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
import org.pragmatica.exformat.ast.UnaryOperator;
import org.pragmatica.exformat.ledger.SourceLedger;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.pragmatica.exformat.ast.Associativity.LEFT;
import static org.pragmatica.exformat.ast.Associativity.RIGHT;

/**
 * Renders an annotated Elixir tree to source text.
 * <p>
 * Layout rules:
 * - operands are parenthesized by precedence and associativity only where required
 * - containers stay on one line while they fit the line width and were on one line in the source,
 *   otherwise one element per line, 2-space indent and a trailing comma
 * - pipes and long-form operators break where the source broke them or where the line is too long
 * - {@code do}-blocks keep the {@code do ... end} form only when some section spans several lines
 * <p>
 * Every node's text passes through the {@link Decorator}, which restores comments and blank lines.
 */
public final class ExRenderer implements NodeVisitor<String, RenderState> {
    private static final Logger log = LoggerFactory.getLogger(ExRenderer.class);

    private static final String INDENT = "  ";
    private static final Set<String> ALIGNED_CALLS = Set.of("with", "for", "defstruct");
    private static final Set<String> AMPERSAND_OPERATORS = Set.of("&", "&&", "&&&");
    private static final String SINGLE_CHAR_OPENERS = "/|\"'([{<";
    private static final String SINGLE_CHAR_CLOSERS = "/|\"')]}>";

    private final int lineWidth;
    private final SourceLedger ledger;
    private final Decorator decorator;

    private ExRenderer(int lineWidth, SourceLedger ledger, Decorator decorator) {
        this.lineWidth = lineWidth;
        this.ledger = ledger;
        this.decorator = decorator;
    }

    public static ExRenderer exRenderer(int lineWidth, SourceLedger ledger, Decorator decorator) {
        return new ExRenderer(lineWidth, ledger, decorator);
    }

    /**
     * Render a node and pass the result through the decorator.
     */
    public String render(Node node, RenderState state) {
        return decorator.decorate(node, node.accept(this, state));
    }

    // ===== Layout helpers =====

    private boolean fits(String candidate) {
        return candidate.indexOf('\n') < 0 && candidate.codePointCount(0, candidate.length()) <= lineWidth;
    }

    private static String indent(String text) {
        return text.replace("\n", "\n" + INDENT);
    }

    private static String spaces(int count) {
        return " ".repeat(count);
    }

    /**
     * Lay out already rendered items between delimiters: on one line when it fits and no item
     * started on a later source line than its predecessor, else one item per line.
     */
    private String container(String open, String close, List<Node> items, List<String> rendered) {
        var body = containerBody(open, close, items, rendered);
        return open + body + close;
    }

    private String containerBody(String open, String close, List<Node> items, List<String> rendered) {
        var single = String.join(", ", rendered);

        if (fits(open + single + close) && !hasLineBreaks(items)) {
            return single;
        }
        return "\n" + INDENT + rendered.stream()
                                       .map(ExRenderer::indent)
                                       .collect(Collectors.joining(",\n" + INDENT)) + ",\n";
    }

    private static boolean hasLineBreaks(List<Node> items) {
        return items.stream()
                    .skip(1)
                    .anyMatch(item -> carrier(item).meta()
                                                   .startsBelowPrevious());
    }

    /// Node whose position stands for a container item: the value of a keyword entry, the key of a map entry.
    private static Node carrier(Node item) {
        if (item instanceof TwoElementTuple pair && !pair.meta()
                                                         .hasLine()) {
            return pair.isKeywordPair()
                   ? pair.right()
                   : pair.left();
        }
        return item;
    }

    private List<String> renderAll(List<Node> nodes, RenderState state) {
        return nodes.stream()
                    .map(node -> render(node, state))
                    .toList();
    }

    private String keywordEntry(Node entry, RenderState state) {
        var pair = (TwoElementTuple) entry;
        var key = pair.keywordKey()
                      .orElseThrow();
        return decorator.decorate(pair, Literals.keywordKey(key) + " " + render(pair.right(), state));
    }

    private String mapEntry(Node entry, RenderState state) {
        if (entry instanceof TwoElementTuple pair) {
            return decorator.decorate(pair, render(pair.left(), state) + " => " + render(pair.right(), state));
        }
        return render(entry, state);
    }

    private List<String> keywordEntries(List<Node> entries, RenderState state) {
        return entries.stream()
                      .map(entry -> keywordEntry(entry, state))
                      .toList();
    }

    // ===== Operators =====

    private static Optional<BinaryOperator> operatorOf(Node node) {
        if (node instanceof BinaryOp op) {
            return Optional.of(op.operator());
        }
        if (node instanceof GuardedExpression guarded && guarded.subjects()
                                                                .size() == 1) {
            return Optional.of(BinaryOperator.WHEN);
        }
        if (node instanceof Range) {
            return Optional.of(BinaryOperator.RANGE);
        }
        return Optional.empty();
    }

    private String operand(Node child, BinaryOperator parent, Associativity side, RenderState state) {
        var text = render(child, state);

        return operatorOf(child).filter(operator -> parent.needsParentheses(operator, side))
                                .map(operator -> "(" + text + ")")
                                .orElse(text);
    }

    private String parenthesizedIfOperator(Node node, RenderState state) {
        var text = render(node, state);
        return operatorOf(node).isPresent() || node instanceof UnaryOp
               ? "(" + text + ")"
               : text;
    }

    /// Operands that started on different source lines, or that do not fit together on one line, are split.
    private boolean breaksBetween(BinaryOp node, String left, String separator, String right) {
        var leftLine = node.left()
                           .firstLine();
        var rightLine = node.right()
                            .firstLine();

        if (leftLine > 0 && rightLine > 0 && leftLine != rightLine) {
            return true;
        }
        return !fits(left + separator + right);
    }

    private static boolean isContainer(Node node) {
        return node instanceof ListLiteral
               || node instanceof TupleLiteral
               || node instanceof TwoElementTuple
               || node instanceof MapLiteral
               || node instanceof StructLiteral;
    }

    @Override
    public String visitBinaryOp(BinaryOp node, RenderState state) {
        var operator = node.operator();
        var operandState = operator == BinaryOperator.TYPE
                           ? state.withParenlessZeroArity()
                           : state;
        var left = operand(node.left(), operator, LEFT, operandState);
        var right = operand(node.right(), operator, RIGHT, operandState);
        var symbol = operator.symbol();

        if (operator == BinaryOperator.PIPE) {
            var separator = breaksBetween(node, left, " " + symbol + " ", right)
                            ? "\n" + symbol + " "
                            : " " + symbol + " ";
            return left + separator + right;
        }
        if (operator.breaksAfter()) {
            var separator = breaksBetween(node, left, " " + symbol + " ", right)
                            ? " " + symbol + "\n"
                            : " " + symbol + " ";
            return left + separator + right;
        }
        if (operator == BinaryOperator.MATCH && !isContainer(node.right()) && right.contains("\n")) {
            return left + " " + symbol + indent("\n" + right);
        }
        if (operator.isTight()) {
            return left + symbol + right;
        }
        return left + " " + symbol + " " + right;
    }

    @Override
    public String visitUnaryOp(UnaryOp node, RenderState state) {
        var operator = node.operator();
        var operand = node.operand();

        if (operatorOf(operand).isPresent()) {
            return operator.symbol() + "(" + render(operand, state) + ")";
        }
        if (operator == UnaryOperator.NOT) {
            return "not " + render(operand, state);
        }
        if (operator == UnaryOperator.ATTRIBUTE) {
            return "@" + render(operand, attributeState(operand, state));
        }
        if (operand instanceof UnaryOp inner && isSign(operator) && isSign(inner.operator())) {
            return operator.symbol() + "(" + render(operand, state) + ")";
        }
        return operator.symbol() + render(operand, state);
    }

    private static boolean isSign(UnaryOperator operator) {
        return operator == UnaryOperator.PLUS || operator == UnaryOperator.MINUS;
    }

    private static RenderState attributeState(Node operand, RenderState state) {
        if (operand instanceof Variable variable) {
            return state.withParenless(variable.name());
        }
        if (operand instanceof Call call) {
            return call.localName()
                       .map(state::withParenless)
                       .orElse(state);
        }
        return state;
    }

    @Override
    public String visitGuardedExpression(GuardedExpression node, RenderState state) {
        var guard = node.guard() instanceof ListLiteral list && list.isKeywordList()
                    ? containerBody("", "", list.elements(), keywordEntries(list.elements(), state))
                    : operand(node.guard(), BinaryOperator.WHEN, RIGHT, state);

        if (node.subjects()
                .size() > 1) {
            return renderAll(node.subjects(), state).stream()
                                                    .collect(Collectors.joining(", ", "(", ") when " + guard));
        }

        var subject = operand(node.subjects()
                                  .get(0),
                              BinaryOperator.WHEN,
                              LEFT,
                              state);

        if (node.meta()
                .startsBelowPrevious()) {
            var padding = spaces(ledger.firstToken(node.meta()
                                                       .prevLine())
                                       .length() + 1);
            return subject + "\n" + padding + "when " + guard;
        }
        return subject + " when " + guard;
    }

    @Override
    public String visitRange(Range node, RenderState state) {
        var text = operand(node.from(), BinaryOperator.RANGE, LEFT, state) + ".."
                   + operand(node.to(), BinaryOperator.RANGE, RIGHT, state);

        return node.step()
                   .map(step -> text + "//" + operand(step, BinaryOperator.RANGE, RIGHT, state))
                   .orElse(text);
    }

    // ===== Captures =====

    @Override
    public String visitCapture(Capture node, RenderState state) {
        if (node.form() instanceof Capture.Placeholder placeholder) {
            return "&" + placeholder.index();
        }
        if (node.form() instanceof Capture.ArityReference reference) {
            var arity = "/" + reference.arity();

            if (reference.module()
                         .isPresent()) {
                return "&" + render(reference.module()
                                             .get(),
                                    state) + "." + reference.name() + arity;
            }
            return AMPERSAND_OPERATORS.contains(reference.name())
                   ? "&(" + reference.name() + arity + ")"
                   : "&" + reference.name() + arity;
        }

        var body = ((Capture.CapturedExpression) node.form()).body();
        var text = render(body, state);

        return isParenlessCapture(body)
               ? "&" + text
               : "&(" + text + ")";
    }

    private static boolean isParenlessCapture(Node body) {
        if (operatorOf(body).isPresent() || body instanceof UnaryOp || body instanceof Capture) {
            return false;
        }
        return !(body instanceof Call call
                 && call.target() instanceof Call.Remote remote
                 && remote.receiver() instanceof Capture);
    }

    // ===== Containers =====

    @Override
    public String visitListLiteral(ListLiteral node, RenderState state) {
        var rendered = node.isKeywordList()
                       ? keywordEntries(node.elements(), state)
                       : renderAll(node.elements(), state);
        return container("[", "]", node.elements(), rendered);
    }

    @Override
    public String visitTupleLiteral(TupleLiteral node, RenderState state) {
        return container("{", "}", node.elements(), renderAll(node.elements(), state));
    }

    @Override
    public String visitTwoElementTuple(TwoElementTuple node, RenderState state) {
        var elements = List.of(node.left(), node.right());
        return container("{", "}", elements, renderAll(elements, state));
    }

    @Override
    public String visitMapLiteral(MapLiteral node, RenderState state) {
        return mapContainer("%{", node, state);
    }

    @Override
    public String visitStructLiteral(StructLiteral node, RenderState state) {
        return mapContainer("%" + render(node.name(), state) + "{", node.map(), state);
    }

    private String mapContainer(String open, MapLiteral map, RenderState state) {
        var update = map.updateForm();

        if (update.isPresent()) {
            var base = render(update.get()
                                    .left(),
                              state);
            var changes = update.get()
                                .right();
            var entries = changes instanceof ListLiteral list
                          ? list.elements()
                          : List.of(changes);
            return container(open + base + " | ", "}", entries, mapEntries(entries, state));
        }
        return container(open, "}", map.entries(), mapEntries(map.entries(), state));
    }

    private List<String> mapEntries(List<Node> entries, RenderState state) {
        var keywords = !entries.isEmpty() && entries.stream()
                                                    .allMatch(entry -> entry instanceof TwoElementTuple pair
                                                                       && pair.isKeywordPair());
        return keywords
               ? keywordEntries(entries, state)
               : entries.stream()
                        .map(entry -> mapEntry(entry, state))
                        .toList();
    }

    // ===== Functions and clauses =====

    private String patterns(Clause clause, RenderState state, String whenEmpty) {
        if (clause.patterns()
                  .isEmpty()) {
            return whenEmpty;
        }
        return String.join(", ", renderAll(clause.patterns(), state)) + " ";
    }

    private String inlineClause(Clause clause, RenderState state, String whenEmpty) {
        return decorator.decorate(clause, patterns(clause, state, whenEmpty) + "-> " + render(clause.body(), state));
    }

    @Override
    public String visitClause(Clause node, RenderState state) {
        return patterns(node, state, "") + "->\n" + INDENT + indent(render(node.body(), state));
    }

    @Override
    public String visitAnonymousFunction(AnonymousFunction node, RenderState state) {
        if (node.clauses()
                .size() > 1) {
            var clauses = node.clauses()
                              .stream()
                              .map(clause -> render(clause, state))
                              .collect(Collectors.joining("\n"));
            return "fn\n" + INDENT + indent(clauses) + "\nend";
        }

        var clause = node.clauses()
                         .get(0);
        var body = render(clause.body(), state);

        if (isInlineBody(clause, body)) {
            return "fn " + inlineClause(clause, state, "") + " end";
        }
        return "fn " + render(clause, state) + "\nend";
    }

    private boolean isInlineBody(Clause clause, String body) {
        if (body.contains("\n")) {
            return false;
        }

        var bodyLine = clause.body()
                             .firstLine();
        var patternLine = clause.patterns()
                                .isEmpty()
                          ? clause.meta()
                                  .line()
                          : clause.patterns()
                                  .get(0)
                                  .firstLine();

        if (bodyLine > 0 && patternLine > 0) {
            return bodyLine == patternLine;
        }
        return fits(body);
    }

    @Override
    public String visitClauseList(ClauseList node, RenderState state) {
        return node.clauses()
                   .stream()
                   .map(clause -> inlineClause(clause, state, "() "))
                   .collect(Collectors.joining("; ", "(", ")"));
    }

    /// Body of a {@code do}-block section: clauses one after another, anything else as is.
    private String sectionBody(Node value, RenderState state) {
        if (value instanceof ClauseList clauses) {
            var text = clauses.clauses()
                              .stream()
                              .map(clause -> render(clause, state))
                              .collect(Collectors.joining("\n"));
            return decorator.decorate(clauses, text);
        }
        return render(value, state);
    }

    // ===== Calls =====

    @Override
    public String visitCall(Call node, RenderState state) {
        var sections = node.doBlocks();

        if (sections.isPresent()) {
            return callWithBlocks(node, sections.get(), state);
        }
        return callWithArguments(node, node.arguments(), state);
    }

    private String callWithArguments(Call node, List<Node> arguments, RenderState state) {
        if (isBinaryToAtom(node, arguments)) {
            return ":" + render(arguments.get(0), state);
        }
        if (node.target() instanceof Call.Remote remote && remote.name()
                                                                 .equals("{}")) {
            return receiver(remote.receiver(), state) + "." + container("{",
                                                                         "}",
                                                                         arguments,
                                                                         renderAll(arguments, state));
        }

        var aligned = node.localName()
                          .filter(ALIGNED_CALLS::contains);

        if (aligned.isPresent() && !arguments.isEmpty()) {
            var head = aligned.get() + " ";
            var delimiter = ",\n" + spaces(head.length());
            return head + arguments(arguments, delimiter, state).strip();
        }

        var target = target(node.target(), state);

        if (isParenless(node.target(), arguments, state)) {
            return (target + " " + arguments(arguments, ", ", state)).strip();
        }
        if (arguments.stream()
                     .anyMatch(ExRenderer::hasPrefixComments)) {
            return target + "(\n" + INDENT + indent(arguments(arguments, ",\n", state)) + "\n)";
        }
        return target + "(" + arguments(arguments, ", ", state) + ")";
    }

    /// Comments claimed above an argument need the argument list broken one argument per line.
    private static boolean hasPrefixComments(Node argument) {
        return !argument.meta()
                        .prefixComments()
                        .isEmpty();
    }

    private static boolean isBinaryToAtom(Call node, List<Node> arguments) {
        return node.target() instanceof Call.Remote remote
               && remote.receiver() instanceof AtomLiteral module
               && module.name()
                        .equals("erlang")
               && remote.name()
                        .equals("binary_to_atom")
               && !arguments.isEmpty()
               && arguments.get(0) instanceof Bitstring bitstring
               && bitstring.isInterpolated();
    }

    private String target(Call.Target target, RenderState state) {
        if (target instanceof Call.Remote remote) {
            return receiver(remote.receiver(), state) + "." + remote.name();
        }
        if (target instanceof Call.Applied applied) {
            return receiver(applied.function(), state) + ".";
        }
        return ((Call.Local) target).name();
    }

    private String receiver(Node receiver, RenderState state) {
        if (receiver instanceof AtomLiteral atom) {
            return Literals.atom(atom.name());
        }
        if (receiver instanceof AnonymousFunction
            || receiver instanceof Capture capture && !(capture.form() instanceof Capture.Placeholder)) {
            return "(" + render(receiver, state) + ")";
        }
        return parenthesizedIfOperator(receiver, state);
    }

    private static boolean isParenless(Call.Target target, List<Node> arguments, RenderState state) {
        var zeroArity = state.parenlessZeroArity() && arguments.isEmpty();

        if (target instanceof Call.Local local) {
            return state.isParenless(local.name()) || zeroArity;
        }
        if (target instanceof Call.Remote remote) {
            return remote.receiver() instanceof ModulePath || remote.receiver() instanceof AtomLiteral
                   ? zeroArity
                   : arguments.isEmpty();
        }
        return false;
    }

    /// Arguments joined by {@code delimiter}; a trailing keyword list merges into them without brackets.
    private String arguments(List<Node> arguments, String delimiter, RenderState state) {
        if (arguments.isEmpty()) {
            return "";
        }

        var last = arguments.get(arguments.size() - 1);

        if (!(last instanceof ListLiteral list && list.isKeywordList())) {
            return String.join(delimiter, renderAll(arguments, state));
        }

        var leading = arguments.subList(0, arguments.size() - 1);
        var prefix = leading.isEmpty()
                     ? ""
                     : String.join(delimiter, renderAll(leading, state)) + ", ";
        var keywords = containerBody("[", "]", list.elements(), keywordEntries(list.elements(), state));

        if (keywords.endsWith(",\n")) {
            keywords = keywords.substring(0, keywords.length() - 2);
        }
        if (delimiter.startsWith(",\n")) {
            keywords = keywords.replace("\n" + INDENT, "\n" + delimiter.substring(2));
        }
        return prefix + keywords;
    }

    private String callWithBlocks(Call node, ListLiteral sections, RenderState state) {
        var leading = node.leadingArguments();
        var values = new ArrayList<TwoElementTuple>();

        for (var key : Call.BLOCK_KEYWORDS) {
            sections.elements()
                    .stream()
                    .map(TwoElementTuple.class::cast)
                    .filter(pair -> pair.keywordKey()
                                        .filter(key::equals)
                                        .isPresent())
                    .findFirst()
                    .ifPresent(values::add);
        }

        var bodies = values.stream()
                           .map(pair -> sectionBody(pair.right(), state))
                           .toList();
        var multiline = false;

        for (int i = 0; i < values.size(); i++) {
            multiline = multiline || isMultilineSection(values.get(i)
                                                              .right(),
                                                        bodies.get(i));
        }

        if (!multiline && !isParenless(node.target(), leading, state)) {
            return callWithArguments(node, node.arguments(), state);
        }

        var head = callWithArguments(node, leading, state);
        var builder = new StringBuilder(head);

        if (multiline) {
            builder.append(' ');
            for (int i = 0; i < values.size(); i++) {
                builder.append(keyOf(values.get(i)))
                       .append('\n');

                if (!bodies.get(i)
                           .isEmpty()) {
                    builder.append(INDENT)
                           .append(indent(bodies.get(i)))
                           .append('\n');
                }
            }
            return builder.append("end")
                          .toString();
        }

        for (int i = 0; i < values.size(); i++) {
            var separator = i == 0 && leading.isEmpty()
                            ? " "
                            : ", ";
            builder.append(separator)
                   .append(Literals.keywordKey(keyOf(values.get(i))))
                   .append(' ')
                   .append(bodies.get(i));
        }
        return builder.toString();
    }

    private static String keyOf(TwoElementTuple pair) {
        return pair.keywordKey()
                   .orElseThrow();
    }

    private static boolean isMultilineSection(Node value, String body) {
        if (value instanceof ClauseList || body.contains("\n")) {
            return true;
        }
        if (value instanceof Block block && block.expressions()
                                                 .size() != 1) {
            return true;
        }
        return value.meta()
                    .startsBelowPrevious();
    }

    // ===== Simple nodes =====

    @Override
    public String visitVariable(Variable node, RenderState state) {
        return node.name();
    }

    @Override
    public String visitModulePath(ModulePath node, RenderState state) {
        return String.join(".", node.segments());
    }

    @Override
    public String visitBlock(Block node, RenderState state) {
        return String.join("\n", renderAll(node.expressions(), state));
    }

    @Override
    public String visitAccessIndex(AccessIndex node, RenderState state) {
        return parenthesizedIfOperator(node.base(), state) + "[" + render(node.key(), state) + "]";
    }

    @Override
    public String visitAtomLiteral(AtomLiteral node, RenderState state) {
        return Literals.atom(node.name());
    }

    @Override
    public String visitLiteral(Literal node, RenderState state) {
        var value = node.value();
        var format = node.format();

        if (value instanceof String text) {
            return switch (format) {
                case CHAR_LIST -> Literals.charList(text);
                case BYTE_STRING_HEREDOC -> "\"\"\"\n" + text + "\"\"\"";
                case CHAR_LIST_HEREDOC -> "'''\n" + text + "'''";
                default -> Literals.string(text);
            };
        }
        if (value instanceof Double || value instanceof Float) {
            return Literals.floating(((Number) value).doubleValue());
        }
        if (value instanceof Long || value instanceof Integer || value instanceof BigInteger) {
            return Literals.integer((Number) value, format);
        }
        return fallback(node, value);
    }

    @Override
    public String visitRawValue(RawValue node, RenderState state) {
        return fallback(node, node.value());
    }

    private static String fallback(Node node, Object value) {
        var text = Literals.inspect(value);
        log.debug("Rendering {} by inspection as {}",
                  node.getClass()
                      .getSimpleName(),
                  text);
        return text;
    }

    // ===== Strings, bitstrings, sigils =====

    @Override
    public String visitInterpolation(Interpolation node, RenderState state) {
        return "#{" + render(node.expression(), state) + "}";
    }

    @Override
    public String visitBitstring(Bitstring node, RenderState state) {
        if (node.isInterpolated()) {
            return interpolated(node, state);
        }
        return node.parts()
                   .stream()
                   .map(part -> bitPart(part, state))
                   .map(text -> text.startsWith("<") || text.endsWith(">")
                                ? "(" + text + ")"
                                : text)
                   .collect(Collectors.joining(", ", "<<", ">>"));
    }

    private String interpolated(Bitstring node, RenderState state) {
        var format = node.format();

        if (format.isHeredoc()) {
            var quotes = format == LiteralFormat.CHAR_LIST_HEREDOC
                         ? "'''"
                         : "\"\"\"";
            return quotes + "\n" + segments(node.parts(), state, Function.identity()) + quotes;
        }

        var quote = format == LiteralFormat.CHAR_LIST
                    ? '\''
                    : '"';
        return quote + segments(node.parts(), state, text -> Literals.escape(text, quote)) + quote;
    }

    /// Text segments go through {@code escape}, interpolations render as code.
    private String segments(List<Node> parts, RenderState state, Function<String, String> escape) {
        var builder = new StringBuilder();

        for (var part : parts) {
            if (part instanceof Literal literal && literal.value() instanceof String text) {
                builder.append(escape.apply(text));
            } else {
                builder.append(render(part, state));
            }
        }
        return builder.toString();
    }

    private String bitPart(Node part, RenderState state) {
        if (part instanceof BinaryOp op && op.operator() == BinaryOperator.TYPE) {
            var text = operand(op.left(), BinaryOperator.TYPE, LEFT, state) + "::"
                       + bitModifiers(op.right(), BinaryOperator.TYPE, RIGHT, state);
            return decorator.decorate(part, text);
        }
        return render(part, state);
    }

    private String bitModifiers(Node node, BinaryOperator parent, Associativity side, RenderState state) {
        if (node instanceof BinaryOp op && (op.operator() == BinaryOperator.MULTIPLY
                                            || op.operator() == BinaryOperator.MINUS)) {
            var text = bitModifiers(op.left(), op.operator(), LEFT, state) + op.operator()
                                                                             .symbol()
                       + bitModifiers(op.right(), op.operator(), RIGHT, state);
            return decorator.decorate(node, text);
        }
        return operand(node, parent, side, state);
    }

    @Override
    public String visitSigil(Sigil node, RenderState state) {
        var delimiter = node.delimiter();
        var builder = new StringBuilder("~").append(node.letter());

        if (node.isHeredoc()) {
            builder.append(delimiter)
                   .append('\n')
                   .append(sigilContent(node, state, Optional.empty()))
                   .append(delimiter);
        } else {
            var opener = delimiter.charAt(0);
            var closer = SINGLE_CHAR_CLOSERS.charAt(Math.max(0, SINGLE_CHAR_OPENERS.indexOf(opener)));
            builder.append(opener)
                   .append(sigilContent(node, state, Optional.of(closer)))
                   .append(closer);
        }
        return builder.append(node.modifiers())
                      .toString();
    }

    private String sigilContent(Sigil node, RenderState state, Optional<Character> closer) {
        var builder = new StringBuilder();

        for (var part : node.parts()) {
            if (part instanceof Literal literal && literal.value() instanceof String text) {
                builder.append(closer.map(c -> escapeUnescaped(text, c))
                                     .orElse(text));
            } else {
                builder.append(render(part, state));
            }
        }
        return builder.toString();
    }

    private static String escapeUnescaped(String text, char closer) {
        var builder = new StringBuilder(text.length());
        var escaped = false;

        for (int i = 0; i < text.length(); i++) {
            var c = text.charAt(i);

            if (c == closer && !escaped) {
                builder.append('\\');
            }
            builder.append(c);
            escaped = c == '\\' && !escaped;
        }
        return builder.toString();
    }
}
