package org.pragmatica.exformat.printer;

import org.pragmatica.exformat.FormatterConfig;
import org.pragmatica.exformat.annotate.RenderState;
import org.pragmatica.exformat.ast.LiteralFormat;
import org.pragmatica.exformat.ast.Meta;
import org.pragmatica.exformat.ast.Node;
import org.pragmatica.exformat.ast.Node.GuardedExpression;

import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.params.provider.Arguments.arguments;
import static org.pragmatica.exformat.ast.Node.AccessIndex.access;
import static org.pragmatica.exformat.ast.Node.AnonymousFunction.fn;
import static org.pragmatica.exformat.ast.Node.AtomLiteral.atom;
import static org.pragmatica.exformat.ast.Node.BinaryOp.binary;
import static org.pragmatica.exformat.ast.Node.Bitstring.bitstring;
import static org.pragmatica.exformat.ast.Node.Bitstring.interpolated;
import static org.pragmatica.exformat.ast.Node.Block.block;
import static org.pragmatica.exformat.ast.Node.Call.apply;
import static org.pragmatica.exformat.ast.Node.Call.call;
import static org.pragmatica.exformat.ast.Node.Call.remote;
import static org.pragmatica.exformat.ast.Node.Capture.capture;
import static org.pragmatica.exformat.ast.Node.Capture.placeholder;
import static org.pragmatica.exformat.ast.Node.Capture.reference;
import static org.pragmatica.exformat.ast.Node.Clause.clause;
import static org.pragmatica.exformat.ast.Node.ClauseList.clauses;
import static org.pragmatica.exformat.ast.Node.GuardedExpression.guarded;
import static org.pragmatica.exformat.ast.Node.Interpolation.interpolation;
import static org.pragmatica.exformat.ast.Node.ListLiteral.keywords;
import static org.pragmatica.exformat.ast.Node.ListLiteral.list;
import static org.pragmatica.exformat.ast.Node.Literal.charList;
import static org.pragmatica.exformat.ast.Node.Literal.character;
import static org.pragmatica.exformat.ast.Node.Literal.floating;
import static org.pragmatica.exformat.ast.Node.Literal.heredoc;
import static org.pragmatica.exformat.ast.Node.Literal.integer;
import static org.pragmatica.exformat.ast.Node.Literal.string;
import static org.pragmatica.exformat.ast.Node.MapLiteral.map;
import static org.pragmatica.exformat.ast.Node.ModulePath.modulePath;
import static org.pragmatica.exformat.ast.Node.Range.range;
import static org.pragmatica.exformat.ast.Node.RawValue.raw;
import static org.pragmatica.exformat.ast.Node.Sigil.sigil;
import static org.pragmatica.exformat.ast.Node.StructLiteral.struct;
import static org.pragmatica.exformat.ast.Node.TupleLiteral.tuple;
import static org.pragmatica.exformat.ast.Node.TwoElementTuple.keyword;
import static org.pragmatica.exformat.ast.Node.TwoElementTuple.pair;
import static org.pragmatica.exformat.ast.Node.UnaryOp.unary;
import static org.pragmatica.exformat.ast.Node.Variable.variable;
import static org.pragmatica.exformat.ledger.SourceLedger.sourceLedger;
import static org.pragmatica.exformat.printer.ExRenderer.exRenderer;

class ExRendererTest {
    private static final RenderState STATE = RenderState.renderState(FormatterConfig.DEFAULT.parenlessCalls());

    private static String render(Node node) {
        return render(node, STATE);
    }

    private static String render(Node node, RenderState state) {
        return exRenderer(80, sourceLedger(""), Decorator.IDENTITY).render(node, state);
    }

    private static Node a() {
        return variable("a");
    }

    private static Node b() {
        return variable("b");
    }

    private static Node c() {
        return variable("c");
    }

    static Stream<Arguments> precedenceCases() {
        return Stream.of(arguments(binary("-", binary("-", a(), b()), c()), "a - b - c"),
                         arguments(binary("-", a(), binary("-", b(), c())), "a - (b - c)"),
                         arguments(binary("++", a(), binary("++", b(), c())), "a ++ b ++ c"),
                         arguments(binary("++", binary("++", a(), b()), c()), "(a ++ b) ++ c"),
                         arguments(binary("and", binary("or", a(), b()), c()), "(a or b) and c"),
                         arguments(binary("or", binary("and", a(), b()), c()), "a and b or c"),
                         arguments(binary("==", binary("+", a(), b()), c()), "a + b == c"),
                         arguments(binary("=", a(), binary("=", b(), c())), "a = b = c"));
    }

    @ParameterizedTest
    @MethodSource("precedenceCases")
    void binary_parenthesizesOnlyWhereRequired(Node tree, String expected) {
        assertThat(render(tree)).isEqualTo(expected);
    }

    @Nested
    class Operators {
        @Test
        void tightOperators_haveNoSpaces() {
            assertThat(render(range(integer(1), integer(10)))).isEqualTo("1..10");
            assertThat(render(range(integer(1), integer(10), integer(2)))).isEqualTo("1..10//2");
        }

        @Test
        void pipe_staysOnOneLine_whenSourceDid() {
            var tree = binary("|>", binary("|>", variable("list"), call("f")), call("g"));

            assertThat(render(tree)).isEqualTo("list |> f() |> g()");
        }

        @Test
        void pipe_breaksBeforeOperator_whenOperandsOnDifferentLines() {
            var tree = binary("|>", variable("list").at(1), call("f").at(2)).at(1);

            assertThat(render(tree)).isEqualTo("list\n|> f()");
        }

        @Test
        void concatenation_breaksAfterOperator_whenTooLong() {
            var left = string("a".repeat(40));
            var right = string("b".repeat(40));

            assertThat(render(binary("<>", left, right))).isEqualTo("\"" + "a".repeat(40) + "\" <>\n\""
                                                                    + "b".repeat(40) + "\"");
        }

        @Test
        void concatenation_breaks_exactlyPastLineWidth() {
            var left = string("a".repeat(36));

            assertThat(render(binary("<>", left, string("b".repeat(36))))).doesNotContain("\n");
            assertThat(render(binary("<>", left, string("b".repeat(37))))).isEqualTo("\"" + "a".repeat(36) + "\" <>\n\""
                                                                                    + "b".repeat(37) + "\"");
        }

        @Test
        void concatenation_breaksAfterOperator_whenLeftOperandIsMultiline() {
            var left = list(string("x".repeat(77)));

            assertThat(render(binary("++", left, variable("b")))).isEqualTo("[\n  \"" + "x".repeat(77) + "\",\n] ++\nb");
        }

        @Test
        void match_movesMultilineRightSide_belowOperator() {
            var tree = binary("=", variable("x"), binary("|>", variable("a").at(1), call("f").at(2)));

            assertThat(render(tree)).isEqualTo("x =\n  a\n  |> f()");
        }

        @Test
        void typeSpec_dropsParenthesesOfZeroArityCalls() {
            assertThat(render(binary("::", call("t"), call("integer")))).isEqualTo("t :: integer");
            assertThat(render(binary("::", call("t"), remote(modulePath("String"), "t")))).isEqualTo("t :: String.t");
        }

        @Test
        void unary_rendersPrefixForms() {
            assertThat(render(unary("-", unary("-", variable("x"))))).isEqualTo("-(-x)");
            assertThat(render(unary("not", variable("x")))).isEqualTo("not x");
            assertThat(render(unary("!", binary("==", a(), b())))).isEqualTo("!(a == b)");
            assertThat(render(unary("^", variable("pin")))).isEqualTo("^pin");
            assertThat(render(unary("@", call("doc", string("x"))))).isEqualTo("@doc \"x\"");
        }

        @Test
        void guard_rendersSingleAndMultipleSubjects() {
            var single = guarded(call("f", variable("x")), binary(">", variable("x"), integer(0)));
            var multiple = guarded(List.<Node>of(a(), b()), call("is_integer", a()));

            assertThat(render(single)).isEqualTo("f(x) when x > 0");
            assertThat(render(multiple)).isEqualTo("(a, b) when is_integer(a)");
        }

        @Test
        void guard_onItsOwnLine_alignsWithDefinitionKeyword() {
            var guard = new GuardedExpression(List.of(call("foo", variable("x"))),
                                              binary(">", variable("x"), integer(0)),
                                              new Meta(2, 0, 1, "", false, ""));
            var renderer = exRenderer(80, sourceLedger("def foo(x)\n    when x > 0 do\n"), Decorator.IDENTITY);

            assertThat(renderer.render(guard, STATE)).isEqualTo("foo(x)\n    when x > 0");
        }
    }

    @Nested
    class Captures {
        @Test
        void capture_rendersReferencesAndExpressions() {
            assertThat(render(reference("is_atom", 1))).isEqualTo("&is_atom/1");
            assertThat(render(reference(modulePath("Enum"), "map", 2))).isEqualTo("&Enum.map/2");
            assertThat(render(reference("&&", 2))).isEqualTo("&(&&/2)");
            assertThat(render(capture(binary("+", placeholder(1), integer(1))))).isEqualTo("&(&1 + 1)");
            assertThat(render(capture(call("foo", placeholder(1))))).isEqualTo("&foo(&1)");
        }
    }

    @Nested
    class Containers {
        @Test
        void containers_renderOnOneLine_whenTheyFit() {
            assertThat(render(list())).isEqualTo("[]");
            assertThat(render(list(integer(1), integer(2)))).isEqualTo("[1, 2]");
            assertThat(render(tuple(a(), b(), c()))).isEqualTo("{a, b, c}");
            assertThat(render(pair(atom("ok"), variable("v")))).isEqualTo("{:ok, v}");
            assertThat(render(keywords(keyword("a", integer(1)), keyword("b", integer(2))))).isEqualTo("[a: 1, b: 2]");
        }

        @Test
        void maps_useArrows_unlessAllKeysAreAtoms() {
            assertThat(render(map(pair(string("k"), integer(1))))).isEqualTo("%{\"k\" => 1}");
            assertThat(render(map(keyword("a", integer(1))))).isEqualTo("%{a: 1}");
            assertThat(render(struct(modulePath("User"), map(keyword("name", string("x")))))).isEqualTo("%User{name: \"x\"}");
        }

        @Test
        void map_rendersUpdateForm() {
            var update = map(binary("|", variable("user"), keywords(keyword("name", string("y")))));

            assertThat(render(update)).isEqualTo("%{user | name: \"y\"}");
        }

        @Test
        void container_breaks_onlyPastLineWidth() {
            var fits = string("x".repeat(76));
            var overflows = string("x".repeat(77));

            assertThat(render(list(fits))).isEqualTo("[\"" + "x".repeat(76) + "\"]");
            assertThat(render(list(overflows))).isEqualTo("[\n  \"" + "x".repeat(77) + "\",\n]");
        }

        @Test
        void lineWidth_countsCodePoints() {
            var emoji = "😀".repeat(76);

            assertThat(render(list(string(emoji)))).isEqualTo("[\"" + emoji + "\"]");
        }

        @Test
        void accessIndex_rendersBrackets() {
            assertThat(render(access(variable("map"), atom("key")))).isEqualTo("map[:key]");
        }
    }

    @Nested
    class Functions {
        @Test
        void fn_staysInline_whenBodyFits() {
            assertThat(render(fn(clause(variable("x"), variable("x"))))).isEqualTo("fn x -> x end");
            assertThat(render(fn(clause(List.of(), atom("ok"))))).isEqualTo("fn -> :ok end");
        }

        @Test
        void fn_usesBlockForm_whenBodyStartedOnNextLine() {
            var tree = fn(clause(variable("x").at(1), call("g", variable("x")).at(2)).at(1));

            assertThat(render(tree)).isEqualTo("fn x ->\n  g(x)\nend");
        }

        @Test
        void fn_withSeveralClauses_putsEachOnItsOwnLine() {
            var tree = fn(clause(integer(0), atom("zero")), clause(variable("_"), atom("other")));

            assertThat(render(tree)).isEqualTo("fn\n  0 ->\n    :zero\n  _ ->\n    :other\nend");
        }

        @Test
        void clauseList_rendersInline() {
            var tree = clauses(clause(a(), b()), clause(List.of(), c()));

            assertThat(render(tree)).isEqualTo("(a -> b; () -> c)");
        }
    }

    @Nested
    class Calls {
        @Test
        void call_mergesTrailingKeywords() {
            assertThat(render(call("foo", a(), keywords(keyword("b", integer(1)))))).isEqualTo("foo(a, b: 1)");
        }

        @Test
        void call_dropsParentheses_forConfiguredNames() {
            assertThat(render(call("alias", modulePath("Foo.Bar")))).isEqualTo("alias Foo.Bar");
        }

        @Test
        void remoteCalls_renderReceiverForms() {
            assertThat(render(remote(modulePath("Enum"), "map", variable("xs"), variable("f")))).isEqualTo("Enum.map(xs, f)");
            assertThat(render(remote(modulePath("Mod"), "f"))).isEqualTo("Mod.f()");
            assertThat(render(remote(variable("user"), "name"))).isEqualTo("user.name");
            assertThat(render(remote(atom("lists"), "reverse", variable("xs")))).isEqualTo(":lists.reverse(xs)");
            assertThat(render(remote(modulePath("Mod"), "{}", modulePath("A"), modulePath("B")))).isEqualTo("Mod.{A, B}");
        }

        @Test
        void appliedCall_keepsParentheses() {
            assertThat(render(apply(variable("fun"), integer(1)))).isEqualTo("fun.(1)");
            assertThat(render(apply(variable("fun")))).isEqualTo("fun.()");
        }

        @Test
        void with_alignsClausesUnderFirst() {
            var tree = call("with",
                            binary("<-", pair(atom("ok"), a()), call("f")),
                            binary("<-", pair(atom("ok"), b()), call("g")),
                            keywords(keyword("do", b())));

            assertThat(render(tree)).isEqualTo("with {:ok, a} <- f(),\n     {:ok, b} <- g(), do: b");
        }

        @Test
        void doBlock_collapsesToKeyword_whenSingleLine() {
            var tree = call("if", variable("ok"), keywords(keyword("do", atom("yes")), keyword("else", atom("no"))));

            assertThat(render(tree)).isEqualTo("if(ok, do: :yes, else: :no)");
            assertThat(render(tree, STATE.withParenless("if"))).isEqualTo("if ok, do: :yes, else: :no");
        }

        @Test
        void doBlock_rendersSectionsInCanonicalOrder() {
            var tree = call("try",
                            keywords(keyword("do", block(call("a"), call("b"))),
                                     keyword("after", call("c")),
                                     keyword("rescue", variable("e"))));

            assertThat(render(tree)).isEqualTo("try do\n  a()\n  b()\nrescue\n  e\nafter\n  c()\nend");
        }

        @Test
        void doBlock_keepsBlockForm_forMultipleStatements() {
            var tree = call("if", variable("ok"), keywords(keyword("do", block(call("a"), call("b"))),
                                                            keyword("else", atom("no"))));

            assertThat(render(tree, STATE.withParenless("if"))).isEqualTo("if ok do\n  a()\n  b()\nelse\n  :no\nend");
        }
    }

    @Nested
    class LiteralNodes {
        @Test
        void literals_renderInSourceNotation() {
            assertThat(render(integer(1_000_000))).isEqualTo("1_000_000");
            assertThat(render(integer(255, LiteralFormat.HEXADECIMAL))).isEqualTo("0xFF");
            assertThat(render(floating(2.5))).isEqualTo("2.5");
            assertThat(render(character('a'))).isEqualTo("?a");
            assertThat(render(charList("abc"))).isEqualTo("'abc'");
            assertThat(render(atom("ok"))).isEqualTo(":ok");
        }

        @Test
        void heredoc_keepsContentVerbatim() {
            assertThat(render(heredoc("line one\nline two\n"))).isEqualTo("\"\"\"\nline one\nline two\n\"\"\"");
        }

        @Test
        void interpolatedStrings_escapeTextSegmentsOnly() {
            var text = interpolated(LiteralFormat.PLAIN_STRING, string("a\"b "), interpolation(variable("x")));
            var chars = interpolated(LiteralFormat.CHAR_LIST, string("it's "), interpolation(variable("x")));

            assertThat(render(text)).isEqualTo("\"a\\\"b #{x}\"");
            assertThat(render(chars)).isEqualTo("'it\\'s #{x}'");
        }

        @Test
        void bitstring_rendersSegmentsAndModifiers() {
            var tree = bitstring(a(), binary("::", b(), binary("-", variable("binary"), call("size", integer(4)))));

            assertThat(render(tree)).isEqualTo("<<a, b::binary-size(4)>>");
            assertThat(render(bitstring(bitstring(integer(1))))).isEqualTo("<<(<<1>>)>>");
        }

        @Test
        void sigil_escapesClosingDelimiter() {
            assertThat(render(sigil('r', "/", "i", string("a/b")))).isEqualTo("~r/a\\/b/i");
            assertThat(render(sigil('s', "(", "", string("x)")))).isEqualTo("~s(x\\))");
            assertThat(render(sigil('s', "\"", "", string("hi "), interpolation(variable("n"))))).isEqualTo("~s\"hi #{n}\"");
            assertThat(render(sigil('S', "\"\"\"", "", string("text\n")))).isEqualTo("~S\"\"\"\ntext\n\"\"\"");
        }

        @Test
        void rawValue_rendersByInspection() {
            assertThat(render(raw(List.of(1L, 2L)))).isEqualTo("[1, 2]");
        }
    }

    @Test
    void layoutDecorator_restoresCommentsAndBlankLine() {
        var node = variable("x").withMeta(Meta.at(3)
                                              .withPrefix("# c\n", true)
                                              .withSuffixComments("\n# s"));
        var renderer = exRenderer(80, sourceLedger(""), LayoutDecorator.INSTANCE);

        assertThat(renderer.render(node, STATE)).isEqualTo("# c\n\nx\n# s");
    }
}
