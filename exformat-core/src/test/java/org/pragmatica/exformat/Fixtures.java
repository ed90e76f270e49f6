package org.pragmatica.exformat;

import org.pragmatica.exformat.ast.LiteralFormat;
import org.pragmatica.exformat.ast.Node;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.pragmatica.exformat.ast.Node.AnonymousFunction.fn;
import static org.pragmatica.exformat.ast.Node.AtomLiteral.atom;
import static org.pragmatica.exformat.ast.Node.BinaryOp.binary;
import static org.pragmatica.exformat.ast.Node.Bitstring.interpolated;
import static org.pragmatica.exformat.ast.Node.Block.block;
import static org.pragmatica.exformat.ast.Node.Call.call;
import static org.pragmatica.exformat.ast.Node.Call.remote;
import static org.pragmatica.exformat.ast.Node.Clause.clause;
import static org.pragmatica.exformat.ast.Node.ClauseList.clauses;
import static org.pragmatica.exformat.ast.Node.GuardedExpression.guarded;
import static org.pragmatica.exformat.ast.Node.Interpolation.interpolation;
import static org.pragmatica.exformat.ast.Node.ListLiteral.keywords;
import static org.pragmatica.exformat.ast.Node.Literal.integer;
import static org.pragmatica.exformat.ast.Node.Literal.string;
import static org.pragmatica.exformat.ast.Node.ModulePath.modulePath;
import static org.pragmatica.exformat.ast.Node.TwoElementTuple.keyword;
import static org.pragmatica.exformat.ast.Node.TwoElementTuple.pair;
import static org.pragmatica.exformat.ast.Node.UnaryOp.unary;
import static org.pragmatica.exformat.ast.Node.Variable.variable;

/**
 * Formatted example sources and the trees a parser produces for them.
 */
final class Fixtures {
    private static final Path EXAMPLES_DIR = Path.of("src/test/resources/format-examples");

    private Fixtures() {}

    static String read(String fileName) throws IOException {
        return Files.readString(EXAMPLES_DIR.resolve(fileName));
    }

    /// Tree of format-examples/greeter.ex.
    static Node greeterTree() {
        var moduledoc = unary("@", call("moduledoc", string("Greeting helpers").at(3)).at(3)).at(3);
        var alias = call("alias", modulePath("Greeter.Names").at(5)).at(5);
        var pipeline = binary("|>",
                              binary("|>",
                                     variable("name").at(8),
                                     remote(modulePath("String").at(9), "trim").at(9)).at(9),
                              variable("greet").at(10)).at(10);
        var hello = call("def",
                         guarded(call("hello", variable("name").at(7)).at(7),
                                 call("is_binary", variable("name").at(7)).at(7)).at(7),
                         keywords(keyword("do", pipeline))).spanning(7, 11);
        var greeting = interpolated(LiteralFormat.PLAIN_STRING,
                                    string("Hello, "),
                                    interpolation(variable("name")),
                                    string("!")).at(13);
        var greet = call("defp",
                         call("greet", variable("name").at(13)).at(13),
                         keywords(keyword("do", greeting))).at(13);
        var doubled = fn(clause(variable("x").at(16),
                                binary("*", variable("x").at(16), integer(2).at(16)).at(16)).at(16)).at(16);
        var run = call("def",
                       call("run", variable("list").at(15)).at(15),
                       keywords(keyword("do",
                                        remote(modulePath("Enum").at(16), "map", variable("list").at(16), doubled)
                                                .at(16)))).spanning(15, 18);

        return call("defmodule",
                    modulePath("Greeter").at(1),
                    keywords(keyword("do", block(moduledoc, alias, hello, greet, run)))).spanning(1, 19);
    }

    /// Tree of format-examples/clauses.ex.
    static Node clausesTree() {
        var success = clause(pair(atom("ok"), variable("result").at(2)).at(2), variable("result").at(3)).at(2);
        var fallback = clause(variable("_").at(6), atom("nil").at(7)).at(6);

        return call("case",
                    variable("value").at(1),
                    keywords(keyword("do", clauses(success, fallback)))).spanning(1, 8);
    }
}
