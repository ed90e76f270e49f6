package org.pragmatica.exformat;

import org.pragmatica.exformat.annotate.AnnotationPass;
import org.pragmatica.exformat.ast.Node;
import org.pragmatica.exformat.ledger.SourceLedger;
import org.pragmatica.exformat.printer.ExPrinter;
import org.pragmatica.exformat.shared.SourceFile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Elixir code formatter implementation.
 *
 * Formats Elixir source according to canonical style rules:
 * - operators parenthesized only where precedence requires it
 * - containers broken one element per line when they exceed the line width
 * - pipes and long operators broken where the source broke them
 * - comments and blank lines preserved
 * <p>
 * Each call works on its own ledger and state, so one instance may format many files concurrently.
 */
public final class ExFormatter implements Formatter {
    private static final Logger log = LoggerFactory.getLogger(ExFormatter.class);

    private final SourceParser parser;
    private final FormatterConfig config;
    private final ExPrinter printer;

    private ExFormatter(SourceParser parser, FormatterConfig config) {
        this.parser = parser;
        this.config = config;
        this.printer = ExPrinter.exPrinter(config);
    }

    /**
     * Factory method for creating a formatter with default config.
     */
    public static ExFormatter exFormatter(SourceParser parser) {
        return new ExFormatter(parser, FormatterConfig.defaultConfig());
    }

    /**
     * Factory method for creating a formatter with custom config.
     */
    public static ExFormatter exFormatter(SourceParser parser, FormatterConfig config) {
        return new ExFormatter(parser, config);
    }

    @Override
    public SourceFile format(SourceFile source) throws FormattingError {
        var tree = parser.parse(source);
        return source.withContent(formatTree(tree, source.content()));
    }

    @Override
    public boolean isFormatted(SourceFile source) throws FormattingError {
        return format(source).content()
                             .equals(source.content());
    }

    @Override
    public FormatterConfig config() {
        return config;
    }

    /**
     * Format an already parsed tree. {@code content} is the source text the tree was parsed
     * from; comments and blank lines are recovered from it.
     */
    public String formatTree(Node tree, String content) {
        var ledger = SourceLedger.sourceLedger(content);
        var annotated = AnnotationPass.annotate(tree, ledger, config.parenlessCalls());
        var output = printer.print(annotated);

        log.debug("Formatted {} source lines into {} characters", ledger.lineCount(), output.length());
        return output;
    }
}
