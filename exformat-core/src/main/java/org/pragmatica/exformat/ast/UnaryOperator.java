package org.pragmatica.exformat.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * Prefix operators. Capture ({@code &}) is modeled separately by {@link Node.Capture}.
 */
public enum UnaryOperator {
    BANG("!"),
    ATTRIBUTE("@"),
    PIN("^"),
    NOT("not"),
    PLUS("+"),
    MINUS("-"),
    BITWISE_NOT("~~~");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static Optional<UnaryOperator> fromSymbol(String symbol) {
        return Arrays.stream(values())
                     .filter(operator -> operator.symbol.equals(symbol))
                     .findFirst();
    }

    public static UnaryOperator of(String symbol) {
        return fromSymbol(symbol).orElseThrow(() -> new IllegalArgumentException("Unknown unary operator: " + symbol));
    }
}
