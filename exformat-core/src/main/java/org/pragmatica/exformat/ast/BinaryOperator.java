package org.pragmatica.exformat.ast;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.pragmatica.exformat.ast.Associativity.LEFT;
import static org.pragmatica.exformat.ast.Associativity.RIGHT;

/**
 * Binary operators with their binding strength and associativity.
 * Higher precedence binds tighter.
 */
public enum BinaryOperator {
    LEFT_ARROW("<-", 40, LEFT),
    DEFAULT_ARG("\\\\", 40, LEFT),
    WHEN("when", 50, RIGHT),
    TYPE("::", 60, RIGHT),
    BAR("|", 70, RIGHT),
    MATCH("=", 90, RIGHT),
    OR_OP("||", 130, LEFT),
    TRIPLE_BAR("|||", 130, LEFT),
    OR("or", 130, LEFT),
    AND_OP("&&", 140, LEFT),
    TRIPLE_AMP("&&&", 140, LEFT),
    AND("and", 140, LEFT),
    EQUAL("==", 150, LEFT),
    NOT_EQUAL("!=", 150, LEFT),
    REGEX_MATCH("=~", 150, LEFT),
    STRICT_EQUAL("===", 150, LEFT),
    STRICT_NOT_EQUAL("!==", 150, LEFT),
    LESS("<", 160, LEFT),
    LESS_EQUAL("<=", 160, LEFT),
    GREATER_EQUAL(">=", 160, LEFT),
    GREATER(">", 160, LEFT),
    PIPE("|>", 170, LEFT),
    SHIFT_LEFT("<<<", 170, LEFT),
    SHIFT_RIGHT(">>>", 170, LEFT),
    LEFT_SQUIGGLE("<~", 170, LEFT),
    RIGHT_SQUIGGLE("~>", 170, LEFT),
    LEFT_DOUBLE_SQUIGGLE("<<~", 170, LEFT),
    RIGHT_DOUBLE_SQUIGGLE("~>>", 170, LEFT),
    BOTH_SQUIGGLE("<~>", 170, LEFT),
    ALTERNATIVE("<|>", 170, LEFT),
    XOR("^^^", 170, LEFT),
    IN("in", 180, LEFT),
    CONCAT("++", 200, RIGHT),
    SUBTRACT_LIST("--", 200, RIGHT),
    RANGE("..", 200, RIGHT),
    CONCAT_BINARY("<>", 200, RIGHT),
    PLUS("+", 210, LEFT),
    MINUS("-", 210, LEFT),
    MULTIPLY("*", 220, LEFT),
    DIVIDE("/", 220, LEFT),
    DOT(".", 310, LEFT);

    private static final Map<String, BinaryOperator> BY_SYMBOL = Arrays.stream(values())
                                                                       .collect(Collectors.toUnmodifiableMap(BinaryOperator::symbol,
                                                                                                             Function.identity()));

    private final String symbol;
    private final int precedence;
    private final Associativity associativity;

    BinaryOperator(String symbol, int precedence, Associativity associativity) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.associativity = associativity;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public Associativity associativity() {
        return associativity;
    }

    /**
     * Operators that may break after the operator when the operands do not fit on one line.
     */
    public boolean breaksAfter() {
        return this == CONCAT_BINARY || this == CONCAT || this == AND || this == OR;
    }

    /**
     * Operators written without surrounding spaces.
     */
    public boolean isTight() {
        return this == DOT || this == RANGE;
    }

    /**
     * Decide whether an operand with operator {@code child} needs parentheses
     * when placed on {@code side} of this operator.
     */
    public boolean needsParentheses(BinaryOperator child, Associativity side) {
        if (precedence != child.precedence) {
            return precedence > child.precedence;
        }
        return associativity != side;
    }

    public static Optional<BinaryOperator> fromSymbol(String symbol) {
        return Optional.ofNullable(BY_SYMBOL.get(symbol));
    }

    public static BinaryOperator of(String symbol) {
        return fromSymbol(symbol).orElseThrow(() -> new IllegalArgumentException("Unknown binary operator: " + symbol));
    }
}
