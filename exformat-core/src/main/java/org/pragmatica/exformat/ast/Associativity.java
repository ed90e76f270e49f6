package org.pragmatica.exformat.ast;

/**
 * Operator associativity. Also used to name the operand side of a binary expression.
 */
public enum Associativity {
    LEFT,
    RIGHT
}
