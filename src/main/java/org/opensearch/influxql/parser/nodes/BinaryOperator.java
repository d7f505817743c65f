/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.parser.nodes;

/**
 * Binary operators of InfluxQL with their textual form and binding precedence.
 */
public enum BinaryOperator {
    OR("OR", 1),
    AND("AND", 2),
    EQ("=", 4),
    NEQ("!=", 4),
    EQ_REGEX("=~", 4),
    NEQ_REGEX("!~", 4),
    LT("<", 4),
    LTE("<=", 4),
    GT(">", 4),
    GTE(">=", 4),
    ADD("+", 5),
    SUB("-", 5),
    BITWISE_OR("|", 5),
    BITWISE_XOR("^", 5),
    MUL("*", 6),
    DIV("/", 6),
    MOD("%", 6),
    BITWISE_AND("&", 6);

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isLogical() {
        return this == AND || this == OR;
    }

    public boolean isComparison() {
        return precedence == 4;
    }

    public boolean isArithmetic() {
        return precedence >= 5;
    }

    /**
     * Returns the operator to use when the operands are swapped, so that {@code 5 < time} can be read as
     * {@code time > 5}.
     */
    public BinaryOperator mirror() {
        return switch (this) {
            case LT -> GT;
            case LTE -> GTE;
            case GT -> LT;
            case GTE -> LTE;
            default -> this;
        };
    }

    @Override
    public String toString() {
        return symbol;
    }
}
