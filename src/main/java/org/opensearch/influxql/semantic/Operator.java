/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.semantic;

/**
 * Operators of binary and unary expressions.
 */
public enum Operator {
    MULTIPLICATION("*"),
    DIVISION("/"),
    MODULO("%"),
    ADDITION("+"),
    SUBTRACTION("-"),
    LESS_THAN_EQUAL("<="),
    LESS_THAN("<"),
    GREATER_THAN_EQUAL(">="),
    GREATER_THAN(">"),
    EQUAL("=="),
    NOT_EQUAL("!="),
    REGEXP_MATCH("=~"),
    NOT_REGEXP_MATCH("!~"),
    NOT("not");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
