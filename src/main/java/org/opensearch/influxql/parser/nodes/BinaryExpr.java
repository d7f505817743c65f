/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.parser.nodes;

/**
 * A binary operation such as {@code a + b} or {@code host = 'a'}.
 */
public record BinaryExpr(BinaryOperator op, Expr lhs, Expr rhs) implements Expr {

    @Override
    public <T> T accept(InfluxQLASTVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return InfluxQLExpressionPrinter.print(this);
    }
}
