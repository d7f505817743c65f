/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.parser.nodes;

public record BooleanLiteral(boolean value) implements Literal {

    @Override
    public <T> T accept(InfluxQLASTVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return InfluxQLExpressionPrinter.print(this);
    }
}
