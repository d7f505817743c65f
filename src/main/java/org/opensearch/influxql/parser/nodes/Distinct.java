/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.parser.nodes;

import java.util.List;

/**
 * The {@code DISTINCT field} form, equivalent to {@code distinct(field)}.
 */
public record Distinct(String name) implements Expr {

    /**
     * Rewrites this node as the equivalent {@code distinct(field)} call.
     */
    public Call toCall() {
        return new Call("distinct", List.of(new VarRef(name)));
    }

    @Override
    public <T> T accept(InfluxQLASTVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return InfluxQLExpressionPrinter.print(this);
    }
}
