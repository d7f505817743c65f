/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.parser.nodes;

import java.util.List;
import java.util.Objects;

/**
 * A function call. Function names are lower case.
 */
public record Call(String name, List<Expr> args) implements Expr {

    public Call {
        Objects.requireNonNull(name, "name");
        args = List.copyOf(args);
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
