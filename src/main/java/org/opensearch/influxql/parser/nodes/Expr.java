/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.parser.nodes;

/**
 * A scalar expression of the InfluxQL statement tree. Implementations are immutable values: two expressions
 * compare equal when they have the same shape.
 */
public interface Expr {

    /**
     * Accept a visitor.
     * @param visitor the visitor
     * @param <T> the return type of the visitor
     * @return the result of the visit
     */
    <T> T accept(InfluxQLASTVisitor<T> visitor);

    /**
     * Name of the node type as reported in legacy error messages, for example {@code *influxql.IntegerLiteral}.
     */
    default String legacyTypeName() {
        return "*influxql." + getClass().getSimpleName();
    }
}
