/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.parser.nodes;

/**
 * Abstract visitor class for traversing InfluxQL expressions.
 * @param <T> the return type of the visit methods
 */
public abstract class InfluxQLASTVisitor<T> {

    /**
     * Constructor for InfluxQLASTVisitor.
     */
    public InfluxQLASTVisitor() {}

    /**
     * Visit a field or tag reference.
     * @param varRef the reference to visit
     * @return the result of visiting the reference
     */
    public abstract T visit(VarRef varRef);

    /**
     * Visit a wildcard.
     * @param wildcard the wildcard to visit
     * @return the result of visiting the wildcard
     */
    public abstract T visit(Wildcard wildcard);

    /**
     * Visit a function call.
     * @param call the call to visit
     * @return the result of visiting the call
     */
    public abstract T visit(Call call);

    /**
     * Visit a {@code DISTINCT field} node.
     * @param distinct the node to visit
     * @return the result of visiting the node
     */
    public abstract T visit(Distinct distinct);

    /**
     * Visit a binary expression.
     * @param binaryExpr the expression to visit
     * @return the result of visiting the expression
     */
    public abstract T visit(BinaryExpr binaryExpr);

    /**
     * Visit a parenthesized expression.
     * @param parenExpr the expression to visit
     * @return the result of visiting the expression
     */
    public abstract T visit(ParenExpr parenExpr);

    public abstract T visit(StringLiteral literal);

    public abstract T visit(IntegerLiteral literal);

    public abstract T visit(NumberLiteral literal);

    public abstract T visit(BooleanLiteral literal);

    public abstract T visit(DurationLiteral literal);

    public abstract T visit(TimeLiteral literal);

    public abstract T visit(RegexLiteral literal);
}
