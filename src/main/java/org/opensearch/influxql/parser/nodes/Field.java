/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.parser.nodes;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An entry of the SELECT list with its optional alias.
 */
public record Field(Expr expr, String alias) {

    public Field {
        Objects.requireNonNull(expr, "expr");
    }

    public Field(Expr expr) {
        this(expr, null);
    }

    /**
     * Returns the output column name: the alias when present, otherwise a name derived from the expression.
     * Binary expressions are named after their references and calls joined by {@code _}.
     */
    public String name() {
        if (alias != null && !alias.isEmpty()) {
            return alias;
        }
        return nameOf(expr);
    }

    private static String nameOf(Expr expr) {
        if (expr instanceof Call call) {
            return call.name();
        } else if (expr instanceof Distinct) {
            return "distinct";
        } else if (expr instanceof VarRef ref) {
            return ref.name();
        } else if (expr instanceof ParenExpr paren) {
            return nameOf(paren.expr());
        } else if (expr instanceof BinaryExpr binary) {
            List<String> names = new ArrayList<>();
            collectNames(binary, names);
            return String.join("_", names);
        }
        return "";
    }

    private static void collectNames(Expr expr, List<String> names) {
        if (expr instanceof Call call) {
            names.add(call.name());
        } else if (expr instanceof VarRef ref) {
            names.add(ref.name());
        } else if (expr instanceof ParenExpr paren) {
            collectNames(paren.expr(), names);
        } else if (expr instanceof BinaryExpr binary) {
            collectNames(binary.lhs(), names);
            collectNames(binary.rhs(), names);
        }
    }

    @Override
    public String toString() {
        String text = expr.toString();
        return alias == null ? text : text + " AS " + InfluxQLExpressionPrinter.quoteIdent(alias);
    }
}
