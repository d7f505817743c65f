/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.parser.nodes;

import org.opensearch.influxql.common.InfluxQLDuration;
import org.opensearch.influxql.common.TimeLiterals;

import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders expressions back to InfluxQL text. The output is the form quoted in error messages.
 */
public class InfluxQLExpressionPrinter extends InfluxQLASTVisitor<String> {
    private static final InfluxQLExpressionPrinter INSTANCE = new InfluxQLExpressionPrinter();
    private static final Pattern BARE_IDENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final String SPACE = " ";
    private static final String COMMA = ", ";
    private static final String OPEN_PAREN = "(";
    private static final String CLOSE_PAREN = ")";
    private static final String QUOTE = "'";

    /**
     * Constructor for InfluxQLExpressionPrinter.
     */
    public InfluxQLExpressionPrinter() {}

    /**
     * Renders the given expression.
     * @param expr the expression
     * @return the InfluxQL text of the expression
     */
    public static String print(Expr expr) {
        return expr.accept(INSTANCE);
    }

    /**
     * Quotes an identifier when it is not a bare identifier.
     */
    public static String quoteIdent(String ident) {
        if (BARE_IDENT.matcher(ident).matches()) {
            return ident;
        }
        return "\"" + ident.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    @Override
    public String visit(VarRef varRef) {
        return quoteIdent(varRef.name());
    }

    @Override
    public String visit(Wildcard wildcard) {
        return "*";
    }

    @Override
    public String visit(Call call) {
        return call.name() + OPEN_PAREN + call.args().stream().map(arg -> arg.accept(this)).collect(Collectors.joining(COMMA))
            + CLOSE_PAREN;
    }

    @Override
    public String visit(Distinct distinct) {
        return "DISTINCT " + quoteIdent(distinct.name());
    }

    @Override
    public String visit(BinaryExpr binaryExpr) {
        return binaryExpr.lhs().accept(this) + SPACE + binaryExpr.op().getSymbol() + SPACE + binaryExpr.rhs().accept(this);
    }

    @Override
    public String visit(ParenExpr parenExpr) {
        return OPEN_PAREN + parenExpr.expr().accept(this) + CLOSE_PAREN;
    }

    @Override
    public String visit(StringLiteral literal) {
        return QUOTE + literal.value().replace("\\", "\\\\").replace("'", "\\'").replace("\n", "\\n") + QUOTE;
    }

    @Override
    public String visit(IntegerLiteral literal) {
        return Long.toString(literal.value());
    }

    @Override
    public String visit(NumberLiteral literal) {
        return String.format(Locale.ROOT, "%.3f", literal.value());
    }

    @Override
    public String visit(BooleanLiteral literal) {
        return Boolean.toString(literal.value());
    }

    @Override
    public String visit(DurationLiteral literal) {
        return InfluxQLDuration.format(literal.value());
    }

    @Override
    public String visit(TimeLiteral literal) {
        return QUOTE + TimeLiterals.format(literal.value()) + QUOTE;
    }

    @Override
    public String visit(RegexLiteral literal) {
        return "/" + literal.pattern().replace("/", "\\/") + "/";
    }
}
