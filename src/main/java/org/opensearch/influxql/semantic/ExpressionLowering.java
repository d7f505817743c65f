/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.semantic;

import org.opensearch.influxql.TranspileException;
import org.opensearch.influxql.compiler.InfluxQLFunction;
import org.opensearch.influxql.parser.nodes.BinaryExpr;
import org.opensearch.influxql.parser.nodes.BinaryOperator;
import org.opensearch.influxql.parser.nodes.Call;
import org.opensearch.influxql.parser.nodes.Distinct;
import org.opensearch.influxql.parser.nodes.Expr;
import org.opensearch.influxql.parser.nodes.InfluxQLASTVisitor;
import org.opensearch.influxql.parser.nodes.ParenExpr;
import org.opensearch.influxql.parser.nodes.VarRef;
import org.opensearch.influxql.parser.nodes.Wildcard;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Lowers InfluxQL scalar expressions into the lambda intermediate form.
 * <p>
 * References and aggregate calls are resolved through a symbol table that maps them to columns of the input
 * record. Everything else is translated structurally: operators map one to one, time-like strings become date-time
 * literals and math functions become calls into the {@code math} package.
 */
public class ExpressionLowering extends InfluxQLASTVisitor<SemanticNode> {

    private static final String MATH_PACKAGE = "math";

    private final Function<Expr, Optional<String>> symbols;

    /**
     * @param symbols resolves an expression to the column holding its value, if it has one
     */
    public ExpressionLowering(Function<Expr, Optional<String>> symbols) {
        this.symbols = symbols;
    }

    /**
     * Lowers the expression.
     *
     * @throws TranspileException if the expression uses a construct without a lowering
     */
    public SemanticNode lower(Expr expr) {
        Optional<String> column = symbols.apply(expr);
        if (column.isPresent()) {
            return Lambdas.recordColumn(column.get());
        }
        return expr.accept(this);
    }

    @Override
    public SemanticNode visit(VarRef varRef) {
        throw new IllegalStateException("missing symbol for " + varRef);
    }

    @Override
    public SemanticNode visit(Wildcard wildcard) {
        throw TranspileException.unimplemented("wildcard in expression");
    }

    @Override
    public SemanticNode visit(Call call) {
        InfluxQLFunction function = InfluxQLFunction.lookup(call.name())
            .filter(InfluxQLFunction::isMath)
            .orElseThrow(() -> new IllegalStateException("missing symbol for " + call));
        List<SemanticNode> args = new ArrayList<>(call.args().size());
        for (Expr arg : call.args()) {
            args.add(lower(arg));
        }
        return switch (function) {
            case ATAN2 -> mathCall("atan2", List.of(new Property("y", args.get(0)), new Property("x", args.get(1))));
            case POW -> mathCall("pow", List.of(new Property("x", args.get(0)), new Property("y", args.get(1))));
            case LN -> mathCall("log", List.of(new Property("x", args.get(0))));
            // log(x, b) is ln(x) / ln(b)
            case LOG -> new BinaryExpression(
                Operator.DIVISION,
                mathCall("log", List.of(new Property("x", args.get(0)))),
                mathCall("log", List.of(new Property("x", args.get(1))))
            );
            default -> mathCall(function.getName(), List.of(new Property("x", args.get(0))));
        };
    }

    private static CallExpression mathCall(String name, List<Property> arguments) {
        return new CallExpression(new MemberExpression(new IdentifierExpression(MATH_PACKAGE), name), new ObjectExpression(arguments));
    }

    @Override
    public SemanticNode visit(Distinct distinct) {
        return visit(distinct.toCall());
    }

    @Override
    public SemanticNode visit(BinaryExpr binaryExpr) {
        BinaryOperator op = binaryExpr.op();
        // -x is parsed as -1 * x
        if (op == BinaryOperator.MUL
            && binaryExpr.lhs() instanceof org.opensearch.influxql.parser.nodes.IntegerLiteral factor
            && factor.value() == -1) {
            return new UnaryExpression(Operator.SUBTRACTION, lower(binaryExpr.rhs()));
        }

        SemanticNode left = lower(binaryExpr.lhs());
        SemanticNode right = lower(binaryExpr.rhs());
        return switch (op) {
            case AND -> new LogicalExpression(LogicalOperator.AND, left, right);
            case OR -> new LogicalExpression(LogicalOperator.OR, left, right);
            case EQ -> new BinaryExpression(Operator.EQUAL, left, right);
            case NEQ -> new BinaryExpression(Operator.NOT_EQUAL, left, right);
            case EQ_REGEX -> new BinaryExpression(Operator.REGEXP_MATCH, left, right);
            case NEQ_REGEX -> new BinaryExpression(Operator.NOT_REGEXP_MATCH, left, right);
            case LT -> new BinaryExpression(Operator.LESS_THAN, left, right);
            case LTE -> new BinaryExpression(Operator.LESS_THAN_EQUAL, left, right);
            case GT -> new BinaryExpression(Operator.GREATER_THAN, left, right);
            case GTE -> new BinaryExpression(Operator.GREATER_THAN_EQUAL, left, right);
            case ADD -> new BinaryExpression(Operator.ADDITION, left, right);
            case SUB -> new BinaryExpression(Operator.SUBTRACTION, left, right);
            case MUL -> new BinaryExpression(Operator.MULTIPLICATION, left, right);
            case DIV -> new BinaryExpression(Operator.DIVISION, left, right);
            case MOD -> new BinaryExpression(Operator.MODULO, left, right);
            case BITWISE_AND, BITWISE_OR, BITWISE_XOR -> throw TranspileException.unimplemented("binary expression " + op.getSymbol());
        };
    }

    @Override
    public SemanticNode visit(ParenExpr parenExpr) {
        return lower(parenExpr.expr());
    }

    @Override
    public SemanticNode visit(org.opensearch.influxql.parser.nodes.StringLiteral literal) {
        if (literal.isTimeLiteral()) {
            return new DateTimeLiteral(literal.toTimeLiteral().value());
        }
        return new StringLiteral(literal.value());
    }

    @Override
    public SemanticNode visit(org.opensearch.influxql.parser.nodes.IntegerLiteral literal) {
        return new IntegerLiteral(literal.value());
    }

    @Override
    public SemanticNode visit(org.opensearch.influxql.parser.nodes.NumberLiteral literal) {
        return new FloatLiteral(literal.value());
    }

    @Override
    public SemanticNode visit(org.opensearch.influxql.parser.nodes.BooleanLiteral literal) {
        return new BooleanLiteral(literal.value());
    }

    @Override
    public SemanticNode visit(org.opensearch.influxql.parser.nodes.DurationLiteral literal) {
        return new DurationLiteral(literal.value());
    }

    @Override
    public SemanticNode visit(org.opensearch.influxql.parser.nodes.TimeLiteral literal) {
        return new DateTimeLiteral(literal.value());
    }

    @Override
    public SemanticNode visit(org.opensearch.influxql.parser.nodes.RegexLiteral literal) {
        return new RegexpLiteral(literal.pattern());
    }
}
