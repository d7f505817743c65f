/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.compiler;

import org.opensearch.influxql.ErrorKind;
import org.opensearch.influxql.TranspileException;
import org.opensearch.influxql.common.Constants;
import org.opensearch.influxql.common.TimeLiterals;
import org.opensearch.influxql.parser.nodes.BinaryExpr;
import org.opensearch.influxql.parser.nodes.Call;
import org.opensearch.influxql.parser.nodes.Dimension;
import org.opensearch.influxql.parser.nodes.Distinct;
import org.opensearch.influxql.parser.nodes.DurationLiteral;
import org.opensearch.influxql.parser.nodes.Expr;
import org.opensearch.influxql.parser.nodes.Field;
import org.opensearch.influxql.parser.nodes.FillOption;
import org.opensearch.influxql.parser.nodes.IntegerLiteral;
import org.opensearch.influxql.parser.nodes.Literal;
import org.opensearch.influxql.parser.nodes.ParenExpr;
import org.opensearch.influxql.parser.nodes.RegexLiteral;
import org.opensearch.influxql.parser.nodes.SelectStatement;
import org.opensearch.influxql.parser.nodes.Source;
import org.opensearch.influxql.parser.nodes.StringLiteral;
import org.opensearch.influxql.parser.nodes.SubQuery;
import org.opensearch.influxql.parser.nodes.TimeLiteral;
import org.opensearch.influxql.parser.nodes.VarRef;
import org.opensearch.influxql.parser.nodes.Wildcard;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Semantic analysis of a SELECT statement. Validates the WHERE clause, the GROUP BY dimensions and the SELECT list
 * against the rules of the query language and resolves the time range and bucketing interval.
 * <p>
 * An instance holds the state of one statement while it is compiled; subqueries are compiled by child instances
 * that inherit the interval and time range of their parent.
 */
public class StatementCompiler {

    private final Instant now;

    private Expr condition;
    private TimeRange timeRange = TimeRange.UNBOUNDED;
    private Interval interval = Interval.NONE;
    private boolean inheritedInterval;
    private FillOption fill = FillOption.NULL;
    private Literal fillValue;
    private boolean ascending = true;
    private int limit;

    private String topBottomFunction;
    private boolean hasDistinct;
    private boolean hasAuxiliaryFields;
    private boolean onlySelectors = true;
    // Reset for every field; binary expressions turn it off
    private boolean allowWildcard;

    private final List<Call> functionCalls = new ArrayList<>();
    private final List<CompiledField> fields = new ArrayList<>();
    private final List<CompiledStatement> subqueries = new ArrayList<>();

    private StatementCompiler(Instant now) {
        this.now = now;
    }

    /**
     * Compiles a top level statement.
     *
     * @param statement the statement
     * @param now       the reference time for {@code now()}
     * @return the compiled statement
     * @throws TranspileException if the statement violates a rule of the query language
     */
    public static CompiledStatement compile(SelectStatement statement, Instant now) {
        StatementCompiler compiler = new StatementCompiler(now);
        compiler.preprocess(statement);
        compiler.compileFields(statement);
        compiler.validateFields();
        // Subqueries are compiled last since they inherit state from this statement
        compiler.compileSubqueries(statement);
        return compiler.build(statement);
    }

    private CompiledStatement compileSubquery(SelectStatement statement) {
        StatementCompiler subquery = new StatementCompiler(now);
        subquery.preprocess(statement);

        if (!statement.sortFields().isEmpty() && subquery.ascending != ascending) {
            throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "subqueries must be ordered in the same direction as the query itself");
        }
        subquery.ascending = ascending;
        subquery.timeRange = subquery.timeRange.intersect(timeRange);

        // Null filling an inner query only produces rows the outer query has to skip
        if (!subquery.interval.isZero() && subquery.fill == FillOption.NULL) {
            subquery.fill = FillOption.NONE;
        }
        if (!interval.isZero() && subquery.interval.isZero()) {
            subquery.interval = interval;
            subquery.inheritedInterval = true;
        }

        subquery.compileFields(statement);
        subquery.validateFields();
        subquery.compileSubqueries(statement);
        return subquery.build(statement);
    }

    private void compileSubqueries(SelectStatement statement) {
        for (Source source : statement.sources()) {
            if (source instanceof SubQuery subquery) {
                subqueries.add(compileSubquery(subquery.statement()));
            }
        }
    }

    private CompiledStatement build(SelectStatement statement) {
        return new CompiledStatement(
            statement,
            fields,
            condition,
            timeRange,
            interval,
            inheritedInterval,
            fill,
            fillValue,
            ascending,
            functionCalls,
            subqueries
        );
    }

    private void preprocess(SelectStatement statement) {
        ascending = statement.isAscending();
        limit = statement.limit();

        ConditionSplitter.Split split = ConditionSplitter.split(statement.condition(), now);
        validateCondition(split.condition());
        condition = split.condition();
        timeRange = split.timeRange();

        compileDimensions(statement);
        fill = statement.fill();
        fillValue = statement.fillValue();

        // Aggregate queries stop at now() unless told otherwise
        Instant defaultMax = interval.isZero() ? Constants.TimeBounds.MAX_TIME : now;
        timeRange = timeRange.withDefaults(Constants.TimeBounds.MIN_TIME, defaultMax);
    }

    private void compileDimensions(SelectStatement statement) {
        for (Dimension dimension : statement.dimensions()) {
            Expr expr = ExprReducer.reduce(dimension.expr(), null);
            if (expr instanceof VarRef ref) {
                if (Constants.Names.TIME.equals(ref.name().toLowerCase(Locale.ROOT))) {
                    throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "time() is a function and expects at least one argument");
                }
            } else if (expr instanceof Call call) {
                compileTimeDimension(call);
            } else if (!(expr instanceof Wildcard) && !(expr instanceof RegexLiteral)) {
                throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "only time and tag dimensions allowed");
            }
        }
    }

    private void compileTimeDimension(Call call) {
        if (!Constants.Names.TIME.equals(call.name())) {
            throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "only time() calls allowed in dimensions");
        } else if (call.args().size() < 1 || call.args().size() > 2) {
            throw new TranspileException(ErrorKind.ARITY, "time dimension expected 1 or 2 arguments");
        } else if (!(call.args().get(0) instanceof DurationLiteral every)) {
            throw new TranspileException(ErrorKind.ARGUMENT_TYPE, "time dimension must have duration argument");
        } else if (!interval.isZero()) {
            throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "multiple time dimensions not allowed");
        } else {
            if (every.value().isNegative() || every.value().isZero()) {
                throw new TranspileException(ErrorKind.ARGUMENT_VALUE, "time dimension must have a positive duration argument");
            }
            long everyNanos;
            try {
                everyNanos = every.value().toNanos();
            } catch (ArithmeticException e) {
                throw new TranspileException(ErrorKind.ARGUMENT_VALUE, "time dimension duration overflows");
            }
            long offsetNanos = 0;
            if (call.args().size() == 2) {
                offsetNanos = offsetNanos(call.args().get(1));
            }
            interval = new Interval(every.value(), Duration.ofNanos(Math.floorMod(offsetNanos, everyNanos)));
        }
    }

    private long offsetNanos(Expr offset) {
        Instant instant;
        if (offset instanceof DurationLiteral duration) {
            try {
                return duration.value().toNanos();
            } catch (ArithmeticException e) {
                throw new TranspileException(ErrorKind.ARGUMENT_VALUE, "time dimension offset overflows");
            }
        } else if (offset instanceof TimeLiteral time) {
            instant = time.value();
        } else if (offset instanceof Call offsetCall) {
            if (!Constants.Names.NOW.equals(offsetCall.name())) {
                throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "time dimension offset function must be now()");
            } else if (!offsetCall.args().isEmpty()) {
                throw new TranspileException(ErrorKind.ARITY, "time dimension offset now() function requires no arguments");
            }
            instant = now;
        } else if (offset instanceof StringLiteral string && string.isTimeLiteral()) {
            try {
                instant = string.toTimeLiteral().value();
            } catch (IllegalArgumentException e) {
                throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "unable to parse time %s", string);
            }
        } else {
            throw new TranspileException(ErrorKind.ARGUMENT_TYPE, "time dimension offset must be duration or now()");
        }

        try {
            return TimeLiterals.toEpochNanos(instant);
        } catch (ArithmeticException e) {
            throw new TranspileException(
                ErrorKind.ARGUMENT_VALUE,
                "time dimension offset %s overflows time literal",
                TimeLiterals.format(instant)
            );
        }
    }

    private void validateCondition(Expr expr) {
        if (expr instanceof BinaryExpr binary) {
            validateCondition(binary.lhs());
            validateCondition(binary.rhs());
        } else if (expr instanceof Call call) {
            Optional<InfluxQLFunction> function = InfluxQLFunction.lookup(call.name());
            if (function.isEmpty() || !function.get().isMath()) {
                throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "invalid function call in condition: %s", call);
            }
            InfluxQLFunction.requireArity(call, function.get().getArity());
            for (Expr arg : call.args()) {
                validateCondition(arg);
            }
        }
    }

    private void compileFields(SelectStatement statement) {
        for (Field field : statement.fields()) {
            // time is always returned; it is not a field
            if (field.expr() instanceof VarRef ref && Constants.Names.TIME.equals(ref.name())) {
                continue;
            }
            Expr expr = rewriteDistinct(ExprReducer.reduce(field.expr(), null));
            fields.add(new CompiledField(field, expr));
            allowWildcard = true;
            compileExpr(expr);
        }
    }

    void compileExpr(Expr expr) {
        if (expr instanceof VarRef) {
            hasAuxiliaryFields = true;
        } else if (expr instanceof Wildcard) {
            hasAuxiliaryFields = true;
            if (!allowWildcard) {
                throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "unable to use wildcard in a binary expression");
            }
        } else if (expr instanceof RegexLiteral) {
            hasAuxiliaryFields = true;
            if (!allowWildcard) {
                throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "unable to use regex in a binary expression");
            }
        } else if (expr instanceof Call call) {
            Optional<InfluxQLFunction> function = InfluxQLFunction.lookup(call.name());
            if (function.isPresent() && function.get().isMath()) {
                function.get().compile(this, call);
                return;
            }
            functionCalls.add(call);
            function.orElseThrow(() -> new TranspileException(ErrorKind.UNSUPPORTED_FUNCTION, "undefined function %s()", call.name()))
                .compile(this, call);
        } else if (expr instanceof BinaryExpr binary) {
            allowWildcard = false;
            boolean lhsLiteral = isLiteral(binary.lhs());
            boolean rhsLiteral = isLiteral(binary.rhs());
            if (lhsLiteral && rhsLiteral) {
                throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "cannot perform a binary expression on two literals");
            } else if (lhsLiteral) {
                compileExpr(binary.rhs());
            } else if (rhsLiteral) {
                compileExpr(binary.lhs());
            } else {
                compileExpr(binary.lhs());
                compileExpr(binary.rhs());
            }
        } else if (expr instanceof ParenExpr paren) {
            compileExpr(paren.expr());
        } else if (expr instanceof Literal) {
            throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "field must contain at least one variable");
        } else {
            throw TranspileException.unimplemented(expr.toString());
        }
    }

    /**
     * Validates the single argument of an aggregate or selector. It must be a field, or a wildcard or regex when the
     * function is the whole field expression.
     */
    void compileSymbol(String name, Expr field) {
        if (field instanceof VarRef) {
            return;
        } else if (field instanceof Wildcard) {
            if (!allowWildcard) {
                throw new TranspileException(ErrorKind.ARGUMENT_TYPE, "unsupported expression with wildcard: %s()", name);
            }
            onlySelectors = false;
        } else if (field instanceof RegexLiteral) {
            if (!allowWildcard) {
                throw new TranspileException(ErrorKind.ARGUMENT_TYPE, "unsupported expression with regex field: %s()", name);
            }
            onlySelectors = false;
        } else {
            throw new TranspileException(ErrorKind.ARGUMENT_TYPE, "expected field argument in %s()", name);
        }
    }

    /**
     * Validates the first argument of a transformation: a nested aggregate when the statement groups by time,
     * a plain field otherwise.
     */
    void compileTransformationArgument(String name, Expr arg0) {
        onlySelectors = false;
        if (arg0 instanceof Call) {
            if (interval.isZero()) {
                throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "%s aggregate requires a GROUP BY interval", name);
            }
            compileNestedExpr(arg0);
        } else {
            if (!interval.isZero()) {
                throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "aggregate function required inside the call to %s", name);
            }
            compileSymbol(name, arg0);
        }
    }

    void compileNestedExpr(Expr expr) {
        if (expr instanceof Call call && InfluxQLFunction.DISTINCT.getName().equals(call.name())) {
            compileDistinct(call.args(), true);
            return;
        }
        compileExpr(expr);
    }

    void compileDistinct(List<Expr> args, boolean nested) {
        if (args.isEmpty()) {
            throw new TranspileException(ErrorKind.ARITY, "distinct function requires at least one argument");
        } else if (args.size() != 1) {
            throw new TranspileException(ErrorKind.ARITY, "distinct function can only have one argument");
        } else if (!(args.get(0) instanceof VarRef)) {
            throw new TranspileException(ErrorKind.ARGUMENT_TYPE, "expected field argument in distinct()");
        }
        if (!nested) {
            hasDistinct = true;
        }
        onlySelectors = false;
    }

    void compileTopBottom(Call call) {
        String name = call.name();
        List<Expr> args = call.args();
        if (topBottomFunction != null) {
            throw new TranspileException(ErrorKind.COMBINATION_RULE, "selector function %s() cannot be combined with other functions", topBottomFunction);
        } else if (args.size() < 2) {
            throw new TranspileException(ErrorKind.ARITY, "invalid number of arguments for %s, expected at least %d, got %d", name, 2, args.size());
        }

        Expr last = args.get(args.size() - 1);
        if (!(last instanceof IntegerLiteral n)) {
            throw new TranspileException(ErrorKind.ARGUMENT_TYPE, "expected integer as last argument in %s(), found %s", name, last);
        } else if (n.value() <= 0) {
            throw new TranspileException(ErrorKind.ARGUMENT_VALUE, "limit (%d) in %s function must be at least 1", n.value(), name);
        } else if (limit > 0 && n.value() > limit) {
            throw new TranspileException(
                ErrorKind.ARGUMENT_VALUE,
                "limit (%d) in %s function can not be larger than the LIMIT (%d) in the select statement",
                n.value(),
                name,
                limit
            );
        }

        if (!(args.get(0) instanceof VarRef)) {
            throw new TranspileException(ErrorKind.ARGUMENT_TYPE, "expected first argument to be a field in %s(), found %s", name, args.get(0));
        }
        for (Expr tag : args.subList(1, args.size() - 1)) {
            if (!(tag instanceof VarRef)) {
                throw new TranspileException(ErrorKind.ARGUMENT_TYPE, "only fields or tags are allowed in %s(), found %s", name, tag);
            }
            // Each listed tag is returned alongside the selected points
            compileExpr(tag);
        }
        topBottomFunction = name;
    }

    private void validateFields() {
        if (fields.isEmpty()) {
            throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "at least 1 non-time field must be queried");
        }

        if (functionCalls.size() > 1 && topBottomFunction != null) {
            throw new TranspileException(
                ErrorKind.COMBINATION_RULE,
                "selector function %s() cannot be combined with other functions",
                topBottomFunction
            );
        } else if (functionCalls.isEmpty()) {
            if (fill == FillOption.NONE) {
                throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "fill(none) must be used with a function");
            } else if (fill == FillOption.LINEAR) {
                throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "fill(linear) must be used with a function");
            }
            if (!interval.isZero() && !inheritedInterval) {
                throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "GROUP BY requires at least one aggregate function");
            }
        }

        if (hasDistinct && (functionCalls.size() != 1 || hasAuxiliaryFields)) {
            throw new TranspileException(
                ErrorKind.COMBINATION_RULE,
                "aggregate function distinct() cannot be combined with other functions or fields"
            );
        }

        if (hasAuxiliaryFields) {
            if (!onlySelectors) {
                throw new TranspileException(ErrorKind.COMBINATION_RULE, "mixing aggregate and non-aggregate queries is not supported");
            } else if (functionCalls.size() > 1) {
                throw new TranspileException(
                    ErrorKind.COMBINATION_RULE,
                    "mixing multiple selector functions with tags or fields is not supported"
                );
            }
        }
    }

    void clearOnlySelectors() {
        onlySelectors = false;
    }

    boolean hasInterval() {
        return !interval.isZero();
    }

    static boolean isLiteral(Expr expr) {
        return expr instanceof Literal;
    }

    private static Expr rewriteDistinct(Expr expr) {
        if (expr instanceof Distinct distinct) {
            return distinct.toCall();
        } else if (expr instanceof Call call) {
            List<Expr> args = new ArrayList<>(call.args().size());
            for (Expr arg : call.args()) {
                args.add(rewriteDistinct(arg));
            }
            return new Call(call.name(), args);
        } else if (expr instanceof BinaryExpr binary) {
            return new BinaryExpr(binary.op(), rewriteDistinct(binary.lhs()), rewriteDistinct(binary.rhs()));
        } else if (expr instanceof ParenExpr paren) {
            return new ParenExpr(rewriteDistinct(paren.expr()));
        }
        return expr;
    }
}
