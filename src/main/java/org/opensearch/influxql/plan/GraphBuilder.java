/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.plan;

import org.opensearch.influxql.ErrorKind;
import org.opensearch.influxql.TranspileException;
import org.opensearch.influxql.common.Constants;
import org.opensearch.influxql.compiler.CompiledField;
import org.opensearch.influxql.compiler.CompiledStatement;
import org.opensearch.influxql.compiler.InfluxQLFunction;
import org.opensearch.influxql.compiler.Interval;
import org.opensearch.influxql.compiler.TimeRange;
import org.opensearch.influxql.parser.nodes.Call;
import org.opensearch.influxql.parser.nodes.Dimension;
import org.opensearch.influxql.parser.nodes.DurationLiteral;
import org.opensearch.influxql.parser.nodes.Expr;
import org.opensearch.influxql.parser.nodes.FillOption;
import org.opensearch.influxql.parser.nodes.IntegerLiteral;
import org.opensearch.influxql.parser.nodes.Measurement;
import org.opensearch.influxql.parser.nodes.NumberLiteral;
import org.opensearch.influxql.parser.nodes.RegexLiteral;
import org.opensearch.influxql.parser.nodes.SelectStatement;
import org.opensearch.influxql.parser.nodes.SubQuery;
import org.opensearch.influxql.parser.nodes.VarRef;
import org.opensearch.influxql.parser.nodes.Wildcard;
import org.opensearch.influxql.plan.FieldGrouper.FieldGroup;
import org.opensearch.influxql.plan.PlannerContext.StatementScope;
import org.opensearch.influxql.plan.operations.AggregateConfig;
import org.opensearch.influxql.plan.operations.AggregateOpSpec;
import org.opensearch.influxql.plan.operations.CumulativeSumOpSpec;
import org.opensearch.influxql.plan.operations.DerivativeOpSpec;
import org.opensearch.influxql.plan.operations.DifferenceOpSpec;
import org.opensearch.influxql.plan.operations.DistinctOpSpec;
import org.opensearch.influxql.plan.operations.FillOpSpec;
import org.opensearch.influxql.plan.operations.FilterOpSpec;
import org.opensearch.influxql.plan.operations.FromOpSpec;
import org.opensearch.influxql.plan.operations.GroupOpSpec;
import org.opensearch.influxql.plan.operations.IntegralOpSpec;
import org.opensearch.influxql.plan.operations.JoinOpSpec;
import org.opensearch.influxql.plan.operations.LimitOpSpec;
import org.opensearch.influxql.plan.operations.MapOpSpec;
import org.opensearch.influxql.plan.operations.OperationSpec;
import org.opensearch.influxql.plan.operations.PercentileOpSpec;
import org.opensearch.influxql.plan.operations.RangeOpSpec;
import org.opensearch.influxql.plan.operations.SampleOpSpec;
import org.opensearch.influxql.plan.operations.SelectorOpSpec;
import org.opensearch.influxql.plan.operations.SortOpSpec;
import org.opensearch.influxql.plan.operations.WindowOpSpec;
import org.opensearch.influxql.plan.operations.YieldOpSpec;
import org.opensearch.influxql.semantic.BinaryExpression;
import org.opensearch.influxql.semantic.ExpressionLowering;
import org.opensearch.influxql.semantic.IdentifierExpression;
import org.opensearch.influxql.semantic.Lambdas;
import org.opensearch.influxql.semantic.LogicalExpression;
import org.opensearch.influxql.semantic.LogicalOperator;
import org.opensearch.influxql.semantic.MemberExpression;
import org.opensearch.influxql.semantic.ObjectExpression;
import org.opensearch.influxql.semantic.Operator;
import org.opensearch.influxql.semantic.Property;
import org.opensearch.influxql.semantic.RegexpLiteral;
import org.opensearch.influxql.semantic.SemanticNode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the operation graph of compiled statements.
 * <p>
 * Every statement becomes a chain {@code from -> range -> filter -> group -> [window] -> function -> [window] -> map
 * -> yield}. A statement computing several functions, or combining several fields, builds one such pipeline per
 * input and merges them with a {@code join} before the final {@code map}. Operations are appended to the
 * {@link PlannerContext} in the order they are created, which fixes their ids.
 */
public class GraphBuilder {

    private static final Duration DEFAULT_UNIT = Duration.ofSeconds(1);

    private final PlannerContext context;
    private final String defaultDatabase;
    private final String defaultRetentionPolicy;

    /**
     * @param context                the context collecting the graph
     * @param defaultDatabase        database of sources that name none, may be null
     * @param defaultRetentionPolicy retention policy of sources that name none, may be null
     */
    public GraphBuilder(PlannerContext context, String defaultDatabase, String defaultRetentionPolicy) {
        this.context = context;
        this.defaultDatabase = defaultDatabase;
        this.defaultRetentionPolicy = defaultRetentionPolicy;
    }

    /**
     * Builds a top level statement and publishes its result under the given name.
     *
     * @param statement  the compiled statement
     * @param resultName the name of the result
     * @return the id of the yield operation
     * @throws TranspileException if the statement uses a feature that has no translation
     */
    public String buildStatement(CompiledStatement statement, String resultName) {
        Cursor cursor = buildSelect(statement);
        return context.addOperation(new YieldOpSpec(resultName), cursor.id());
    }

    private Cursor buildSelect(CompiledStatement statement) {
        SelectStatement select = statement.statement();
        if (select.sources().size() != 1) {
            throw TranspileException.unimplemented("multiple sources");
        }
        for (Dimension dimension : select.dimensions()) {
            if (dimension.expr() instanceof Wildcard || dimension.expr() instanceof RegexLiteral) {
                throw TranspileException.unimplemented("wildcard and regex dimensions");
            }
        }
        if (statement.fill() == FillOption.LINEAR) {
            throw TranspileException.unimplemented("fill(linear)");
        }

        StatementScope scope = new StatementScope(statement);
        context.pushScope(scope);
        try {
            if (select.sources().get(0) instanceof SubQuery) {
                scope.setSubquerySource(buildSelect(statement.subqueries().get(0)));
            }

            List<FieldGroup> groups = FieldGrouper.group(statement.fields());
            List<Expr> outputs = new ArrayList<>(groups.size());
            List<Cursor> cursors = new ArrayList<>(groups.size());
            for (FieldGroup group : groups) {
                outputs.add(group.call());
                cursors.add(buildGroup(statement, group));
            }
            Cursor cursor = cursors.size() == 1 ? cursors.get(0) : join(outputs, cursors);
            cursor = project(statement, cursor);

            if (!statement.ascending()) {
                String id = context.addOperation(new SortOpSpec(List.of(Constants.Columns.TIME), true), cursor.id());
                cursor = new PassThroughCursor(id, cursor);
            }
            if (select.limit() > 0 || select.offset() > 0) {
                String id = context.addOperation(new LimitOpSpec(select.limit(), select.offset()), cursor.id());
                cursor = new PassThroughCursor(id, cursor);
            }
            return cursor;
        } finally {
            context.popScope();
        }
    }

    private Cursor buildGroup(CompiledStatement statement, FieldGroup group) {
        List<Expr> inputs = group.inputs();
        List<Cursor> cursors = new ArrayList<>(inputs.size());
        for (Expr input : inputs) {
            cursors.add(readField(input));
        }
        Cursor cursor = cursors.size() == 1 ? cursors.get(0) : join(inputs, cursors);

        if (statement.condition() != null) {
            Cursor source = cursor;
            // Tags are not carried by the cursor; they are columns of the record under their own name
            ExpressionLowering lowering = new ExpressionLowering(
                expr -> source.valueOf(expr).or(() -> expr instanceof VarRef ref ? Optional.of(ref.name()) : Optional.empty())
            );
            SemanticNode predicate = lowering.lower(statement.condition());
            String id = context.addOperation(new FilterOpSpec(Lambdas.overRecord(predicate)), cursor.id());
            cursor = new PassThroughCursor(id, cursor);
        }

        List<String> by = new ArrayList<>();
        by.add(Constants.Columns.MEASUREMENT);
        for (Expr input : inputs) {
            if (!(input instanceof VarRef)) {
                // Wildcard and regex inputs read several fields, each one a series of its own
                by.add(Constants.Columns.FIELD);
                break;
            }
        }
        for (Dimension dimension : statement.statement().dimensions()) {
            if (dimension.expr() instanceof VarRef tag) {
                by.add(tag.name());
            }
        }
        String groupId = context.addOperation(new GroupOpSpec(by), cursor.id());
        cursor = new PassThroughCursor(groupId, cursor);

        if (group.call() != null) {
            cursor = function(statement, group.call(), cursor);
        }
        return cursor;
    }

    /**
     * Reads the raw values of a field, a wildcard or a regex into the {@code _value} column.
     */
    private Cursor readField(Expr input) {
        StatementScope scope = context.currentScope();
        Cursor subquery = scope.getSubquerySource();
        if (subquery != null) {
            if (!(input instanceof VarRef ref)) {
                throw TranspileException.unimplemented("wildcard and regex fields in subqueries");
            }
            ObjectExpression body = new ObjectExpression(
                List.of(
                    new Property(Constants.Columns.TIME, Lambdas.recordColumn(Constants.Columns.TIME)),
                    new Property(Constants.Columns.VALUE, Lambdas.recordColumn(ref.name()))
                )
            );
            String id = context.addOperation(new MapOpSpec(Lambdas.overRecord(body), true), subquery.id());
            return ColumnCursor.of(id, input, Constants.Columns.VALUE);
        }

        CompiledStatement statement = scope.getStatement();
        Measurement measurement = (Measurement) statement.statement().sources().get(0);
        String database = measurement.database() != null ? measurement.database() : defaultDatabase;
        if (database == null) {
            throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "database is required");
        }
        String retentionPolicy = measurement.retentionPolicy();
        if (retentionPolicy == null) {
            retentionPolicy = defaultRetentionPolicy != null ? defaultRetentionPolicy : Constants.Names.DEFAULT_RETENTION_POLICY;
        }
        String fromId = context.addOperation(FromOpSpec.of(database, retentionPolicy));

        TimeRange timeRange = statement.timeRange();
        String rangeId = context.addOperation(new RangeOpSpec(timeRange.min(), timeRange.max()), fromId);

        SemanticNode predicate = measurement.isRegex()
            ? new BinaryExpression(
                Operator.REGEXP_MATCH,
                Lambdas.recordColumn(Constants.Columns.MEASUREMENT),
                new RegexpLiteral(measurement.regex().pattern())
            )
            : Lambdas.columnEquals(Constants.Columns.MEASUREMENT, measurement.name());
        if (input instanceof VarRef ref) {
            predicate = new LogicalExpression(LogicalOperator.AND, predicate, Lambdas.columnEquals(Constants.Columns.FIELD, ref.name()));
        } else if (input instanceof RegexLiteral regex) {
            predicate = new LogicalExpression(
                LogicalOperator.AND,
                predicate,
                new BinaryExpression(Operator.REGEXP_MATCH, Lambdas.recordColumn(Constants.Columns.FIELD), new RegexpLiteral(regex.pattern()))
            );
        }
        String filterId = context.addOperation(new FilterOpSpec(Lambdas.overRecord(predicate)), rangeId);
        return ColumnCursor.of(filterId, input, Constants.Columns.VALUE);
    }

    /**
     * Joins pipelines on the measurement. The value of {@code exprs[i]} in {@code cursors[i]} is exposed as
     * column {@code val<i>} of the joined rows.
     */
    private Cursor join(List<Expr> exprs, List<Cursor> cursors) {
        Map<String, String> tableNames = new LinkedHashMap<>();
        Map<Expr, String> columns = new LinkedHashMap<>();
        List<Property> properties = new ArrayList<>(cursors.size());
        List<String> parents = new ArrayList<>(cursors.size());
        for (int i = 0; i < cursors.size(); i++) {
            Cursor cursor = cursors.get(i);
            Expr expr = exprs.get(i);
            String table = "t" + i;
            String column = cursor.valueOf(expr).orElseThrow(() -> new IllegalStateException("missing symbol for " + expr));

            SemanticNode value = new MemberExpression(new IdentifierExpression(Constants.Names.TABLES_PARAM), table);
            if (!Constants.Columns.VALUE.equals(column)) {
                value = new MemberExpression(value, column);
            }
            String property = "val" + i;
            properties.add(new Property(property, value));
            tableNames.put(cursor.id(), table);
            columns.put(expr, property);
            parents.add(cursor.id());
        }
        JoinOpSpec spec = new JoinOpSpec(
            List.of(Constants.Names.JOIN_KEY),
            Lambdas.overTables(new ObjectExpression(properties)),
            tableNames
        );
        return new ColumnCursor(context.addOperation(spec, parents), columns);
    }

    private Cursor function(CompiledStatement statement, Call call, Cursor cursor) {
        InfluxQLFunction function = InfluxQLFunction.lookup(call.name())
            .orElseThrow(() -> new IllegalStateException("unknown function " + call.name() + "()"));
        return switch (function) {
            case COUNT, SUM, MEAN, MEDIAN, STDDEV, SPREAD, MAX, MIN, FIRST, LAST, PERCENTILE, SAMPLE, DISTINCT, INTEGRAL ->
                reduce(statement, function, call, cursor);
            case DERIVATIVE, NON_NEGATIVE_DERIVATIVE, DIFFERENCE, NON_NEGATIVE_DIFFERENCE, CUMULATIVE_SUM ->
                transform(statement, function, call, cursor);
            case TOP, BOTTOM, MODE, ELAPSED, MOVING_AVERAGE, HOLT_WINTERS, HOLT_WINTERS_WITH_FIT ->
                throw TranspileException.unimplemented(function.getName());
            case ABS, SIN, COS, TAN, ASIN, ACOS, ATAN, ATAN2, EXP, LOG, LN, LOG2, LOG10, SQRT, POW, FLOOR, CEIL, ROUND ->
                throw new IllegalStateException("math function " + function.getName() + "() does not start a pipeline");
        };
    }

    /**
     * Aggregates and selectors reduce each GROUP BY interval to its result, then merge the intervals back into one
     * table per series.
     */
    private Cursor reduce(CompiledStatement statement, InfluxQLFunction function, Call call, Cursor cursor) {
        Interval interval = statement.interval();
        if (!interval.isZero()) {
            String id = context.addOperation(WindowOpSpec.of(interval.every(), interval.offset()), cursor.id());
            cursor = new PassThroughCursor(id, cursor);
        }

        Expr arg0 = call.args().get(0);
        if (function == InfluxQLFunction.COUNT && arg0 instanceof Call distinct) {
            // count(distinct(x)) counts the output of distinct
            String column = column(cursor, distinct.args().get(0));
            String id = context.addOperation(new DistinctOpSpec(column), cursor.id());
            cursor = new PassThroughCursor(id, cursor, distinct, column);
        }
        String column = column(cursor, arg0);
        String id = context.addOperation(reducer(function, call, column), cursor.id());
        cursor = new PassThroughCursor(id, cursor, call, column);

        if (!interval.isZero()) {
            if (statement.fill() == FillOption.NUMBER) {
                SemanticNode value = new ExpressionLowering(expr -> Optional.empty()).lower(statement.fillValue());
                cursor = new PassThroughCursor(context.addOperation(FillOpSpec.withValue(column, value), cursor.id()), cursor);
            } else if (statement.fill() == FillOption.PREVIOUS) {
                cursor = new PassThroughCursor(context.addOperation(FillOpSpec.withPrevious(column), cursor.id()), cursor);
            }
            cursor = new PassThroughCursor(context.addOperation(WindowOpSpec.unbounded(), cursor.id()), cursor);
        }
        return cursor;
    }

    private static OperationSpec reducer(InfluxQLFunction function, Call call, String column) {
        return switch (function) {
            case COUNT, SUM, MEAN, STDDEV, SPREAD -> new AggregateOpSpec(function.getName(), AggregateConfig.of(column));
            case MAX, MIN, FIRST, LAST -> new SelectorOpSpec(function.getName(), column);
            case MEDIAN -> PercentileOpSpec.median(column);
            case PERCENTILE -> new PercentileOpSpec(percentile(call.args().get(1)), PercentileOpSpec.EXACT_SELECTOR, column);
            case SAMPLE -> new SampleOpSpec(((IntegerLiteral) call.args().get(1)).value(), SampleOpSpec.RANDOM_POSITION, column);
            case DISTINCT -> new DistinctOpSpec(column);
            case INTEGRAL -> new IntegralOpSpec(unit(call), AggregateConfig.of(column));
            default -> throw new IllegalStateException("function " + function.getName() + "() does not reduce");
        };
    }

    /**
     * Transformations run on the raw points, or after the nested aggregate when they wrap one.
     */
    private Cursor transform(CompiledStatement statement, InfluxQLFunction function, Call call, Cursor cursor) {
        Expr arg0 = call.args().get(0);
        if (arg0 instanceof Call nested) {
            cursor = function(statement, nested, cursor);
        } else if (!(arg0 instanceof VarRef)) {
            throw TranspileException.unimplemented(String.format(Locale.ROOT, "%s on wildcard and regex fields", function.getName()));
        }

        String column = column(cursor, arg0);
        OperationSpec spec = switch (function) {
            case DERIVATIVE -> new DerivativeOpSpec(unit(call), false, List.of(column), Constants.Columns.TIME);
            case NON_NEGATIVE_DERIVATIVE -> new DerivativeOpSpec(unit(call), true, List.of(column), Constants.Columns.TIME);
            case DIFFERENCE -> new DifferenceOpSpec(false, List.of(column));
            case NON_NEGATIVE_DIFFERENCE -> new DifferenceOpSpec(true, List.of(column));
            case CUMULATIVE_SUM -> new CumulativeSumOpSpec(List.of(column));
            default -> throw new IllegalStateException("function " + function.getName() + "() is not a transformation");
        };
        return new PassThroughCursor(context.addOperation(spec, cursor.id()), cursor, call, column);
    }

    /**
     * The final projection: {@code _time} and one column per field, named after the field.
     */
    private Cursor project(CompiledStatement statement, Cursor cursor) {
        ExpressionLowering lowering = new ExpressionLowering(cursor::valueOf);
        List<Property> properties = new ArrayList<>();
        properties.add(new Property(Constants.Columns.TIME, Lambdas.recordColumn(Constants.Columns.TIME)));

        Map<Expr, String> columns = new LinkedHashMap<>();
        Set<String> names = new HashSet<>();
        for (CompiledField field : statement.fields()) {
            String name = uniqueName(field.name(), names);
            properties.add(new Property(name, lowering.lower(field.expr())));
            columns.put(new VarRef(name), name);
        }
        MapOpSpec spec = new MapOpSpec(Lambdas.overRecord(new ObjectExpression(properties)), true);
        return new ColumnCursor(context.addOperation(spec, cursor.id()), columns);
    }

    private static String uniqueName(String name, Set<String> names) {
        String candidate = name;
        for (int i = 1; !names.add(candidate); i++) {
            candidate = name + "_" + i;
        }
        return candidate;
    }

    private static String column(Cursor cursor, Expr expr) {
        return cursor.valueOf(expr).orElseThrow(() -> new IllegalStateException("missing symbol for " + expr));
    }

    private static double percentile(Expr arg) {
        double value = arg instanceof IntegerLiteral integer ? integer.value() : ((NumberLiteral) arg).value();
        return value / 100.0;
    }

    private static Duration unit(Call call) {
        if (call.args().size() > 1 && call.args().get(1) instanceof DurationLiteral unit) {
            return unit.value();
        }
        return DEFAULT_UNIT;
    }
}
