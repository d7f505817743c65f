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
import org.opensearch.influxql.parser.InfluxQLParser;
import org.opensearch.influxql.parser.nodes.Call;
import org.opensearch.influxql.parser.nodes.FillOption;
import org.opensearch.influxql.parser.nodes.VarRef;
import org.opensearch.test.OpenSearchTestCase;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

public class StatementCompilerTests extends OpenSearchTestCase {

    private static final Instant NOW = Instant.parse("2010-09-15T09:00:00Z");

    private static CompiledStatement compile(String query) {
        return StatementCompiler.compile(InfluxQLParser.parse(query).statements().get(0), NOW);
    }

    private static TranspileException compileError(String query) {
        return expectThrows(TranspileException.class, () -> compile(query));
    }

    public void testRawQueryDefaults() {
        CompiledStatement statement = compile("SELECT value FROM cpu");
        assertEquals(1, statement.fields().size());
        assertEquals("value", statement.fields().get(0).name());
        assertNull(statement.condition());
        assertEquals(new TimeRange(Constants.TimeBounds.MIN_TIME, Constants.TimeBounds.MAX_TIME), statement.timeRange());
        assertTrue(statement.interval().isZero());
        assertEquals(FillOption.NULL, statement.fill());
        assertTrue(statement.ascending());
        assertTrue(statement.functionCalls().isEmpty());
        assertTrue(statement.subqueries().isEmpty());
    }

    public void testTimeFieldIsSkipped() {
        CompiledStatement statement = compile("SELECT time, value FROM cpu");
        assertEquals(1, statement.fields().size());
        assertEquals(new VarRef("value"), statement.fields().get(0).expr());
    }

    public void testIntervalQueryStopsAtNow() {
        CompiledStatement statement = compile("SELECT mean(value) FROM cpu WHERE time >= now() - 1h GROUP BY time(10m)");
        assertEquals(new TimeRange(NOW.minus(Duration.ofHours(1)), NOW), statement.timeRange());
        assertEquals(new Interval(Duration.ofMinutes(10), Duration.ZERO), statement.interval());
        assertFalse(statement.inheritedInterval());
    }

    public void testIntervalOffsetIsNormalized() {
        assertEquals(
            new Interval(Duration.ofHours(1), Duration.ofMinutes(30)),
            compile("SELECT mean(value) FROM cpu GROUP BY time(1h, 90m)").interval()
        );
        assertEquals(
            new Interval(Duration.ofHours(1), Duration.ofMinutes(45)),
            compile("SELECT mean(value) FROM cpu GROUP BY time(1h, -15m)").interval()
        );
        // now() is 09:00, a whole number of hours
        assertEquals(
            new Interval(Duration.ofHours(1), Duration.ZERO),
            compile("SELECT mean(value) FROM cpu GROUP BY time(1h, now())").interval()
        );
    }

    public void testConditionAndOrdering() {
        CompiledStatement statement = compile("SELECT value FROM cpu WHERE host = 'server01' ORDER BY time DESC");
        assertEquals(InfluxQLParser.parseExpr("host = 'server01'"), statement.condition());
        assertFalse(statement.ascending());
    }

    public void testFunctionCallsIncludeNestedCalls() {
        CompiledStatement statement = compile(
            "SELECT derivative(mean(value), 1s) FROM cpu WHERE time >= now() - 1h GROUP BY time(1m)"
        );
        List<String> names = statement.functionCalls().stream().map(Call::name).collect(Collectors.toList());
        assertEquals(List.of("derivative", "mean"), names);
    }

    public void testMathCallsAreNotFunctionCalls() {
        CompiledStatement statement = compile("SELECT sqrt(value) FROM cpu");
        assertTrue(statement.functionCalls().isEmpty());

        statement = compile("SELECT abs(max(value)) FROM cpu");
        assertEquals(1, statement.functionCalls().size());
        assertEquals("max", statement.functionCalls().get(0).name());
    }

    public void testDistinctIsRewrittenToCall() {
        CompiledStatement statement = compile("SELECT DISTINCT value FROM cpu");
        assertEquals(new Call("distinct", List.of(new VarRef("value"))), statement.fields().get(0).expr());
        assertEquals(1, statement.functionCalls().size());
    }

    public void testSubqueryInheritsIntervalAndTimeRange() {
        CompiledStatement statement = compile(
            "SELECT mean(value) FROM (SELECT value FROM cpu WHERE time >= now() - 1h) WHERE time >= now() - 10m GROUP BY time(1m)"
        );
        assertEquals(1, statement.subqueries().size());
        CompiledStatement subquery = statement.subqueries().get(0);
        assertEquals(new TimeRange(NOW.minus(Duration.ofMinutes(10)), NOW), subquery.timeRange());
        assertEquals(new Interval(Duration.ofMinutes(1), Duration.ZERO), subquery.interval());
        assertTrue(subquery.inheritedInterval());
        assertEquals(FillOption.NULL, subquery.fill());
    }

    public void testSubqueryWithIntervalDoesNotFillNulls() {
        CompiledStatement statement = compile(
            "SELECT max(mean) FROM (SELECT mean(value) FROM cpu GROUP BY time(1m)) WHERE time >= now() - 1h"
        );
        CompiledStatement subquery = statement.subqueries().get(0);
        assertEquals(FillOption.NONE, subquery.fill());
        assertFalse(subquery.inheritedInterval());
    }

    public void testSubqueryOrderingMustMatch() {
        TranspileException e = compileError("SELECT value FROM (SELECT value FROM cpu ORDER BY time DESC)");
        assertEquals("subqueries must be ordered in the same direction as the query itself", e.getMessage());
    }

    public void testDimensionErrors() {
        assertEquals("time() is a function and expects at least one argument", compileError("SELECT mean(value) FROM cpu GROUP BY time").getMessage());
        assertEquals("only time() calls allowed in dimensions", compileError("SELECT mean(value) FROM cpu GROUP BY mean(value)").getMessage());
        TranspileException e = compileError("SELECT mean(value) FROM cpu GROUP BY time()");
        assertEquals(ErrorKind.ARITY, e.getKind());
        assertEquals("time dimension expected 1 or 2 arguments", e.getMessage());
        assertEquals(
            "multiple time dimensions not allowed",
            compileError("SELECT mean(value) FROM cpu GROUP BY time(1m), time(2m)").getMessage()
        );
        assertEquals(
            "time dimension offset function must be now()",
            compileError("SELECT mean(value) FROM cpu GROUP BY time(1m, mean(value))").getMessage()
        );
    }

    public void testFieldErrors() {
        assertEquals("GROUP BY requires at least one aggregate function", compileError("SELECT value FROM cpu GROUP BY time(1m)").getMessage());
        assertEquals("fill(none) must be used with a function", compileError("SELECT value FROM cpu fill(none)").getMessage());
        assertEquals(
            "mixing aggregate and non-aggregate queries is not supported",
            compileError("SELECT mean(value), host FROM cpu").getMessage()
        );
        assertEquals(
            "mixing multiple selector functions with tags or fields is not supported",
            compileError("SELECT max(value), min(value), host FROM cpu").getMessage()
        );
        assertEquals("field must contain at least one variable", compileError("SELECT 1 FROM cpu").getMessage());
        assertEquals(
            "cannot perform a binary expression on two literals",
            compileError("SELECT 'a' + 1 FROM cpu").getMessage()
        );
    }

    public void testUndefinedFunction() {
        TranspileException e = compileError("SELECT foo(value) FROM cpu");
        assertEquals(ErrorKind.UNSUPPORTED_FUNCTION, e.getKind());
        assertEquals("undefined function foo()", e.getMessage());
    }

    public void testTopBottomRules() {
        assertEquals("limit (0) in top function must be at least 1", compileError("SELECT top(value, 0) FROM cpu").getMessage());
        assertEquals(
            "limit (5) in bottom function can not be larger than the LIMIT (3) in the select statement",
            compileError("SELECT bottom(value, 5) FROM cpu LIMIT 3").getMessage()
        );
        assertEquals(
            "selector function top() cannot be combined with other functions",
            compileError("SELECT top(value, 1), mean(value) FROM cpu").getMessage()
        );
        CompiledStatement statement = compile("SELECT top(value, host, 2) FROM cpu");
        assertEquals(1, statement.functionCalls().size());
    }

    public void testDistinctCombination() {
        assertEquals(
            "aggregate function distinct() cannot be combined with other functions or fields",
            compileError("SELECT distinct(value), mean(value) FROM cpu").getMessage()
        );
    }

    public void testTimeDimensionOverflow() {
        TranspileException e = compileError(
            "SELECT max(value) FROM cpu WHERE time >= now() - 1m GROUP BY time(10s, '3000-01-01T00:00:00Z')"
        );
        assertEquals(ErrorKind.ARGUMENT_VALUE, e.getKind());
        assertEquals("time dimension offset 3000-01-01T00:00:00Z overflows time literal", e.getMessage());

        e = compileError("SELECT max(value) FROM cpu GROUP BY time(10000w * 100)");
        assertEquals(ErrorKind.ARGUMENT_VALUE, e.getKind());
        assertEquals("time dimension duration overflows", e.getMessage());

        e = compileError("SELECT max(value) FROM cpu GROUP BY time(1m, 10000w * 100)");
        assertEquals(ErrorKind.ARGUMENT_VALUE, e.getKind());
        assertEquals("time dimension offset overflows", e.getMessage());
    }

    public void testSampleWindowOfOne() {
        TranspileException e = compileError("SELECT sample(value, 1) FROM cpu");
        assertEquals(ErrorKind.ARGUMENT_VALUE, e.getKind());
        assertEquals("sample window must be greater than 1, got 1", e.getMessage());
    }
}
