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
import org.opensearch.influxql.compiler.StatementCompiler;
import org.opensearch.influxql.parser.InfluxQLParser;
import org.opensearch.influxql.plan.operations.FillOpSpec;
import org.opensearch.influxql.plan.operations.FilterOpSpec;
import org.opensearch.influxql.plan.operations.FromOpSpec;
import org.opensearch.influxql.plan.operations.GroupOpSpec;
import org.opensearch.influxql.plan.operations.LimitOpSpec;
import org.opensearch.influxql.plan.operations.SortOpSpec;
import org.opensearch.influxql.plan.operations.WindowOpSpec;
import org.opensearch.influxql.semantic.IntegerLiteral;
import org.opensearch.influxql.semantic.Lambdas;
import org.opensearch.test.OpenSearchTestCase;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

public class GraphBuilderTests extends OpenSearchTestCase {

    private static final Instant NOW = Instant.parse("2010-09-15T09:00:00Z");

    private PlannerContext context;

    @Override
    public void setUp() throws Exception {
        super.setUp();
        context = new PlannerContext();
    }

    private Spec build(String query, String defaultDatabase, String defaultRetentionPolicy) {
        GraphBuilder builder = new GraphBuilder(context, defaultDatabase, defaultRetentionPolicy);
        builder.buildStatement(StatementCompiler.compile(InfluxQLParser.parse(query).statements().get(0), NOW), "0");
        Spec spec = context.toSpec();
        spec.validate();
        return spec;
    }

    private Spec build(String query) {
        return build(query, "db0", null);
    }

    private static List<String> kinds(Spec spec) {
        return spec.operations().stream().map(Operation::kind).collect(Collectors.toList());
    }

    public void testRawField() {
        Spec spec = build("SELECT value FROM cpu");
        assertEquals(List.of("from", "range", "filter", "group", "map", "yield"), kinds(spec));
        assertEquals(new FromOpSpec("db0/autogen"), spec.getOperation("from0").spec());
        assertEquals(new GroupOpSpec(List.of("_measurement")), spec.getOperation("group0").spec());
        assertEquals(List.of("map0"), spec.parentsOf("yield0"));
    }

    public void testSourceQualifiers() {
        assertEquals(new FromOpSpec("db1/rp1"), build("SELECT value FROM db1.rp1.cpu").getOperation("from0").spec());
        context = new PlannerContext();
        assertEquals(new FromOpSpec("db1/weekly"), build("SELECT value FROM db1..cpu", null, "weekly").getOperation("from0").spec());
    }

    public void testDatabaseIsRequired() {
        TranspileException e = expectThrows(TranspileException.class, () -> build("SELECT value FROM cpu", null, null));
        assertEquals(ErrorKind.SYNTAX_VALIDITY, e.getKind());
        assertEquals("database is required", e.getMessage());
        // the failed statement leaves no scope behind
        expectThrows(NoSuchElementException.class, context::currentScope);
    }

    public void testConditionAndTagGrouping() {
        Spec spec = build("SELECT mean(value) FROM cpu WHERE host = 'server01' GROUP BY region");
        assertEquals(List.of("from", "range", "filter", "filter", "group", "mean", "map", "yield"), kinds(spec));
        assertEquals(new FilterOpSpec(Lambdas.overRecord(Lambdas.columnEquals("host", "server01"))), spec.getOperation("filter1").spec());
        assertEquals(new GroupOpSpec(List.of("_measurement", "region")), spec.getOperation("group0").spec());
    }

    public void testIntervalWithFill() {
        Spec spec = build("SELECT mean(value) FROM cpu WHERE time >= now() - 1h GROUP BY time(10m) fill(0)");
        assertEquals(List.of("from", "range", "filter", "group", "window", "mean", "fill", "window", "map", "yield"), kinds(spec));
        assertEquals(WindowOpSpec.of(Duration.ofMinutes(10), Duration.ZERO), spec.getOperation("window0").spec());
        assertEquals(FillOpSpec.withValue("_value", new IntegerLiteral(0)), spec.getOperation("fill0").spec());
        assertEquals(WindowOpSpec.unbounded(), spec.getOperation("window1").spec());
    }

    public void testFillPrevious() {
        Spec spec = build("SELECT max(value) FROM cpu WHERE time >= now() - 1h GROUP BY time(10m) fill(previous)");
        assertEquals(FillOpSpec.withPrevious("_value"), spec.getOperation("fill0").spec());
    }

    public void testOrderingAndLimit() {
        Spec spec = build("SELECT value FROM cpu ORDER BY time DESC LIMIT 10 OFFSET 5");
        assertEquals(List.of("from", "range", "filter", "group", "map", "sort", "limit", "yield"), kinds(spec));
        assertEquals(new SortOpSpec(List.of("_time"), true), spec.getOperation("sort0").spec());
        assertEquals(new LimitOpSpec(10, 5), spec.getOperation("limit0").spec());
    }

    public void testMultipleCallsAreJoined() {
        Spec spec = build("SELECT mean(value), max(value) FROM cpu");
        assertEquals(
            List.of("from", "range", "filter", "group", "mean", "from", "range", "filter", "group", "max", "join", "map", "yield"),
            kinds(spec)
        );
        assertEquals(List.of("mean0", "max0"), spec.parentsOf("join0"));
    }

    public void testSubquery() {
        Spec spec = build("SELECT max(value) FROM (SELECT value FROM cpu)");
        assertEquals(List.of("from", "range", "filter", "group", "map", "map", "group", "max", "map", "yield"), kinds(spec));
        assertEquals(List.of("map0"), spec.parentsOf("map1"));
    }

    public void testUnimplementedFeatures() {
        assertEquals(
            "unimplemented: fill(linear)",
            expectThrows(TranspileException.class, () -> build("SELECT mean(value) FROM cpu GROUP BY time(1m) fill(linear)")).getMessage()
        );
        assertEquals(
            "unimplemented: multiple sources",
            expectThrows(TranspileException.class, () -> build("SELECT value FROM cpu, mem")).getMessage()
        );
        assertEquals("unimplemented: top", expectThrows(TranspileException.class, () -> build("SELECT top(value, 2) FROM cpu")).getMessage());
        TranspileException e = expectThrows(TranspileException.class, () -> build("SELECT mean(value) FROM cpu GROUP BY *"));
        assertTrue(e.isUnimplemented());
    }
}
