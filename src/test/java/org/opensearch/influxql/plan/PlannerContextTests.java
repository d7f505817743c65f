/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.plan;

import org.opensearch.influxql.compiler.CompiledStatement;
import org.opensearch.influxql.compiler.StatementCompiler;
import org.opensearch.influxql.parser.InfluxQLParser;
import org.opensearch.influxql.plan.operations.FromOpSpec;
import org.opensearch.influxql.plan.operations.LimitOpSpec;
import org.opensearch.influxql.plan.operations.YieldOpSpec;
import org.opensearch.test.OpenSearchTestCase;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

public class PlannerContextTests extends OpenSearchTestCase {

    public void testIdsAreNumberedPerKind() {
        PlannerContext context = new PlannerContext();
        assertEquals("from0", context.addOperation(new FromOpSpec("db0/autogen")));
        assertEquals("from1", context.addOperation(new FromOpSpec("db1/autogen")));
        assertEquals("limit0", context.addOperation(new LimitOpSpec(1, 0), "from0"));
        assertEquals("yield0", context.addOperation(new YieldOpSpec("0"), List.of("limit0", "from1")));
        assertEquals(4, context.operationCount());

        Spec spec = context.toSpec();
        assertEquals(List.of(new Edge("from0", "limit0"), new Edge("limit0", "yield0"), new Edge("from1", "yield0")), spec.edges());
        assertEquals(List.of("limit0", "from1"), spec.parentsOf("yield0"));
        spec.validate();
    }

    public void testToSpecIsASnapshot() {
        PlannerContext context = new PlannerContext();
        context.addOperation(new FromOpSpec("db0/autogen"));
        Spec spec = context.toSpec();
        context.addOperation(new YieldOpSpec("0"), "from0");
        assertEquals(1, spec.operations().size());
        assertEquals(2, context.toSpec().operations().size());
    }

    public void testScopes() {
        PlannerContext context = new PlannerContext();
        NoSuchElementException e = expectThrows(NoSuchElementException.class, context::currentScope);
        assertEquals("no statement is being planned", e.getMessage());

        CompiledStatement outer = StatementCompiler.compile(InfluxQLParser.parse("SELECT value FROM cpu").statements().get(0), Instant.EPOCH);
        CompiledStatement inner = StatementCompiler.compile(InfluxQLParser.parse("SELECT host FROM mem").statements().get(0), Instant.EPOCH);
        PlannerContext.StatementScope outerScope = new PlannerContext.StatementScope(outer);
        context.pushScope(outerScope);
        context.pushScope(new PlannerContext.StatementScope(inner));
        assertSame(inner, context.currentScope().getStatement());
        assertNull(context.currentScope().getSubquerySource());

        context.popScope();
        assertSame(outerScope, context.currentScope());
        outerScope.setSubquerySource(new ColumnCursor("map0", Map.of()));
        assertEquals("map0", outerScope.getSubquerySource().id());
        expectThrows(IllegalStateException.class, () -> outerScope.setSubquerySource(new ColumnCursor("map1", Map.of())));
    }
}
