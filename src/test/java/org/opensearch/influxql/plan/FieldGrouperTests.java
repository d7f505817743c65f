/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.plan;

import org.opensearch.influxql.TranspileException;
import org.opensearch.influxql.compiler.CompiledField;
import org.opensearch.influxql.compiler.StatementCompiler;
import org.opensearch.influxql.parser.InfluxQLParser;
import org.opensearch.influxql.parser.nodes.Call;
import org.opensearch.influxql.parser.nodes.Expr;
import org.opensearch.influxql.parser.nodes.Field;
import org.opensearch.influxql.parser.nodes.RegexLiteral;
import org.opensearch.influxql.parser.nodes.VarRef;
import org.opensearch.influxql.plan.FieldGrouper.FieldGroup;
import org.opensearch.test.OpenSearchTestCase;

import java.time.Instant;
import java.util.List;

public class FieldGrouperTests extends OpenSearchTestCase {

    private static List<FieldGroup> group(String query) {
        return FieldGrouper.group(StatementCompiler.compile(InfluxQLParser.parse(query).statements().get(0), Instant.EPOCH).fields());
    }

    private static VarRef ref(String name) {
        return new VarRef(name);
    }

    public void testOneGroupPerCall() {
        List<FieldGroup> groups = group("SELECT mean(value), max(usage) FROM cpu");
        assertEquals(2, groups.size());
        assertEquals("mean", groups.get(0).call().name());
        assertEquals(List.of(ref("value")), groups.get(0).inputs());
        assertEquals("max", groups.get(1).call().name());
        assertEquals(List.of(ref("usage")), groups.get(1).inputs());
    }

    public void testIdenticalCallsShareAGroup() {
        assertEquals(1, group("SELECT mean(value), mean(value) * 2 FROM cpu").size());
    }

    public void testReferencesJoinTheSelector() {
        List<FieldGroup> groups = group("SELECT max(value), host FROM cpu");
        assertEquals(1, groups.size());
        assertEquals("max", groups.get(0).call().name());
        assertEquals(List.of(ref("host")), groups.get(0).refs());
        assertEquals(List.of(ref("value"), ref("host")), groups.get(0).inputs());
    }

    public void testRawReferences() {
        List<FieldGroup> groups = group("SELECT a + b, sqrt(a) FROM cpu");
        assertEquals(1, groups.size());
        assertNull(groups.get(0).call());
        assertEquals(List.of(ref("a"), ref("b")), groups.get(0).inputs());
    }

    public void testMathCallsAreTransparent() {
        List<FieldGroup> groups = group("SELECT abs(mean(value)) FROM cpu");
        assertEquals(1, groups.size());
        assertEquals("mean", groups.get(0).call().name());
    }

    public void testRawWildcardIsUnimplemented() {
        TranspileException e = expectThrows(TranspileException.class, () -> group("SELECT * FROM cpu"));
        assertTrue(e.isUnimplemented());
        RegexLiteral pattern = new RegexLiteral("^u");
        List<CompiledField> regex = List.of(new CompiledField(new Field(pattern), pattern));
        expectThrows(TranspileException.class, () -> FieldGrouper.group(regex));
    }

    public void testFieldArgument() {
        Expr nested = InfluxQLParser.parseExpr("derivative(mean(value), 1s)");
        assertEquals(ref("value"), FieldGrouper.fieldArgument((Call) nested));
        assertEquals(ref("x"), FieldGrouper.fieldArgument((Call) InfluxQLParser.parseExpr("count(x)")));
    }
}
