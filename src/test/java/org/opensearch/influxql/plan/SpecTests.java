/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.plan;

import org.opensearch.influxql.TestUtils;
import org.opensearch.influxql.plan.operations.FromOpSpec;
import org.opensearch.influxql.plan.operations.LimitOpSpec;
import org.opensearch.influxql.plan.operations.YieldOpSpec;
import org.opensearch.test.OpenSearchTestCase;

import java.io.IOException;
import java.util.List;
import java.util.Map;

public class SpecTests extends OpenSearchTestCase {

    private static final Operation FROM = new Operation("from0", new FromOpSpec("db0/autogen"));
    private static final Operation LIMIT = new Operation("limit0", new LimitOpSpec(10, 0));
    private static final Operation YIELD = new Operation("yield0", new YieldOpSpec("0"));

    private static void assertInvalid(String message, Spec spec) {
        IllegalStateException e = expectThrows(IllegalStateException.class, spec::validate);
        assertEquals(message, e.getMessage());
    }

    public void testValidSpec() {
        Spec spec = new Spec(List.of(FROM, LIMIT, YIELD), List.of(new Edge("from0", "limit0"), new Edge("limit0", "yield0")));
        spec.validate();
        assertSame(LIMIT, spec.getOperation("limit0"));
        assertNull(spec.getOperation("limit1"));
        assertEquals(List.of("limit0"), spec.parentsOf("yield0"));
        assertEquals(List.of(), spec.parentsOf("from0"));
    }

    public void testParentsInEdgeOrder() {
        Operation from1 = new Operation("from1", new FromOpSpec("db0/autogen"));
        Spec spec = new Spec(List.of(FROM, from1, YIELD), List.of(new Edge("from1", "yield0"), new Edge("from0", "yield0")));
        spec.validate();
        assertEquals(List.of("from1", "from0"), spec.parentsOf("yield0"));
    }

    public void testDuplicates() {
        assertInvalid("duplicate operation id: from0", new Spec(List.of(FROM, FROM), List.of()));
        Operation other = new Operation("yield1", new YieldOpSpec("0"));
        assertInvalid(
            "duplicate yield name: 0",
            new Spec(List.of(FROM, YIELD, other), List.of(new Edge("from0", "yield0"), new Edge("from0", "yield1")))
        );
    }

    public void testUnknownEndpoints() {
        assertInvalid("edge references unknown parent: range0", new Spec(List.of(FROM, YIELD), List.of(new Edge("range0", "yield0"))));
        assertInvalid("edge references unknown child: range0", new Spec(List.of(FROM, YIELD), List.of(new Edge("from0", "range0"))));
    }

    public void testSourcesAndSinks() {
        Operation from1 = new Operation("from1", new FromOpSpec("db0/autogen"));
        assertInvalid(
            "source operation has a parent: from1",
            new Spec(List.of(FROM, from1, YIELD), List.of(new Edge("from0", "from1"), new Edge("from1", "yield0")))
        );
        assertInvalid(
            "operation has no parent: limit0",
            new Spec(List.of(FROM, LIMIT, YIELD), List.of(new Edge("from0", "yield0"), new Edge("limit0", "yield0")))
        );
        assertInvalid(
            "operation has no child: limit0",
            new Spec(List.of(FROM, LIMIT, YIELD), List.of(new Edge("from0", "limit0"), new Edge("from0", "yield0")))
        );
    }

    public void testCycle() {
        Operation limit1 = new Operation("limit1", new LimitOpSpec(5, 0));
        Spec spec = new Spec(
            List.of(FROM, LIMIT, limit1, YIELD),
            List.of(new Edge("from0", "limit0"), new Edge("limit0", "limit1"), new Edge("limit1", "limit0"), new Edge("limit1", "yield0"))
        );
        assertInvalid("operation graph contains a cycle", spec);
    }

    @SuppressWarnings("unchecked")
    public void testToJson() throws IOException {
        Spec spec = new Spec(List.of(FROM, YIELD), List.of(new Edge("from0", "yield0")));
        Map<String, Object> json = TestUtils.parseJson(spec.toJson());

        List<Map<String, Object>> operations = (List<Map<String, Object>>) json.get("operations");
        assertEquals(2, operations.size());
        assertEquals(Map.of("kind", "from", "id", "from0", "spec", Map.of("bucket", "db0/autogen")), operations.get(0));
        assertEquals("yield", operations.get(1).get("kind"));
        assertEquals(List.of(Map.of("parent", "from0", "child", "yield0")), json.get("edges"));
    }
}
