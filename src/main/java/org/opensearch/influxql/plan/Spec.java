/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.plan;

import org.opensearch.common.xcontent.XContentFactory;
import org.opensearch.core.xcontent.ToXContent;
import org.opensearch.core.xcontent.ToXContentObject;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.influxql.plan.operations.FromOpSpec;
import org.opensearch.influxql.plan.operations.YieldOpSpec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The operation graph produced for a query: operations in creation order and the edges between them.
 * <p>
 * A valid spec is a directed acyclic graph in which only {@code from} operations have no parent, only
 * {@code yield} operations have no child, and every yield publishes a distinct name.
 */
public record Spec(List<Operation> operations, List<Edge> edges) implements ToXContentObject {

    public Spec {
        operations = List.copyOf(operations);
        edges = List.copyOf(edges);
    }

    /**
     * Returns the operation with the given id, or null.
     */
    public Operation getOperation(String id) {
        for (Operation operation : operations) {
            if (operation.id().equals(id)) {
                return operation;
            }
        }
        return null;
    }

    /**
     * Ids of the parents of an operation, in edge order.
     */
    public List<String> parentsOf(String id) {
        List<String> parents = new ArrayList<>();
        for (Edge edge : edges) {
            if (edge.child().equals(id)) {
                parents.add(edge.parent());
            }
        }
        return parents;
    }

    /**
     * Checks the structural invariants of the graph.
     *
     * @throws IllegalStateException describing the first violation found
     */
    public void validate() {
        Map<String, Operation> byId = new HashMap<>();
        Set<String> yieldNames = new HashSet<>();
        for (Operation operation : operations) {
            if (byId.put(operation.id(), operation) != null) {
                throw new IllegalStateException("duplicate operation id: " + operation.id());
            }
            if (operation.spec() instanceof YieldOpSpec yield && !yieldNames.add(yield.name())) {
                throw new IllegalStateException("duplicate yield name: " + yield.name());
            }
        }

        Map<String, List<String>> children = new HashMap<>();
        Map<String, Integer> inDegree = new HashMap<>();
        for (Edge edge : edges) {
            if (!byId.containsKey(edge.parent())) {
                throw new IllegalStateException("edge references unknown parent: " + edge.parent());
            } else if (!byId.containsKey(edge.child())) {
                throw new IllegalStateException("edge references unknown child: " + edge.child());
            }
            children.computeIfAbsent(edge.parent(), k -> new ArrayList<>()).add(edge.child());
            inDegree.merge(edge.child(), 1, Integer::sum);
        }

        for (Operation operation : operations) {
            boolean isSource = operation.spec() instanceof FromOpSpec;
            boolean hasParent = inDegree.containsKey(operation.id());
            if (isSource == hasParent) {
                throw new IllegalStateException(
                    isSource ? "source operation has a parent: " + operation.id() : "operation has no parent: " + operation.id()
                );
            }
            if (!(operation.spec() instanceof YieldOpSpec) && !children.containsKey(operation.id())) {
                throw new IllegalStateException("operation has no child: " + operation.id());
            }
        }

        // Kahn's algorithm: every operation is visited exactly when the graph has no cycle
        Deque<String> ready = new ArrayDeque<>();
        for (Operation operation : operations) {
            if (!inDegree.containsKey(operation.id())) {
                ready.add(operation.id());
            }
        }
        int visited = 0;
        while (!ready.isEmpty()) {
            String id = ready.poll();
            visited++;
            for (String child : children.getOrDefault(id, List.of())) {
                if (inDegree.merge(child, -1, Integer::sum) == 0) {
                    ready.add(child);
                }
            }
        }
        if (visited != operations.size()) {
            throw new IllegalStateException("operation graph contains a cycle");
        }
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.startArray("operations");
        for (Operation operation : operations) {
            operation.toXContent(builder, params);
        }
        builder.endArray();
        builder.startArray("edges");
        for (Edge edge : edges) {
            edge.toXContent(builder, params);
        }
        builder.endArray();
        return builder.endObject();
    }

    /**
     * Renders the spec as JSON.
     */
    public String toJson() {
        try (XContentBuilder builder = XContentFactory.jsonBuilder()) {
            toXContent(builder, ToXContent.EMPTY_PARAMS);
            return builder.toString();
        } catch (IOException e) {
            throw new UncheckedIOException("failed to render spec", e);
        }
    }
}
