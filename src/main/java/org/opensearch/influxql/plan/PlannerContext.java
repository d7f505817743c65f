/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.plan;

import org.opensearch.influxql.compiler.CompiledStatement;
import org.opensearch.influxql.plan.operations.OperationSpec;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * PlannerContext holds the state of one transpilation: the operations and edges emitted so far, the per-kind id
 * counters, and a stack with one scope per statement being built. A subquery pushes its own scope on top of the
 * scope of the statement reading from it.
 * <p>
 * A context belongs to a single call and is never shared, so independent calls need no coordination.
 */
public class PlannerContext {

    private final IdGenerator idGenerator = new IdGenerator();
    private final List<Operation> operations = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();
    private final Deque<StatementScope> scopes = new ArrayDeque<>();

    /**
     * The statement being built. When the statement reads from a subquery, the subquery is built in a scope of its
     * own pushed on top of this one, and its final cursor becomes the source of this scope.
     */
    public static final class StatementScope {
        private final CompiledStatement statement;
        private Cursor subquerySource;

        public StatementScope(CompiledStatement statement) {
            this.statement = statement;
        }

        public CompiledStatement getStatement() {
            return statement;
        }

        /**
         * The cursor producing the rows of the subquery source, or null when reading a measurement.
         */
        public Cursor getSubquerySource() {
            return subquerySource;
        }

        void setSubquerySource(Cursor subquerySource) {
            if (this.subquerySource != null) {
                throw new IllegalStateException("subquery source already set");
            }
            this.subquerySource = subquerySource;
        }
    }

    /**
     * Appends an operation fed by the given parents.
     *
     * @param spec    the payload of the operation
     * @param parents ids of the operations feeding this one, in order
     * @return the id of the new operation
     */
    public String addOperation(OperationSpec spec, String... parents) {
        String id = idGenerator.nextId(spec.getKind());
        operations.add(new Operation(id, spec));
        for (String parent : parents) {
            edges.add(new Edge(parent, id));
        }
        return id;
    }

    /**
     * Appends an operation fed by the given parents.
     */
    public String addOperation(OperationSpec spec, List<String> parents) {
        return addOperation(spec, parents.toArray(new String[0]));
    }

    public void pushScope(StatementScope scope) {
        scopes.push(scope);
    }

    public StatementScope popScope() {
        return scopes.pop();
    }

    /**
     * The scope of the innermost statement being built.
     * @throws NoSuchElementException if no statement is being built
     */
    public StatementScope currentScope() {
        StatementScope scope = scopes.peek();
        if (scope == null) {
            throw new NoSuchElementException("no statement is being planned");
        }
        return scope;
    }

    public int operationCount() {
        return operations.size();
    }

    /**
     * Assembles the operations and edges emitted so far.
     */
    public Spec toSpec() {
        return new Spec(operations, edges);
    }

    private static class IdGenerator {
        private final Map<String, Integer> counters = new HashMap<>();

        String nextId(String kind) {
            int next = counters.merge(kind, 1, Integer::sum) - 1;
            return kind + next;
        }
    }
}
