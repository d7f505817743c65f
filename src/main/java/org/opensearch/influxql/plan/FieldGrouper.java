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
import org.opensearch.influxql.compiler.InfluxQLFunction;
import org.opensearch.influxql.parser.nodes.BinaryExpr;
import org.opensearch.influxql.parser.nodes.Call;
import org.opensearch.influxql.parser.nodes.Expr;
import org.opensearch.influxql.parser.nodes.ParenExpr;
import org.opensearch.influxql.parser.nodes.RegexLiteral;
import org.opensearch.influxql.parser.nodes.VarRef;
import org.opensearch.influxql.parser.nodes.Wildcard;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Splits the SELECT list of a statement into the pipelines that compute it.
 * <p>
 * Each function call gets a pipeline of its own. Plain references are read together in one pipeline, which also
 * evaluates the single selector they may be combined with. Repeated references and calls share a pipeline.
 */
public final class FieldGrouper {

    /**
     * The inputs of one pipeline.
     *
     * @param call the function evaluated by the pipeline, or null
     * @param refs the references read alongside the call
     */
    public record FieldGroup(Call call, List<VarRef> refs) {

        public FieldGroup {
            refs = List.copyOf(refs);
        }

        /**
         * Expressions whose raw values are read from storage, the field argument of the call first.
         */
        public List<Expr> inputs() {
            Set<Expr> inputs = new LinkedHashSet<>();
            if (call != null) {
                inputs.add(fieldArgument(call));
            }
            inputs.addAll(refs);
            return new ArrayList<>(inputs);
        }
    }

    private FieldGrouper() {
        // Utility class
    }

    /**
     * Groups the compiled fields of a statement.
     *
     * @throws TranspileException if a field reads a wildcard or regex outside of a function
     */
    public static List<FieldGroup> group(List<CompiledField> fields) {
        Set<VarRef> refs = new LinkedHashSet<>();
        Set<Call> calls = new LinkedHashSet<>();
        for (CompiledField field : fields) {
            collect(field.expr(), refs, calls);
        }

        if (!refs.isEmpty()) {
            if (calls.size() > 1) {
                throw new IllegalStateException("references can be combined with at most one selector, got " + calls);
            }
            Call call = calls.isEmpty() ? null : calls.iterator().next();
            return List.of(new FieldGroup(call, new ArrayList<>(refs)));
        }

        List<FieldGroup> groups = new ArrayList<>(calls.size());
        for (Call call : calls) {
            groups.add(new FieldGroup(call, List.of()));
        }
        return groups;
    }

    /**
     * The field read by a call, looking through nested calls such as {@code derivative(mean(value))}.
     */
    public static Expr fieldArgument(Call call) {
        Expr arg0 = call.args().get(0);
        if (arg0 instanceof Call nested) {
            return fieldArgument(nested);
        }
        return arg0;
    }

    private static void collect(Expr expr, Set<VarRef> refs, Set<Call> calls) {
        if (expr instanceof VarRef ref) {
            refs.add(ref);
        } else if (expr instanceof Wildcard || expr instanceof RegexLiteral) {
            throw TranspileException.unimplemented("wildcard and regex fields");
        } else if (expr instanceof Call call) {
            Optional<InfluxQLFunction> function = InfluxQLFunction.lookup(call.name());
            if (function.isPresent() && function.get().isMath()) {
                for (Expr arg : call.args()) {
                    collect(arg, refs, calls);
                }
            } else {
                calls.add(call);
            }
        } else if (expr instanceof BinaryExpr binary) {
            collect(binary.lhs(), refs, calls);
            collect(binary.rhs(), refs, calls);
        } else if (expr instanceof ParenExpr paren) {
            collect(paren.expr(), refs, calls);
        }
    }
}
