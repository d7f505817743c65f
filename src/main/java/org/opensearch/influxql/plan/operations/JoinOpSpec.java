/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.plan.operations;

import org.opensearch.core.xcontent.ToXContent;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.influxql.semantic.FunctionExpression;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Joins the tables of several parents on the given columns. Each parent is bound to a table name, and {@code fn}
 * builds the output row from the {@code tables} parameter.
 *
 * @param on         the join key columns
 * @param fn         the row constructor over the joined tables
 * @param tableNames parent operation id to table name, in parent order
 */
public record JoinOpSpec(List<String> on, FunctionExpression fn, Map<String, String> tableNames) implements OperationSpec {

    /** Operation kind. */
    public static final String KIND = "join";

    public JoinOpSpec {
        on = List.copyOf(on);
        tableNames = Collections.unmodifiableMap(new LinkedHashMap<>(tableNames));
    }

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException {
        builder.field("on", on);
        builder.field("fn", fn);
        builder.startObject("tableNames");
        for (Map.Entry<String, String> entry : tableNames.entrySet()) {
            builder.field(entry.getKey(), entry.getValue());
        }
        builder.endObject();
    }
}
