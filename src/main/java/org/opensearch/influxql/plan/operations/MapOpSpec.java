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

/**
 * Replaces every record with the object built by {@code fn}. With {@code mergeKey} the group key columns are kept.
 */
public record MapOpSpec(FunctionExpression fn, boolean mergeKey) implements OperationSpec {

    /** Operation kind. */
    public static final String KIND = "map";

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException {
        builder.field("fn", fn);
        builder.field("mergeKey", mergeKey);
    }
}
