/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.semantic;

import org.opensearch.core.xcontent.XContentBuilder;

import java.io.IOException;

/**
 * Boolean conjunction or disjunction.
 */
public record LogicalExpression(LogicalOperator operator, SemanticNode left, SemanticNode right) implements SemanticNode {

    public static final String TYPE = "LogicalExpression";

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field(TYPE_FIELD, TYPE);
        builder.field("operator", operator.getSymbol());
        builder.field("left", left);
        builder.field("right", right);
        return builder.endObject();
    }
}
