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
import java.util.List;

/**
 * A lambda over named parameters.
 */
public record FunctionExpression(List<String> params, SemanticNode body) implements SemanticNode {

    public static final String TYPE = "FunctionExpression";

    public FunctionExpression {
        params = List.copyOf(params);
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field(TYPE_FIELD, TYPE);
        builder.startArray("params");
        for (String param : this.params) {
            builder.startObject();
            builder.field(TYPE_FIELD, "FunctionParam");
            builder.startObject("key").field(TYPE_FIELD, "Identifier").field("name", param).endObject();
            builder.endObject();
        }
        builder.endArray();
        builder.field("body", body);
        return builder.endObject();
    }
}
