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
 * A named entry of an object expression.
 */
public record Property(String key, SemanticNode value) implements SemanticNode {

    public static final String TYPE = "Property";

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field(TYPE_FIELD, TYPE);
        builder.startObject("key").field(TYPE_FIELD, "Identifier").field("name", key).endObject();
        builder.field("value", value);
        return builder.endObject();
    }
}
