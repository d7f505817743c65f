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
 * Construction of a record from named properties.
 */
public record ObjectExpression(List<Property> properties) implements SemanticNode {

    public static final String TYPE = "ObjectExpression";

    public ObjectExpression {
        properties = List.copyOf(properties);
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field(TYPE_FIELD, TYPE);
        builder.startArray("properties");
        for (Property property : properties) {
            property.toXContent(builder, params);
        }
        builder.endArray();
        return builder.endObject();
    }
}
