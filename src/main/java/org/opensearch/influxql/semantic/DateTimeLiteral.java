/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.semantic;

import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.influxql.common.TimeLiterals;

import java.io.IOException;
import java.time.Instant;

/**
 * An absolute time constant, written as RFC 3339.
 */
public record DateTimeLiteral(Instant value) implements SemanticNode {

    public static final String TYPE = "DateTimeLiteral";

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field(TYPE_FIELD, TYPE);
        builder.field("value", TimeLiterals.format(value));
        return builder.endObject();
    }
}
