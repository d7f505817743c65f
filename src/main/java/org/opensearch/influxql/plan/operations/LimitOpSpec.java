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

import java.io.IOException;

/**
 * Keeps at most {@code n} rows of each table after skipping {@code offset} rows. A zero {@code n} keeps every row.
 */
public record LimitOpSpec(long n, long offset) implements OperationSpec {

    /** Operation kind. */
    public static final String KIND = "limit";

    public LimitOpSpec {
        if (n < 0 || offset < 0) {
            throw new IllegalArgumentException("limit and offset must not be negative");
        }
    }

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException {
        builder.field("n", n);
        builder.field("offset", offset);
    }
}
