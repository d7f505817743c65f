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
 * Selects every {@code n}-th row of a table, beginning at {@code pos}. A negative position picks a random start.
 */
public record SampleOpSpec(long n, long pos, String column) implements OperationSpec {

    /** Operation kind. */
    public static final String KIND = "sample";

    /** Position that picks a random start in every table. */
    public static final long RANDOM_POSITION = -1;

    public SampleOpSpec {
        if (n <= 0) {
            throw new IllegalArgumentException("sample n must be positive, got " + n);
        }
    }

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException {
        builder.field("n", n);
        builder.field("pos", pos);
        builder.field("column", column);
    }
}
