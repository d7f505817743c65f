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
import java.util.List;

/**
 * Replaces each value with the running total of the column.
 */
public record CumulativeSumOpSpec(List<String> columns) implements OperationSpec {

    /** Operation kind. */
    public static final String KIND = "cumulativeSum";

    public CumulativeSumOpSpec {
        columns = List.copyOf(columns);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException {
        builder.field("columns", columns);
    }
}
