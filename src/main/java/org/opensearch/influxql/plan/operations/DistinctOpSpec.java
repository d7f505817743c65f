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
 * Emits one row per distinct value of a column.
 */
public record DistinctOpSpec(String column) implements OperationSpec {

    /** Operation kind. */
    public static final String KIND = "distinct";

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException {
        builder.field("column", column);
    }
}
