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
import org.opensearch.influxql.semantic.SemanticNode;

import java.io.IOException;

/**
 * Replaces null values of a column, either with a constant or with the previous non-null value.
 *
 * @param column      the column to fill
 * @param value       the constant, null when {@code usePrevious} is set
 * @param usePrevious whether to carry the previous value forward
 */
public record FillOpSpec(String column, SemanticNode value, boolean usePrevious) implements OperationSpec {

    /** Operation kind. */
    public static final String KIND = "fill";

    public FillOpSpec {
        if (usePrevious == (value != null)) {
            throw new IllegalArgumentException("fill takes either a value or usePrevious");
        }
    }

    public static FillOpSpec withValue(String column, SemanticNode value) {
        return new FillOpSpec(column, value, false);
    }

    public static FillOpSpec withPrevious(String column) {
        return new FillOpSpec(column, null, true);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException {
        builder.field("column", column);
        if (usePrevious) {
            builder.field("usePrevious", true);
        } else {
            builder.field("value", value);
        }
    }
}
