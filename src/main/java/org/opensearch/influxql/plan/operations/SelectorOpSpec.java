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
import java.util.Set;

/**
 * An operation selecting one row per table by the value of a column: {@code first}, {@code last}, {@code min} or
 * {@code max}.
 */
public record SelectorOpSpec(String kind, String column) implements OperationSpec {

    /** Kinds accepted by this spec. */
    public static final Set<String> KINDS = Set.of("first", "last", "min", "max");

    public SelectorOpSpec {
        if (!KINDS.contains(kind)) {
            throw new IllegalArgumentException("unknown selector kind: " + kind);
        }
    }

    @Override
    public String getKind() {
        return kind;
    }

    @Override
    public void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException {
        builder.field("column", column);
    }
}
