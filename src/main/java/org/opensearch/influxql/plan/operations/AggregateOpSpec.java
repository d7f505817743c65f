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
 * A reducing operation configured only by its {@link AggregateConfig}: {@code count}, {@code sum}, {@code mean},
 * {@code stddev} or {@code spread}.
 */
public record AggregateOpSpec(String kind, AggregateConfig config) implements OperationSpec {

    /** Kinds accepted by this spec. */
    public static final Set<String> KINDS = Set.of("count", "sum", "mean", "stddev", "spread");

    public AggregateOpSpec {
        if (!KINDS.contains(kind)) {
            throw new IllegalArgumentException("unknown aggregate kind: " + kind);
        }
    }

    @Override
    public String getKind() {
        return kind;
    }

    @Override
    public void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException {
        config.writeFields(builder);
    }
}
