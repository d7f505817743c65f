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
import org.opensearch.influxql.common.TimeLiterals;

import java.io.IOException;
import java.time.Instant;

/**
 * Keeps the points with {@code start <= _time <= stop}. Both bounds are absolute; a start after the stop selects nothing.
 */
public record RangeOpSpec(Instant start, Instant stop) implements OperationSpec {

    /** Operation kind. */
    public static final String KIND = "range";

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException {
        builder.field("start", TimeLiterals.format(start));
        builder.field("stop", TimeLiterals.format(stop));
    }
}
