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
import org.opensearch.influxql.common.InfluxQLDuration;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Computes the rate of change between consecutive rows per {@code unit} of time. Negative rates are dropped when
 * {@code nonNegative} is set.
 */
public record DerivativeOpSpec(Duration unit, boolean nonNegative, List<String> columns, String timeSrc) implements OperationSpec {

    /** Operation kind. */
    public static final String KIND = "derivative";

    public DerivativeOpSpec {
        columns = List.copyOf(columns);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException {
        builder.field("unit", InfluxQLDuration.formatCompound(unit));
        builder.field("nonNegative", nonNegative);
        builder.field("columns", columns);
        builder.field("timeSrc", timeSrc);
    }
}
