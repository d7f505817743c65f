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

/**
 * Computes the area under the curve of each column, per {@code unit} of time.
 */
public record IntegralOpSpec(Duration unit, AggregateConfig config) implements OperationSpec {

    /** Operation kind. */
    public static final String KIND = "integral";

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException {
        builder.field("unit", InfluxQLDuration.formatCompound(unit));
        config.writeFields(builder);
    }
}
