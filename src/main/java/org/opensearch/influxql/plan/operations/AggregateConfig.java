/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.plan.operations;

import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.influxql.common.Constants;

import java.io.IOException;
import java.util.List;

/**
 * Shared configuration of the operations that reduce a table to one row. The row takes its time from
 * {@code timeSrc} and writes it to {@code timeDst}.
 */
public record AggregateConfig(String timeSrc, String timeDst, List<String> columns) {

    public AggregateConfig {
        columns = List.copyOf(columns);
    }

    /**
     * Aggregates a single column, stamping the result with the start of its window.
     */
    public static AggregateConfig of(String column) {
        return new AggregateConfig(Constants.Columns.START, Constants.Columns.TIME, List.of(column));
    }

    void writeFields(XContentBuilder builder) throws IOException {
        builder.field("timeSrc", timeSrc);
        builder.field("timeDst", timeDst);
        builder.field("columns", columns);
    }
}
