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
import org.opensearch.influxql.common.Constants;
import org.opensearch.influxql.common.InfluxQLDuration;

import java.io.IOException;
import java.time.Duration;

/**
 * Splits each table into time windows of {@code period}, starting every {@code every}, shifted by {@code offset}.
 * Windows derive their bounds from the data rather than from the range of the query.
 */
public record WindowOpSpec(
    Duration every,
    Duration period,
    Duration offset,
    boolean ignoreGlobalBounds,
    String timeCol,
    String startColLabel,
    String stopColLabel
) implements OperationSpec {

    /** Operation kind. */
    public static final String KIND = "window";

    /** A window wide enough to hold any point in time. */
    public static final Duration FOREVER = Duration.ofNanos(Long.MAX_VALUE);

    public WindowOpSpec {
        if (every.isNegative() || every.isZero()) {
            throw new IllegalArgumentException("window every must be positive, got " + every);
        }
    }

    /**
     * Tumbling windows of the given width.
     */
    public static WindowOpSpec of(Duration every, Duration offset) {
        return new WindowOpSpec(
            every,
            every,
            offset,
            true,
            Constants.Columns.TIME,
            Constants.Columns.START,
            Constants.Columns.STOP
        );
    }

    /**
     * A single window over all time, used to merge the per-interval tables back into one table per group.
     */
    public static WindowOpSpec unbounded() {
        return of(FOREVER, Duration.ZERO);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException {
        builder.field("every", InfluxQLDuration.formatCompound(every));
        builder.field("period", InfluxQLDuration.formatCompound(period));
        if (!offset.isZero()) {
            builder.field("offset", InfluxQLDuration.formatCompound(offset));
        }
        builder.field("ignoreGlobalBounds", ignoreGlobalBounds);
        builder.field("timeCol", timeCol);
        builder.field("startColLabel", startColLabel);
        builder.field("stopColLabel", stopColLabel);
    }
}
