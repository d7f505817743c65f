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

import java.io.IOException;
import java.util.List;

/**
 * Computes a quantile of a column. With {@link #EXACT_SELECTOR} the row holding the quantile is returned; with
 * {@link #EXACT_MEAN} adjacent values are averaged into a new row.
 *
 * @param percentile the quantile, between 0 and 1
 * @param method     {@link #EXACT_SELECTOR} or {@link #EXACT_MEAN}
 * @param column     the column to read
 */
public record PercentileOpSpec(double percentile, String method, String column) implements OperationSpec {

    /** Operation kind. */
    public static final String KIND = "percentile";

    public static final String EXACT_SELECTOR = "exact_selector";
    public static final String EXACT_MEAN = "exact_mean";

    public PercentileOpSpec {
        if (!EXACT_SELECTOR.equals(method) && !EXACT_MEAN.equals(method)) {
            throw new IllegalArgumentException("unknown percentile method: " + method);
        }
    }

    /**
     * The median of a column, interpolated between the two middle values.
     */
    public static PercentileOpSpec median(String column) {
        return new PercentileOpSpec(0.5, EXACT_MEAN, column);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException {
        builder.field("percentile", percentile);
        builder.field("method", method);
        if (EXACT_SELECTOR.equals(method)) {
            builder.field("column", column);
        } else {
            new AggregateConfig(Constants.Columns.START, Constants.Columns.TIME, List.of(column)).writeFields(builder);
        }
    }
}
