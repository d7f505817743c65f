/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.compiler;

import java.time.Duration;

/**
 * The GROUP BY time bucketing of a statement.
 *
 * @param every  the bucket width, zero when the statement has no time dimension
 * @param offset the phase shift of the buckets, in {@code [0, every)}
 */
public record Interval(Duration every, Duration offset) {

    public static final Interval NONE = new Interval(Duration.ZERO, Duration.ZERO);

    public boolean isZero() {
        return every.isZero();
    }
}
