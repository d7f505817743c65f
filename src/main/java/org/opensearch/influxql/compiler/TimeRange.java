/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.compiler;

import java.time.Instant;

/**
 * A closed time range derived from a WHERE clause. Either bound may be null while the condition is being read,
 * meaning the bound is not constrained.
 *
 * @param min the inclusive lower bound
 * @param max the inclusive upper bound
 */
public record TimeRange(Instant min, Instant max) {

    public static final TimeRange UNBOUNDED = new TimeRange(null, null);

    /**
     * Returns the range covered by both ranges. Unset bounds never win over set ones.
     */
    public TimeRange intersect(TimeRange other) {
        Instant newMin = min;
        if (other.min != null && (newMin == null || other.min.isAfter(newMin))) {
            newMin = other.min;
        }
        Instant newMax = max;
        if (other.max != null && (newMax == null || other.max.isBefore(newMax))) {
            newMax = other.max;
        }
        return new TimeRange(newMin, newMax);
    }

    /**
     * Replaces unset bounds with the given defaults.
     */
    public TimeRange withDefaults(Instant defaultMin, Instant defaultMax) {
        return new TimeRange(min == null ? defaultMin : min, max == null ? defaultMax : max);
    }
}
