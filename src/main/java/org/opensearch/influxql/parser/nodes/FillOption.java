/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.parser.nodes;

/**
 * How empty GROUP BY time windows are filled.
 */
public enum FillOption {
    /** Emit null for empty windows, the default. */
    NULL,
    /** Drop empty windows. */
    NONE,
    /** Emit a fixed number. */
    NUMBER,
    /** Repeat the previous value. */
    PREVIOUS,
    /** Interpolate between neighbouring values. */
    LINEAR
}
