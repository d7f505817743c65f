/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.parser.nodes;

/**
 * A measurement source, optionally qualified with a database and retention policy. Exactly one of
 * {@code name} and {@code regex} is set.
 *
 * @param database        the database, or null when omitted
 * @param retentionPolicy the retention policy, or null when omitted
 * @param name            the measurement name
 * @param regex           the measurement pattern
 */
public record Measurement(String database, String retentionPolicy, String name, RegexLiteral regex) implements Source {

    public Measurement(String database, String retentionPolicy, String name) {
        this(database, retentionPolicy, name, null);
    }

    public boolean isRegex() {
        return regex != null;
    }
}
