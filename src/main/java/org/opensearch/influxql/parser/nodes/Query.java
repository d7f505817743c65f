/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.parser.nodes;

import java.util.List;

/**
 * One or more statements separated by semicolons.
 */
public record Query(List<SelectStatement> statements) {

    public Query {
        statements = List.copyOf(statements);
    }
}
