/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.plan;

import org.opensearch.influxql.parser.nodes.Expr;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A cursor with a fixed mapping from expressions to columns. Produced where the set of columns is defined anew:
 * reading a field, reading a subquery column, and joining pipelines.
 */
public record ColumnCursor(String id, Map<Expr, String> columns) implements Cursor {

    public ColumnCursor {
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public static ColumnCursor of(String id, Expr expr, String column) {
        return new ColumnCursor(id, Map.of(expr, column));
    }

    @Override
    public Optional<String> valueOf(Expr expr) {
        return Optional.ofNullable(columns.get(expr));
    }
}
