/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.plan;

import org.opensearch.influxql.parser.nodes.Expr;

import java.util.Optional;

/**
 * A cursor over an operation that keeps the columns of its parent, such as a filter, group or window.
 * An optional {@code expr} is additionally exposed in {@code column}, which is how a function result is
 * made available to the expressions downstream.
 */
public record PassThroughCursor(String id, Cursor parent, Expr expr, String column) implements Cursor {

    public PassThroughCursor(String id, Cursor parent) {
        this(id, parent, null, null);
    }

    @Override
    public Optional<String> valueOf(Expr other) {
        if (expr != null && expr.equals(other)) {
            return Optional.of(column);
        }
        return parent.valueOf(other);
    }
}
