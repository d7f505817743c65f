/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.compiler;

import org.opensearch.influxql.parser.nodes.Expr;
import org.opensearch.influxql.parser.nodes.Field;

/**
 * A SELECT list entry after constant folding.
 *
 * @param field the field as written
 * @param expr  the folded expression, with {@code DISTINCT x} rewritten to {@code distinct(x)}
 */
public record CompiledField(Field field, Expr expr) {

    /**
     * The output column name of the field.
     */
    public String name() {
        return field.name();
    }
}
