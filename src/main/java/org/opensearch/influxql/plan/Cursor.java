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
 * The output of the operation most recently added to a pipeline, together with the columns in which it carries
 * the values of query expressions.
 */
public interface Cursor {

    /**
     * Id of the operation producing this cursor's tables.
     */
    String id();

    /**
     * The column holding the value of an expression, if this cursor carries it.
     */
    Optional<String> valueOf(Expr expr);
}
