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
import org.opensearch.influxql.semantic.FunctionExpression;

import java.io.IOException;

/**
 * Keeps the records for which the predicate returns true.
 *
 * @param fn a predicate over the record parameter
 */
public record FilterOpSpec(FunctionExpression fn) implements OperationSpec {

    /** Operation kind. */
    public static final String KIND = "filter";

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException {
        builder.field("fn", fn);
    }
}
