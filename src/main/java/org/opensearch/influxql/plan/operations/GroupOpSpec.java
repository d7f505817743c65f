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

import java.io.IOException;
import java.util.List;

/**
 * Regroups the input into one table per distinct combination of the given columns.
 */
public record GroupOpSpec(List<String> by) implements OperationSpec {

    /** Operation kind. */
    public static final String KIND = "group";

    public GroupOpSpec {
        by = List.copyOf(by);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException {
        builder.field("by", by);
    }
}
