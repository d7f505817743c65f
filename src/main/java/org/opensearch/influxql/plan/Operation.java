/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.plan;

import org.opensearch.core.xcontent.ToXContentObject;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.influxql.plan.operations.OperationSpec;

import java.io.IOException;
import java.util.Objects;

/**
 * A node of the operation graph.
 *
 * @param id   the id, unique within a {@link Spec}
 * @param spec the kind-specific payload
 */
public record Operation(String id, OperationSpec spec) implements ToXContentObject {

    public Operation {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(spec, "spec");
    }

    public String kind() {
        return spec.getKind();
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field("kind", spec.getKind());
        builder.field("id", id);
        builder.startObject("spec");
        spec.toXContent(builder, params);
        builder.endObject();
        return builder.endObject();
    }
}
