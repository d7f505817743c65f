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
import java.util.Objects;

/**
 * Reads every point of a bucket. A bucket is named {@code <database>/<retention policy>}.
 *
 * @param bucket the bucket to read
 */
public record FromOpSpec(String bucket) implements OperationSpec {

    /** Operation kind. */
    public static final String KIND = "from";

    public FromOpSpec {
        Objects.requireNonNull(bucket, "bucket");
    }

    /**
     * Creates the spec for the bucket of a database and retention policy.
     */
    public static FromOpSpec of(String database, String retentionPolicy) {
        return new FromOpSpec(database + "/" + retentionPolicy);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    @Override
    public void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException {
        builder.field("bucket", bucket);
    }
}
