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

/**
 * The kind-specific payload of an operation in the emitted graph. Implementations are immutable.
 */
public interface OperationSpec {

    /**
     * The operation kind, also the prefix of the operation id, for example {@code filter} in {@code filter0}.
     * @return the kind of this operation
     */
    String getKind();

    /**
     * Write the payload fields into the currently open object.
     * @param builder the XContent builder to write to
     * @param params the serialization parameters
     * @throws IOException if an error occurs during writing
     */
    void toXContent(XContentBuilder builder, ToXContent.Params params) throws IOException;
}
