/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.semantic;

import org.opensearch.core.xcontent.ToXContentObject;

/**
 * A node of the lambda intermediate form used by filter, map and join operations. Nodes are immutable values and
 * serialize as objects carrying a {@code type} discriminator.
 */
public interface SemanticNode extends ToXContentObject {

    /** Name of the discriminator field. */
    String TYPE_FIELD = "type";

    /**
     * The node type written to the {@code type} field.
     */
    String getType();
}
