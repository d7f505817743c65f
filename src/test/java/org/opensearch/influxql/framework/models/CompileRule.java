/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.framework.models;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A query and the error it must fail with, or no error if the query is valid.
 */
public record CompileRule(@JsonProperty("query") String query, @JsonProperty("error") String error) {

    public boolean expectsError() {
        return error != null && error.isEmpty() == false;
    }
}
