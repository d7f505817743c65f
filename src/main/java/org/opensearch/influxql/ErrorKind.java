/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql;

/**
 * Classification of transpile failures. The message of a {@link TranspileException} is the stable contract
 * surfaced to users; the kind lets callers branch without matching on message text.
 */
public enum ErrorKind {
    /** The query text could not be parsed into a statement tree. */
    PARSE,
    /** Malformed GROUP BY, fill, condition or source shapes unrelated to a specific function. */
    SYNTAX_VALIDITY,
    /** Wrong argument count for a named function. */
    ARITY,
    /** An argument is present but of the wrong kind. */
    ARGUMENT_TYPE,
    /** An argument has the right kind but an illegal value. */
    ARGUMENT_VALUE,
    /** Otherwise valid calls or fields combined illegally. */
    COMBINATION_RULE,
    /** Unknown function name. */
    UNSUPPORTED_FUNCTION,
    /** A known feature the graph builder does not implement yet. */
    UNIMPLEMENTED
}
