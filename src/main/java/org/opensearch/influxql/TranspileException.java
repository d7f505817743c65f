/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql;

import java.util.Locale;
import java.util.Objects;

/**
 * Raised when a query cannot be transpiled. The message is kept verbatim from the legacy query engine so
 * existing clients that match on it keep working.
 */
public class TranspileException extends IllegalArgumentException {

    /** Prefix of the message raised for features that are recognized but not implemented. */
    public static final String UNIMPLEMENTED_PREFIX = "unimplemented: ";

    private final ErrorKind kind;

    public TranspileException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public TranspileException(ErrorKind kind, String format, Object... args) {
        this(kind, String.format(Locale.ROOT, format, args));
    }

    /**
     * Creates the marker for a recognized feature that has no operator graph translation.
     *
     * @param feature the feature name, for example a function name
     */
    public static TranspileException unimplemented(String feature) {
        return new TranspileException(ErrorKind.UNIMPLEMENTED, UNIMPLEMENTED_PREFIX + feature);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Whether callers may downgrade this failure to a skip instead of a hard error.
     */
    public boolean isUnimplemented() {
        return kind == ErrorKind.UNIMPLEMENTED;
    }
}
