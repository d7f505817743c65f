/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.parser.nodes;

import org.opensearch.influxql.common.TimeLiterals;

/**
 * A single-quoted string.
 */
public record StringLiteral(String value) implements Literal {

    /**
     * Whether the string is shaped like a date or date-time and may be used where a time is expected.
     */
    public boolean isTimeLiteral() {
        return TimeLiterals.isTimeString(value);
    }

    /**
     * Converts this string into a time literal.
     *
     * @throws IllegalArgumentException if the string is not a valid time
     */
    public TimeLiteral toTimeLiteral() {
        return new TimeLiteral(TimeLiterals.parse(value));
    }

    @Override
    public <T> T accept(InfluxQLASTVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return InfluxQLExpressionPrinter.print(this);
    }
}
