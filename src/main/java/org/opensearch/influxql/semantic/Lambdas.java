/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.semantic;

import org.opensearch.influxql.common.Constants;

import java.util.List;

/**
 * Factory methods for the lambdas embedded in operations.
 */
public final class Lambdas {

    private Lambdas() {
        // Utility class
    }

    /**
     * A lambda over a single record parameter {@code r}.
     */
    public static FunctionExpression overRecord(SemanticNode body) {
        return new FunctionExpression(List.of(Constants.Names.RECORD_PARAM), body);
    }

    /**
     * A lambda over the joined tables parameter {@code tables}.
     */
    public static FunctionExpression overTables(SemanticNode body) {
        return new FunctionExpression(List.of(Constants.Names.TABLES_PARAM), body);
    }

    /**
     * Access to a column of the record parameter, {@code r.<column>}.
     */
    public static MemberExpression recordColumn(String column) {
        return new MemberExpression(new IdentifierExpression(Constants.Names.RECORD_PARAM), column);
    }

    /**
     * The predicate {@code r.<column> == "<value>"}.
     */
    public static BinaryExpression columnEquals(String column, String value) {
        return new BinaryExpression(Operator.EQUAL, recordColumn(column), new StringLiteral(value));
    }
}
