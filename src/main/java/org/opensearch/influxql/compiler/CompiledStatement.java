/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.compiler;

import org.opensearch.influxql.parser.nodes.Call;
import org.opensearch.influxql.parser.nodes.Expr;
import org.opensearch.influxql.parser.nodes.FillOption;
import org.opensearch.influxql.parser.nodes.Literal;
import org.opensearch.influxql.parser.nodes.SelectStatement;

import java.util.List;

/**
 * A validated SELECT statement with its WHERE clause split into a condition and a resolved time range.
 *
 * @param statement         the statement as parsed
 * @param fields            the non-time fields in SELECT order
 * @param condition         the non-time part of the WHERE clause, or null
 * @param timeRange         the resolved time range, both bounds set
 * @param interval          the GROUP BY time interval, {@link Interval#NONE} when absent
 * @param inheritedInterval whether the interval was inherited from an enclosing statement
 * @param fill              the fill option
 * @param fillValue         the fill value for {@link FillOption#NUMBER}
 * @param ascending         whether results are in ascending time order
 * @param functionCalls     every aggregate, selector and transformation call, nested calls included
 * @param subqueries        the compiled subqueries, in source order
 */
public record CompiledStatement(
    SelectStatement statement,
    List<CompiledField> fields,
    Expr condition,
    TimeRange timeRange,
    Interval interval,
    boolean inheritedInterval,
    FillOption fill,
    Literal fillValue,
    boolean ascending,
    List<Call> functionCalls,
    List<CompiledStatement> subqueries
) {

    public CompiledStatement {
        fields = List.copyOf(fields);
        functionCalls = List.copyOf(functionCalls);
        subqueries = List.copyOf(subqueries);
    }
}
