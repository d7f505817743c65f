/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.parser.nodes;

import java.util.List;
import java.util.Objects;

/**
 * A parsed SELECT statement.
 *
 * @param fields     the SELECT list
 * @param sources    the FROM list
 * @param condition  the WHERE expression, or null
 * @param dimensions the GROUP BY list
 * @param fill       the fill option
 * @param fillValue  the fill value when {@code fill} is {@link FillOption#NUMBER}, otherwise null
 * @param sortFields the ORDER BY list
 * @param limit      the LIMIT, 0 when absent
 * @param offset     the OFFSET, 0 when absent
 */
public record SelectStatement(
    List<Field> fields,
    List<Source> sources,
    Expr condition,
    List<Dimension> dimensions,
    FillOption fill,
    Literal fillValue,
    List<SortField> sortFields,
    int limit,
    int offset
) {

    public SelectStatement {
        fields = List.copyOf(fields);
        sources = List.copyOf(sources);
        dimensions = List.copyOf(dimensions);
        sortFields = List.copyOf(sortFields);
        Objects.requireNonNull(fill, "fill");
    }

    /**
     * Whether results are returned in ascending time order.
     */
    public boolean isAscending() {
        return sortFields.isEmpty() || sortFields.get(0).ascending();
    }
}
