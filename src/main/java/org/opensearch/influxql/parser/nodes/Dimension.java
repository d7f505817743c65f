/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.parser.nodes;

/**
 * A GROUP BY entry: a tag reference, a {@code time()} call, a wildcard or a regex.
 */
public record Dimension(Expr expr) {}
