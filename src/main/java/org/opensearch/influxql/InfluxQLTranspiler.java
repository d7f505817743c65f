/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.influxql.compiler.CompiledStatement;
import org.opensearch.influxql.compiler.StatementCompiler;
import org.opensearch.influxql.parser.InfluxQLParser;
import org.opensearch.influxql.parser.nodes.Query;
import org.opensearch.influxql.parser.nodes.SelectStatement;
import org.opensearch.influxql.plan.GraphBuilder;
import org.opensearch.influxql.plan.PlannerContext;
import org.opensearch.influxql.plan.Spec;

import java.time.Instant;
import java.util.List;

/**
 * Translates InfluxQL queries into operation graphs.
 * <p>
 * Every statement of a query is compiled and built in order into one {@link Spec}, its result published under the
 * statement's index. The first failure aborts the whole query. Instances hold no mutable state and may be shared.
 */
public class InfluxQLTranspiler {

    private static final Logger logger = LogManager.getLogger(InfluxQLTranspiler.class);

    private final TranspilerConfig config;

    public InfluxQLTranspiler(TranspilerConfig config) {
        this.config = config;
    }

    /**
     * Parses and translates a query.
     *
     * @param query the query text, statements separated by semicolons
     * @return the validated operation graph
     * @throws TranspileException if the query is malformed, violates a rule of the language, or uses a feature
     *                            that has no translation
     */
    public Spec transpile(String query) {
        return transpile(InfluxQLParser.parse(query));
    }

    /**
     * Translates a parsed query.
     *
     * @param query the parsed query
     * @return the validated operation graph
     * @throws TranspileException if the query violates a rule of the language, or uses a feature that has no
     *                            translation
     */
    public Spec transpile(Query query) {
        Instant now = config.getNowClock().instant();
        PlannerContext context = new PlannerContext();
        GraphBuilder builder = new GraphBuilder(context, config.getDefaultDatabase(), config.getDefaultRetentionPolicy());

        List<SelectStatement> statements = query.statements();
        try {
            for (int i = 0; i < statements.size(); i++) {
                CompiledStatement compiled = StatementCompiler.compile(statements.get(i), now);
                builder.buildStatement(compiled, Integer.toString(i));
            }
        } catch (TranspileException e) {
            if (e.isUnimplemented()) {
                logger.debug("Rejected query using an untranslated feature: {}", e.getMessage());
            }
            throw e;
        }

        Spec spec = context.toSpec();
        spec.validate();
        logger.debug("Transpiled {} statement(s) into {} operation(s)", statements.size(), context.operationCount());
        return spec;
    }

    public TranspilerConfig getConfig() {
        return config;
    }
}
