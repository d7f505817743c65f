/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql;

import com.carrotsearch.randomizedtesting.annotations.ParametersFactory;
import org.opensearch.influxql.framework.YamlLoader;
import org.opensearch.influxql.framework.models.CompileRule;
import org.opensearch.influxql.framework.models.CompileRuleSet;
import org.opensearch.test.OpenSearchTestCase;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks that queries are accepted or rejected with the messages InfluxQL users expect. Queries rejected only
 * because their translation is not implemented are skipped.
 */
public class InfluxQLCompileRulesTests extends OpenSearchTestCase {

    private static final String RULES = "transpiler/compile_rules.yaml";

    private final String defaultDatabase;
    private final CompileRule rule;

    public InfluxQLCompileRulesTests(String query, String defaultDatabase, CompileRule rule) {
        this.defaultDatabase = defaultDatabase;
        this.rule = rule;
    }

    @ParametersFactory(argumentFormatting = "%1$s")
    public static Iterable<Object[]> parameters() {
        try {
            CompileRuleSet rules = YamlLoader.loadCompileRules(RULES);
            List<Object[]> testCases = new ArrayList<>();
            for (CompileRule rule : rules.cases()) {
                testCases.add(new Object[] { rule.query(), rules.defaultDatabase(), rule });
            }
            return testCases;
        } catch (IOException e) {
            throw new RuntimeException("Failed to load compile rules: " + e.getMessage(), e);
        }
    }

    public void testCompileRule() {
        InfluxQLTranspiler transpiler = new InfluxQLTranspiler(TranspilerConfig.builder().defaultDatabase(defaultDatabase).build());
        try {
            transpiler.transpile(rule.query());
        } catch (TranspileException e) {
            if (e.getMessage().equals(rule.error())) {
                return;
            }
            assumeFalse(e.getMessage(), e.isUnimplemented());
            fail("Unexpected error for [" + rule.query() + "]: got [" + e.getMessage() + "], want [" + rule.error() + "]");
        }
        if (rule.expectsError()) {
            fail("Expected error for [" + rule.query() + "]: " + rule.error());
        }
    }
}
