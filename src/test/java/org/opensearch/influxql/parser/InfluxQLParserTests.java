/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.parser;

import org.opensearch.influxql.ErrorKind;
import org.opensearch.influxql.TranspileException;
import org.opensearch.influxql.parser.nodes.BinaryExpr;
import org.opensearch.influxql.parser.nodes.BinaryOperator;
import org.opensearch.influxql.parser.nodes.Call;
import org.opensearch.influxql.parser.nodes.Dimension;
import org.opensearch.influxql.parser.nodes.Distinct;
import org.opensearch.influxql.parser.nodes.DurationLiteral;
import org.opensearch.influxql.parser.nodes.FillOption;
import org.opensearch.influxql.parser.nodes.IntegerLiteral;
import org.opensearch.influxql.parser.nodes.Measurement;
import org.opensearch.influxql.parser.nodes.NumberLiteral;
import org.opensearch.influxql.parser.nodes.ParenExpr;
import org.opensearch.influxql.parser.nodes.Query;
import org.opensearch.influxql.parser.nodes.RegexLiteral;
import org.opensearch.influxql.parser.nodes.SelectStatement;
import org.opensearch.influxql.parser.nodes.StringLiteral;
import org.opensearch.influxql.parser.nodes.SubQuery;
import org.opensearch.influxql.parser.nodes.VarRef;
import org.opensearch.influxql.parser.nodes.Wildcard;
import org.opensearch.test.OpenSearchTestCase;

import java.time.Duration;
import java.util.List;

public class InfluxQLParserTests extends OpenSearchTestCase {

    private static SelectStatement parseSingle(String query) {
        Query parsed = InfluxQLParser.parse(query);
        assertEquals(1, parsed.statements().size());
        return parsed.statements().get(0);
    }

    public void testParseFullStatement() {
        SelectStatement statement = parseSingle(
            "SELECT mean(value) AS avg FROM db0..cpu WHERE host = 'server01' GROUP BY time(1m), host fill(0) "
                + "ORDER BY time DESC LIMIT 10 OFFSET 2"
        );

        assertEquals(1, statement.fields().size());
        assertEquals(new Call("mean", List.of(new VarRef("value"))), statement.fields().get(0).expr());
        assertEquals("avg", statement.fields().get(0).alias());
        assertEquals(List.of(new Measurement("db0", null, "cpu")), statement.sources());
        assertEquals(new BinaryExpr(BinaryOperator.EQ, new VarRef("host"), new StringLiteral("server01")), statement.condition());
        assertEquals(
            List.of(
                new Dimension(new Call("time", List.of(new DurationLiteral(Duration.ofMinutes(1))))),
                new Dimension(new VarRef("host"))
            ),
            statement.dimensions()
        );
        assertEquals(FillOption.NUMBER, statement.fill());
        assertEquals(new IntegerLiteral(0), statement.fillValue());
        assertFalse(statement.isAscending());
        assertEquals(10, statement.limit());
        assertEquals(2, statement.offset());
    }

    public void testParseMultipleStatements() {
        Query query = InfluxQLParser.parse("SELECT a FROM b; SELECT c FROM d;");
        assertEquals(2, query.statements().size());
        assertEquals(new VarRef("c"), query.statements().get(1).fields().get(0).expr());
    }

    public void testParseMeasurementQualifiers() {
        assertEquals(new Measurement(null, null, "cpu"), parseSingle("SELECT value FROM cpu").sources().get(0));
        assertEquals(new Measurement(null, "alternate", "cpu"), parseSingle("SELECT value FROM alternate.cpu").sources().get(0));
        assertEquals(new Measurement("db0", "alternate", "cpu"), parseSingle("SELECT value FROM db0.alternate.cpu").sources().get(0));
        assertEquals(new Measurement("db0", null, "cpu"), parseSingle("SELECT value FROM \"db0\"..\"cpu\"").sources().get(0));
    }

    public void testParseRegexMeasurement() {
        Measurement measurement = (Measurement) parseSingle("SELECT value FROM /^cpu/").sources().get(0);
        assertTrue(measurement.isRegex());
        assertNull(measurement.name());
        assertEquals(new RegexLiteral("^cpu"), measurement.regex());
    }

    public void testParseSubquery() {
        SelectStatement statement = parseSingle("SELECT max(mean) FROM (SELECT mean(value) FROM cpu GROUP BY host)");
        SubQuery subquery = (SubQuery) statement.sources().get(0);
        assertEquals(new Call("mean", List.of(new VarRef("value"))), subquery.statement().fields().get(0).expr());
        assertEquals(List.of(new Dimension(new VarRef("host"))), subquery.statement().dimensions());
    }

    public void testOperatorPrecedence() {
        assertEquals(
            new BinaryExpr(
                BinaryOperator.ADD,
                new VarRef("a"),
                new BinaryExpr(BinaryOperator.MUL, new VarRef("b"), new VarRef("c"))
            ),
            InfluxQLParser.parseExpr("a + b * c")
        );
        BinaryExpr or = (BinaryExpr) InfluxQLParser.parseExpr("a = 1 AND b = 2 OR c = 3");
        assertEquals(BinaryOperator.OR, or.op());
        assertEquals(BinaryOperator.AND, ((BinaryExpr) or.lhs()).op());
        assertEquals(
            new BinaryExpr(BinaryOperator.SUB, new BinaryExpr(BinaryOperator.SUB, new VarRef("a"), new VarRef("b")), new VarRef("c")),
            InfluxQLParser.parseExpr("a - b - c")
        );
    }

    public void testParseUnaryMinus() {
        assertEquals(new IntegerLiteral(-5), InfluxQLParser.parseExpr("-5"));
        assertEquals(new NumberLiteral(-2.5), InfluxQLParser.parseExpr("-2.5"));
        assertEquals(new DurationLiteral(Duration.ofMinutes(-10)), InfluxQLParser.parseExpr("-10m"));
        assertEquals(new BinaryExpr(BinaryOperator.MUL, new IntegerLiteral(-1), new VarRef("x")), InfluxQLParser.parseExpr("-x"));
    }

    public void testParseCallsAndWildcards() {
        assertEquals(new Call("count", List.of(new Wildcard())), InfluxQLParser.parseExpr("COUNT(*)"));
        assertEquals(new Call("max", List.of(new RegexLiteral("val"))), InfluxQLParser.parseExpr("max(/val/)"));
        assertEquals(new Call("now", List.of()), InfluxQLParser.parseExpr("now()"));
        assertEquals(new Call("distinct", List.of(new VarRef("value"))), InfluxQLParser.parseExpr("distinct(value)"));
        assertEquals(new Distinct("value"), InfluxQLParser.parseExpr("distinct value"));
        assertEquals(new ParenExpr(new VarRef("a")), InfluxQLParser.parseExpr("(a)"));
    }

    public void testParseFillOptions() {
        assertEquals(FillOption.NULL, parseSingle("SELECT mean(v) FROM cpu GROUP BY time(1m)").fill());
        assertEquals(FillOption.NONE, parseSingle("SELECT mean(v) FROM cpu GROUP BY time(1m) fill(none)").fill());
        assertEquals(FillOption.PREVIOUS, parseSingle("SELECT mean(v) FROM cpu GROUP BY time(1m) fill(previous)").fill());
        assertEquals(FillOption.LINEAR, parseSingle("SELECT mean(v) FROM cpu GROUP BY time(1m) fill(linear)").fill());

        SelectStatement negative = parseSingle("SELECT mean(v) FROM cpu GROUP BY time(1m) fill(-1.5)");
        assertEquals(FillOption.NUMBER, negative.fill());
        assertEquals(new NumberLiteral(-1.5), negative.fillValue());

        TranspileException e = expectThrows(
            TranspileException.class,
            () -> InfluxQLParser.parse("SELECT mean(v) FROM cpu GROUP BY time(1m) fill(sideways)")
        );
        assertEquals(ErrorKind.PARSE, e.getKind());
    }

    public void testOrderByOnlyTime() {
        assertTrue(parseSingle("SELECT value FROM cpu ORDER BY time ASC").isAscending());
        assertFalse(parseSingle("SELECT value FROM cpu ORDER BY DESC").isAscending());

        TranspileException e = expectThrows(TranspileException.class, () -> InfluxQLParser.parse("SELECT value FROM cpu ORDER BY host"));
        assertEquals(ErrorKind.SYNTAX_VALIDITY, e.getKind());
        assertEquals("only ORDER BY time supported at this time", e.getMessage());
    }

    public void testSeriesLimitsAreUnimplemented() {
        TranspileException e = expectThrows(TranspileException.class, () -> InfluxQLParser.parse("SELECT value FROM cpu SLIMIT 1"));
        assertTrue(e.isUnimplemented());
        e = expectThrows(TranspileException.class, () -> InfluxQLParser.parse("SELECT value FROM cpu SOFFSET 1"));
        assertTrue(e.isUnimplemented());
    }

    public void testParseErrors() {
        for (String query : List.of("", "SELECT", "SELECT value", "SELECT value FROM", "SELECT value FROM cpu WHERE", "DELETE FROM cpu")) {
            TranspileException e = expectThrows(TranspileException.class, () -> InfluxQLParser.parse(query));
            assertEquals(query, ErrorKind.PARSE, e.getKind());
        }
    }

    public void testInvalidLimit() {
        TranspileException e = expectThrows(TranspileException.class, () -> InfluxQLParser.parse("SELECT value FROM cpu LIMIT 'ten'"));
        assertEquals(ErrorKind.PARSE, e.getKind());
    }
}
