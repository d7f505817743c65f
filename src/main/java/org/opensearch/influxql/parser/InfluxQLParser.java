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
import org.opensearch.influxql.common.Constants;
import org.opensearch.influxql.common.InfluxQLDuration;
import org.opensearch.influxql.parser.nodes.BinaryExpr;
import org.opensearch.influxql.parser.nodes.BinaryOperator;
import org.opensearch.influxql.parser.nodes.BooleanLiteral;
import org.opensearch.influxql.parser.nodes.Call;
import org.opensearch.influxql.parser.nodes.Dimension;
import org.opensearch.influxql.parser.nodes.Distinct;
import org.opensearch.influxql.parser.nodes.DurationLiteral;
import org.opensearch.influxql.parser.nodes.Expr;
import org.opensearch.influxql.parser.nodes.Field;
import org.opensearch.influxql.parser.nodes.FillOption;
import org.opensearch.influxql.parser.nodes.IntegerLiteral;
import org.opensearch.influxql.parser.nodes.Literal;
import org.opensearch.influxql.parser.nodes.Measurement;
import org.opensearch.influxql.parser.nodes.NumberLiteral;
import org.opensearch.influxql.parser.nodes.ParenExpr;
import org.opensearch.influxql.parser.nodes.Query;
import org.opensearch.influxql.parser.nodes.RegexLiteral;
import org.opensearch.influxql.parser.nodes.SelectStatement;
import org.opensearch.influxql.parser.nodes.SortField;
import org.opensearch.influxql.parser.nodes.Source;
import org.opensearch.influxql.parser.nodes.StringLiteral;
import org.opensearch.influxql.parser.nodes.SubQuery;
import org.opensearch.influxql.parser.nodes.VarRef;
import org.opensearch.influxql.parser.nodes.Wildcard;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Recursive-descent parser for InfluxQL SELECT statements.
 */
public class InfluxQLParser {

    private final List<Token> tokens;
    private int index;

    private InfluxQLParser(String query) {
        this.tokens = new Scanner(query).scanAll();
    }

    /**
     * Parses one or more semicolon separated SELECT statements.
     *
     * @param query the query text
     * @return the parsed query
     * @throws TranspileException with kind {@link ErrorKind#PARSE} if the text is not valid InfluxQL
     */
    public static Query parse(String query) {
        return new InfluxQLParser(query).parseQuery();
    }

    /**
     * Parses a single expression, for example a WHERE condition.
     */
    public static Expr parseExpr(String expr) {
        InfluxQLParser parser = new InfluxQLParser(expr);
        Expr result = parser.parseExpr();
        parser.expect(TokenType.EOF, "EOF");
        return result;
    }

    private Query parseQuery() {
        List<SelectStatement> statements = new ArrayList<>();
        while (true) {
            while (accept(TokenType.SEMICOLON)) {
                // skip empty statements
            }
            if (peek().type() == TokenType.EOF) {
                break;
            }
            statements.add(parseSelect());
            if (peek().type() != TokenType.EOF) {
                expect(TokenType.SEMICOLON, ";");
            }
        }
        if (statements.isEmpty()) {
            throw error(peek(), "SELECT");
        }
        return new Query(statements);
    }

    private SelectStatement parseSelect() {
        expect(TokenType.SELECT, "SELECT");
        List<Field> fields = parseFields();
        expect(TokenType.FROM, "FROM");
        List<Source> sources = parseSources();

        Expr condition = null;
        if (accept(TokenType.WHERE)) {
            condition = parseExpr();
        }

        List<Dimension> dimensions = new ArrayList<>();
        if (accept(TokenType.GROUP)) {
            expect(TokenType.BY, "BY");
            do {
                dimensions.add(new Dimension(parseExpr()));
            } while (accept(TokenType.COMMA));
        }

        FillOption fill = FillOption.NULL;
        Literal fillValue = null;
        if (accept(TokenType.FILL)) {
            expect(TokenType.LPAREN, "(");
            Token token = next();
            switch (token.type()) {
                case IDENT -> fill = parseFillOption(token);
                case INTEGER, NUMBER -> {
                    fill = FillOption.NUMBER;
                    fillValue = parseNumber(token, false);
                }
                case SUB -> {
                    Token number = next();
                    if (number.type() != TokenType.INTEGER && number.type() != TokenType.NUMBER) {
                        throw error(number, "number");
                    }
                    fill = FillOption.NUMBER;
                    fillValue = parseNumber(number, true);
                }
                default -> throw error(token, "fill option");
            }
            expect(TokenType.RPAREN, ")");
        }

        List<SortField> sortFields = new ArrayList<>();
        if (accept(TokenType.ORDER)) {
            expect(TokenType.BY, "BY");
            do {
                sortFields.add(parseSortField());
            } while (accept(TokenType.COMMA));
        }

        int limit = 0;
        int offset = 0;
        if (accept(TokenType.LIMIT)) {
            limit = parseInt(next());
        }
        if (accept(TokenType.OFFSET)) {
            offset = parseInt(next());
        }
        if (accept(TokenType.SLIMIT)) {
            parseInt(next());
            throw TranspileException.unimplemented("slimit");
        }
        if (accept(TokenType.SOFFSET)) {
            parseInt(next());
            throw TranspileException.unimplemented("soffset");
        }
        return new SelectStatement(fields, sources, condition, dimensions, fill, fillValue, sortFields, limit, offset);
    }

    private List<Field> parseFields() {
        List<Field> fields = new ArrayList<>();
        do {
            Expr expr = parseExpr();
            String alias = null;
            if (accept(TokenType.AS)) {
                alias = expectIdent();
            }
            fields.add(new Field(expr, alias));
        } while (accept(TokenType.COMMA));
        return fields;
    }

    private List<Source> parseSources() {
        List<Source> sources = new ArrayList<>();
        do {
            if (accept(TokenType.LPAREN)) {
                SelectStatement statement = parseSelect();
                expect(TokenType.RPAREN, ")");
                sources.add(new SubQuery(statement));
            } else {
                sources.add(parseMeasurement());
            }
        } while (accept(TokenType.COMMA));
        return sources;
    }

    /**
     * Parses {@code [db.[rp.]]name}, where each qualifier may be empty as in {@code db..cpu}.
     */
    private Measurement parseMeasurement() {
        List<String> segments = new ArrayList<>();
        RegexLiteral regex = null;
        while (true) {
            Token token = peek();
            if (token.type() == TokenType.IDENT) {
                segments.add(next().text());
            } else if (token.type() == TokenType.REGEX) {
                regex = new RegexLiteral(next().text());
                segments.add(null);
                break;
            } else {
                segments.add("");
            }
            if (!accept(TokenType.DOT)) {
                break;
            }
        }

        String name = segments.get(segments.size() - 1);
        if ((name != null && name.isEmpty()) || segments.size() > 3) {
            throw error(peek(), "identifier");
        }
        String retentionPolicy = segments.size() >= 2 ? emptyToNull(segments.get(segments.size() - 2)) : null;
        String database = segments.size() == 3 ? emptyToNull(segments.get(0)) : null;
        return new Measurement(database, retentionPolicy, name, regex);
    }

    private SortField parseSortField() {
        Token token = next();
        if (token.type() == TokenType.ASC || token.type() == TokenType.DESC) {
            return new SortField(Constants.Names.TIME, token.type() == TokenType.ASC);
        } else if (token.type() != TokenType.IDENT) {
            throw error(token, "identifier, ASC, or DESC");
        }
        if (!Constants.Names.TIME.equals(token.text())) {
            throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "only ORDER BY time supported at this time");
        }
        boolean ascending = true;
        if (accept(TokenType.DESC)) {
            ascending = false;
        } else {
            accept(TokenType.ASC);
        }
        return new SortField(token.text(), ascending);
    }

    private FillOption parseFillOption(Token token) {
        return switch (token.text().toLowerCase(Locale.ROOT)) {
            case "null" -> FillOption.NULL;
            case "none" -> FillOption.NONE;
            case "previous" -> FillOption.PREVIOUS;
            case "linear" -> FillOption.LINEAR;
            default -> throw error(token, "null, none, previous, linear or a number");
        };
    }

    Expr parseExpr() {
        return parseBinary(1);
    }

    private Expr parseBinary(int minPrecedence) {
        Expr lhs = parseUnary();
        while (true) {
            BinaryOperator op = peek().type().getOperator();
            if (op == null || op.getPrecedence() < minPrecedence) {
                return lhs;
            }
            next();
            Expr rhs = parseBinary(op.getPrecedence() + 1);
            lhs = new BinaryExpr(op, lhs, rhs);
        }
    }

    private Expr parseUnary() {
        Token token = next();
        switch (token.type()) {
            case LPAREN -> {
                Expr expr = parseExpr();
                expect(TokenType.RPAREN, ")");
                return new ParenExpr(expr);
            }
            case SUB -> {
                TokenType nextType = peek().type();
                if (nextType == TokenType.INTEGER || nextType == TokenType.NUMBER) {
                    return parseNumber(next(), true);
                } else if (nextType == TokenType.DURATION) {
                    return new DurationLiteral(parseDuration(next()).negated());
                }
                return new BinaryExpr(BinaryOperator.MUL, new IntegerLiteral(-1), parseUnary());
            }
            case ADD -> {
                return parseUnary();
            }
            case MUL -> {
                return new Wildcard();
            }
            case DISTINCT -> {
                if (peek().type() == TokenType.LPAREN) {
                    next();
                    return new Call("distinct", parseArgs());
                }
                return new Distinct(expectIdent());
            }
            case IDENT -> {
                if (accept(TokenType.LPAREN)) {
                    return new Call(token.text().toLowerCase(Locale.ROOT), parseArgs());
                }
                return new VarRef(token.text());
            }
            case STRING -> {
                return new StringLiteral(token.text());
            }
            case INTEGER, NUMBER -> {
                return parseNumber(token, false);
            }
            case DURATION -> {
                return new DurationLiteral(parseDuration(token));
            }
            case TRUE, FALSE -> {
                return new BooleanLiteral(token.type() == TokenType.TRUE);
            }
            case REGEX -> {
                return new RegexLiteral(token.text());
            }
            default -> throw error(token, "identifier, string, number, bool");
        }
    }

    private List<Expr> parseArgs() {
        List<Expr> args = new ArrayList<>();
        if (accept(TokenType.RPAREN)) {
            return args;
        }
        do {
            args.add(parseExpr());
        } while (accept(TokenType.COMMA));
        expect(TokenType.RPAREN, ")");
        return args;
    }

    private Literal parseNumber(Token token, boolean negative) {
        String text = negative ? "-" + token.text() : token.text();
        if (token.type() == TokenType.INTEGER) {
            try {
                return new IntegerLiteral(Long.parseLong(text));
            } catch (NumberFormatException e) {
                throw new TranspileException(ErrorKind.PARSE, "unable to parse integer at char %d", token.pos());
            }
        }
        return new NumberLiteral(Double.parseDouble(text));
    }

    private Duration parseDuration(Token token) {
        try {
            return InfluxQLDuration.parse(token.text());
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new TranspileException(ErrorKind.PARSE, "invalid duration %s at char %d", token.text(), token.pos());
        }
    }

    private int parseInt(Token token) {
        if (token.type() != TokenType.INTEGER) {
            throw error(token, "integer");
        }
        try {
            return Integer.parseInt(token.text());
        } catch (NumberFormatException e) {
            throw new TranspileException(ErrorKind.PARSE, "unable to parse integer at char %d", token.pos());
        }
    }

    private String expectIdent() {
        Token token = next();
        if (token.type() != TokenType.IDENT) {
            throw error(token, "identifier");
        }
        return token.text();
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token next() {
        Token token = tokens.get(index);
        if (token.type() != TokenType.EOF) {
            index++;
        }
        return token;
    }

    private boolean accept(TokenType type) {
        if (peek().type() == type) {
            next();
            return true;
        }
        return false;
    }

    private void expect(TokenType type, String expected) {
        Token token = next();
        if (token.type() != type) {
            throw error(token, expected);
        }
    }

    private static TranspileException error(Token found, String expected) {
        return new TranspileException(ErrorKind.PARSE, "found %s, expected %s at char %d", found, expected, found.pos());
    }
}
