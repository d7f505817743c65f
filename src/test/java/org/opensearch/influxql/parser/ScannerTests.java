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
import org.opensearch.test.OpenSearchTestCase;

import java.util.List;
import java.util.stream.Collectors;

public class ScannerTests extends OpenSearchTestCase {

    private static List<TokenType> types(String input) {
        return new Scanner(input).scanAll().stream().map(Token::type).collect(Collectors.toList());
    }

    public void testKeywordsAreCaseInsensitive() {
        assertEquals(
            List.of(TokenType.SELECT, TokenType.IDENT, TokenType.FROM, TokenType.IDENT, TokenType.EOF),
            types("select value FrOm cpu")
        );
    }

    public void testSlashAfterOperandIsDivision() {
        assertEquals(List.of(TokenType.IDENT, TokenType.DIV, TokenType.IDENT, TokenType.EOF), types("a / b"));
        assertEquals(List.of(TokenType.RPAREN, TokenType.DIV, TokenType.INTEGER, TokenType.EOF), types(") / 2"));
    }

    public void testSlashStartingOperandIsRegex() {
        List<Token> tokens = new Scanner("FROM /^cpu/").scanAll();
        assertEquals(TokenType.REGEX, tokens.get(1).type());
        assertEquals("^cpu", tokens.get(1).text());
    }

    public void testLiterals() {
        List<Token> tokens = new Scanner("10m 42 3.14 'it\\'s' \"my field\"").scanAll();
        assertEquals(TokenType.DURATION, tokens.get(0).type());
        assertEquals(TokenType.INTEGER, tokens.get(1).type());
        assertEquals(TokenType.NUMBER, tokens.get(2).type());
        assertEquals(TokenType.STRING, tokens.get(3).type());
        assertEquals("it's", tokens.get(3).text());
        assertEquals(TokenType.IDENT, tokens.get(4).type());
        assertEquals("my field", tokens.get(4).text());
    }

    public void testOperators() {
        assertEquals(
            List.of(
                TokenType.EQ_REGEX,
                TokenType.NEQ_REGEX,
                TokenType.NEQ,
                TokenType.NEQ,
                TokenType.LTE,
                TokenType.GTE,
                TokenType.LT,
                TokenType.GT,
                TokenType.EOF
            ),
            types("=~ !~ != <> <= >= < >")
        );
    }

    public void testUnterminatedString() {
        TranspileException e = expectThrows(TranspileException.class, () -> new Scanner("'abc").scanAll());
        assertEquals(ErrorKind.PARSE, e.getKind());
        assertEquals("unterminated quoted text at char 0", e.getMessage());
    }

    public void testInvalidCharacter() {
        TranspileException e = expectThrows(TranspileException.class, () -> new Scanner("a ! b").scanAll());
        assertEquals(ErrorKind.PARSE, e.getKind());
    }
}
