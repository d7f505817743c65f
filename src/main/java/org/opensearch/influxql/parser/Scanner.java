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
import org.opensearch.influxql.common.InfluxQLDuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits InfluxQL text into tokens. A {@code /} starts a regex when it appears where an operand is expected and is
 * a division otherwise.
 */
public class Scanner {

    private final String input;
    private int pos;
    private TokenType previous = TokenType.EOF;

    public Scanner(String input) {
        this.input = input;
    }

    /**
     * Scans the whole input. The returned list always ends with an {@link TokenType#EOF} token.
     *
     * @throws TranspileException with kind {@link ErrorKind#PARSE} on malformed input
     */
    public List<Token> scanAll() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = scan();
            tokens.add(token);
            previous = token.type();
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    private Token scan() {
        skipWhitespaceAndComments();
        if (pos >= input.length()) {
            return new Token(TokenType.EOF, "", pos);
        }

        int start = pos;
        char ch = input.charAt(pos);
        if (Character.isLetter(ch) || ch == '_') {
            return scanIdent(start);
        } else if (Character.isDigit(ch) || (ch == '.' && pos + 1 < input.length() && Character.isDigit(input.charAt(pos + 1)))) {
            return scanNumber(start);
        }

        pos++;
        switch (ch) {
            case '"':
                return new Token(TokenType.IDENT, scanQuoted('"', start), start);
            case '\'':
                return new Token(TokenType.STRING, scanQuoted('\'', start), start);
            case '/':
                if (previous.endsOperand()) {
                    return new Token(TokenType.DIV, "/", start);
                }
                return new Token(TokenType.REGEX, scanRegex(start), start);
            case '+':
                return new Token(TokenType.ADD, "+", start);
            case '-':
                return new Token(TokenType.SUB, "-", start);
            case '*':
                return new Token(TokenType.MUL, "*", start);
            case '%':
                return new Token(TokenType.MOD, "%", start);
            case '&':
                return new Token(TokenType.BITWISE_AND, "&", start);
            case '|':
                return new Token(TokenType.BITWISE_OR, "|", start);
            case '^':
                return new Token(TokenType.BITWISE_XOR, "^", start);
            case '=':
                if (consume('~')) {
                    return new Token(TokenType.EQ_REGEX, "=~", start);
                }
                return new Token(TokenType.EQ, "=", start);
            case '!':
                if (consume('=')) {
                    return new Token(TokenType.NEQ, "!=", start);
                } else if (consume('~')) {
                    return new Token(TokenType.NEQ_REGEX, "!~", start);
                }
                break;
            case '<':
                if (consume('=')) {
                    return new Token(TokenType.LTE, "<=", start);
                } else if (consume('>')) {
                    return new Token(TokenType.NEQ, "<>", start);
                }
                return new Token(TokenType.LT, "<", start);
            case '>':
                if (consume('=')) {
                    return new Token(TokenType.GTE, ">=", start);
                }
                return new Token(TokenType.GT, ">", start);
            case '(':
                return new Token(TokenType.LPAREN, "(", start);
            case ')':
                return new Token(TokenType.RPAREN, ")", start);
            case ',':
                return new Token(TokenType.COMMA, ",", start);
            case ';':
                return new Token(TokenType.SEMICOLON, ";", start);
            case '.':
                return new Token(TokenType.DOT, ".", start);
            default:
                break;
        }
        throw new TranspileException(ErrorKind.PARSE, "found %s, expected valid token at char %d", input.substring(start, pos), start);
    }

    private void skipWhitespaceAndComments() {
        while (pos < input.length()) {
            char ch = input.charAt(pos);
            if (Character.isWhitespace(ch)) {
                pos++;
            } else if (ch == '-' && pos + 1 < input.length() && input.charAt(pos + 1) == '-') {
                while (pos < input.length() && input.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                return;
            }
        }
    }

    private boolean consume(char expected) {
        if (pos < input.length() && input.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private Token scanIdent(int start) {
        while (pos < input.length() && (Character.isLetterOrDigit(input.charAt(pos)) || input.charAt(pos) == '_')) {
            pos++;
        }
        String word = input.substring(start, pos);
        return new Token(TokenType.lookup(word), word, start);
    }

    private Token scanNumber(int start) {
        while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
            pos++;
        }
        if (pos < input.length() && input.charAt(pos) == '.' && pos + 1 < input.length() && Character.isDigit(input.charAt(pos + 1))) {
            pos++;
            while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                pos++;
            }
            return new Token(TokenType.NUMBER, input.substring(start, pos), start);
        }
        if (pos < input.length() && (Character.isLetter(input.charAt(pos)))) {
            while (pos < input.length() && Character.isLetterOrDigit(input.charAt(pos))) {
                pos++;
            }
            String text = input.substring(start, pos);
            try {
                InfluxQLDuration.parse(text);
            } catch (IllegalArgumentException | ArithmeticException e) {
                throw new TranspileException(ErrorKind.PARSE, "invalid duration %s at char %d", text, start);
            }
            return new Token(TokenType.DURATION, text, start);
        }
        return new Token(TokenType.INTEGER, input.substring(start, pos), start);
    }

    private String scanQuoted(char quote, int start) {
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char ch = input.charAt(pos++);
            if (ch == quote) {
                return sb.toString();
            } else if (ch == '\\' && pos < input.length()) {
                char escaped = input.charAt(pos++);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case '\\', '\'', '"' -> sb.append(escaped);
                    default -> sb.append('\\').append(escaped);
                }
            } else if (ch == '\n') {
                break;
            } else {
                sb.append(ch);
            }
        }
        throw new TranspileException(ErrorKind.PARSE, "unterminated quoted text at char %d", start);
    }

    private String scanRegex(int start) {
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char ch = input.charAt(pos++);
            if (ch == '/') {
                return sb.toString();
            } else if (ch == '\\' && pos < input.length() && input.charAt(pos) == '/') {
                sb.append('/');
                pos++;
            } else {
                sb.append(ch);
            }
        }
        throw new TranspileException(ErrorKind.PARSE, "unterminated regex at char %d", start);
    }
}
