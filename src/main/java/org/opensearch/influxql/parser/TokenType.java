/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.parser;

import org.opensearch.influxql.parser.nodes.BinaryOperator;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Token kinds produced by {@link Scanner}.
 */
public enum TokenType {
    EOF(null),
    IDENT(null),
    STRING(null),
    INTEGER(null),
    NUMBER(null),
    DURATION(null),
    REGEX(null),

    ADD(BinaryOperator.ADD),
    SUB(BinaryOperator.SUB),
    MUL(BinaryOperator.MUL),
    DIV(BinaryOperator.DIV),
    MOD(BinaryOperator.MOD),
    BITWISE_AND(BinaryOperator.BITWISE_AND),
    BITWISE_OR(BinaryOperator.BITWISE_OR),
    BITWISE_XOR(BinaryOperator.BITWISE_XOR),
    EQ(BinaryOperator.EQ),
    NEQ(BinaryOperator.NEQ),
    EQ_REGEX(BinaryOperator.EQ_REGEX),
    NEQ_REGEX(BinaryOperator.NEQ_REGEX),
    LT(BinaryOperator.LT),
    LTE(BinaryOperator.LTE),
    GT(BinaryOperator.GT),
    GTE(BinaryOperator.GTE),

    LPAREN(null),
    RPAREN(null),
    COMMA(null),
    SEMICOLON(null),
    DOT(null),

    // Keywords
    AND(BinaryOperator.AND),
    OR(BinaryOperator.OR),
    TRUE(null),
    FALSE(null),
    SELECT(null),
    FROM(null),
    WHERE(null),
    GROUP(null),
    BY(null),
    FILL(null),
    ORDER(null),
    ASC(null),
    DESC(null),
    LIMIT(null),
    OFFSET(null),
    SLIMIT(null),
    SOFFSET(null),
    AS(null),
    DISTINCT(null);

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (TokenType type : new TokenType[] {
            AND,
            OR,
            TRUE,
            FALSE,
            SELECT,
            FROM,
            WHERE,
            GROUP,
            BY,
            FILL,
            ORDER,
            ASC,
            DESC,
            LIMIT,
            OFFSET,
            SLIMIT,
            SOFFSET,
            AS,
            DISTINCT }) {
            KEYWORDS.put(type.name(), type);
        }
    }

    private final BinaryOperator operator;

    TokenType(BinaryOperator operator) {
        this.operator = operator;
    }

    /**
     * The binary operator this token stands for, or null.
     */
    public BinaryOperator getOperator() {
        return operator;
    }

    /**
     * Looks up a keyword, case-insensitively.
     * @return the keyword token type, or {@link #IDENT} if the word is not a keyword
     */
    public static TokenType lookup(String word) {
        return KEYWORDS.getOrDefault(word.toUpperCase(Locale.ROOT), IDENT);
    }

    /**
     * Whether a token of this type can end an operand, in which case a following {@code /} is a division.
     */
    boolean endsOperand() {
        return switch (this) {
            case IDENT, STRING, INTEGER, NUMBER, DURATION, REGEX, RPAREN, TRUE, FALSE -> true;
            default -> false;
        };
    }
}
