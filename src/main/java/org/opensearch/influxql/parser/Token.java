/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.parser;

/**
 * A lexical token with its position in the query text.
 *
 * @param type the token type
 * @param text the token text; for strings, quoted identifiers and regexes the unescaped content
 * @param pos  the offset of the token in the query text
 */
public record Token(TokenType type, String text, int pos) {

    @Override
    public String toString() {
        return switch (type) {
            case EOF -> "EOF";
            case STRING -> "'" + text + "'";
            case REGEX -> "/" + text + "/";
            default -> text;
        };
    }
}
