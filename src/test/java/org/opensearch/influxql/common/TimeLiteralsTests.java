/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.common;

import org.opensearch.test.OpenSearchTestCase;

import java.time.Instant;

public class TimeLiteralsTests extends OpenSearchTestCase {

    public void testIsTimeString() {
        assertTrue(TimeLiterals.isTimeString("2000-01-01"));
        assertTrue(TimeLiterals.isTimeString("2000-01-01T00:00:00Z"));
        assertTrue(TimeLiterals.isTimeString("2000-01-01 00:00:00"));
        assertTrue(TimeLiterals.isTimeString("2000-01-01T00:00:00.123456789+02:00"));
        assertFalse(TimeLiterals.isTimeString("server01"));
        assertFalse(TimeLiterals.isTimeString("5s"));
    }

    public void testParse() {
        assertEquals(Instant.parse("2000-01-01T00:00:00Z"), TimeLiterals.parse("2000-01-01T00:00:00Z"));
        assertEquals(Instant.parse("2000-01-01T00:00:00Z"), TimeLiterals.parse("2000-01-01"));
        assertEquals(Instant.parse("2000-01-01T00:00:00.500Z"), TimeLiterals.parse("2000-01-01 00:00:00.5"));
        assertEquals(Instant.parse("1999-12-31T22:00:00Z"), TimeLiterals.parse("2000-01-01T00:00:00+02:00"));
    }

    public void testParseInvalid() {
        expectThrows(IllegalArgumentException.class, () -> TimeLiterals.parse("not a time"));
    }

    public void testFormat() {
        assertEquals("2010-09-15T09:00:00Z", TimeLiterals.format(Instant.parse("2010-09-15T09:00:00Z")));
        assertEquals("1677-09-21T00:12:43.145224194Z", TimeLiterals.format(Constants.TimeBounds.MIN_TIME));
        assertEquals("2262-04-11T23:47:16.854775806Z", TimeLiterals.format(Constants.TimeBounds.MAX_TIME));
    }

    public void testEpochNanos() {
        assertEquals(Instant.EPOCH, TimeLiterals.ofEpochNanos(0));
        assertEquals(Instant.ofEpochSecond(-1, 999_999_999), TimeLiterals.ofEpochNanos(-1));
        assertEquals(-1L, TimeLiterals.toEpochNanos(Instant.ofEpochSecond(-1, 999_999_999)));
        assertEquals(Constants.TimeBounds.MIN_TIME_NANOS, TimeLiterals.toEpochNanos(Constants.TimeBounds.MIN_TIME));
        assertEquals(Constants.TimeBounds.MAX_TIME_NANOS, TimeLiterals.toEpochNanos(Constants.TimeBounds.MAX_TIME));
        expectThrows(ArithmeticException.class, () -> TimeLiterals.toEpochNanos(Instant.parse("1600-01-01T00:00:00Z")));
    }
}
