/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.common;

import org.opensearch.common.time.DateFormatter;
import org.opensearch.common.time.DateFormatters;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

/**
 * Conversions between instants, epoch nanoseconds and the time strings accepted by InfluxQL.
 */
public final class TimeLiterals {

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private static final Pattern TIME_STRING = Pattern.compile(
        "^\\d{4}-\\d{2}-\\d{2}([ T]\\d{2}:\\d{2}:\\d{2}(\\.\\d{1,9})?(Z|[+-]\\d{2}:\\d{2})?)?$"
    );

    private static final DateFormatter PARSER = DateFormatter.forPattern("strict_date_optional_time_nanos");

    private TimeLiterals() {
        // Utility class
    }

    /**
     * Whether a string literal is shaped like a date or a date-time and should be treated as a time literal.
     */
    public static boolean isTimeString(String text) {
        return TIME_STRING.matcher(text).matches();
    }

    /**
     * Parses a date or date-time string. Strings without a zone are read as UTC.
     *
     * @throws IllegalArgumentException if the string cannot be parsed
     */
    public static Instant parse(String text) {
        try {
            return DateFormatters.from(PARSER.parse(text.replace(' ', 'T'))).toInstant();
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("unable to parse time [" + text + "]", e);
        }
    }

    /**
     * Formats an instant as RFC 3339 with as many fractional digits as needed.
     */
    public static String format(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(instant);
    }

    public static Instant ofEpochNanos(long nanos) {
        return Instant.ofEpochSecond(Math.floorDiv(nanos, NANOS_PER_SECOND), Math.floorMod(nanos, NANOS_PER_SECOND));
    }

    /**
     * Converts an instant to nanoseconds since the epoch.
     *
     * @throws ArithmeticException if the instant is outside the range of a signed 64-bit nanosecond timestamp
     */
    public static long toEpochNanos(Instant instant) {
        long seconds = instant.getEpochSecond();
        long nanos = instant.getNano();
        if (seconds < 0 && nanos > 0) {
            return Math.addExact(Math.multiplyExact(seconds + 1, NANOS_PER_SECOND), nanos - NANOS_PER_SECOND);
        }
        return Math.addExact(Math.multiplyExact(seconds, NANOS_PER_SECOND), nanos);
    }
}
