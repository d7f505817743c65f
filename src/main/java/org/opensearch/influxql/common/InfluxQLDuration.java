/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.common;

import java.time.Duration;
import java.util.Locale;

/**
 * Parsing and formatting of InfluxQL duration literals such as {@code 10m}, {@code 1h30m} or {@code 500ms}.
 */
public final class InfluxQLDuration {

    private static final long NANOS_PER_MICRO = 1_000L;
    private static final long NANOS_PER_MILLI = 1_000_000L;
    private static final long NANOS_PER_SECOND = 1_000_000_000L;
    private static final long NANOS_PER_MINUTE = 60 * NANOS_PER_SECOND;
    private static final long NANOS_PER_HOUR = 60 * NANOS_PER_MINUTE;
    private static final long NANOS_PER_DAY = 24 * NANOS_PER_HOUR;
    private static final long NANOS_PER_WEEK = 7 * NANOS_PER_DAY;

    private InfluxQLDuration() {
        // Utility class
    }

    /**
     * Parses a duration literal made of one or more {@code <integer><unit>} segments.
     * Supported units are {@code ns}, {@code u}, {@code µ}, {@code ms}, {@code s}, {@code m}, {@code h}, {@code d} and {@code w}.
     *
     * @param text the literal, without sign
     * @return the parsed duration
     * @throws IllegalArgumentException if the text is not a valid duration literal
     */
    public static Duration parse(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("invalid duration");
        }
        long total = 0;
        int i = 0;
        while (i < text.length()) {
            int start = i;
            while (i < text.length() && Character.isDigit(text.charAt(i))) {
                i++;
            }
            if (start == i) {
                throw new IllegalArgumentException("invalid duration");
            }
            long amount = Long.parseLong(text.substring(start, i));

            int unitStart = i;
            while (i < text.length() && !Character.isDigit(text.charAt(i))) {
                i++;
            }
            String unit = text.substring(unitStart, i);
            total = Math.addExact(total, Math.multiplyExact(amount, unitNanos(unit)));
        }
        return Duration.ofNanos(total);
    }

    /**
     * Whether the given unit suffix names a duration unit.
     */
    public static boolean isUnit(String unit) {
        return switch (unit) {
            case "ns", "u", "µ", "ms", "s", "m", "h", "d", "w" -> true;
            default -> false;
        };
    }

    private static long unitNanos(String unit) {
        return switch (unit) {
            case "ns" -> 1L;
            case "u", "µ" -> NANOS_PER_MICRO;
            case "ms" -> NANOS_PER_MILLI;
            case "s" -> NANOS_PER_SECOND;
            case "m" -> NANOS_PER_MINUTE;
            case "h" -> NANOS_PER_HOUR;
            case "d" -> NANOS_PER_DAY;
            case "w" -> NANOS_PER_WEEK;
            default -> throw new IllegalArgumentException("invalid duration");
        };
    }

    /**
     * Formats a duration with the largest unit that divides it evenly, the way InfluxQL prints duration literals
     * (for example {@code 0s}, {@code -2h}, {@code 90s}).
     */
    public static String format(Duration duration) {
        long nanos = duration.toNanos();
        if (nanos == 0) {
            return "0s";
        } else if (nanos % NANOS_PER_WEEK == 0) {
            return (nanos / NANOS_PER_WEEK) + "w";
        } else if (nanos % NANOS_PER_DAY == 0) {
            return (nanos / NANOS_PER_DAY) + "d";
        } else if (nanos % NANOS_PER_HOUR == 0) {
            return (nanos / NANOS_PER_HOUR) + "h";
        } else if (nanos % NANOS_PER_MINUTE == 0) {
            return (nanos / NANOS_PER_MINUTE) + "m";
        } else if (nanos % NANOS_PER_SECOND == 0) {
            return (nanos / NANOS_PER_SECOND) + "s";
        } else if (nanos % NANOS_PER_MILLI == 0) {
            return (nanos / NANOS_PER_MILLI) + "ms";
        } else if (nanos % NANOS_PER_MICRO == 0) {
            return (nanos / NANOS_PER_MICRO) + "u";
        }
        return nanos + "ns";
    }

    /**
     * Formats a duration as a sequence of unit segments from hours down to nanoseconds, omitting zero segments,
     * for example {@code 1h30m} or {@code 2562047h47m16s854ms775us807ns}. This is the encoding used in serialized specs.
     */
    public static String formatCompound(Duration duration) {
        long nanos = duration.toNanos();
        if (nanos == 0) {
            return "0s";
        }
        StringBuilder sb = new StringBuilder();
        if (nanos < 0) {
            sb.append('-');
        }
        // Work on the magnitude segment by segment so Long.MIN_VALUE does not overflow on negation
        long[] units = { NANOS_PER_HOUR, NANOS_PER_MINUTE, NANOS_PER_SECOND, NANOS_PER_MILLI, NANOS_PER_MICRO, 1L };
        String[] suffixes = { "h", "m", "s", "ms", "us", "ns" };
        long remainder = nanos;
        for (int i = 0; i < units.length; i++) {
            long amount = Math.abs(remainder / units[i]);
            remainder = remainder % units[i];
            if (amount != 0) {
                sb.append(String.format(Locale.ROOT, "%d%s", amount, suffixes[i]));
            }
        }
        return sb.toString();
    }
}
