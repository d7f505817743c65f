/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.compiler;

import org.opensearch.influxql.ErrorKind;
import org.opensearch.influxql.TranspileException;
import org.opensearch.influxql.common.Constants;
import org.opensearch.influxql.common.TimeLiterals;
import org.opensearch.influxql.parser.nodes.BinaryExpr;
import org.opensearch.influxql.parser.nodes.BinaryOperator;
import org.opensearch.influxql.parser.nodes.BooleanLiteral;
import org.opensearch.influxql.parser.nodes.DurationLiteral;
import org.opensearch.influxql.parser.nodes.Expr;
import org.opensearch.influxql.parser.nodes.IntegerLiteral;
import org.opensearch.influxql.parser.nodes.NumberLiteral;
import org.opensearch.influxql.parser.nodes.ParenExpr;
import org.opensearch.influxql.parser.nodes.StringLiteral;
import org.opensearch.influxql.parser.nodes.TimeLiteral;
import org.opensearch.influxql.parser.nodes.VarRef;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Splits a WHERE clause into the part that filters rows and the part that bounds time.
 * <p>
 * Comparisons between {@code time} and a literal become bounds of the time range and are removed from the condition.
 * Bounds on both sides of AND and OR are intersected: OR on time is accepted but does not widen the range.
 */
public final class ConditionSplitter {

    /**
     * Result of splitting a condition.
     *
     * @param condition the remaining condition, or null when nothing but time bounds was given
     * @param timeRange the bounds found, with unset bounds left null
     */
    public record Split(Expr condition, TimeRange timeRange) {}

    private ConditionSplitter() {
        // Utility class
    }

    /**
     * Splits the condition, evaluating {@code now()} with the given reference time.
     *
     * @param condition the WHERE expression, may be null
     * @param now       the reference time
     * @throws TranspileException if the condition is not a valid boolean expression or a time bound is invalid
     */
    public static Split split(Expr condition, Instant now) {
        Split split = splitExpr(condition, now);
        Expr expr = split.condition();
        if (expr instanceof ParenExpr paren) {
            expr = paren.expr();
        }
        if (expr instanceof BooleanLiteral bool && bool.value()) {
            expr = null;
        }
        return new Split(expr, split.timeRange());
    }

    private static Split splitExpr(Expr condition, Instant now) {
        if (condition == null) {
            return new Split(null, TimeRange.UNBOUNDED);
        } else if (condition instanceof BinaryExpr binary) {
            if (binary.op().isLogical()) {
                Split lhs = splitExpr(binary.lhs(), now);
                Split rhs = splitExpr(binary.rhs(), now);
                TimeRange timeRange = lhs.timeRange().intersect(rhs.timeRange());
                if (rhs.condition() == null) {
                    return new Split(lhs.condition(), timeRange);
                } else if (lhs.condition() == null) {
                    return new Split(rhs.condition(), timeRange);
                }
                return new Split(ExprReducer.reduceBinary(binary.op(), lhs.condition(), rhs.condition()), timeRange);
            }

            if (isTimeRef(binary.lhs())) {
                return new Split(null, timeRange(binary.op(), binary.rhs(), now));
            } else if (isTimeRef(binary.rhs())) {
                return new Split(null, timeRange(binary.op().mirror(), binary.lhs(), now));
            }
            return new Split(ExprReducer.reduce(binary, now), TimeRange.UNBOUNDED);
        } else if (condition instanceof ParenExpr paren) {
            Split inner = splitExpr(paren.expr(), now);
            if (inner.condition() == null) {
                return inner;
            }
            return new Split(ExprReducer.reduce(new ParenExpr(inner.condition()), null), inner.timeRange());
        } else if (condition instanceof BooleanLiteral) {
            return new Split(condition, TimeRange.UNBOUNDED);
        }
        throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "invalid condition expression: %s", condition);
    }

    private static boolean isTimeRef(Expr expr) {
        return expr instanceof VarRef ref && Constants.Names.TIME.equals(ref.name().toLowerCase(Locale.ROOT));
    }

    private static TimeRange timeRange(BinaryOperator op, Expr operand, Instant now) {
        if (operand instanceof StringLiteral string && string.isTimeLiteral()) {
            try {
                operand = string.toTimeLiteral();
            } catch (IllegalArgumentException e) {
                throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "unable to parse time %s", string);
            }
        }
        Expr value = ExprReducer.reduce(operand, now);

        Instant instant;
        if (value instanceof TimeLiteral time) {
            if (time.value().isAfter(Constants.TimeBounds.MAX_TIME)) {
                throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "time %s overflows time literal", formatSeconds(time.value()));
            } else if (!time.value().isAfter(Constants.TimeBounds.MIN_TIME)) {
                // MinTime itself is reserved as the unbounded sentinel
                throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "time %s underflows time literal", formatSeconds(time.value()));
            }
            instant = time.value();
        } else if (value instanceof DurationLiteral duration) {
            instant = Instant.EPOCH.plus(duration.value());
        } else if (value instanceof NumberLiteral number) {
            instant = TimeLiterals.ofEpochNanos((long) number.value());
        } else if (value instanceof IntegerLiteral integer) {
            instant = TimeLiterals.ofEpochNanos(integer.value());
        } else {
            throw new TranspileException(
                ErrorKind.SYNTAX_VALIDITY,
                "invalid operation: time and %s are not compatible",
                value.legacyTypeName()
            );
        }

        return switch (op) {
            case GT -> new TimeRange(instant.plusNanos(1), null);
            case GTE -> new TimeRange(instant, null);
            case LT -> new TimeRange(null, instant.minusNanos(1));
            case LTE -> new TimeRange(null, instant);
            case EQ -> new TimeRange(instant, instant);
            default -> throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "invalid time comparison operator: %s", op.getSymbol());
        };
    }

    private static String formatSeconds(Instant instant) {
        return TimeLiterals.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }
}
