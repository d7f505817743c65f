/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.compiler;

import org.opensearch.influxql.common.Constants;
import org.opensearch.influxql.parser.nodes.BinaryExpr;
import org.opensearch.influxql.parser.nodes.BinaryOperator;
import org.opensearch.influxql.parser.nodes.BooleanLiteral;
import org.opensearch.influxql.parser.nodes.Call;
import org.opensearch.influxql.parser.nodes.DurationLiteral;
import org.opensearch.influxql.parser.nodes.Expr;
import org.opensearch.influxql.parser.nodes.IntegerLiteral;
import org.opensearch.influxql.parser.nodes.NumberLiteral;
import org.opensearch.influxql.parser.nodes.ParenExpr;
import org.opensearch.influxql.parser.nodes.StringLiteral;
import org.opensearch.influxql.parser.nodes.TimeLiteral;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Constant folding over InfluxQL expressions. Arithmetic and comparisons between literals are evaluated, math
 * functions whose arguments are all numeric literals are evaluated, and {@code now()} is replaced by a time literal
 * when a reference time is given. Anything else is returned with its children folded.
 */
public final class ExprReducer {

    private ExprReducer() {
        // Utility class
    }

    /**
     * Folds the expression.
     *
     * @param expr the expression, may be null
     * @param now  the value of {@code now()}, or null to leave {@code now()} calls in place
     * @return the folded expression, or null if {@code expr} is null
     */
    public static Expr reduce(Expr expr, Instant now) {
        if (expr instanceof BinaryExpr binary) {
            return reduceBinary(binary.op(), reduce(binary.lhs(), now), reduce(binary.rhs(), now));
        } else if (expr instanceof ParenExpr paren) {
            Expr inner = reduce(paren.expr(), now);
            return inner instanceof BinaryExpr ? new ParenExpr(inner) : inner;
        } else if (expr instanceof Call call) {
            return reduceCall(call, now);
        }
        return expr;
    }

    /**
     * Folds a binary operation whose operands are already folded.
     */
    public static Expr reduceBinary(BinaryOperator op, Expr lhs, Expr rhs) {
        Expr folded = null;
        if (lhs instanceof IntegerLiteral l) {
            folded = reduceIntegerLhs(op, l.value(), rhs);
        } else if (lhs instanceof NumberLiteral l) {
            folded = reduceNumberLhs(op, l.value(), rhs);
        } else if (lhs instanceof DurationLiteral l) {
            folded = reduceDurationLhs(op, l.value(), rhs);
        } else if (lhs instanceof TimeLiteral l) {
            folded = reduceTimeLhs(op, l.value(), rhs);
        } else if (lhs instanceof StringLiteral l) {
            folded = reduceStringLhs(op, l, rhs);
        } else if (lhs instanceof BooleanLiteral l && rhs instanceof BooleanLiteral r) {
            folded = switch (op) {
                case AND -> new BooleanLiteral(l.value() && r.value());
                case OR -> new BooleanLiteral(l.value() || r.value());
                case EQ -> new BooleanLiteral(l.value() == r.value());
                case NEQ -> new BooleanLiteral(l.value() != r.value());
                default -> null;
            };
        }
        return folded != null ? folded : new BinaryExpr(op, lhs, rhs);
    }

    private static Expr reduceCall(Call call, Instant now) {
        if (now != null && Constants.Names.NOW.equals(call.name()) && call.args().isEmpty()) {
            return new TimeLiteral(now);
        }

        List<Expr> args = new ArrayList<>(call.args().size());
        for (Expr arg : call.args()) {
            args.add(reduce(arg, now));
        }

        Optional<InfluxQLFunction> function = InfluxQLFunction.lookup(call.name());
        if (function.isPresent() && function.get().getKind() == InfluxQLFunction.Kind.MATH && args.size() == function.get().getArity()) {
            Expr evaluated = evaluateMath(function.get(), args);
            if (evaluated != null) {
                return evaluated;
            }
        }
        return new Call(call.name(), args);
    }

    private static Expr evaluateMath(InfluxQLFunction function, List<Expr> args) {
        double[] values = new double[args.size()];
        for (int i = 0; i < args.size(); i++) {
            Expr arg = args.get(i);
            if (arg instanceof IntegerLiteral integer) {
                values[i] = integer.value();
            } else if (arg instanceof NumberLiteral number) {
                values[i] = number.value();
            } else {
                return null;
            }
        }
        // Rounding an integer keeps it an integer
        if (function.isIntegerPreserving() && args.get(0) instanceof IntegerLiteral integer) {
            return function == InfluxQLFunction.ABS ? new IntegerLiteral(Math.abs(integer.value())) : integer;
        }
        return new NumberLiteral(function.evaluate(values));
    }

    private static Expr reduceIntegerLhs(BinaryOperator op, long l, Expr rhs) {
        if (rhs instanceof IntegerLiteral r) {
            long rv = r.value();
            return switch (op) {
                case ADD -> new IntegerLiteral(l + rv);
                case SUB -> new IntegerLiteral(l - rv);
                case MUL -> new IntegerLiteral(l * rv);
                case DIV -> new NumberLiteral(rv == 0 ? 0 : (double) l / rv);
                case MOD -> new IntegerLiteral(rv == 0 ? 0 : l % rv);
                case BITWISE_AND -> new IntegerLiteral(l & rv);
                case BITWISE_OR -> new IntegerLiteral(l | rv);
                case BITWISE_XOR -> new IntegerLiteral(l ^ rv);
                default -> compare(op, Long.compare(l, rv));
            };
        } else if (rhs instanceof NumberLiteral) {
            return reduceNumberLhs(op, l, rhs);
        } else if (rhs instanceof DurationLiteral r) {
            // The integer is a timestamp in nanoseconds, except when scaling a duration
            return switch (op) {
                case ADD -> new TimeLiteral(Instant.EPOCH.plusNanos(l).plus(r.value()));
                case SUB -> new TimeLiteral(Instant.EPOCH.plusNanos(l).minus(r.value()));
                case MUL -> new DurationLiteral(r.value().multipliedBy(l));
                default -> null;
            };
        }
        return null;
    }

    private static Expr reduceNumberLhs(BinaryOperator op, double l, Expr rhs) {
        double rv;
        if (rhs instanceof NumberLiteral r) {
            rv = r.value();
        } else if (rhs instanceof IntegerLiteral r) {
            rv = r.value();
        } else {
            return null;
        }
        return switch (op) {
            case ADD -> new NumberLiteral(l + rv);
            case SUB -> new NumberLiteral(l - rv);
            case MUL -> new NumberLiteral(l * rv);
            case DIV -> new NumberLiteral(rv == 0 ? 0 : l / rv);
            case MOD -> new NumberLiteral(l % rv);
            default -> compare(op, Double.compare(l, rv));
        };
    }

    private static Expr reduceDurationLhs(BinaryOperator op, Duration l, Expr rhs) {
        if (rhs instanceof DurationLiteral r) {
            return switch (op) {
                case ADD -> new DurationLiteral(l.plus(r.value()));
                case SUB -> new DurationLiteral(l.minus(r.value()));
                default -> compare(op, l.compareTo(r.value()));
            };
        } else if (rhs instanceof IntegerLiteral r) {
            return switch (op) {
                case MUL -> new DurationLiteral(l.multipliedBy(r.value()));
                case DIV -> new DurationLiteral(r.value() == 0 ? Duration.ZERO : l.dividedBy(r.value()));
                default -> null;
            };
        } else if (rhs instanceof NumberLiteral r) {
            return switch (op) {
                case MUL -> new DurationLiteral(Duration.ofNanos((long) (l.toNanos() * r.value())));
                case DIV -> new DurationLiteral(r.value() == 0 ? Duration.ZERO : Duration.ofNanos((long) (l.toNanos() / r.value())));
                default -> null;
            };
        } else if (rhs instanceof TimeLiteral r && op == BinaryOperator.ADD) {
            return new TimeLiteral(r.value().plus(l));
        } else if (rhs instanceof StringLiteral r && op == BinaryOperator.ADD && r.isTimeLiteral()) {
            return new TimeLiteral(r.toTimeLiteral().value().plus(l));
        }
        return null;
    }

    private static Expr reduceTimeLhs(BinaryOperator op, Instant l, Expr rhs) {
        if (rhs instanceof DurationLiteral r) {
            return switch (op) {
                case ADD -> new TimeLiteral(l.plus(r.value()));
                case SUB -> new TimeLiteral(l.minus(r.value()));
                default -> null;
            };
        } else if (rhs instanceof TimeLiteral r) {
            return reduceTimes(op, l, r.value());
        } else if (rhs instanceof StringLiteral r && r.isTimeLiteral()) {
            return reduceTimes(op, l, r.toTimeLiteral().value());
        }
        return null;
    }

    private static Expr reduceTimes(BinaryOperator op, Instant l, Instant r) {
        if (op == BinaryOperator.SUB) {
            return new DurationLiteral(Duration.between(r, l));
        }
        return compare(op, l.compareTo(r));
    }

    private static Expr reduceStringLhs(BinaryOperator op, StringLiteral l, Expr rhs) {
        if (rhs instanceof StringLiteral r) {
            return switch (op) {
                case EQ -> new BooleanLiteral(l.value().equals(r.value()));
                case NEQ -> new BooleanLiteral(!l.value().equals(r.value()));
                case ADD -> new StringLiteral(l.value() + r.value());
                default -> null;
            };
        } else if (l.isTimeLiteral() && (rhs instanceof DurationLiteral || rhs instanceof TimeLiteral)) {
            return reduceTimeLhs(op, l.toTimeLiteral().value(), rhs);
        }
        return null;
    }

    private static BooleanLiteral compare(BinaryOperator op, int comparison) {
        return switch (op) {
            case EQ -> new BooleanLiteral(comparison == 0);
            case NEQ -> new BooleanLiteral(comparison != 0);
            case LT -> new BooleanLiteral(comparison < 0);
            case LTE -> new BooleanLiteral(comparison <= 0);
            case GT -> new BooleanLiteral(comparison > 0);
            case GTE -> new BooleanLiteral(comparison >= 0);
            default -> null;
        };
    }
}
