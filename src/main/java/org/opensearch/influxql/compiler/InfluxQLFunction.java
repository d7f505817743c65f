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
import org.opensearch.influxql.common.InfluxQLDuration;
import org.opensearch.influxql.parser.nodes.Call;
import org.opensearch.influxql.parser.nodes.Distinct;
import org.opensearch.influxql.parser.nodes.DurationLiteral;
import org.opensearch.influxql.parser.nodes.Expr;
import org.opensearch.influxql.parser.nodes.IntegerLiteral;
import org.opensearch.influxql.parser.nodes.NumberLiteral;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Catalog of the functions InfluxQL knows about. Each constant carries the validation rules for its calls;
 * {@link #compile(StatementCompiler, Call)} is invoked for every call found in a SELECT list.
 */
public enum InfluxQLFunction {
    COUNT("count", Kind.AGGREGATE) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            compiler.clearOnlySelectors();
            requireArity(call, 1);
            // count() also accepts a distinct() argument
            Expr arg0 = call.args().get(0);
            if (arg0 instanceof Call nested && DISTINCT.getName().equals(nested.name())) {
                compiler.compileDistinct(nested.args(), true);
            } else if (arg0 instanceof Distinct distinct) {
                compiler.compileDistinct(distinct.toCall().args(), true);
            } else {
                compiler.compileSymbol(call.name(), arg0);
            }
        }
    },
    SUM("sum", Kind.AGGREGATE) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            compileAggregate(compiler, call);
        }
    },
    MEAN("mean", Kind.AGGREGATE) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            compileAggregate(compiler, call);
        }
    },
    MEDIAN("median", Kind.AGGREGATE) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            compileAggregate(compiler, call);
        }
    },
    MODE("mode", Kind.AGGREGATE) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            compileAggregate(compiler, call);
        }
    },
    STDDEV("stddev", Kind.AGGREGATE) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            compileAggregate(compiler, call);
        }
    },
    SPREAD("spread", Kind.AGGREGATE) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            compileAggregate(compiler, call);
        }
    },
    MAX("max", Kind.SELECTOR) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            compileSelector(compiler, call);
        }
    },
    MIN("min", Kind.SELECTOR) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            compileSelector(compiler, call);
        }
    },
    FIRST("first", Kind.SELECTOR) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            compileSelector(compiler, call);
        }
    },
    LAST("last", Kind.SELECTOR) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            compileSelector(compiler, call);
        }
    },
    PERCENTILE("percentile", Kind.SELECTOR) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            requireArity(call, 2);
            Expr arg1 = call.args().get(1);
            if (!(arg1 instanceof IntegerLiteral) && !(arg1 instanceof NumberLiteral)) {
                throw new TranspileException(ErrorKind.ARGUMENT_TYPE, "expected float argument in percentile()");
            }
            compiler.compileSymbol(getName(), call.args().get(0));
        }
    },
    SAMPLE("sample", Kind.SELECTOR) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            requireArity(call, 2);
            if (!(call.args().get(1) instanceof IntegerLiteral size)) {
                throw new TranspileException(ErrorKind.ARGUMENT_TYPE, "expected integer argument in sample()");
            } else if (size.value() <= 1) {
                throw new TranspileException(ErrorKind.ARGUMENT_VALUE, "sample window must be greater than 1, got %d", size.value());
            }
            compiler.compileSymbol(getName(), call.args().get(0));
        }
    },
    TOP("top", Kind.SELECTOR) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            compiler.compileTopBottom(call);
        }
    },
    BOTTOM("bottom", Kind.SELECTOR) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            compiler.compileTopBottom(call);
        }
    },
    DISTINCT("distinct", Kind.AGGREGATE) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            compiler.compileDistinct(call.args(), false);
        }
    },
    INTEGRAL("integral", Kind.AGGREGATE) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            requireArityRange(call, 1, 2);
            if (call.args().size() == 2) {
                if (!(call.args().get(1) instanceof DurationLiteral unit)) {
                    throw new TranspileException(ErrorKind.ARGUMENT_TYPE, "second argument must be a duration");
                }
                requirePositive(unit);
            }
            compiler.clearOnlySelectors();
            compiler.compileSymbol(getName(), call.args().get(0));
        }
    },
    DERIVATIVE("derivative", Kind.TRANSFORMATION) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            compileRateOfChange(compiler, call);
        }
    },
    NON_NEGATIVE_DERIVATIVE("non_negative_derivative", Kind.TRANSFORMATION) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            compileRateOfChange(compiler, call);
        }
    },
    ELAPSED("elapsed", Kind.TRANSFORMATION) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            compileRateOfChange(compiler, call);
        }
    },
    DIFFERENCE("difference", Kind.TRANSFORMATION) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            requireArity(call, 1);
            compiler.compileTransformationArgument(getName(), call.args().get(0));
        }
    },
    NON_NEGATIVE_DIFFERENCE("non_negative_difference", Kind.TRANSFORMATION) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            requireArity(call, 1);
            compiler.compileTransformationArgument(getName(), call.args().get(0));
        }
    },
    CUMULATIVE_SUM("cumulative_sum", Kind.TRANSFORMATION) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            requireArity(call, 1);
            compiler.compileTransformationArgument(getName(), call.args().get(0));
        }
    },
    MOVING_AVERAGE("moving_average", Kind.TRANSFORMATION) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            requireArity(call, 2);
            Expr arg1 = call.args().get(1);
            if (!(arg1 instanceof IntegerLiteral window)) {
                throw new TranspileException(
                    ErrorKind.ARGUMENT_TYPE,
                    "second argument for moving_average must be an integer, got %s",
                    arg1.legacyTypeName()
                );
            } else if (window.value() <= 1) {
                throw new TranspileException(ErrorKind.ARGUMENT_VALUE, "moving_average window must be greater than 1, got %d", window.value());
            } else if (window.value() > Integer.MAX_VALUE) {
                throw new TranspileException(ErrorKind.ARGUMENT_VALUE, "moving_average window too large, got %d", window.value());
            }
            compiler.compileTransformationArgument(getName(), call.args().get(0));
        }
    },
    HOLT_WINTERS("holt_winters", Kind.TRANSFORMATION) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            compileHoltWinters(compiler, call);
        }
    },
    HOLT_WINTERS_WITH_FIT("holt_winters_with_fit", Kind.TRANSFORMATION) {
        @Override
        void compile(StatementCompiler compiler, Call call) {
            compileHoltWinters(compiler, call);
        }
    },

    // Math functions evaluate per point and may be used in conditions
    ABS("abs", 1, args -> Math.abs(args[0])),
    SIN("sin", 1, args -> Math.sin(args[0])),
    COS("cos", 1, args -> Math.cos(args[0])),
    TAN("tan", 1, args -> Math.tan(args[0])),
    ASIN("asin", 1, args -> Math.asin(args[0])),
    ACOS("acos", 1, args -> Math.acos(args[0])),
    ATAN("atan", 1, args -> Math.atan(args[0])),
    ATAN2("atan2", 2, args -> Math.atan2(args[0], args[1])),
    EXP("exp", 1, args -> Math.exp(args[0])),
    LOG("log", 2, args -> Math.log(args[0]) / Math.log(args[1])),
    LN("ln", 1, args -> Math.log(args[0])),
    LOG2("log2", 1, args -> Math.log(args[0]) / Math.log(2)),
    LOG10("log10", 1, args -> Math.log10(args[0])),
    SQRT("sqrt", 1, args -> Math.sqrt(args[0])),
    POW("pow", 2, args -> Math.pow(args[0], args[1])),
    FLOOR("floor", 1, args -> Math.floor(args[0])),
    CEIL("ceil", 1, args -> Math.ceil(args[0])),
    // Half away from zero
    ROUND("round", 1, args -> Math.signum(args[0]) * Math.floor(Math.abs(args[0]) + 0.5));

    /**
     * How a function consumes its input.
     */
    public enum Kind {
        /** Reduces each group to a single computed value. */
        AGGREGATE,
        /** Returns representative points of each group. */
        SELECTOR,
        /** Derives a new series from the points or from the result of a nested aggregate. */
        TRANSFORMATION,
        /** Evaluates per point. */
        MATH
    }

    @FunctionalInterface
    interface MathOperator {
        double apply(double[] args);
    }

    private static final Map<String, InfluxQLFunction> BY_NAME = Collections.unmodifiableMap(
        Arrays.stream(values()).collect(Collectors.toMap(InfluxQLFunction::getName, Function.identity()))
    );

    private final String name;
    private final Kind kind;
    private final int arity;
    private final MathOperator mathOperator;

    InfluxQLFunction(String name, Kind kind) {
        this.name = name;
        this.kind = kind;
        this.arity = -1;
        this.mathOperator = null;
    }

    InfluxQLFunction(String name, int arity, MathOperator mathOperator) {
        this.name = name;
        this.kind = Kind.MATH;
        this.arity = arity;
        this.mathOperator = mathOperator;
    }

    /**
     * Looks up a function by its lower case name.
     */
    public static Optional<InfluxQLFunction> lookup(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Fixed argument count of a math function, -1 for other functions.
     */
    public int getArity() {
        return arity;
    }

    public boolean isSelector() {
        return kind == Kind.SELECTOR;
    }

    public boolean isMath() {
        return kind == Kind.MATH;
    }

    /**
     * Whether applying this math function to an integer yields the same integer or its magnitude.
     */
    boolean isIntegerPreserving() {
        return this == ABS || this == FLOOR || this == CEIL || this == ROUND;
    }

    /**
     * Evaluates a math function over literal arguments.
     */
    double evaluate(double[] args) {
        if (mathOperator == null) {
            throw new IllegalStateException("function " + name + "() cannot be evaluated");
        }
        return mathOperator.apply(args);
    }

    /**
     * Validates a call to this function appearing in a SELECT list and records its effect on the statement.
     * Math functions only check their arity and validate their non-literal arguments.
     *
     * @throws TranspileException if the call is invalid
     */
    void compile(StatementCompiler compiler, Call call) {
        requireArity(call, arity);
        for (Expr arg : call.args()) {
            if (!StatementCompiler.isLiteral(arg)) {
                compiler.compileExpr(arg);
            }
        }
    }

    private static void compileAggregate(StatementCompiler compiler, Call call) {
        compiler.clearOnlySelectors();
        requireArity(call, 1);
        compiler.compileSymbol(call.name(), call.args().get(0));
    }

    private static void compileSelector(StatementCompiler compiler, Call call) {
        requireArity(call, 1);
        compiler.compileSymbol(call.name(), call.args().get(0));
    }

    /**
     * derivative, non_negative_derivative and elapsed: a field or a nested aggregate, with an optional positive unit.
     */
    private static void compileRateOfChange(StatementCompiler compiler, Call call) {
        requireArityRange(call, 1, 2);
        if (call.args().size() == 2) {
            Expr arg1 = call.args().get(1);
            if (!(arg1 instanceof DurationLiteral unit)) {
                throw new TranspileException(
                    ErrorKind.ARGUMENT_TYPE,
                    "second argument to %s must be a duration, got %s",
                    call.name(),
                    arg1.legacyTypeName()
                );
            }
            requirePositive(unit);
        }
        compiler.compileTransformationArgument(call.name(), call.args().get(0));
    }

    private static void compileHoltWinters(StatementCompiler compiler, Call call) {
        String name = call.name();
        requireArity(call, 3);
        if (!(call.args().get(1) instanceof IntegerLiteral n)) {
            throw new TranspileException(ErrorKind.ARGUMENT_TYPE, "expected integer argument as second arg in %s", name);
        } else if (n.value() <= 0) {
            throw new TranspileException(ErrorKind.ARGUMENT_VALUE, "second arg to %s must be greater than 0, got %d", name, n.value());
        }
        if (!(call.args().get(2) instanceof IntegerLiteral seasonality)) {
            throw new TranspileException(ErrorKind.ARGUMENT_TYPE, "expected integer argument as third arg in %s", name);
        } else if (seasonality.value() < 0) {
            throw new TranspileException(ErrorKind.ARGUMENT_VALUE, "third arg to %s cannot be negative, got %d", name, seasonality.value());
        }
        compiler.clearOnlySelectors();
        if (!(call.args().get(0) instanceof Call nested)) {
            throw new TranspileException(ErrorKind.ARGUMENT_TYPE, "must use aggregate function with %s", name);
        } else if (!compiler.hasInterval()) {
            throw new TranspileException(ErrorKind.SYNTAX_VALIDITY, "%s aggregate requires a GROUP BY interval", name);
        }
        compiler.compileNestedExpr(nested);
    }

    static void requireArity(Call call, int expected) {
        List<Expr> args = call.args();
        if (args.size() != expected) {
            throw new TranspileException(
                ErrorKind.ARITY,
                "invalid number of arguments for %s, expected %d, got %d",
                call.name(),
                expected,
                args.size()
            );
        }
    }

    private static void requireArityRange(Call call, int min, int max) {
        int got = call.args().size();
        if (got < min || got > max) {
            throw new TranspileException(
                ErrorKind.ARITY,
                "invalid number of arguments for %s, expected at least %d but no more than %d, got %d",
                call.name(),
                min,
                max,
                got
            );
        }
    }

    private static void requirePositive(DurationLiteral duration) {
        if (duration.value().isNegative() || duration.value().isZero()) {
            throw new TranspileException(
                ErrorKind.ARGUMENT_VALUE,
                "duration argument must be positive, got %s",
                InfluxQLDuration.format(duration.value())
            );
        }
    }
}
