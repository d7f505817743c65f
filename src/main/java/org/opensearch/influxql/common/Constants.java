/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql.common;

import java.time.Instant;

/**
 * Constants shared by the compiler and the graph builder.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    /**
     * Column names of the tables flowing through the operator graph.
     */
    public static final class Columns {
        private Columns() {}

        /** Timestamp of a point. */
        public static final String TIME = "_time";

        /** Lower bound of the window a row belongs to. */
        public static final String START = "_start";

        /** Upper bound of the window a row belongs to. */
        public static final String STOP = "_stop";

        /** Value of a point. */
        public static final String VALUE = "_value";

        /** Field key of a point. */
        public static final String FIELD = "_field";

        /** Measurement name of a point. */
        public static final String MEASUREMENT = "_measurement";
    }

    /**
     * Whole-of-time bounds used when a statement does not constrain time.
     */
    public static final class TimeBounds {
        private TimeBounds() {}

        /** Smallest representable timestamp in nanoseconds since the epoch. */
        public static final long MIN_TIME_NANOS = Long.MIN_VALUE + 2;

        /** Largest representable timestamp in nanoseconds since the epoch. */
        public static final long MAX_TIME_NANOS = Long.MAX_VALUE - 1;

        /** 1677-09-21T00:12:43.145224194Z */
        public static final Instant MIN_TIME = TimeLiterals.ofEpochNanos(MIN_TIME_NANOS);

        /** 2262-04-11T23:47:16.854775806Z */
        public static final Instant MAX_TIME = TimeLiterals.ofEpochNanos(MAX_TIME_NANOS);
    }

    /**
     * Names used in the query language and in generated lambdas.
     */
    public static final class Names {
        private Names() {}

        /** The implicit time column of the query language. */
        public static final String TIME = "time";

        /** Function returning the current time. */
        public static final String NOW = "now";

        /** Parameter of filter and map lambdas. */
        public static final String RECORD_PARAM = "r";

        /** Parameter of join lambdas. */
        public static final String TABLES_PARAM = "tables";

        /** Retention policy used when neither the statement nor the configuration names one. */
        public static final String DEFAULT_RETENTION_POLICY = "autogen";

        /** Key every cross-pipeline join is performed on. */
        public static final String JOIN_KEY = Columns.MEASUREMENT;
    }
}
