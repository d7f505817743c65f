/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql;

import org.opensearch.common.settings.Settings;

import java.time.Clock;
import java.util.Objects;

/**
 * Immutable configuration of an {@link InfluxQLTranspiler}.
 */
public final class TranspilerConfig {

    private final Clock nowClock;
    private final String defaultDatabase;
    private final String defaultRetentionPolicy;

    private TranspilerConfig(Builder builder) {
        this.nowClock = Objects.requireNonNull(builder.nowClock, "nowClock");
        this.defaultDatabase = emptyToNull(builder.defaultDatabase);
        this.defaultRetentionPolicy = emptyToNull(builder.defaultRetentionPolicy);
    }

    /**
     * Creates a configuration from node settings.
     *
     * @param settings the node settings
     * @param nowClock the clock resolving {@code now()}
     * @return the configuration
     */
    public static TranspilerConfig fromSettings(Settings settings, Clock nowClock) {
        return builder().nowClock(nowClock)
            .defaultDatabase(TranspilerSettings.DEFAULT_DATABASE.get(settings))
            .defaultRetentionPolicy(TranspilerSettings.DEFAULT_RETENTION_POLICY.get(settings))
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The clock resolving {@code now()} and relative time bounds.
     */
    public Clock getNowClock() {
        return nowClock;
    }

    /**
     * Database used when a source names none, or null.
     */
    public String getDefaultDatabase() {
        return defaultDatabase;
    }

    /**
     * Retention policy used when a source names none, or null.
     */
    public String getDefaultRetentionPolicy() {
        return defaultRetentionPolicy;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    /**
     * Builder for {@link TranspilerConfig}. The clock defaults to the UTC system clock.
     */
    public static final class Builder {
        private Clock nowClock = Clock.systemUTC();
        private String defaultDatabase;
        private String defaultRetentionPolicy;

        private Builder() {}

        public Builder nowClock(Clock nowClock) {
            this.nowClock = nowClock;
            return this;
        }

        public Builder defaultDatabase(String defaultDatabase) {
            this.defaultDatabase = defaultDatabase;
            return this;
        }

        public Builder defaultRetentionPolicy(String defaultRetentionPolicy) {
            this.defaultRetentionPolicy = defaultRetentionPolicy;
            return this;
        }

        public TranspilerConfig build() {
            return new TranspilerConfig(this);
        }
    }
}
