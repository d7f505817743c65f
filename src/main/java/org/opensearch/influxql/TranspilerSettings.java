/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql;

import org.opensearch.common.settings.Setting;

import java.util.List;

/**
 * Node settings read by {@link TranspilerConfig#fromSettings}.
 */
public final class TranspilerSettings {

    /**
     * Database of sources that do not name one. Empty means statements must always name their database.
     */
    public static final Setting<String> DEFAULT_DATABASE = Setting.simpleString(
        "influxql.default_database",
        "",
        Setting.Property.NodeScope
    );

    /**
     * Retention policy of sources that do not name one. Empty falls back to {@code autogen}.
     */
    public static final Setting<String> DEFAULT_RETENTION_POLICY = Setting.simpleString(
        "influxql.default_retention_policy",
        "",
        Setting.Property.NodeScope
    );

    private TranspilerSettings() {
        // Utility class
    }

    /**
     * All settings declared by the transpiler.
     */
    public static List<Setting<?>> getSettings() {
        return List.of(DEFAULT_DATABASE, DEFAULT_RETENTION_POLICY);
    }
}
