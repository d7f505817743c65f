/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.influxql;

import org.opensearch.common.settings.Settings;
import org.opensearch.test.OpenSearchTestCase;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

public class TranspilerConfigTests extends OpenSearchTestCase {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2010-09-15T09:00:00Z"), ZoneOffset.UTC);

    public void testBuilderDefaults() {
        TranspilerConfig config = TranspilerConfig.builder().build();
        assertNotNull(config.getNowClock());
        assertNull(config.getDefaultDatabase());
        assertNull(config.getDefaultRetentionPolicy());
    }

    public void testEmptyValuesAreUnset() {
        TranspilerConfig config = TranspilerConfig.builder().nowClock(CLOCK).defaultDatabase("").defaultRetentionPolicy("").build();
        assertNull(config.getDefaultDatabase());
        assertNull(config.getDefaultRetentionPolicy());
        assertSame(CLOCK, config.getNowClock());
    }

    public void testClockIsRequired() {
        expectThrows(NullPointerException.class, () -> TranspilerConfig.builder().nowClock(null).build());
    }

    public void testFromSettings() {
        Settings settings = Settings.builder()
            .put(TranspilerSettings.DEFAULT_DATABASE.getKey(), "telegraf")
            .put(TranspilerSettings.DEFAULT_RETENTION_POLICY.getKey(), "weekly")
            .build();
        TranspilerConfig config = TranspilerConfig.fromSettings(settings, CLOCK);
        assertEquals("telegraf", config.getDefaultDatabase());
        assertEquals("weekly", config.getDefaultRetentionPolicy());
        assertSame(CLOCK, config.getNowClock());
    }

    public void testFromEmptySettings() {
        TranspilerConfig config = TranspilerConfig.fromSettings(Settings.EMPTY, CLOCK);
        assertNull(config.getDefaultDatabase());
        assertNull(config.getDefaultRetentionPolicy());
    }

    public void testSettingKeys() {
        assertEquals("influxql.default_database", TranspilerSettings.DEFAULT_DATABASE.getKey());
        assertEquals("influxql.default_retention_policy", TranspilerSettings.DEFAULT_RETENTION_POLICY.getKey());
        assertEquals(2, TranspilerSettings.getSettings().size());
        assertTrue(TranspilerSettings.getSettings().contains(TranspilerSettings.DEFAULT_DATABASE));
    }
}
