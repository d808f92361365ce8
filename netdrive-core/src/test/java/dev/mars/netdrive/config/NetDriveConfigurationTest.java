/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.netdrive.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for NetDriveConfiguration.
 */
class NetDriveConfigurationTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(NetDriveConfiguration.CONCURRENT_LIMIT);
        System.clearProperty(NetDriveConfiguration.DISCOVERY_EXTRA_HOSTS);
    }

    @Test
    void testDefaultValues() {
        NetDriveConfiguration config = new NetDriveConfiguration(new Properties());

        assertEquals(3, config.getConcurrentLimit());
        assertEquals(3, config.getMaxRetries());
        assertEquals(Duration.ofSeconds(1), config.getRetryBaseDelay());
        assertEquals(Duration.ofMinutes(1), config.getRetryMaxDelay());
        assertEquals(65536, config.getBufferSize());
        assertEquals(Duration.ofMillis(250), config.getProgressInterval());
        assertEquals(500, config.getRetainedItems());
        assertEquals(Duration.ofSeconds(30), config.getConnectionTimeout());
        assertEquals(Duration.ofSeconds(5), config.getDiscoveryInterval());
        assertEquals(Duration.ofSeconds(2), config.getDiscoveryMinInterval());
        assertEquals(Duration.ofMillis(300), config.getProbeTimeout());
        assertEquals(32, config.getProbeThreads());
        assertEquals(3, config.getStaleCycles());
        assertEquals(List.of(), config.getExtraHosts());
        assertEquals("SHA-256", config.getChecksumAlgorithm());
        assertEquals(Duration.ofSeconds(2), config.getSyncMtimeTolerance());
        assertEquals(Duration.ofSeconds(15), config.getHealthInterval());
    }

    @Test
    void testOverridesFromMap() {
        NetDriveConfiguration config = NetDriveConfiguration.of(Map.of(
                NetDriveConfiguration.CONCURRENT_LIMIT, "5",
                NetDriveConfiguration.RETRY_BASE_DELAY_MS, "250",
                NetDriveConfiguration.CHECKSUM_ALGORITHM, "MD5"));

        assertEquals(5, config.getConcurrentLimit());
        assertEquals(Duration.ofMillis(250), config.getRetryBaseDelay());
        assertEquals("MD5", config.getChecksumAlgorithm());
        assertEquals(3, config.getMaxRetries());
    }

    @Test
    void testInvalidNumbersFallBackToDefaults() {
        NetDriveConfiguration config = NetDriveConfiguration.of(Map.of(
                NetDriveConfiguration.CONCURRENT_LIMIT, "many",
                NetDriveConfiguration.CONNECTION_TIMEOUT_MS, "30s",
                NetDriveConfiguration.MAX_RETRIES, " 7 "));

        assertEquals(3, config.getConcurrentLimit());
        assertEquals(Duration.ofSeconds(30), config.getConnectionTimeout());
        assertEquals(7, config.getMaxRetries());
    }

    @Test
    void testOutOfRangeValuesAreClamped() {
        NetDriveConfiguration config = NetDriveConfiguration.of(Map.of(
                NetDriveConfiguration.CONCURRENT_LIMIT, "0",
                NetDriveConfiguration.MAX_RETRIES, "-2",
                NetDriveConfiguration.DISCOVERY_STALE_CYCLES, "0"));

        assertEquals(1, config.getConcurrentLimit());
        assertEquals(0, config.getMaxRetries());
        assertEquals(1, config.getStaleCycles());
    }

    @Test
    void testExtraHostsAreSplitAndTrimmed() {
        NetDriveConfiguration config = NetDriveConfiguration.of(Map.of(
                NetDriveConfiguration.DISCOVERY_EXTRA_HOSTS, " 10.0.0.5, nas.example.org ,, "));

        assertEquals(List.of("10.0.0.5", "nas.example.org"), config.getExtraHosts());
    }

    @Test
    void testSystemPropertiesOverrideDefaults() {
        System.setProperty(NetDriveConfiguration.CONCURRENT_LIMIT, "8");
        System.setProperty(NetDriveConfiguration.DISCOVERY_EXTRA_HOSTS, "192.168.7.2");

        NetDriveConfiguration config = new NetDriveConfiguration();

        assertEquals(8, config.getConcurrentLimit());
        assertEquals(List.of("192.168.7.2"), config.getExtraHosts());
    }

    @Test
    void testExplicitPropertiesIgnoreSystemProperties() {
        System.setProperty(NetDriveConfiguration.CONCURRENT_LIMIT, "8");

        NetDriveConfiguration config = new NetDriveConfiguration(new Properties());

        assertEquals(3, config.getConcurrentLimit());
    }

    @Test
    void testSnapshotIsSortedAndReadOnly() {
        NetDriveConfiguration config = NetDriveConfiguration.of(Map.of("netdrive.custom", "x"));

        Map<String, String> snapshot = config.snapshot();

        assertEquals("x", snapshot.get("netdrive.custom"));
        assertEquals("3", snapshot.get(NetDriveConfiguration.CONCURRENT_LIMIT));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put("a", "b"));
        assertEquals("x", config.getProperty("netdrive.custom"));
        assertEquals("fallback", config.getProperty("netdrive.absent", "fallback"));
    }

    @Test
    void testToStringMentionsKeySettings() {
        String text = new NetDriveConfiguration(new Properties()).toString();

        assertTrue(text.contains("concurrentLimit=3"));
        assertTrue(text.contains("checksumAlgorithm='SHA-256'"));
    }
}
