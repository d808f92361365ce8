package dev.mars.netdrive.config;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Configuration for the NetDrive engine.
 *
 * <p>Values are layered: built-in defaults, then the first {@code netdrive.properties}
 * found (working directory, {@code config/}, {@code ~/.netdrive/}, classpath), then
 * {@code netdrive.*} system properties. An instance is a read-only snapshot; the
 * engine never writes configuration back.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class NetDriveConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(NetDriveConfiguration.class);

    public static final String PREFIX = "netdrive.";

    public static final String CONCURRENT_LIMIT = "netdrive.transfer.concurrent.limit";
    public static final String MAX_RETRIES = "netdrive.transfer.max.retries";
    public static final String RETRY_BASE_DELAY_MS = "netdrive.transfer.retry.base.delay.ms";
    public static final String RETRY_MAX_DELAY_MS = "netdrive.transfer.retry.max.delay.ms";
    public static final String BUFFER_SIZE = "netdrive.transfer.buffer.size";
    public static final String PROGRESS_INTERVAL_MS = "netdrive.transfer.progress.interval.ms";
    public static final String PROGRESS_BYTES = "netdrive.transfer.progress.bytes";
    public static final String RETAINED_ITEMS = "netdrive.transfer.retained.items";
    public static final String CONNECTION_TIMEOUT_MS = "netdrive.connection.timeout.ms";
    public static final String DISCOVERY_INTERVAL_MS = "netdrive.discovery.interval.ms";
    public static final String DISCOVERY_MIN_INTERVAL_MS = "netdrive.discovery.min.interval.ms";
    public static final String DISCOVERY_PROBE_TIMEOUT_MS = "netdrive.discovery.probe.timeout.ms";
    public static final String DISCOVERY_PROBE_THREADS = "netdrive.discovery.probe.threads";
    public static final String DISCOVERY_STALE_CYCLES = "netdrive.discovery.stale.cycles";
    public static final String DISCOVERY_EXTRA_HOSTS = "netdrive.discovery.extra.hosts";
    public static final String CHECKSUM_ALGORITHM = "netdrive.checksum.algorithm";
    public static final String MOUNT_ROOT = "netdrive.mount.root";
    public static final String SYNC_MTIME_TOLERANCE_MS = "netdrive.sync.mtime.tolerance.ms";
    public static final String HEALTH_INTERVAL_MS = "netdrive.drive.health.interval.ms";

    private static final String FILE_NAME = "netdrive.properties";

    private final Properties properties;

    /**
     * Load defaults, the first properties file found and system property overrides.
     */
    public NetDriveConfiguration() {
        this.properties = defaults();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    /**
     * Defaults overlaid with the given properties only; files and system properties are ignored.
     */
    public NetDriveConfiguration(Properties overrides) {
        this.properties = defaults();
        if (overrides != null) {
            this.properties.putAll(overrides);
        }
    }

    public static NetDriveConfiguration of(Map<String, String> overrides) {
        Properties props = new Properties();
        props.putAll(overrides);
        return new NetDriveConfiguration(props);
    }

    // Transfer queue

    public int getConcurrentLimit() {
        return Math.max(1, getIntProperty(CONCURRENT_LIMIT, 3));
    }

    public int getMaxRetries() {
        return Math.max(0, getIntProperty(MAX_RETRIES, 3));
    }

    public Duration getRetryBaseDelay() {
        return Duration.ofMillis(getLongProperty(RETRY_BASE_DELAY_MS, 1000));
    }

    public Duration getRetryMaxDelay() {
        return Duration.ofMillis(getLongProperty(RETRY_MAX_DELAY_MS, 60_000));
    }

    public int getBufferSize() {
        return getIntProperty(BUFFER_SIZE, 64 * 1024);
    }

    public Duration getProgressInterval() {
        return Duration.ofMillis(getLongProperty(PROGRESS_INTERVAL_MS, 250));
    }

    public long getProgressBytes() {
        return getLongProperty(PROGRESS_BYTES, 256 * 1024);
    }

    public int getRetainedItems() {
        return getIntProperty(RETAINED_ITEMS, 500);
    }

    // Connections

    public Duration getConnectionTimeout() {
        return Duration.ofMillis(getLongProperty(CONNECTION_TIMEOUT_MS, 30_000));
    }

    public Path getMountRoot() {
        return Paths.get(getStringProperty(MOUNT_ROOT, defaultMountRoot()));
    }

    public Duration getHealthInterval() {
        return Duration.ofMillis(getLongProperty(HEALTH_INTERVAL_MS, 15_000));
    }

    // Discovery

    public Duration getDiscoveryInterval() {
        return Duration.ofMillis(getLongProperty(DISCOVERY_INTERVAL_MS, 5_000));
    }

    public Duration getDiscoveryMinInterval() {
        return Duration.ofMillis(getLongProperty(DISCOVERY_MIN_INTERVAL_MS, 2_000));
    }

    public Duration getProbeTimeout() {
        return Duration.ofMillis(getLongProperty(DISCOVERY_PROBE_TIMEOUT_MS, 300));
    }

    public int getProbeThreads() {
        return Math.max(1, getIntProperty(DISCOVERY_PROBE_THREADS, 32));
    }

    public int getStaleCycles() {
        return Math.max(1, getIntProperty(DISCOVERY_STALE_CYCLES, 3));
    }

    public List<String> getExtraHosts() {
        String value = getStringProperty(DISCOVERY_EXTRA_HOSTS, "");
        if (value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableList());
    }

    // Integrity and sync

    public String getChecksumAlgorithm() {
        return getStringProperty(CHECKSUM_ALGORITHM, "SHA-256");
    }

    public Duration getSyncMtimeTolerance() {
        return Duration.ofMillis(getLongProperty(SYNC_MTIME_TOLERANCE_MS, 2_000));
    }

    // Generic access

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    /**
     * @return an immutable, sorted copy of every effective property
     */
    public Map<String, String> snapshot() {
        Map<String, String> copy = new TreeMap<>();
        properties.stringPropertyNames().forEach(k -> copy.put(k, properties.getProperty(k)));
        return Collections.unmodifiableMap(copy);
    }

    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private static Properties defaults() {
        Properties defaults = new Properties();
        defaults.setProperty(CONCURRENT_LIMIT, "3");
        defaults.setProperty(MAX_RETRIES, "3");
        defaults.setProperty(RETRY_BASE_DELAY_MS, "1000");
        defaults.setProperty(RETRY_MAX_DELAY_MS, "60000");
        defaults.setProperty(BUFFER_SIZE, String.valueOf(64 * 1024));
        defaults.setProperty(PROGRESS_INTERVAL_MS, "250");
        defaults.setProperty(PROGRESS_BYTES, String.valueOf(256 * 1024));
        defaults.setProperty(RETAINED_ITEMS, "500");
        defaults.setProperty(CONNECTION_TIMEOUT_MS, "30000");
        defaults.setProperty(DISCOVERY_INTERVAL_MS, "5000");
        defaults.setProperty(DISCOVERY_MIN_INTERVAL_MS, "2000");
        defaults.setProperty(DISCOVERY_PROBE_TIMEOUT_MS, "300");
        defaults.setProperty(DISCOVERY_PROBE_THREADS, "32");
        defaults.setProperty(DISCOVERY_STALE_CYCLES, "3");
        defaults.setProperty(DISCOVERY_EXTRA_HOSTS, "");
        defaults.setProperty(CHECKSUM_ALGORITHM, "SHA-256");
        defaults.setProperty(MOUNT_ROOT, defaultMountRoot());
        defaults.setProperty(SYNC_MTIME_TOLERANCE_MS, "2000");
        defaults.setProperty(HEALTH_INTERVAL_MS, "15000");
        return defaults;
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                FILE_NAME,
                "config/" + FILE_NAME,
                System.getProperty("user.home") + "/.netdrive/" + FILE_NAME
        };
        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.isRegularFile(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }
        try (InputStream input = NetDriveConfiguration.class.getClassLoader().getResourceAsStream(FILE_NAME)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().stringPropertyNames().stream()
                .filter(key -> key.startsWith(PREFIX))
                .forEach(key -> {
                    properties.setProperty(key, System.getProperty(key));
                    logger.debug("Override from system property: {}", key);
                });
    }

    private static String defaultMountRoot() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        return os.contains("win") ? "C:\\netdrive" : "/mnt";
    }

    @Override
    public String toString() {
        return "NetDriveConfiguration{" +
                "concurrentLimit=" + getConcurrentLimit() +
                ", maxRetries=" + getMaxRetries() +
                ", connectionTimeout=" + getConnectionTimeout().toMillis() + "ms" +
                ", discoveryInterval=" + getDiscoveryInterval().toMillis() + "ms" +
                ", checksumAlgorithm='" + getChecksumAlgorithm() + '\'' +
                '}';
    }
}
