package dev.mars.netdrive.core;

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

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only snapshot of the parameters a virtual drive is mounted with.
 *
 * <p>The engine never writes back to configuration; reconnecting a drive reuses
 * the snapshot it was mounted with.</p>
 */
public final class ConnectionConfig {

    private final Protocol protocol;
    private final String host;
    private final int port;
    private final String username;
    private final String password;
    private final String remoteRoot;
    private final Path localRoot;
    private final Duration timeout;
    private final Map<String, String> options;

    private ConnectionConfig(Builder builder) {
        this.protocol = builder.protocol;
        this.host = builder.host;
        this.port = builder.port;
        this.username = builder.username;
        this.password = builder.password;
        this.remoteRoot = builder.remoteRoot;
        this.localRoot = builder.localRoot;
        this.timeout = builder.timeout;
        this.options = Map.copyOf(builder.options);
    }

    public Protocol getProtocol() { return protocol; }
    public String getHost() { return host; }
    public String getUsername() { return username; }
    public String getPassword() { return password; }
    public String getRemoteRoot() { return remoteRoot; }
    public Path getLocalRoot() { return localRoot; }
    public Duration getTimeout() { return timeout; }
    public Map<String, String> getOptions() { return options; }

    /**
     * @return the configured port, or the protocol's default when none was set
     */
    public int getPort() {
        return port == 0 ? protocol.getDefaultPort() : port;
    }

    public String getOption(String key, String defaultValue) {
        return options.getOrDefault(key, defaultValue);
    }

    public boolean hasCredentials() {
        return username != null && !username.isEmpty();
    }

    /**
     * Key identifying the remote endpoint; at most one connection attempt per key
     * may be in flight.
     */
    public String endpointKey() {
        return protocol + "://" + host + ":" + getPort();
    }

    public Builder toBuilder() {
        return new Builder()
                .protocol(protocol)
                .host(host)
                .port(port)
                .username(username)
                .password(password)
                .remoteRoot(remoteRoot)
                .localRoot(localRoot)
                .timeout(timeout)
                .options(options);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Protocol protocol;
        private String host;
        private int port;
        private String username = "anonymous";
        private String password = "";
        private String remoteRoot = "/";
        private Path localRoot;
        private Duration timeout = Duration.ofSeconds(30);
        private final Map<String, String> options = new HashMap<>();

        public Builder protocol(Protocol protocol) { this.protocol = protocol; return this; }
        public Builder host(String host) { this.host = host; return this; }
        public Builder port(int port) { this.port = port; return this; }
        public Builder username(String username) { this.username = username; return this; }
        public Builder password(String password) { this.password = password; return this; }
        public Builder remoteRoot(String remoteRoot) { this.remoteRoot = remoteRoot; return this; }
        public Builder localRoot(Path localRoot) { this.localRoot = localRoot; return this; }
        public Builder timeout(Duration timeout) { this.timeout = timeout; return this; }
        public Builder option(String key, String value) { this.options.put(key, value); return this; }
        public Builder options(Map<String, String> options) { this.options.putAll(options); return this; }

        /**
         * @throws IllegalArgumentException if the host is empty, the port is out of
         *         range or the remote root is not absolute
         */
        public ConnectionConfig build() {
            Objects.requireNonNull(protocol, "protocol cannot be null");
            Objects.requireNonNull(timeout, "timeout cannot be null");
            if (host == null || host.trim().isEmpty()) {
                throw new IllegalArgumentException("Host cannot be empty");
            }
            host = host.trim();
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Port must be between 1 and 65535: " + port);
            }
            if (remoteRoot == null || !remoteRoot.replace('\\', '/').startsWith("/")) {
                throw new IllegalArgumentException("Remote root must be an absolute path: " + remoteRoot);
            }
            remoteRoot = RemotePaths.normalize(remoteRoot);
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("Timeout must be positive");
            }
            return new ConnectionConfig(this);
        }
    }

    @Override
    public String toString() {
        // password intentionally omitted
        return "ConnectionConfig{" + endpointKey() +
                ", user=" + username +
                ", remoteRoot=" + remoteRoot +
                ", localRoot=" + localRoot +
                '}';
    }
}
