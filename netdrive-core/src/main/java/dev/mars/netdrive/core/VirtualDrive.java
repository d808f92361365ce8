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

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A named binding between the application and one remote storage endpoint.
 *
 * <p>Whether the drive is online is derived from its {@link ActiveConnection};
 * there is no separate flag to get out of sync.</p>
 */
public class VirtualDrive {

    private final String id;
    private final String name;
    private final ConnectionConfig config;
    private final Instant createdAt;

    private volatile ActiveConnection activeConnection;
    private volatile Instant lastSync;
    private volatile String deviceNotice;

    public VirtualDrive(String id, String name, ConnectionConfig config, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.name = name == null || name.isBlank() ? config.getHost() : name;
        this.createdAt = createdAt;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public ConnectionConfig getConfig() { return config; }
    public Protocol getProtocol() { return config.getProtocol(); }
    public Instant getCreatedAt() { return createdAt; }
    public Optional<Instant> getLastSync() { return Optional.ofNullable(lastSync); }
    public Optional<ActiveConnection> getActiveConnection() { return Optional.ofNullable(activeConnection); }

    public boolean isOnline() {
        ActiveConnection connection = activeConnection;
        return connection != null && connection.getStatus() == ConnectionStatus.CONNECTED;
    }

    /**
     * Why the drive is offline: the connection's last error, else a notice from
     * discovery about the device, else a plain "not connected".
     */
    public Optional<String> getOfflineReason() {
        if (isOnline()) {
            return Optional.empty();
        }
        ActiveConnection connection = activeConnection;
        if (connection != null && connection.getLastError() != null
                && connection.getStatus() == ConnectionStatus.ERROR) {
            return Optional.of(connection.getLastError());
        }
        if (deviceNotice != null) {
            return Optional.of(deviceNotice);
        }
        return Optional.of("Not connected");
    }

    /**
     * Notice attached by discovery, e.g. that the bound device stopped answering.
     * Does not change the connection state.
     */
    public Optional<String> getDeviceNotice() {
        return Optional.ofNullable(deviceNotice);
    }

    public void attach(ActiveConnection connection) {
        this.activeConnection = connection;
    }

    public void setDeviceNotice(String notice) {
        this.deviceNotice = notice;
    }

    public void markSynced(Instant when) {
        this.lastSync = when;
    }

    @Override
    public String toString() {
        return "VirtualDrive{id='" + id + "', name='" + name + "', " + config.endpointKey() +
                ", online=" + isOnline() + '}';
    }
}
