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

import dev.mars.netdrive.core.exceptions.InvalidTransitionException;
import dev.mars.netdrive.protocol.ConnectorSession;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A live (or failed) session against one endpoint on behalf of a virtual drive.
 *
 * <p>Status changes follow {@link ConnectionStatus#canTransitionTo(ConnectionStatus)}
 * and are made by the drive manager only.</p>
 */
public class ActiveConnection {

    private final String id;
    private final String deviceKey;
    private final Protocol protocol;
    private final String endpointKey;

    private volatile ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    private volatile ConnectorSession session;
    private volatile String lastError;
    private volatile ErrorKind lastErrorKind;
    private volatile Instant connectedAt;
    private volatile Instant statusChangedAt;

    public ActiveConnection(String id, ConnectionConfig config) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.deviceKey = config.getHost();
        this.protocol = config.getProtocol();
        this.endpointKey = config.endpointKey();
        this.statusChangedAt = Instant.now();
    }

    public String getId() { return id; }
    public String getDeviceKey() { return deviceKey; }
    public Protocol getProtocol() { return protocol; }
    public String getEndpointKey() { return endpointKey; }
    public ConnectionStatus getStatus() { return status; }
    public Optional<ConnectorSession> getSession() { return Optional.ofNullable(session); }
    public String getLastError() { return lastError; }
    public ErrorKind getLastErrorKind() { return lastErrorKind; }
    public Instant getConnectedAt() { return connectedAt; }
    public Instant getStatusChangedAt() { return statusChangedAt; }

    public boolean isConnected() {
        return status == ConnectionStatus.CONNECTED;
    }

    public void markConnecting() throws InvalidTransitionException {
        transitionTo(ConnectionStatus.CONNECTING);
        this.lastError = null;
        this.lastErrorKind = null;
    }

    public void markConnected(ConnectorSession session) throws InvalidTransitionException {
        transitionTo(ConnectionStatus.CONNECTED);
        this.session = Objects.requireNonNull(session, "session cannot be null");
        this.connectedAt = Instant.now();
    }

    /**
     * Record a failure. The session, if any, is dropped; the caller disconnects it.
     */
    public void markError(ErrorKind kind, String message) throws InvalidTransitionException {
        transitionTo(ConnectionStatus.ERROR);
        this.session = null;
        this.lastErrorKind = kind;
        this.lastError = message;
    }

    public void markDisconnected() throws InvalidTransitionException {
        if (status == ConnectionStatus.DISCONNECTED) {
            return;
        }
        transitionTo(ConnectionStatus.DISCONNECTED);
        this.session = null;
    }

    private void transitionTo(ConnectionStatus target) throws InvalidTransitionException {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException(id, status, target, status.getValidTransitions());
        }
        this.status = target;
        this.statusChangedAt = Instant.now();
    }

    @Override
    public String toString() {
        return "ActiveConnection{" + endpointKey + ", status=" + status +
                (lastError != null ? ", lastError='" + lastError + '\'' : "") + '}';
    }
}
