package dev.mars.netdrive.transfer;

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

import dev.mars.netdrive.core.ConnectionConfig;
import dev.mars.netdrive.core.ErrorKind;
import dev.mars.netdrive.core.exceptions.ConnectorException;
import dev.mars.netdrive.protocol.ConnectorSession;
import dev.mars.netdrive.protocol.ProtocolConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Bounded pool of connector sessions used by one drive's transfer workers.
 *
 * <p>Each session is leased to at most one transfer at a time. Idle sessions are
 * reused when they still report alive, otherwise a fresh one is opened with the
 * drive's connection settings. Once closed, the pool disconnects its idle
 * sessions immediately and leased ones as they are released.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TransferSessionPool {

    private static final Logger logger = LoggerFactory.getLogger(TransferSessionPool.class);

    private final ProtocolConnector connector;
    private final ConnectionConfig config;
    private final int maxSessions;

    private final Deque<ConnectorSession> idle = new ArrayDeque<>();
    private final Set<ConnectorSession> leased = Collections.newSetFromMap(new IdentityHashMap<>());
    private int opening;
    private boolean closed;

    public TransferSessionPool(ProtocolConnector connector, ConnectionConfig config, int maxSessions) {
        if (maxSessions < 1) {
            throw new IllegalArgumentException("maxSessions must be at least 1");
        }
        this.connector = connector;
        this.config = config;
        this.maxSessions = maxSessions;
    }

    /**
     * Lease a session for exclusive use by one transfer.
     *
     * @throws ConnectorException with kind CONNECTION if the pool is closed or
     *         exhausted, or whatever the connector raises while opening a session
     */
    public ConnectorSession acquire() throws ConnectorException {
        List<ConnectorSession> dead = new ArrayList<>();
        try {
            synchronized (this) {
                requireOpen();
                while (!idle.isEmpty()) {
                    ConnectorSession candidate = idle.pollFirst();
                    if (isAlive(candidate)) {
                        leased.add(candidate);
                        return candidate;
                    }
                    dead.add(candidate);
                }
                if (leased.size() + opening >= maxSessions) {
                    throw new ConnectorException(ErrorKind.CONNECTION, "All " + maxSessions
                            + " transfer sessions to " + config.endpointKey() + " are in use");
                }
                opening++;
            }
        } finally {
            dead.forEach(this::close);
        }

        ConnectorSession session;
        try {
            session = connector.connect(config);
        } finally {
            synchronized (this) {
                opening--;
            }
        }
        synchronized (this) {
            if (!closed) {
                leased.add(session);
                logger.debug("Opened transfer session {} to {} ({} leased)", session.getId(),
                        config.endpointKey(), leased.size());
                return session;
            }
        }
        close(session);
        throw closedError();
    }

    /**
     * Hand a leased session back. A session that is not reusable, no longer alive
     * or returned after {@link #closeAll()} is disconnected.
     *
     * @return {@code false} if the session was not leased from this pool
     */
    public boolean release(ConnectorSession session, boolean reusable) {
        boolean keep;
        synchronized (this) {
            if (!leased.remove(session)) {
                return false;
            }
            keep = reusable && !closed && isAlive(session);
            if (keep) {
                idle.addFirst(session);
            }
        }
        if (!keep) {
            close(session);
        }
        return true;
    }

    /**
     * Disconnect every idle session and refuse further leases.
     */
    public void closeAll() {
        List<ConnectorSession> toClose;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            toClose = new ArrayList<>(idle);
            idle.clear();
        }
        toClose.forEach(this::close);
        logger.debug("Closed transfer session pool for {} ({} idle sessions)", config.endpointKey(), toClose.size());
    }

    public synchronized int getLeasedCount() {
        return leased.size();
    }

    public synchronized int getIdleCount() {
        return idle.size();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    private void requireOpen() throws ConnectorException {
        if (closed) {
            throw closedError();
        }
    }

    private ConnectorException closedError() {
        return new ConnectorException(ErrorKind.CONNECTION,
                "Transfer sessions to " + config.endpointKey() + " were closed");
    }

    private void close(ConnectorSession session) {
        try {
            connector.disconnect(session);
        } catch (RuntimeException e) {
            logger.warn("Error closing transfer session {}: {}", session.getId(), e.getMessage());
        }
    }

    private static boolean isAlive(ConnectorSession session) {
        try {
            return session.isAlive();
        } catch (RuntimeException e) {
            logger.debug("Liveness check of session {} threw: {}", session.getId(), e.getMessage());
            return false;
        }
    }
}
