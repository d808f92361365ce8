package dev.mars.netdrive.drive;

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

import dev.mars.netdrive.core.ActiveConnection;
import dev.mars.netdrive.core.ConnectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Guards connection attempts: at most one connection per (protocol, host) may be
 * in the CONNECTING state at a time.
 */
public class ConnectionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<String, ActiveConnection> connecting = new ConcurrentHashMap<>();

    static String key(ConnectionConfig config) {
        return config.getProtocol() + "://" + config.getHost().toLowerCase(Locale.ROOT);
    }

    /**
     * Claim the connecting slot for the connection's endpoint.
     *
     * @return {@code false} if another connection to the same endpoint is already connecting
     */
    public boolean tryBeginConnecting(ConnectionConfig config, ActiveConnection connection) {
        ActiveConnection existing = connecting.putIfAbsent(key(config), connection);
        if (existing != null && existing != connection) {
            logger.debug("Connection to {} already in progress ({})", key(config), existing.getId());
            return false;
        }
        return true;
    }

    public void endConnecting(ConnectionConfig config, ActiveConnection connection) {
        connecting.remove(key(config), connection);
    }
}
