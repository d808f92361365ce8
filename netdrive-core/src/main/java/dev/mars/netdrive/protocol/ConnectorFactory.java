package dev.mars.netdrive.protocol;

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

import dev.mars.netdrive.core.ErrorKind;
import dev.mars.netdrive.core.Protocol;
import dev.mars.netdrive.core.exceptions.ConnectorException;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Registry resolving a {@link Protocol} to its connector. A drive asks once, at
 * mount time, and keeps the connector for its lifetime.
 */
public class ConnectorFactory {

    private static final Logger logger = LoggerFactory.getLogger(ConnectorFactory.class);

    private final Map<Protocol, ProtocolConnector> connectors = new EnumMap<>(Protocol.class);

    /**
     * Empty factory; callers register connectors explicitly.
     */
    public ConnectorFactory() {
    }

    /**
     * Factory with every built-in connector registered.
     *
     * @param vertx     Vert.x instance backing the WebDAV client
     * @param mountRoot directory under which NFS exports and cloud folders are mounted
     */
    public static ConnectorFactory withDefaults(Vertx vertx, Path mountRoot, ConnectorSettings settings) {
        ConnectorFactory factory = new ConnectorFactory();
        factory.register(new FtpConnector(settings));
        factory.register(new SftpConnector(settings));
        factory.register(new WebDavConnector(vertx, settings));
        factory.register(new SmbConnector(settings));
        factory.register(new MountedFolderConnector(mountRoot, settings));
        logger.info("Registered default connectors for {}", factory.getSupportedProtocols());
        return factory;
    }

    /**
     * Register a connector for every protocol it declares, replacing earlier registrations.
     */
    public synchronized void register(ProtocolConnector connector) {
        for (Protocol protocol : connector.getProtocols()) {
            ProtocolConnector previous = connectors.put(protocol, connector);
            if (previous != null && previous != connector) {
                logger.debug("Replaced connector for {}: {} -> {}", protocol,
                        previous.getClass().getSimpleName(), connector.getClass().getSimpleName());
            }
        }
    }

    public synchronized void unregister(Protocol protocol) {
        if (connectors.remove(protocol) != null) {
            logger.info("Unregistered connector for {}", protocol);
        }
    }

    /**
     * @throws ConnectorException of kind UNSUPPORTED_PROTOCOL when nothing is registered
     */
    public synchronized ProtocolConnector getConnector(Protocol protocol) throws ConnectorException {
        ProtocolConnector connector = protocol == null ? null : connectors.get(protocol);
        if (connector == null) {
            throw new ConnectorException(ErrorKind.UNSUPPORTED_PROTOCOL, "No connector available for " + protocol);
        }
        return connector;
    }

    public synchronized boolean isSupported(Protocol protocol) {
        return protocol != null && connectors.containsKey(protocol);
    }

    public synchronized Set<Protocol> getSupportedProtocols() {
        return connectors.isEmpty() ? EnumSet.noneOf(Protocol.class) : EnumSet.copyOf(connectors.keySet());
    }
}
