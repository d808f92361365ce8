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
import dev.mars.netdrive.core.exceptions.ConnectorException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

/**
 * Shared plumbing for connectors: typed session lookup, local file handling and
 * the configured copy settings.
 *
 * @param <S> the connector's session type
 */
public abstract class AbstractConnector<S extends ConnectorSession> implements ProtocolConnector {

    protected final ConnectorSettings settings;
    private final Class<S> sessionType;

    protected AbstractConnector(Class<S> sessionType, ConnectorSettings settings) {
        this.sessionType = sessionType;
        this.settings = settings != null ? settings : ConnectorSettings.DEFAULTS;
    }

    public ConnectorSettings getSettings() {
        return settings;
    }

    protected S session(ConnectorSession session) throws ConnectorException {
        if (!sessionType.isInstance(session)) {
            throw new ConnectorException(ErrorKind.PROTOCOL,
                    "Session " + (session == null ? "null" : session.getClass().getSimpleName())
                            + " does not belong to " + getClass().getSimpleName());
        }
        return sessionType.cast(session);
    }

    protected static String newSessionId() {
        return UUID.randomUUID().toString();
    }

    protected static long localSize(Path localPath) throws ConnectorException {
        try {
            return Files.size(localPath);
        } catch (IOException e) {
            throw ConnectorErrors.local("Cannot read " + localPath, e);
        }
    }

    protected static InputStream openLocalInput(Path localPath) throws ConnectorException {
        try {
            return Files.newInputStream(localPath);
        } catch (IOException e) {
            throw ConnectorErrors.local("Cannot open " + localPath, e);
        }
    }

    /**
     * Open the download target, creating missing parent directories and truncating
     * any existing file.
     */
    protected static OutputStream openLocalOutput(Path localPath) throws ConnectorException {
        try {
            Path parent = localPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            return Files.newOutputStream(localPath, StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException e) {
            throw ConnectorErrors.local("Cannot write " + localPath, e);
        }
    }
}
