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

import dev.mars.netdrive.core.ConnectionConfig;
import dev.mars.netdrive.core.Protocol;
import dev.mars.netdrive.core.RemoteEntry;
import dev.mars.netdrive.core.exceptions.ConnectorException;

import java.nio.file.Path;
import java.util.List;

/**
 * Contract implemented once per storage protocol.
 *
 * <p>Connectors hold no per-connection state: every call receives the
 * {@link ConnectorSession} returned by {@link #connect}, and the caller owns that
 * session until it passes it to {@link #disconnect}. Remote paths are absolute
 * '/'-separated paths on the server.</p>
 *
 * <p>Transfers report progress through the supplied listener at a throttled
 * rate and check the cancellation token between chunks.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface ProtocolConnector {

    /**
     * @return the protocols this connector serves
     */
    List<Protocol> getProtocols();

    /**
     * Establish a session.
     *
     * @throws ConnectorException with kind AUTHENTICATION, CONNECTION, TIMEOUT or PROTOCOL
     */
    ConnectorSession connect(ConnectionConfig config) throws ConnectorException;

    /**
     * List the direct children of a remote directory. Never mutates remote state.
     */
    List<RemoteEntry> listEntries(ConnectorSession session, String remotePath) throws ConnectorException;

    /**
     * Stream a local file to the remote path, creating missing remote parent directories.
     */
    void upload(ConnectorSession session, Path localPath, String remotePath,
                ProgressListener listener, CancellationToken cancellation) throws ConnectorException;

    /**
     * Stream a remote file to the local path, creating missing local parent directories.
     */
    void download(ConnectorSession session, String remotePath, Path localPath,
                  ProgressListener listener, CancellationToken cancellation) throws ConnectorException;

    /**
     * Release the session. Idempotent and never throws.
     */
    void disconnect(ConnectorSession session);
}
