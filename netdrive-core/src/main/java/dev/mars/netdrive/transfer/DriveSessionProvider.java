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

import dev.mars.netdrive.core.Protocol;
import dev.mars.netdrive.core.exceptions.ConnectorException;
import dev.mars.netdrive.protocol.ConnectorSession;
import dev.mars.netdrive.protocol.ProtocolConnector;

/**
 * Supplies a transfer queue with the connector of the drive it serves and leases
 * it one session per running transfer.
 */
public interface DriveSessionProvider {

    String getDriveId();

    Protocol getProtocol();

    ProtocolConnector getConnector() throws ConnectorException;

    /**
     * Lease a session that no other transfer uses until it is released.
     *
     * @throws ConnectorException with kind CONNECTION while the drive is offline
     */
    ConnectorSession acquireSession() throws ConnectorException;

    /**
     * Return a session obtained from {@link #acquireSession()}.
     *
     * @param reusable {@code false} if the attempt failed in a way that leaves the session suspect
     */
    void releaseSession(ConnectorSession session, boolean reusable);
}
