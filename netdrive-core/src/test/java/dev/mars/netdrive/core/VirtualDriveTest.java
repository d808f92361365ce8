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

package dev.mars.netdrive.core;

import dev.mars.netdrive.core.exceptions.InvalidTransitionException;
import dev.mars.netdrive.protocol.ConnectorSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Online state of a drive follows its active connection.
 */
class VirtualDriveTest {

    private VirtualDrive drive;
    private ActiveConnection connection;

    @BeforeEach
    void setUp() {
        ConnectionConfig config = ConnectionConfig.builder().protocol(Protocol.SMB).host("nas.local").build();
        drive = new VirtualDrive("drive-1", null, config, Instant.now());
        connection = new ActiveConnection("conn-1", config);
        drive.attach(connection);
    }

    @Test
    void testNameDefaultsToHost() {
        assertEquals("nas.local", drive.getName());
    }

    @Test
    void testOnlineOnlyWhileConnected() throws Exception {
        assertFalse(drive.isOnline());
        assertEquals("Not connected", drive.getOfflineReason().orElseThrow());

        connection.markConnecting();
        assertFalse(drive.isOnline());

        connection.markConnected(Mockito.mock(ConnectorSession.class));
        assertTrue(drive.isOnline());
        assertTrue(drive.getOfflineReason().isEmpty());
        assertTrue(connection.getSession().isPresent());

        connection.markError(ErrorKind.CONNECTION, "Connection reset");
        assertFalse(drive.isOnline());
        assertEquals("Connection reset", drive.getOfflineReason().orElseThrow());
        assertTrue(connection.getSession().isEmpty());
    }

    @Test
    void testDeviceNoticeDoesNotChangeConnection() throws Exception {
        connection.markConnecting();
        connection.markConnected(Mockito.mock(ConnectorSession.class));

        drive.setDeviceNotice("Device nas.local is unreachable");

        assertTrue(drive.isOnline());
        assertEquals(ConnectionStatus.CONNECTED, connection.getStatus());

        connection.markDisconnected();
        assertEquals("Device nas.local is unreachable", drive.getOfflineReason().orElseThrow());
    }

    @Test
    void testDisconnectIsIdempotent() throws Exception {
        connection.markDisconnected();
        connection.markDisconnected();

        assertEquals(ConnectionStatus.DISCONNECTED, connection.getStatus());
    }

    @Test
    void testIllegalConnectionTransition() {
        assertThrows(InvalidTransitionException.class,
                () -> connection.markConnected(Mockito.mock(ConnectorSession.class)));
        assertEquals(ConnectionStatus.DISCONNECTED, connection.getStatus());
    }
}
