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

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionConfigTest {

    @Test
    void testDefaults() {
        ConnectionConfig config = ConnectionConfig.builder()
                .protocol(Protocol.SFTP)
                .host("  nas.local ")
                .build();

        assertEquals("nas.local", config.getHost());
        assertEquals(22, config.getPort());
        assertEquals("/", config.getRemoteRoot());
        assertEquals(Duration.ofSeconds(30), config.getTimeout());
        assertEquals("anonymous", config.getUsername());
        assertEquals("SFTP://nas.local:22", config.endpointKey());
    }

    @Test
    void testExplicitPortAndRoot() {
        ConnectionConfig config = ConnectionConfig.builder()
                .protocol(Protocol.FTP)
                .host("192.168.1.20")
                .port(2121)
                .remoteRoot("/share//media/")
                .option("passive", "true")
                .build();

        assertEquals(2121, config.getPort());
        assertEquals("/share/media", config.getRemoteRoot());
        assertEquals("true", config.getOption("passive", "false"));
        assertEquals("x", config.getOption("missing", "x"));
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> ConnectionConfig.builder().protocol(Protocol.FTP).host(" ").build());
        assertThrows(IllegalArgumentException.class,
                () -> ConnectionConfig.builder().protocol(Protocol.FTP).host("h").port(70000).build());
        assertThrows(IllegalArgumentException.class,
                () -> ConnectionConfig.builder().protocol(Protocol.FTP).host("h").remoteRoot("relative").build());
        assertThrows(IllegalArgumentException.class,
                () -> ConnectionConfig.builder().protocol(Protocol.FTP).host("h").timeout(Duration.ZERO).build());
        assertThrows(NullPointerException.class,
                () -> ConnectionConfig.builder().host("h").build());
    }

    @Test
    void testToStringOmitsPassword() {
        ConnectionConfig config = ConnectionConfig.builder()
                .protocol(Protocol.SMB)
                .host("fileserver")
                .username("alice")
                .password("s3cret")
                .build();

        assertFalse(config.toString().contains("s3cret"));
        assertTrue(config.hasCredentials());
    }

    @Test
    void testToBuilderCopiesEverything() {
        ConnectionConfig original = ConnectionConfig.builder()
                .protocol(Protocol.WEBDAV)
                .host("dav.local")
                .port(8080)
                .remoteRoot("/dav")
                .option("k", "v")
                .build();

        ConnectionConfig copy = original.toBuilder().host("dav2.local").build();

        assertEquals("dav2.local", copy.getHost());
        assertEquals(8080, copy.getPort());
        assertEquals("/dav", copy.getRemoteRoot());
        assertEquals("v", copy.getOption("k", null));
    }
}
