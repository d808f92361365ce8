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

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the JSON shapes handed to external history stores.
 */
class CoreModelJsonTest {

    @Test
    void testRemoteEntryJson() throws Exception {
        RemoteEntry entry = RemoteEntry.file("/docs", "a.txt", 42, Instant.parse("2025-01-02T03:04:05Z"));

        JsonNode json = NetDriveJson.mapper().readTree(NetDriveJson.toJson(entry));

        assertEquals("a.txt", json.get("name").asText());
        assertEquals("/docs/a.txt", json.get("path").asText());
        assertEquals(42, json.get("size").asLong());
        assertFalse(json.get("isDirectory").asBoolean());
        assertEquals("2025-01-02T03:04:05Z", json.get("modifiedAt").asText());
    }

    @Test
    void testDirectoryEntry() {
        RemoteEntry dir = RemoteEntry.directory("/", "photos", null);

        assertTrue(dir.directory());
        assertEquals("/photos", dir.path());
        assertEquals(0, dir.size());
    }

    @Test
    void testSnapshotJsonRoundTrip() throws Exception {
        TransferRequest request = TransferRequest.builder()
                .direction(TransferDirection.DOWNLOAD)
                .localPath(Paths.get("local", "a.bin"))
                .remotePath("/a.bin")
                .priority(TransferPriority.CRITICAL)
                .metadata("origin", "sync")
                .build();
        TransferItemSnapshot snapshot = new TransferItem("id-1", "drive-1", 1, request, 3,
                Instant.parse("2025-03-01T00:00:00Z")).snapshot();

        String json = NetDriveJson.toJson(snapshot);
        TransferItemSnapshot parsed = NetDriveJson.mapper().readValue(json, TransferItemSnapshot.class);

        assertEquals(snapshot, parsed);
        assertTrue(json.contains("\"status\":\"QUEUED\""));
        assertTrue(json.contains("\"createdAt\":\"2025-03-01T00:00:00Z\""));
    }

    @Test
    void testPriorityParsing() {
        assertEquals(TransferPriority.HIGH, TransferPriority.fromString(" high "));
        assertEquals(TransferPriority.NORMAL, TransferPriority.fromString(""));
        assertThrows(IllegalArgumentException.class, () -> TransferPriority.fromString("urgent"));
        assertTrue(TransferPriority.CRITICAL.isHigherThan(TransferPriority.HIGH));
    }

    @Test
    void testProtocolLookup() {
        assertEquals(Protocol.SMB, Protocol.forServicePort(445));
        assertEquals(Protocol.WEBDAVS, Protocol.forServicePort(5001));
        assertNull(Protocol.forServicePort(3389));
        assertEquals(Protocol.SFTP, Protocol.fromString("sftp"));
        assertTrue(Protocol.NFS.isMountBased());
        assertFalse(Protocol.FTP.isMountBased());
    }
}
