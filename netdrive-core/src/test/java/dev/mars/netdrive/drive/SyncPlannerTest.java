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

package dev.mars.netdrive.drive;

import dev.mars.netdrive.core.RemoteEntry;
import dev.mars.netdrive.core.RemotePaths;
import dev.mars.netdrive.core.TransferDirection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SyncPlannerTest {

    private static final Instant BASE = Instant.parse("2025-03-01T10:00:00Z");
    private static final Instant NOW = Instant.parse("2025-03-02T08:30:00Z");

    @TempDir
    Path localRoot;

    private final Map<String, RemoteEntry> remoteFiles = new TreeMap<>();
    private SyncPlanner planner;

    @BeforeEach
    void setUp() {
        planner = new SyncPlanner(Duration.ofSeconds(2), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void local(String rel, int size, Instant modified) throws IOException {
        Path file = localRoot.resolve(rel);
        Files.createDirectories(file.getParent());
        Files.write(file, new byte[size]);
        Files.setLastModifiedTime(file, FileTime.from(modified));
    }

    private void remote(String rel, int size, Instant modified) {
        String path = RemotePaths.join("/share", rel);
        remoteFiles.put(path, new RemoteEntry(RemotePaths.fileName(path), path, size, false, modified));
    }

    /**
     * Lists one directory level of {@link #remoteFiles}, synthesising directory entries.
     */
    private List<RemoteEntry> list(String dir) {
        Map<String, RemoteEntry> entries = new TreeMap<>();
        for (RemoteEntry file : remoteFiles.values()) {
            if (!RemotePaths.isBelow(dir, file.path()) || file.path().equals(dir)) {
                continue;
            }
            String rel = RemotePaths.relativize(dir, file.path());
            int slash = rel.indexOf('/');
            if (slash < 0) {
                entries.put(rel, file);
            } else {
                String child = rel.substring(0, slash);
                entries.putIfAbsent(child, RemoteEntry.directory(dir, child, null));
            }
        }
        return new ArrayList<>(entries.values());
    }

    private SyncPlan plan(SyncDirection direction) throws Exception {
        return planner.plan("drive-1", direction, localRoot, "/share", this::list);
    }

    private static List<String> paths(List<PlannedTransfer> transfers) {
        return transfers.stream().map(PlannedTransfer::relativePath).collect(Collectors.toList());
    }

    @Test
    void testUploadCopiesMissingAndChangedFiles() throws Exception {
        local("same.txt", 10, BASE);
        remote("same.txt", 10, BASE.plusSeconds(1));
        local("missing.txt", 5, BASE);
        local("docs/resized.txt", 20, BASE);
        remote("docs/resized.txt", 30, BASE);
        local("newer.txt", 8, BASE.plusSeconds(60));
        remote("newer.txt", 8, BASE);
        remote("remote-only.txt", 3, BASE);

        SyncPlan plan = plan(SyncDirection.UPLOAD);

        assertEquals(List.of("docs/resized.txt", "missing.txt", "newer.txt"), paths(plan.uploads()));
        assertTrue(plan.downloads().isEmpty());
        assertEquals(1, plan.unchanged());
        PlannedTransfer resized = plan.uploads().get(0);
        assertEquals(PlannedTransfer.Reason.SIZE_CHANGED, resized.reason());
        assertEquals(TransferDirection.UPLOAD, resized.direction());
        assertEquals("/share/docs/resized.txt", resized.remotePath());
        assertEquals(localRoot.resolve("docs/resized.txt"), resized.localPath());
        assertEquals(PlannedTransfer.Reason.MISSING, plan.uploads().get(1).reason());
        assertEquals(PlannedTransfer.Reason.NEWER, plan.uploads().get(2).reason());
        assertEquals(20 + 5 + 8, plan.getTotalBytes());
    }

    @Test
    void testDownloadIgnoresLocalOnlyFiles() throws Exception {
        local("local-only.txt", 4, BASE);
        remote("photos/a.jpg", 100, BASE);
        remote("photos/2024/b.jpg", 200, BASE);

        SyncPlan plan = plan(SyncDirection.DOWNLOAD);

        assertEquals(List.of("photos/2024/b.jpg", "photos/a.jpg"), paths(plan.downloads()));
        assertTrue(plan.uploads().isEmpty());
        assertEquals(0, plan.unchanged());
    }

    @Test
    void testBidirectionalNewerCopyWins() throws Exception {
        local("edited-locally.txt", 10, BASE.plusSeconds(300));
        remote("edited-locally.txt", 12, BASE);
        local("edited-remotely.txt", 10, BASE);
        remote("edited-remotely.txt", 12, BASE.plusSeconds(300));
        local("only-local.txt", 1, BASE);
        remote("only-remote.txt", 1, BASE);

        SyncPlan plan = plan(SyncDirection.BIDIRECTIONAL);

        assertEquals(List.of("edited-locally.txt", "only-local.txt"), paths(plan.uploads()));
        assertEquals(List.of("edited-remotely.txt", "only-remote.txt"), paths(plan.downloads()));
        assertTrue(plan.conflicts().isEmpty());
    }

    @Test
    void testBidirectionalSizeDifferenceWithinToleranceIsConflict() throws Exception {
        local("both.txt", 10, BASE);
        remote("both.txt", 11, BASE.plusSeconds(1));

        SyncPlan plan = plan(SyncDirection.BIDIRECTIONAL);

        assertTrue(plan.isEmpty());
        assertEquals(List.of("both.txt"), plan.conflicts());
    }

    @Test
    void testTimestampsWithinToleranceAreUnchanged() throws Exception {
        local("a.txt", 10, BASE);
        remote("a.txt", 10, BASE.plusSeconds(2));

        assertTrue(plan(SyncDirection.UPLOAD).isEmpty());
        assertTrue(plan(SyncDirection.DOWNLOAD).isEmpty());
        assertEquals(1, plan(SyncDirection.BIDIRECTIONAL).unchanged());
    }

    @Test
    void testMissingLocalRootPlansFullDownload() throws Exception {
        remote("a.txt", 1, BASE);

        SyncPlan plan = planner.plan("drive-1", SyncDirection.DOWNLOAD, localRoot.resolve("not-there"), "/share",
                this::list);

        assertEquals(1, plan.downloads().size());
        assertEquals(localRoot.resolve("not-there/a.txt"), plan.downloads().get(0).localPath());
    }

    @Test
    void testPlanHasNoItemsUntilEnqueued() throws Exception {
        local("a.txt", 1, BASE);

        SyncPlan plan = plan(SyncDirection.UPLOAD);

        assertTrue(plan.itemIds().isEmpty());
        assertTrue(plan.alreadyQueued().isEmpty());
        assertEquals("drive-1", plan.driveId());
        assertEquals(1, plan.getTransferCount());
        assertEquals(NOW, plan.plannedAt(), "Planning time comes from the injected clock");
    }
}
