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

import dev.mars.netdrive.core.RemoteEntry;
import dev.mars.netdrive.core.RemotePaths;
import dev.mars.netdrive.core.TransferDirection;
import dev.mars.netdrive.core.exceptions.ConnectorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Compares a local directory tree with a remote one and decides what to transfer.
 *
 * <p>Files are matched by relative path. A file is considered changed when its
 * size differs or its modification time differs by more than the tolerance
 * (file systems and servers round timestamps differently). In one-way modes the
 * source side wins whenever the files differ; in bidirectional mode the newer
 * copy wins and files that differ in size with timestamps inside the tolerance
 * are reported as conflicts.</p>
 */
public class SyncPlanner {

    private static final Logger logger = LoggerFactory.getLogger(SyncPlanner.class);

    /**
     * Directory listing against the remote side.
     */
    @FunctionalInterface
    public interface RemoteLister {
        List<RemoteEntry> list(String remotePath) throws ConnectorException;
    }

    private final Duration tolerance;
    private final Clock clock;

    public SyncPlanner(Duration tolerance, Clock clock) {
        this.tolerance = tolerance;
        this.clock = clock;
    }

    public SyncPlan plan(String driveId, SyncDirection direction, Path localRoot, String remoteRoot,
                         RemoteLister lister) throws ConnectorException, IOException {
        Map<String, FileState> local = scanLocal(localRoot);
        Map<String, FileState> remote = scanRemote(remoteRoot, lister);

        List<PlannedTransfer> uploads = new ArrayList<>();
        List<PlannedTransfer> downloads = new ArrayList<>();
        List<String> conflicts = new ArrayList<>();
        int unchanged = 0;

        Set<String> paths = new TreeSet<>(local.keySet());
        paths.addAll(remote.keySet());
        for (String rel : paths) {
            FileState l = local.get(rel);
            FileState r = remote.get(rel);
            Path localPath = localRoot.resolve(rel);
            String remotePath = RemotePaths.join(remoteRoot, rel);

            switch (direction) {
                case UPLOAD -> {
                    PlannedTransfer.Reason reason = oneWayReason(l, r);
                    if (reason != null) {
                        uploads.add(new PlannedTransfer(TransferDirection.UPLOAD, rel, localPath, remotePath, l.size(), reason));
                    } else if (l != null) {
                        unchanged++;
                    }
                }
                case DOWNLOAD -> {
                    PlannedTransfer.Reason reason = oneWayReason(r, l);
                    if (reason != null) {
                        downloads.add(new PlannedTransfer(TransferDirection.DOWNLOAD, rel, localPath, remotePath, r.size(), reason));
                    } else if (r != null) {
                        unchanged++;
                    }
                }
                case BIDIRECTIONAL -> {
                    if (r == null) {
                        uploads.add(new PlannedTransfer(TransferDirection.UPLOAD, rel, localPath, remotePath, l.size(),
                                PlannedTransfer.Reason.MISSING));
                    } else if (l == null) {
                        downloads.add(new PlannedTransfer(TransferDirection.DOWNLOAD, rel, localPath, remotePath, r.size(),
                                PlannedTransfer.Reason.MISSING));
                    } else if (isNewer(l, r)) {
                        uploads.add(new PlannedTransfer(TransferDirection.UPLOAD, rel, localPath, remotePath, l.size(),
                                PlannedTransfer.Reason.NEWER));
                    } else if (isNewer(r, l)) {
                        downloads.add(new PlannedTransfer(TransferDirection.DOWNLOAD, rel, localPath, remotePath, r.size(),
                                PlannedTransfer.Reason.NEWER));
                    } else if (l.size() != r.size()) {
                        conflicts.add(rel);
                    } else {
                        unchanged++;
                    }
                }
            }
        }
        logger.info("Sync plan for drive {} ({}): {} uploads, {} downloads, {} unchanged, {} conflicts",
                driveId, direction, uploads.size(), downloads.size(), unchanged, conflicts.size());
        return new SyncPlan(driveId, direction, uploads, downloads, unchanged, conflicts, List.of(), List.of(), clock.instant());
    }

    /**
     * Reason to copy {@code source} over {@code target} in a one-way sync, or null if nothing to do.
     */
    private PlannedTransfer.Reason oneWayReason(FileState source, FileState target) {
        if (source == null) {
            return null;
        }
        if (target == null) {
            return PlannedTransfer.Reason.MISSING;
        }
        if (source.size() != target.size()) {
            return PlannedTransfer.Reason.SIZE_CHANGED;
        }
        return isNewer(source, target) ? PlannedTransfer.Reason.NEWER : null;
    }

    private boolean isNewer(FileState a, FileState b) {
        if (a.modifiedAt() == null || b.modifiedAt() == null) {
            return false;
        }
        return Duration.between(b.modifiedAt(), a.modifiedAt()).compareTo(tolerance) > 0;
    }

    static Map<String, FileState> scanLocal(Path root) throws IOException {
        Map<String, FileState> files = new TreeMap<>();
        if (!Files.isDirectory(root)) {
            return files;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : (Iterable<Path>) walk::iterator) {
                BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
                if (attrs.isRegularFile()) {
                    String rel = root.relativize(path).toString().replace('\\', '/');
                    files.put(rel, new FileState(attrs.size(), attrs.lastModifiedTime().toInstant()));
                }
            }
        }
        return files;
    }

    static Map<String, FileState> scanRemote(String root, RemoteLister lister) throws ConnectorException {
        Map<String, FileState> files = new TreeMap<>();
        Deque<String> pending = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        pending.push(RemotePaths.normalize(root));
        while (!pending.isEmpty()) {
            String dir = pending.pop();
            if (!visited.add(dir)) {
                continue;
            }
            for (RemoteEntry entry : lister.list(dir)) {
                String path = RemotePaths.normalize(entry.path());
                if (!RemotePaths.isBelow(root, path) || path.equals(RemotePaths.normalize(root))) {
                    continue;
                }
                if (entry.directory()) {
                    pending.push(path);
                } else {
                    files.put(RemotePaths.relativize(root, path), new FileState(entry.size(), entry.modifiedAt()));
                }
            }
        }
        return files;
    }

    record FileState(long size, Instant modifiedAt) {
    }
}
