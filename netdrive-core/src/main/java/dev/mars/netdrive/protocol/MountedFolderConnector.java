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
import dev.mars.netdrive.core.ErrorKind;
import dev.mars.netdrive.core.Protocol;
import dev.mars.netdrive.core.RemoteEntry;
import dev.mars.netdrive.core.RemotePaths;
import dev.mars.netdrive.core.exceptions.ConnectorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Connector for storage that the operating system has already mounted: NFS
 * exports and cloud provider sync folders.
 * <p>
 * The folder backing a drive is the connection option {@code mount.path} when
 * set; otherwise it follows the convention {@code {mountRoot}/{host}}. Remote
 * paths are resolved below that folder.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class MountedFolderConnector extends AbstractConnector<MountedFolderConnector.FolderSession> {

    private static final Logger logger = LoggerFactory.getLogger(MountedFolderConnector.class);

    public static final String OPTION_MOUNT_PATH = "mount.path";

    private final Path mountRoot;

    public MountedFolderConnector(Path mountRoot, ConnectorSettings settings) {
        super(FolderSession.class, settings);
        this.mountRoot = mountRoot;
        logger.debug("MountedFolderConnector initialized with mountRoot={}", mountRoot);
    }

    @Override
    public List<Protocol> getProtocols() {
        return List.of(Protocol.NFS, Protocol.CLOUD);
    }

    public Path getMountRoot() {
        return mountRoot;
    }

    @Override
    public ConnectorSession connect(ConnectionConfig config) throws ConnectorException {
        Path base = baseFolder(config);
        Path root = resolve(base, config.getRemoteRoot());
        if (!Files.isDirectory(base)) {
            throw new ConnectorException(ErrorKind.CONNECTION, "Mount point " + base + " is not available");
        }
        if (!Files.isDirectory(root)) {
            throw new ConnectorException(ErrorKind.PROTOCOL, "Remote root " + config.getRemoteRoot() + " not found under " + base);
        }
        if (!Files.isReadable(root)) {
            throw new ConnectorException(ErrorKind.AUTHENTICATION, "No read permission on " + root);
        }
        logger.info("Mounted folder session: {} -> {}", config.endpointKey(), base);
        return new FolderSession(newSessionId(), config, base);
    }

    @Override
    public List<RemoteEntry> listEntries(ConnectorSession session, String remotePath) throws ConnectorException {
        FolderSession folder = session(session);
        String dir = RemotePaths.normalize(remotePath);
        Path path = resolve(folder.base, dir);
        List<RemoteEntry> entries = new ArrayList<>();
        try (Stream<Path> children = Files.list(path)) {
            for (Path child : (Iterable<Path>) children::iterator) {
                BasicFileAttributes attrs = Files.readAttributes(child, BasicFileAttributes.class);
                String name = child.getFileName().toString();
                entries.add(attrs.isDirectory()
                        ? RemoteEntry.directory(dir, name, attrs.lastModifiedTime().toInstant())
                        : RemoteEntry.file(dir, name, attrs.size(), attrs.lastModifiedTime().toInstant()));
            }
        } catch (NoSuchFileException e) {
            throw new ConnectorException(ErrorKind.PROTOCOL, "No such directory: " + dir, e);
        } catch (IOException e) {
            throw folderFailure(folder, "List " + dir, e);
        }
        return entries;
    }

    @Override
    public void upload(ConnectorSession session, Path localPath, String remotePath,
                       ProgressListener listener, CancellationToken cancellation) throws ConnectorException {
        FolderSession folder = session(session);
        String target = RemotePaths.normalize(remotePath);
        Path destination = resolve(folder.base, target);
        long size = localSize(localPath);
        try {
            Files.createDirectories(destination.getParent());
        } catch (IOException e) {
            throw folderFailure(folder, "Create " + RemotePaths.parent(target), e);
        }
        try (InputStream in = openLocalInput(localPath);
             OutputStream out = Files.newOutputStream(destination, StandardOpenOption.CREATE,
                     StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            StreamCopier.copy(in, out, size, true, settings, listener, cancellation, "Upload of " + target);
        } catch (IOException e) {
            throw folderFailure(folder, "Upload of " + target, e);
        }
    }

    @Override
    public void download(ConnectorSession session, String remotePath, Path localPath,
                         ProgressListener listener, CancellationToken cancellation) throws ConnectorException {
        FolderSession folder = session(session);
        String source = RemotePaths.normalize(remotePath);
        Path origin = resolve(folder.base, source);
        if (!Files.isRegularFile(origin)) {
            throw new ConnectorException(ErrorKind.PROTOCOL, "No such file: " + source);
        }
        long size;
        try {
            size = Files.size(origin);
        } catch (IOException e) {
            throw folderFailure(folder, "Stat " + source, e);
        }
        try (InputStream in = Files.newInputStream(origin);
             OutputStream out = openLocalOutput(localPath)) {
            StreamCopier.copy(in, out, size, false, settings, listener, cancellation, "Download of " + source);
        } catch (IOException e) {
            throw folderFailure(folder, "Download of " + source, e);
        }
    }

    @Override
    public void disconnect(ConnectorSession session) {
        if (session instanceof FolderSession folder) {
            folder.closed = true;
        }
    }

    Path baseFolder(ConnectionConfig config) {
        String explicit = config.getOption(OPTION_MOUNT_PATH, null);
        if (explicit != null && !explicit.isBlank()) {
            return Paths.get(explicit);
        }
        return mountRoot.resolve(config.getHost());
    }

    /**
     * Resolve a remote path below the base folder, refusing paths that escape it.
     */
    static Path resolve(Path base, String remotePath) throws ConnectorException {
        String relative = RemotePaths.normalize(remotePath).substring(1);
        Path resolved = relative.isEmpty() ? base : base.resolve(relative).normalize();
        if (!resolved.startsWith(base.normalize())) {
            throw new ConnectorException(ErrorKind.PROTOCOL, "Path escapes the mount point: " + remotePath);
        }
        return resolved;
    }

    /**
     * A vanished mount point means the export went away; anything else is a protocol-level failure.
     */
    private static ConnectorException folderFailure(FolderSession folder, String operation, IOException e) {
        ErrorKind kind = Files.isDirectory(folder.base) ? ErrorKind.PROTOCOL : ErrorKind.CONNECTION;
        return new ConnectorException(kind, operation + " failed: " + e.getMessage(), e);
    }

    /**
     * Session over a mounted directory.
     */
    public static final class FolderSession implements ConnectorSession {
        private final String id;
        private final ConnectionConfig config;
        private final Path base;
        private volatile boolean closed;

        FolderSession(String id, ConnectionConfig config, Path base) {
            this.id = id;
            this.config = config;
            this.base = base;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public ConnectionConfig getConfig() {
            return config;
        }

        public Path getBase() {
            return base;
        }

        @Override
        public boolean isAlive() {
            return !closed && Files.isDirectory(base);
        }
    }
}
