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

import com.hierynomus.msdtyp.AccessMask;
import com.hierynomus.mserref.NtStatus;
import com.hierynomus.msfscc.FileAttributes;
import com.hierynomus.msfscc.fileinformation.FileIdBothDirectoryInformation;
import com.hierynomus.mssmb2.SMB2CreateDisposition;
import com.hierynomus.mssmb2.SMB2ShareAccess;
import com.hierynomus.mssmb2.SMBApiException;
import com.hierynomus.smbj.SMBClient;
import com.hierynomus.smbj.SmbConfig;
import com.hierynomus.smbj.auth.AuthenticationContext;
import com.hierynomus.smbj.common.SMBRuntimeException;
import com.hierynomus.smbj.connection.Connection;
import com.hierynomus.smbj.session.Session;
import com.hierynomus.smbj.share.DiskShare;
import com.hierynomus.smbj.share.File;
import com.hierynomus.smbj.share.Share;
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
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * SMB2/3 connector on smbj.
 * <p>
 * The first segment of the drive's remote root names the share; remote paths
 * passed to the connector are {@code /share/dir/file}. Empty credentials fall
 * back to guest authentication. The optional connection option {@code smb.domain}
 * sets the authentication domain.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class SmbConnector extends AbstractConnector<SmbConnector.SmbSession> {

    private static final Logger logger = LoggerFactory.getLogger(SmbConnector.class);

    static final String OPTION_DOMAIN = "smb.domain";

    public SmbConnector(ConnectorSettings settings) {
        super(SmbSession.class, settings);
    }

    @Override
    public List<Protocol> getProtocols() {
        return List.of(Protocol.SMB);
    }

    @Override
    public ConnectorSession connect(ConnectionConfig config) throws ConnectorException {
        String shareName = shareName(config.getRemoteRoot());
        if (shareName.isEmpty()) {
            throw new ConnectorException(ErrorKind.PROTOCOL, "SMB remote root must start with a share name: " + config.getRemoteRoot());
        }
        long timeoutMs = config.getTimeout().toMillis();
        SMBClient client = new SMBClient(SmbConfig.builder()
                .withTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .withSoTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .build());
        Connection connection = null;
        try {
            logger.debug("Connecting to {}", config.endpointKey());
            connection = client.connect(config.getHost(), config.getPort());
            Session session = connection.authenticate(authContext(config));
            Share share = session.connectShare(shareName);
            if (!(share instanceof DiskShare diskShare)) {
                share.close();
                throw new ConnectorException(ErrorKind.PROTOCOL, "Share " + shareName + " is not a disk share");
            }
            logger.info("SMB session established: {} share={}", config.endpointKey(), shareName);
            return new SmbSession(newSessionId(), config, client, connection, session, diskShare, shareName);
        } catch (IOException | SMBRuntimeException e) {
            closeQuietly(connection, client);
            throw mapFailure("Connect to " + config.endpointKey(), e);
        } catch (ConnectorException e) {
            closeQuietly(connection, client);
            throw e;
        }
    }

    @Override
    public List<RemoteEntry> listEntries(ConnectorSession session, String remotePath) throws ConnectorException {
        SmbSession smb = session(session);
        String dir = RemotePaths.normalize(remotePath);
        try {
            List<RemoteEntry> entries = new ArrayList<>();
            for (FileIdBothDirectoryInformation info : smb.share.list(smb.sharePath(dir))) {
                String name = info.getFileName();
                if (".".equals(name) || "..".equals(name)) {
                    continue;
                }
                boolean directory = (info.getFileAttributes() & FileAttributes.FILE_ATTRIBUTE_DIRECTORY.getValue()) != 0;
                Instant modified = Instant.ofEpochMilli(info.getLastWriteTime().toEpochMillis());
                entries.add(directory
                        ? RemoteEntry.directory(dir, name, modified)
                        : RemoteEntry.file(dir, name, info.getEndOfFile(), modified));
            }
            return entries;
        } catch (SMBRuntimeException e) {
            throw mapFailure("List " + dir, e);
        }
    }

    @Override
    public void upload(ConnectorSession session, Path localPath, String remotePath,
                       ProgressListener listener, CancellationToken cancellation) throws ConnectorException {
        SmbSession smb = session(session);
        String target = RemotePaths.normalize(remotePath);
        long size = localSize(localPath);
        try {
            makeDirectories(smb, RemotePaths.parent(target));
            try (File remote = smb.share.openFile(smb.sharePath(target), EnumSet.of(AccessMask.GENERIC_WRITE),
                    EnumSet.of(FileAttributes.FILE_ATTRIBUTE_NORMAL), SMB2ShareAccess.ALL,
                    SMB2CreateDisposition.FILE_OVERWRITE_IF, null);
                 InputStream in = openLocalInput(localPath);
                 OutputStream out = remote.getOutputStream()) {
                StreamCopier.copy(in, out, size, true, settings, listener, cancellation, "Upload of " + target);
            }
        } catch (IOException | SMBRuntimeException e) {
            throw mapFailure("Upload of " + target, e);
        }
    }

    @Override
    public void download(ConnectorSession session, String remotePath, Path localPath,
                         ProgressListener listener, CancellationToken cancellation) throws ConnectorException {
        SmbSession smb = session(session);
        String source = RemotePaths.normalize(remotePath);
        try (File remote = smb.share.openFile(smb.sharePath(source), EnumSet.of(AccessMask.GENERIC_READ), null,
                SMB2ShareAccess.ALL, SMB2CreateDisposition.FILE_OPEN, null);
             InputStream in = remote.getInputStream();
             OutputStream out = openLocalOutput(localPath)) {
            long size = remote.getFileInformation().getStandardInformation().getEndOfFile();
            StreamCopier.copy(in, out, size, false, settings, listener, cancellation, "Download of " + source);
        } catch (IOException | SMBRuntimeException e) {
            throw mapFailure("Download of " + source, e);
        }
    }

    @Override
    public void disconnect(ConnectorSession session) {
        if (session instanceof SmbSession smb) {
            smb.close();
        }
    }

    private void makeDirectories(SmbSession smb, String dir) {
        String inShare = smb.sharePath(dir);
        if (inShare.isEmpty()) {
            return;
        }
        StringBuilder current = new StringBuilder();
        for (String segment : inShare.split("\\\\")) {
            if (current.length() > 0) {
                current.append('\\');
            }
            current.append(segment);
            if (!smb.share.folderExists(current.toString())) {
                smb.share.mkdir(current.toString());
            }
        }
    }

    private static AuthenticationContext authContext(ConnectionConfig config) {
        String user = config.getUsername() == null ? "" : config.getUsername();
        String password = config.getPassword() == null ? "" : config.getPassword();
        if ((user.isEmpty() || "anonymous".equals(user)) && password.isEmpty()) {
            return AuthenticationContext.guest();
        }
        return new AuthenticationContext(user, password.toCharArray(), config.getOption(OPTION_DOMAIN, ""));
    }

    static ConnectorException mapFailure(String operation, Exception e) {
        ErrorKind kind;
        if (e instanceof SMBApiException api) {
            NtStatus status = api.getStatus();
            kind = status == NtStatus.STATUS_LOGON_FAILURE || status == NtStatus.STATUS_ACCESS_DENIED
                    ? ErrorKind.AUTHENTICATION : ErrorKind.PROTOCOL;
        } else {
            kind = ConnectorErrors.classify(e, e instanceof IOException ? ErrorKind.CONNECTION : ErrorKind.PROTOCOL);
        }
        return new ConnectorException(kind, operation + " failed: " + e.getMessage(), e);
    }

    static String shareName(String remoteRoot) {
        String root = RemotePaths.normalize(remoteRoot);
        int slash = root.indexOf('/', 1);
        return slash < 0 ? root.substring(1) : root.substring(1, slash);
    }

    private static void closeQuietly(Connection connection, SMBClient client) {
        try {
            if (connection != null) {
                connection.close();
            }
        } catch (IOException e) {
            logger.debug("SMB connection close failed: {}", e.getMessage());
        } finally {
            client.close();
        }
    }

    /**
     * Session bound to one authenticated SMB session and disk share.
     */
    public static final class SmbSession implements ConnectorSession {
        private final String id;
        private final ConnectionConfig config;
        private final SMBClient client;
        private final Connection connection;
        private final Session session;
        private final DiskShare share;
        private final String shareName;

        SmbSession(String id, ConnectionConfig config, SMBClient client, Connection connection,
                   Session session, DiskShare share, String shareName) {
            this.id = id;
            this.config = config;
            this.client = client;
            this.connection = connection;
            this.session = session;
            this.share = share;
            this.shareName = shareName;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public ConnectionConfig getConfig() {
            return config;
        }

        @Override
        public boolean isAlive() {
            return connection.isConnected() && share.isConnected();
        }

        /**
         * Convert {@code /share/a/b} into the share-relative {@code a\b}.
         */
        String sharePath(String remotePath) {
            String path = RemotePaths.normalize(remotePath);
            String prefix = "/" + shareName;
            if (path.equals(prefix) || "/".equals(path)) {
                return "";
            }
            if (path.startsWith(prefix + "/")) {
                path = path.substring(prefix.length() + 1);
            } else {
                path = path.substring(1);
            }
            return path.replace('/', '\\');
        }

        void close() {
            try {
                share.close();
                session.close();
            } catch (IOException e) {
                logger.debug("SMB session {} close failed: {}", id, e.getMessage());
            } finally {
                closeQuietly(connection, client);
            }
        }
    }
}
