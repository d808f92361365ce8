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
import org.apache.commons.net.ftp.FTP;
import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPFile;
import org.apache.commons.net.ftp.FTPReply;
import org.apache.commons.net.ftp.FTPSClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * FTP and FTPS connector on Apache commons-net.
 * <p>
 * Sessions run in passive mode with binary transfer type. FTPS uses explicit TLS
 * ({@code AUTH TLS} on the control port) and protects the data channel with
 * {@code PROT P}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class FtpConnector extends AbstractConnector<FtpConnector.FtpSession> {

    private static final Logger logger = LoggerFactory.getLogger(FtpConnector.class);

    public FtpConnector(ConnectorSettings settings) {
        super(FtpSession.class, settings);
    }

    @Override
    public List<Protocol> getProtocols() {
        return List.of(Protocol.FTP, Protocol.FTPS);
    }

    @Override
    public ConnectorSession connect(ConnectionConfig config) throws ConnectorException {
        FTPClient client = config.getProtocol() == Protocol.FTPS ? new FTPSClient(false) : new FTPClient();
        int timeoutMs = (int) config.getTimeout().toMillis();
        client.setConnectTimeout(timeoutMs);
        client.setDefaultTimeout(timeoutMs);
        client.setDataTimeout(Duration.ofMillis(timeoutMs));

        logger.debug("Connecting to {}", config.endpointKey());
        try {
            client.connect(config.getHost(), config.getPort());
            if (!FTPReply.isPositiveCompletion(client.getReplyCode())) {
                String reply = client.getReplyString();
                closeQuietly(client);
                throw new ConnectorException(ErrorKind.PROTOCOL, "Server refused connection: " + trim(reply));
            }
            client.setSoTimeout(timeoutMs);
            if (!client.login(config.getUsername(), config.getPassword())) {
                String reply = client.getReplyString();
                closeQuietly(client);
                throw new ConnectorException(ErrorKind.AUTHENTICATION,
                        "Login rejected for user " + config.getUsername() + ": " + trim(reply));
            }
            if (client instanceof FTPSClient ftps) {
                ftps.execPBSZ(0);
                ftps.execPROT("P");
            }
            client.enterLocalPassiveMode();
            client.setFileType(FTP.BINARY_FILE_TYPE);
        } catch (IOException e) {
            closeQuietly(client);
            throw ConnectorErrors.remote("Cannot connect to " + config.endpointKey(), e);
        }
        logger.info("FTP session established: {}", config.endpointKey());
        return new FtpSession(newSessionId(), config, client);
    }

    @Override
    public List<RemoteEntry> listEntries(ConnectorSession session, String remotePath) throws ConnectorException {
        FTPClient client = session(session).client;
        String dir = RemotePaths.normalize(remotePath);
        try {
            FTPFile[] files = client.listFiles(dir);
            if (!FTPReply.isPositiveCompletion(client.getReplyCode())) {
                throw new ConnectorException(ErrorKind.PROTOCOL, "LIST " + dir + " failed: " + trim(client.getReplyString()));
            }
            List<RemoteEntry> entries = new ArrayList<>(files.length);
            for (FTPFile file : files) {
                if (file == null || ".".equals(file.getName()) || "..".equals(file.getName())) {
                    continue;
                }
                Instant modified = file.getTimestamp() != null ? file.getTimestamp().toInstant() : null;
                entries.add(file.isDirectory()
                        ? RemoteEntry.directory(dir, file.getName(), modified)
                        : RemoteEntry.file(dir, file.getName(), file.getSize(), modified));
            }
            return entries;
        } catch (IOException e) {
            throw ConnectorErrors.remote("LIST " + dir + " failed", e);
        }
    }

    @Override
    public void upload(ConnectorSession session, Path localPath, String remotePath,
                       ProgressListener listener, CancellationToken cancellation) throws ConnectorException {
        FTPClient client = session(session).client;
        String target = RemotePaths.normalize(remotePath);
        long size = localSize(localPath);
        makeDirectories(client, RemotePaths.parent(target));

        try (InputStream in = openLocalInput(localPath)) {
            OutputStream out = client.storeFileStream(target);
            if (out == null) {
                throw new ConnectorException(ErrorKind.PROTOCOL, "STOR " + target + " refused: " + trim(client.getReplyString()));
            }
            try {
                StreamCopier.copy(in, out, size, true, settings, listener, cancellation, "Upload of " + target);
            } catch (ConnectorException e) {
                abortQuietly(client, out);
                throw e;
            }
            out.close();
            if (!client.completePendingCommand()) {
                throw new ConnectorException(ErrorKind.PROTOCOL, "STOR " + target + " failed: " + trim(client.getReplyString()));
            }
        } catch (IOException e) {
            throw ConnectorErrors.remote("Upload of " + target + " failed", e);
        }
        logger.debug("Uploaded {} -> {} ({} bytes)", localPath, target, size);
    }

    @Override
    public void download(ConnectorSession session, String remotePath, Path localPath,
                         ProgressListener listener, CancellationToken cancellation) throws ConnectorException {
        FTPClient client = session(session).client;
        String source = RemotePaths.normalize(remotePath);
        long size = remoteSize(client, source);

        try (OutputStream out = openLocalOutput(localPath)) {
            InputStream in = client.retrieveFileStream(source);
            if (in == null) {
                throw new ConnectorException(ErrorKind.PROTOCOL, "RETR " + source + " refused: " + trim(client.getReplyString()));
            }
            try {
                StreamCopier.copy(in, out, size, false, settings, listener, cancellation, "Download of " + source);
            } catch (ConnectorException e) {
                abortQuietly(client, in);
                throw e;
            }
            in.close();
            if (!client.completePendingCommand()) {
                throw new ConnectorException(ErrorKind.PROTOCOL, "RETR " + source + " failed: " + trim(client.getReplyString()));
            }
        } catch (IOException e) {
            throw ConnectorErrors.remote("Download of " + source + " failed", e);
        }
        logger.debug("Downloaded {} -> {} ({} bytes)", source, localPath, size);
    }

    @Override
    public void disconnect(ConnectorSession session) {
        if (session instanceof FtpSession ftp) {
            ftp.close();
        }
    }

    private void makeDirectories(FTPClient client, String dir) throws ConnectorException {
        if ("/".equals(dir)) {
            return;
        }
        StringBuilder current = new StringBuilder();
        try {
            for (String segment : dir.substring(1).split("/")) {
                current.append('/').append(segment);
                // 550 when it already exists; the following STOR reports real failures
                if (!client.makeDirectory(current.toString())) {
                    logger.trace("MKD {} returned {}", current, client.getReplyCode());
                }
            }
        } catch (IOException e) {
            throw ConnectorErrors.remote("Cannot create remote directory " + current, e);
        }
    }

    private long remoteSize(FTPClient client, String path) throws ConnectorException {
        try {
            FTPFile[] match = client.listFiles(path);
            if (match != null && match.length == 1 && match[0] != null && match[0].isFile()) {
                return match[0].getSize();
            }
            return -1;
        } catch (IOException e) {
            throw ConnectorErrors.remote("Cannot stat " + path, e);
        }
    }

    private static void abortQuietly(FTPClient client, Closeable stream) {
        try {
            stream.close();
            client.abort();
        } catch (IOException e) {
            logger.debug("Abort after interrupted transfer failed: {}", e.getMessage());
        }
    }

    private static void closeQuietly(FTPClient client) {
        if (client.isConnected()) {
            try {
                client.disconnect();
            } catch (IOException e) {
                logger.debug("FTP disconnect failed: {}", e.getMessage());
            }
        }
    }

    private static String trim(String reply) {
        return reply == null ? "" : reply.trim();
    }

    /**
     * Session wrapping one logged-in commons-net client.
     */
    public static final class FtpSession implements ConnectorSession {
        private final String id;
        private final ConnectionConfig config;
        private final FTPClient client;
        private volatile boolean closed;

        FtpSession(String id, ConnectionConfig config, FTPClient client) {
            this.id = id;
            this.config = config;
            this.client = client;
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
            if (closed || !client.isConnected()) {
                return false;
            }
            try {
                return client.sendNoOp();
            } catch (IOException e) {
                logger.debug("NOOP on session {} failed: {}", id, e.getMessage());
                return false;
            }
        }

        synchronized void close() {
            if (closed) {
                return;
            }
            closed = true;
            try {
                if (client.isConnected()) {
                    client.logout();
                }
            } catch (IOException e) {
                logger.debug("FTP logout failed on session {}: {}", id, e.getMessage());
            } finally {
                closeQuietly(client);
            }
        }
    }
}
