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

import com.jcraft.jsch.ChannelSftp;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.jcraft.jsch.SftpATTRS;
import com.jcraft.jsch.SftpException;
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
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.Vector;

/**
 * SFTP connector on JSch.
 * <p>
 * Password authentication. Host key checking follows the connection option
 * {@code sftp.strictHostKeyChecking} (default {@code no}); set it to {@code yes}
 * together with {@code sftp.knownHosts} to pin server keys.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class SftpConnector extends AbstractConnector<SftpConnector.SftpSession> {

    private static final Logger logger = LoggerFactory.getLogger(SftpConnector.class);

    static final String OPTION_STRICT_HOST_KEY = "sftp.strictHostKeyChecking";
    static final String OPTION_KNOWN_HOSTS = "sftp.knownHosts";

    public SftpConnector(ConnectorSettings settings) {
        super(SftpSession.class, settings);
    }

    @Override
    public List<Protocol> getProtocols() {
        return List.of(Protocol.SFTP);
    }

    @Override
    public ConnectorSession connect(ConnectionConfig config) throws ConnectorException {
        JSch jsch = new JSch();
        int timeoutMs = (int) config.getTimeout().toMillis();
        Session session = null;
        try {
            String knownHosts = config.getOption(OPTION_KNOWN_HOSTS, null);
            if (knownHosts != null) {
                jsch.setKnownHosts(knownHosts);
            }
            session = jsch.getSession(config.getUsername(), config.getHost(), config.getPort());
            session.setPassword(config.getPassword());
            Properties sshConfig = new Properties();
            sshConfig.put("StrictHostKeyChecking", config.getOption(OPTION_STRICT_HOST_KEY, "no"));
            sshConfig.put("PreferredAuthentications", "password,keyboard-interactive");
            session.setConfig(sshConfig);
            session.setTimeout(timeoutMs);

            logger.debug("Connecting to {}", config.endpointKey());
            session.connect(timeoutMs);
            ChannelSftp channel = (ChannelSftp) session.openChannel("sftp");
            channel.connect(timeoutMs);
            logger.info("SFTP session established: {}", config.endpointKey());
            return new SftpSession(newSessionId(), config, session, channel);
        } catch (JSchException e) {
            if (session != null) {
                session.disconnect();
            }
            throw mapJschFailure(config, e);
        }
    }

    @Override
    public List<RemoteEntry> listEntries(ConnectorSession session, String remotePath) throws ConnectorException {
        ChannelSftp channel = session(session).channel;
        String dir = RemotePaths.normalize(remotePath);
        try {
            Vector<ChannelSftp.LsEntry> listing = channel.ls(dir);
            List<RemoteEntry> entries = new ArrayList<>(listing.size());
            for (ChannelSftp.LsEntry entry : listing) {
                String name = entry.getFilename();
                if (".".equals(name) || "..".equals(name)) {
                    continue;
                }
                SftpATTRS attrs = entry.getAttrs();
                Instant modified = Instant.ofEpochSecond(Integer.toUnsignedLong(attrs.getMTime()));
                entries.add(attrs.isDir()
                        ? RemoteEntry.directory(dir, name, modified)
                        : RemoteEntry.file(dir, name, attrs.getSize(), modified));
            }
            return entries;
        } catch (SftpException e) {
            throw mapSftpFailure("ls " + dir, e);
        }
    }

    @Override
    public void upload(ConnectorSession session, Path localPath, String remotePath,
                       ProgressListener listener, CancellationToken cancellation) throws ConnectorException {
        ChannelSftp channel = session(session).channel;
        String target = RemotePaths.normalize(remotePath);
        long size = localSize(localPath);
        makeDirectories(channel, RemotePaths.parent(target));

        try (InputStream in = openLocalInput(localPath);
             OutputStream out = channel.put(target, ChannelSftp.OVERWRITE)) {
            StreamCopier.copy(in, out, size, true, settings, listener, cancellation, "Upload of " + target);
        } catch (SftpException e) {
            throw mapSftpFailure("put " + target, e);
        } catch (IOException e) {
            throw ConnectorErrors.remote("Upload of " + target + " failed", e);
        }
    }

    @Override
    public void download(ConnectorSession session, String remotePath, Path localPath,
                         ProgressListener listener, CancellationToken cancellation) throws ConnectorException {
        ChannelSftp channel = session(session).channel;
        String source = RemotePaths.normalize(remotePath);
        try {
            long size = channel.stat(source).getSize();
            try (InputStream in = channel.get(source);
                 OutputStream out = openLocalOutput(localPath)) {
                StreamCopier.copy(in, out, size, false, settings, listener, cancellation, "Download of " + source);
            }
        } catch (SftpException e) {
            throw mapSftpFailure("get " + source, e);
        } catch (IOException e) {
            throw ConnectorErrors.remote("Download of " + source + " failed", e);
        }
    }

    @Override
    public void disconnect(ConnectorSession session) {
        if (session instanceof SftpSession sftp) {
            sftp.close();
        }
    }

    private void makeDirectories(ChannelSftp channel, String dir) throws ConnectorException {
        if ("/".equals(dir)) {
            return;
        }
        StringBuilder current = new StringBuilder();
        for (String segment : dir.substring(1).split("/")) {
            current.append('/').append(segment);
            String path = current.toString();
            try {
                channel.stat(path);
            } catch (SftpException missing) {
                if (missing.id != ChannelSftp.SSH_FX_NO_SUCH_FILE) {
                    throw mapSftpFailure("stat " + path, missing);
                }
                try {
                    channel.mkdir(path);
                } catch (SftpException e) {
                    throw mapSftpFailure("mkdir " + path, e);
                }
            }
        }
    }

    static ConnectorException mapJschFailure(ConnectionConfig config, JSchException e) {
        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        ErrorKind kind;
        if (message.startsWith("auth")) {
            kind = ErrorKind.AUTHENTICATION;
        } else if (message.contains("timeout") || message.contains("timed out")) {
            kind = ErrorKind.TIMEOUT;
        } else {
            kind = ConnectorErrors.classify(e.getCause(), ErrorKind.PROTOCOL);
        }
        return new ConnectorException(kind, "SSH connection to " + config.endpointKey() + " failed: " + e.getMessage(), e);
    }

    private static ConnectorException mapSftpFailure(String operation, SftpException e) {
        ErrorKind kind = switch (e.id) {
            case ChannelSftp.SSH_FX_PERMISSION_DENIED -> ErrorKind.AUTHENTICATION;
            case ChannelSftp.SSH_FX_CONNECTION_LOST, ChannelSftp.SSH_FX_NO_CONNECTION -> ErrorKind.CONNECTION;
            default -> ConnectorErrors.classify(e.getCause(), ErrorKind.PROTOCOL);
        };
        return new ConnectorException(kind, operation + " failed: " + e.getMessage(), e);
    }

    /**
     * Session wrapping one SSH session and its SFTP channel.
     */
    public static final class SftpSession implements ConnectorSession {
        private final String id;
        private final ConnectionConfig config;
        private final Session session;
        private final ChannelSftp channel;

        SftpSession(String id, ConnectionConfig config, Session session, ChannelSftp channel) {
            this.id = id;
            this.config = config;
            this.session = session;
            this.channel = channel;
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
            return session.isConnected() && channel.isConnected() && !channel.isClosed();
        }

        void close() {
            channel.disconnect();
            session.disconnect();
        }
    }
}
