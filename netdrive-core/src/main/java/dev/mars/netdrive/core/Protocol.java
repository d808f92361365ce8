package dev.mars.netdrive.core;

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


import java.util.Locale;

/**
 * The closed set of storage protocols a virtual drive can be mounted over.
 *
 * <p>NFS and CLOUD are served through a locally mounted folder (an NFS export or a
 * cloud provider's sync directory); the rest speak their wire protocol through a
 * client library.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum Protocol {

    FTP("ftp", 21, false),
    FTPS("ftps", 21, true),
    SFTP("sftp", 22, true),
    WEBDAV("http", 80, false),
    WEBDAVS("https", 443, true),
    SMB("smb", 445, false),
    NFS("nfs", 2049, false),
    CLOUD("cloud", 0, true);

    private final String scheme;
    private final int defaultPort;
    private final boolean secure;

    Protocol(String scheme, int defaultPort, boolean secure) {
        this.scheme = scheme;
        this.defaultPort = defaultPort;
        this.secure = secure;
    }

    public String getScheme() {
        return scheme;
    }

    /**
     * @return the well-known port, or 0 when the protocol has no network port
     */
    public int getDefaultPort() {
        return defaultPort;
    }

    public boolean isSecure() {
        return secure;
    }

    /**
     * Whether this protocol is served from a local mount point rather than a socket.
     */
    public boolean isMountBased() {
        return this == NFS || this == CLOUD;
    }

    /**
     * Resolve the protocol a discovered service port most likely speaks.
     *
     * @return the protocol, or {@code null} for ports that do not map to a drive protocol
     */
    public static Protocol forServicePort(int port) {
        return switch (port) {
            case 21 -> FTP;
            case 22 -> SFTP;
            case 445 -> SMB;
            case 2049 -> NFS;
            case 80, 8080, 5000 -> WEBDAV;
            case 443, 5001 -> WEBDAVS;
            default -> null;
        };
    }

    public static Protocol fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Protocol must not be blank");
        }
        return Protocol.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
