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
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpClientRequest;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * WebDAV connector on the Vert.x HTTP client.
 * <p>
 * Listing uses {@code PROPFIND} with {@code Depth: 1} and parses the multistatus
 * response. Uploads stream with {@code PUT} after creating parent collections
 * with {@code MKCOL}; downloads stream with {@code GET}. WEBDAVS enables TLS;
 * the connection option {@code webdav.trustAll=true} accepts self-signed
 * certificates on NAS appliances.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WebDavConnector extends AbstractConnector<WebDavConnector.WebDavSession> {

    private static final Logger logger = LoggerFactory.getLogger(WebDavConnector.class);

    static final String OPTION_TRUST_ALL = "webdav.trustAll";
    static final String DAV_NS = "DAV:";

    private static final String PROPFIND_BODY = "<?xml version=\"1.0\" encoding=\"utf-8\"?>"
            + "<d:propfind xmlns:d=\"DAV:\"><d:prop>"
            + "<d:resourcetype/><d:getcontentlength/><d:getlastmodified/>"
            + "</d:prop></d:propfind>";

    private final Vertx vertx;

    public WebDavConnector(Vertx vertx, ConnectorSettings settings) {
        super(WebDavSession.class, settings);
        this.vertx = vertx;
    }

    @Override
    public List<Protocol> getProtocols() {
        return List.of(Protocol.WEBDAV, Protocol.WEBDAVS);
    }

    @Override
    public ConnectorSession connect(ConnectionConfig config) throws ConnectorException {
        boolean tls = config.getProtocol() == Protocol.WEBDAVS;
        boolean trustAll = Boolean.parseBoolean(config.getOption(OPTION_TRUST_ALL, "false"));
        int timeoutMs = (int) config.getTimeout().toMillis();
        HttpClient client = vertx.createHttpClient(new HttpClientOptions()
                .setDefaultHost(config.getHost())
                .setDefaultPort(config.getPort())
                .setSsl(tls)
                .setTrustAll(tls && trustAll)
                .setVerifyHost(!trustAll)
                .setConnectTimeout(timeoutMs));
        WebDavSession session = new WebDavSession(newSessionId(), config, client, authorization(config));

        logger.debug("Connecting to {}", config.endpointKey());
        try {
            DavResponse probe = propfind(session, config.getRemoteRoot(), "0");
            if (probe.status == 401 || probe.status == 403) {
                throw new ConnectorException(ErrorKind.AUTHENTICATION,
                        "Server rejected credentials for " + config.getUsername() + " (HTTP " + probe.status + ")");
            }
            if (probe.status != 207 && probe.status != 200) {
                throw new ConnectorException(ErrorKind.PROTOCOL,
                        "PROPFIND " + config.getRemoteRoot() + " returned HTTP " + probe.status);
            }
        } catch (ConnectorException e) {
            session.close();
            throw e;
        }
        logger.info("WebDAV session established: {}", config.endpointKey());
        return session;
    }

    @Override
    public List<RemoteEntry> listEntries(ConnectorSession session, String remotePath) throws ConnectorException {
        WebDavSession dav = session(session);
        String dir = RemotePaths.normalize(remotePath);
        DavResponse response = propfind(dav, dir, "1");
        checkStatus("PROPFIND " + dir, response.status, 207, 200);
        return parseMultistatus(dir, response.body);
    }

    @Override
    public void upload(ConnectorSession session, Path localPath, String remotePath,
                       ProgressListener listener, CancellationToken cancellation) throws ConnectorException {
        WebDavSession dav = session(session);
        String target = RemotePaths.normalize(remotePath);
        long size = localSize(localPath);
        makeCollections(dav, RemotePaths.parent(target));

        HttpClientRequest request = VertxBlocking.await(
                dav.client.request(dav.options(HttpMethod.PUT, target)), dav.timeoutMs(), "PUT " + target);
        request.putHeader(HttpHeaders.CONTENT_LENGTH, String.valueOf(size));
        Future<HttpClientResponse> response = request.response();
        HttpBodyOutputStream body = new HttpBodyOutputStream(request, dav.timeoutMs());
        try (InputStream in = openLocalInput(localPath)) {
            StreamCopier.copy(in, body, size, true, settings, listener, cancellation, "Upload of " + target);
            body.close();
        } catch (ConnectorException e) {
            body.abort();
            throw e;
        } catch (IOException e) {
            body.abort();
            throw ConnectorErrors.remote("Upload of " + target + " failed", e);
        }
        HttpClientResponse result = VertxBlocking.await(response, dav.timeoutMs(), "PUT " + target);
        checkStatus("PUT " + target, result.statusCode(), 200, 201, 204);
    }

    @Override
    public void download(ConnectorSession session, String remotePath, Path localPath,
                         ProgressListener listener, CancellationToken cancellation) throws ConnectorException {
        WebDavSession dav = session(session);
        String source = RemotePaths.normalize(remotePath);
        long timeoutMs = dav.timeoutMs();
        Future<HttpBodyInputStream> opened = dav.client.request(dav.options(HttpMethod.GET, source))
                .compose(HttpClientRequest::send)
                .map(resp -> new HttpBodyInputStream(resp, Vertx.currentContext(), timeoutMs));
        HttpBodyInputStream in = VertxBlocking.await(opened, timeoutMs, "GET " + source);
        try {
            if (in.statusCode() != 200) {
                throw new ConnectorException(in.statusCode() == 401 ? ErrorKind.AUTHENTICATION : ErrorKind.PROTOCOL,
                        "GET " + source + " returned HTTP " + in.statusCode());
            }
            long size = parseLength(in.header(HttpHeaders.CONTENT_LENGTH.toString()));
            try (OutputStream out = openLocalOutput(localPath)) {
                StreamCopier.copy(in, out, size, false, settings, listener, cancellation, "Download of " + source);
            } catch (IOException e) {
                throw ConnectorErrors.local("Cannot finish writing " + localPath, e);
            }
        } finally {
            in.close();
        }
    }

    @Override
    public void disconnect(ConnectorSession session) {
        if (session instanceof WebDavSession dav) {
            dav.close();
        }
    }

    private DavResponse propfind(WebDavSession dav, String path, String depth) throws ConnectorException {
        RequestOptions options = dav.options(HttpMethod.PROPFIND, path)
                .putHeader("Depth", depth)
                .putHeader(HttpHeaders.CONTENT_TYPE, "application/xml; charset=utf-8");
        Future<DavResponse> result = dav.client.request(options)
                .compose(req -> req.send(Buffer.buffer(PROPFIND_BODY)))
                .compose(resp -> resp.body().map(body -> new DavResponse(resp.statusCode(), body)));
        return VertxBlocking.await(result, dav.timeoutMs(), "PROPFIND " + path);
    }

    private void makeCollections(WebDavSession dav, String dir) throws ConnectorException {
        if ("/".equals(dir)) {
            return;
        }
        StringBuilder current = new StringBuilder();
        for (String segment : dir.substring(1).split("/")) {
            current.append('/').append(segment);
            String path = current.toString();
            Future<Integer> status = dav.client.request(dav.options(HttpMethod.MKCOL, path + "/"))
                    .compose(HttpClientRequest::send)
                    .compose(resp -> resp.body().map(ignored -> resp.statusCode()));
            int code = VertxBlocking.await(status, dav.timeoutMs(), "MKCOL " + path);
            // 405: collection already exists
            if (code != 201 && code != 405 && code != 200) {
                throw new ConnectorException(code == 401 ? ErrorKind.AUTHENTICATION : ErrorKind.PROTOCOL,
                        "MKCOL " + path + " returned HTTP " + code);
            }
        }
    }

    /**
     * Parse a PROPFIND multistatus body into the entries below {@code dir}, skipping the
     * directory's own response.
     */
    static List<RemoteEntry> parseMultistatus(String dir, Buffer body) throws ConnectorException {
        Document doc;
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            doc = builder.parse(new ByteArrayInputStream(body.getBytes()));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new ConnectorException(ErrorKind.PROTOCOL, "Malformed PROPFIND response: " + e.getMessage(), e);
        }

        List<RemoteEntry> entries = new ArrayList<>();
        NodeList responses = doc.getElementsByTagNameNS(DAV_NS, "response");
        for (int i = 0; i < responses.getLength(); i++) {
            Element response = (Element) responses.item(i);
            String href = text(response, "href");
            if (href == null) {
                continue;
            }
            String path;
            try {
                path = RemotePaths.normalize(URI.create(href.trim()).getPath());
            } catch (IllegalArgumentException e) {
                logger.debug("Skipping PROPFIND entry with malformed href '{}'", href);
                continue;
            }
            if (path.equals(dir)) {
                continue;
            }
            boolean collection = response.getElementsByTagNameNS(DAV_NS, "collection").getLength() > 0;
            Instant modified = parseHttpDate(text(response, "getlastmodified"));
            String name = RemotePaths.fileName(path);
            entries.add(collection
                    ? RemoteEntry.directory(dir, name, modified)
                    : RemoteEntry.file(dir, name, Math.max(0, parseLength(text(response, "getcontentlength"))), modified));
        }
        return entries;
    }

    private static String text(Element parent, String localName) {
        NodeList nodes = parent.getElementsByTagNameNS(DAV_NS, localName);
        return nodes.getLength() == 0 ? null : nodes.item(0).getTextContent();
    }

    private static Instant parseHttpDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return ZonedDateTime.parse(value.trim(), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            logger.debug("Unparseable getlastmodified '{}'", value);
            return null;
        }
    }

    private static long parseLength(String value) {
        if (value == null || value.isBlank()) {
            return -1;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static void checkStatus(String operation, int status, int... accepted) throws ConnectorException {
        for (int ok : accepted) {
            if (status == ok) {
                return;
            }
        }
        ErrorKind kind = status == 401 || status == 403 ? ErrorKind.AUTHENTICATION : ErrorKind.PROTOCOL;
        throw new ConnectorException(kind, operation + " returned HTTP " + status);
    }

    private static String authorization(ConnectionConfig config) {
        if (!config.hasCredentials() || "anonymous".equals(config.getUsername())) {
            return null;
        }
        String token = config.getUsername() + ":" + (config.getPassword() == null ? "" : config.getPassword());
        return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }

    static String encodePath(String path) {
        StringBuilder sb = new StringBuilder();
        for (String segment : RemotePaths.normalize(path).split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            sb.append('/').append(URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20"));
        }
        String encoded = sb.length() == 0 ? "/" : sb.toString();
        return path.endsWith("/") && encoded.length() > 1 ? encoded + "/" : encoded;
    }

    private record DavResponse(int status, Buffer body) {
    }

    /**
     * Session owning one Vert.x HTTP client bound to the drive's host.
     */
    public static final class WebDavSession implements ConnectorSession {
        private final String id;
        private final ConnectionConfig config;
        private final HttpClient client;
        private final String authorization;
        private volatile boolean closed;

        WebDavSession(String id, ConnectionConfig config, HttpClient client, String authorization) {
            this.id = id;
            this.config = config;
            this.client = client;
            this.authorization = authorization;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public ConnectionConfig getConfig() {
            return config;
        }

        /**
         * HTTP is connectionless from the session's point of view; a session is alive
         * until closed. Drive health checks rely on the next request failing.
         */
        @Override
        public boolean isAlive() {
            return !closed;
        }

        long timeoutMs() {
            return config.getTimeout().toMillis();
        }

        RequestOptions options(HttpMethod method, String path) {
            RequestOptions options = new RequestOptions()
                    .setMethod(method)
                    .setURI(encodePath(path))
                    .setIdleTimeout(timeoutMs());
            if (authorization != null) {
                options.putHeader(HttpHeaders.AUTHORIZATION, authorization);
            }
            return options;
        }

        void close() {
            if (!closed) {
                closed = true;
                client.close().onFailure(err -> logger.debug("HTTP client close failed: {}", err.getMessage()));
            }
        }
    }
}
