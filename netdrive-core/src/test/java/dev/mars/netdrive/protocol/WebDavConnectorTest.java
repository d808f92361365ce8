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

package dev.mars.netdrive.protocol;

import dev.mars.netdrive.core.ConnectionConfig;
import dev.mars.netdrive.core.ErrorKind;
import dev.mars.netdrive.core.Protocol;
import dev.mars.netdrive.core.RemoteEntry;
import dev.mars.netdrive.core.RemotePaths;
import dev.mars.netdrive.core.exceptions.ConnectorException;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WebDavConnector against a small in-process WebDAV server built on the Vert.x HTTP server.
 */
@ExtendWith(VertxExtension.class)
class WebDavConnectorTest {

    private static final String LAST_MODIFIED = "Wed, 01 Jan 2025 00:00:00 GMT";

    @TempDir
    Path tempDir;

    private final Map<String, Buffer> files = new ConcurrentHashMap<>();
    private final Set<String> collections = ConcurrentHashMap.newKeySet();
    private final String expectedAuth = "Basic " + Base64.getEncoder()
            .encodeToString("alice:secret".getBytes(StandardCharsets.UTF_8));

    private WebDavConnector connector;
    private int port;

    @BeforeEach
    void startServer(Vertx vertx, VertxTestContext testContext) {
        collections.add("/");
        collections.add("/dav");
        connector = new WebDavConnector(vertx, new ConnectorSettings(1024, 1, Duration.ZERO));
        vertx.createHttpServer()
                .requestHandler(this::handle)
                .listen(0)
                .onComplete(testContext.succeeding(server -> {
                    port = server.actualPort();
                    testContext.completeNow();
                }));
    }

    private ConnectionConfig.Builder config() {
        return ConnectionConfig.builder()
                .protocol(Protocol.WEBDAV)
                .host("127.0.0.1")
                .port(port)
                .username("alice")
                .password("secret")
                .remoteRoot("/dav")
                .timeout(Duration.ofSeconds(5));
    }

    @Test
    void uploadListAndDownload() throws Exception {
        Path local = tempDir.resolve("notes.txt");
        Files.writeString(local, "x".repeat(3000));
        ConnectorSession session = connector.connect(config().build());
        List<Long> progress = new ArrayList<>();

        connector.upload(session, local, "/dav/docs/2025/notes.txt",
                (transferred, total) -> progress.add(transferred), CancellationToken.NONE);

        assertThat(collections).contains("/dav/docs", "/dav/docs/2025");
        assertThat(files.get("/dav/docs/2025/notes.txt").toString()).isEqualTo("x".repeat(3000));
        assertThat(progress).isSorted().last().isEqualTo(3000L);

        List<RemoteEntry> root = connector.listEntries(session, "/dav");
        assertThat(root).singleElement().satisfies(e -> {
            assertThat(e.name()).isEqualTo("docs");
            assertThat(e.directory()).isTrue();
        });
        List<RemoteEntry> year = connector.listEntries(session, "/dav/docs/2025");
        assertThat(year).singleElement().satisfies(e -> {
            assertThat(e.path()).isEqualTo("/dav/docs/2025/notes.txt");
            assertThat(e.size()).isEqualTo(3000);
            assertThat(e.modifiedAt()).isEqualTo(Instant.parse("2025-01-01T00:00:00Z"));
        });

        Path target = tempDir.resolve("copy/notes.txt");
        connector.download(session, "/dav/docs/2025/notes.txt", target, ProgressListener.NONE, CancellationToken.NONE);
        assertThat(target).hasContent("x".repeat(3000));

        connector.disconnect(session);
        assertThat(session.isAlive()).isFalse();
    }

    @Test
    void wrongCredentialsAreAuthenticationFailure() {
        ConnectionConfig wrong = config().password("nope").build();

        assertThatThrownBy(() -> connector.connect(wrong))
                .isInstanceOf(ConnectorException.class)
                .satisfies(e -> assertThat(((ConnectorException) e).getKind()).isEqualTo(ErrorKind.AUTHENTICATION));
    }

    @Test
    void missingRootIsProtocolFailure() {
        ConnectionConfig missing = config().remoteRoot("/absent").build();

        assertThatThrownBy(() -> connector.connect(missing))
                .isInstanceOf(ConnectorException.class)
                .satisfies(e -> assertThat(((ConnectorException) e).getKind()).isEqualTo(ErrorKind.PROTOCOL));
    }

    @Test
    void downloadOfMissingFileIsProtocolFailure() throws Exception {
        ConnectorSession session = connector.connect(config().build());

        assertThatThrownBy(() -> connector.download(session, "/dav/none.bin", tempDir.resolve("none.bin"),
                ProgressListener.NONE, CancellationToken.NONE))
                .isInstanceOf(ConnectorException.class)
                .satisfies(e -> assertThat(((ConnectorException) e).getKind()).isEqualTo(ErrorKind.PROTOCOL));
    }

    @Test
    void refusedConnectionIsTransient() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        ConnectionConfig refused = config().port(closedPort).build();

        assertThatThrownBy(() -> connector.connect(refused))
                .isInstanceOf(ConnectorException.class)
                .satisfies(e -> assertThat(((ConnectorException) e).getKind()).isEqualTo(ErrorKind.CONNECTION));
    }

    @Test
    void parsesMultistatusAndSkipsTheDirectoryItself() throws Exception {
        String xml = "<?xml version=\"1.0\"?><d:multistatus xmlns:d=\"DAV:\">"
                + "<d:response><d:href>http://host/share/</d:href><d:propstat><d:prop>"
                + "<d:resourcetype><d:collection/></d:resourcetype></d:prop></d:propstat></d:response>"
                + "<d:response><d:href>/share/my%20file.txt</d:href><d:propstat><d:prop><d:resourcetype/>"
                + "<d:getcontentlength>12</d:getcontentlength>"
                + "<d:getlastmodified>not a date</d:getlastmodified></d:prop></d:propstat></d:response>"
                + "</d:multistatus>";

        List<RemoteEntry> entries = WebDavConnector.parseMultistatus("/share", Buffer.buffer(xml));

        assertThat(entries).singleElement().satisfies(e -> {
            assertThat(e.name()).isEqualTo("my file.txt");
            assertThat(e.size()).isEqualTo(12);
            assertThat(e.modifiedAt()).isNull();
        });
    }

    @Test
    void malformedMultistatusIsProtocolFailure() {
        assertThatThrownBy(() -> WebDavConnector.parseMultistatus("/", Buffer.buffer("<not-xml")))
                .isInstanceOf(ConnectorException.class)
                .satisfies(e -> assertThat(((ConnectorException) e).getKind()).isEqualTo(ErrorKind.PROTOCOL));
    }

    @Test
    void encodesPathSegments() {
        assertThat(WebDavConnector.encodePath("/a b/c#d.txt")).isEqualTo("/a%20b/c%23d.txt");
        assertThat(WebDavConnector.encodePath("/dir/")).isEqualTo("/dir/");
        assertThat(WebDavConnector.encodePath("/")).isEqualTo("/");
    }

    // Minimal WebDAV server

    private void handle(HttpServerRequest request) {
        request.body().onSuccess(body -> {
            if (!expectedAuth.equals(request.getHeader("Authorization"))) {
                request.response().setStatusCode(401).end();
                return;
            }
            String path = RemotePaths.normalize(request.path());
            HttpMethod method = request.method();
            if (HttpMethod.PROPFIND.equals(method)) {
                propfind(request, path, request.getHeader("Depth"));
            } else if (HttpMethod.MKCOL.equals(method)) {
                if (collections.contains(path)) {
                    request.response().setStatusCode(405).end();
                } else if (!collections.contains(RemotePaths.parent(path))) {
                    request.response().setStatusCode(409).end();
                } else {
                    collections.add(path);
                    request.response().setStatusCode(201).end();
                }
            } else if (HttpMethod.PUT.equals(method)) {
                if (!collections.contains(RemotePaths.parent(path))) {
                    request.response().setStatusCode(409).end();
                } else {
                    files.put(path, body);
                    request.response().setStatusCode(201).end();
                }
            } else if (HttpMethod.GET.equals(method)) {
                Buffer content = files.get(path);
                if (content == null) {
                    request.response().setStatusCode(404).end();
                } else {
                    request.response().setStatusCode(200).end(content);
                }
            } else {
                request.response().setStatusCode(405).end();
            }
        });
    }

    private void propfind(HttpServerRequest request, String path, String depth) {
        StringBuilder xml = new StringBuilder("<?xml version=\"1.0\" encoding=\"utf-8\"?><d:multistatus xmlns:d=\"DAV:\">");
        if (collections.contains(path)) {
            xml.append(collectionResponse(path));
            if ("1".equals(depth)) {
                for (String dir : collections) {
                    if (!dir.equals(path) && RemotePaths.parent(dir).equals(path)) {
                        xml.append(collectionResponse(dir));
                    }
                }
                files.forEach((file, content) -> {
                    if (RemotePaths.parent(file).equals(path)) {
                        xml.append(fileResponse(file, content.length()));
                    }
                });
            }
        } else if (files.containsKey(path)) {
            xml.append(fileResponse(path, files.get(path).length()));
        } else {
            request.response().setStatusCode(404).end();
            return;
        }
        xml.append("</d:multistatus>");
        request.response().setStatusCode(207)
                .putHeader("Content-Type", "application/xml; charset=utf-8")
                .end(xml.toString());
    }

    private static String collectionResponse(String path) {
        return "<d:response><d:href>" + path + "/</d:href><d:propstat><d:prop>"
                + "<d:resourcetype><d:collection/></d:resourcetype>"
                + "<d:getlastmodified>" + LAST_MODIFIED + "</d:getlastmodified>"
                + "</d:prop><d:status>HTTP/1.1 200 OK</d:status></d:propstat></d:response>";
    }

    private static String fileResponse(String path, int length) {
        return "<d:response><d:href>" + path + "</d:href><d:propstat><d:prop><d:resourcetype/>"
                + "<d:getcontentlength>" + length + "</d:getcontentlength>"
                + "<d:getlastmodified>" + LAST_MODIFIED + "</d:getlastmodified>"
                + "</d:prop><d:status>HTTP/1.1 200 OK</d:status></d:propstat></d:response>";
    }
}
