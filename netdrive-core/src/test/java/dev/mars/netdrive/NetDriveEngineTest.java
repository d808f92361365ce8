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

package dev.mars.netdrive;

import com.fasterxml.jackson.core.type.TypeReference;
import dev.mars.netdrive.config.NetDriveConfiguration;
import dev.mars.netdrive.core.ConnectionConfig;
import dev.mars.netdrive.core.NetDriveJson;
import dev.mars.netdrive.core.Protocol;
import dev.mars.netdrive.core.TransferItemSnapshot;
import dev.mars.netdrive.core.TransferPriority;
import dev.mars.netdrive.core.TransferStatus;
import dev.mars.netdrive.core.VirtualDrive;
import dev.mars.netdrive.network.HostProber;
import dev.mars.netdrive.network.NetworkStatus;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the assembled engine over a mounted-folder drive and a scripted network.
 */
class NetDriveEngineTest {

    private static final String NAS_IP = "192.168.1.10";

    @TempDir
    Path tempDir;

    private Path mountRoot;
    private ScriptedProber prober;
    private NetDriveEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        mountRoot = Files.createDirectories(tempDir.resolve("mnt"));
        Files.createDirectories(mountRoot.resolve(NAS_IP));
        prober = new ScriptedProber();
        prober.open.add(NAS_IP);
        NetDriveConfiguration configuration = NetDriveConfiguration.of(Map.of(
                NetDriveConfiguration.MOUNT_ROOT, mountRoot.toString(),
                NetDriveConfiguration.DISCOVERY_STALE_CYCLES, "1",
                NetDriveConfiguration.DISCOVERY_PROBE_THREADS, "2",
                NetDriveConfiguration.MAX_RETRIES, "0"));
        engine = new NetDriveEngine(configuration, OpenTelemetry.noop(), prober);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private ConnectionConfig nfsDrive() {
        return engine.connectionConfig(Protocol.NFS, NAS_IP).remoteRoot("/").build();
    }

    @Test
    void testConnectionConfigUsesConfiguredTimeout() {
        ConnectionConfig config = engine.connectionConfig(Protocol.SFTP, "nas.local").build();

        assertEquals(Duration.ofSeconds(30), config.getTimeout());
        assertEquals(22, config.getPort());
        assertTrue(engine.connectors().isSupported(Protocol.CLOUD));
    }

    @Test
    void testUploadToMountedFolderAndExportHistory() throws Exception {
        VirtualDrive drive = engine.drives().mount("NFS share", nfsDrive());
        Path local = Files.writeString(tempDir.resolve("report.txt"), "numbers");

        TransferItemSnapshot item = engine.drives().upload(drive.getId(), local, "docs/report.txt", TransferPriority.HIGH);

        await().atMost(Duration.ofSeconds(5)).until(() ->
                engine.drives().getQueue(drive.getId()).get(item.id()).map(s -> s.status() == TransferStatus.COMPLETED)
                        .orElse(false));
        assertEquals("numbers", Files.readString(mountRoot.resolve(NAS_IP).resolve("docs/report.txt")));

        List<TransferItemSnapshot> history = NetDriveJson.mapper().readValue(engine.exportTransferHistory(),
                new TypeReference<List<TransferItemSnapshot>>() { });
        assertEquals(1, history.size());
        assertEquals(item.id(), history.get(0).id());
        assertEquals(TransferStatus.COMPLETED, history.get(0).status());
        assertEquals(7, history.get(0).processedBytes());
    }

    @Test
    void testUnreachableDeviceAnnotatesBoundDrive() throws Exception {
        VirtualDrive drive = engine.drives().mount("NFS share", nfsDrive());
        engine.discovery().scan(d -> { }).toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);

        prober.open.remove(NAS_IP);
        engine.discovery().scan(d -> { }).toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);

        await().atMost(Duration.ofSeconds(3)).until(() -> drive.getDeviceNotice().isPresent());
        assertTrue(drive.isOnline(), "Discovery does not disconnect drives");

        prober.open.add(NAS_IP);
        engine.discovery().scan(d -> { }).toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);

        await().atMost(Duration.ofSeconds(3)).until(() -> drive.getDeviceNotice().isEmpty());
    }

    @Test
    void testCloseIsIdempotent() {
        engine.close();
        engine.close();

        assertFalse(engine.discovery().isMonitoring());
    }

    private static final class ScriptedProber implements HostProber {
        final Set<String> open = ConcurrentHashMap.newKeySet();

        @Override
        public List<String> candidateHosts() {
            return List.of(NAS_IP);
        }

        @Override
        public boolean isPortOpen(String host, int port, Duration timeout) {
            return port == 2049 && open.contains(host);
        }

        @Override
        public Optional<String> resolveHostname(String ipAddress) {
            return Optional.empty();
        }

        @Override
        public NetworkStatus networkStatus() {
            return NetworkStatus.connected("eth0", "192.168.1.2", "192.168.1.1", "192.168.1.0/24");
        }
    }
}
