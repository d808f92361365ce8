package dev.mars.netdrive;

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

import dev.mars.netdrive.config.NetDriveConfiguration;
import dev.mars.netdrive.core.ConnectionConfig;
import dev.mars.netdrive.core.NetDriveJson;
import dev.mars.netdrive.core.Protocol;
import dev.mars.netdrive.core.TransferItemSnapshot;
import dev.mars.netdrive.drive.DriveEvent;
import dev.mars.netdrive.drive.VirtualDriveManager;
import dev.mars.netdrive.events.EventChannel;
import dev.mars.netdrive.monitoring.TransferTelemetryMetrics;
import dev.mars.netdrive.network.DeviceRegistry;
import dev.mars.netdrive.network.DiscoveryEvent;
import dev.mars.netdrive.network.DiscoverySettings;
import dev.mars.netdrive.network.HostProber;
import dev.mars.netdrive.network.NetworkDiscoveryService;
import dev.mars.netdrive.network.SocketHostProber;
import dev.mars.netdrive.protocol.ConnectorFactory;
import dev.mars.netdrive.protocol.ConnectorSettings;
import dev.mars.netdrive.storage.ChecksumCalculator;
import dev.mars.netdrive.transfer.TransferEvent;
import dev.mars.netdrive.transfer.TransferQueueSettings;
import io.opentelemetry.api.OpenTelemetry;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Top-level assembly of the NetDrive engine.
 *
 * <p>Constructs and owns the Vert.x instance, the event channels, the connector
 * factory, network discovery and the drive manager. Nothing in the engine is a
 * process-wide singleton; callers hold the engine and reach the services from it.</p>
 *
 * <pre>{@code
 * try (NetDriveEngine engine = new NetDriveEngine(new NetDriveConfiguration(), OpenTelemetry.noop())) {
 *     engine.transferEvents().consume(event -> ui.update(event));
 *     VirtualDrive nas = engine.drives().mount("NAS", engine.connectionConfig(Protocol.SMB, "192.168.1.20")
 *             .username("me").password("secret").remoteRoot("/share").build());
 *     engine.drives().upload(nas.getId(), Paths.get("report.pdf"), "/docs/report.pdf", TransferPriority.HIGH);
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class NetDriveEngine implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(NetDriveEngine.class);
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final NetDriveConfiguration configuration;
    private final Vertx vertx;
    private final EventChannel<DriveEvent> driveEvents;
    private final EventChannel<TransferEvent> transferEvents;
    private final EventChannel<DiscoveryEvent> discoveryEvents;
    private final ConnectorFactory connectorFactory;
    private final TransferTelemetryMetrics metrics;
    private final DeviceRegistry deviceRegistry;
    private final NetworkDiscoveryService discovery;
    private final VirtualDriveManager driveManager;
    private final EventChannel.Subscription deviceLink;
    private final long healthTimer;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public NetDriveEngine(NetDriveConfiguration configuration, OpenTelemetry openTelemetry) {
        this(configuration, openTelemetry, new SocketHostProber());
    }

    public NetDriveEngine(NetDriveConfiguration configuration, OpenTelemetry openTelemetry, HostProber prober) {
        this(configuration, openTelemetry, prober, Vertx.vertx());
    }

    NetDriveEngine(NetDriveConfiguration configuration, OpenTelemetry openTelemetry, HostProber prober, Vertx vertx) {
        this.configuration = configuration;
        this.vertx = vertx;
        logger.info("Starting NetDrive engine: {}", configuration);

        this.driveEvents = new EventChannel<>("drive", Flow.defaultBufferSize());
        this.transferEvents = new EventChannel<>("transfer", Flow.defaultBufferSize());
        this.discoveryEvents = new EventChannel<>("discovery", Flow.defaultBufferSize());

        ConnectorSettings connectorSettings = new ConnectorSettings(configuration.getBufferSize(),
                configuration.getProgressBytes(), configuration.getProgressInterval());
        this.connectorFactory = ConnectorFactory.withDefaults(vertx, configuration.getMountRoot(), connectorSettings);
        this.metrics = new TransferTelemetryMetrics(openTelemetry);

        this.deviceRegistry = new DeviceRegistry(configuration.getStaleCycles());
        this.discovery = new NetworkDiscoveryService(vertx, prober, deviceRegistry, discoveryEvents,
                DiscoverySettings.from(configuration), Clock.systemUTC());

        this.driveManager = new VirtualDriveManager(connectorFactory, driveEvents, transferEvents,
                TransferQueueSettings.from(configuration),
                new ChecksumCalculator(configuration.getChecksumAlgorithm()),
                metrics, configuration.getSyncMtimeTolerance(), Clock.systemUTC());

        this.deviceLink = discoveryEvents.consume(this::linkDeviceState);
        this.healthTimer = vertx.setPeriodic(configuration.getHealthInterval().toMillis(), id ->
                vertx.executeBlocking(driveManager::checkHealth, false)
                        .onFailure(err -> logger.warn("Drive health check failed: {}", err.getMessage())));
    }

    public NetDriveConfiguration configuration() {
        return configuration;
    }

    public VirtualDriveManager drives() {
        return driveManager;
    }

    public NetworkDiscoveryService discovery() {
        return discovery;
    }

    public ConnectorFactory connectors() {
        return connectorFactory;
    }

    public TransferTelemetryMetrics metrics() {
        return metrics;
    }

    public EventChannel<DriveEvent> driveEvents() {
        return driveEvents;
    }

    public EventChannel<TransferEvent> transferEvents() {
        return transferEvents;
    }

    public EventChannel<DiscoveryEvent> discoveryEvents() {
        return discoveryEvents;
    }

    /**
     * Builder preset with the configured connection timeout.
     */
    public ConnectionConfig.Builder connectionConfig(Protocol protocol, String host) {
        return ConnectionConfig.builder()
                .protocol(protocol)
                .host(host)
                .timeout(configuration.getConnectionTimeout());
    }

    /**
     * Transfer history of every drive as a JSON array, for an external history store.
     */
    public String exportTransferHistory() {
        List<TransferItemSnapshot> history = driveManager.getAllTransfers();
        return NetDriveJson.toJson(history);
    }

    private void linkDeviceState(DiscoveryEvent event) {
        if (event.device() == null) {
            return;
        }
        switch (event.type()) {
            case DEVICE_UNREACHABLE -> {
                driveManager.markDeviceUnreachable(event.ipAddress());
                event.device().getHostname().ifPresent(driveManager::markDeviceUnreachable);
            }
            case DEVICE_FOUND -> {
                driveManager.markDeviceReachable(event.ipAddress());
                event.device().getHostname().ifPresent(driveManager::markDeviceReachable);
            }
            default -> {
            }
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.info("Stopping NetDrive engine");
        vertx.cancelTimer(healthTimer);
        discovery.stopContinuousMonitoring();
        driveManager.shutdown(SHUTDOWN_TIMEOUT);
        deviceLink.close();
        driveEvents.close();
        transferEvents.close();
        discoveryEvents.close();
        try {
            vertx.close().toCompletionStage().toCompletableFuture()
                    .get(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("Vert.x did not close cleanly: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while closing Vert.x");
        }
        logger.info("NetDrive engine stopped");
    }
}
