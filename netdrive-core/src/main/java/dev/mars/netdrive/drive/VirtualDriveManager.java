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

import dev.mars.netdrive.core.ActiveConnection;
import dev.mars.netdrive.core.ConnectionConfig;
import dev.mars.netdrive.core.ConnectionStatus;
import dev.mars.netdrive.core.ErrorKind;
import dev.mars.netdrive.core.Protocol;
import dev.mars.netdrive.core.RemoteEntry;
import dev.mars.netdrive.core.RemotePaths;
import dev.mars.netdrive.core.TransferItemSnapshot;
import dev.mars.netdrive.core.TransferPriority;
import dev.mars.netdrive.core.TransferRequest;
import dev.mars.netdrive.core.VirtualDrive;
import dev.mars.netdrive.core.exceptions.ConnectorException;
import dev.mars.netdrive.core.exceptions.InvalidTransitionException;
import dev.mars.netdrive.core.exceptions.MountException;
import dev.mars.netdrive.core.exceptions.QueueException;
import dev.mars.netdrive.events.EventChannel;
import dev.mars.netdrive.monitoring.TransferTelemetryMetrics;
import dev.mars.netdrive.protocol.ConnectorFactory;
import dev.mars.netdrive.protocol.ConnectorSession;
import dev.mars.netdrive.protocol.ProtocolConnector;
import dev.mars.netdrive.storage.ChecksumCalculator;
import dev.mars.netdrive.transfer.DriveSessionProvider;
import dev.mars.netdrive.transfer.TransferEvent;
import dev.mars.netdrive.transfer.TransferQueue;
import dev.mars.netdrive.transfer.TransferQueueSettings;
import dev.mars.netdrive.transfer.TransferSessionPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Lifecycle of virtual drives: mount, unmount, reconnect, browse, transfer and sync.
 *
 * <p>Each drive gets its own {@link TransferQueue}, so a slow endpoint never holds
 * up transfers to another. Mount failures are never retried implicitly; a drive
 * whose mount failed stays registered and offline with the failure as its offline
 * reason until the user reconnects or removes it.</p>
 *
 * <p>A mounted drive holds one primary session for browsing, sync listings and
 * health checks, used by one caller at a time. Transfers lease their own
 * sessions from a per-drive {@link TransferSessionPool} sized to the queue's
 * concurrency limit.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class VirtualDriveManager {

    private static final Logger logger = LoggerFactory.getLogger(VirtualDriveManager.class);

    private final ConnectorFactory connectorFactory;
    private final EventChannel<DriveEvent> driveEvents;
    private final EventChannel<TransferEvent> transferEvents;
    private final TransferQueueSettings queueSettings;
    private final ChecksumCalculator checksumCalculator;
    private final TransferTelemetryMetrics metrics;
    private final SyncPlanner syncPlanner;
    private final Clock clock;

    private final ConnectionRegistry connectionRegistry = new ConnectionRegistry();
    private final Map<String, DriveBinding> drives = new ConcurrentHashMap<>();

    public VirtualDriveManager(ConnectorFactory connectorFactory, EventChannel<DriveEvent> driveEvents,
                               EventChannel<TransferEvent> transferEvents, TransferQueueSettings queueSettings,
                               ChecksumCalculator checksumCalculator, TransferTelemetryMetrics metrics,
                               Duration syncTolerance, Clock clock) {
        this.connectorFactory = connectorFactory;
        this.driveEvents = driveEvents;
        this.transferEvents = transferEvents;
        this.queueSettings = queueSettings;
        this.checksumCalculator = checksumCalculator;
        this.metrics = metrics;
        this.syncPlanner = new SyncPlanner(syncTolerance, clock);
        this.clock = clock;
    }

    /**
     * Register a drive and connect it.
     *
     * @throws MountException if the connection cannot be established; the drive
     *         stays registered and offline, see {@link #reconnect(String)}
     */
    public VirtualDrive mount(String name, ConnectionConfig config) throws MountException {
        VirtualDrive drive = new VirtualDrive(UUID.randomUUID().toString(), name, config, clock.instant());
        DriveBinding binding = new DriveBinding(drive);
        drives.put(drive.getId(), binding);
        logger.info("Mounting drive '{}' ({}) as {}", drive.getName(), config.endpointKey(), drive.getId());
        connect(binding);
        return drive;
    }

    /**
     * Disconnect a drive and mark it offline. Idempotent; the drive stays registered.
     */
    public VirtualDrive unmount(String driveId) {
        DriveBinding binding = require(driveId);
        boolean changed;
        synchronized (binding) {
            changed = disconnect(binding);
        }
        if (changed) {
            logger.info("Unmounted drive '{}'", binding.drive.getName());
            driveEvents.publishBlocking(DriveEvent.unmounted(driveId, binding.drive.getName(), clock.instant()));
        }
        return binding.drive;
    }

    /**
     * User-initiated reconnect. A drive that is already online is returned unchanged.
     */
    public VirtualDrive reconnect(String driveId) throws MountException {
        DriveBinding binding = require(driveId);
        if (binding.drive.isOnline()) {
            return binding.drive;
        }
        logger.info("Reconnecting drive '{}'", binding.drive.getName());
        connect(binding);
        return binding.drive;
    }

    /**
     * Unmount, stop the drive's queue and forget the drive.
     */
    public boolean remove(String driveId, Duration timeout) {
        DriveBinding binding = drives.get(driveId);
        if (binding == null) {
            return false;
        }
        unmount(driveId);
        binding.queue.shutdown(timeout);
        drives.remove(driveId);
        logger.info("Removed drive '{}'", binding.drive.getName());
        return true;
    }

    public List<RemoteEntry> list(String driveId, String remotePath) throws ConnectorException {
        DriveBinding binding = require(driveId);
        String path = RemotePaths.resolve(binding.drive.getConfig().getRemoteRoot(), remotePath);
        ProtocolConnector connector = binding.getConnector();
        synchronized (binding.primaryLock) {
            return connector.listEntries(binding.primarySession(), path);
        }
    }

    public TransferItemSnapshot upload(String driveId, Path localPath, String remotePath, TransferPriority priority)
            throws QueueException {
        DriveBinding binding = require(driveId);
        String path = RemotePaths.resolve(binding.drive.getConfig().getRemoteRoot(), remotePath);
        return binding.queue.enqueue(TransferRequest.upload(localPath, path, priority));
    }

    public TransferItemSnapshot download(String driveId, String remotePath, Path localPath, TransferPriority priority)
            throws QueueException {
        DriveBinding binding = require(driveId);
        String path = RemotePaths.resolve(binding.drive.getConfig().getRemoteRoot(), remotePath);
        return binding.queue.enqueue(TransferRequest.download(path, localPath, priority));
    }

    /**
     * Compare the drive's local root with its remote root and enqueue the needed transfers.
     *
     * @throws IllegalStateException if the drive has no local root configured
     */
    public SyncPlan sync(String driveId, SyncDirection direction) throws ConnectorException, QueueException {
        DriveBinding binding = require(driveId);
        VirtualDrive drive = binding.drive;
        ConnectionConfig config = drive.getConfig();
        if (config.getLocalRoot() == null) {
            throw new IllegalStateException("Drive '" + drive.getName() + "' has no local root to sync");
        }
        ProtocolConnector connector = binding.getConnector();

        SyncPlan plan;
        synchronized (binding.primaryLock) {
            ConnectorSession session = binding.primarySession();
            try {
                plan = syncPlanner.plan(driveId, direction, config.getLocalRoot(), config.getRemoteRoot(),
                        path -> connector.listEntries(session, path));
            } catch (IOException e) {
                throw new ConnectorException(ErrorKind.IO, "Cannot scan local root " + config.getLocalRoot(), e);
            }
        }

        List<String> itemIds = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<PlannedTransfer> planned = new ArrayList<>(plan.uploads());
        planned.addAll(plan.downloads());
        for (PlannedTransfer transfer : planned) {
            // a previous sync may still be moving this file
            if (binding.queue.hasPending(transfer.direction(), transfer.remotePath())) {
                skipped.add(transfer.relativePath());
                continue;
            }
            TransferRequest request = TransferRequest.builder()
                    .direction(transfer.direction())
                    .localPath(transfer.localPath())
                    .remotePath(transfer.remotePath())
                    .expectedSize(transfer.size())
                    .metadata("sync", direction.name())
                    .build();
            itemIds.add(binding.queue.enqueue(request).id());
        }
        if (!skipped.isEmpty()) {
            logger.info("Sync of drive '{}' skipped {} files already queued", drive.getName(), skipped.size());
        }
        SyncPlan result = plan.withQueueOutcome(skipped, itemIds);
        drive.markSynced(clock.instant());
        driveEvents.publishBlocking(DriveEvent.synced(driveId, drive.getName(), result, clock.instant()));
        return result;
    }

    /**
     * Probe every online drive's session. A dead session turns the connection to
     * ERROR, which takes the drive offline.
     *
     * @return ids of the drives that went offline
     */
    public List<String> checkHealth() {
        List<String> lost = new ArrayList<>();
        for (DriveBinding binding : drives.values()) {
            VirtualDrive drive = binding.drive;
            Optional<ActiveConnection> connection = drive.getActiveConnection();
            if (!drive.isOnline() || connection.isEmpty()) {
                continue;
            }
            Optional<ConnectorSession> session = connection.get().getSession();
            boolean alive;
            synchronized (binding.primaryLock) {
                try {
                    alive = session.isPresent() && session.get().isAlive();
                } catch (RuntimeException e) {
                    logger.debug("Health check of drive '{}' threw: {}", drive.getName(), e.getMessage());
                    alive = false;
                }
            }
            if (alive) {
                continue;
            }
            String message = "Connection to " + drive.getConfig().getHost() + " lost";
            synchronized (binding) {
                // an unmount or reconnect may have replaced the connection meanwhile
                if (!drive.isOnline() || drive.getActiveConnection().orElse(null) != connection.get()) {
                    logger.debug("Drive '{}' changed connection during health check, skipping", drive.getName());
                    continue;
                }
                fail(binding, connection.get(), ErrorKind.CONNECTION, message);
                session.ifPresent(s -> closeQuietly(binding, s));
            }
            logger.warn("Drive '{}' went offline: {}", drive.getName(), message);
            lost.add(drive.getId());
        }
        return lost;
    }

    /**
     * Annotate drives bound to {@code host} with an offline notice from discovery.
     * The connection state is not touched.
     *
     * @return number of drives annotated
     */
    public int markDeviceUnreachable(String host) {
        int count = 0;
        for (DriveBinding binding : drives.values()) {
            if (binding.drive.getConfig().getHost().equalsIgnoreCase(host)) {
                binding.drive.setDeviceNotice("Device " + host + " is not responding on the network");
                count++;
            }
        }
        return count;
    }

    public int markDeviceReachable(String host) {
        int count = 0;
        for (DriveBinding binding : drives.values()) {
            if (binding.drive.getConfig().getHost().equalsIgnoreCase(host)
                    && binding.drive.getDeviceNotice().isPresent()) {
                binding.drive.setDeviceNotice(null);
                count++;
            }
        }
        return count;
    }

    public Optional<VirtualDrive> get(String driveId) {
        return Optional.ofNullable(drives.get(driveId)).map(b -> b.drive);
    }

    public List<VirtualDrive> getDrives() {
        return drives.values().stream()
                .map(b -> b.drive)
                .sorted(Comparator.comparing(VirtualDrive::getCreatedAt))
                .collect(Collectors.toUnmodifiableList());
    }

    public TransferQueue getQueue(String driveId) {
        return require(driveId).queue;
    }

    public List<TransferItemSnapshot> getAllTransfers() {
        List<TransferItemSnapshot> all = new ArrayList<>();
        drives.values().forEach(b -> all.addAll(b.queue.snapshot()));
        all.sort(Comparator.comparing(TransferItemSnapshot::createdAt));
        return all;
    }

    /**
     * Stop every queue and disconnect every drive.
     */
    public void shutdown(Duration timeout) {
        for (DriveBinding binding : drives.values()) {
            binding.queue.shutdown(timeout);
            synchronized (binding) {
                disconnect(binding);
            }
        }
        logger.info("VirtualDriveManager shut down ({} drives)", drives.size());
    }

    // Connection handling

    private void connect(DriveBinding binding) throws MountException {
        VirtualDrive drive = binding.drive;
        ConnectionConfig config = drive.getConfig();
        synchronized (binding) {
            ActiveConnection connection = new ActiveConnection(UUID.randomUUID().toString(), config);
            Optional<ActiveConnection> previous = drive.getActiveConnection();
            if (previous.isPresent() && previous.get().getSession().isPresent()) {
                disconnect(binding);
            }
            drive.attach(connection);

            ProtocolConnector connector;
            try {
                connector = connectorFactory.getConnector(config.getProtocol());
            } catch (ConnectorException e) {
                throw mountFailed(binding, connection, e.getKind(), e.getMessage(), e);
            }

            if (!connectionRegistry.tryBeginConnecting(config, connection)) {
                String message = "A connection to " + config.getHost() + " over " + config.getProtocol()
                        + " is already being established";
                throw mountFailed(binding, connection, ErrorKind.CONNECTION, message, null);
            }
            try {
                connection.markConnecting();
                ConnectorSession session = connector.connect(config);
                connection.markConnected(session);
                binding.connector = connector;
                binding.transferSessions = new TransferSessionPool(connector, config, queueSettings.concurrentLimit());
            } catch (ConnectorException e) {
                throw mountFailed(binding, connection, e.getKind(), e.getMessage(), e);
            } catch (InvalidTransitionException e) {
                throw new IllegalStateException(e.getMessage(), e);
            } finally {
                connectionRegistry.endConnecting(config, connection);
            }
        }
        drive.setDeviceNotice(null);
        logger.info("Drive '{}' mounted ({})", drive.getName(), config.endpointKey());
        driveEvents.publishBlocking(DriveEvent.mounted(drive.getId(), drive.getName(), clock.instant()));
    }

    private MountException mountFailed(DriveBinding binding, ActiveConnection connection, ErrorKind kind,
                                       String message, Throwable cause) {
        fail(binding, connection, kind, message);
        VirtualDrive drive = binding.drive;
        logger.warn("Mount of drive '{}' failed ({}): {}", drive.getName(), kind, message);
        return cause == null
                ? new MountException(drive.getId(), kind, message)
                : new MountException(drive.getId(), kind, message, cause);
    }

    private void fail(DriveBinding binding, ActiveConnection connection, ErrorKind kind, String message) {
        closeTransferSessions(binding);
        if (connection.getStatus() == ConnectionStatus.DISCONNECTED) {
            try {
                connection.markConnecting();
            } catch (InvalidTransitionException e) {
                throw new IllegalStateException(e.getMessage(), e);
            }
        }
        try {
            connection.markError(kind, message);
        } catch (InvalidTransitionException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
        driveEvents.publishBlocking(DriveEvent.error(binding.drive.getId(), binding.drive.getName(), kind, message,
                clock.instant()));
    }

    /**
     * @return whether the drive was connected (or in error) before the call
     */
    private boolean disconnect(DriveBinding binding) {
        Optional<ActiveConnection> connection = binding.drive.getActiveConnection();
        if (connection.isEmpty()) {
            return false;
        }
        ActiveConnection active = connection.get();
        closeTransferSessions(binding);
        active.getSession().ifPresent(session -> closeQuietly(binding, session));
        if (active.getStatus() == ConnectionStatus.DISCONNECTED) {
            return false;
        }
        try {
            active.markDisconnected();
        } catch (InvalidTransitionException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
        return true;
    }

    private static void closeTransferSessions(DriveBinding binding) {
        TransferSessionPool pool = binding.transferSessions;
        if (pool != null) {
            pool.closeAll();
            binding.transferSessions = null;
        }
    }

    private void closeQuietly(DriveBinding binding, ConnectorSession session) {
        ProtocolConnector connector = binding.connector;
        if (connector != null) {
            connector.disconnect(session);
        }
    }

    private DriveBinding require(String driveId) {
        DriveBinding binding = drives.get(driveId);
        if (binding == null) {
            throw new IllegalArgumentException("Unknown drive: " + driveId);
        }
        return binding;
    }

    /**
     * Per-drive state: the drive, the connector chosen at mount time, the transfer
     * sessions of the current connection and the drive's queue.
     */
    private final class DriveBinding implements DriveSessionProvider {

        private final VirtualDrive drive;
        private final TransferQueue queue;
        private final Object primaryLock = new Object();
        private volatile ProtocolConnector connector;
        private volatile TransferSessionPool transferSessions;

        private DriveBinding(VirtualDrive drive) {
            this.drive = drive;
            this.queue = new TransferQueue(this, queueSettings, checksumCalculator, transferEvents, metrics, clock);
        }

        @Override
        public String getDriveId() {
            return drive.getId();
        }

        @Override
        public Protocol getProtocol() {
            return drive.getProtocol();
        }

        @Override
        public ProtocolConnector getConnector() throws ConnectorException {
            ProtocolConnector current = connector;
            return current != null ? current : connectorFactory.getConnector(drive.getProtocol());
        }

        @Override
        public ConnectorSession acquireSession() throws ConnectorException {
            TransferSessionPool pool = transferSessions;
            if (pool == null || !drive.isOnline()) {
                throw offline();
            }
            return pool.acquire();
        }

        @Override
        public void releaseSession(ConnectorSession session, boolean reusable) {
            TransferSessionPool pool = transferSessions;
            if (pool == null || !pool.release(session, reusable)) {
                // leased from a pool that a reconnect has since replaced
                closeQuietly(this, session);
            }
        }

        private ConnectorSession primarySession() throws ConnectorException {
            Optional<ConnectorSession> session = drive.getActiveConnection()
                    .filter(ActiveConnection::isConnected)
                    .flatMap(ActiveConnection::getSession);
            if (session.isEmpty()) {
                throw offline();
            }
            return session.get();
        }

        private ConnectorException offline() {
            return new ConnectorException(ErrorKind.CONNECTION, "Drive '" + drive.getName() + "' is offline: "
                    + drive.getOfflineReason().orElse("not connected"));
        }
    }
}
