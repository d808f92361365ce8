package dev.mars.netdrive.network;

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

import dev.mars.netdrive.core.AdvertisedService;
import dev.mars.netdrive.core.NetworkDevice;
import dev.mars.netdrive.events.EventChannel;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Finds devices on the local network that expose file-sharing services.
 *
 * <p>A scan probes the well-known service ports of every candidate host on a
 * bounded probe pool, hands each device to the caller's consumer as soon as it
 * is found, and then closes the cycle in the {@link DeviceRegistry}. Scans run
 * on Vert.x worker threads, which also publish the scan's events, so a slow
 * event consumer never stalls the event loop. Continuous monitoring is a Vert.x
 * periodic timer that first checks connectivity, then scans, and skips a tick
 * while the previous scan is still running.</p>
 *
 * <p>Losing the network clears the device registry; regaining it, or moving to
 * a different subnet, starts a fresh scan.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class NetworkDiscoveryService {

    private static final Logger logger = LoggerFactory.getLogger(NetworkDiscoveryService.class);

    private final Vertx vertx;
    private final HostProber prober;
    private final DeviceRegistry registry;
    private final EventChannel<DiscoveryEvent> events;
    private final DiscoverySettings settings;
    private final Clock clock;

    private final AtomicBoolean scanning = new AtomicBoolean(false);
    private final AtomicReference<NetworkStatus> networkStatus = new AtomicReference<>();
    private final AtomicReference<Long> monitorTimer = new AtomicReference<>();
    private final AtomicInteger skippedTicks = new AtomicInteger(0);

    public NetworkDiscoveryService(Vertx vertx, HostProber prober, DeviceRegistry registry,
                                   EventChannel<DiscoveryEvent> events, DiscoverySettings settings, Clock clock) {
        this.vertx = vertx;
        this.prober = prober;
        this.registry = registry;
        this.events = events;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Run one scan.
     *
     * @param onDevice called from probe threads for every device found, as it is found
     * @return the scan report; fails if the scan could not run or another scan is in progress
     */
    public Future<ScanReport> scan(Consumer<NetworkDevice> onDevice) {
        if (!scanning.compareAndSet(false, true)) {
            return Future.failedFuture(new IllegalStateException("A discovery scan is already in progress"));
        }
        logger.info("Starting network discovery scan");
        return vertx.executeBlocking(() -> runScan(onDevice), false)
                .onComplete(ar -> scanning.set(false));
    }

    /**
     * Read the current network status and react to a change: a lost network clears
     * the registry, a restored or different one starts a scan. Every change is
     * published as a NETWORK_CONNECTED or NETWORK_DISCONNECTED event.
     */
    public Future<NetworkStatus> checkConnectivity() {
        return vertx.executeBlocking(() -> {
            NetworkStatus current = prober.networkStatus();
            NetworkStatus previous = networkStatus.getAndSet(current);
            if (current.equals(previous)) {
                return new StatusChange(current, false);
            }
            if (current.connected()) {
                logger.info("Network available on {} ({}, subnet {})", current.interfaceName(),
                        current.localAddress(), current.subnet());
            } else {
                logger.warn("Network connection lost, clearing {} discovered devices", registry.size());
                registry.clear();
            }
            events.publishBlocking(DiscoveryEvent.network(current, clock.instant()));
            return new StatusChange(current, previous != null && previous.isRestoredBy(current));
        }, false).map(change -> {
            if (change.restored() && !scanning.get()) {
                // failures are already logged and published by scan()
                scan(device -> { });
            }
            return change.status();
        });
    }

    /**
     * Last status seen by {@link #checkConnectivity()}, empty before the first check.
     */
    public Optional<NetworkStatus> getNetworkStatus() {
        return Optional.ofNullable(networkStatus.get());
    }

    /**
     * Scan now and then repeatedly. The interval is raised to the configured minimum
     * if it is shorter. Calling again replaces the previous schedule.
     *
     * @return the interval actually used
     */
    public Duration startContinuousMonitoring(Duration interval) {
        Duration effective = interval.compareTo(settings.minInterval()) < 0 ? settings.minInterval() : interval;
        if (effective.isZero() || effective.isNegative()) {
            throw new IllegalArgumentException("Monitoring interval must be positive");
        }
        stopContinuousMonitoring();
        long timerId = vertx.setPeriodic(1, effective.toMillis(), id -> monitorTick());
        monitorTimer.set(timerId);
        logger.info("Continuous network monitoring started, interval {} ms", effective.toMillis());
        return effective;
    }

    public void stopContinuousMonitoring() {
        Long timerId = monitorTimer.getAndSet(null);
        if (timerId != null) {
            vertx.cancelTimer(timerId);
            logger.info("Continuous network monitoring stopped");
        }
    }

    public boolean isMonitoring() {
        return monitorTimer.get() != null;
    }

    public boolean isScanning() {
        return scanning.get();
    }

    /**
     * Number of monitoring ticks skipped because a scan was still running.
     */
    public int getSkippedTicks() {
        return skippedTicks.get();
    }

    public DeviceRegistry getRegistry() {
        return registry;
    }

    public List<NetworkDevice> getDevices() {
        return registry.snapshot();
    }

    private void monitorTick() {
        if (scanning.get()) {
            skippedTicks.incrementAndGet();
            logger.debug("Previous scan still running, skipping this monitoring tick");
            return;
        }
        checkConnectivity().onComplete(ar -> {
            if (ar.failed()) {
                logger.debug("Connectivity check failed, scanning anyway: {}", ar.cause().getMessage());
            } else if (!ar.result().connected()) {
                logger.debug("No network, skipping this monitoring tick");
                return;
            }
            if (!scanning.get()) {
                // failures are already logged and published by scan()
                scan(device -> { });
            }
        });
    }

    /**
     * Runs on a worker thread and publishes the outcome from there.
     */
    private ScanReport runScan(Consumer<NetworkDevice> onDevice) throws IOException, InterruptedException {
        ScanReport report;
        try {
            report = performScan(onDevice);
        } catch (IOException | InterruptedException | RuntimeException e) {
            logger.warn("Discovery scan failed: {}", e.getMessage());
            events.publishBlocking(DiscoveryEvent.failed(String.valueOf(e.getMessage()), clock.instant()));
            throw e;
        }
        logger.info("Discovery scan completed in {} ms - {} hosts probed, {} devices found",
                report.getDuration().toMillis(), report.hostsProbed(), report.devicesFound().size());
        events.publishBlocking(DiscoveryEvent.completed(report, clock.instant()));
        return report;
    }

    private ScanReport performScan(Consumer<NetworkDevice> onDevice) throws IOException, InterruptedException {
        Instant startedAt = clock.instant();
        Set<String> hosts = new LinkedHashSet<>(prober.candidateHosts());
        hosts.addAll(settings.extraHosts());

        Set<String> seen = ConcurrentHashMap.newKeySet();
        List<NetworkDevice> found = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger threadCounter = new AtomicInteger(0);
        ExecutorService probePool = Executors.newFixedThreadPool(settings.probeThreads(), r -> {
            Thread t = new Thread(r, "netdrive-probe-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<java.util.concurrent.Future<?>> probes = new ArrayList<>();
            for (String host : hosts) {
                probes.add(probePool.submit(() -> probeHost(host).ifPresent(device -> {
                    DeviceRegistry.Observation observation = registry.observe(device);
                    seen.add(device.getIpAddress());
                    found.add(observation.device());
                    if (observation.newDevice() || observation.recovered()) {
                        events.publish(DiscoveryEvent.device(DiscoveryEvent.Type.DEVICE_FOUND, observation.device(),
                                clock.instant()));
                    }
                    deliver(onDevice, observation.device());
                })));
            }
            for (java.util.concurrent.Future<?> probe : probes) {
                try {
                    probe.get();
                } catch (ExecutionException e) {
                    logger.warn("Probe task failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
                }
            }
        } finally {
            probePool.shutdownNow();
        }

        DeviceRegistry.CycleOutcome outcome = registry.completeCycle(seen);
        Instant finishedAt = clock.instant();
        outcome.stale().forEach(d -> events.publish(
                DiscoveryEvent.device(DiscoveryEvent.Type.DEVICE_STALE, d, finishedAt)));
        outcome.unreachable().forEach(d -> events.publishBlocking(
                DiscoveryEvent.device(DiscoveryEvent.Type.DEVICE_UNREACHABLE, d, finishedAt)));

        return new ScanReport(startedAt, finishedAt, hosts.size(), List.copyOf(found),
                outcome.stale(), outcome.unreachable());
    }

    private Optional<NetworkDevice> probeHost(String host) {
        List<Integer> open = new ArrayList<>();
        for (int port : settings.ports()) {
            if (Thread.currentThread().isInterrupted()) {
                return Optional.empty();
            }
            if (prober.isPortOpen(host, port, settings.probeTimeout())) {
                open.add(port);
            }
        }
        if (open.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> hostname = prober.resolveHostname(host);
        List<AdvertisedService> services = DeviceClassifier.toServices(open);
        NetworkDevice device = NetworkDevice.builder()
                .name(hostname.orElse(host))
                .ipAddress(host)
                .hostname(hostname.orElse(null))
                .services(services)
                .type(DeviceClassifier.classify(host, services))
                .reachable(true)
                .lastSeen(clock.instant())
                .build();
        logger.debug("Found {} at {} with ports {}", device.getType(), host, open);
        return Optional.of(device);
    }

    private record StatusChange(NetworkStatus status, boolean restored) {
    }

    private static void deliver(Consumer<NetworkDevice> onDevice, NetworkDevice device) {
        try {
            onDevice.accept(device);
        } catch (RuntimeException e) {
            logger.warn("Device consumer failed for {}: {}", device.getIpAddress(), e.getMessage(), e);
        }
    }
}
