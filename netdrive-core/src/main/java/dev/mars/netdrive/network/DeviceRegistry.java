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

import dev.mars.netdrive.core.NetworkDevice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Devices known to discovery, keyed by IP address.
 *
 * <p>A device missed by a scan cycle stays listed as stale. After
 * {@code unreachableAfterCycles} consecutive misses it is marked unreachable, still
 * without being removed. Removal only happens through {@link #prune(Duration, Instant)}.</p>
 */
public class DeviceRegistry {

    private static final Logger logger = LoggerFactory.getLogger(DeviceRegistry.class);

    private final int unreachableAfterCycles;
    private final Map<String, NetworkDevice> devices = new LinkedHashMap<>();

    public DeviceRegistry(int unreachableAfterCycles) {
        if (unreachableAfterCycles < 1) {
            throw new IllegalArgumentException("unreachableAfterCycles must be at least 1");
        }
        this.unreachableAfterCycles = unreachableAfterCycles;
    }

    /**
     * Record a sighting.
     *
     * @return the stored device; a new entry or a refreshed copy of the known one
     */
    public synchronized Observation observe(NetworkDevice seen) {
        NetworkDevice known = devices.get(seen.getIpAddress());
        NetworkDevice stored = known == null ? seen : known.withObservation(seen);
        devices.put(stored.getIpAddress(), stored);
        return new Observation(stored, known == null, known != null && !known.isReachable());
    }

    /**
     * Close a scan cycle: every reachable device not in {@code seenAddresses} misses one more cycle.
     */
    public synchronized CycleOutcome completeCycle(Set<String> seenAddresses) {
        List<NetworkDevice> stale = new ArrayList<>();
        List<NetworkDevice> unreachable = new ArrayList<>();
        for (Map.Entry<String, NetworkDevice> entry : devices.entrySet()) {
            NetworkDevice device = entry.getValue();
            if (seenAddresses.contains(entry.getKey()) || !device.isReachable()) {
                continue;
            }
            NetworkDevice missed = device.withMissedCycle(unreachableAfterCycles);
            entry.setValue(missed);
            if (missed.isReachable()) {
                stale.add(missed);
            } else {
                unreachable.add(missed);
                logger.info("Device {} unreachable after {} missed scans", missed.getIpAddress(), missed.getMissedCycles());
            }
        }
        return new CycleOutcome(stale, unreachable);
    }

    /**
     * Remove devices not seen since {@code now - olderThan}.
     *
     * @return the removed devices
     */
    public synchronized List<NetworkDevice> prune(Duration olderThan, Instant now) {
        Instant cutoff = now.minus(olderThan);
        List<NetworkDevice> removed = new ArrayList<>();
        Iterator<NetworkDevice> it = devices.values().iterator();
        while (it.hasNext()) {
            NetworkDevice device = it.next();
            if (device.getLastSeen().isBefore(cutoff)) {
                removed.add(device);
                it.remove();
            }
        }
        if (!removed.isEmpty()) {
            logger.info("Pruned {} devices not seen since {}", removed.size(), cutoff);
        }
        return removed;
    }

    public synchronized Optional<NetworkDevice> get(String ipAddress) {
        return Optional.ofNullable(devices.get(ipAddress));
    }

    public synchronized List<NetworkDevice> snapshot() {
        List<NetworkDevice> copy = new ArrayList<>(devices.values());
        copy.sort(Comparator.comparing(NetworkDevice::getIpAddress));
        return List.copyOf(copy);
    }

    public synchronized int size() {
        return devices.size();
    }

    public synchronized void clear() {
        devices.clear();
    }

    public int getUnreachableAfterCycles() {
        return unreachableAfterCycles;
    }

    /**
     * @param device    the stored device after the sighting
     * @param newDevice first sighting ever
     * @param recovered the device was unreachable before this sighting
     */
    public record Observation(NetworkDevice device, boolean newDevice, boolean recovered) {
    }

    public record CycleOutcome(List<NetworkDevice> stale, List<NetworkDevice> unreachable) {
    }
}
