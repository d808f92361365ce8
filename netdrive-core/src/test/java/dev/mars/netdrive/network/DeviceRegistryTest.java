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

package dev.mars.netdrive.network;

import dev.mars.netdrive.core.DeviceType;
import dev.mars.netdrive.core.NetworkDevice;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DeviceRegistryTest {

    private static final Instant T0 = Instant.parse("2025-05-01T12:00:00Z");

    private DeviceRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DeviceRegistry(3);
    }

    private static NetworkDevice device(String ip, Instant seen) {
        return NetworkDevice.builder()
                .ipAddress(ip)
                .type(DeviceType.NAS)
                .services(DeviceClassifier.toServices(List.of(445, 5000)))
                .lastSeen(seen)
                .build();
    }

    @Test
    void testFirstSightingIsNew() {
        DeviceRegistry.Observation first = registry.observe(device("192.168.1.10", T0));
        DeviceRegistry.Observation again = registry.observe(device("192.168.1.10", T0.plusSeconds(5)));

        assertTrue(first.newDevice());
        assertFalse(again.newDevice());
        assertFalse(again.recovered());
        assertEquals(1, registry.size());
        assertEquals(T0.plusSeconds(5), registry.get("192.168.1.10").orElseThrow().getLastSeen());
    }

    @Test
    void testMissedCyclesGoStaleThenUnreachable() {
        registry.observe(device("192.168.1.10", T0));
        registry.observe(device("192.168.1.11", T0));

        DeviceRegistry.CycleOutcome first = registry.completeCycle(Set.of("192.168.1.11"));
        assertEquals(1, first.stale().size());
        assertTrue(first.unreachable().isEmpty());
        assertTrue(registry.get("192.168.1.10").orElseThrow().isStale());

        registry.completeCycle(Set.of("192.168.1.11"));
        DeviceRegistry.CycleOutcome third = registry.completeCycle(Set.of("192.168.1.11"));

        assertTrue(third.stale().isEmpty());
        assertEquals(1, third.unreachable().size());
        NetworkDevice lost = registry.get("192.168.1.10").orElseThrow();
        assertFalse(lost.isReachable());
        assertEquals(3, lost.getMissedCycles());
        assertEquals(2, registry.size(), "Unreachable devices stay listed");

        DeviceRegistry.CycleOutcome fourth = registry.completeCycle(Set.of());
        assertTrue(fourth.unreachable().isEmpty(), "Already unreachable devices are not reported again");
    }

    @Test
    void testSightingRecoversUnreachableDevice() {
        registry.observe(device("192.168.1.10", T0));
        for (int i = 0; i < 3; i++) {
            registry.completeCycle(Set.of());
        }

        DeviceRegistry.Observation back = registry.observe(device("192.168.1.10", T0.plusSeconds(60)));

        assertTrue(back.recovered());
        assertTrue(back.device().isReachable());
        assertEquals(0, back.device().getMissedCycles());
    }

    @Test
    void testPruneRemovesOldDevices() {
        registry.observe(device("192.168.1.10", T0));
        registry.observe(device("192.168.1.11", T0.plus(Duration.ofHours(2))));

        List<NetworkDevice> removed = registry.prune(Duration.ofHours(1), T0.plus(Duration.ofHours(2)));

        assertEquals(1, removed.size());
        assertEquals("192.168.1.10", removed.get(0).getIpAddress());
        assertEquals(1, registry.size());
    }

    @Test
    void testSnapshotIsSortedAndImmutable() {
        registry.observe(device("192.168.1.20", T0));
        registry.observe(device("192.168.1.10", T0));

        List<NetworkDevice> snapshot = registry.snapshot();

        assertEquals("192.168.1.10", snapshot.get(0).getIpAddress());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(device("10.0.0.1", T0)));
    }

    @Test
    void testRejectsNonPositiveThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new DeviceRegistry(0));
    }
}
