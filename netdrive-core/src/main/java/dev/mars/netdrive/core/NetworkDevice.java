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

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A device found on the local network, with the services it exposes.
 *
 * <p>Instances are immutable. The discovery registry replaces a device with a
 * refreshed copy on every scan cycle via {@link #withObservation} or
 * {@link #withMissedCycle()}.</p>
 */
public class NetworkDevice {

    private final String name;
    private final DeviceType type;
    private final String ipAddress;
    private final String hostname;
    private final List<AdvertisedService> services;
    private final boolean reachable;
    private final Instant lastSeen;
    private final int missedCycles;

    private NetworkDevice(Builder builder) {
        this.name = builder.name;
        this.type = builder.type;
        this.ipAddress = builder.ipAddress;
        this.hostname = builder.hostname;
        this.services = List.copyOf(builder.services);
        this.reachable = builder.reachable;
        this.lastSeen = builder.lastSeen;
        this.missedCycles = builder.missedCycles;
    }

    public String getName() { return name; }
    public DeviceType getType() { return type; }
    public String getIpAddress() { return ipAddress; }
    public Optional<String> getHostname() { return Optional.ofNullable(hostname); }
    public List<AdvertisedService> getServices() { return services; }
    public boolean isReachable() { return reachable; }
    public Instant getLastSeen() { return lastSeen; }
    public int getMissedCycles() { return missedCycles; }

    /**
     * A stale device was not seen by the most recent scan but has not yet been
     * declared unreachable.
     */
    public boolean isStale() {
        return reachable && missedCycles > 0;
    }

    public boolean offers(Protocol protocol) {
        return services.stream().anyMatch(s -> s.protocol() == protocol);
    }

    /**
     * Copy of this device that was missed by one more scan cycle. The device
     * becomes unreachable once {@code unreachableAfter} consecutive cycles are missed.
     */
    public NetworkDevice withMissedCycle(int unreachableAfter) {
        int missed = missedCycles + 1;
        return toBuilder()
                .missedCycles(missed)
                .reachable(missed < unreachableAfter)
                .build();
    }

    /**
     * Copy of this device refreshed by a new sighting.
     */
    public NetworkDevice withObservation(NetworkDevice seen) {
        return toBuilder()
                .name(seen.name)
                .type(seen.type)
                .hostname(seen.hostname != null ? seen.hostname : hostname)
                .services(seen.services)
                .reachable(true)
                .lastSeen(seen.lastSeen)
                .missedCycles(0)
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .type(type)
                .ipAddress(ipAddress)
                .hostname(hostname)
                .services(services)
                .reachable(reachable)
                .lastSeen(lastSeen)
                .missedCycles(missedCycles);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private DeviceType type = DeviceType.UNKNOWN;
        private String ipAddress;
        private String hostname;
        private List<AdvertisedService> services = List.of();
        private boolean reachable = true;
        private Instant lastSeen = Instant.now();
        private int missedCycles;

        public Builder name(String name) { this.name = name; return this; }
        public Builder type(DeviceType type) { this.type = type; return this; }
        public Builder ipAddress(String ipAddress) { this.ipAddress = ipAddress; return this; }
        public Builder hostname(String hostname) { this.hostname = hostname; return this; }
        public Builder services(List<AdvertisedService> services) { this.services = services; return this; }
        public Builder reachable(boolean reachable) { this.reachable = reachable; return this; }
        public Builder lastSeen(Instant lastSeen) { this.lastSeen = lastSeen; return this; }
        public Builder missedCycles(int missedCycles) { this.missedCycles = missedCycles; return this; }

        public NetworkDevice build() {
            Objects.requireNonNull(ipAddress, "ipAddress cannot be null");
            Objects.requireNonNull(type, "type cannot be null");
            Objects.requireNonNull(services, "services cannot be null");
            Objects.requireNonNull(lastSeen, "lastSeen cannot be null");
            if (name == null) {
                name = hostname != null ? hostname : ipAddress;
            }
            return new NetworkDevice(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NetworkDevice that = (NetworkDevice) o;
        return Objects.equals(ipAddress, that.ipAddress);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ipAddress);
    }

    @Override
    public String toString() {
        return "NetworkDevice{" +
                "name='" + name + '\'' +
                ", ip=" + ipAddress +
                ", type=" + type +
                ", services=" + services.size() +
                ", reachable=" + reachable +
                ", missedCycles=" + missedCycles +
                '}';
    }
}
