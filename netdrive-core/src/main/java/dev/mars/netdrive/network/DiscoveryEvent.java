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

import java.time.Instant;

/**
 * Notification from network discovery. Device events carry the device;
 * SCAN_COMPLETED carries the report, SCAN_FAILED the error message and the
 * NETWORK_ events the new network status.
 */
public record DiscoveryEvent(Type type, String ipAddress, NetworkDevice device, ScanReport report,
                             NetworkStatus network, String message, Instant timestamp) {

    public enum Type {
        DEVICE_FOUND, DEVICE_STALE, DEVICE_UNREACHABLE, SCAN_COMPLETED, SCAN_FAILED,
        NETWORK_CONNECTED, NETWORK_DISCONNECTED
    }

    public static DiscoveryEvent device(Type type, NetworkDevice device, Instant timestamp) {
        return new DiscoveryEvent(type, device.getIpAddress(), device, null, null, null, timestamp);
    }

    public static DiscoveryEvent completed(ScanReport report, Instant timestamp) {
        return new DiscoveryEvent(Type.SCAN_COMPLETED, null, null, report, null, null, timestamp);
    }

    public static DiscoveryEvent failed(String message, Instant timestamp) {
        return new DiscoveryEvent(Type.SCAN_FAILED, null, null, null, null, message, timestamp);
    }

    public static DiscoveryEvent network(NetworkStatus status, Instant timestamp) {
        Type type = status.connected() ? Type.NETWORK_CONNECTED : Type.NETWORK_DISCONNECTED;
        return new DiscoveryEvent(type, status.localAddress(), null, null, status, null, timestamp);
    }
}
