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
import dev.mars.netdrive.core.DeviceType;
import dev.mars.netdrive.core.Protocol;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps open ports to advertised services and guesses a device type from them.
 */
public final class DeviceClassifier {

    public static final List<Integer> WELL_KNOWN_PORTS = List.of(21, 22, 80, 443, 445, 2049, 5000, 5001, 8080);

    private static final Set<Integer> WEB_PORTS = Set.of(80, 443, 8080);
    private static final Set<Integer> NAS_ADMIN_PORTS = Set.of(5000, 5001);

    private DeviceClassifier() {
    }

    public static List<AdvertisedService> toServices(Collection<Integer> openPorts) {
        List<AdvertisedService> services = new ArrayList<>();
        for (int port : openPorts) {
            services.add(new AdvertisedService(serviceName(port), port, isSecurePort(port), Protocol.forServicePort(port)));
        }
        return services;
    }

    /**
     * NAS when it shares files (SMB or NFS) and exposes a NAS admin port; SERVER when it
     * offers SSH or FTP; ROUTER on a {@code .1} gateway address exposing only web ports;
     * COMPUTER otherwise.
     */
    public static DeviceType classify(String ipAddress, Collection<AdvertisedService> services) {
        Set<Integer> ports = services.stream().map(AdvertisedService::port).collect(Collectors.toSet());
        if (ports.isEmpty()) {
            return DeviceType.UNKNOWN;
        }
        boolean fileSharing = ports.contains(445) || ports.contains(2049);
        if (fileSharing && ports.stream().anyMatch(NAS_ADMIN_PORTS::contains)) {
            return DeviceType.NAS;
        }
        if (ports.contains(22) || ports.contains(21)) {
            return DeviceType.SERVER;
        }
        if (ipAddress.endsWith(".1") && WEB_PORTS.containsAll(ports)) {
            return DeviceType.ROUTER;
        }
        return DeviceType.COMPUTER;
    }

    static String serviceName(int port) {
        return switch (port) {
            case 21 -> "FTP";
            case 22 -> "SSH";
            case 80 -> "HTTP";
            case 443 -> "HTTPS";
            case 445 -> "SMB";
            case 2049 -> "NFS";
            case 5000 -> "NAS Admin";
            case 5001 -> "NAS Admin (HTTPS)";
            case 8080 -> "WebDAV";
            default -> "Port " + port;
        };
    }

    static boolean isSecurePort(int port) {
        return port == 22 || port == 443 || port == 5001;
    }
}
