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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.InterfaceAddress;
import java.net.NetworkInterface;
import java.net.Socket;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@link HostProber} backed by {@link NetworkInterface} enumeration and plain TCP connects.
 *
 * <p>Every site-local IPv4 interface contributes the hosts of its subnet; prefixes
 * wider than /24 are narrowed to the /24 around the interface address.</p>
 */
public class SocketHostProber implements HostProber {

    private static final Logger logger = LoggerFactory.getLogger(SocketHostProber.class);
    private static final int MIN_PREFIX = 24;

    @Override
    public List<String> candidateHosts() throws IOException {
        Set<String> hosts = new LinkedHashSet<>();
        Set<String> own = new LinkedHashSet<>();
        for (NetworkInterface nif : Collections.list(NetworkInterface.getNetworkInterfaces())) {
            if (!nif.isUp() || nif.isLoopback() || nif.isVirtual()) {
                continue;
            }
            for (InterfaceAddress address : nif.getInterfaceAddresses()) {
                InetAddress inet = address.getAddress();
                if (!(inet instanceof Inet4Address) || !inet.isSiteLocalAddress()) {
                    continue;
                }
                own.add(inet.getHostAddress());
                int prefix = Math.max(MIN_PREFIX, Math.min(30, address.getNetworkPrefixLength()));
                hosts.addAll(subnetHosts(inet.getAddress(), prefix));
                logger.debug("Scanning {}/{} on interface {}", inet.getHostAddress(), prefix, nif.getName());
            }
        }
        hosts.removeAll(own);
        return new ArrayList<>(hosts);
    }

    @Override
    public NetworkStatus networkStatus() throws IOException {
        for (NetworkInterface nif : Collections.list(NetworkInterface.getNetworkInterfaces())) {
            if (!nif.isUp() || nif.isLoopback() || nif.isVirtual()) {
                continue;
            }
            for (InterfaceAddress address : nif.getInterfaceAddresses()) {
                InetAddress inet = address.getAddress();
                if (inet instanceof Inet4Address && inet.isSiteLocalAddress()) {
                    return describe(nif.getName(), inet.getAddress(), address.getNetworkPrefixLength());
                }
            }
        }
        return NetworkStatus.disconnected();
    }

    @Override
    public boolean isPortOpen(String host, int port, Duration timeout) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), (int) timeout.toMillis());
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    @Override
    public Optional<String> resolveHostname(String ipAddress) {
        try {
            InetAddress address = InetAddress.getByName(ipAddress);
            String name = address.getCanonicalHostName();
            return name.equals(ipAddress) ? Optional.empty() : Optional.of(name);
        } catch (UnknownHostException e) {
            logger.debug("Reverse lookup failed for {}: {}", ipAddress, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Status for an interface address. The gateway is assumed to be the first host of the subnet.
     */
    static NetworkStatus describe(String interfaceName, byte[] address, int prefixLength) {
        int prefix = Math.max(MIN_PREFIX, Math.min(30, prefixLength));
        int ip = toInt(address);
        int network = ip & mask(prefix);
        return NetworkStatus.connected(interfaceName, toDotted(ip), toDotted(network + 1),
                toDotted(network) + "/" + prefix);
    }

    /**
     * Host addresses of the subnet containing {@code address}, excluding the network and broadcast addresses.
     */
    static List<String> subnetHosts(byte[] address, int prefixLength) {
        int network = toInt(address) & mask(prefixLength);
        int size = 1 << (32 - prefixLength);
        List<String> hosts = new ArrayList<>(Math.max(0, size - 2));
        for (int i = 1; i < size - 1; i++) {
            hosts.add(toDotted(network + i));
        }
        return hosts;
    }

    private static int toInt(byte[] address) {
        return ((address[0] & 0xFF) << 24) | ((address[1] & 0xFF) << 16)
                | ((address[2] & 0xFF) << 8) | (address[3] & 0xFF);
    }

    private static int mask(int prefixLength) {
        return prefixLength == 0 ? 0 : -1 << (32 - prefixLength);
    }

    private static String toDotted(int address) {
        return ((address >>> 24) & 0xFF) + "." + ((address >>> 16) & 0xFF) + "."
                + ((address >>> 8) & 0xFF) + "." + (address & 0xFF);
    }
}
