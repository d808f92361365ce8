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

/**
 * The machine's attachment to the local network, as seen by discovery.
 *
 * @param interfaceName  name of the interface carrying the local address, {@code null} when disconnected
 * @param localAddress   this machine's site-local IPv4 address
 * @param gatewayAddress assumed gateway: the first host address of the subnet
 * @param subnet         the subnet in CIDR notation, e.g. {@code 192.168.1.0/24}
 */
public record NetworkStatus(boolean connected, String interfaceName, String localAddress,
                            String gatewayAddress, String subnet) {

    public static NetworkStatus disconnected() {
        return new NetworkStatus(false, null, null, null, null);
    }

    public static NetworkStatus connected(String interfaceName, String localAddress, String gatewayAddress,
                                          String subnet) {
        return new NetworkStatus(true, interfaceName, localAddress, gatewayAddress, subnet);
    }

    /**
     * Whether moving from this status to {@code next} puts the machine on a network it
     * was not on before: reconnecting after a loss, or joining a different subnet.
     */
    public boolean isRestoredBy(NetworkStatus next) {
        if (!next.connected) {
            return false;
        }
        return !connected || !next.subnet.equals(subnet);
    }
}
