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

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Low-level network access used by discovery. Replaced by a deterministic fake in tests.
 */
public interface HostProber {

    /**
     * Candidate IPv4 addresses on the local subnets, excluding this machine's own addresses.
     *
     * @throws IOException if the network interfaces cannot be enumerated
     */
    List<String> candidateHosts() throws IOException;

    /**
     * TCP connect probe.
     */
    boolean isPortOpen(String host, int port, Duration timeout);

    Optional<String> resolveHostname(String ipAddress);

    /**
     * Current attachment to the local network; {@link NetworkStatus#disconnected()} when
     * no site-local IPv4 interface is up.
     *
     * @throws IOException if the network interfaces cannot be enumerated
     */
    NetworkStatus networkStatus() throws IOException;
}
