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

import dev.mars.netdrive.config.NetDriveConfiguration;

import java.time.Duration;
import java.util.List;

/**
 * @param ports        ports probed on every candidate host
 * @param probeTimeout TCP connect timeout per probe
 * @param probeThreads size of the per-scan probe pool
 * @param minInterval  lower bound for the continuous monitoring interval
 * @param extraHosts   hosts probed in addition to the local subnets
 */
public record DiscoverySettings(List<Integer> ports, Duration probeTimeout, int probeThreads,
                                Duration minInterval, List<String> extraHosts) {

    public DiscoverySettings {
        ports = List.copyOf(ports);
        extraHosts = List.copyOf(extraHosts);
        if (probeThreads < 1) {
            throw new IllegalArgumentException("probeThreads must be at least 1");
        }
    }

    public static DiscoverySettings from(NetDriveConfiguration configuration) {
        return new DiscoverySettings(DeviceClassifier.WELL_KNOWN_PORTS, configuration.getProbeTimeout(),
                configuration.getProbeThreads(), configuration.getDiscoveryMinInterval(),
                configuration.getExtraHosts());
    }
}
