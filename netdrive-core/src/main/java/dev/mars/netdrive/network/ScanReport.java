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

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Summary of one finished discovery scan.
 */
public record ScanReport(Instant startedAt, Instant finishedAt, int hostsProbed,
                         List<NetworkDevice> devicesFound, List<NetworkDevice> staleDevices,
                         List<NetworkDevice> unreachableDevices) {

    public Duration getDuration() {
        return Duration.between(startedAt, finishedAt);
    }
}
