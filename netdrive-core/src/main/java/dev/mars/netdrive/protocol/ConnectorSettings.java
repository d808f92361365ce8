package dev.mars.netdrive.protocol;

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

import java.time.Duration;

/**
 * Tuning shared by all connectors: copy buffer size and progress reporting gates.
 *
 * @param bufferSize       bytes per read/write chunk
 * @param progressBytes    minimum byte delta between two progress reports
 * @param progressInterval minimum time between two progress reports
 */
public record ConnectorSettings(int bufferSize, long progressBytes, Duration progressInterval) {

    public static final ConnectorSettings DEFAULTS =
            new ConnectorSettings(64 * 1024, 256 * 1024, Duration.ofMillis(250));

    public ConnectorSettings {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive");
        }
        if (progressBytes < 0 || progressInterval == null || progressInterval.isNegative()) {
            throw new IllegalArgumentException("progress gates must not be negative");
        }
    }
}
