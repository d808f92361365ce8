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

import dev.mars.netdrive.core.ConnectionConfig;

/**
 * An established connection to one remote endpoint, owned by whoever called
 * {@link ProtocolConnector#connect}. Sessions are not shared between concurrent
 * transfers unless the connector documents that it is safe.
 */
public interface ConnectorSession {

    String getId();

    ConnectionConfig getConfig();

    /**
     * Cheap liveness probe used by drive health checks. Must not throw.
     */
    boolean isAlive();
}
