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

import dev.mars.netdrive.core.exceptions.ConnectorException;

/**
 * Cooperative cancellation signal checked by connectors between chunks.
 */
public interface CancellationToken {

    CancellationToken NONE = () -> false;

    boolean isCancellationRequested();

    /**
     * @throws ConnectorException of kind CANCELLED once cancellation was requested
     */
    default void throwIfCancelled(String operation) throws ConnectorException {
        if (isCancellationRequested()) {
            throw ConnectorException.cancelled(operation);
        }
    }
}
