package dev.mars.netdrive.core;

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
 * Classification of a failure, carried on exceptions, transfer items and events.
 * Only the transient kinds are retried automatically by the transfer queue.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum ErrorKind {

    /** Host unreachable, connection refused or dropped mid-transfer. */
    CONNECTION(true),

    /** Connect or read timeout. */
    TIMEOUT(true),

    /** Credentials rejected by the server. */
    AUTHENTICATION(false),

    /** Server replied with an unexpected or error status. */
    PROTOCOL(true),

    /** Local filesystem failure. */
    IO(false),

    /** Checksum verification failed after the bytes were moved. */
    INTEGRITY(false),

    /** Cancelled by the user. */
    CANCELLED(false),

    /** No connector is available for the requested protocol. */
    UNSUPPORTED_PROTOCOL(false);

    private final boolean transientFailure;

    ErrorKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    /**
     * @return {@code true} if a failure of this kind may succeed on a later attempt
     */
    public boolean isTransient() {
        return transientFailure;
    }
}
