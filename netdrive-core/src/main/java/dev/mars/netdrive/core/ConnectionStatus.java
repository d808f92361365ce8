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
 * State of a live connection behind a virtual drive. A drive is online exactly
 * when its connection is CONNECTED.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum ConnectionStatus {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    ERROR;

    /**
     * <pre>
     *   DISCONNECTED → CONNECTING
     *   CONNECTING   → CONNECTED, ERROR, DISCONNECTED
     *   CONNECTED    → DISCONNECTED, ERROR
     *   ERROR        → CONNECTING, DISCONNECTED
     * </pre>
     */
    public boolean canTransitionTo(ConnectionStatus target) {
        return switch (this) {
            case DISCONNECTED -> target == CONNECTING;
            case CONNECTING -> target == CONNECTED || target == ERROR || target == DISCONNECTED;
            case CONNECTED -> target == DISCONNECTED || target == ERROR;
            case ERROR -> target == CONNECTING || target == DISCONNECTED;
        };
    }

    public ConnectionStatus[] getValidTransitions() {
        return switch (this) {
            case DISCONNECTED -> new ConnectionStatus[]{CONNECTING};
            case CONNECTING -> new ConnectionStatus[]{CONNECTED, ERROR, DISCONNECTED};
            case CONNECTED -> new ConnectionStatus[]{DISCONNECTED, ERROR};
            case ERROR -> new ConnectionStatus[]{CONNECTING, DISCONNECTED};
        };
    }
}
