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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A service port found open on a discovered device.
 *
 * @param name     short service label, e.g. "smb" or "ssh"
 * @param port     TCP port the service answered on
 * @param secure   whether the service is TLS or SSH based
 * @param protocol drive protocol the service can be mounted with, or {@code null}
 */
public record AdvertisedService(
        @JsonProperty("name") String name,
        @JsonProperty("port") int port,
        @JsonProperty("secure") boolean secure,
        @JsonProperty("protocol") Protocol protocol) {

    public boolean isMountable() {
        return protocol != null;
    }
}
