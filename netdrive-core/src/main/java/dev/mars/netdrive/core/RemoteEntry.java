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

import java.time.Instant;

/**
 * One entry of a remote directory listing.
 *
 * @param name        file or directory name without path
 * @param path        absolute remote path
 * @param size        size in bytes, 0 for directories
 * @param directory   whether the entry is a directory
 * @param modifiedAt  last modification time, or {@code null} if the server does not report it
 */
public record RemoteEntry(
        @JsonProperty("name") String name,
        @JsonProperty("path") String path,
        @JsonProperty("size") long size,
        @JsonProperty("isDirectory") boolean directory,
        @JsonProperty("modifiedAt") Instant modifiedAt) {

    public static RemoteEntry file(String parent, String name, long size, Instant modifiedAt) {
        return new RemoteEntry(name, RemotePaths.join(parent, name), size, false, modifiedAt);
    }

    public static RemoteEntry directory(String parent, String name, Instant modifiedAt) {
        return new RemoteEntry(name, RemotePaths.join(parent, name), 0L, true, modifiedAt);
    }
}
