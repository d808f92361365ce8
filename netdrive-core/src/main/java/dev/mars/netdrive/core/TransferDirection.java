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
 * Direction of a transfer relative to the local machine.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum TransferDirection {

    /** Remote drive to local filesystem. */
    DOWNLOAD("Remote -> Local"),

    /** Local filesystem to remote drive. */
    UPLOAD("Local -> Remote");

    private final String description;

    TransferDirection(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
