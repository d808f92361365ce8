package dev.mars.netdrive.drive;

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

import dev.mars.netdrive.core.TransferDirection;

import java.nio.file.Path;

/**
 * One file a sync decided to move, and why.
 */
public record PlannedTransfer(TransferDirection direction, String relativePath, Path localPath,
                              String remotePath, long size, Reason reason) {

    public enum Reason {
        MISSING, SIZE_CHANGED, NEWER
    }
}
