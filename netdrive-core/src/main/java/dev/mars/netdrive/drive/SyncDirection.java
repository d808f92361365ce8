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

/**
 * Which side of a drive sync is authoritative.
 */
public enum SyncDirection {
    /** Local root to remote root. */
    UPLOAD,
    /** Remote root to local root. */
    DOWNLOAD,
    /** Newest copy wins on each side; files missing on one side are copied over. */
    BIDIRECTIONAL
}
