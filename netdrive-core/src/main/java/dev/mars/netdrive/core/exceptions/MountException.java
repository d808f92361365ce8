package dev.mars.netdrive.core.exceptions;

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

import dev.mars.netdrive.core.ErrorKind;

/**
 * Exception thrown when a virtual drive cannot be mounted or reconnected.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class MountException extends NetDriveException {

    private final String driveId;
    private final ErrorKind kind;

    public MountException(String driveId, ErrorKind kind, String message) {
        super(message);
        this.driveId = driveId;
        this.kind = kind;
    }

    public MountException(String driveId, ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.driveId = driveId;
        this.kind = kind;
    }

    public String getDriveId() {
        return driveId;
    }

    public ErrorKind getKind() {
        return kind;
    }

    @Override
    public String getMessage() {
        return String.format("Mount of drive %s failed (%s): %s", driveId, kind, super.getMessage());
    }
}
