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
 * Exception thrown by a protocol connector when connecting, listing or moving bytes fails.
 * The {@link ErrorKind} decides whether the transfer queue may retry the operation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ConnectorException extends NetDriveException {

    private final ErrorKind kind;

    public ConnectorException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ConnectorException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isTransient() {
        return kind.isTransient();
    }

    public static ConnectorException cancelled(String what) {
        return new ConnectorException(ErrorKind.CANCELLED, what + " cancelled");
    }

    @Override
    public String getMessage() {
        return String.format("[%s] %s", kind, super.getMessage());
    }
}
