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

import dev.mars.netdrive.core.ErrorKind;
import dev.mars.netdrive.core.exceptions.ConnectorException;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

/**
 * Maps library and JDK failures onto {@link ErrorKind}.
 */
public final class ConnectorErrors {

    private ConnectorErrors() {
    }

    /**
     * Classify a failure by walking its cause chain for well-known network exceptions.
     *
     * @param fallback kind used when nothing in the chain is recognised
     */
    public static ErrorKind classify(Throwable error, ErrorKind fallback) {
        Throwable t = error;
        int depth = 0;
        while (t != null && depth++ < 10) {
            if (t instanceof ConnectorException ce) {
                return ce.getKind();
            }
            if (t instanceof SocketTimeoutException || t instanceof TimeoutException
                    || t instanceof InterruptedIOException) {
                return ErrorKind.TIMEOUT;
            }
            if (t instanceof ConnectException || t instanceof UnknownHostException
                    || t instanceof NoRouteToHostException || t instanceof SocketException) {
                return ErrorKind.CONNECTION;
            }
            t = t.getCause();
        }
        return fallback;
    }

    /**
     * Wrap a remote-side failure, keeping an existing {@link ConnectorException} as is.
     */
    public static ConnectorException remote(String message, Throwable error) {
        if (error instanceof ConnectorException ce) {
            return ce;
        }
        return new ConnectorException(classify(error, ErrorKind.PROTOCOL), message + ": " + error.getMessage(), error);
    }

    /**
     * Wrap a local filesystem failure.
     */
    public static ConnectorException local(String message, IOException error) {
        return new ConnectorException(ErrorKind.IO, message + ": " + error.getMessage(), error);
    }
}
