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
import io.vertx.core.Future;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bridges Vert.x futures into the blocking connector contract. Only ever called
 * from worker or caller threads, never from an event loop.
 */
final class VertxBlocking {

    private VertxBlocking() {
    }

    static <T> T await(Future<T> future, long timeoutMs, String operation) throws ConnectorException {
        try {
            return future.toCompletionStage().toCompletableFuture().get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ConnectorException(ConnectorErrors.classify(cause, ErrorKind.PROTOCOL),
                    operation + " failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new ConnectorException(ErrorKind.TIMEOUT, operation + " timed out after " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ConnectorException.cancelled(operation);
        }
    }

    /**
     * Same as {@link #await} for use inside stream adapters, which may only throw IOException.
     */
    static <T> T awaitIo(Future<T> future, long timeoutMs) throws IOException {
        try {
            return future.toCompletionStage().toCompletableFuture().get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw cause instanceof IOException io ? io : new IOException(cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new SocketTimeoutException("No progress within " + timeoutMs + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for the server");
        }
    }
}
