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

import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClientRequest;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Blocking writer for a Vert.x request body. Each write waits for the previous
 * chunk to be accepted, which keeps the upload under the socket's own backpressure.
 */
class HttpBodyOutputStream extends OutputStream {

    private final HttpClientRequest request;
    private final long writeTimeoutMs;
    private boolean closed;

    HttpBodyOutputStream(HttpClientRequest request, long writeTimeoutMs) {
        this.request = request;
        this.writeTimeoutMs = writeTimeoutMs;
    }

    @Override
    public void write(int b) throws IOException {
        write(new byte[]{(byte) b}, 0, 1);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        if (closed) {
            throw new IOException("Request body already ended");
        }
        Buffer chunk = Buffer.buffer(len);
        chunk.appendBytes(b, off, len);
        VertxBlocking.awaitIo(request.write(chunk), writeTimeoutMs);
    }

    /**
     * Ends the request body. Use {@link #abort()} instead when the upload is abandoned.
     */
    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            VertxBlocking.awaitIo(request.end(), writeTimeoutMs);
        }
    }

    void abort() {
        if (!closed) {
            closed = true;
            request.reset();
        }
    }
}
