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

import io.vertx.core.Context;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClientResponse;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Blocking view of a paused Vert.x response body. Demand is issued one buffer at a
 * time on the response's context, so memory stays bounded by a single chunk.
 *
 * <p>Must be constructed on the response's event loop, before any body data arrives.</p>
 */
class HttpBodyInputStream extends InputStream {

    private static final Buffer END = Buffer.buffer();

    private final HttpClientResponse response;
    private final Context context;
    private final long readTimeoutMs;
    private final BlockingQueue<Buffer> chunks = new LinkedBlockingQueue<>();

    private volatile Throwable failure;
    private Buffer current;
    private int position;
    private boolean ended;

    HttpBodyInputStream(HttpClientResponse response, Context context, long readTimeoutMs) {
        this.response = response;
        this.context = context;
        this.readTimeoutMs = readTimeoutMs;
        response.pause();
        response.handler(chunks::add);
        response.endHandler(v -> chunks.add(END));
        response.exceptionHandler(err -> {
            failure = err;
            chunks.add(END);
        });
        response.fetch(1);
    }

    int statusCode() {
        return response.statusCode();
    }

    String header(String name) {
        return response.getHeader(name);
    }

    @Override
    public int read() throws IOException {
        byte[] one = new byte[1];
        int n = read(one, 0, 1);
        return n < 0 ? -1 : one[0] & 0xff;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if (len == 0) {
            return 0;
        }
        if (!nextChunk()) {
            return -1;
        }
        int n = Math.min(len, current.length() - position);
        current.getBytes(position, position + n, b, off);
        position += n;
        return n;
    }

    private boolean nextChunk() throws IOException {
        while (!ended && (current == null || position >= current.length())) {
            Buffer next;
            try {
                next = chunks.poll(readTimeoutMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while reading response body");
            }
            if (next == null) {
                throw new SocketTimeoutException("No data from server within " + readTimeoutMs + "ms");
            }
            if (next == END) {
                ended = true;
                if (failure != null) {
                    throw new IOException("Response body failed: " + failure.getMessage(), failure);
                }
                break;
            }
            current = next;
            position = 0;
            context.runOnContext(v -> response.fetch(1));
        }
        return !ended || (current != null && position < current.length());
    }

    @Override
    public void close() {
        if (!ended) {
            ended = true;
            context.runOnContext(v -> response.request().reset());
        }
    }
}
