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

package dev.mars.netdrive.protocol;

import dev.mars.netdrive.core.ErrorKind;
import dev.mars.netdrive.core.exceptions.ConnectorException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.SocketException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamCopierTest {

    private static final ConnectorSettings SMALL_CHUNKS = new ConnectorSettings(1024, 4096, Duration.ofHours(1));

    private final List<long[]> reports = new ArrayList<>();
    private final ProgressListener listener = (transferred, total) -> reports.add(new long[]{transferred, total});

    @Test
    void copiesAllBytesAndReportsThrottledProgress() throws Exception {
        byte[] content = new byte[10_000];
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        long copied = StreamCopier.copy(new ByteArrayInputStream(content), out, content.length, true,
                SMALL_CHUNKS, listener, CancellationToken.NONE, "Upload of test");

        assertThat(copied).isEqualTo(10_000);
        assertThat(out.size()).isEqualTo(10_000);
        // one per 4 KiB, then the final report
        assertThat(reports).extracting(r -> r[0]).containsExactly(4096L, 8192L, 10_000L);
        assertThat(reports).allSatisfy(r -> assertThat(r[1]).isEqualTo(10_000L));
    }

    @Test
    void emptySourceStillReportsCompletion() throws Exception {
        StreamCopier.copy(new ByteArrayInputStream(new byte[0]), new ByteArrayOutputStream(), 0, true,
                SMALL_CHUNKS, listener, CancellationToken.NONE, "Upload of empty");

        assertThat(reports).hasSize(1);
        assertThat(reports.get(0)[0]).isZero();
    }

    @Test
    void stopsAtNextChunkWhenCancelled() {
        AtomicBoolean cancelled = new AtomicBoolean(false);
        CancellationToken token = cancelled::get;
        ProgressListener cancelAfterFirstChunk = (transferred, total) -> {
            if (transferred >= 1024) {
                cancelled.set(true);
            }
        };
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ConnectorSettings everyChunk = new ConnectorSettings(1024, 1, Duration.ofHours(1));

        assertThatThrownBy(() -> StreamCopier.copy(new ByteArrayInputStream(new byte[8192]), out, 8192, false,
                everyChunk, cancelAfterFirstChunk, token, "Download of big"))
                .isInstanceOf(ConnectorException.class)
                .satisfies(e -> assertThat(((ConnectorException) e).getKind()).isEqualTo(ErrorKind.CANCELLED));
        assertThat(out.size()).isEqualTo(1024);
    }

    @Test
    void localReadFailureOnUploadIsIo() {
        InputStream failing = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("disk gone");
            }
        };

        assertThatThrownBy(() -> StreamCopier.copy(failing, new ByteArrayOutputStream(), 10, true,
                SMALL_CHUNKS, listener, CancellationToken.NONE, "Upload of x"))
                .isInstanceOf(ConnectorException.class)
                .satisfies(e -> assertThat(((ConnectorException) e).getKind()).isEqualTo(ErrorKind.IO));
    }

    @Test
    void remoteWriteFailureOnUploadIsClassifiedByCause() {
        OutputStream broken = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new SocketException("Connection reset");
            }
        };

        assertThatThrownBy(() -> StreamCopier.copy(new ByteArrayInputStream(new byte[100]), broken, 100, true,
                SMALL_CHUNKS, listener, CancellationToken.NONE, "Upload of x"))
                .isInstanceOf(ConnectorException.class)
                .satisfies(e -> assertThat(((ConnectorException) e).getKind()).isEqualTo(ErrorKind.CONNECTION));
    }
}
