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

import dev.mars.netdrive.core.exceptions.ConnectorException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Chunked copy loop shared by the stream-based connectors.
 *
 * <p>Checks cancellation before every chunk, reports progress through a
 * {@link ProgressThrottle} and classifies read and write failures by which side
 * of the copy is local.</p>
 */
public final class StreamCopier {

    private StreamCopier() {
    }

    /**
     * @param localSource {@code true} for uploads (read local, write remote),
     *                    {@code false} for downloads
     * @return number of bytes copied
     */
    public static long copy(InputStream in, OutputStream out, long totalBytes, boolean localSource,
                            ConnectorSettings settings, ProgressListener listener,
                            CancellationToken cancellation, String operation) throws ConnectorException {
        ProgressThrottle throttle = new ProgressThrottle(listener, settings);
        byte[] buffer = new byte[settings.bufferSize()];
        long transferred = 0;
        throttle.update(0, totalBytes);
        while (true) {
            cancellation.throwIfCancelled(operation);
            int read;
            try {
                read = in.read(buffer);
            } catch (IOException e) {
                throw localSource ? ConnectorErrors.local(operation + " read failed", e)
                        : ConnectorErrors.remote(operation + " read failed", e);
            }
            if (read < 0) {
                break;
            }
            try {
                out.write(buffer, 0, read);
            } catch (IOException e) {
                throw localSource ? ConnectorErrors.remote(operation + " write failed", e)
                        : ConnectorErrors.local(operation + " write failed", e);
            }
            transferred += read;
            throttle.update(transferred, totalBytes);
        }
        try {
            out.flush();
        } catch (IOException e) {
            throw localSource ? ConnectorErrors.remote(operation + " flush failed", e)
                    : ConnectorErrors.local(operation + " flush failed", e);
        }
        throttle.complete(transferred, totalBytes);
        return transferred;
    }
}
