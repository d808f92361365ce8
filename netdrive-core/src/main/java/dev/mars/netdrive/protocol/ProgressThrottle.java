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


/**
 * Gates progress reports so listeners see one update per byte delta or time
 * delta instead of one per chunk, plus a final report on completion.
 *
 * <p>Not thread-safe; one throttle belongs to one running transfer.</p>
 */
public class ProgressThrottle {

    private final ProgressListener listener;
    private final long byteThreshold;
    private final long intervalNanos;

    private long lastReportedBytes;
    private long lastReportNanos;
    private boolean reportedAny;

    public ProgressThrottle(ProgressListener listener, ConnectorSettings settings) {
        this.listener = listener != null ? listener : ProgressListener.NONE;
        this.byteThreshold = settings.progressBytes();
        this.intervalNanos = settings.progressInterval().toNanos();
        this.lastReportNanos = System.nanoTime();
    }

    /**
     * Report if either gate has opened since the previous report.
     */
    public void update(long transferred, long total) {
        long now = System.nanoTime();
        boolean bytesDue = transferred - lastReportedBytes >= byteThreshold;
        boolean timeDue = now - lastReportNanos >= intervalNanos;
        if (bytesDue || timeDue) {
            emit(transferred, total, now);
        }
    }

    /**
     * Final report, always delivered unless the same count was just reported.
     */
    public void complete(long transferred, long total) {
        if (!reportedAny || transferred != lastReportedBytes) {
            emit(transferred, total, System.nanoTime());
        }
    }

    private void emit(long transferred, long total, long now) {
        lastReportedBytes = transferred;
        lastReportNanos = now;
        reportedAny = true;
        listener.onProgress(transferred, total);
    }
}
