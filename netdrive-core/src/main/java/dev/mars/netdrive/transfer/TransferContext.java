package dev.mars.netdrive.transfer;

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

import dev.mars.netdrive.protocol.CancellationToken;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Control flags for one running attempt of a transfer item.
 *
 * <p>The running connector polls it as a {@link CancellationToken} between
 * chunks. A cancel or a pause both stop the attempt at the next checkpoint;
 * the queue then looks at which flag was set to decide the resulting state.</p>
 */
public class TransferContext implements CancellationToken {

    private final String itemId;
    private final Instant startedAt;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean paused = new AtomicBoolean(false);

    public TransferContext(String itemId, Instant startedAt) {
        this.itemId = itemId;
        this.startedAt = startedAt;
    }

    public String getItemId() {
        return itemId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Request a pause. Ignored once a cancel has been requested.
     */
    public void pause() {
        if (!cancelled.get()) {
            paused.set(true);
        }
    }

    public boolean isPaused() {
        return paused.get() && !cancelled.get();
    }

    public boolean shouldContinue() {
        return !cancelled.get() && !paused.get();
    }

    @Override
    public boolean isCancellationRequested() {
        return !shouldContinue();
    }
}
