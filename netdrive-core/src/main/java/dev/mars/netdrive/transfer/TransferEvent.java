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

import dev.mars.netdrive.core.ErrorKind;
import dev.mars.netdrive.core.TransferItemSnapshot;

import java.time.Instant;

/**
 * Lifecycle and progress notification for one transfer item.
 *
 * @param type           what happened
 * @param itemId         the transfer item
 * @param driveId        the drive whose queue owns the item
 * @param item           snapshot of the item after the change
 * @param processedBytes bytes moved so far (progress events)
 * @param totalBytes     total bytes, or -1 when unknown
 * @param errorKind      failure classification (FAILED events)
 * @param message        failure message (FAILED events)
 * @param timestamp      when the event was raised
 */
public record TransferEvent(Type type, String itemId, String driveId, TransferItemSnapshot item,
                            long processedBytes, long totalBytes, ErrorKind errorKind, String message,
                            Instant timestamp) {

    public enum Type {
        QUEUED, STARTED, PROGRESSED, COMPLETED, FAILED, CANCELLED, PAUSED, RETRY_SCHEDULED
    }

    public static TransferEvent of(Type type, TransferItemSnapshot item, Instant timestamp) {
        return new TransferEvent(type, item.id(), item.driveId(), item, item.processedBytes(),
                item.totalBytes(), item.errorKind(), item.errorMessage(), timestamp);
    }

    public static TransferEvent progress(TransferItemSnapshot item, Instant timestamp) {
        return of(Type.PROGRESSED, item, timestamp);
    }

    public boolean isLifecycle() {
        return type != Type.PROGRESSED;
    }
}
