package dev.mars.netdrive.drive;

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

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a sync: the transfers it planned, files it left alone and the queue items it created.
 *
 * @param conflicts     relative paths changed on both sides within the time tolerance; not transferred
 * @param alreadyQueued relative paths whose transfer was planned but an unfinished queue item
 *                      already covers it, so no new item was created
 */
public record SyncPlan(String driveId, SyncDirection direction, List<PlannedTransfer> uploads,
                       List<PlannedTransfer> downloads, int unchanged, List<String> conflicts,
                       List<String> alreadyQueued, List<String> itemIds, Instant plannedAt) {

    public SyncPlan {
        uploads = List.copyOf(uploads);
        downloads = List.copyOf(downloads);
        conflicts = List.copyOf(conflicts);
        alreadyQueued = List.copyOf(alreadyQueued);
        itemIds = List.copyOf(itemIds);
    }

    public int getTransferCount() {
        return uploads.size() + downloads.size();
    }

    public long getTotalBytes() {
        return uploads.stream().mapToLong(PlannedTransfer::size).sum()
                + downloads.stream().mapToLong(PlannedTransfer::size).sum();
    }

    public boolean isEmpty() {
        return uploads.isEmpty() && downloads.isEmpty();
    }

    SyncPlan withQueueOutcome(List<String> skipped, List<String> ids) {
        return new SyncPlan(driveId, direction, uploads, downloads, unchanged, conflicts, skipped, ids, plannedAt);
    }
}
