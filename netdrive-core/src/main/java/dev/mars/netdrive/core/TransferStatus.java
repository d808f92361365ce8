package dev.mars.netdrive.core;

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
 * Lifecycle states of a queued file transfer.
 *
 * <h3>State Transition Flow:</h3>
 * <pre>
 * QUEUED → IN_PROGRESS → {COMPLETED | FAILED | CANCELLED | PAUSED}
 *   ↓                        ↑                              ↓
 * CANCELLED          FAILED → QUEUED (retry)       PAUSED → QUEUED (resume)
 * </pre>
 *
 * <h3>State Transition Rules:</h3>
 * <ul>
 *   <li>Every item starts in QUEUED</li>
 *   <li>Only the queue dispatcher moves QUEUED to IN_PROGRESS</li>
 *   <li>FAILED returns to QUEUED either automatically (transient error with retries left)
 *       or by an explicit user retry</li>
 *   <li>COMPLETED and CANCELLED are terminal</li>
 * </ul>
 *
 * <p>Status changes on a {@code TransferItem} happen under the owning queue's lock.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @see TransferItem
 */
public enum TransferStatus {

    /**
     * Waiting for a free worker slot. Items in retry backoff are also QUEUED but not
     * yet eligible for dispatch.
     */
    QUEUED,

    /**
     * A connector operation is moving bytes for this item. At most one operation
     * runs per item, and progress only grows while in this state.
     */
    IN_PROGRESS,

    /**
     * Paused at a chunk checkpoint. Bytes already written stay where they are;
     * resuming re-queues the item and the next attempt starts over.
     */
    PAUSED,

    /**
     * All bytes moved and, when an expected checksum was supplied, verified.
     * Terminal.
     */
    COMPLETED,

    /**
     * The last attempt failed. The item's error kind and retry counters tell
     * whether an automatic retry is pending or the failure needs the user.
     */
    FAILED,

    /**
     * Cancelled by the user or by queue shutdown. Terminal. Partially written
     * bytes are not rolled back.
     */
    CANCELLED;

    /**
     * @return {@code true} for COMPLETED and CANCELLED
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    /**
     * Finished items no longer occupy the queue and are subject to retention eviction.
     * FAILED counts as finished even though it may be retried later.
     */
    public boolean isFinished() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }

    /**
     * Checks whether a transition from this status to the given target status is valid.
     *
     * <pre>
     *   QUEUED      → IN_PROGRESS, CANCELLED
     *   IN_PROGRESS → COMPLETED, FAILED, CANCELLED, PAUSED
     *   PAUSED      → QUEUED, CANCELLED
     *   FAILED      → QUEUED, CANCELLED
     *   COMPLETED   → (terminal)
     *   CANCELLED   → (terminal)
     * </pre>
     *
     * @param target the target status
     * @return {@code true} if the transition is valid
     */
    public boolean canTransitionTo(TransferStatus target) {
        return switch (this) {
            case QUEUED -> target == IN_PROGRESS || target == CANCELLED;
            case IN_PROGRESS -> target == COMPLETED || target == FAILED
                        || target == CANCELLED || target == PAUSED;
            case PAUSED -> target == QUEUED || target == CANCELLED;
            case FAILED -> target == QUEUED || target == CANCELLED;
            case COMPLETED, CANCELLED -> false;
        };
    }

    /**
     * @return valid target statuses from this status (empty for terminal states)
     */
    public TransferStatus[] getValidTransitions() {
        return switch (this) {
            case QUEUED -> new TransferStatus[]{IN_PROGRESS, CANCELLED};
            case IN_PROGRESS -> new TransferStatus[]{COMPLETED, FAILED, CANCELLED, PAUSED};
            case PAUSED -> new TransferStatus[]{QUEUED, CANCELLED};
            case FAILED -> new TransferStatus[]{QUEUED, CANCELLED};
            case COMPLETED, CANCELLED -> new TransferStatus[0];
        };
    }
}
