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

import dev.mars.netdrive.core.exceptions.InvalidTransitionException;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * The central unit of work: one queued, running or finished file transfer.
 *
 * <p>Items are owned by exactly one transfer queue. Status changes go through
 * {@link #transitionTo(TransferStatus, Instant)}, which enforces the
 * {@link TransferStatus} state machine. The only mutation allowed from outside
 * the queue's lock is {@link #recordProgress(long, long)}, invoked from the
 * running connector's progress callback.</p>
 *
 * <p>Readers outside the queue must use {@link #snapshot()}.</p>
 */
public class TransferItem {

    private final String id;
    private final String driveId;
    private final long sequence;
    private final String fileName;
    private final Path localPath;
    private final String remotePath;
    private final TransferDirection direction;
    private final TransferPriority priority;
    private final int maxRetries;
    private final Instant createdAt;
    private final String expectedChecksum;
    private final Map<String, String> metadata;

    private volatile TransferStatus status = TransferStatus.QUEUED;
    private volatile long totalBytes;
    private volatile long processedBytes;
    private volatile double progress;
    private volatile Instant lastAttempt;
    private volatile String errorMessage;
    private volatile ErrorKind errorKind;
    private volatile int retryCount;
    private volatile Instant nextEligible;
    private volatile boolean retryScheduled;
    private volatile Instant finishedAt;

    public TransferItem(String id, String driveId, long sequence, TransferRequest request,
                        int defaultMaxRetries, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.driveId = driveId;
        this.sequence = sequence;
        this.fileName = request.getFileName();
        this.localPath = request.getLocalPath();
        this.remotePath = request.getRemotePath();
        this.direction = request.getDirection();
        this.priority = request.getPriority();
        this.maxRetries = request.getMaxRetries() != null ? request.getMaxRetries() : defaultMaxRetries;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt cannot be null");
        this.expectedChecksum = request.getExpectedChecksum();
        this.metadata = request.getMetadata();
        this.totalBytes = request.getExpectedSize();
    }

    public String getId() { return id; }
    public String getDriveId() { return driveId; }
    public long getSequence() { return sequence; }
    public String getFileName() { return fileName; }
    public Path getLocalPath() { return localPath; }
    public String getRemotePath() { return remotePath; }
    public TransferDirection getDirection() { return direction; }
    public TransferPriority getPriority() { return priority; }
    public int getMaxRetries() { return maxRetries; }
    public Instant getCreatedAt() { return createdAt; }
    public String getExpectedChecksum() { return expectedChecksum; }
    public Map<String, String> getMetadata() { return metadata; }
    public TransferStatus getStatus() { return status; }
    public long getTotalBytes() { return totalBytes; }
    public long getProcessedBytes() { return processedBytes; }
    public double getProgress() { return progress; }
    public Instant getLastAttempt() { return lastAttempt; }
    public String getErrorMessage() { return errorMessage; }
    public ErrorKind getErrorKind() { return errorKind; }
    public int getRetryCount() { return retryCount; }
    public Instant getNextEligible() { return nextEligible; }
    public Instant getFinishedAt() { return finishedAt; }

    /**
     * Failed, with an automatic retry scheduled at {@link #getNextEligible()}.
     */
    public boolean isAwaitingRetry() {
        return status == TransferStatus.FAILED && retryScheduled;
    }

    /**
     * Failed with no automatic retry coming; only a manual retry can revive it.
     */
    public boolean isRetryExhausted() {
        return status == TransferStatus.FAILED && !retryScheduled;
    }

    /**
     * Not yet done with: queued, running, paused or awaiting an automatic retry.
     */
    public boolean isPending() {
        return status == TransferStatus.QUEUED || status == TransferStatus.IN_PROGRESS
                || status == TransferStatus.PAUSED || isAwaitingRetry();
    }

    public boolean hasRetriesLeft() {
        return retryCount < maxRetries;
    }

    /**
     * Whether the dispatcher may pick this item at {@code now}.
     */
    public boolean isEligible(Instant now) {
        return status == TransferStatus.QUEUED && (nextEligible == null || !now.isBefore(nextEligible));
    }

    /**
     * Apply a status change, enforcing the transition table.
     *
     * @param now recorded as the finish time when {@code target} is a finished state
     * @throws InvalidTransitionException if the transition is not allowed
     */
    public void transitionTo(TransferStatus target, Instant now) throws InvalidTransitionException {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException(id, status, target, status.getValidTransitions());
        }
        this.status = target;
        this.finishedAt = target.isFinished() ? Objects.requireNonNull(now, "now cannot be null") : null;
    }

    /**
     * QUEUED to IN_PROGRESS; starts a fresh attempt.
     */
    public void markStarted(Instant now) throws InvalidTransitionException {
        transitionTo(TransferStatus.IN_PROGRESS, now);
        this.lastAttempt = now;
        this.processedBytes = 0;
        this.progress = 0.0;
        this.errorMessage = null;
        this.errorKind = null;
        this.retryScheduled = false;
        this.nextEligible = null;
    }

    /**
     * Progress callback from the running connector. Ignored unless the item is
     * IN_PROGRESS; never lets progress go backwards and clamps to the known total.
     */
    public void recordProgress(long transferred, long total) {
        if (status != TransferStatus.IN_PROGRESS) {
            return;
        }
        if (total > 0) {
            this.totalBytes = total;
        }
        long known = this.totalBytes;
        long clamped = known > 0 ? Math.min(transferred, known) : transferred;
        if (clamped > processedBytes) {
            this.processedBytes = clamped;
            if (known > 0) {
                this.progress = Math.max(progress, Math.min(1.0, (double) clamped / known));
            }
        }
    }

    public void markCompleted(Instant now) throws InvalidTransitionException {
        transitionTo(TransferStatus.COMPLETED, now);
        if (totalBytes <= 0) {
            this.totalBytes = processedBytes;
        } else {
            this.processedBytes = totalBytes;
        }
        this.progress = 1.0;
    }

    /**
     * IN_PROGRESS to FAILED. The caller decides separately whether a retry is scheduled.
     */
    public void markFailed(ErrorKind kind, String message, Instant now) throws InvalidTransitionException {
        transitionTo(TransferStatus.FAILED, now);
        this.errorKind = kind;
        this.errorMessage = message;
        this.retryScheduled = false;
        this.nextEligible = null;
    }

    /**
     * Consume one unit of the retry budget and schedule the automatic retry.
     */
    public void scheduleRetry(Instant eligibleAt) {
        if (status != TransferStatus.FAILED || !hasRetriesLeft()) {
            throw new IllegalStateException("Item " + id + " cannot schedule a retry");
        }
        this.retryCount++;
        this.retryScheduled = true;
        this.nextEligible = eligibleAt;
    }

    /**
     * FAILED (or PAUSED) back to QUEUED. Resets progress and error but keeps the retry count.
     */
    public void requeue(Instant eligibleAt) throws InvalidTransitionException {
        transitionTo(TransferStatus.QUEUED, null);
        this.processedBytes = 0;
        this.progress = 0.0;
        this.errorMessage = null;
        this.errorKind = null;
        this.retryScheduled = false;
        this.nextEligible = eligibleAt;
    }

    public TransferItemSnapshot snapshot() {
        return new TransferItemSnapshot(id, driveId, fileName, localPath.toString(), remotePath, direction,
                totalBytes, processedBytes, priority, status, progress, errorMessage, errorKind,
                retryCount, maxRetries, createdAt, lastAttempt, nextEligible, isAwaitingRetry(),
                expectedChecksum, metadata);
    }

    @Override
    public String toString() {
        return "TransferItem{" +
                "id='" + id + '\'' +
                ", file='" + fileName + '\'' +
                ", " + direction +
                ", priority=" + priority +
                ", status=" + status +
                ", progress=" + String.format("%.2f", progress) +
                ", retries=" + retryCount + "/" + maxRetries +
                '}';
    }
}
