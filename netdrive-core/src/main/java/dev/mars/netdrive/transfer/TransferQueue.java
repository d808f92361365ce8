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
import dev.mars.netdrive.core.RemotePaths;
import dev.mars.netdrive.core.TransferDirection;
import dev.mars.netdrive.core.TransferItem;
import dev.mars.netdrive.core.TransferItemSnapshot;
import dev.mars.netdrive.core.TransferRequest;
import dev.mars.netdrive.core.TransferStatus;
import dev.mars.netdrive.core.exceptions.ConnectorException;
import dev.mars.netdrive.core.exceptions.InvalidTransitionException;
import dev.mars.netdrive.core.exceptions.QueueException;
import dev.mars.netdrive.events.EventChannel;
import dev.mars.netdrive.monitoring.TransferTelemetryMetrics;
import dev.mars.netdrive.protocol.ConnectorSession;
import dev.mars.netdrive.protocol.ProgressListener;
import dev.mars.netdrive.protocol.ProtocolConnector;
import dev.mars.netdrive.storage.ChecksumCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Ordered, concurrency-capped transfer queue for one drive.
 *
 * <p>A single dispatch thread starts the next eligible QUEUED item whenever one
 * of the {@code concurrentLimit} worker slots is free. Items are ordered by
 * priority (highest first), then creation time, then enqueue sequence. Items in
 * retry backoff are skipped until their eligible instant.</p>
 *
 * <p>Every running item holds its own session, leased from the
 * {@link DriveSessionProvider} for the duration of one attempt, so concurrent
 * transfers never interleave on a connection.</p>
 *
 * <p>All item state changes happen under the queue lock. Events are handed to
 * the dispatch thread and published from there in the order they occurred, so
 * queue methods never block on slow event consumers.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TransferQueue {

    private static final Logger logger = LoggerFactory.getLogger(TransferQueue.class);

    static final Comparator<TransferItem> DISPATCH_ORDER = Comparator
            .comparing((TransferItem item) -> item.getPriority().getValue(), Comparator.reverseOrder())
            .thenComparing(TransferItem::getCreatedAt)
            .thenComparingLong(TransferItem::getSequence);

    private final String driveId;
    private final DriveSessionProvider sessions;
    private final TransferQueueSettings settings;
    private final ChecksumCalculator checksumCalculator;
    private final EventChannel<TransferEvent> events;
    private final TransferTelemetryMetrics metrics;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, TransferItem> items = new LinkedHashMap<>();
    private final Map<String, TransferContext> running = new ConcurrentHashMap<>();
    private final Map<String, ProgressTracker> trackers = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong(0);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private final ScheduledExecutorService dispatcher;
    private final ExecutorService workers;

    public TransferQueue(DriveSessionProvider sessions, TransferQueueSettings settings,
                         ChecksumCalculator checksumCalculator, EventChannel<TransferEvent> events,
                         TransferTelemetryMetrics metrics, Clock clock) {
        this.driveId = sessions.getDriveId();
        this.sessions = sessions;
        this.settings = settings;
        this.checksumCalculator = checksumCalculator;
        this.events = events;
        this.metrics = metrics;
        this.clock = clock;

        ScheduledThreadPoolExecutor dispatchExecutor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "netdrive-dispatch-" + driveId);
            t.setDaemon(true);
            return t;
        });
        // pending retry promotions are dropped on shutdown
        dispatchExecutor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.dispatcher = dispatchExecutor;
        AtomicInteger workerCounter = new AtomicInteger(0);
        this.workers = new ThreadPoolExecutor(
                settings.concurrentLimit(),
                settings.concurrentLimit(),
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                r -> {
                    Thread t = new Thread(r, "netdrive-transfer-" + driveId + "-" + workerCounter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                }
        );

        logger.info("TransferQueue for drive {} initialized with {} concurrent transfers", driveId,
                settings.concurrentLimit());
    }

    public String getDriveId() {
        return driveId;
    }

    /**
     * Add a request to the queue. Returns immediately; dispatch happens on the queue's own thread.
     */
    public TransferItemSnapshot enqueue(TransferRequest request) throws QueueException {
        if (shutdown.get()) {
            throw new QueueException(null, "Transfer queue for drive " + driveId + " is shut down");
        }
        TransferItem item = new TransferItem(UUID.randomUUID().toString(), driveId, sequence.incrementAndGet(),
                request, settings.defaultMaxRetries(), clock.instant());
        TransferItemSnapshot snapshot;
        lock.lock();
        try {
            items.put(item.getId(), item);
            snapshot = item.snapshot();
            emit(TransferEvent.Type.QUEUED, snapshot);
        } finally {
            lock.unlock();
        }
        logger.debug("Enqueued {}", item);
        requestDispatch();
        return snapshot;
    }

    /**
     * Cancel an item. A queued, paused or failed item is cancelled immediately;
     * a running item stops at its next progress checkpoint.
     *
     * @return the item's snapshot after the request
     */
    public TransferItemSnapshot cancel(String itemId) throws QueueException {
        lock.lock();
        try {
            TransferItem item = require(itemId);
            TransferStatus status = item.getStatus();
            if (status == TransferStatus.IN_PROGRESS) {
                TransferContext context = running.get(itemId);
                if (context != null) {
                    context.cancel();
                }
                logger.info("Cancellation requested for running transfer {}", itemId);
                return item.snapshot();
            }
            transition(item, TransferStatus.CANCELLED);
            metrics.recordTransferCancelled(protocolName(), direction(item), false);
            TransferItemSnapshot snapshot = item.snapshot();
            emit(TransferEvent.Type.CANCELLED, snapshot);
            evictFinished();
            logger.info("Cancelled transfer {}", itemId);
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Manually re-queue a FAILED item. Progress and error are reset; the retry count is kept.
     */
    public TransferItemSnapshot retry(String itemId) throws QueueException {
        TransferItemSnapshot snapshot;
        lock.lock();
        try {
            TransferItem item = require(itemId);
            if (item.getStatus() != TransferStatus.FAILED) {
                throw new QueueException(itemId, "Only failed transfers can be retried, status is " + item.getStatus());
            }
            requeue(item, null);
            snapshot = item.snapshot();
            emit(TransferEvent.Type.QUEUED, snapshot);
        } finally {
            lock.unlock();
        }
        logger.info("Manual retry of transfer {} (retry count {})", itemId, snapshot.retryCount());
        requestDispatch();
        return snapshot;
    }

    /**
     * Remove an item from the queue and its history. Running items must be cancelled first.
     */
    public TransferItemSnapshot remove(String itemId) throws QueueException {
        lock.lock();
        try {
            TransferItem item = require(itemId);
            if (item.getStatus() == TransferStatus.IN_PROGRESS) {
                throw new QueueException(itemId, "Cannot remove a transfer that is in progress");
            }
            items.remove(itemId);
            trackers.remove(itemId);
            return item.snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ask a running item to pause at its next checkpoint.
     */
    public TransferItemSnapshot pause(String itemId) throws QueueException {
        lock.lock();
        try {
            TransferItem item = require(itemId);
            TransferContext context = running.get(itemId);
            if (item.getStatus() != TransferStatus.IN_PROGRESS || context == null) {
                throw new QueueException(itemId, "Only running transfers can be paused, status is " + item.getStatus());
            }
            context.pause();
            logger.info("Pause requested for transfer {}", itemId);
            return item.snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Put a PAUSED item back in the queue. The next attempt starts from the beginning.
     */
    public TransferItemSnapshot resume(String itemId) throws QueueException {
        TransferItemSnapshot snapshot;
        lock.lock();
        try {
            TransferItem item = require(itemId);
            if (item.getStatus() != TransferStatus.PAUSED) {
                throw new QueueException(itemId, "Only paused transfers can be resumed, status is " + item.getStatus());
            }
            requeue(item, null);
            snapshot = item.snapshot();
            emit(TransferEvent.Type.QUEUED, snapshot);
        } finally {
            lock.unlock();
        }
        requestDispatch();
        return snapshot;
    }

    /**
     * Drop completed, cancelled and terminally failed items from the history.
     *
     * @return number of items removed
     */
    public int clearFinished() {
        lock.lock();
        try {
            int before = items.size();
            items.values().removeIf(TransferQueue::isEvictable);
            int removed = before - items.size();
            if (removed > 0) {
                logger.debug("Cleared {} finished transfers from drive {}", removed, driveId);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public List<TransferItemSnapshot> snapshot() {
        lock.lock();
        try {
            return items.values().stream().map(TransferItem::snapshot).collect(Collectors.toUnmodifiableList());
        } finally {
            lock.unlock();
        }
    }

    public Optional<TransferItemSnapshot> get(String itemId) {
        lock.lock();
        try {
            return Optional.ofNullable(items.get(itemId)).map(TransferItem::snapshot);
        } finally {
            lock.unlock();
        }
    }

    public Map<TransferStatus, Long> countByStatus() {
        lock.lock();
        try {
            Map<TransferStatus, Long> counts = new EnumMap<>(TransferStatus.class);
            for (TransferStatus status : TransferStatus.values()) {
                counts.put(status, 0L);
            }
            items.values().forEach(item -> counts.merge(item.getStatus(), 1L, Long::sum));
            return counts;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether an unfinished item already moves {@code remotePath} in {@code direction}:
     * queued, running, paused or waiting for an automatic retry.
     */
    public boolean hasPending(TransferDirection direction, String remotePath) {
        String path = RemotePaths.normalize(remotePath);
        lock.lock();
        try {
            return items.values().stream().anyMatch(item -> item.isPending()
                    && item.getDirection() == direction
                    && item.getRemotePath().equals(path));
        } finally {
            lock.unlock();
        }
    }

    public int getActiveCount() {
        return running.size();
    }

    public Optional<ProgressTracker> getProgressTracker(String itemId) {
        return Optional.ofNullable(trackers.get(itemId));
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * Stop dispatching, cancel running items and wait for the workers to finish.
     *
     * @return {@code true} if all workers stopped within the timeout
     */
    public boolean shutdown(Duration timeout) {
        if (shutdown.getAndSet(true)) {
            return true;
        }
        logger.info("Shutting down transfer queue for drive {}", driveId);
        running.values().forEach(TransferContext::cancel);
        workers.shutdown();
        boolean terminated;
        try {
            terminated = workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!terminated) {
                logger.warn("Transfer queue shutdown for drive {} timed out, forcing shutdown", driveId);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
            terminated = false;
        }
        // let the completion events already handed to the dispatcher go out
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            dispatcher.shutdownNow();
        }
        logger.info("Transfer queue for drive {} shut down", driveId);
        return terminated;
    }

    // Dispatch

    private void requestDispatch() {
        if (shutdown.get()) {
            return;
        }
        try {
            dispatcher.execute(this::dispatch);
        } catch (RejectedExecutionException e) {
            logger.debug("Dispatcher for drive {} no longer accepts work", driveId);
        }
    }

    private void dispatch() {
        if (shutdown.get()) {
            return;
        }
        lock.lock();
        try {
            Instant now = clock.instant();
            while (running.size() < settings.concurrentLimit()) {
                Optional<TransferItem> next = items.values().stream()
                        .filter(item -> item.isEligible(now))
                        .min(DISPATCH_ORDER);
                if (next.isEmpty()) {
                    break;
                }
                start(next.get(), now);
            }
        } catch (RuntimeException e) {
            logger.error("Dispatch loop error on drive {}", driveId, e);
        } finally {
            lock.unlock();
        }
    }

    private void start(TransferItem item, Instant now) {
        try {
            item.markStarted(now);
        } catch (InvalidTransitionException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
        TransferContext context = new TransferContext(item.getId(), now);
        running.put(item.getId(), context);
        trackers.put(item.getId(), new ProgressTracker(item.getId(), item.getTotalBytes(), clock));
        metrics.recordTransferStarted(protocolName(), direction(item));
        emit(TransferEvent.Type.STARTED, item.snapshot());
        logger.info("Starting transfer {} ({} {} -> {})", item.getId(), item.getDirection(),
                item.getLocalPath(), item.getRemotePath());
        workers.execute(() -> runAttempt(item, context));
    }

    private void runAttempt(TransferItem item, TransferContext context) {
        ConnectorException failure = null;
        ConnectorSession session = null;
        try {
            ProtocolConnector connector = sessions.getConnector();
            session = sessions.acquireSession();
            String operation = item.getDirection() == TransferDirection.UPLOAD ? "Upload" : "Download";
            context.throwIfCancelled(operation + " of " + item.getFileName());
            ProgressListener listener = (transferred, total) -> onProgress(item, transferred, total);
            if (item.getDirection() == TransferDirection.UPLOAD) {
                connector.upload(session, item.getLocalPath(), item.getRemotePath(), listener, context);
            } else {
                connector.download(session, item.getRemotePath(), item.getLocalPath(), listener, context);
            }
            checksumCalculator.verify(item.getLocalPath(), item.getExpectedChecksum());
        } catch (ConnectorException e) {
            failure = e;
        } catch (IOException e) {
            failure = new ConnectorException(ErrorKind.IO, "Checksum verification failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            logger.error("Unexpected error in transfer {}", item.getId(), e);
            failure = new ConnectorException(ErrorKind.PROTOCOL, "Unexpected error: " + e.getMessage(), e);
        } finally {
            if (session != null) {
                sessions.releaseSession(session, isReusableAfter(failure));
            }
        }
        finish(item, context, failure);
    }

    /**
     * An interrupted or failed exchange can leave a session mid-command; only clean
     * completions and post-transfer integrity failures hand it back for reuse.
     */
    private static boolean isReusableAfter(ConnectorException failure) {
        return failure == null || failure.getKind() == ErrorKind.INTEGRITY;
    }

    private void onProgress(TransferItem item, long transferred, long total) {
        TransferItemSnapshot snapshot;
        lock.lock();
        try {
            item.recordProgress(transferred, total);
            snapshot = item.snapshot();
        } finally {
            lock.unlock();
        }
        ProgressTracker tracker = trackers.get(item.getId());
        if (tracker != null) {
            tracker.update(snapshot.processedBytes(), snapshot.totalBytes());
        }
        emitProgress(snapshot);
    }

    private void finish(TransferItem item, TransferContext context, ConnectorException failure) {
        lock.lock();
        try {
            running.remove(item.getId());
            trackers.remove(item.getId());
            Instant now = clock.instant();
            double seconds = Duration.between(context.getStartedAt(), now).toMillis() / 1000.0;

            if (failure == null) {
                item.markCompleted(now);
                metrics.recordTransferCompleted(protocolName(), direction(item), item.getProcessedBytes(), seconds);
                emit(TransferEvent.Type.COMPLETED, item.snapshot());
                logger.info("Transfer completed: {} ({} bytes)", item.getId(), item.getProcessedBytes());
            } else if (context.isCancelled() || failure.getKind() == ErrorKind.CANCELLED && !context.isPaused()) {
                item.transitionTo(TransferStatus.CANCELLED, now);
                metrics.recordTransferCancelled(protocolName(), direction(item), true);
                emit(TransferEvent.Type.CANCELLED, item.snapshot());
                logger.info("Transfer cancelled: {} after {} bytes", item.getId(), item.getProcessedBytes());
            } else if (context.isPaused()) {
                item.transitionTo(TransferStatus.PAUSED, now);
                metrics.recordTransferPaused();
                emit(TransferEvent.Type.PAUSED, item.snapshot());
                logger.info("Transfer paused: {} after {} bytes", item.getId(), item.getProcessedBytes());
            } else {
                fail(item, failure, seconds, now);
            }
            evictFinished();
        } catch (InvalidTransitionException e) {
            logger.error("Inconsistent state finishing transfer {}", item.getId(), e);
        } finally {
            lock.unlock();
        }
        requestDispatch();
    }

    private void fail(TransferItem item, ConnectorException failure, double seconds, Instant now)
            throws InvalidTransitionException {
        ErrorKind kind = failure.getKind();
        item.markFailed(kind, failure.getMessage(), now);
        metrics.recordTransferFailed(protocolName(), direction(item), kind.name(), seconds);
        emit(TransferEvent.Type.FAILED, item.snapshot());

        RetryPolicy policy = settings.retryPolicy();
        if (!shutdown.get() && policy.shouldRetry(kind, item.getRetryCount(), item.getMaxRetries())) {
            Duration delay = policy.delayFor(item.getRetryCount() + 1);
            item.scheduleRetry(now.plus(delay));
            metrics.recordRetryScheduled(protocolName(), direction(item));
            emit(TransferEvent.Type.RETRY_SCHEDULED, item.snapshot());
            logger.warn("Transfer {} failed ({}), retry {}/{} in {} ms", item.getId(), failure.getMessage(),
                    item.getRetryCount(), item.getMaxRetries(), delay.toMillis());
            schedulePromotion(item.getId(), delay);
        } else {
            logger.error("Transfer failed permanently: {} - {}", item.getId(), failure.getMessage());
        }
    }

    private void schedulePromotion(String itemId, Duration delay) {
        try {
            dispatcher.schedule(() -> promote(itemId), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug("Dispatcher for drive {} no longer accepts work", driveId);
        }
    }

    /**
     * FAILED to QUEUED once the backoff has elapsed, unless the item was cancelled,
     * removed or manually retried in the meantime.
     */
    private void promote(String itemId) {
        lock.lock();
        try {
            TransferItem item = items.get(itemId);
            if (item == null || !item.isAwaitingRetry()) {
                return;
            }
            requeue(item, null);
            emit(TransferEvent.Type.QUEUED, item.snapshot());
            logger.debug("Transfer {} re-queued for retry {}", itemId, item.getRetryCount());
        } catch (QueueException e) {
            logger.error("Could not re-queue transfer {}", itemId, e);
        } finally {
            lock.unlock();
        }
        dispatch();
    }

    // Helpers, called with the lock held

    private TransferItem require(String itemId) throws QueueException {
        TransferItem item = items.get(itemId);
        if (item == null) {
            throw new QueueException(itemId, "No such transfer on drive " + driveId);
        }
        return item;
    }

    private void transition(TransferItem item, TransferStatus target) throws QueueException {
        try {
            item.transitionTo(target, clock.instant());
        } catch (InvalidTransitionException e) {
            throw new QueueException(item.getId(), e.getMessage());
        }
    }

    private void requeue(TransferItem item, Instant eligibleAt) throws QueueException {
        try {
            item.requeue(eligibleAt);
        } catch (InvalidTransitionException e) {
            throw new QueueException(item.getId(), e.getMessage());
        }
    }

    private void evictFinished() {
        int limit = settings.maxRetainedItems();
        List<TransferItem> finished = new ArrayList<>();
        for (TransferItem item : items.values()) {
            if (isEvictable(item)) {
                finished.add(item);
            }
        }
        int excess = finished.size() - limit;
        if (excess <= 0) {
            return;
        }
        finished.sort(Comparator.comparing(TransferItem::getFinishedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparingLong(TransferItem::getSequence));
        Iterator<TransferItem> oldest = finished.iterator();
        for (int i = 0; i < excess && oldest.hasNext(); i++) {
            items.remove(oldest.next().getId());
        }
        logger.debug("Evicted {} finished transfers from drive {}", excess, driveId);
    }

    private static boolean isEvictable(TransferItem item) {
        return item.getStatus().isTerminal() || item.isRetryExhausted();
    }

    private void emit(TransferEvent.Type type, TransferItemSnapshot snapshot) {
        TransferEvent event = TransferEvent.of(type, snapshot, clock.instant());
        try {
            dispatcher.execute(() -> events.publishBlocking(event));
        } catch (RejectedExecutionException e) {
            events.publishBlocking(event);
        }
    }

    private void emitProgress(TransferItemSnapshot snapshot) {
        TransferEvent event = TransferEvent.progress(snapshot, clock.instant());
        try {
            dispatcher.execute(() -> events.publish(event));
        } catch (RejectedExecutionException e) {
            logger.trace("Dropped progress event for {} after shutdown", snapshot.id());
        }
    }

    private String protocolName() {
        return sessions.getProtocol().name();
    }

    private static String direction(TransferItem item) {
        return item.getDirection().name();
    }
}
