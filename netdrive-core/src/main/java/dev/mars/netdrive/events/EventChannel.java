package dev.mars.netdrive.events;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Flow;
import java.util.concurrent.SubmissionPublisher;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Consumer;

/**
 * Asynchronous, bounded event channel between the engine and its observers.
 *
 * <p>Each subscriber has its own buffer of {@code bufferCapacity} events and its
 * own delivery order. {@link #publish(Object)} drops the event for a subscriber
 * whose buffer is full (used for high-rate progress events);
 * {@link #publishBlocking(Object)} waits for buffer space (lifecycle events).</p>
 *
 * @param <E> event type
 */
public class EventChannel<E> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EventChannel.class);

    private final String name;
    private final ExecutorService deliveryExecutor;
    private final SubmissionPublisher<E> publisher;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final LongAdder dropped = new LongAdder();

    public EventChannel(String name, int bufferCapacity) {
        this.name = name;
        AtomicInteger threadCounter = new AtomicInteger(0);
        this.deliveryExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "netdrive-events-" + name + "-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.publisher = new SubmissionPublisher<>(deliveryExecutor, bufferCapacity);
    }

    public String getName() {
        return name;
    }

    /**
     * Publish without blocking; subscribers with a full buffer miss this event.
     */
    public void publish(E event) {
        if (closed.get()) {
            return;
        }
        try {
            publisher.offer(event, (subscriber, item) -> {
                dropped.increment();
                return false;
            });
        } catch (IllegalStateException e) {
            logger.debug("Channel {} closed while publishing", name);
        }
    }

    /**
     * Publish, blocking while any subscriber's buffer is full.
     */
    public void publishBlocking(E event) {
        if (closed.get()) {
            return;
        }
        try {
            publisher.submit(event);
        } catch (IllegalStateException e) {
            logger.debug("Channel {} closed while publishing", name);
        }
    }

    /**
     * Register a consumer. Events published after this call are delivered in order
     * on a channel thread. Closing the returned handle unsubscribes.
     */
    public Subscription consume(Consumer<? super E> consumer) {
        ConsumerSubscriber subscriber = new ConsumerSubscriber(consumer);
        publisher.subscribe(subscriber);
        return subscriber;
    }

    public int getSubscriberCount() {
        return publisher.getNumberOfSubscribers();
    }

    /**
     * Number of events dropped by {@link #publish(Object)} across all subscribers.
     */
    public long getDroppedCount() {
        return dropped.sum();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        publisher.close();
        deliveryExecutor.shutdown();
        try {
            if (!deliveryExecutor.awaitTermination(2, TimeUnit.SECONDS)) {
                deliveryExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            deliveryExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Handle for a registered consumer.
     */
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    private final class ConsumerSubscriber implements Flow.Subscriber<E>, Subscription {

        private final Consumer<? super E> consumer;
        private volatile Flow.Subscription subscription;
        private volatile boolean cancelled;

        ConsumerSubscriber(Consumer<? super E> consumer) {
            this.consumer = consumer;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            this.subscription = subscription;
            if (cancelled) {
                subscription.cancel();
            } else {
                subscription.request(1);
            }
        }

        @Override
        public void onNext(E item) {
            try {
                consumer.accept(item);
            } catch (RuntimeException e) {
                logger.warn("Consumer on channel {} failed for {}: {}", name, item, e.getMessage(), e);
            }
            if (!cancelled) {
                subscription.request(1);
            }
        }

        @Override
        public void onError(Throwable throwable) {
            logger.error("Channel {} delivery failed", name, throwable);
        }

        @Override
        public void onComplete() {
            logger.debug("Channel {} completed", name);
        }

        @Override
        public void close() {
            cancelled = true;
            Flow.Subscription current = subscription;
            if (current != null) {
                current.cancel();
            }
        }
    }
}
