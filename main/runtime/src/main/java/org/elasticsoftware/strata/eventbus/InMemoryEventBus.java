/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.strata.eventbus;

import org.elasticsoftware.strata.protocol.DomainEventRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process event bus. With zero partitions events are delivered on the publishing thread; with
 * {@code n} partitions every aggregate id is pinned to one of {@code n} single threaded executors,
 * which keeps delivery FIFO per aggregate while different aggregates are delivered in parallel.
 * <p>
 * Subscribers are invoked in subscription order. A subscriber that throws is logged and counted,
 * delivery to the remaining subscribers continues.
 */
public class InMemoryEventBus implements EventBus, Closeable {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);
    private final List<EventSubscriber> subscribers = new CopyOnWriteArrayList<>();
    private final ExecutorService[] partitions;
    private final AtomicLong publishedCount = new AtomicLong();
    private final AtomicLong deliveryFailureCount = new AtomicLong();
    private volatile boolean closed = false;

    public InMemoryEventBus() {
        this(0);
    }

    public InMemoryEventBus(int partitions) {
        if (partitions < 0) {
            throw new IllegalArgumentException("partitions must not be negative, got " + partitions);
        }
        this.partitions = new ExecutorService[partitions];
        for (int i = 0; i < partitions; i++) {
            final String threadName = "strata-eventbus-" + i;
            this.partitions[i] = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable, threadName);
                thread.setDaemon(true);
                return thread;
            });
        }
        log.info("InMemoryEventBus started with {} partition(s)", partitions);
    }

    @Override
    public void publish(DomainEventRecord event) {
        if (closed) {
            throw new IllegalStateException("InMemoryEventBus is closed");
        }
        publishedCount.incrementAndGet();
        if (partitions.length == 0) {
            deliver(event);
        } else {
            partitions[PartitionUtils.partitionFor(event.aggregateId(), partitions.length)].execute(() -> deliver(event));
        }
    }

    private void deliver(DomainEventRecord event) {
        for (EventSubscriber subscriber : subscribers) {
            if (subscriber.canHandle(event.eventType())) {
                try {
                    subscriber.handle(event);
                } catch (RuntimeException e) {
                    deliveryFailureCount.incrementAndGet();
                    log.error("Subscriber {} failed to handle DomainEvent {} v{} of {} {}",
                            subscriber.getName(), event.eventType(), event.version(), event.aggregateType(), event.aggregateId(), e);
                }
            }
        }
    }

    @Override
    public synchronized void subscribe(EventSubscriber subscriber) {
        if (subscribers.stream().anyMatch(existing -> existing.getName().equals(subscriber.getName()))) {
            throw new IllegalStateException("Subscriber " + subscriber.getName() + " is already subscribed");
        }
        subscribers.add(subscriber);
        log.debug("Subscribed {}", subscriber.getName());
    }

    @Override
    public synchronized void unsubscribe(String subscriberName) {
        if (subscribers.removeIf(subscriber -> subscriber.getName().equals(subscriberName))) {
            log.debug("Unsubscribed {}", subscriberName);
        }
    }

    /**
     * Waits until every event published before this call has been delivered.
     *
     * @return false when the timeout elapsed first
     */
    public boolean awaitDelivery(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        List<Future<?>> barriers = new ArrayList<>(partitions.length);
        for (ExecutorService partition : partitions) {
            barriers.add(partition.submit(() -> { }));
        }
        for (Future<?> barrier : barriers) {
            try {
                barrier.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                return false;
            } catch (ExecutionException e) {
                throw new IllegalStateException("Delivery barrier failed", e.getCause());
            }
        }
        return true;
    }

    public long getPublishedCount() {
        return publishedCount.get();
    }

    public long getDeliveryFailureCount() {
        return deliveryFailureCount.get();
    }

    public int getPartitionCount() {
        return partitions.length;
    }

    @Override
    public void close() {
        closed = true;
        for (ExecutorService partition : partitions) {
            partition.shutdown();
        }
        for (ExecutorService partition : partitions) {
            try {
                if (!partition.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("EventBus partition did not terminate in time, {} task(s) dropped", partition.shutdownNow().size());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                partition.shutdownNow();
            }
        }
    }
}
