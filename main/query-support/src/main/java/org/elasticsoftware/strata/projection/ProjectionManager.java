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

package org.elasticsoftware.strata.projection;

import org.elasticsoftware.strata.eventbus.EventBus;
import org.elasticsoftware.strata.eventbus.EventSubscriber;
import org.elasticsoftware.strata.protocol.DomainEventRecord;
import org.elasticsoftware.strata.registry.FreezableRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns the registered projections and their subscriptions on the {@link EventBus}. Every
 * projection is subscribed separately, so a failing projection is marked {@link ProjectionState#FAULTED}
 * and stops receiving events without affecting the others. A faulted projection recovers through
 * {@link #rebuild(String)}.
 * <p>
 * A rebuild holds the projection's write lock; live deliveries wait for it and then skip what the
 * rebuild already applied.
 */
public class ProjectionManager extends FreezableRegistry implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(ProjectionManager.class);
    private final EventBus eventBus;
    private final Map<String, ManagedProjection> projections = new LinkedHashMap<>();
    private final List<ProjectionFailure> failures = new CopyOnWriteArrayList<>();

    public ProjectionManager(EventBus eventBus) {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
    }

    public synchronized ProjectionManager register(Projection projection) {
        checkNotFrozen();
        if (projections.containsKey(projection.getName())) {
            throw new IllegalStateException("Duplicate Projection " + projection.getName());
        }
        projections.put(projection.getName(), new ManagedProjection(projection));
        return this;
    }

    @Override
    protected void onFreeze() {
        projections.values().forEach(managed -> {
            managed.state = ProjectionState.RUNNING;
            eventBus.subscribe(managed);
            log.info("Projection {} version {} subscribed to {}", managed.getName(),
                    managed.projection.getVersion(), managed.projection.getHandledEventTypes());
        });
    }

    public Set<String> getProjectionNames() {
        return Collections.unmodifiableSet(projections.keySet());
    }

    public ProjectionState getState(String name) {
        return get(name).state;
    }

    public List<ProjectionFailure> getFailures() {
        return List.copyOf(failures);
    }

    public List<ProjectionFailure> getFailures(String name) {
        return failures.stream().filter(failure -> failure.projectionName().equals(name)).toList();
    }

    public ProjectionMetrics getMetrics(String name) {
        return get(name).metrics();
    }

    public List<ProjectionMetrics> getMetrics() {
        return projections.values().stream().map(ManagedProjection::metrics).toList();
    }

    public void rebuild(String name) {
        checkFrozen();
        get(name).rebuild();
    }

    public void rebuildAll() {
        checkFrozen();
        projections.values().forEach(ManagedProjection::rebuild);
    }

    public void reset(String name) {
        checkFrozen();
        get(name).reset();
    }

    /**
     * Stops delivery to the projection; events published while stopped are not applied until a rebuild.
     */
    public void stop(String name) {
        checkFrozen();
        get(name).state = ProjectionState.STOPPED;
        log.info("Projection {} stopped", name);
    }

    /**
     * Resumes a stopped projection by rebuilding it.
     */
    public void start(String name) {
        checkFrozen();
        ManagedProjection managed = get(name);
        if (managed.state == ProjectionState.STOPPED) {
            managed.rebuild();
        }
    }

    @Override
    public void close() {
        projections.values().forEach(managed -> {
            eventBus.unsubscribe(managed.getName());
            managed.state = ProjectionState.STOPPED;
        });
    }

    private ManagedProjection get(String name) {
        ManagedProjection managed = projections.get(name);
        if (managed == null) {
            throw new NoSuchElementException("Unknown Projection " + name);
        }
        return managed;
    }

    private void recordFailure(String projectionName, DomainEventRecord event, RuntimeException exception) {
        failures.add(new ProjectionFailure(projectionName,
                event != null ? event.eventType() : null,
                event != null ? event.aggregateId() : null,
                event != null ? event.version() : 0L,
                exception.getMessage(),
                Instant.now()));
    }

    private final class ManagedProjection implements EventSubscriber {
        private final Projection projection;
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        private volatile ProjectionState state = ProjectionState.STOPPED;
        private final AtomicLong eventsProcessed = new AtomicLong();
        private final AtomicLong processingNanos = new AtomicLong();
        private volatile Instant lastProcessedAt;

        private ManagedProjection(Projection projection) {
            this.projection = projection;
        }

        @Override
        public String getName() {
            return projection.getName();
        }

        @Override
        public boolean canHandle(String eventType) {
            return projection.canHandle(eventType);
        }

        @Override
        public void handle(DomainEventRecord event) {
            lock.readLock().lock();
            try {
                if (state != ProjectionState.RUNNING) {
                    log.debug("Projection {} is {}, skipping {} v{} of {}", getName(), state, event.eventType(), event.version(), event.aggregateId());
                    return;
                }
                long start = System.nanoTime();
                projection.project(event);
                processingNanos.addAndGet(System.nanoTime() - start);
                eventsProcessed.incrementAndGet();
                lastProcessedAt = Instant.now();
            } catch (RuntimeException e) {
                state = ProjectionState.FAULTED;
                recordFailure(getName(), event, e);
                log.error("Projection {} failed on {} v{} of {} {} and is now FAULTED",
                        getName(), event.eventType(), event.version(), event.aggregateType(), event.aggregateId(), e);
            } finally {
                lock.readLock().unlock();
            }
        }

        ProjectionMetrics metrics() {
            long processed = eventsProcessed.get();
            Duration average = processed == 0L ? Duration.ZERO : Duration.ofNanos(processingNanos.get() / processed);
            return new ProjectionMetrics(getName(), state, processed, average, lastProcessedAt, getFailures(getName()).size());
        }

        void rebuild() {
            lock.writeLock().lock();
            try {
                state = ProjectionState.REBUILDING;
                log.info("Rebuilding Projection {}", getName());
                projection.rebuild();
                state = ProjectionState.RUNNING;
            } catch (RuntimeException e) {
                state = ProjectionState.FAULTED;
                recordFailure(getName(), null, e);
                log.error("Rebuild of Projection {} failed", getName(), e);
                throw e instanceof ProjectionException projectionException ? projectionException
                        : new ProjectionException(getName(), "Rebuild of " + getName() + " failed", e);
            } finally {
                lock.writeLock().unlock();
            }
        }

        void reset() {
            lock.writeLock().lock();
            try {
                projection.reset();
            } finally {
                lock.writeLock().unlock();
            }
        }
    }
}
