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

package org.elasticsoftware.strata.aggregate;

import jakarta.annotation.Nonnull;
import jakarta.annotation.Nullable;
import org.elasticsoftware.strata.PersistenceException;
import org.elasticsoftware.strata.ValidationException;
import org.elasticsoftware.strata.events.DomainEvent;
import org.elasticsoftware.strata.events.DomainEventType;
import org.elasticsoftware.strata.events.Issuer;
import org.elasticsoftware.strata.protocol.DomainEventRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base class of every event-sourced entity. The state {@code S} is the fold of the aggregate's
 * events through its {@link EventSourcingHandlers}; business methods on subclasses validate against
 * {@link #getState()} and then {@link #raise(DomainEvent)} new events, which are applied at once and
 * kept as uncommitted changes until a repository saves them.
 * <p>
 * An instance is owned by a single command execution and is not thread-safe.
 */
public abstract class AggregateRoot<S extends AggregateState> {
    private final String id;
    private final EventSourcingHandlers<S> handlers;
    private final List<DomainEventRecord> uncommittedChanges = new ArrayList<>();
    private S state;
    private long originalVersion = 0L;
    private long currentVersion = 0L;
    private boolean deleted = false;
    private Issuer issuer = Issuer.SYSTEM;

    protected AggregateRoot(@Nonnull String id, @Nonnull EventSourcingHandlers<S> handlers) {
        this.id = Objects.requireNonNull(id, "id");
        this.handlers = Objects.requireNonNull(handlers, "handlers");
    }

    public final String getId() {
        return id;
    }

    public final String getType() {
        return handlers.getAggregateType();
    }

    public final long getOriginalVersion() {
        return originalVersion;
    }

    public final long getCurrentVersion() {
        return currentVersion;
    }

    public final boolean isDeleted() {
        return deleted;
    }

    @Nullable
    public final S getState() {
        return state;
    }

    public final List<DomainEventRecord> getUncommittedChanges() {
        return List.copyOf(uncommittedChanges);
    }

    public final boolean hasUncommittedChanges() {
        return !uncommittedChanges.isEmpty();
    }

    /**
     * Sets the issuer stamped on events raised from now on.
     */
    public final void setIssuer(@Nonnull Issuer issuer) {
        this.issuer = Objects.requireNonNull(issuer, "issuer");
    }

    /**
     * Called by a repository once the uncommitted changes are durably stored.
     */
    public final void markChangesAsCommitted() {
        uncommittedChanges.clear();
        originalVersion = currentVersion;
    }

    /**
     * Rebuilds this (fresh) instance from its stored history.
     */
    public final void replay(@Nonnull List<DomainEventRecord> history) {
        if (currentVersion != 0L) {
            throw new IllegalStateException("Cannot replay history into " + getType() + " " + id + " at version " + currentVersion);
        }
        for (DomainEventRecord record : history) {
            apply(record, false);
        }
        originalVersion = currentVersion;
    }

    /**
     * Folds one event into the state. New events are recorded as uncommitted changes, replayed
     * events only advance state and version.
     */
    public final void apply(@Nonnull DomainEventRecord record, boolean isNew) {
        if (!id.equals(record.aggregateId())) {
            throw new IllegalArgumentException("DomainEvent for aggregate " + record.aggregateId() + " cannot be applied to " + getType() + " " + id);
        }
        if (record.version() != currentVersion + 1) {
            throw new PersistenceException("Non-contiguous event stream for " + getType() + " " + id
                    + ": expected version " + (currentVersion + 1) + " but got " + record.version(), getType(), id);
        }
        DomainEventType<?> eventType = handlers.getEventType(record.eventType());
        if (eventType.create() != (currentVersion == 0L)) {
            throw new IllegalStateException("DomainEvent " + record.eventType() + " cannot be applied to "
                    + getType() + " " + id + " at version " + currentVersion);
        }
        state = handlers.apply(record, state);
        currentVersion = record.version();
        if (eventType.delete()) {
            deleted = true;
        }
        if (isNew) {
            uncommittedChanges.add(record);
        }
    }

    /**
     * Structural invariants checked before every save. Subclasses extend this with their own checks.
     */
    public void validate() {
        if (id.isBlank()) {
            throw invalid("Aggregate id must not be blank");
        }
        if (getType().isBlank()) {
            throw invalid("Aggregate type must not be blank");
        }
    }

    protected final void raise(@Nonnull DomainEvent event) {
        if (deleted) {
            throw new AggregateDeletedException(getType(), id);
        }
        if (!id.equals(event.getAggregateId())) {
            throw new IllegalArgumentException("DomainEvent " + event.getClass().getSimpleName()
                    + " targets aggregate " + event.getAggregateId() + " but was raised by " + getType() + " " + id);
        }
        DomainEventType<?> eventType = handlers.getEventType(event.getClass());
        apply(new DomainEventRecord(eventType.typeName(), id, getType(), currentVersion + 1, Instant.now(), issuer, event), true);
    }

    /**
     * Soft-deletes this aggregate by raising its delete event. No further events can be raised afterwards.
     */
    protected final void markAsDeleted(@Nonnull DomainEvent deletionEvent) {
        DomainEventType<?> eventType = handlers.getEventType(deletionEvent.getClass());
        if (!eventType.delete()) {
            throw new IllegalArgumentException("DomainEvent " + eventType.typeName() + " is not a delete event");
        }
        raise(deletionEvent);
    }

    /**
     * Returns the current state, failing when the aggregate was never created.
     */
    protected final S requireState() {
        if (state == null) {
            throw invalid(getType() + " " + id + " has not been created");
        }
        return state;
    }

    protected final ValidationException invalid(String message) {
        return new ValidationException(message, getType(), id);
    }

    @Override
    public String toString() {
        return getType() + "{" + id + ", version=" + currentVersion + (deleted ? ", deleted" : "") + "}";
    }
}
