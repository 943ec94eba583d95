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

package org.elasticsoftware.accounts.query;

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.accounts.aggregates.user.User;
import org.elasticsoftware.accounts.aggregates.user.UserProfile;
import org.elasticsoftware.accounts.aggregates.user.UserStatus;
import org.elasticsoftware.accounts.aggregates.user.events.*;
import org.elasticsoftware.strata.eventstore.EventStore;
import org.elasticsoftware.strata.projection.ReadModelProjection;
import org.elasticsoftware.strata.protocol.DomainEventRecord;
import org.elasticsoftware.strata.readmodel.ReadStore;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps one {@link UserView} per {@link User}. Role names are kept sorted.
 */
public final class UserViewProjection {
    public static final String NAME = "UserViewProjection";

    private UserViewProjection() {
    }

    public static ReadModelProjection<UserView> create(ReadStore readStore, EventStore eventStore) {
        return ReadModelProjection.builder(NAME, UserView.TYPE)
                .setVersion("1")
                .setReadStore(readStore)
                .setEventStore(eventStore)
                .addAggregateType(User.TYPE)
                .addCreateHandler(UserCreatedEvent.TYPE, UserViewProjection::created)
                .addEventHandler(EmailChangedEvent.TYPE, UserViewProjection::emailChanged)
                .addEventHandler(UserDeactivatedEvent.TYPE, (event, record, view) -> withStatus(view, record, UserStatus.DEACTIVATED))
                .addEventHandler(UserActivatedEvent.TYPE, (event, record, view) -> withStatus(view, record, UserStatus.ACTIVE))
                .addEventHandler(RoleAssignedEvent.TYPE, UserViewProjection::roleAssigned)
                .addEventHandler(RoleRevokedEvent.TYPE, UserViewProjection::roleRevoked)
                .addEventHandler(ProfileUpdatedEvent.TYPE, UserViewProjection::profileUpdated)
                .addEventHandler(UserDeletedEvent.TYPE, UserViewProjection::deleted)
                .build();
    }

    static @NotNull UserView created(@NotNull UserCreatedEvent event, @NotNull DomainEventRecord record, UserView isNull) {
        return new UserView(event.id(), record.version(), event.email(), event.name(), null, null, UserStatus.ACTIVE,
                List.of("USER"), null, null, event.createdAt(), record.timestamp(), false);
    }

    static @NotNull UserView emailChanged(@NotNull EmailChangedEvent event, @NotNull DomainEventRecord record, @NotNull UserView view) {
        return new UserView(view.id(), record.version(), event.newEmail(), view.name(), view.firstName(), view.lastName(),
                view.status(), view.roles(), view.city(), view.country(), view.createdAt(), record.timestamp(), view.deleted());
    }

    static @NotNull UserView withStatus(@NotNull UserView view, @NotNull DomainEventRecord record, @NotNull UserStatus status) {
        return new UserView(view.id(), record.version(), view.email(), view.name(), view.firstName(), view.lastName(),
                status, view.roles(), view.city(), view.country(), view.createdAt(), record.timestamp(), view.deleted());
    }

    static @NotNull UserView roleAssigned(@NotNull RoleAssignedEvent event, @NotNull DomainEventRecord record, @NotNull UserView view) {
        List<String> roles = new ArrayList<>(view.roles());
        if (!roles.contains(event.roleType().name())) {
            roles.add(event.roleType().name());
            roles.sort(null);
        }
        return new UserView(view.id(), record.version(), view.email(), view.name(), view.firstName(), view.lastName(),
                view.status(), roles, view.city(), view.country(), view.createdAt(), record.timestamp(), view.deleted());
    }

    static @NotNull UserView roleRevoked(@NotNull RoleRevokedEvent event, @NotNull DomainEventRecord record, @NotNull UserView view) {
        List<String> roles = view.roles().stream().filter(role -> !role.equals(event.roleType().name())).toList();
        return new UserView(view.id(), record.version(), view.email(), view.name(), view.firstName(), view.lastName(),
                view.status(), roles, view.city(), view.country(), view.createdAt(), record.timestamp(), view.deleted());
    }

    static @NotNull UserView profileUpdated(@NotNull ProfileUpdatedEvent event, @NotNull DomainEventRecord record, @NotNull UserView view) {
        UserProfile profile = event.profile();
        return new UserView(view.id(), record.version(), view.email(), view.name(), profile.firstName(), profile.lastName(),
                view.status(), view.roles(), profile.city(), profile.country(), view.createdAt(), record.timestamp(), view.deleted());
    }

    static @NotNull UserView deleted(@NotNull UserDeletedEvent event, @NotNull DomainEventRecord record, @NotNull UserView view) {
        return new UserView(view.id(), record.version(), view.email(), view.name(), view.firstName(), view.lastName(),
                view.status(), view.roles(), view.city(), view.country(), view.createdAt(), record.timestamp(), true);
    }
}
