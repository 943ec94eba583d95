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

package org.elasticsoftware.accounts.aggregates.user;

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.accounts.aggregates.user.commands.*;
import org.elasticsoftware.accounts.aggregates.user.events.*;
import org.elasticsoftware.strata.aggregate.AggregateRoot;
import org.elasticsoftware.strata.aggregate.EventSourcingHandlers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

public final class User extends AggregateRoot<UserState> {
    public static final String TYPE = "User";
    private static final Logger log = LoggerFactory.getLogger(User.class);
    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    public static final EventSourcingHandlers<UserState> EVENT_SOURCING_HANDLERS = EventSourcingHandlers.<UserState>builder(TYPE)
            .on(UserCreatedEvent.TYPE, User::created)
            .on(EmailChangedEvent.TYPE, (event, state) -> state.withEmail(event.newEmail()))
            .on(UserDeactivatedEvent.TYPE, (event, state) -> state.withStatus(UserStatus.DEACTIVATED, event.reason(), event.deactivatedAt()))
            .on(UserActivatedEvent.TYPE, (event, state) -> state.withStatus(UserStatus.ACTIVE, null, null))
            .on(RoleAssignedEvent.TYPE, User::roleAssigned)
            .on(RoleRevokedEvent.TYPE, User::roleRevoked)
            .on(ProfileUpdatedEvent.TYPE, (event, state) -> state.withProfile(event.profile()))
            .on(UserDeletedEvent.TYPE, (event, state) -> state)
            .build();

    public User(String id) {
        super(id, EVENT_SOURCING_HANDLERS);
    }

    public void create(@NotNull CreateUserCommand cmd) {
        if (getCurrentVersion() != 0L) {
            throw invalid("user " + getId() + " is already created");
        }
        requireValidEmail(cmd.email());
        log.info("CommandHandler: Creating User {} with email {}", getId(), cmd.email());
        raise(new UserCreatedEvent(getId(), cmd.email(), cmd.name(), Instant.now()));
    }

    public void changeEmail(@NotNull ChangeEmailCommand cmd) {
        UserState state = requireState();
        if (state.status() == UserStatus.DEACTIVATED) {
            throw invalid("cannot change email of deactivated user");
        }
        if (state.email().equalsIgnoreCase(cmd.newEmail())) {
            throw invalid("new email is the same as current email");
        }
        requireValidEmail(cmd.newEmail());
        raise(new EmailChangedEvent(getId(), state.email(), cmd.newEmail()));
    }

    public void deactivate(@NotNull DeactivateUserCommand cmd) {
        UserState state = requireState();
        if (state.status() == UserStatus.DEACTIVATED) {
            throw invalid("user is already deactivated");
        }
        if (cmd.reason() == null || cmd.reason().isBlank()) {
            throw invalid("deactivation reason cannot be empty");
        }
        log.info("CommandHandler: Deactivating User {}: {}", getId(), cmd.reason());
        raise(new UserDeactivatedEvent(getId(), cmd.reason(), Instant.now()));
    }

    public void activate(@NotNull ActivateUserCommand cmd) {
        UserState state = requireState();
        if (state.status() == UserStatus.ACTIVE) {
            throw invalid("user is already active");
        }
        raise(new UserActivatedEvent(getId(), Instant.now()));
    }

    public void assignRole(@NotNull AssignRoleCommand cmd) {
        UserState state = requireState();
        if (state.status() == UserStatus.DEACTIVATED) {
            throw invalid("cannot assign role to deactivated user");
        }
        if (state.hasRole(cmd.roleType())) {
            throw invalid("user already has role: " + cmd.roleType());
        }
        Instant now = Instant.now();
        if (cmd.expiresAt() != null && !cmd.expiresAt().isAfter(now)) {
            throw invalid("expiration time cannot be in the past");
        }
        raise(new RoleAssignedEvent(getId(), cmd.roleType(), cmd.assignedBy(), now, cmd.expiresAt()));
    }

    public void revokeRole(@NotNull RevokeRoleCommand cmd) {
        UserState state = requireState();
        if (!state.hasRole(cmd.roleType())) {
            throw invalid("user does not have role: " + cmd.roleType());
        }
        if (cmd.roleType() == RoleType.USER && state.roles().size() == 1) {
            throw invalid("cannot revoke the last user role");
        }
        raise(new RoleRevokedEvent(getId(), cmd.roleType(), cmd.revokedBy()));
    }

    public void updateProfile(@NotNull UpdateProfileCommand cmd) {
        UserState state = requireState();
        if (state.status() == UserStatus.DEACTIVATED) {
            throw invalid("cannot update profile of deactivated user");
        }
        UserProfile current = state.profile();
        UserProfile updated = new UserProfile(
                cmd.firstName() != null ? cmd.firstName() : current.firstName(),
                cmd.lastName() != null ? cmd.lastName() : current.lastName(),
                cmd.displayName() != null ? cmd.displayName() : current.displayName(),
                cmd.bio() != null ? cmd.bio() : current.bio(),
                cmd.phoneNumber() != null ? cmd.phoneNumber() : current.phoneNumber(),
                cmd.city() != null ? cmd.city() : current.city(),
                cmd.country() != null ? cmd.country() : current.country());
        if (updated.equals(current)) {
            // nothing changed, nothing to record
            return;
        }
        raise(new ProfileUpdatedEvent(getId(), updated));
    }

    public void delete(@NotNull DeleteUserCommand cmd) {
        requireState();
        log.info("CommandHandler: Deleting User {}: {}", getId(), cmd.reason());
        markAsDeleted(new UserDeletedEvent(getId(), cmd.reason(), cmd.deletedBy()));
    }

    @Override
    public void validate() {
        super.validate();
        UserState state = getState();
        if (state == null) {
            return;
        }
        if (state.email().isBlank()) {
            throw invalid("user email cannot be empty");
        }
        if (state.name().isBlank()) {
            throw invalid("user name cannot be empty");
        }
        requireValidEmail(state.email());
    }

    private void requireValidEmail(String email) {
        if (email == null || !EMAIL_PATTERN.matcher(email).matches()) {
            throw invalid("invalid email format: " + email);
        }
    }

    static @NotNull UserState created(@NotNull UserCreatedEvent event, UserState isNull) {
        return new UserState(event.id(), event.email(), event.name(), UserStatus.ACTIVE, UserProfile.initial(event.name()),
                List.of(new Role(RoleType.USER, "system", event.createdAt(), null)), null, null);
    }

    static @NotNull UserState roleAssigned(@NotNull RoleAssignedEvent event, @NotNull UserState state) {
        List<Role> roles = new ArrayList<>(state.roles());
        roles.add(new Role(event.roleType(), event.assignedBy(), event.assignedAt(), event.expiresAt()));
        return state.withRoles(roles);
    }

    static @NotNull UserState roleRevoked(@NotNull RoleRevokedEvent event, @NotNull UserState state) {
        return state.withRoles(state.roles().stream().filter(role -> !Objects.equals(role.type(), event.roleType())).toList());
    }
}
