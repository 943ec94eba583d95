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

package org.elasticsoftware.accounts;

import org.elasticsoftware.accounts.aggregates.user.RoleType;
import org.elasticsoftware.accounts.aggregates.user.UserStatus;
import org.elasticsoftware.accounts.aggregates.user.commands.*;
import org.elasticsoftware.accounts.query.GetUserQuery;
import org.elasticsoftware.accounts.query.SearchUsersQuery;
import org.elasticsoftware.accounts.query.UserView;
import org.elasticsoftware.accounts.query.UserViewProjection;
import org.elasticsoftware.strata.ErrorCode;
import org.elasticsoftware.strata.commands.Command;
import org.elasticsoftware.strata.commands.CommandDispatcher;
import org.elasticsoftware.strata.commands.CommandResult;
import org.elasticsoftware.strata.eventstore.EventStore;
import org.elasticsoftware.strata.projection.ProjectionManager;
import org.elasticsoftware.strata.projection.ProjectionState;
import org.elasticsoftware.strata.protocol.CommandRecord;
import org.elasticsoftware.strata.protocol.DomainEventRecord;
import org.elasticsoftware.strata.protocol.QueryRecord;
import org.elasticsoftware.strata.query.QueryDispatcher;
import org.elasticsoftware.strata.query.QueryResult;
import org.elasticsoftware.strata.readmodel.Page;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.*;

@SpringBootTest
public class AccountsApplicationTests {
    @Autowired
    private CommandDispatcher commandDispatcher;
    @Autowired
    private QueryDispatcher queryDispatcher;
    @Autowired
    private ProjectionManager projectionManager;
    @Autowired
    private EventStore eventStore;

    private CommandResult send(String commandType, Command command) {
        return commandDispatcher.dispatch(new CommandRecord(commandType, "User", command));
    }

    private String createUser(String name) {
        String userId = UUID.randomUUID().toString();
        CommandResult result = send("CreateUser", new CreateUserCommand(userId, userId + "@example.com", name));
        Assertions.assertTrue(result.success(), result.error());
        return userId;
    }

    private UserView getUser(String userId) {
        QueryResult<Object> result = queryDispatcher.dispatch(new QueryRecord("GetUser", new GetUserQuery(userId)));
        Assertions.assertTrue(result.success(), result.error());
        return (UserView) result.data();
    }

    @Test
    public void testContextLoads() {
        Assertions.assertEquals(8, commandDispatcher.getSupportedCommandTypes().size());
        Assertions.assertTrue(queryDispatcher.getSupportedQueryTypes().containsAll(List.of("GetUser", "SearchUsers")));
        Assertions.assertEquals(ProjectionState.RUNNING, projectionManager.getState(UserViewProjection.NAME));
    }

    @Test
    public void testUserLifecycleIsProjected() {
        String userId = createUser("Jane Doe");
        Assertions.assertTrue(send("AssignRole", new AssignRoleCommand(userId, RoleType.MODERATOR, "admin-1", null)).success());
        Assertions.assertTrue(send("UpdateProfile", new UpdateProfileCommand(userId, "Jane", "Doe", null, null, null, "Ghent", "BE")).success());
        Assertions.assertTrue(send("DeactivateUser", new DeactivateUserCommand(userId, "on leave")).success());

        UserView view = getUser(userId);

        Assertions.assertEquals(4L, view.version());
        Assertions.assertEquals(UserStatus.DEACTIVATED, view.status());
        Assertions.assertEquals(List.of("MODERATOR", "USER"), view.roles());
        Assertions.assertEquals("Ghent", view.city());
    }

    @Test
    public void testSecondDeactivationIsRejected() {
        String userId = createUser("John Roe");
        Assertions.assertTrue(send("DeactivateUser", new DeactivateUserCommand(userId, "requested by user")).success());

        CommandResult second = send("DeactivateUser", new DeactivateUserCommand(userId, "requested again"));

        Assertions.assertFalse(second.success());
        Assertions.assertEquals(ErrorCode.VALIDATION, second.errorCode());
        Assertions.assertTrue(second.error().contains("already deactivated"));
        Assertions.assertEquals(2L, eventStore.currentVersion(userId));
        Assertions.assertEquals(2L, getUser(userId).version());
    }

    @Test
    public void testDuplicateCreateAndUnknownUser() {
        String userId = createUser("Ann Smith");

        CommandResult duplicate = send("CreateUser", new CreateUserCommand(userId, "ann@example.com", "Ann Smith"));
        CommandResult unknown = send("ActivateUser", new ActivateUserCommand(UUID.randomUUID().toString()));
        QueryResult<Object> missing = queryDispatcher.dispatch(new QueryRecord("GetUser", new GetUserQuery("nobody")));

        Assertions.assertFalse(duplicate.success());
        Assertions.assertEquals(ErrorCode.NOT_FOUND, unknown.errorCode());
        Assertions.assertEquals(ErrorCode.NOT_FOUND, missing.errorCode());
        Assertions.assertEquals(1L, eventStore.currentVersion(userId));
    }

    @Test
    public void testConcurrentCommandsKeepStreamContiguous() throws Exception {
        String userId = createUser("Busy Bee");
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<CommandResult>> futures = new ArrayList<>();
            for (RoleType roleType : List.of(RoleType.ADMIN, RoleType.SUPPORT, RoleType.DEVELOPER, RoleType.BETA_TESTER,
                    RoleType.GAME_MASTER, RoleType.PLAYER)) {
                futures.add(executor.submit(() -> send("AssignRole", new AssignRoleCommand(userId, roleType, "admin-1", null))));
            }
            long succeeded = 0;
            for (Future<CommandResult> future : futures) {
                CommandResult result = future.get(10, TimeUnit.SECONDS);
                if (result.success()) {
                    succeeded++;
                } else {
                    Assertions.assertEquals(ErrorCode.CONCURRENCY_CONFLICT, result.errorCode());
                }
            }

            List<DomainEventRecord> history = eventStore.read(userId);
            Assertions.assertEquals(1 + succeeded, history.size());
            for (int i = 0; i < history.size(); i++) {
                Assertions.assertEquals(i + 1L, history.get(i).version());
            }
            Assertions.assertEquals(history.size(), getUser(userId).version());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testSearchUsersByRole() {
        String country = "XX-" + UUID.randomUUID();
        String admin = createUser("Admin Person");
        String regular = createUser("Regular Person");
        send("UpdateProfile", new UpdateProfileCommand(admin, null, null, null, null, null, null, country));
        send("UpdateProfile", new UpdateProfileCommand(regular, null, null, null, null, null, null, country));
        send("AssignRole", new AssignRoleCommand(admin, RoleType.ADMIN, "root", null));

        QueryResult<Object> result = queryDispatcher.dispatch(new QueryRecord("SearchUsers",
                new SearchUsersQuery(null, null, List.of("ADMIN"), country, null, null, false, null, null, 0, 10)));

        Assertions.assertTrue(result.success(), result.error());
        @SuppressWarnings("unchecked")
        Page<UserView> page = (Page<UserView>) result.data();
        Assertions.assertEquals(List.of(admin), page.items().stream().map(UserView::id).toList());
    }

    @Test
    public void testSearchWithEmptyRoleIsRejected() {
        QueryResult<Object> result = queryDispatcher.dispatch(new QueryRecord("SearchUsers",
                new SearchUsersQuery(null, null, Arrays.asList("ADMIN", null), null, null, null, false, null, null, 0, 10)));

        Assertions.assertFalse(result.success());
        Assertions.assertEquals(ErrorCode.VALIDATION, result.errorCode());
    }
}
