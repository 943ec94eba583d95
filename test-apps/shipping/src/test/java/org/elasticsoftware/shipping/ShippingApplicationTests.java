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

package org.elasticsoftware.shipping;

import org.elasticsoftware.shipping.aggregates.cargo.CargoStatus;
import org.elasticsoftware.shipping.aggregates.cargo.Dimensions;
import org.elasticsoftware.shipping.aggregates.cargo.ShipmentType;
import org.elasticsoftware.shipping.aggregates.cargo.commands.*;
import org.elasticsoftware.shipping.query.CargoView;
import org.elasticsoftware.shipping.query.CargoViewProjection;
import org.elasticsoftware.shipping.query.GetCargoQuery;
import org.elasticsoftware.shipping.query.SearchCargoQuery;
import org.elasticsoftware.strata.ErrorCode;
import org.elasticsoftware.strata.commands.Command;
import org.elasticsoftware.strata.commands.CommandDispatcher;
import org.elasticsoftware.strata.commands.CommandResult;
import org.elasticsoftware.strata.eventstore.EventStore;
import org.elasticsoftware.strata.projection.ProjectionManager;
import org.elasticsoftware.strata.projection.ProjectionState;
import org.elasticsoftware.strata.protocol.CommandRecord;
import org.elasticsoftware.strata.protocol.QueryRecord;
import org.elasticsoftware.strata.query.QueryDispatcher;
import org.elasticsoftware.strata.query.QueryResult;
import org.elasticsoftware.strata.readmodel.Page;
import org.elasticsoftware.strata.readmodel.QueryCriteria;
import org.elasticsoftware.strata.readmodel.ReadStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

@SpringBootTest
public class ShippingApplicationTests {
    @Autowired
    private CommandDispatcher commandDispatcher;
    @Autowired
    private QueryDispatcher queryDispatcher;
    @Autowired
    private ProjectionManager projectionManager;
    @Autowired
    private EventStore eventStore;
    @Autowired
    private ReadStore readStore;

    private CommandResult send(String commandType, Command command) {
        return commandDispatcher.dispatch(new CommandRecord(commandType, "Cargo", command, "dispatcher"));
    }

    private String createCargo(String origin, String destination) {
        String cargoId = UUID.randomUUID().toString();
        CommandResult result = send("CreateCargo", new CreateCargoCommand(cargoId, origin, destination, 1000.0, 50.0));
        Assertions.assertTrue(result.success(), result.error());
        return cargoId;
    }

    private CommandResult load(String cargoId, String shipmentId, double weight) {
        return send("LoadShipment", new LoadShipmentCommand(cargoId, shipmentId, "crate of " + shipmentId, ShipmentType.FRAGILE,
                weight, new Dimensions(1.0, 2.0, 0.5), new BigDecimal("99.95"), "this side up", "dock-worker"));
    }

    @SuppressWarnings("unchecked")
    private Page<CargoView> search(SearchCargoQuery query) {
        QueryResult<Object> result = queryDispatcher.dispatch(new QueryRecord("SearchCargo", query));
        Assertions.assertTrue(result.success(), result.error());
        return (Page<CargoView>) result.data();
    }

    @Test
    public void testContextLoads() {
        Assertions.assertTrue(commandDispatcher.getSupportedCommandTypes().containsAll(List.of(
                "CreateCargo", "LoadShipment", "UnloadShipment", "StartTransport", "CompleteTransport", "DeleteCargo")));
        Assertions.assertTrue(queryDispatcher.getSupportedQueryTypes().containsAll(List.of("GetCargo", "SearchCargo")));
        Assertions.assertEquals(ProjectionState.RUNNING, projectionManager.getState(CargoViewProjection.NAME));
    }

    @Test
    public void testCargoLifecycleIsProjected() {
        String cargoId = createCargo("Rotterdam", "Hamburg");
        Assertions.assertTrue(load(cargoId, "s1", 120.0).success());
        Assertions.assertTrue(load(cargoId, "s2", 80.0).success());
        CommandResult started = send("StartTransport", new StartTransportCommand(cargoId, "TRUCK", "TRK-7", "driver-1", "A1",
                Instant.now().plus(1, ChronoUnit.DAYS), "dispatcher"));
        Assertions.assertTrue(started.success(), started.error());
        Assertions.assertEquals(4L, started.version());

        QueryResult<Object> result = queryDispatcher.dispatch(new QueryRecord("GetCargo", new GetCargoQuery(cargoId)));

        Assertions.assertTrue(result.success(), result.error());
        CargoView view = (CargoView) result.data();
        Assertions.assertEquals(4L, view.version());
        Assertions.assertEquals(CargoStatus.IN_TRANSIT, view.status());
        Assertions.assertEquals(200.0, view.currentWeight());
        Assertions.assertEquals(2, view.shipmentCount());
        Assertions.assertEquals("TRK-7", view.vehicleId());
        Assertions.assertEquals("dispatcher", eventStore.read(cargoId).get(0).issuer().id());
    }

    @Test
    public void testOverCapacityLoadIsRejected() {
        String cargoId = createCargo("Antwerp", "Bremen");
        Assertions.assertTrue(load(cargoId, "heavy-1", 800.0).success());

        CommandResult rejected = load(cargoId, "heavy-2", 300.0);

        Assertions.assertFalse(rejected.success());
        Assertions.assertEquals(ErrorCode.VALIDATION, rejected.errorCode());
        Assertions.assertTrue(rejected.error().contains("would exceed weight capacity"));
        Assertions.assertTrue(rejected.events().isEmpty());
        Assertions.assertEquals(2L, eventStore.currentVersion(cargoId));
        Assertions.assertEquals(2L, readStore.getById(CargoView.TYPE, cargoId).version());
    }

    @Test
    public void testMalformedCommandIsRejectedBeforeLoading() {
        String cargoId = createCargo("Antwerp", "Bremen");

        CommandResult rejected = load(cargoId, "", -5.0);

        Assertions.assertEquals(ErrorCode.VALIDATION, rejected.errorCode());
        Assertions.assertTrue(rejected.error().contains("shipmentId"));
        Assertions.assertTrue(rejected.error().contains("weight"));
        Assertions.assertEquals(1L, eventStore.currentVersion(cargoId));
    }

    @Test
    public void testSearchHidesDeletedCargoUnlessAsked() {
        String origin = "Gdansk-" + UUID.randomUUID();
        String kept = createCargo(origin, "Oslo");
        String deleted = createCargo(origin, "Bergen");
        Assertions.assertTrue(send("DeleteCargo", new DeleteCargoCommand(deleted, "customer cancelled", "dispatcher")).success());

        Page<CargoView> visible = search(new SearchCargoQuery(null, null, origin, null, null, null, false, null, null, 0, 10));
        Page<CargoView> all = search(new SearchCargoQuery(null, null, origin, null, null, null, true, "destination", "asc", 0, 10));

        Assertions.assertEquals(List.of(kept), visible.items().stream().map(CargoView::id).toList());
        Assertions.assertEquals(List.of(deleted, kept), all.items().stream().map(CargoView::id).toList());
        Assertions.assertTrue(all.items().get(0).deleted());
        CommandResult afterDelete = load(deleted, "s1", 1.0);
        Assertions.assertFalse(afterDelete.success());
    }

    @Test
    public void testSearchByTextAndInvalidSort() {
        String marker = "Lisbon-" + UUID.randomUUID();
        String cargoId = createCargo(marker, "Porto");
        load(cargoId, "ceramics-" + marker, 10.0);

        Page<CargoView> found = search(SearchCargoQuery.byText("ceramics-" + marker, 0, 0));
        QueryResult<Object> invalid = queryDispatcher.dispatch(new QueryRecord("SearchCargo",
                new SearchCargoQuery(null, null, null, null, null, null, false, "price", null, 0, 10)));

        Assertions.assertEquals(1L, found.totalCount());
        Assertions.assertEquals(cargoId, found.items().get(0).id());
        Assertions.assertEquals(ErrorCode.VALIDATION, invalid.errorCode());
    }

    @Test
    public void testRebuildReproducesReadModels() {
        String cargoId = createCargo("Le Havre", "Dublin");
        load(cargoId, "s1", 10.0);
        CargoView before = readStore.getById(CargoView.TYPE, cargoId);
        long count = readStore.count(CargoView.TYPE);

        projectionManager.rebuild(CargoViewProjection.NAME);

        Assertions.assertEquals(before, readStore.getById(CargoView.TYPE, cargoId));
        Assertions.assertEquals(count, readStore.count(CargoView.TYPE));
        Assertions.assertEquals(count, readStore.query(CargoView.TYPE, QueryCriteria.builder().limit(1000).build()).totalCount());
    }
}
