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

package org.elasticsoftware.shipping.aggregates.cargo;

import org.elasticsoftware.shipping.aggregates.cargo.commands.*;
import org.elasticsoftware.shipping.aggregates.cargo.events.ShipmentUnloadedEvent;
import org.elasticsoftware.strata.ValidationException;
import org.elasticsoftware.strata.aggregate.AggregateDeletedException;
import org.elasticsoftware.strata.protocol.DomainEventRecord;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

public class CargoTests {
    private static final String CARGO_ID = "cargo-1";

    private static Cargo committed(Cargo cargo) {
        cargo.markChangesAsCommitted();
        return cargo;
    }

    private static Cargo createdCargo(double maxWeight, double maxVolume) {
        Cargo cargo = new Cargo(CARGO_ID);
        cargo.create(new CreateCargoCommand(CARGO_ID, "Rotterdam", "Hamburg", maxWeight, maxVolume));
        return committed(cargo);
    }

    private static LoadShipmentCommand load(String shipmentId, double weight) {
        return new LoadShipmentCommand(CARGO_ID, shipmentId, "pallet " + shipmentId, ShipmentType.GENERAL, weight,
                new Dimensions(1.0, 1.0, 1.0), new BigDecimal("250.00"), null, "dock-worker");
    }

    private static StartTransportCommand start() {
        return new StartTransportCommand(CARGO_ID, "TRUCK", "TRK-42", "driver-7", "A15",
                Instant.now().plus(2, ChronoUnit.DAYS), "dispatcher");
    }

    @Test
    public void testCreateCargo() {
        Cargo cargo = new Cargo(CARGO_ID);
        cargo.create(new CreateCargoCommand(CARGO_ID, "Rotterdam", "Hamburg", 1000.0, 50.0));

        Assertions.assertEquals(1L, cargo.getCurrentVersion());
        Assertions.assertEquals(CargoStatus.CREATED, cargo.getState().status());
        Assertions.assertEquals("CargoCreated", cargo.getUncommittedChanges().get(0).eventType());
        Assertions.assertThrows(ValidationException.class,
                () -> cargo.create(new CreateCargoCommand(CARGO_ID, "Rotterdam", "Hamburg", 1000.0, 50.0)));
    }

    @Test
    public void testOriginAndDestinationMustDiffer() {
        Cargo cargo = new Cargo(CARGO_ID);

        ValidationException exception = Assertions.assertThrows(ValidationException.class,
                () -> cargo.create(new CreateCargoCommand(CARGO_ID, "Rotterdam", " rotterdam ", 1000.0, 50.0)));

        Assertions.assertTrue(exception.getMessage().contains("must differ"));
        Assertions.assertEquals(0L, cargo.getCurrentVersion());
    }

    @Test
    public void testLoadingOverWeightCapacityIsRejected() {
        Cargo cargo = createdCargo(1000.0, 50.0);
        cargo.loadShipment(load("s1", 800.0));
        committed(cargo);

        ValidationException exception = Assertions.assertThrows(ValidationException.class,
                () -> cargo.loadShipment(load("s2", 300.0)));

        Assertions.assertTrue(exception.getMessage().contains("would exceed weight capacity"));
        Assertions.assertTrue(exception.getMessage().contains("current: 800.00, max: 1000.00, adding: 300.00"));
        Assertions.assertEquals(2L, cargo.getCurrentVersion());
        Assertions.assertFalse(cargo.hasUncommittedChanges());
        Assertions.assertEquals(800.0, cargo.getState().currentWeight());
    }

    @Test
    public void testLoadingOverVolumeCapacityIsRejected() {
        Cargo cargo = createdCargo(1000.0, 1.5);
        cargo.loadShipment(load("s1", 10.0));
        committed(cargo);

        ValidationException exception = Assertions.assertThrows(ValidationException.class,
                () -> cargo.loadShipment(load("s2", 10.0)));

        Assertions.assertTrue(exception.getMessage().contains("would exceed volume capacity"));
        Assertions.assertEquals(2L, cargo.getCurrentVersion());
    }

    @Test
    public void testDuplicateShipmentIsRejected() {
        Cargo cargo = createdCargo(1000.0, 50.0);
        cargo.loadShipment(load("s1", 10.0));

        Assertions.assertThrows(ValidationException.class, () -> cargo.loadShipment(load("s1", 10.0)));
        Assertions.assertEquals(CargoStatus.LOADING, cargo.getState().status());
        Assertions.assertEquals(1, cargo.getState().shipments().size());
    }

    @Test
    public void testTransportLifecycle() {
        Cargo cargo = createdCargo(1000.0, 50.0);
        Assertions.assertThrows(ValidationException.class, () -> cargo.startTransport(start()));

        cargo.loadShipment(load("s1", 100.0));
        cargo.loadShipment(load("s2", 200.0));
        cargo.startTransport(start());

        Assertions.assertEquals(CargoStatus.IN_TRANSIT, cargo.getState().status());
        Assertions.assertTrue(cargo.getState().shipments().stream().allMatch(shipment -> shipment.status() == ShipmentStatus.IN_TRANSIT));
        Assertions.assertEquals("TRK-42", cargo.getState().transport().vehicleId());
        Assertions.assertThrows(ValidationException.class, () -> cargo.loadShipment(load("s3", 1.0)));
        Assertions.assertThrows(ValidationException.class,
                () -> cargo.delete(new DeleteCargoCommand(CARGO_ID, "cancelled", "dispatcher")));

        cargo.completeTransport(new CompleteTransportCommand(CARGO_ID, "driver-7", "left at gate 3"));

        Assertions.assertEquals(CargoStatus.COMPLETED, cargo.getState().status());
        Assertions.assertNotNull(cargo.getState().transport().completedAt());
        Assertions.assertTrue(cargo.getState().shipments().stream().allMatch(shipment -> shipment.status() == ShipmentStatus.DELIVERED));
        Assertions.assertEquals(5L, cargo.getCurrentVersion());
    }

    @Test
    public void testEstimatedArrivalMustBeInTheFuture() {
        Cargo cargo = createdCargo(1000.0, 50.0);
        cargo.loadShipment(load("s1", 100.0));

        Assertions.assertThrows(ValidationException.class, () -> cargo.startTransport(new StartTransportCommand(CARGO_ID,
                "TRUCK", "TRK-42", null, null, Instant.now().minusSeconds(60), "dispatcher")));
        Assertions.assertEquals(CargoStatus.LOADING, cargo.getState().status());
    }

    @Test
    public void testUnloadingShipments() {
        Cargo cargo = createdCargo(1000.0, 50.0);
        cargo.loadShipment(load("s1", 100.0));
        cargo.loadShipment(load("s2", 200.0));

        cargo.unloadShipment(new UnloadShipmentCommand(CARGO_ID, "s1", "dock-worker", "damaged", "Rotterdam", false));

        Assertions.assertEquals(CargoStatus.UNLOADING, cargo.getState().status());
        Assertions.assertEquals(200.0, cargo.getState().currentWeight());
        Assertions.assertEquals(ShipmentStatus.UNLOADED, cargo.getState().findShipment("s1").orElseThrow().status());
        Assertions.assertThrows(ValidationException.class,
                () -> cargo.unloadShipment(new UnloadShipmentCommand(CARGO_ID, "s1", "dock-worker", null, null, false)));
        Assertions.assertThrows(ValidationException.class,
                () -> cargo.unloadShipment(new UnloadShipmentCommand(CARGO_ID, "s9", "dock-worker", null, null, false)));

        cargo.unloadShipment(new UnloadShipmentCommand(CARGO_ID, "s2", "dock-worker", null, "Hamburg", true));

        Assertions.assertEquals(CargoStatus.COMPLETED, cargo.getState().status());
        Assertions.assertTrue(cargo.getState().findShipment("s2").isEmpty());
        Assertions.assertEquals(0.0, cargo.getState().currentWeight());
        ShipmentUnloadedEvent unloaded = cargo.getUncommittedChanges().get(cargo.getUncommittedChanges().size() - 1)
                .payload(ShipmentUnloadedEvent.class);
        Assertions.assertTrue(unloaded.destinationUnload());
        Assertions.assertEquals(200.0, unloaded.weight());
    }

    @Test
    public void testUnloadingFractionalWeightsEmptiesCargo() {
        Cargo cargo = new Cargo(CARGO_ID);
        cargo.create(new CreateCargoCommand(CARGO_ID, "Rotterdam", "Hamburg", 1000.0, 50.0));
        cargo.loadShipment(load("s1", 0.7));
        cargo.loadShipment(load("s2", 0.1));
        Cargo loaded = new Cargo(CARGO_ID);
        loaded.replay(cargo.getUncommittedChanges());

        loaded.unloadShipment(new UnloadShipmentCommand(CARGO_ID, "s1", "dock-worker", null, "Hamburg", true));
        loaded.unloadShipment(new UnloadShipmentCommand(CARGO_ID, "s2", "dock-worker", null, "Hamburg", true));

        Assertions.assertEquals(0.0, loaded.getState().currentWeight());
        Assertions.assertEquals(0.0, loaded.getState().currentVolume());
        Assertions.assertEquals(CargoStatus.COMPLETED, loaded.getState().status());
        Assertions.assertDoesNotThrow(loaded::validate);
    }

    @Test
    public void testDeletedCargoRejectsFurtherCommands() {
        Cargo cargo = createdCargo(1000.0, 50.0);
        cargo.delete(new DeleteCargoCommand(CARGO_ID, "cancelled", "dispatcher"));

        Assertions.assertTrue(cargo.isDeleted());
        Assertions.assertEquals(2L, cargo.getCurrentVersion());
        Assertions.assertThrows(AggregateDeletedException.class, () -> cargo.loadShipment(load("s1", 1.0)));
    }

    @Test
    public void testReplayRebuildsIdenticalState() {
        Cargo source = new Cargo(CARGO_ID);
        source.create(new CreateCargoCommand(CARGO_ID, "Rotterdam", "Hamburg", 1000.0, 50.0));
        source.loadShipment(load("s1", 100.0));
        source.loadShipment(load("s2", 250.0));
        source.startTransport(start());
        source.completeTransport(new CompleteTransportCommand(CARGO_ID, "driver-7", null));
        List<DomainEventRecord> history = source.getUncommittedChanges();

        Cargo first = new Cargo(CARGO_ID);
        first.replay(history);
        Cargo second = new Cargo(CARGO_ID);
        second.replay(history);

        Assertions.assertEquals(source.getState(), first.getState());
        Assertions.assertEquals(first.getState(), second.getState());
        Assertions.assertEquals(5L, first.getCurrentVersion());
        Assertions.assertFalse(first.hasUncommittedChanges());
        Assertions.assertEquals(350.0, first.getState().currentWeight());
    }
}
