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

package org.elasticsoftware.strata.eventstore;

import com.google.common.base.Charsets;
import com.google.common.primitives.Bytes;
import com.google.common.primitives.Longs;
import org.elasticsoftware.strata.PersistenceException;
import org.elasticsoftware.strata.aggregate.ConcurrencyConflictException;
import org.elasticsoftware.strata.protocol.DomainEventRecord;
import org.elasticsoftware.strata.serialization.DomainEventRecordSerde;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/**
 * Event store on a RocksDB {@link TransactionDB}. Each append runs in one pessimistic transaction
 * that locks the aggregate's version key with {@code getForUpdate}, so the version check and the
 * writes commit together or not at all.
 * <p>
 * Key layout:
 * <ul>
 *     <li>{@code V<aggregateId>} latest version</li>
 *     <li>{@code A<aggregateId>} aggregate type</li>
 *     <li>{@code E<aggregateId>\0<version>} event record</li>
 *     <li>{@code C<aggregateType>} number of aggregates of the type</li>
 *     <li>{@code T<aggregateType>\0<sequence>} aggregate id, in first-append order</li>
 * </ul>
 */
public class RocksDBEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(RocksDBEventStore.class);
    private static final byte VERSION_PREFIX = 'V';
    private static final byte AGGREGATE_TYPE_PREFIX = 'A';
    private static final byte EVENT_PREFIX = 'E';
    private static final byte TYPE_COUNT_PREFIX = 'C';
    private static final byte TYPE_INDEX_PREFIX = 'T';
    private static final byte SEPARATOR = 0x00;
    private final Options options;
    private final TransactionDBOptions transactionDBOptions;
    private final TransactionDB db;
    private final File baseDir;
    private final DomainEventRecordSerde serde;

    public RocksDBEventStore(String baseDir, DomainEventRecordSerde serde) {
        this.serde = serde;
        RocksDB.loadLibrary();
        this.options = new Options().setCreateIfMissing(true);
        this.transactionDBOptions = new TransactionDBOptions();
        this.baseDir = new File(baseDir, "events");
        try {
            Files.createDirectories(this.baseDir.getAbsoluteFile().toPath());
            db = TransactionDB.open(options, transactionDBOptions, this.baseDir.getAbsolutePath());
            log.info("RocksDB EventStore initialized in folder {}", this.baseDir.getAbsolutePath());
        } catch (IOException | RocksDBException e) {
            transactionDBOptions.close();
            options.close();
            throw new PersistenceException("Error initializing RocksDB", e);
        }
    }

    @Override
    public void close() {
        try {
            db.syncWal();
        } catch (RocksDBException e) {
            log.error("Error syncing WAL. Exception: '{}', message: '{}'", e.getCause(), e.getMessage(), e);
        }
        db.close();
        transactionDBOptions.close();
        options.close();
    }

    @Override
    public void append(String aggregateId, String aggregateType, long expectedVersion, List<DomainEventRecord> events) {
        EventStreamValidator.validateBatch(aggregateId, aggregateType, expectedVersion, events);
        if (events.isEmpty()) {
            return;
        }
        try (WriteOptions writeOptions = new WriteOptions();
             ReadOptions readOptions = new ReadOptions();
             Transaction transaction = db.beginTransaction(writeOptions)) {
            byte[] versionKey = key(VERSION_PREFIX, aggregateId);
            byte[] versionBytes = transaction.getForUpdate(readOptions, versionKey, true);
            long currentVersion = versionBytes != null ? Longs.fromByteArray(versionBytes) : 0L;
            if (currentVersion != expectedVersion) {
                transaction.rollback();
                throw new ConcurrencyConflictException(aggregateType, aggregateId, expectedVersion, currentVersion);
            }
            if (currentVersion == 0L) {
                indexAggregate(transaction, readOptions, aggregateId, aggregateType);
            } else {
                byte[] storedType = transaction.get(readOptions, key(AGGREGATE_TYPE_PREFIX, aggregateId));
                if (storedType != null && !aggregateType.equals(new String(storedType, Charsets.UTF_8))) {
                    transaction.rollback();
                    throw new IllegalArgumentException("Aggregate " + aggregateId + " is a "
                            + new String(storedType, Charsets.UTF_8) + ", not a " + aggregateType);
                }
            }
            for (DomainEventRecord event : events) {
                transaction.put(eventKey(aggregateId, event.version()), serde.serialize(event));
            }
            transaction.put(versionKey, Longs.toByteArray(expectedVersion + events.size()));
            transaction.commit();
            log.trace("Appended {} DomainEvent(s) to {} {}", events.size(), aggregateType, aggregateId);
        } catch (RocksDBException e) {
            throw new PersistenceException("Error appending DomainEvents", aggregateType, aggregateId, e);
        }
    }

    private void indexAggregate(Transaction transaction, ReadOptions readOptions, String aggregateId, String aggregateType) throws RocksDBException {
        byte[] countKey = key(TYPE_COUNT_PREFIX, aggregateType);
        byte[] countBytes = transaction.getForUpdate(readOptions, countKey, true);
        long sequence = (countBytes != null ? Longs.fromByteArray(countBytes) : 0L) + 1;
        transaction.put(typeIndexKey(aggregateType, sequence), aggregateId.getBytes(Charsets.UTF_8));
        transaction.put(countKey, Longs.toByteArray(sequence));
        transaction.put(key(AGGREGATE_TYPE_PREFIX, aggregateId), aggregateType.getBytes(Charsets.UTF_8));
    }

    @Override
    public List<DomainEventRecord> read(String aggregateId, long fromVersion) {
        long currentVersion = currentVersion(aggregateId);
        List<DomainEventRecord> events = new ArrayList<>();
        try {
            for (long version = Math.max(1L, fromVersion); version <= currentVersion; version++) {
                byte[] data = db.get(eventKey(aggregateId, version));
                if (data == null) {
                    throw new PersistenceException("Missing DomainEvent version " + version + " for aggregate " + aggregateId, null, aggregateId);
                }
                events.add(serde.deserialize(data));
            }
        } catch (RocksDBException e) {
            throw new PersistenceException("Problem reading DomainEvents", null, aggregateId, e);
        }
        return events;
    }

    @Override
    public long currentVersion(String aggregateId) {
        try {
            byte[] versionBytes = db.get(key(VERSION_PREFIX, aggregateId));
            return versionBytes != null ? Longs.fromByteArray(versionBytes) : 0L;
        } catch (RocksDBException e) {
            throw new PersistenceException("Problem reading version", null, aggregateId, e);
        }
    }

    @Override
    public List<String> aggregateIds(String aggregateType) {
        try {
            byte[] countBytes = db.get(key(TYPE_COUNT_PREFIX, aggregateType));
            long count = countBytes != null ? Longs.fromByteArray(countBytes) : 0L;
            List<String> ids = new ArrayList<>((int) count);
            for (long sequence = 1; sequence <= count; sequence++) {
                byte[] id = db.get(typeIndexKey(aggregateType, sequence));
                if (id != null) {
                    ids.add(new String(id, Charsets.UTF_8));
                }
            }
            return ids;
        } catch (RocksDBException e) {
            throw new PersistenceException("Problem reading aggregate ids of type " + aggregateType, e);
        }
    }

    private static byte[] key(byte prefix, String value) {
        return Bytes.concat(new byte[]{prefix}, value.getBytes(Charsets.UTF_8));
    }

    private static byte[] eventKey(String aggregateId, long version) {
        return Bytes.concat(key(EVENT_PREFIX, aggregateId), new byte[]{SEPARATOR}, Longs.toByteArray(version));
    }

    private static byte[] typeIndexKey(String aggregateType, long sequence) {
        return Bytes.concat(key(TYPE_INDEX_PREFIX, aggregateType), new byte[]{SEPARATOR}, Longs.toByteArray(sequence));
    }
}
