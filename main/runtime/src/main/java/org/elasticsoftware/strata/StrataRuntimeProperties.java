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

package org.elasticsoftware.strata;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "strata")
public class StrataRuntimeProperties {
    private final EventStoreProperties eventStore = new EventStoreProperties();
    private final EventBusProperties eventBus = new EventBusProperties();

    public EventStoreProperties getEventStore() {
        return eventStore;
    }

    public EventBusProperties getEventBus() {
        return eventBus;
    }

    public enum EventStoreType {
        IN_MEMORY,
        ROCKSDB
    }

    public static class EventStoreProperties {
        private EventStoreType type = EventStoreType.IN_MEMORY;
        private final RocksDBProperties rocksdb = new RocksDBProperties();

        public EventStoreType getType() {
            return type;
        }

        public void setType(EventStoreType type) {
            this.type = type;
        }

        public RocksDBProperties getRocksdb() {
            return rocksdb;
        }
    }

    public static class RocksDBProperties {
        private String baseDir = "/tmp/strata";

        public String getBaseDir() {
            return baseDir;
        }

        public void setBaseDir(String baseDir) {
            this.baseDir = baseDir;
        }
    }

    public static class EventBusProperties {
        /**
         * Number of delivery partitions, 0 delivers on the publishing thread.
         */
        private int partitions = 0;

        public int getPartitions() {
            return partitions;
        }

        public void setPartitions(int partitions) {
            this.partitions = partitions;
        }
    }
}
