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

import java.util.List;

/**
 * Delivers committed events to subscribers. Events of one aggregate reach every subscriber in the
 * order they were published; a failing subscriber never affects the others or the publisher.
 */
public interface EventBus {
    void publish(DomainEventRecord event);

    default void publishAll(List<DomainEventRecord> events) {
        events.forEach(this::publish);
    }

    void subscribe(EventSubscriber subscriber);

    void unsubscribe(String subscriberName);
}
