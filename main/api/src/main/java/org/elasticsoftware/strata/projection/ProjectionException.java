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

import org.elasticsoftware.strata.ErrorCode;
import org.elasticsoftware.strata.StrataException;
import org.elasticsoftware.strata.protocol.DomainEventRecord;

public class ProjectionException extends StrataException {
    private final String projectionName;

    public ProjectionException(String projectionName, String message) {
        super(message, null, null);
        this.projectionName = projectionName;
    }

    public ProjectionException(String projectionName, String message, Throwable cause) {
        super(message, null, null, cause);
        this.projectionName = projectionName;
    }

    public ProjectionException(String projectionName, String message, DomainEventRecord event) {
        super(message, event.aggregateType(), event.aggregateId());
        this.projectionName = projectionName;
    }

    public ProjectionException(String projectionName, String message, DomainEventRecord event, Throwable cause) {
        super(message, event.aggregateType(), event.aggregateId(), cause);
        this.projectionName = projectionName;
    }

    public String getProjectionName() {
        return projectionName;
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.PROJECTION;
    }
}
