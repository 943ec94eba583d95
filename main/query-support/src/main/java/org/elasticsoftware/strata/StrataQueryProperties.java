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

import org.elasticsoftware.strata.readmodel.QueryCriteriaEvaluator;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "strata.query")
public class StrataQueryProperties {
    private int defaultPageSize = QueryCriteriaEvaluator.DEFAULT_PAGE_SIZE;
    private int maxPageSize = QueryCriteriaEvaluator.MAX_PAGE_SIZE;
    /**
     * Rebuild all projections from the event store when the application starts.
     */
    private boolean rebuildOnStart = true;

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public void setDefaultPageSize(int defaultPageSize) {
        this.defaultPageSize = defaultPageSize;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    public void setMaxPageSize(int maxPageSize) {
        this.maxPageSize = maxPageSize;
    }

    public boolean isRebuildOnStart() {
        return rebuildOnStart;
    }

    public void setRebuildOnStart(boolean rebuildOnStart) {
        this.rebuildOnStart = rebuildOnStart;
    }
}
