package io.portalfetch.transfer;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.portalfetch.manifest.WorkItem;

import java.util.List;
import java.util.Map;

/// The result of a scheduler run.
///
/// @param status How the run ended
/// @param rounds Number of rounds started
/// @param completed Items downloaded during the run
/// @param skipped Items that were already complete
/// @param failureCounts Number of failed attempts per item, for items that failed at least once
/// @param pending Items not finished when the run stopped, in manifest order
public record RunSummary(
    RunStatus status,
    int rounds,
    int completed,
    int skipped,
    Map<WorkItem, Integer> failureCounts,
    List<WorkItem> pending
) {
    public RunSummary {
        failureCounts = Map.copyOf(failureCounts);
        pending = List.copyOf(pending);
    }

    public boolean isSuccess() {
        return status == RunStatus.SUCCEEDED;
    }

    /// @param item A work item
    /// @return How often the item failed during the run
    public int failureCount(WorkItem item) {
        return failureCounts.getOrDefault(item, 0);
    }
}
