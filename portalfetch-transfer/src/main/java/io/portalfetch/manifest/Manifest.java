package io.portalfetch.manifest;

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

import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// An ordered list of work items without duplicates.
///
/// The first occurrence of an item wins and keeps its position. The number of dropped
/// duplicates is kept for reporting.
public final class Manifest implements Iterable<WorkItem> {

    private final List<WorkItem> items;
    private final int duplicatesRemoved;

    private Manifest(List<WorkItem> items, int duplicatesRemoved) {
        this.items = items;
        this.duplicatesRemoved = duplicatesRemoved;
    }

    /// @param candidates Items in their original order, duplicates allowed
    /// @return A deduplicated manifest
    public static Manifest of(Collection<WorkItem> candidates) {
        Map<WorkItem, WorkItem> unique = new LinkedHashMap<>();
        int duplicates = 0;
        for (WorkItem item : candidates) {
            if (unique.putIfAbsent(item, item) != null) {
                duplicates++;
            }
        }
        return new Manifest(List.copyOf(unique.values()), duplicates);
    }

    public static Manifest of(WorkItem... candidates) {
        return of(List.of(candidates));
    }

    public List<WorkItem> items() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /// @return How many duplicate items were dropped when the manifest was built
    public int duplicatesRemoved() {
        return duplicatesRemoved;
    }

    @Override
    public Iterator<WorkItem> iterator() {
        return items.iterator();
    }
}
