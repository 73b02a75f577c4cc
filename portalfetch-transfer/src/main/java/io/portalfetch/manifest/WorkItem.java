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

import java.nio.file.Path;
import java.util.Objects;

/// One remote object and where it goes locally.
///
/// Two items are the same item when source and destination match; the size hint is not part
/// of the identity.
///
/// @param sourceLocator The absolute URL of the remote object
/// @param destinationPath The local file to write
/// @param sizeHint The expected size in bytes, or -1 when unknown
public record WorkItem(String sourceLocator, Path destinationPath, long sizeHint) {

    public static final long UNKNOWN_SIZE = -1;

    public WorkItem {
        Objects.requireNonNull(sourceLocator, "sourceLocator must not be null");
        Objects.requireNonNull(destinationPath, "destinationPath must not be null");
        if (sourceLocator.isBlank()) {
            throw new IllegalArgumentException("sourceLocator must not be blank");
        }
        if (sizeHint < UNKNOWN_SIZE) {
            sizeHint = UNKNOWN_SIZE;
        }
    }

    public WorkItem(String sourceLocator, Path destinationPath) {
        this(sourceLocator, destinationPath, UNKNOWN_SIZE);
    }

    /// @return true when a size hint is present
    public boolean hasSizeHint() {
        return sizeHint >= 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WorkItem)) {
            return false;
        }
        WorkItem other = (WorkItem) o;
        return sourceLocator.equals(other.sourceLocator) && destinationPath.equals(other.destinationPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceLocator, destinationPath);
    }

    @Override
    public String toString() {
        return sourceLocator + " -> " + destinationPath;
    }
}
