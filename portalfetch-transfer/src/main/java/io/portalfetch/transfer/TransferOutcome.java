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

/// The result of one attempt at one work item.
///
/// @param item The work item
/// @param status How the attempt ended
/// @param bytes Bytes written during this attempt, or the existing size for a skipped item
/// @param error The failure cause, or null unless the status is FAILED
public record TransferOutcome(
    WorkItem item,
    TransferStatus status,
    long bytes,
    Exception error
) {
    /// @param item The work item
    /// @param bytes Bytes written during this attempt
    /// @return A COMPLETED outcome
    public static TransferOutcome completed(WorkItem item, long bytes) {
        return new TransferOutcome(item, TransferStatus.COMPLETED, bytes, null);
    }

    /// @param item The work item
    /// @param bytes Size of the existing local file
    /// @return A SKIPPED outcome
    public static TransferOutcome skipped(WorkItem item, long bytes) {
        return new TransferOutcome(item, TransferStatus.SKIPPED, bytes, null);
    }

    /// @param item The work item
    /// @param error The cause of the failure
    /// @return A FAILED outcome
    public static TransferOutcome failed(WorkItem item, Exception error) {
        return new TransferOutcome(item, TransferStatus.FAILED, 0, error);
    }

    /// @return true for COMPLETED and SKIPPED
    public boolean isSuccess() {
        return status == TransferStatus.COMPLETED || status == TransferStatus.SKIPPED;
    }

    /// @return true when the attempt stopped because the run was cancelled
    public boolean isCancelled() {
        return status == TransferStatus.FAILED && error instanceof TransferCancelledException;
    }
}
