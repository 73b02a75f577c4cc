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

/// Receives progress events from transfers and rounds.
///
/// Calls arrive from worker threads, so implementations must be thread safe.
public interface TransferEventSink {

    /// A round is about to start.
    ///
    /// @param round The 1-based round number
    /// @param items The number of items in this round
    void roundStarted(int round, int items);

    /// A chunk was written.
    ///
    /// @param item The item being transferred
    /// @param bytesOnDisk The local file size after the chunk
    /// @param totalBytes The expected final size, or -1 when unknown
    void progress(WorkItem item, long bytesOnDisk, long totalBytes);

    /// An item finished in this round.
    ///
    /// @param round The round number
    /// @param outcome How the item ended
    void itemFinished(int round, TransferOutcome outcome);

    /// A round finished.
    ///
    /// @param round The round number
    /// @param completed Items transferred in this round
    /// @param skipped Items already complete
    /// @param failed Items that failed and go to the next round
    void roundFinished(int round, int completed, int skipped, int failed);
}
