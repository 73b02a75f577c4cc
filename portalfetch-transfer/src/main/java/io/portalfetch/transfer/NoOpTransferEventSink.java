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

/// Discards every event.
public class NoOpTransferEventSink implements TransferEventSink {

    public static final NoOpTransferEventSink INSTANCE = new NoOpTransferEventSink();

    @Override
    public void roundStarted(int round, int items) {
    }

    @Override
    public void progress(WorkItem item, long bytesOnDisk, long totalBytes) {
    }

    @Override
    public void itemFinished(int round, TransferOutcome outcome) {
    }

    @Override
    public void roundFinished(int round, int completed, int skipped, int failed) {
    }
}
