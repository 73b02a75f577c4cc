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

import java.util.concurrent.atomic.AtomicBoolean;

/// A one-way cancellation flag shared by the scheduler and its transfers.
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /// Requests cancellation. Later calls have no effect.
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /// @param what A description of the interrupted work, used in the exception message
    /// @throws TransferCancelledException If cancellation was requested
    public void throwIfCancelled(Object what) throws TransferCancelledException {
        if (cancelled.get()) {
            throw new TransferCancelledException("Cancelled: " + what);
        }
    }
}
