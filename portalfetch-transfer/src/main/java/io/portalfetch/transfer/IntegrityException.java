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

/// The local file ended up larger than the remote object.
public class IntegrityException extends TransferException {

    private final long expectedSize;
    private final long actualSize;

    public IntegrityException(String message, long expectedSize, long actualSize) {
        super(message + " (expected " + expectedSize + " bytes, found " + actualSize + ")");
        this.expectedSize = expectedSize;
        this.actualSize = actualSize;
    }

    public long expectedSize() {
        return expectedSize;
    }

    public long actualSize() {
        return actualSize;
    }
}
