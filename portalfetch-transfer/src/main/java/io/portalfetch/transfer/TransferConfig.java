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

import java.time.Duration;

/// Settings for the transfer rounds.
///
/// @param workers Number of concurrent transfers per round
/// @param chunkSize Size of the buffer used to copy response bodies to disk
/// @param roundCooldown Pause between two rounds
/// @param maxRounds Maximum number of rounds, 0 for no limit
public record TransferConfig(int workers, int chunkSize, Duration roundCooldown, int maxRounds) {

    public static final int DEFAULT_WORKERS = 4;
    public static final int DEFAULT_CHUNK_SIZE = 8192;
    public static final Duration DEFAULT_ROUND_COOLDOWN = Duration.ofSeconds(5);
    public static final int UNLIMITED_ROUNDS = 0;

    public TransferConfig {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1, was " + workers);
        }
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be at least 1, was " + chunkSize);
        }
        if (maxRounds < 0) {
            throw new IllegalArgumentException("maxRounds must not be negative, was " + maxRounds);
        }
        roundCooldown = roundCooldown == null ? DEFAULT_ROUND_COOLDOWN : roundCooldown;
        if (roundCooldown.isNegative()) {
            throw new IllegalArgumentException("roundCooldown must not be negative");
        }
    }

    /// @return 4 workers, 8 KiB chunks, 5 s cooldown, unlimited rounds
    public static TransferConfig defaults() {
        return new TransferConfig(DEFAULT_WORKERS, DEFAULT_CHUNK_SIZE, DEFAULT_ROUND_COOLDOWN, UNLIMITED_ROUNDS);
    }

    /// @return true when a round limit is configured
    public boolean hasRoundLimit() {
        return maxRounds > 0;
    }
}
