package io.portalfetch.transport;

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
import java.util.Random;

/// Linear backoff with random jitter: `base × attempt + jitter`, jitter drawn from `[0, maxJitter)`.
public class Backoff {

    private final Duration base;
    private final Duration maxJitter;
    private final Random random;

    public Backoff(Duration base, Duration maxJitter) {
        this(base, maxJitter, new Random());
    }

    public Backoff(Duration base, Duration maxJitter, Random random) {
        this.base = base;
        this.maxJitter = maxJitter;
        this.random = random;
    }

    /// @param config The portal settings supplying base and jitter
    /// @return A backoff using the configured values
    public static Backoff from(PortalConfig config) {
        return new Backoff(config.backoffBase(), config.backoffJitter());
    }

    /// @param attempt The 1-based attempt that just failed
    /// @return How long to wait before the next attempt
    public Duration delay(int attempt) {
        long jitterMillis = maxJitter.toMillis();
        long jitter;
        synchronized (random) {
            jitter = jitterMillis > 0 ? (long) (random.nextDouble() * jitterMillis) : 0L;
        }
        return base.multipliedBy(Math.max(1, attempt)).plusMillis(jitter);
    }
}
