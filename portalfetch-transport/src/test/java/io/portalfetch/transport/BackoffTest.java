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

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

public class BackoffTest {

    @Test
    public void testDelayGrowsLinearlyWithJitter() {
        Backoff backoff = new Backoff(Duration.ofSeconds(5), Duration.ofSeconds(1), new Random(42));
        for (int attempt = 1; attempt <= 5; attempt++) {
            Duration delay = backoff.delay(attempt);
            assertThat(delay).isGreaterThanOrEqualTo(Duration.ofSeconds(5L * attempt));
            assertThat(delay).isLessThan(Duration.ofSeconds(5L * attempt + 1));
        }
    }

    @Test
    public void testZeroJitterIsExact() {
        Backoff backoff = new Backoff(Duration.ofMillis(250), Duration.ZERO);
        assertThat(backoff.delay(1)).isEqualTo(Duration.ofMillis(250));
        assertThat(backoff.delay(4)).isEqualTo(Duration.ofMillis(1000));
    }

    @Test
    public void testDefaultsFromConfig() {
        PortalConfig config = PortalConfig.builder("https://portal.example/data", "https://auth.example/realm/", "c")
            .backoffJitter(Duration.ZERO)
            .build();
        assertThat(Backoff.from(config).delay(2)).isEqualTo(Duration.ofSeconds(10));
    }
}
