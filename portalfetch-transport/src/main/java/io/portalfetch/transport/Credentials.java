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

import java.util.Objects;

/// The account used to log in to the portal. Held in memory only.
///
/// @param identity The account name
/// @param secret The account password
public record Credentials(String identity, String secret) {

    public Credentials {
        Objects.requireNonNull(identity, "identity must not be null");
        Objects.requireNonNull(secret, "secret must not be null");
        if (identity.isBlank()) {
            throw new IllegalArgumentException("identity must not be blank");
        }
    }

    @Override
    public String toString() {
        return "Credentials{identity=" + identity + ", secret=****}";
    }
}
