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

import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;

import java.util.concurrent.TimeUnit;

/// Builds the OkHttp clients used for portal traffic.
///
/// Every client gets its own connection pool and cookie jar, so discarding a client discards
/// the connections and session state that belong to it.
public final class PortalHttpClients {

    private PortalHttpClients() {
    }

    /// Creates a client for one login session.
    ///
    /// @param config The portal settings supplying the timeouts
    /// @param cookieJar The cookie jar of the session
    /// @return A client that follows redirects and keeps its cookies in the given jar
    public static OkHttpClient newClient(PortalConfig config, SessionCookieJar cookieJar) {
        return new OkHttpClient.Builder()
            .connectionPool(new ConnectionPool(16, 5, TimeUnit.MINUTES))
            .cookieJar(cookieJar)
            .connectTimeout(config.connectTimeout())
            .readTimeout(config.readTimeout())
            .writeTimeout(config.readTimeout())
            .followRedirects(true)
            .followSslRedirects(true)
            // Retries are handled by AuthenticatedTransport so attempts stay countable
            .retryOnConnectionFailure(false)
            .build();
    }
}
