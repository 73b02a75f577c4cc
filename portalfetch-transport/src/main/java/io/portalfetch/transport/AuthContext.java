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

import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// An immutable snapshot of an authenticated session.
///
/// A context bundles the client (with its own connection pool), its cookie jar and an optional
/// bearer token. The cookie jar is the only mutable part and is thread safe. Contexts are
/// replaced wholesale, never patched.
public final class AuthContext {

    private final long generation;
    private final OkHttpClient client;
    private final SessionCookieJar cookieJar;
    private final String bearerToken;

    public AuthContext(long generation, OkHttpClient client, SessionCookieJar cookieJar, String bearerToken) {
        this.generation = generation;
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.cookieJar = Objects.requireNonNull(cookieJar, "cookieJar must not be null");
        this.bearerToken = bearerToken;
    }

    /// @return The sequence number assigned when this context was installed
    public long generation() {
        return generation;
    }

    public OkHttpClient client() {
        return client;
    }

    public SessionCookieJar cookieJar() {
        return cookieJar;
    }

    public Optional<String> bearerToken() {
        return Optional.ofNullable(bearerToken);
    }

    /// @param newGeneration The generation to assign
    /// @return The same session under a new generation number
    public AuthContext withGeneration(long newGeneration) {
        return new AuthContext(newGeneration, client, cookieJar, bearerToken);
    }

    /// Builds the OkHttp request for a logical request, adding the bearer token when present.
    ///
    /// @param request The logical request
    /// @return A request ready for [#client()]
    public Request newRequest(TransportRequest request) {
        Request.Builder builder = new Request.Builder().url(request.url());
        if ("HEAD".equals(request.method())) {
            builder.head();
        } else {
            builder.get();
        }
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        if (bearerToken != null) {
            builder.header("Authorization", "Bearer " + bearerToken);
        }
        return builder.build();
    }

    /// Evicts idle pooled connections. Calls in flight on this context may still finish.
    public void release() {
        client.connectionPool().evictAll();
    }

    @Override
    public String toString() {
        return "AuthContext{generation=" + generation + ", bearer=" + (bearerToken != null) + ", cookies="
               + cookieJar.size() + "}";
    }
}
