package io.portalfetch.transport.auth;

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

import io.portalfetch.transport.AuthContext;
import io.portalfetch.transport.PortalConfig;
import io.portalfetch.transport.PortalHttpClients;
import io.portalfetch.transport.SessionCookieJar;
import okhttp3.OkHttpClient;

/// The scratch state of one login attempt: a fresh client, a fresh cookie jar and, once a token
/// grant succeeds, a bearer token. Nothing here is shared with the current context until the
/// session is verified and turned into an [AuthContext].
public class LoginSession {

    private final PortalConfig config;
    private final SessionCookieJar cookieJar;
    private final OkHttpClient client;
    private volatile String bearerToken;

    public LoginSession(PortalConfig config) {
        this.config = config;
        this.cookieJar = new SessionCookieJar();
        this.client = PortalHttpClients.newClient(config, cookieJar);
    }

    public PortalConfig config() {
        return config;
    }

    public OkHttpClient client() {
        return client;
    }

    public SessionCookieJar cookieJar() {
        return cookieJar;
    }

    public String bearerToken() {
        return bearerToken;
    }

    public void setBearerToken(String bearerToken) {
        this.bearerToken = bearerToken;
    }

    /// @return A context holding this session's client, cookies and token, generation 0
    public AuthContext toContext() {
        return new AuthContext(0, client, cookieJar, bearerToken);
    }

    /// Evicts this session's connections; used when the attempt is abandoned.
    public void discard() {
        client.connectionPool().evictAll();
    }
}
