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
import java.util.List;
import java.util.Objects;

/// Connection and authentication settings for one portal and its authentication realm.
///
/// @param baseUrl The protected base address; its listing is the crawl root and the verification target
/// @param authBaseUrl The authentication realm base address; any response whose final URL starts
///                    with it is treated as an authorization failure
/// @param tokenUrl The token endpoint used for the password grant
/// @param authorizationUrl The authorization endpoint that renders the interactive login form
/// @param clientId The client id presented to the realm
/// @param clientSecret The client secret, or null for public clients
/// @param redirectUri The redirect URI sent with the authorization request
/// @param scope The scope sent with the authorization request
/// @param loginFormId The id of the HTML login form
/// @param loginErrorMarkers Class names whose presence on a login response means the login was rejected
/// @param connectTimeout Connect timeout for every request
/// @param readTimeout Read timeout for every request
/// @param maxAttempts Attempts per logical request before giving up
/// @param backoffBase Backoff step multiplied by the attempt number
/// @param backoffJitter Upper bound (exclusive) of the random jitter added to each backoff
public record PortalConfig(
    String baseUrl,
    String authBaseUrl,
    String tokenUrl,
    String authorizationUrl,
    String clientId,
    String clientSecret,
    String redirectUri,
    String scope,
    String loginFormId,
    List<String> loginErrorMarkers,
    Duration connectTimeout,
    Duration readTimeout,
    int maxAttempts,
    Duration backoffBase,
    Duration backoffJitter
) {
    public static final String DEFAULT_SCOPE = "openid email";
    public static final String DEFAULT_LOGIN_FORM_ID = "kc-form-login";
    public static final List<String> DEFAULT_LOGIN_ERROR_MARKERS = List.of("kc-feedback-text", "pf-c-alert__title");
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(15);
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_ATTEMPTS = 10;
    public static final Duration DEFAULT_BACKOFF_BASE = Duration.ofSeconds(5);
    public static final Duration DEFAULT_BACKOFF_JITTER = Duration.ofSeconds(1);

    public PortalConfig {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        Objects.requireNonNull(authBaseUrl, "authBaseUrl must not be null");
        Objects.requireNonNull(clientId, "clientId must not be null");
        if (baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl must not be blank");
        }
        if (authBaseUrl.isBlank()) {
            throw new IllegalArgumentException("authBaseUrl must not be blank");
        }
        if (clientId.isBlank()) {
            throw new IllegalArgumentException("clientId must not be blank");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        if (!baseUrl.endsWith("/")) {
            baseUrl = baseUrl + "/";
        }
        while (authBaseUrl.endsWith("/")) {
            authBaseUrl = authBaseUrl.substring(0, authBaseUrl.length() - 1);
        }
        if (tokenUrl == null) {
            tokenUrl = authBaseUrl + "/token";
        }
        if (authorizationUrl == null) {
            authorizationUrl = authBaseUrl + "/auth";
        }
        if (clientSecret != null && clientSecret.isEmpty()) {
            clientSecret = null;
        }
        if (redirectUri == null) {
            redirectUri = baseUrl;
        }
        if (scope == null) {
            scope = DEFAULT_SCOPE;
        }
        if (loginFormId == null) {
            loginFormId = DEFAULT_LOGIN_FORM_ID;
        }
        loginErrorMarkers = loginErrorMarkers == null ? DEFAULT_LOGIN_ERROR_MARKERS : List.copyOf(loginErrorMarkers);
        connectTimeout = requirePositive(connectTimeout, DEFAULT_CONNECT_TIMEOUT, "connectTimeout");
        readTimeout = requirePositive(readTimeout, DEFAULT_READ_TIMEOUT, "readTimeout");
        backoffBase = backoffBase == null ? DEFAULT_BACKOFF_BASE : backoffBase;
        backoffJitter = backoffJitter == null ? DEFAULT_BACKOFF_JITTER : backoffJitter;
        if (backoffBase.isNegative() || backoffJitter.isNegative()) {
            throw new IllegalArgumentException("backoff durations must not be negative");
        }
    }

    private static Duration requirePositive(Duration value, Duration fallback, String name) {
        if (value == null) {
            return fallback;
        }
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, was " + value);
        }
        return value;
    }

    /// @return true when a client secret is configured
    public boolean hasClientSecret() {
        return clientSecret != null;
    }

    /// Checks whether a URL is inside the authentication realm.
    ///
    /// @param url An absolute URL
    /// @return true when the URL starts with the realm base address
    public boolean isUnderAuthRealm(String url) {
        return url != null && url.startsWith(authBaseUrl);
    }

    /// The record masks the client secret.
    @Override
    public String toString() {
        return "PortalConfig{baseUrl=" + baseUrl + ", authBaseUrl=" + authBaseUrl + ", clientId=" + clientId
               + ", clientSecret=" + (clientSecret == null ? "none" : "****") + ", maxAttempts=" + maxAttempts + "}";
    }

    /// @param baseUrl The protected base address
    /// @param authBaseUrl The authentication realm base address
    /// @param clientId The client id
    /// @return A builder with every other setting at its default
    public static Builder builder(String baseUrl, String authBaseUrl, String clientId) {
        return new Builder(baseUrl, authBaseUrl, clientId);
    }

    public static final class Builder {
        private final String baseUrl;
        private final String authBaseUrl;
        private final String clientId;
        private String tokenUrl;
        private String authorizationUrl;
        private String clientSecret;
        private String redirectUri;
        private String scope;
        private String loginFormId;
        private List<String> loginErrorMarkers;
        private Duration connectTimeout;
        private Duration readTimeout;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration backoffBase;
        private Duration backoffJitter;

        private Builder(String baseUrl, String authBaseUrl, String clientId) {
            this.baseUrl = baseUrl;
            this.authBaseUrl = authBaseUrl;
            this.clientId = clientId;
        }

        public Builder tokenUrl(String tokenUrl) {
            this.tokenUrl = tokenUrl;
            return this;
        }

        public Builder authorizationUrl(String authorizationUrl) {
            this.authorizationUrl = authorizationUrl;
            return this;
        }

        public Builder clientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
            return this;
        }

        public Builder redirectUri(String redirectUri) {
            this.redirectUri = redirectUri;
            return this;
        }

        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }

        public Builder loginFormId(String loginFormId) {
            this.loginFormId = loginFormId;
            return this;
        }

        public Builder loginErrorMarkers(List<String> loginErrorMarkers) {
            this.loginErrorMarkers = loginErrorMarkers;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder readTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder backoffBase(Duration backoffBase) {
            this.backoffBase = backoffBase;
            return this;
        }

        public Builder backoffJitter(Duration backoffJitter) {
            this.backoffJitter = backoffJitter;
            return this;
        }

        public PortalConfig build() {
            return new PortalConfig(baseUrl, authBaseUrl, tokenUrl, authorizationUrl, clientId, clientSecret,
                redirectUri, scope, loginFormId, loginErrorMarkers, connectTimeout, readTimeout, maxAttempts,
                backoffBase, backoffJitter);
        }
    }
}
