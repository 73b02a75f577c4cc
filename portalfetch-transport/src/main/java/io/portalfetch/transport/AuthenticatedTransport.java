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

import io.portalfetch.transport.auth.Authenticator;
import okhttp3.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/// Sends requests with the current authenticated session and keeps that session alive.
///
/// The transport owns one [AuthContext] behind an atomic reference. Requests read it without
/// locking. When a response shows that the session is no longer accepted, the caller sleeps the
/// backoff delay and then takes the replacement lock. If another caller already replaced the
/// context it observed, the caller simply retries on the new one; otherwise it logs in again
/// through the [Authenticator] and installs the result. Any number of workers hitting the same
/// expiry therefore cause a single login.
///
/// Responses are classified as follows:
/// - final URL inside the authentication realm, or status 401, 403 or 503: authorization failure,
///   re-login and retry
/// - transport `IOException`: re-login and retry
/// - any other 5xx: retry without re-login
/// - 2xx or a status the request passes through: returned to the caller, who must close it
/// - anything else: [HttpStatusException] immediately
///
/// After `maxAttempts` attempts the last failure is raised as a [TransportException].
public class AuthenticatedTransport implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(AuthenticatedTransport.class);

    private final PortalConfig config;
    private final Authenticator authenticator;
    private final Backoff backoff;
    private final Sleeper sleeper;

    private final AtomicReference<AuthContext> current = new AtomicReference<>();
    private final ReentrantLock replacementLock = new ReentrantLock();
    private final AtomicLong generations = new AtomicLong();
    private final AtomicLong reauthentications = new AtomicLong();

    public AuthenticatedTransport(PortalConfig config, Authenticator authenticator) {
        this(config, authenticator, Backoff.from(config), Sleeper.SYSTEM);
    }

    public AuthenticatedTransport(PortalConfig config, Authenticator authenticator, Backoff backoff, Sleeper sleeper) {
        this.config = config;
        this.authenticator = authenticator;
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    /// Performs the initial login.
    ///
    /// @throws AuthenticationException If no strategy produced a verified session
    public void start() throws AuthenticationException {
        replacementLock.lock();
        try {
            if (current.get() != null) {
                return;
            }
            AuthContext context = authenticator.establish()
                .orElseThrow(() -> new AuthenticationException(
                    "Could not authenticate against " + config.authBaseUrl()));
            current.set(context.withGeneration(generations.incrementAndGet()));
            logger.info("Initial session established for {}", config.baseUrl());
        } finally {
            replacementLock.unlock();
        }
    }

    /// Re-establishes the session unless another caller already replaced it since it was read here.
    ///
    /// @return true when a usable session is current afterwards
    public boolean reauthenticate() {
        return refresh(current.get());
    }

    public Response get(String url) throws IOException {
        return request(TransportRequest.get(url));
    }

    public Response head(String url) throws IOException {
        return request(TransportRequest.head(url));
    }

    /// Sends a logical request, retrying and re-authenticating as needed.
    ///
    /// @param request The logical request
    /// @return An open response with a 2xx or pass-through status; the caller closes it
    /// @throws HttpStatusException For a non-retryable status
    /// @throws TransportException When the retry budget is exhausted
    public Response request(TransportRequest request) throws IOException {
        IOException lastFailure = null;
        for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
            AuthContext observed = current.get();
            if (observed == null) {
                throw new IllegalStateException("Transport not started");
            }

            Response response;
            try {
                response = observed.client().newCall(observed.newRequest(request)).execute();
            } catch (InterruptedIOException e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw e;
                }
                lastFailure = e;
                logger.debug("Attempt {}/{} for {} timed out: {}", attempt, config.maxAttempts(), request.url(),
                    e.getMessage());
                recover(attempt, observed, true);
                continue;
            } catch (IOException e) {
                lastFailure = e;
                logger.debug("Attempt {}/{} for {} failed: {}", attempt, config.maxAttempts(), request.url(),
                    e.toString());
                recover(attempt, observed, true);
                continue;
            }

            int status = response.code();
            String finalUrl = response.request().url().toString();
            if (isAuthorizationFailure(status, finalUrl)) {
                response.close();
                lastFailure = new AuthorizationException(status, finalUrl);
                logger.info("Session rejected on attempt {}/{} for {} (status {}, landed on {})", attempt,
                    config.maxAttempts(), request.url(), status, finalUrl);
                recover(attempt, observed, true);
                continue;
            }
            if (request.accepts(status)) {
                return response;
            }
            response.close();
            if (status >= 500) {
                lastFailure = new HttpStatusException(status, request.url());
                logger.debug("Attempt {}/{} for {} answered {}", attempt, config.maxAttempts(), request.url(), status);
                recover(attempt, observed, false);
                continue;
            }
            throw new HttpStatusException(status, request.url());
        }
        throw new TransportException(
            "Giving up on " + request.method() + " " + request.url() + " after " + config.maxAttempts() + " attempts",
            lastFailure);
    }

    private boolean isAuthorizationFailure(int status, String finalUrl) {
        return status == 401 || status == 403 || status == 503 || config.isUnderAuthRealm(finalUrl);
    }

    private void recover(int attempt, AuthContext observed, boolean relogin) throws IOException {
        if (attempt >= config.maxAttempts()) {
            return;
        }
        Duration delay = backoff.delay(attempt);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while backing off");
        }
        if (relogin) {
            refresh(observed);
        }
    }

    private boolean refresh(AuthContext observed) {
        replacementLock.lock();
        try {
            AuthContext installed = current.get();
            if (installed != observed) {
                logger.debug("Session already replaced by another caller (generation {})",
                    installed == null ? 0 : installed.generation());
                return installed != null;
            }
            Optional<AuthContext> fresh = authenticator.establish();
            if (fresh.isEmpty()) {
                logger.warn("Re-authentication failed, keeping the current session");
                return false;
            }
            AuthContext replacement = fresh.get().withGeneration(generations.incrementAndGet());
            current.set(replacement);
            reauthentications.incrementAndGet();
            if (observed != null) {
                observed.release();
            }
            logger.info("Re-authenticated, session generation {}", replacement.generation());
            return true;
        } finally {
            replacementLock.unlock();
        }
    }

    /// @return The session currently in use, or null before [#start()]
    public AuthContext currentContext() {
        return current.get();
    }

    /// @return How many times the session was replaced after the initial login
    public long reauthenticationCount() {
        return reauthentications.get();
    }

    public PortalConfig config() {
        return config;
    }

    @Override
    public void close() {
        AuthContext context = current.get();
        if (context != null) {
            context.release();
        }
    }
}
