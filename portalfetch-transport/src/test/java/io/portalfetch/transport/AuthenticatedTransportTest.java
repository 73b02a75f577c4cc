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

import io.portalfetch.testserver.PortalServerFixture;
import io.portalfetch.transport.auth.Authenticator;
import io.portalfetch.transport.auth.PortalAuthenticator;
import okhttp3.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AuthenticatedTransportTest {

    private static final byte[] CONTENT = "portal payload for transport tests".getBytes(StandardCharsets.UTF_8);

    private PortalServerFixture portal;
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    @BeforeEach
    public void startPortal() throws IOException {
        portal = new PortalServerFixture("alice", "wonderland");
        portal.putFile("a.bin", CONTENT);
        portal.start();
        sleeps.clear();
    }

    @AfterEach
    public void stopPortal() {
        portal.close();
    }

    private PortalConfig config(int maxAttempts) {
        return PortalConfig.builder(portal.baseUrl(), portal.authBaseUrl(), portal.clientId())
            .connectTimeout(Duration.ofSeconds(2))
            .readTimeout(Duration.ofSeconds(5))
            .maxAttempts(maxAttempts)
            .build();
    }

    private AuthenticatedTransport transport(PortalConfig config, Authenticator authenticator) {
        return new AuthenticatedTransport(config, authenticator,
            new Backoff(Duration.ofMillis(10), Duration.ZERO), sleeps::add);
    }

    private AuthenticatedTransport startedTransport(int maxAttempts) throws IOException {
        PortalConfig config = config(maxAttempts);
        AuthenticatedTransport transport = transport(config,
            new PortalAuthenticator(config, new Credentials("alice", "wonderland")));
        transport.start();
        return transport;
    }

    @Test
    public void testStartAndFetch() throws IOException {
        try (AuthenticatedTransport transport = startedTransport(4);
             Response response = transport.get(portal.url("a.bin")))
        {
            assertThat(response.code()).isEqualTo(200);
            assertThat(response.body().bytes()).isEqualTo(CONTENT);
            assertThat(transport.currentContext().generation()).isEqualTo(1);
            assertThat(portal.tokenGrants()).isEqualTo(1);
            assertThat(transport.reauthenticationCount()).isZero();
        }
    }

    @Test
    public void testStartFailsWithBadCredentials() {
        PortalConfig config = config(4);
        AuthenticatedTransport transport = transport(config,
            new PortalAuthenticator(config, new Credentials("alice", "wrong")));
        assertThatThrownBy(transport::start).isInstanceOf(AuthenticationException.class);
        assertThat(transport.currentContext()).isNull();
        assertThat(portal.successfulLogins()).isZero();
    }

    @Test
    public void testLoginPageWithSuccessStatusTriggersReauthentication() throws IOException {
        try (AuthenticatedTransport transport = startedTransport(4)) {
            portal.expireSessions();
            try (Response response = transport.get(portal.url("a.bin"))) {
                assertThat(response.code()).isEqualTo(200);
                assertThat(response.body().bytes()).isEqualTo(CONTENT);
            }
            assertThat(portal.loginRedirects()).isEqualTo(1);
            assertThat(transport.reauthenticationCount()).isEqualTo(1);
            assertThat(transport.currentContext().generation()).isEqualTo(2);
            assertThat(sleeps).hasSize(1);
        }
    }

    @Test
    public void testConcurrentExpiryCausesSingleLogin() throws Exception {
        int workers = 8;
        try (AuthenticatedTransport transport = startedTransport(6)) {
            assertThat(portal.successfulLogins()).isEqualTo(1);
            portal.expireSessions();

            ExecutorService pool = Executors.newFixedThreadPool(workers);
            CountDownLatch ready = new CountDownLatch(workers);
            CountDownLatch go = new CountDownLatch(1);
            List<Future<byte[]>> results = new ArrayList<>();
            for (int i = 0; i < workers; i++) {
                Callable<byte[]> call = () -> {
                    ready.countDown();
                    go.await();
                    try (Response response = transport.get(portal.url("a.bin"))) {
                        return response.body().bytes();
                    }
                };
                results.add(pool.submit(call));
            }
            ready.await();
            go.countDown();
            for (Future<byte[]> result : results) {
                assertThat(result.get(30, TimeUnit.SECONDS)).isEqualTo(CONTENT);
            }
            pool.shutdown();

            assertThat(transport.reauthenticationCount()).isEqualTo(1);
            assertThat(portal.successfulLogins()).isEqualTo(2);
        }
    }

    @Test
    public void testNotFoundIsNotRetried() throws IOException {
        try (AuthenticatedTransport transport = startedTransport(4)) {
            assertThatThrownBy(() -> transport.get(portal.url("missing.bin")))
                .isInstanceOf(HttpStatusException.class)
                .satisfies(e -> assertThat(((HttpStatusException) e).statusCode()).isEqualTo(404));
            assertThat(portal.requestCount("missing.bin")).isEqualTo(1);
            assertThat(sleeps).isEmpty();
        }
    }

    @Test
    public void testServerErrorIsRetriedWithoutLogin() throws IOException {
        try (AuthenticatedTransport transport = startedTransport(4)) {
            portal.failNextRequests("a.bin", 2, 500);
            try (Response response = transport.get(portal.url("a.bin"))) {
                assertThat(response.body().bytes()).isEqualTo(CONTENT);
            }
            assertThat(portal.requestCount("a.bin")).isEqualTo(3);
            assertThat(transport.reauthenticationCount()).isZero();
            assertThat(sleeps).containsExactly(Duration.ofMillis(10), Duration.ofMillis(20));
        }
    }

    @Test
    public void testUnavailableTriggersLogin() throws IOException {
        try (AuthenticatedTransport transport = startedTransport(4)) {
            portal.failNextRequests("a.bin", 1, 503);
            try (Response response = transport.get(portal.url("a.bin"))) {
                assertThat(response.code()).isEqualTo(200);
            }
            assertThat(transport.reauthenticationCount()).isEqualTo(1);
        }
    }

    @Test
    public void testRetryBudgetExhaustion() throws IOException {
        try (AuthenticatedTransport transport = startedTransport(3)) {
            portal.failNextRequests("a.bin", 10, 502);
            assertThatThrownBy(() -> transport.get(portal.url("a.bin")))
                .isInstanceOf(TransportException.class)
                .isNotInstanceOf(HttpStatusException.class)
                .hasCauseInstanceOf(HttpStatusException.class);
            assertThat(portal.requestCount("a.bin")).isEqualTo(3);
            assertThat(sleeps).hasSize(2);
        }
    }

    @Test
    public void testPassThroughStatusIsReturned() throws IOException {
        try (AuthenticatedTransport transport = startedTransport(4);
             Response response = transport.request(TransportRequest.get(portal.url("a.bin"))
                 .withHeader("Range", "bytes=" + CONTENT.length + "-")
                 .allowingStatus(416)))
        {
            assertThat(response.code()).isEqualTo(416);
            assertThat(response.header("Content-Range")).isEqualTo("bytes */" + CONTENT.length);
        }
    }

    @Test
    public void testConnectionFailureRetriesWithLogin() throws IOException {
        AtomicInteger establishCalls = new AtomicInteger();
        PortalConfig config = config(3);
        PortalAuthenticator real = new PortalAuthenticator(config, new Credentials("alice", "wonderland"));
        Authenticator counting = () -> {
            establishCalls.incrementAndGet();
            return real.establish();
        };
        try (AuthenticatedTransport transport = transport(config, counting)) {
            transport.start();
            String dead = "http://127.0.0.1:1/data/a.bin";
            assertThatThrownBy(() -> transport.get(dead))
                .isInstanceOf(TransportException.class)
                .hasCauseInstanceOf(IOException.class);
            assertThat(establishCalls.get()).isEqualTo(3);
            assertThat(transport.reauthenticationCount()).isEqualTo(2);
        }
    }

    @Test
    public void testFailedReloginKeepsCurrentContext() throws IOException {
        PortalConfig config = config(3);
        PortalAuthenticator real = new PortalAuthenticator(config, new Credentials("alice", "wonderland"));
        AtomicInteger calls = new AtomicInteger();
        Authenticator firstOnly = () -> calls.getAndIncrement() == 0 ? real.establish() : Optional.empty();
        try (AuthenticatedTransport transport = transport(config, firstOnly)) {
            transport.start();
            AuthContext initial = transport.currentContext();
            portal.expireSessions();
            assertThatThrownBy(() -> transport.get(portal.url("a.bin")))
                .isInstanceOf(TransportException.class)
                .hasCauseInstanceOf(AuthorizationException.class);
            assertThat(transport.currentContext()).isSameAs(initial);
            assertThat(transport.reauthenticationCount()).isZero();
        }
    }
}
