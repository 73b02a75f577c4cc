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

import io.portalfetch.testserver.PortalServerFixture;
import io.portalfetch.transport.AuthContext;
import io.portalfetch.transport.Credentials;
import io.portalfetch.transport.PortalConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

public class PortalAuthenticatorTest {

    private PortalServerFixture portal;

    @BeforeEach
    public void startPortal() throws IOException {
        portal = new PortalServerFixture("alice", "wonderland");
        portal.putFile("dir/a.bin", "abc".getBytes(StandardCharsets.UTF_8));
        portal.start();
    }

    @AfterEach
    public void stopPortal() {
        portal.close();
    }

    private PortalConfig.Builder configBuilder() {
        return PortalConfig.builder(portal.baseUrl(), portal.authBaseUrl(), portal.clientId())
            .connectTimeout(Duration.ofSeconds(2))
            .readTimeout(Duration.ofSeconds(5));
    }

    @Test
    public void testPasswordGrantInstallsBearerToken() {
        Optional<AuthContext> context =
            new PortalAuthenticator(configBuilder().build(), new Credentials("alice", "wonderland")).establish();

        assertThat(context).isPresent();
        assertThat(context.get().bearerToken()).isPresent();
        assertThat(portal.tokenGrants()).isEqualTo(1);
        assertThat(portal.formLogins()).isZero();
    }

    @Test
    public void testBrowserFormFallback() {
        portal.setPasswordGrantEnabled(false);
        Optional<AuthContext> context =
            new PortalAuthenticator(configBuilder().build(), new Credentials("alice", "wonderland")).establish();

        assertThat(context).isPresent();
        assertThat(context.get().bearerToken()).isEmpty();
        assertThat(context.get().cookieJar().size()).isGreaterThan(0);
        assertThat(portal.tokenGrants()).isZero();
        assertThat(portal.formLogins()).isEqualTo(1);
    }

    @Test
    public void testRejectedFormLoginFails() {
        portal.setPasswordGrantEnabled(false);
        Optional<AuthContext> context =
            new PortalAuthenticator(configBuilder().build(), new Credentials("alice", "queen-of-hearts")).establish();

        assertThat(context).isEmpty();
        assertThat(portal.rejectedLogins()).isEqualTo(1);
        assertThat(portal.formLogins()).isZero();
    }

    @Test
    public void testClientSecretDisablesBrowserFallback() {
        portal.setPasswordGrantEnabled(false);
        PortalConfig config = configBuilder().clientSecret("confidential").build();
        Optional<AuthContext> context =
            new PortalAuthenticator(config, new Credentials("alice", "wonderland")).establish();

        assertThat(context).isEmpty();
        assertThat(portal.formLogins()).isZero();
        assertThat(portal.rejectedLogins()).isZero();
    }

    @Test
    public void testMissingFormStillRequiresVerification() {
        portal.setPasswordGrantEnabled(false);
        portal.setLoginFormEnabled(false);
        Optional<AuthContext> context =
            new PortalAuthenticator(configBuilder().build(), new Credentials("alice", "wonderland")).establish();

        assertThat(context).isEmpty();
    }

    @Test
    public void testMissingFormMeansExistingSession() throws IOException {
        PortalConfig config = configBuilder().build();
        Credentials credentials = new Credentials("alice", "wonderland");
        LoginSession session = new LoginSession(config);
        BrowserLoginStrategy strategy = new BrowserLoginStrategy();

        assertThat(strategy.login(session, credentials)).isTrue();
        assertThat(portal.formLogins()).isEqualTo(1);

        // the realm recognizes the session cookie and redirects straight back to the portal
        assertThat(strategy.login(session, credentials)).isTrue();
        assertThat(portal.formLogins()).isEqualTo(1);
        assertThat(new AccessVerifier().verify(session)).isTrue();
    }

    @Test
    public void testUnverifiedStrategyIsSkipped() {
        LoginStrategy optimistic = new LoginStrategy() {
            @Override
            public String name() {
                return "optimistic";
            }

            @Override
            public boolean login(LoginSession session, Credentials credentials) {
                return true;
            }
        };
        Optional<AuthContext> context = new PortalAuthenticator(configBuilder().build(),
            new Credentials("alice", "wonderland"), List.of(optimistic), new AccessVerifier()).establish();

        assertThat(context).isEmpty();
        assertThat(portal.loginRedirects()).isEqualTo(1);
    }

    @Test
    public void testAccessTokenParsing() {
        assertThat(PasswordGrantStrategy.parseAccessToken("{\"access_token\":\"t-1\",\"expires_in\":300}"))
            .isEqualTo("t-1");
        assertThat(PasswordGrantStrategy.parseAccessToken("{\"error\":\"invalid_grant\"}")).isNull();
        assertThat(PasswordGrantStrategy.parseAccessToken("<html>not json</html>")).isNull();
        assertThat(PasswordGrantStrategy.parseAccessToken("[]")).isNull();
    }
}
