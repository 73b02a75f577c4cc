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
import io.portalfetch.transport.Credentials;
import io.portalfetch.transport.PortalConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;

/// Logs in with the password grant first and falls back to the browser login form.
///
/// The browser form is only tried when no client secret is configured, because confidential
/// clients are not offered the interactive flow. Each strategy runs on its own fresh
/// [LoginSession] and must pass [AccessVerifier] before its session is returned.
public class PortalAuthenticator implements Authenticator {
    private static final Logger logger = LogManager.getLogger(PortalAuthenticator.class);

    private final PortalConfig config;
    private final Credentials credentials;
    private final List<LoginStrategy> strategies;
    private final AccessVerifier verifier;

    public PortalAuthenticator(PortalConfig config, Credentials credentials) {
        this(config, credentials, defaultStrategies(config), new AccessVerifier());
    }

    public PortalAuthenticator(PortalConfig config, Credentials credentials, List<LoginStrategy> strategies,
                               AccessVerifier verifier)
    {
        this.config = config;
        this.credentials = credentials;
        this.strategies = List.copyOf(strategies);
        this.verifier = verifier;
    }

    private static List<LoginStrategy> defaultStrategies(PortalConfig config) {
        if (config.hasClientSecret()) {
            return List.of(new PasswordGrantStrategy());
        }
        return List.of(new PasswordGrantStrategy(), new BrowserLoginStrategy());
    }

    @Override
    public Optional<AuthContext> establish() {
        for (LoginStrategy strategy : strategies) {
            LoginSession session = new LoginSession(config);
            try {
                if (!strategy.login(session, credentials)) {
                    logger.info("Login via {} failed for {}", strategy.name(), credentials.identity());
                    session.discard();
                    continue;
                }
                if (!verifier.verify(session)) {
                    logger.warn("Login via {} could not be verified against {}", strategy.name(), config.baseUrl());
                    session.discard();
                    continue;
                }
                logger.info("Authenticated {} via {}", credentials.identity(), strategy.name());
                return Optional.of(session.toContext());
            } catch (Exception e) {
                logger.warn("Login via {} raised {}: {}", strategy.name(), e.getClass().getSimpleName(), e.getMessage());
                logger.debug("Login failure detail", e);
                session.discard();
            }
        }
        return Optional.empty();
    }
}
