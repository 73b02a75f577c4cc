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

import io.portalfetch.transport.PortalConfig;
import okhttp3.Request;
import okhttp3.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/// Confirms that a session can actually read the protected base address.
public class AccessVerifier {
    private static final Logger logger = LogManager.getLogger(AccessVerifier.class);

    /// @param session The session to check
    /// @return true when the base address answers 2xx and the final URL is outside the realm
    /// @throws IOException If the portal could not be reached
    public boolean verify(LoginSession session) throws IOException {
        PortalConfig config = session.config();
        Request.Builder builder = new Request.Builder().url(config.baseUrl());
        if (session.bearerToken() != null) {
            builder.header("Authorization", "Bearer " + session.bearerToken());
        }
        try (Response response = session.client().newCall(builder.build()).execute()) {
            String finalUrl = response.request().url().toString();
            if (!response.isSuccessful()) {
                logger.debug("Verification of {} answered {}", config.baseUrl(), response.code());
                return false;
            }
            if (config.isUnderAuthRealm(finalUrl)) {
                logger.debug("Verification of {} ended at the login page {}", config.baseUrl(), finalUrl);
                return false;
            }
            return true;
        }
    }
}
