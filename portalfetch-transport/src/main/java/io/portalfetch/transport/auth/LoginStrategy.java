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

import io.portalfetch.transport.Credentials;

import java.io.IOException;

/// One way of logging in to the portal.
public interface LoginStrategy {

    /// @return A short name used in log messages
    String name();

    /// Attempts a login on the given session.
    ///
    /// @param session A fresh session that receives cookies and tokens
    /// @param credentials The account to log in with
    /// @return true when the strategy believes it logged in; the caller still verifies access
    /// @throws IOException If the portal could not be reached
    boolean login(LoginSession session, Credentials credentials) throws IOException;
}
