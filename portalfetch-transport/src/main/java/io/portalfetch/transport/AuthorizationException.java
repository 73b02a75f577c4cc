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

/// The portal refused the current session: status 401, 403 or 503, or a response whose final
/// URL landed inside the authentication realm.
public class AuthorizationException extends TransportException {

    private final int statusCode;
    private final String finalUrl;

    public AuthorizationException(int statusCode, String finalUrl) {
        super("Authorization failure (status " + statusCode + ", final URL " + finalUrl + ")");
        this.statusCode = statusCode;
        this.finalUrl = finalUrl;
    }

    public int statusCode() {
        return statusCode;
    }

    public String finalUrl() {
        return finalUrl;
    }
}
