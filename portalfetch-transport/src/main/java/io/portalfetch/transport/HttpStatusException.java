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

/// A status the transport does not retry, such as 404.
public class HttpStatusException extends TransportException {

    private final int statusCode;
    private final String url;

    public HttpStatusException(int statusCode, String url) {
        super("HTTP " + statusCode + " for " + url);
        this.statusCode = statusCode;
        this.url = url;
    }

    public int statusCode() {
        return statusCode;
    }

    public String url() {
        return url;
    }
}
