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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/// One logical request issued through [AuthenticatedTransport].
///
/// The same logical request may be sent several times, each time with the authenticated
/// context that is current at that moment.
///
/// @param method `GET` or `HEAD`
/// @param url The absolute target URL
/// @param headers Extra request headers
/// @param passThroughStatuses Non-2xx statuses the caller handles itself
public record TransportRequest(String method, String url, Map<String, String> headers, Set<Integer> passThroughStatuses) {

    public TransportRequest {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(url, "url must not be null");
        if (!method.equals("GET") && !method.equals("HEAD")) {
            throw new IllegalArgumentException("Only GET and HEAD are supported, got " + method);
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        passThroughStatuses = passThroughStatuses == null ? Set.of() : Set.copyOf(passThroughStatuses);
    }

    public static TransportRequest get(String url) {
        return new TransportRequest("GET", url, Map.of(), Set.of());
    }

    public static TransportRequest head(String url) {
        return new TransportRequest("HEAD", url, Map.of(), Set.of());
    }

    /// @return A copy of this request with one more header
    public TransportRequest withHeader(String name, String value) {
        Map<String, String> merged = new LinkedHashMap<>(headers);
        merged.put(name, value);
        return new TransportRequest(method, url, merged, passThroughStatuses);
    }

    /// @return A copy of this request that returns the given status to the caller instead of failing
    public TransportRequest allowingStatus(int status) {
        Set<Integer> merged = new TreeSet<>(passThroughStatuses);
        merged.add(status);
        return new TransportRequest(method, url, headers, merged);
    }

    /// @param status A response status code
    /// @return true when the caller accepts this status
    public boolean accepts(int status) {
        return (status >= 200 && status < 300) || passThroughStatuses.contains(status);
    }
}
