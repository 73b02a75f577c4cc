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

import okhttp3.Cookie;
import okhttp3.CookieJar;
import okhttp3.HttpUrl;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/// A thread-safe in-memory cookie store for one login session.
///
/// Cookies are keyed by name, domain and path, so a newer cookie replaces an older one with the
/// same key. Expired cookies are dropped when they are next read.
public class SessionCookieJar implements CookieJar {

    private final Map<String, Cookie> cookies = new ConcurrentHashMap<>();

    @Override
    public void saveFromResponse(HttpUrl url, List<Cookie> responseCookies) {
        for (Cookie cookie : responseCookies) {
            cookies.put(key(cookie), cookie);
        }
    }

    @Override
    public List<Cookie> loadForRequest(HttpUrl url) {
        long now = System.currentTimeMillis();
        List<Cookie> matching = new ArrayList<>();
        for (Map.Entry<String, Cookie> entry : cookies.entrySet()) {
            Cookie cookie = entry.getValue();
            if (cookie.expiresAt() < now) {
                cookies.remove(entry.getKey(), cookie);
            } else if (cookie.matches(url)) {
                matching.add(cookie);
            }
        }
        return matching;
    }

    /// @return The number of cookies currently held
    public int size() {
        return cookies.size();
    }

    private static String key(Cookie cookie) {
        return cookie.name() + "|" + cookie.domain() + "|" + cookie.path();
    }
}
