package io.portalfetch.testserver;

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

import com.google.gson.JsonObject;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpException;
import org.apache.hc.core5.http.HttpStatus;
import org.apache.hc.core5.http.impl.bootstrap.HttpServer;
import org.apache.hc.core5.http.impl.bootstrap.ServerBootstrap;
import org.apache.hc.core5.http.io.HttpRequestHandler;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.InputStreamEntity;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.http.protocol.HttpContext;
import org.apache.hc.core5.io.CloseMode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.ServerSocket;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/// A test fixture that simulates an authenticated file portal on a local port.
///
/// The simulated portal has three parts, laid out the way a Keycloak-fronted Apache
/// file tree is:
/// - an OpenID Connect realm under [#REALM_PATH] with a password-grant token endpoint and an
///   authorization endpoint that renders a `kc-form-login` form
/// - a login action that accepts the form, sets a `PORTAL_SESSION` cookie and redirects to the
///   protected tree
/// - a protected tree under [#DATA_PATH], served from memory, with directory listings and
///   byte-range support
///
/// Unauthenticated requests to the protected tree are redirected to the login page, which
/// answers with 200. This reproduces the disguised session expiry the transfer engine must
/// detect. Faults (server errors, truncated bodies, ignored ranges, expired sessions) can be
/// injected per path, and counters expose what the server saw.
///
/// Example usage:
/// ```java
/// try (PortalServerFixture portal = new PortalServerFixture("user", "secret")) {
///     portal.putFile("a/one.bin", bytes);
///     portal.start();
///     String url = portal.url("a/one.bin");
/// }
/// ```
public class PortalServerFixture implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(PortalServerFixture.class);

    /// Path of the simulated authentication realm
    public static final String REALM_PATH = "/realms/test/protocol/openid-connect";
    /// Path of the login form action
    public static final String LOGIN_ACTION_PATH = "/realms/test/login-actions/authenticate";
    /// Path of the protected file tree
    public static final String DATA_PATH = "/data/";
    /// Client id the realm accepts
    public static final String CLIENT_ID = "portal-test-client";
    /// Name of the browser session cookie
    public static final String SESSION_COOKIE = "PORTAL_SESSION";

    private final String username;
    private final String password;

    private final Map<String, byte[]> files = new ConcurrentSkipListMap<>();
    private final Set<String> bearerTokens = ConcurrentHashMap.newKeySet();
    private final Set<String> browserSessions = ConcurrentHashMap.newKeySet();
    private final Set<String> pendingLoginCodes = ConcurrentHashMap.newKeySet();

    private final Map<String, InjectedFailure> failures = new ConcurrentHashMap<>();
    private final Map<String, Integer> truncations = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> requestCounts = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> bodyBytes = new ConcurrentHashMap<>();
    private final Map<String, List<String>> rangeHeaders = new ConcurrentHashMap<>();
    private final Map<String, List<String>> acceptEncodings = new ConcurrentHashMap<>();

    private final AtomicInteger tokenGrants = new AtomicInteger();
    private final AtomicInteger formLogins = new AtomicInteger();
    private final AtomicInteger rejectedLogins = new AtomicInteger();
    private final AtomicInteger loginRedirects = new AtomicInteger();

    private volatile boolean passwordGrantEnabled = true;
    private volatile boolean loginFormEnabled = true;
    private volatile boolean rangeSupported = true;

    private HttpServer server;
    private int port;

    /// Creates a portal that accepts exactly one account.
    ///
    /// @param username The account name the portal accepts
    /// @param password The account password the portal accepts
    public PortalServerFixture(String username, String password) {
        this.username = username;
        this.password = password;
    }

    /// Starts the portal on a random available port.
    ///
    /// @throws IOException If the server cannot be started
    public void start() throws IOException {
        this.port = findAvailablePort();
        server = ServerBootstrap.bootstrap()
            .setListenerPort(port)
            .register("*", new PortalHandler())
            .create();
        server.start();
        logger.info("Simulated portal started on port {} with {} files", port, files.size());
    }

    /// Stops the portal and releases its port.
    @Override
    public void close() {
        if (server != null) {
            server.close(CloseMode.IMMEDIATE);
            server = null;
            logger.info("Simulated portal stopped");
        }
    }

    /// @return The scheme, host and port of the running portal, without a trailing slash
    public String origin() {
        return "http://127.0.0.1:" + port;
    }

    /// @return The URL of the protected tree root, ending with a slash
    public String baseUrl() {
        return origin() + DATA_PATH;
    }

    /// @return The base address of the authentication realm
    public String authBaseUrl() {
        return origin() + REALM_PATH;
    }

    /// @return The client id accepted by the realm
    public String clientId() {
        return CLIENT_ID;
    }

    /// Resolves a path relative to the protected tree root.
    ///
    /// @param relativePath A path such as `dir/file.bin`
    /// @return The absolute URL of the resource
    public String url(String relativePath) {
        return baseUrl() + relativePath;
    }

    /// Publishes an in-memory file under the protected tree.
    ///
    /// @param relativePath Path below the tree root, with `/` separators
    /// @param content The file content
    public void putFile(String relativePath, byte[] content) {
        files.put(stripSlashes(relativePath), content.clone());
    }

    /// @param enabled Whether the token endpoint honors the password grant
    public void setPasswordGrantEnabled(boolean enabled) {
        this.passwordGrantEnabled = enabled;
    }

    /// @param enabled Whether the authorization endpoint renders a login form
    public void setLoginFormEnabled(boolean enabled) {
        this.loginFormEnabled = enabled;
    }

    /// @param supported Whether file requests honor the Range header; when false full bodies are sent
    public void setRangeSupported(boolean supported) {
        this.rangeSupported = supported;
    }

    /// Invalidates every issued bearer token and browser session.
    public void expireSessions() {
        bearerTokens.clear();
        browserSessions.clear();
        logger.debug("All portal sessions expired");
    }

    /// Answers the next requests for a file with a fixed status.
    ///
    /// @param relativePath The file path below the tree root
    /// @param count How many requests fail
    /// @param status The status code to answer with
    public void failNextRequests(String relativePath, int count, int status) {
        failures.put(stripSlashes(relativePath), new InjectedFailure(new AtomicInteger(count), status));
    }

    /// Breaks the next body for a file after a number of bytes, closing the connection.
    ///
    /// @param relativePath The file path below the tree root
    /// @param bytesBeforeReset Bytes delivered before the connection drops
    public void truncateNextResponse(String relativePath, int bytesBeforeReset) {
        truncations.put(stripSlashes(relativePath), bytesBeforeReset);
    }

    /// @return How many access tokens the token endpoint issued
    public int tokenGrants() {
        return tokenGrants.get();
    }

    /// @return How many form logins succeeded
    public int formLogins() {
        return formLogins.get();
    }

    /// @return How many form logins were rejected
    public int rejectedLogins() {
        return rejectedLogins.get();
    }

    /// @return How many logins (token grants plus form logins) succeeded
    public int successfulLogins() {
        return tokenGrants.get() + formLogins.get();
    }

    /// @return How many protected requests were redirected to the login page
    public int loginRedirects() {
        return loginRedirects.get();
    }

    /// @param relativePath A path below the tree root
    /// @return How many authorized requests reached that path
    public int requestCount(String relativePath) {
        AtomicInteger count = requestCounts.get(stripSlashes(relativePath));
        return count == null ? 0 : count.get();
    }

    /// @param relativePath A file path below the tree root
    /// @return How many body bytes were written for that file
    public long bodyBytesServed(String relativePath) {
        AtomicLong bytes = bodyBytes.get(stripSlashes(relativePath));
        return bytes == null ? 0 : bytes.get();
    }

    /// @param relativePath A file path below the tree root
    /// @return The Range header of each GET for that file, empty string when absent
    public List<String> rangeHeaders(String relativePath) {
        return List.copyOf(rangeHeaders.getOrDefault(stripSlashes(relativePath), List.of()));
    }

    /// @param relativePath A file path below the tree root
    /// @return The Accept-Encoding header of each GET for that file, empty string when absent
    public List<String> acceptEncodings(String relativePath) {
        return List.copyOf(acceptEncodings.getOrDefault(stripSlashes(relativePath), List.of()));
    }

    private static String stripSlashes(String path) {
        String stripped = path;
        while (stripped.startsWith("/")) {
            stripped = stripped.substring(1);
        }
        return stripped;
    }

    private int findAvailablePort() {
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            throw new RuntimeException("Failed to find available port", e);
        }
    }

    private record InjectedFailure(AtomicInteger remaining, int status) {
    }

    /// Routes requests to the realm, the login action or the protected tree.
    private class PortalHandler implements HttpRequestHandler {

        @Override
        public void handle(ClassicHttpRequest request, ClassicHttpResponse response, HttpContext context)
            throws HttpException, IOException
        {
            URI uri;
            try {
                uri = request.getUri();
            } catch (URISyntaxException e) {
                response.setCode(HttpStatus.SC_BAD_REQUEST);
                response.setEntity(new StringEntity("Bad request target"));
                return;
            }
            String path = uri.getPath();

            if (path.equals(REALM_PATH + "/token")) {
                handleToken(request, response);
            } else if (path.equals(REALM_PATH + "/auth")) {
                handleAuthorization(request, response);
            } else if (path.equals(LOGIN_ACTION_PATH)) {
                handleLoginAction(request, response);
            } else if (path.startsWith(DATA_PATH)) {
                handleProtected(request, response, path.substring(DATA_PATH.length()));
            } else {
                response.setCode(HttpStatus.SC_NOT_FOUND);
                response.setEntity(new StringEntity("Not found: " + path));
            }
        }

        private void handleToken(ClassicHttpRequest request, ClassicHttpResponse response) throws IOException {
            Map<String, String> form = readForm(request);
            JsonObject json = new JsonObject();
            if (!passwordGrantEnabled) {
                json.addProperty("error", "unauthorized_client");
                json.addProperty("error_description", "Client not allowed for direct access grants");
                response.setCode(HttpStatus.SC_BAD_REQUEST);
            } else if (!CLIENT_ID.equals(form.get("client_id"))
                || !"password".equals(form.get("grant_type"))
                || !username.equals(form.get("username"))
                || !password.equals(form.get("password")))
            {
                json.addProperty("error", "invalid_grant");
                json.addProperty("error_description", "Invalid user credentials");
                response.setCode(HttpStatus.SC_UNAUTHORIZED);
            } else {
                String token = UUID.randomUUID().toString();
                bearerTokens.add(token);
                tokenGrants.incrementAndGet();
                json.addProperty("access_token", token);
                json.addProperty("token_type", "Bearer");
                json.addProperty("expires_in", 300);
                response.setCode(HttpStatus.SC_OK);
            }
            response.setEntity(new StringEntity(json.toString(), ContentType.APPLICATION_JSON));
        }

        private void handleAuthorization(ClassicHttpRequest request, ClassicHttpResponse response) {
            if (hasValidSession(request)) {
                redirect(response, baseUrl());
                return;
            }
            if (!loginFormEnabled) {
                response.setCode(HttpStatus.SC_OK);
                response.setEntity(new StringEntity(
                    "<html><body><p>Sign-in is temporarily unavailable.</p></body></html>",
                    ContentType.TEXT_HTML));
                return;
            }
            response.setCode(HttpStatus.SC_OK);
            response.setEntity(new StringEntity(loginPage(null), ContentType.TEXT_HTML));
        }

        private void handleLoginAction(ClassicHttpRequest request, ClassicHttpResponse response) throws IOException {
            Map<String, String> form = readForm(request);
            String code = form.get("login_code");
            boolean known = code != null && pendingLoginCodes.remove(code);
            if (known
                && form.containsKey("credentialId")
                && username.equals(form.get("username"))
                && password.equals(form.get("password")))
            {
                String sessionId = UUID.randomUUID().toString();
                browserSessions.add(sessionId);
                formLogins.incrementAndGet();
                response.addHeader("Set-Cookie", SESSION_COOKIE + "=" + sessionId + "; Path=/; HttpOnly");
                redirect(response, baseUrl());
            } else {
                rejectedLogins.incrementAndGet();
                response.setCode(HttpStatus.SC_OK);
                response.setEntity(new StringEntity(
                    loginPage("Invalid username or password."), ContentType.TEXT_HTML));
            }
        }

        private void handleProtected(ClassicHttpRequest request, ClassicHttpResponse response, String relativePath) {
            if (!isAuthorized(request)) {
                loginRedirects.incrementAndGet();
                redirect(response, authBaseUrl() + "/auth?response_type=code&client_id=" + CLIENT_ID
                                   + "&redirect_uri=" + encode(baseUrl()));
                return;
            }
            requestCounts.computeIfAbsent(relativePath, p -> new AtomicInteger()).incrementAndGet();

            InjectedFailure failure = failures.get(relativePath);
            if (failure != null && failure.remaining().getAndDecrement() > 0) {
                response.setCode(failure.status());
                response.setEntity(new StringEntity("Injected failure " + failure.status()));
                return;
            }

            byte[] content = files.get(relativePath);
            if (content != null) {
                serveFile(request, response, relativePath, content);
            } else if (relativePath.isEmpty() || relativePath.endsWith("/")) {
                serveListing(response, relativePath);
            } else {
                response.setCode(HttpStatus.SC_NOT_FOUND);
                response.setEntity(new StringEntity("File not found: " + relativePath));
            }
        }

        private void serveFile(ClassicHttpRequest request, ClassicHttpResponse response, String relativePath,
                               byte[] content)
        {
            if ("HEAD".equalsIgnoreCase(request.getMethod())) {
                // HEAD bodies are dropped by the server, the entity only drives Content-Length
                response.setCode(HttpStatus.SC_OK);
                if (rangeSupported) {
                    response.setHeader("Accept-Ranges", "bytes");
                }
                response.setEntity(new ByteArrayEntity(content, ContentType.APPLICATION_OCTET_STREAM));
                return;
            }

            Header rangeHeader = request.getFirstHeader("Range");
            rangeHeaders.computeIfAbsent(relativePath, p -> new CopyOnWriteArrayList<>())
                .add(rangeHeader == null ? "" : rangeHeader.getValue());
            Header encodingHeader = request.getFirstHeader("Accept-Encoding");
            acceptEncodings.computeIfAbsent(relativePath, p -> new CopyOnWriteArrayList<>())
                .add(encodingHeader == null ? "" : encodingHeader.getValue());

            int start = 0;
            int end = content.length - 1;
            if (rangeHeader != null && rangeSupported) {
                String spec = rangeHeader.getValue();
                if (!spec.startsWith("bytes=")) {
                    response.setCode(HttpStatus.SC_REQUESTED_RANGE_NOT_SATISFIABLE);
                    response.setEntity(new StringEntity("Invalid range header format: " + spec));
                    return;
                }
                String[] parts = spec.substring("bytes=".length()).split("-", -1);
                start = Integer.parseInt(parts[0]);
                if (parts.length > 1 && !parts[1].isEmpty()) {
                    end = Math.min(Integer.parseInt(parts[1]), content.length - 1);
                }
                if (start >= content.length || start > end) {
                    response.setCode(HttpStatus.SC_REQUESTED_RANGE_NOT_SATISFIABLE);
                    response.setHeader("Content-Range", "bytes */" + content.length);
                    response.setEntity(new StringEntity("Requested range not satisfiable"));
                    return;
                }
                response.setCode(HttpStatus.SC_PARTIAL_CONTENT);
                response.setHeader("Content-Range", "bytes " + start + "-" + end + "/" + content.length);
            } else {
                response.setCode(HttpStatus.SC_OK);
            }
            if (rangeSupported) {
                response.setHeader("Accept-Ranges", "bytes");
            }

            byte[] slice = Arrays.copyOfRange(content, start, end + 1);
            Integer cutoff = truncations.remove(relativePath);
            AtomicLong served = bodyBytes.computeIfAbsent(relativePath, p -> new AtomicLong());
            if (cutoff != null) {
                response.setEntity(new InputStreamEntity(
                    new ResettingInputStream(slice, cutoff, served), slice.length,
                    ContentType.APPLICATION_OCTET_STREAM));
            } else {
                served.addAndGet(slice.length);
                response.setEntity(new ByteArrayEntity(slice, ContentType.APPLICATION_OCTET_STREAM));
            }
        }

        private void serveListing(ClassicHttpResponse response, String directory) {
            Set<String> subdirectories = new TreeSet<>();
            Set<String> fileNames = new TreeSet<>();
            for (String path : files.keySet()) {
                if (!path.startsWith(directory)) {
                    continue;
                }
                String rest = path.substring(directory.length());
                int slash = rest.indexOf('/');
                if (slash >= 0) {
                    subdirectories.add(rest.substring(0, slash));
                } else {
                    fileNames.add(rest);
                }
            }
            if (!directory.isEmpty() && subdirectories.isEmpty() && fileNames.isEmpty()) {
                response.setCode(HttpStatus.SC_NOT_FOUND);
                response.setEntity(new StringEntity("Directory not found: " + directory));
                return;
            }

            StringBuilder html = new StringBuilder();
            html.append("<html><head><title>Index of /data/").append(directory).append("</title></head><body>\n");
            html.append("<h1>Index of /data/").append(directory).append("</h1>\n<table>\n");
            html.append("<tr><th><a href=\"?C=N;O=D\">Name</a></th><th><a href=\"?C=M;O=A\">Last modified</a></th></tr>\n");
            html.append("<tr><td><a href=\"/data/\">Parent Directory</a></td></tr>\n");
            html.append("<tr><td><a href=\"../\">../</a></td></tr>\n");
            for (String sub : subdirectories) {
                html.append("<tr><td><a href=\"").append(encode(sub)).append("/\">").append(sub)
                    .append("/</a></td></tr>\n");
            }
            for (String name : fileNames) {
                html.append("<tr><td><a href=\"").append(encode(name)).append("\">").append(name)
                    .append("</a></td></tr>\n");
            }
            html.append("</table></body></html>\n");
            response.setCode(HttpStatus.SC_OK);
            response.setEntity(new StringEntity(html.toString(), ContentType.TEXT_HTML));
        }

        private String loginPage(String error) {
            String code = UUID.randomUUID().toString();
            pendingLoginCodes.add(code);
            StringBuilder html = new StringBuilder();
            html.append("<html><head><title>Sign in to test</title></head><body>\n");
            if (error != null) {
                html.append("<div class=\"pf-c-alert pf-m-danger\"><span class=\"pf-c-alert__title kc-feedback-text\">")
                    .append(error).append("</span></div>\n");
            }
            html.append("<form id=\"kc-form-login\" action=\"").append(LOGIN_ACTION_PATH)
                .append("?session_code=").append(code).append("&amp;execution=login\" method=\"post\">\n");
            html.append("<input id=\"username\" name=\"username\" type=\"text\">\n");
            html.append("<input id=\"password\" name=\"password\" type=\"password\">\n");
            html.append("<input type=\"hidden\" name=\"login_code\" value=\"").append(code).append("\">\n");
            html.append("<input type=\"hidden\" id=\"id-hidden-input\" name=\"credentialId\">\n");
            html.append("<input type=\"submit\" name=\"login\" value=\"Sign In\">\n");
            html.append("</form></body></html>\n");
            return html.toString();
        }

        private boolean isAuthorized(ClassicHttpRequest request) {
            Header authorization = request.getFirstHeader("Authorization");
            if (authorization != null && authorization.getValue().startsWith("Bearer ")) {
                if (bearerTokens.contains(authorization.getValue().substring("Bearer ".length()))) {
                    return true;
                }
            }
            return hasValidSession(request);
        }

        private boolean hasValidSession(ClassicHttpRequest request) {
            for (Header header : request.getHeaders("Cookie")) {
                for (String pair : header.getValue().split(";")) {
                    String[] kv = pair.trim().split("=", 2);
                    if (kv.length == 2 && SESSION_COOKIE.equals(kv[0]) && browserSessions.contains(kv[1])) {
                        return true;
                    }
                }
            }
            return false;
        }

        private void redirect(ClassicHttpResponse response, String location) {
            response.setCode(HttpStatus.SC_MOVED_TEMPORARILY);
            response.setHeader("Location", location);
        }

        private Map<String, String> readForm(ClassicHttpRequest request) throws IOException {
            Map<String, String> form = new HashMap<>();
            if (request.getEntity() == null) {
                return form;
            }
            String body;
            try {
                body = EntityUtils.toString(request.getEntity(), StandardCharsets.UTF_8);
            } catch (org.apache.hc.core5.http.ParseException e) {
                throw new IOException("Unreadable form body", e);
            }
            for (String pair : body.split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                String[] kv = pair.split("=", 2);
                String key = URLDecoder.decode(kv[0], StandardCharsets.UTF_8);
                String value = kv.length > 1 ? URLDecoder.decode(kv[1], StandardCharsets.UTF_8) : "";
                form.put(key, value);
            }
            return form;
        }

        private String encode(String value) {
            return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
        }
    }

    /// Delivers a prefix of a body, then fails as a dropped connection would.
    private static class ResettingInputStream extends InputStream {
        private final InputStream delegate;
        private final AtomicLong served;
        private int remaining;

        ResettingInputStream(byte[] content, int cutoff, AtomicLong served) {
            this.delegate = new ByteArrayInputStream(content);
            this.remaining = Math.min(cutoff, content.length);
            this.served = served;
        }

        @Override
        public int read() throws IOException {
            byte[] one = new byte[1];
            int n = read(one, 0, 1);
            return n < 0 ? -1 : one[0] & 0xff;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (remaining <= 0) {
                throw new IOException("Simulated connection reset");
            }
            int n = delegate.read(b, off, Math.min(len, remaining));
            if (n > 0) {
                remaining -= n;
                served.addAndGet(n);
            }
            return n;
        }
    }
}
