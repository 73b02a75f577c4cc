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
import io.portalfetch.transport.PortalConfig;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.IOException;
import java.util.UUID;

/// Logs in the way a browser would: fetch the authorization page, fill in its login form and
/// submit it, keeping whatever session cookies the realm sets.
///
/// A page without the login form means the realm already recognizes the session; the strategy
/// then reports success and leaves the decision to [AccessVerifier].
public class BrowserLoginStrategy implements LoginStrategy {
    private static final Logger logger = LogManager.getLogger(BrowserLoginStrategy.class);

    @Override
    public String name() {
        return "browser-form";
    }

    @Override
    public boolean login(LoginSession session, Credentials credentials) throws IOException {
        PortalConfig config = session.config();
        HttpUrl authorizationUrl = HttpUrl.parse(config.authorizationUrl());
        if (authorizationUrl == null) {
            throw new IOException("Invalid authorization URL: " + config.authorizationUrl());
        }
        HttpUrl pageUrl = authorizationUrl.newBuilder()
            .addQueryParameter("response_type", "code")
            .addQueryParameter("client_id", config.clientId())
            .addQueryParameter("redirect_uri", config.redirectUri())
            .addQueryParameter("scope", config.scope())
            .addQueryParameter("state", UUID.randomUUID().toString())
            .build();

        Document page;
        try (Response response = session.client().newCall(new Request.Builder().url(pageUrl).build()).execute()) {
            page = parse(response);
        }

        Element form = page.selectFirst("form#" + config.loginFormId());
        if (form == null) {
            logger.debug("No login form on {}, assuming an existing session", page.location());
            return true;
        }

        String action = form.absUrl("action");
        if (action.isEmpty()) {
            action = page.location();
        }
        FormBody.Builder body = new FormBody.Builder()
            .add("username", credentials.identity())
            .add("password", credentials.secret())
            .add("credentialId", "");
        for (Element hidden : form.select("input[type=hidden]")) {
            String name = hidden.attr("name");
            if (!name.isEmpty() && !name.equals("credentialId")) {
                body.add(name, hidden.attr("value"));
            }
        }

        Document result;
        try (Response response = session.client().newCall(
            new Request.Builder().url(action).post(body.build()).build()).execute())
        {
            result = parse(response);
        }

        for (String marker : config.loginErrorMarkers()) {
            if (!result.getElementsByClass(marker).isEmpty()) {
                Element alert = result.selectFirst("span.pf-c-alert__title");
                String message = alert != null ? alert.text() : result.getElementsByClass(marker).first().text();
                logger.warn("Login form rejected the credentials: {}", message);
                return false;
            }
        }
        return true;
    }

    private static Document parse(Response response) throws IOException {
        ResponseBody body = response.body();
        String html = body == null ? "" : body.string();
        String location = response.request().url().toString();
        return Jsoup.parse(html, location);
    }
}
