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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.portalfetch.transport.Credentials;
import io.portalfetch.transport.PortalConfig;
import okhttp3.FormBody;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/// Direct token exchange with the OAuth2 resource-owner password grant.
///
/// On success the access token is installed on the session as a bearer token.
public class PasswordGrantStrategy implements LoginStrategy {
    private static final Logger logger = LogManager.getLogger(PasswordGrantStrategy.class);

    @Override
    public String name() {
        return "password-grant";
    }

    @Override
    public boolean login(LoginSession session, Credentials credentials) throws IOException {
        PortalConfig config = session.config();
        FormBody.Builder form = new FormBody.Builder()
            .add("client_id", config.clientId())
            .add("username", credentials.identity())
            .add("password", credentials.secret())
            .add("grant_type", "password");
        if (config.hasClientSecret()) {
            form.add("client_secret", config.clientSecret());
        }
        Request request = new Request.Builder().url(config.tokenUrl()).post(form.build()).build();

        try (Response response = session.client().newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            if (response.code() != 200) {
                logger.debug("Token endpoint answered {}: {}", response.code(), abbreviate(text));
                return false;
            }
            String token = parseAccessToken(text);
            if (token == null) {
                logger.debug("Token endpoint answered 200 without an access_token");
                return false;
            }
            session.setBearerToken(token);
            return true;
        }
    }

    static String parseAccessToken(String json) {
        try {
            JsonElement element = JsonParser.parseString(json);
            if (!element.isJsonObject()) {
                return null;
            }
            JsonObject object = element.getAsJsonObject();
            JsonElement token = object.get("access_token");
            if (token == null || token.isJsonNull()) {
                return null;
            }
            String value = token.getAsString();
            return value.isEmpty() ? null : value;
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
            logger.debug("Unparseable token response: {}", e.getMessage());
            return null;
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
