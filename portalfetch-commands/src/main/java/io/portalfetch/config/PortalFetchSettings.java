package io.portalfetch.config;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Settings read from an optional YAML file. Every value may be absent; command line options
/// and built-in defaults fill the gaps.
///
/// ```yaml
/// portal:
///   base_url: https://portal.example.org/data/
///   auth_base_url: https://auth.example.org/realms/main/protocol/openid-connect
///   client_id: portal-downloader
///   client_secret: null
///   username: someone@example.org
///   connect_timeout_seconds: 15
///   read_timeout_seconds: 60
///   max_attempts: 10
///   backoff_base_seconds: 5
///   backoff_jitter_seconds: 1
/// transfer:
///   workers: 4
///   chunk_size: 8192
///   round_cooldown_seconds: 5
///   max_rounds: 0
/// crawl:
///   include_suffixes: [.avg_rade9h.tif.gz, .cf_cvg.tif.gz]
///   exclude_directories: [vcmslcfg]
/// manifest:
///   cache_file: file_list_cache.json
/// output: ./downloads
/// ```
///
/// The file never supplies a password.
public class PortalFetchSettings {
    private static final Logger logger = LogManager.getLogger(PortalFetchSettings.class);

    private String baseUrl;
    private String authBaseUrl;
    private String clientId;
    private String clientSecret;
    private String username;
    private Integer connectTimeoutSeconds;
    private Integer readTimeoutSeconds;
    private Integer maxAttempts;
    private Integer backoffBaseSeconds;
    private Integer backoffJitterSeconds;
    private Integer workers;
    private Integer chunkSize;
    private Integer roundCooldownSeconds;
    private Integer maxRounds;
    private List<String> includeSuffixes = new ArrayList<>();
    private Set<String> excludeDirectories = new LinkedHashSet<>();
    private String cacheFile;
    private String output;

    /// @return Settings with every value absent
    public static PortalFetchSettings empty() {
        return new PortalFetchSettings();
    }

    /// Reads a settings file.
    ///
    /// @param file A YAML file
    /// @return The settings it contains
    /// @throws IOException If the file cannot be read or has the wrong shape
    public static PortalFetchSettings load(Path file) throws IOException {
        String text = Files.readString(file);
        try {
            return parse(text);
        } catch (YamlEngineException | IllegalArgumentException e) {
            throw new IOException("Invalid settings file " + file + ": " + e.getMessage(), e);
        }
    }

    /// @param yaml YAML text
    /// @return The settings it contains
    /// @throws IllegalArgumentException If the document has the wrong shape
    public static PortalFetchSettings parse(String yaml) {
        LoadSettings loadSettings = LoadSettings.builder().build();
        Load load = new Load(loadSettings);
        Object document = load.loadFromString(yaml);
        PortalFetchSettings settings = new PortalFetchSettings();
        if (document == null) {
            return settings;
        }
        Map<?, ?> root = asMap(document, "document");

        Map<?, ?> portal = section(root, "portal");
        settings.baseUrl = string(portal, "base_url");
        settings.authBaseUrl = string(portal, "auth_base_url");
        settings.clientId = string(portal, "client_id");
        settings.clientSecret = string(portal, "client_secret");
        settings.username = string(portal, "username");
        settings.connectTimeoutSeconds = integer(portal, "connect_timeout_seconds");
        settings.readTimeoutSeconds = integer(portal, "read_timeout_seconds");
        settings.maxAttempts = integer(portal, "max_attempts");
        settings.backoffBaseSeconds = integer(portal, "backoff_base_seconds");
        settings.backoffJitterSeconds = integer(portal, "backoff_jitter_seconds");
        if (portal.containsKey("password")) {
            logger.warn("Ignoring 'portal.password' in the settings file; use the environment or the prompt");
        }

        Map<?, ?> transfer = section(root, "transfer");
        settings.workers = integer(transfer, "workers");
        settings.chunkSize = integer(transfer, "chunk_size");
        settings.roundCooldownSeconds = integer(transfer, "round_cooldown_seconds");
        settings.maxRounds = integer(transfer, "max_rounds");

        Map<?, ?> crawl = section(root, "crawl");
        settings.includeSuffixes = strings(crawl, "include_suffixes");
        settings.excludeDirectories = new LinkedHashSet<>(strings(crawl, "exclude_directories"));

        Map<?, ?> manifest = section(root, "manifest");
        settings.cacheFile = string(manifest, "cache_file");
        settings.output = string(root, "output");
        return settings;
    }

    private static Map<?, ?> section(Map<?, ?> root, String name) {
        Object value = root.get(name);
        if (value == null) {
            return Map.of();
        }
        return asMap(value, name);
    }

    private static Map<?, ?> asMap(Object value, String name) {
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("'" + name + "' must be a mapping");
        }
        return (Map<?, ?>) value;
    }

    private static String string(Map<?, ?> map, String key) {
        Object value = map.get(key);
        return value == null ? null : value.toString();
    }

    private static Integer integer(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' must be an integer, got '" + value + "'");
        }
    }

    private static List<String> strings(Map<?, ?> map, String key) {
        Object value = map.get(key);
        List<String> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        if (value instanceof List) {
            for (Object element : (List<?>) value) {
                result.add(String.valueOf(element));
            }
        } else {
            result.add(value.toString());
        }
        return result;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public String authBaseUrl() {
        return authBaseUrl;
    }

    public String clientId() {
        return clientId;
    }

    public String clientSecret() {
        return clientSecret;
    }

    public String username() {
        return username;
    }

    public Integer connectTimeoutSeconds() {
        return connectTimeoutSeconds;
    }

    public Integer readTimeoutSeconds() {
        return readTimeoutSeconds;
    }

    public Integer maxAttempts() {
        return maxAttempts;
    }

    public Integer backoffBaseSeconds() {
        return backoffBaseSeconds;
    }

    public Integer backoffJitterSeconds() {
        return backoffJitterSeconds;
    }

    public Integer workers() {
        return workers;
    }

    public Integer chunkSize() {
        return chunkSize;
    }

    public Integer roundCooldownSeconds() {
        return roundCooldownSeconds;
    }

    public Integer maxRounds() {
        return maxRounds;
    }

    public List<String> includeSuffixes() {
        return includeSuffixes;
    }

    public Set<String> excludeDirectories() {
        return excludeDirectories;
    }

    public String cacheFile() {
        return cacheFile;
    }

    public String output() {
        return output;
    }
}
