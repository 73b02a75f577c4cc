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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PortalFetchSettingsTest {

    @TempDir
    Path tempDir;

    @Test
    public void testLoadFullFile() throws IOException, URISyntaxException {
        Path file = Paths.get(getClass().getResource("/settings/nighttime-lights.yaml").toURI());
        PortalFetchSettings settings = PortalFetchSettings.load(file);

        assertThat(settings.baseUrl()).isEqualTo("https://eogdata.mines.edu/nighttime_light/monthly_notile/");
        assertThat(settings.authBaseUrl()).endsWith("/realms/eog/protocol/openid-connect");
        assertThat(settings.clientId()).isEqualTo("eogdata-new-apache");
        assertThat(settings.clientSecret()).isNull();
        assertThat(settings.username()).isEqualTo("someone@example.org");
        assertThat(settings.connectTimeoutSeconds()).isEqualTo(20);
        assertThat(settings.readTimeoutSeconds()).isEqualTo(90);
        assertThat(settings.maxAttempts()).isEqualTo(12);
        assertThat(settings.workers()).isEqualTo(6);
        assertThat(settings.chunkSize()).isNull();
        assertThat(settings.roundCooldownSeconds()).isEqualTo(10);
        assertThat(settings.maxRounds()).isZero();
        assertThat(settings.includeSuffixes()).containsExactly(".avg_rade9h.tif.gz", ".cf_cvg.tif.gz");
        assertThat(settings.excludeDirectories()).containsExactly("vcmslcfg");
        assertThat(settings.cacheFile()).isEqualTo("eog_files_cache.json");
        assertThat(settings.output()).isEqualTo("./eog_downloads");
    }

    @Test
    public void testEmptyAndPartialDocuments() {
        PortalFetchSettings empty = PortalFetchSettings.parse("");
        assertThat(empty.baseUrl()).isNull();
        assertThat(empty.includeSuffixes()).isEmpty();

        PortalFetchSettings partial = PortalFetchSettings.parse("transfer:\n  workers: '8'\n");
        assertThat(partial.workers()).isEqualTo(8);
        assertThat(partial.baseUrl()).isNull();
    }

    @Test
    public void testPasswordIsNeverRead() {
        PortalFetchSettings settings = PortalFetchSettings.parse("portal:\n  username: bob\n  password: hunter2\n");
        assertThat(settings.username()).isEqualTo("bob");
    }

    @Test
    public void testWrongShapesAreRejected() throws IOException {
        assertThatThrownBy(() -> PortalFetchSettings.parse("- just\n- a list\n"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PortalFetchSettings.parse("transfer:\n  workers: many\n"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("workers");

        Path broken = tempDir.resolve("broken.yaml");
        Files.writeString(broken, "portal: [unclosed\n");
        assertThatThrownBy(() -> PortalFetchSettings.load(broken)).isInstanceOf(IOException.class);
    }
}
