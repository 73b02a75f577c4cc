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

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PortalConfigTest {

    @Test
    public void testDefaultsDerivedFromAddresses() {
        PortalConfig config = PortalConfig.builder(
            "https://portal.example/data", "https://auth.example/realms/x/protocol/openid-connect/", "client").build();

        assertThat(config.baseUrl()).isEqualTo("https://portal.example/data/");
        assertThat(config.authBaseUrl()).isEqualTo("https://auth.example/realms/x/protocol/openid-connect");
        assertThat(config.tokenUrl()).isEqualTo("https://auth.example/realms/x/protocol/openid-connect/token");
        assertThat(config.authorizationUrl()).isEqualTo("https://auth.example/realms/x/protocol/openid-connect/auth");
        assertThat(config.redirectUri()).isEqualTo("https://portal.example/data/");
        assertThat(config.scope()).isEqualTo("openid email");
        assertThat(config.loginFormId()).isEqualTo("kc-form-login");
        assertThat(config.loginErrorMarkers()).containsExactly("kc-feedback-text", "pf-c-alert__title");
        assertThat(config.connectTimeout()).isEqualTo(Duration.ofSeconds(15));
        assertThat(config.readTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.maxAttempts()).isEqualTo(10);
        assertThat(config.hasClientSecret()).isFalse();
    }

    @Test
    public void testRealmMembership() {
        PortalConfig config = PortalConfig.builder("https://portal.example/data/", "https://auth.example/realm", "c")
            .build();
        assertThat(config.isUnderAuthRealm("https://auth.example/realm/auth?x=1")).isTrue();
        assertThat(config.isUnderAuthRealm("https://portal.example/data/a.bin")).isFalse();
        assertThat(config.isUnderAuthRealm(null)).isFalse();
    }

    @Test
    public void testSecretsAreMasked() {
        PortalConfig config = PortalConfig.builder("https://p/", "https://a", "c").clientSecret("s3cr3t").build();
        assertThat(config.toString()).doesNotContain("s3cr3t");
        assertThat(new Credentials("bob", "hunter2").toString()).doesNotContain("hunter2").contains("bob");
    }

    @Test
    public void testInvalidValuesRejected() {
        assertThatThrownBy(() -> PortalConfig.builder("https://p/", "https://a", " ").build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PortalConfig.builder("https://p/", "https://a", "c").maxAttempts(0).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PortalConfig.builder("https://p/", "https://a", "c")
            .readTimeout(Duration.ZERO).build())
            .isInstanceOf(IllegalArgumentException.class);
    }
}
