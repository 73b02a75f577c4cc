package io.portalfetch.manifest;

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

import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;

public class ManifestTest {

    @Test
    public void testIdentityIgnoresSizeHint() {
        WorkItem plain = new WorkItem("https://p/data/a", Paths.get("out/a"));
        WorkItem hinted = new WorkItem("https://p/data/a", Paths.get("out/a"), 1024);

        assertThat(plain).isEqualTo(hinted);
        assertThat(plain.hashCode()).isEqualTo(hinted.hashCode());
        assertThat(plain.hasSizeHint()).isFalse();
        assertThat(hinted.hasSizeHint()).isTrue();
    }

    @Test
    public void testSameSourceDifferentDestinationIsDistinct() {
        WorkItem first = new WorkItem("https://p/data/a", Paths.get("out/a"));
        WorkItem second = new WorkItem("https://p/data/a", Paths.get("mirror/a"));

        Manifest manifest = Manifest.of(first, second);
        assertThat(manifest.size()).isEqualTo(2);
        assertThat(manifest.duplicatesRemoved()).isZero();
    }

    @Test
    public void testFirstOccurrenceWinsAndOrderIsKept() {
        WorkItem a = new WorkItem("https://p/data/a", Paths.get("out/a"), 10);
        WorkItem b = new WorkItem("https://p/data/b", Paths.get("out/b"));
        WorkItem c = new WorkItem("https://p/data/c", Paths.get("out/c"));
        WorkItem aAgain = new WorkItem("https://p/data/a", Paths.get("out/a"), 99);

        Manifest manifest = Manifest.of(c, a, b, aAgain, c);

        assertThat(manifest.items()).containsExactly(c, a, b);
        assertThat(manifest.items().get(1).sizeHint()).isEqualTo(10);
        assertThat(manifest.duplicatesRemoved()).isEqualTo(2);
    }
}
