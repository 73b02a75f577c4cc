package io.portalfetch.crawl;

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

import io.portalfetch.manifest.Manifest;
import io.portalfetch.manifest.WorkItem;
import io.portalfetch.testserver.PortalServerFixture;
import io.portalfetch.transport.AuthenticatedTransport;
import io.portalfetch.transport.Credentials;
import io.portalfetch.transport.PortalConfig;
import io.portalfetch.transport.auth.PortalAuthenticator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

public class ManifestCrawlerTest {

    private static final String BASE = "https://portal.example/data/";

    @TempDir
    Path tempDir;

    private static class StubLister implements DirectoryLister {
        private final Map<String, DirectoryListing> pages = new HashMap<>();
        private final Map<String, Integer> calls = new HashMap<>();

        StubLister page(String url, List<String> files, List<String> directories) {
            pages.put(url, new DirectoryListing(files, directories));
            return this;
        }

        @Override
        public DirectoryListing list(String directoryUrl) throws IOException {
            calls.merge(directoryUrl, 1, Integer::sum);
            DirectoryListing listing = pages.get(directoryUrl);
            if (listing == null) {
                throw new IOException("HTTP 500 for " + directoryUrl);
            }
            return listing;
        }
    }

    @Test
    public void testFiltersAndDestinations() {
        StubLister lister = new StubLister()
            .page(BASE, List.of(BASE + "index.txt"), List.of(BASE + "2012/", BASE + "vcmslcfg/"))
            .page(BASE + "2012/",
                List.of(BASE + "2012/SVDNB.avg_rade9h.tif.gz", BASE + "2012/SVDNB.cvg.tif.gz",
                    BASE + "2012/SVDNB%20x.cf_cvg.tif.gz"),
                List.of(BASE + "2012/broken/"))
            .page(BASE + "vcmslcfg/", List.of(BASE + "vcmslcfg/skip.avg_rade9h.tif.gz"), List.of());
        CrawlFilter filter = new CrawlFilter(List.of(".avg_rade9h.tif.gz", ".cf_cvg.tif.gz"), Set.of("vcmslcfg"));

        Manifest manifest = new ManifestCrawler(lister, filter, BASE, tempDir).crawl();

        assertThat(manifest.items()).containsExactly(
            new WorkItem(BASE + "2012/SVDNB.avg_rade9h.tif.gz", tempDir.resolve("2012/SVDNB.avg_rade9h.tif.gz")),
            new WorkItem(BASE + "2012/SVDNB%20x.cf_cvg.tif.gz", tempDir.resolve("2012/SVDNB x.cf_cvg.tif.gz")));
        assertThat(lister.calls).doesNotContainKey(BASE + "vcmslcfg/");
        assertThat(lister.calls).containsEntry(BASE + "2012/broken/", 1);
    }

    @Test
    public void testLinksOutsideBaseAndCyclesAreIgnored() {
        StubLister lister = new StubLister()
            .page(BASE, List.of("https://elsewhere.example/file.bin", BASE + "a.bin"),
                List.of(BASE + "loop/", "https://portal.example/other/"))
            .page(BASE + "loop/", List.of(BASE + "loop/b.bin", BASE + "a.bin"), List.of(BASE + "loop/"));

        Manifest manifest = new ManifestCrawler(lister, CrawlFilter.acceptAll(), BASE, tempDir).crawl();

        assertThat(manifest.items()).extracting(WorkItem::sourceLocator)
            .containsExactly(BASE + "a.bin", BASE + "loop/b.bin");
        assertThat(manifest.items().get(1).destinationPath()).isEqualTo(tempDir.resolve("loop/b.bin"));
        assertThat(lister.calls).containsEntry(BASE + "loop/", 1).doesNotContainKey("https://portal.example/other/");
    }

    @Test
    public void testCrawlAgainstPortal() throws IOException {
        try (PortalServerFixture portal = new PortalServerFixture("alice", "wonderland")) {
            byte[] data = "x".getBytes(StandardCharsets.UTF_8);
            portal.putFile("2013/one.avg_rade9h.tif.gz", data);
            portal.putFile("2013/one.cvg.tif.gz", data);
            portal.putFile("2013/month 01/two.cf_cvg.tif.gz", data);
            portal.putFile("vcmslcfg/three.avg_rade9h.tif.gz", data);
            portal.start();

            PortalConfig config = PortalConfig.builder(portal.baseUrl(), portal.authBaseUrl(), portal.clientId())
                .build();
            try (AuthenticatedTransport transport = new AuthenticatedTransport(config,
                new PortalAuthenticator(config, new Credentials("alice", "wonderland"))))
            {
                transport.start();
                CrawlFilter filter = new CrawlFilter(List.of(".avg_rade9h.tif.gz", ".cf_cvg.tif.gz"),
                    Set.of("vcmslcfg"));
                Manifest manifest = new ManifestCrawler(new HtmlDirectoryLister(transport), filter,
                    portal.baseUrl(), tempDir).crawl();

                assertThat(manifest.items()).extracting(WorkItem::destinationPath).containsExactlyInAnyOrder(
                    tempDir.resolve("2013/one.avg_rade9h.tif.gz"),
                    tempDir.resolve("2013/month 01/two.cf_cvg.tif.gz"));
                assertThat(portal.requestCount("vcmslcfg/")).isZero();
            }
        }
    }
}
