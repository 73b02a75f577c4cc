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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class HtmlDirectoryListerTest {

    private static final String LISTING = "<html><head><title>Index of /nighttime_light/monthly_notile</title></head>"
        + "<body><h1>Index of /nighttime_light/monthly_notile</h1><table>"
        + "<tr><th><a href=\"?C=N;O=D\">Name</a></th><th><a href=\"?C=M;O=A\">Last modified</a></th></tr>"
        + "<tr><td><a href=\"/nighttime_light/\">Parent Directory</a></td></tr>"
        + "<tr><td><a href=\"../\">../</a></td></tr>"
        + "<tr><td><a href=\"./\">./</a></td></tr>"
        + "<tr><td><a href=\"2012/\">2012/</a></td></tr>"
        + "<tr><td><a href=\"vcmslcfg/\">vcmslcfg/</a></td></tr>"
        + "<tr><td><a href=\"README%20first.txt\">README first.txt</a></td></tr>"
        + "<tr><td><a>no href</a></td></tr>"
        + "</table></body></html>";

    @Test
    public void testLinksAreSplitIntoFilesAndDirectories() {
        DirectoryListing listing = HtmlDirectoryLister.parse(LISTING,
            "https://eogdata.example/nighttime_light/monthly_notile/");

        assertThat(listing.directories()).containsExactly(
            "https://eogdata.example/nighttime_light/monthly_notile/2012/",
            "https://eogdata.example/nighttime_light/monthly_notile/vcmslcfg/");
        assertThat(listing.files()).containsExactly(
            "https://eogdata.example/nighttime_light/monthly_notile/README%20first.txt");
    }

    @Test
    public void testEmptyPage() {
        DirectoryListing listing = HtmlDirectoryLister.parse("", "https://eogdata.example/x/");
        assertThat(listing.files()).isEmpty();
        assertThat(listing.directories()).isEmpty();
    }
}
