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

import io.portalfetch.transport.AuthenticatedTransport;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/// Reads Apache-style HTML index pages through the authenticated transport.
///
/// Parent links (`../`, `./`), column sort links (`?C=N;O=D`) and absolute-path links are
/// ignored. A link ending with `/` is a directory, anything else is a file.
public class HtmlDirectoryLister implements DirectoryLister {

    private final AuthenticatedTransport transport;

    public HtmlDirectoryLister(AuthenticatedTransport transport) {
        this.transport = transport;
    }

    @Override
    public DirectoryListing list(String directoryUrl) throws IOException {
        String html;
        try (Response response = transport.get(directoryUrl)) {
            ResponseBody body = response.body();
            html = body == null ? "" : body.string();
        }
        return parse(html, directoryUrl);
    }

    /// @param html A listing page
    /// @param directoryUrl The URL the page was fetched from, used to resolve relative links
    /// @return The files and directories it links to
    static DirectoryListing parse(String html, String directoryUrl) {
        Document document = Jsoup.parse(html, directoryUrl);
        List<String> files = new ArrayList<>();
        List<String> directories = new ArrayList<>();
        for (Element link : document.select("a[href]")) {
            String href = link.attr("href");
            if (href.isEmpty() || href.equals("../") || href.equals("./") || href.startsWith("?")
                || href.startsWith("/"))
            {
                continue;
            }
            String absolute = link.absUrl("href");
            if (absolute.isEmpty()) {
                continue;
            }
            if (href.endsWith("/")) {
                directories.add(absolute);
            } else {
                files.add(absolute);
            }
        }
        return new DirectoryListing(files, directories);
    }
}
