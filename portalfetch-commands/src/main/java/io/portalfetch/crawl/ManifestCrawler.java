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
import okhttp3.HttpUrl;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/// Walks the remote directory tree below a base URL and turns the files it finds into work items.
///
/// Each file lands at `outputDir / relative directory / file name`, all decoded. Links that
/// leave the base URL are ignored, every directory is listed at most once, and a directory
/// whose listing fails is treated as empty.
public class ManifestCrawler {
    private static final Logger logger = LogManager.getLogger(ManifestCrawler.class);

    private final DirectoryLister lister;
    private final CrawlFilter filter;
    private final String baseUrl;
    private final Path outputDir;

    public ManifestCrawler(DirectoryLister lister, CrawlFilter filter, String baseUrl, Path outputDir) {
        this.lister = lister;
        this.filter = filter;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        this.outputDir = outputDir;
    }

    /// @return Every matching file below the base URL, deduplicated, in crawl order
    public Manifest crawl() {
        List<WorkItem> found = new ArrayList<>();
        crawlDirectory(baseUrl, new HashSet<>(), found);
        Manifest manifest = Manifest.of(found);
        if (manifest.duplicatesRemoved() > 0) {
            logger.info("Removed {} duplicate entries", manifest.duplicatesRemoved());
        }
        logger.info("Crawl of {} found {} files", baseUrl, manifest.size());
        return manifest;
    }

    private void crawlDirectory(String directoryUrl, Set<String> visited, List<WorkItem> found) {
        if (!directoryUrl.startsWith(baseUrl) || !visited.add(directoryUrl)) {
            return;
        }
        logger.info("Scanning directory: {}", directoryUrl);
        DirectoryListing listing;
        try {
            listing = lister.list(directoryUrl);
        } catch (IOException e) {
            logger.warn("Failed to list {}: {}", directoryUrl, e.getMessage());
            listing = DirectoryListing.EMPTY;
        }

        for (String fileUrl : listing.files()) {
            if (!fileUrl.startsWith(baseUrl)) {
                continue;
            }
            List<String> segments = relativeSegments(fileUrl);
            if (segments.isEmpty()) {
                continue;
            }
            String fileName = segments.get(segments.size() - 1);
            if (!filter.acceptsFile(fileName)) {
                continue;
            }
            Path destination = outputDir;
            for (String segment : segments) {
                destination = destination.resolve(segment);
            }
            found.add(new WorkItem(fileUrl, destination));
        }

        for (String subdirectoryUrl : listing.directories()) {
            List<String> segments = relativeSegments(subdirectoryUrl);
            if (segments.isEmpty()) {
                continue;
            }
            String name = segments.get(segments.size() - 1);
            if (!filter.acceptsDirectory(name)) {
                logger.info("Skipping excluded directory: {}", name);
                continue;
            }
            crawlDirectory(subdirectoryUrl, visited, found);
        }
    }

    /// @return The decoded path segments of a URL below the base URL, or empty when it is not below it
    List<String> relativeSegments(String url) {
        HttpUrl base = HttpUrl.parse(baseUrl);
        HttpUrl target = HttpUrl.parse(url);
        if (base == null || target == null) {
            return List.of();
        }
        List<String> baseSegments = trimTrailingEmpty(base.pathSegments());
        List<String> targetSegments = trimTrailingEmpty(target.pathSegments());
        if (targetSegments.size() <= baseSegments.size()
            || !targetSegments.subList(0, baseSegments.size()).equals(baseSegments))
        {
            return List.of();
        }
        List<String> relative = targetSegments.subList(baseSegments.size(), targetSegments.size());
        for (String segment : relative) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..") || segment.contains("/")) {
                return List.of();
            }
        }
        return List.copyOf(relative);
    }

    private static List<String> trimTrailingEmpty(List<String> segments) {
        if (!segments.isEmpty() && segments.get(segments.size() - 1).isEmpty()) {
            return segments.subList(0, segments.size() - 1);
        }
        return segments;
    }
}
