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

import java.util.List;
import java.util.Set;

/// Decides which listed files become work items and which directories are descended into.
///
/// @param includeSuffixes File name endings to keep; empty keeps every file
/// @param excludedDirectories Directory names never descended into
public record CrawlFilter(List<String> includeSuffixes, Set<String> excludedDirectories) {

    public CrawlFilter {
        includeSuffixes = includeSuffixes == null ? List.of() : List.copyOf(includeSuffixes);
        excludedDirectories = excludedDirectories == null ? Set.of() : Set.copyOf(excludedDirectories);
    }

    /// @return A filter that keeps every file and descends into every directory
    public static CrawlFilter acceptAll() {
        return new CrawlFilter(List.of(), Set.of());
    }

    /// @param fileName A decoded file name
    /// @return true when the file should be downloaded
    public boolean acceptsFile(String fileName) {
        if (includeSuffixes.isEmpty()) {
            return true;
        }
        for (String suffix : includeSuffixes) {
            if (fileName.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }

    /// @param directoryName A decoded directory name without slashes
    /// @return true when the directory should be crawled
    public boolean acceptsDirectory(String directoryName) {
        return !excludedDirectories.contains(directoryName);
    }
}
