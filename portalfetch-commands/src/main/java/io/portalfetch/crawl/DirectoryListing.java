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

/// The links found on one directory listing page, as absolute URLs.
///
/// @param files Links to files
/// @param directories Links to subdirectories, each ending with `/`
public record DirectoryListing(List<String> files, List<String> directories) {

    public static final DirectoryListing EMPTY = new DirectoryListing(List.of(), List.of());

    public DirectoryListing {
        files = List.copyOf(files);
        directories = List.copyOf(directories);
    }
}
