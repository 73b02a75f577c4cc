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

import java.io.IOException;

/// Lists the entries of one remote directory.
public interface DirectoryLister {

    /// @param directoryUrl The absolute URL of the directory, ending with `/`
    /// @return The files and subdirectories linked from the listing
    /// @throws IOException If the listing could not be fetched
    DirectoryListing list(String directoryUrl) throws IOException;
}
