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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/// Persists a manifest as a JSON array of `[sourceLocator, destinationPath]` pairs.
///
/// Size hints are not stored. Writes go to a sibling temporary file first and are moved into
/// place, so an interrupted save leaves the previous cache intact.
public class ManifestStore {
    private static final Logger logger = LogManager.getLogger(ManifestStore.class);
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private final Path cacheFile;

    public ManifestStore(Path cacheFile) {
        this.cacheFile = cacheFile;
    }

    public Path cacheFile() {
        return cacheFile;
    }

    public boolean exists() {
        return Files.isRegularFile(cacheFile);
    }

    /// Reads the cache.
    ///
    /// @return The deduplicated manifest
    /// @throws IOException If the file cannot be read or is not a list of pairs
    public Manifest load() throws IOException {
        JsonElement root;
        try (Reader reader = Files.newBufferedReader(cacheFile, StandardCharsets.UTF_8)) {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new IOException("Manifest cache " + cacheFile + " is not valid JSON", e);
        }
        if (!root.isJsonArray()) {
            throw new IOException("Manifest cache " + cacheFile + " must contain a JSON array");
        }
        List<WorkItem> items = new ArrayList<>();
        int index = 0;
        for (JsonElement entry : root.getAsJsonArray()) {
            if (!entry.isJsonArray() || entry.getAsJsonArray().size() != 2) {
                throw new IOException("Manifest cache entry " + index + " is not a [url, path] pair: " + entry);
            }
            JsonArray pair = entry.getAsJsonArray();
            items.add(new WorkItem(pair.get(0).getAsString(), Paths.get(pair.get(1).getAsString())));
            index++;
        }
        Manifest manifest = Manifest.of(items);
        logger.info("Loaded {} items from manifest cache {} ({} duplicates dropped)", manifest.size(), cacheFile,
            manifest.duplicatesRemoved());
        return manifest;
    }

    /// Writes the cache, replacing any previous one.
    ///
    /// @param manifest The manifest to persist
    /// @throws IOException If the file cannot be written
    public void save(Manifest manifest) throws IOException {
        JsonArray root = new JsonArray();
        for (WorkItem item : manifest) {
            JsonArray pair = new JsonArray();
            pair.add(item.sourceLocator());
            pair.add(item.destinationPath().toString());
            root.add(pair);
        }
        Path parent = cacheFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = cacheFile.resolveSibling(cacheFile.getFileName() + ".tmp");
        try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
            GSON.toJson(root, writer);
        }
        Files.move(temp, cacheFile, StandardCopyOption.REPLACE_EXISTING);
        logger.info("Saved {} items to manifest cache {}", manifest.size(), cacheFile);
    }
}
