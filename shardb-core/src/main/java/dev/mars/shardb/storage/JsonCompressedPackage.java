/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.shardb.storage;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * A single-file package holding one GZIP-compressed JSON document.
 * <p>
 * Used for the human-readable collection descriptor
 * ({@code <collection>.json.gzip}).
 *
 * @param <T> the document type, mapped with Gson
 */
public final class JsonCompressedPackage<T> {

    private final Path path;
    private final Class<T> type;
    private final Gson gson;
    private final boolean syncEnabled;

    public JsonCompressedPackage(Path path, Class<T> type, Gson gson, boolean syncEnabled) {
        this.path = path;
        this.type = type;
        this.gson = gson;
        this.syncEnabled = syncEnabled;
    }

    public Path path() {
        return path;
    }

    public void save(T value) throws IOException {
        byte[] json = gson.toJson(value).getBytes(StandardCharsets.UTF_8);
        ByteArrayOutputStream compressed = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(compressed)) {
            gzip.write(json);
        }
        AtomicFiles.write(path, compressed.toByteArray(), syncEnabled);
    }

    /**
     * Inflates and parses the document.
     *
     * @throws StorageException if the document is not valid JSON for {@code T}
     */
    public T load() throws IOException {
        byte[] json;
        try (InputStream in = new GZIPInputStream(Files.newInputStream(path))) {
            json = in.readAllBytes();
        }
        try {
            T value = gson.fromJson(new String(json, StandardCharsets.UTF_8), type);
            if (value == null) {
                throw StorageException.corrupted("Empty JSON package " + path);
            }
            return value;
        } catch (JsonParseException e) {
            throw StorageException.corrupted("Malformed JSON package " + path, e);
        }
    }
}
