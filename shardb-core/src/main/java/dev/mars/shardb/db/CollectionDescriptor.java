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
package dev.mars.shardb.db;

import java.util.Map;
import java.util.TreeMap;

/**
 * The human-readable description of a collection, stored as
 * {@code <name>.json.gzip} in its directory.
 * <p>
 * Holds identity and counters only; the live map and cache are attached by
 * {@link Collection} after the descriptor is decoded.
 */
public final class CollectionDescriptor {

    static final String OBJECTS = "objects";
    static final String SHARDS = "shards";

    private String name;
    private String path;
    private TreeMap<String, Long> metadata;

    // Gson
    private CollectionDescriptor() {
    }

    public CollectionDescriptor(String name, String path, Map<String, Long> metadata) {
        this.name = name;
        this.path = path;
        this.metadata = new TreeMap<>(metadata);
    }

    static CollectionDescriptor create(String name, String path, int shardCount) {
        return new CollectionDescriptor(name, path, Map.of(OBJECTS, 0L, SHARDS, (long) shardCount));
    }

    public String name() {
        return name;
    }

    /** Collection directory, relative to the database root. */
    public String path() {
        return path;
    }

    public Map<String, Long> metadata() {
        return metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /** Object count recorded at the last sync. */
    public long objects() {
        return metadata().getOrDefault(OBJECTS, 0L);
    }

    /**
     * Copy with the object count replaced.
     */
    CollectionDescriptor withObjects(long objects) {
        TreeMap<String, Long> updated = new TreeMap<>(metadata());
        updated.put(OBJECTS, objects);
        return new CollectionDescriptor(name, path, updated);
    }
}
