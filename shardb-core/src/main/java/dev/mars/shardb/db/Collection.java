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

import com.google.gson.Gson;
import dev.mars.shardb.storage.JsonCompressedPackage;
import dev.mars.shardb.storage.ShardedMap;
import dev.mars.shardb.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * A named dataset stored across the shards of one {@link ShardedMap}.
 * <p>
 * Element operations are routed to the owning shard and go through that
 * shard's lock only. {@link #sync()} and {@link #optimize()} are serialized
 * per collection so two passes never write the same package concurrently.
 * <p>
 * <b>Files</b> (in the collection directory):
 * <pre>
 * &lt;name&gt;.json.gzip   // descriptor
 * map.index            // counter + sync destination
 * shard_&lt;i&gt;.gobs, shard_&lt;i&gt;_meta.gob.gzip
 * </pre>
 */
public final class Collection implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(Collection.class);

    static final String DESCRIPTOR_SUFFIX = ".json.gzip";

    private final String name;
    private final Path directory;
    private final ShardedMap map;
    private final CollectionCache cache;
    private final TypeRegistry types;
    private final Gson gson;
    private final boolean syncEnabled;
    private volatile CollectionDescriptor descriptor;

    Collection(CollectionDescriptor descriptor, Path directory, ShardedMap map, CollectionCache cache,
               TypeRegistry types, Gson gson, boolean syncEnabled) {
        this.name = descriptor.name();
        this.descriptor = descriptor;
        this.directory = directory;
        this.map = map;
        this.cache = cache;
        this.types = types;
        this.gson = gson;
        this.syncEnabled = syncEnabled;
    }

    static Path descriptorPath(Path directory, String name) {
        return directory.resolve(name + DESCRIPTOR_SUFFIX);
    }

    public String name() {
        return name;
    }

    /** Collection directory, relative to the database root. */
    public String storagePath() {
        return descriptor.path();
    }

    public Path directory() {
        return directory;
    }

    public CollectionDescriptor descriptor() {
        return descriptor;
    }

    ShardedMap map() {
        return map;
    }

    CollectionCache cache() {
        return cache;
    }

    // ========================================================================
    // Element Operations
    // ========================================================================

    /**
     * Stores {@code payload} under a newly allocated identifier.
     *
     * @return the identifier; its decimal form is the element key
     */
    public long insert(byte[] payload) {
        long id = map.nextId();
        put(Long.toString(id), payload);
        return id;
    }

    public void put(String key, byte[] payload) {
        try {
            map.put(key, payload);
            cache.invalidate(key);
        } catch (IOException e) {
            LOG.error("Failed to write key '{}' to collection {}: {}", key, name, e.getMessage(), e);
            throw StorageException.io("Failed to write key '" + key + "' to collection " + name, e);
        }
    }

    public Optional<byte[]> get(String key) {
        Optional<byte[]> cached = cache.get(key);
        if (cached.isPresent()) {
            return cached;
        }
        long token = cache.fillToken();
        try {
            Optional<byte[]> value = map.get(key);
            value.ifPresent(v -> cache.fill(key, v, token));
            return value;
        } catch (IOException e) {
            LOG.error("Failed to read key '{}' from collection {}: {}", key, name, e.getMessage(), e);
            throw StorageException.io("Failed to read key '" + key + "' from collection " + name, e);
        }
    }

    /**
     * @return true if the key was present
     */
    public boolean delete(String key) {
        boolean removed = map.remove(key);
        cache.invalidate(key);
        return removed;
    }

    public boolean contains(String key) {
        return map.contains(key);
    }

    public List<String> keys() {
        return map.keys();
    }

    /**
     * Stores a registered custom structure under a newly allocated identifier.
     */
    public long insertObject(CustomStructure value) {
        return insert(Element.of(value, types, gson).toBytes());
    }

    public void putObject(String key, CustomStructure value) {
        put(key, Element.of(value, types, gson).toBytes());
    }

    public Optional<CustomStructure> getObject(String key) {
        return get(key).map(bytes -> Element.fromBytes(bytes).toStructure(types, gson));
    }

    /**
     * Live element count across all shards.
     */
    public long size() {
        return map.size();
    }

    // ========================================================================
    // Persistence
    // ========================================================================

    /**
     * Persists shard data and metadata, the map index and the descriptor.
     *
     * @throws StorageException if any file cannot be written
     */
    public synchronized void sync() {
        try {
            map.sync();
            CollectionDescriptor updated = descriptor.withObjects(map.size());
            new JsonCompressedPackage<>(descriptorPath(directory, name), CollectionDescriptor.class, gson, syncEnabled)
                    .save(updated);
            descriptor = updated;
            LOG.debug("Collection {} synced: {} objects", name, updated.objects());
        } catch (IOException e) {
            LOG.error("Failed to sync collection {}: {}", name, e.getMessage(), e);
            throw StorageException.io("Failed to sync collection " + name, e);
        }
    }

    /**
     * Compacts every shard, then syncs so the metadata on disk addresses the
     * rewritten data files.
     *
     * @return bytes reclaimed
     */
    public synchronized long optimize() {
        long reclaimed;
        try {
            reclaimed = map.optimize();
        } catch (IOException e) {
            LOG.error("Failed to optimize collection {}: {}", name, e.getMessage(), e);
            throw StorageException.io("Failed to optimize collection " + name, e);
        }
        sync();
        LOG.info("Collection {} optimized: {} bytes reclaimed", name, reclaimed);
        return reclaimed;
    }

    /**
     * Releases the shard files and empties the cache. Does not sync.
     */
    @Override
    public void close() {
        map.close();
        cache.clear();
    }
}
