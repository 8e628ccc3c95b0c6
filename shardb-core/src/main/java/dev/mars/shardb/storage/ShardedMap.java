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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A key space partitioned across a fixed number of independently locked,
 * independently persisted {@link Shard}s.
 * <p>
 * <b>Routing:</b> a key always maps to the same shard ordinal (FNV-1a over its
 * UTF-8 bytes, modulo the shard count), so every operation on a key goes
 * through exactly one shard lock and no operation needs a map-wide lock.
 * <p>
 * <b>Files</b> (in the collection directory):
 * <pre>
 * shard_&lt;i&gt;.gobs           // data file of shard i
 * shard_&lt;i&gt;_meta.gob.gzip  // metadata package of shard i
 * map.index                // counter + sync destination
 * </pre>
 */
public final class ShardedMap implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(ShardedMap.class);

    private static final int FNV_OFFSET_BASIS = 0x811C9DC5;
    private static final int FNV_PRIME = 0x01000193;

    private final Path rootDir;
    private final Path basePath;
    private final boolean syncEnabled;
    private final Shard[] shards;
    private final AtomicLong counter = new AtomicLong();
    private volatile Path syncDestination;

    private ShardedMap(Path rootDir, Path basePath, int shardCount, boolean syncEnabled) {
        this.rootDir = rootDir;
        this.basePath = basePath;
        this.syncEnabled = syncEnabled;
        this.shards = new Shard[shardCount];
        this.syncDestination = basePath;
    }

    /**
     * Builds a map of empty shards over freshly created data files, one per
     * shard ordinal.
     *
     * @param rootDir  the database root, against which the sync destination is recorded
     * @param basePath the collection directory
     * @param files    open data files; {@code files.get(i)} becomes shard {@code i}
     */
    public static ShardedMap create(Path rootDir, Path basePath, List<ShardFile> files, boolean syncEnabled) {
        ShardedMap map = new ShardedMap(rootDir, basePath, files.size(), syncEnabled);
        for (int i = 0; i < files.size(); i++) {
            map.shards[i] = Shard.create(i, files.get(i), syncEnabled);
        }
        return map;
    }

    /**
     * Builds a map with every slot empty, to be filled with {@link #attach}
     * while a collection is being loaded.
     */
    public static ShardedMap reattach(Path rootDir, Path basePath, int shardCount, boolean syncEnabled) {
        return new ShardedMap(rootDir, basePath, shardCount, syncEnabled);
    }

    public static String dataFileName(int shardId) {
        return "shard_" + shardId + ".gobs";
    }

    public static String metaFileName(int shardId) {
        return "shard_" + shardId + "_meta.gob.gzip";
    }

    // ========================================================================
    // Structure
    // ========================================================================

    /**
     * Places a reattached shard into the slot named by its id.
     *
     * @throws StorageException if the id is out of range or the slot is taken
     */
    public synchronized void attach(Shard shard) {
        int id = shard.id();
        if (id < 0 || id >= shards.length) {
            throw StorageException.corrupted("Shard id " + id + " outside [0, " + shards.length + ") in " + basePath);
        }
        if (shards[id] != null) {
            throw StorageException.corrupted("Duplicate shard id " + id + " in " + basePath);
        }
        shards[id] = shard;
    }

    /**
     * @throws StorageException if any shard slot is still empty
     */
    public synchronized void verifyComplete() {
        for (int i = 0; i < shards.length; i++) {
            if (shards[i] == null) {
                throw StorageException.corrupted("Shard " + i + " missing in " + basePath);
            }
        }
    }

    public int shardCount() {
        return shards.length;
    }

    public Path basePath() {
        return basePath;
    }

    public Shard shard(int ordinal) {
        return shards[ordinal];
    }

    /**
     * Shard ordinal owning {@code key}. Stable for the lifetime of the key.
     */
    public int shardFor(String key) {
        int hash = FNV_OFFSET_BASIS;
        for (byte b : key.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xFF);
            hash *= FNV_PRIME;
        }
        return Math.floorMod(hash, shards.length);
    }

    // ========================================================================
    // Counter & Sync Destination
    // ========================================================================

    /**
     * Allocates the next identifier.
     */
    public long nextId() {
        return counter.incrementAndGet();
    }

    public long counterIndex() {
        return counter.get();
    }

    /**
     * Moves the counter to {@code n}. The counter never goes backwards: a
     * smaller value leaves it unchanged.
     */
    public void setCounterIndex(long n) {
        counter.accumulateAndGet(n, Math::max);
    }

    public Path syncDestination() {
        return syncDestination;
    }

    public void setSyncDestination(Path syncDestination) {
        this.syncDestination = syncDestination;
    }

    // ========================================================================
    // Element Operations
    // ========================================================================

    public void put(String key, byte[] payload) throws IOException {
        shards[shardFor(key)].write(key, payload);
    }

    public Optional<byte[]> get(String key) throws IOException {
        return shards[shardFor(key)].read(key);
    }

    public boolean remove(String key) {
        return shards[shardFor(key)].remove(key);
    }

    public boolean contains(String key) {
        return shards[shardFor(key)].contains(key);
    }

    /**
     * Live element count across all shards.
     */
    public long size() {
        long total = 0;
        for (Shard shard : shards) {
            total += shard.size();
        }
        return total;
    }

    public List<String> keys() {
        List<String> keys = new ArrayList<>();
        for (Shard shard : shards) {
            keys.addAll(shard.keys());
        }
        return keys;
    }

    public long staleBytes() {
        long total = 0;
        for (Shard shard : shards) {
            total += shard.staleBytes();
        }
        return total;
    }

    // ========================================================================
    // Persistence
    // ========================================================================

    /**
     * Syncs every shard (data, then metadata), then writes {@code map.index}.
     */
    public void sync() throws IOException {
        for (Shard shard : shards) {
            shard.sync(basePath.resolve(metaFileName(shard.id())));
        }
        mapIndex().write(basePath.resolve(MapIndex.FILE_NAME), syncEnabled);
        LOG.debug("Map synced: {} ({} shards, counter={})", basePath, shards.length, counter.get());
    }

    /**
     * The {@code map.index} contents for the current state.
     */
    public MapIndex mapIndex() {
        String relative = rootDir.relativize(syncDestination).toString().replace('\\', '/');
        return new MapIndex(counter.get(), relative);
    }

    /**
     * Compacts every shard, staging rewritten files in the sync destination.
     * Each compacted shard's metadata package is rewritten before its data
     * file is replaced; {@link #sync()} afterwards clears the pending marks.
     *
     * @return total bytes reclaimed
     */
    public long optimize() throws IOException {
        long reclaimed = 0;
        for (Shard shard : shards) {
            reclaimed += shard.compact(syncDestination, basePath.resolve(metaFileName(shard.id())));
        }
        return reclaimed;
    }

    @Override
    public void close() {
        for (Shard shard : shards) {
            if (shard != null) {
                shard.close();
            }
        }
    }
}
