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
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * One partition of a collection: an append-only data file plus the index of
 * where each live value sits inside it.
 * <p>
 * <b>Thread Safety:</b>
 * Each shard has its own read/write lock guarding both the offset index and
 * the file handle. Reads share the lock; writes, sync and compaction take it
 * exclusively. Different shards never contend.
 * <p>
 * <b>INVARIANT:</b> every offset in the index addresses a byte range that lies
 * inside the currently attached data file.
 */
public final class Shard implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(Shard.class);

    private final int id;
    private final boolean syncEnabled;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, ShardOffset> offsets;
    private long staleBytes;
    private ShardFile file;

    private Shard(int id, ShardFile file, Map<String, ShardOffset> offsets, long staleBytes, boolean syncEnabled) {
        this.id = id;
        this.file = file;
        this.offsets = new HashMap<>(offsets);
        this.staleBytes = staleBytes;
        this.syncEnabled = syncEnabled;
    }

    /**
     * Creates an empty shard over a freshly created data file.
     */
    public static Shard create(int id, ShardFile file, boolean syncEnabled) {
        ShardMetadata meta = ShardMetadata.empty(id);
        return new Shard(id, file, meta.offsets(), meta.staleBytes(), syncEnabled);
    }

    /**
     * Attaches decoded metadata to an open data file.
     * <p>
     * Metadata marked {@code compactionPending} was written for a compacted
     * file. If that file is still in {@code stagingDir} it is moved over the
     * data file first; otherwise the move already happened.
     * Non-pending metadata leaves any staged leftover unused and deletes it.
     *
     * @throws StorageException if the data file is shorter than the metadata
     *                          records or an offset points past its end
     */
    public static Shard attach(ShardMetadata meta, ShardFile file, Path stagingDir, boolean syncEnabled)
            throws IOException {
        Path staged = stagingDir.resolve(stagedFileName(meta.id()));
        try {
            if (meta.compactionPending() && Files.exists(staged)) {
                long stagedSize = Files.size(staged);
                if (stagedSize != meta.dataSize()) {
                    throw StorageException.corrupted("Staged compaction " + staged + " is " + stagedSize
                            + " bytes, shard " + meta.id() + " metadata expects " + meta.dataSize());
                }
                LOG.info("Shard {} completing interrupted compaction from {}", meta.id(), staged);
                Path dataPath = file.path();
                file.close();
                AtomicFiles.replace(staged, dataPath);
                file = ShardFile.open(dataPath);
                if (syncEnabled) {
                    AtomicFiles.syncDirectory(dataPath.toAbsolutePath().getParent());
                }
            } else if (!meta.compactionPending() && Files.deleteIfExists(staged)) {
                LOG.info("Shard {} discarded unfinished compaction {}", meta.id(), staged);
            }

            long fileSize = file.size();
            if (fileSize < meta.dataSize()) {
                LOG.error("Shard {} metadata expects {} bytes but {} is {} bytes",
                        meta.id(), meta.dataSize(), file.path(), fileSize);
                throw StorageException.corrupted("Shard " + meta.id() + " data file " + file.path()
                        + " is shorter than its metadata (" + fileSize + " < " + meta.dataSize() + ")");
            }
            for (Map.Entry<String, ShardOffset> e : meta.offsets().entrySet()) {
                if (e.getValue().end() > fileSize) {
                    LOG.error("Shard {} offset for key '{}' ends at {} but {} is {} bytes",
                            meta.id(), e.getKey(), e.getValue().end(), file.path(), fileSize);
                    throw StorageException.corrupted("Shard " + meta.id() + " references bytes beyond "
                            + file.path() + " (" + e.getValue().end() + " > " + fileSize + ")");
                }
            }
            LOG.debug("Shard {} attached: {} keys, {} stale bytes, file={} bytes",
                    meta.id(), meta.offsets().size(), meta.staleBytes(), fileSize);
            return new Shard(meta.id(), file, meta.offsets(), meta.staleBytes(), syncEnabled);
        } catch (IOException | RuntimeException e) {
            // the handle may have been reopened above
            file.close();
            throw e;
        }
    }

    /**
     * Name of the compacted data file while it waits in the staging directory.
     */
    public static String stagedFileName(int shardId) {
        return "shard_" + shardId + ".gobs.compact";
    }

    public int id() {
        return id;
    }

    // ========================================================================
    // Element Operations
    // ========================================================================

    /**
     * Appends {@code payload} to the data file and points {@code key} at it.
     * A previous value for the key becomes stale.
     */
    public void write(String key, byte[] payload) throws IOException {
        lock.writeLock().lock();
        try {
            FileChannel ch = file.channel();
            long position = ch.size();
            ByteBuffer buf = ByteBuffer.wrap(payload);
            long at = position;
            while (buf.hasRemaining()) {
                at += ch.write(buf, at);
            }
            ShardOffset previous = offsets.put(key, new ShardOffset(position, payload.length));
            if (previous != null) {
                staleBytes += previous.length();
            }
            LOG.trace("Shard {} write: key={}, position={}, length={}", id, key, position, payload.length);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<byte[]> read(String key) throws IOException {
        lock.readLock().lock();
        try {
            ShardOffset offset = offsets.get(key);
            if (offset == null) {
                return Optional.empty();
            }
            ByteBuffer buf = ByteBuffer.allocate(offset.length());
            long at = offset.position();
            while (buf.hasRemaining()) {
                int n = file.channel().read(buf, at);
                if (n < 0) {
                    throw StorageException.corrupted("Shard " + id + " data file ends inside value for key '"
                            + key + "' at " + at);
                }
                at += n;
            }
            return Optional.of(buf.array());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes {@code key}; its bytes become stale until the next compaction.
     *
     * @return true if the key was present
     */
    public boolean remove(String key) {
        lock.writeLock().lock();
        try {
            ShardOffset previous = offsets.remove(key);
            if (previous == null) {
                return false;
            }
            staleBytes += previous.length();
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean contains(String key) {
        lock.readLock().lock();
        try {
            return offsets.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return offsets.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> keys() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(offsets.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public long staleBytes() {
        lock.readLock().lock();
        try {
            return staleBytes;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshot of the serializable half of this shard.
     */
    public ShardMetadata metadata() throws IOException {
        lock.readLock().lock();
        try {
            return new ShardMetadata(id, staleBytes, file.size(), false, new TreeMap<>(offsets));
        } finally {
            lock.readLock().unlock();
        }
    }

    // ========================================================================
    // Persistence
    // ========================================================================

    /**
     * Forces the data file to disk, then writes the metadata package. Data is
     * durable before the metadata that references it.
     */
    public void sync(Path metaPath) throws IOException {
        lock.writeLock().lock();
        try {
            if (syncEnabled) {
                file.channel().force(true);
            }
            new EncodedCompressedPackage<>(metaPath, ShardMetadata.CODEC, syncEnabled)
                    .save(new ShardMetadata(id, staleBytes, file.size(), false, new TreeMap<>(offsets)));
            LOG.debug("Shard {} synced: {} keys, {} stale bytes", id, offsets.size(), staleBytes);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Rewrites the data file with only the live values, in their current order.
     * <p>
     * <b>Protocol:</b>
     * <ol>
     *   <li>Copy live values into {@code stagingDir}/{@link #stagedFileName} and fsync it.</li>
     *   <li>Write metadata for the compacted file to {@code metaPath}, marked
     *       {@code compactionPending}.</li>
     *   <li>Move the staged file over the data file, reopen and relock it.</li>
     * </ol>
     * A failure before step 2 completes leaves the old metadata and data file
     * in place. A failure after it is finished by {@link #attach} on the next
     * load. The caller syncs afterwards to clear the pending mark.
     *
     * @return bytes reclaimed (old file size minus new file size)
     */
    public long compact(Path stagingDir, Path metaPath) throws IOException {
        lock.writeLock().lock();
        try {
            if (staleBytes == 0) {
                LOG.trace("Shard {} has no stale bytes, skipping compaction", id);
                return 0L;
            }

            long oldSize = file.size();
            Files.createDirectories(stagingDir);
            Path staged = stagingDir.resolve(stagedFileName(id));

            List<Map.Entry<String, ShardOffset>> live = new ArrayList<>(offsets.entrySet());
            live.sort(Comparator.comparingLong(e -> e.getValue().position()));
            TreeMap<String, ShardOffset> rewritten = new TreeMap<>();
            long newSize = 0;

            try {
                try (FileChannel out = FileChannel.open(staged,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.TRUNCATE_EXISTING,
                        StandardOpenOption.WRITE)) {
                    for (Map.Entry<String, ShardOffset> e : live) {
                        ShardOffset offset = e.getValue();
                        long copied = 0;
                        while (copied < offset.length()) {
                            long n = file.channel().transferTo(offset.position() + copied,
                                    offset.length() - copied, out);
                            if (n <= 0) {
                                throw StorageException.corrupted("Shard " + id
                                        + " data file ends inside value for key '" + e.getKey() + "'");
                            }
                            copied += n;
                        }
                        rewritten.put(e.getKey(), new ShardOffset(newSize, offset.length()));
                        newSize += offset.length();
                    }
                    if (syncEnabled) {
                        out.force(true);
                    }
                }
                new EncodedCompressedPackage<>(metaPath, ShardMetadata.CODEC, syncEnabled)
                        .save(new ShardMetadata(id, 0L, newSize, true, rewritten));
            } catch (IOException | RuntimeException e) {
                Files.deleteIfExists(staged);
                throw e;
            }

            // From here on the metadata on disk addresses the staged file
            Path dataPath = file.path();
            file.close();
            try {
                AtomicFiles.replace(staged, dataPath);
            } finally {
                // Reattach whichever file is now in place
                file = ShardFile.open(dataPath);
            }
            if (syncEnabled) {
                AtomicFiles.syncDirectory(dataPath.toAbsolutePath().getParent());
            }

            offsets.clear();
            offsets.putAll(rewritten);
            staleBytes = 0;

            LOG.info("Shard {} compacted: {} -> {} bytes, {} live keys", id, oldSize, newSize, offsets.size());
            return oldSize - newSize;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Detaches and closes the data file.
     */
    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            file.close();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
