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
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * An open, exclusively locked shard data file ({@code shard_<i>.gobs}).
 * <p>
 * The lock is held for as long as the handle is open, so a second process
 * (or a second database instance in this JVM) cannot attach the same shard.
 */
public final class ShardFile implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(ShardFile.class);

    private final Path path;
    private final FileChannel channel;
    private final FileLock lock;

    private ShardFile(Path path, FileChannel channel, FileLock lock) {
        this.path = path;
        this.channel = channel;
        this.lock = lock;
    }

    /**
     * Creates a fresh, empty data file, truncating any existing one once the
     * lock is held.
     */
    public static ShardFile create(Path path) throws IOException {
        ShardFile file = open(path,
                StandardOpenOption.CREATE,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE);
        try {
            file.channel.truncate(0);
        } catch (IOException e) {
            file.close();
            throw e;
        }
        return file;
    }

    /**
     * Opens an existing data file read-write.
     *
     * @throws java.nio.file.NoSuchFileException if the file does not exist
     */
    public static ShardFile open(Path path) throws IOException {
        return open(path, StandardOpenOption.READ, StandardOpenOption.WRITE);
    }

    private static ShardFile open(Path path, OpenOption... options) throws IOException {
        FileChannel channel = FileChannel.open(path, options);
        try {
            FileLock lock = channel.tryLock();
            if (lock == null) {
                channel.close();
                LOG.error("Cannot lock shard file {}: another process holds the lock", path);
                throw new StorageException(StorageException.Kind.IO,
                        "Cannot acquire exclusive lock on " + path + ". Another process may be using it.");
            }
            LOG.trace("Shard file opened and locked: {}", path);
            return new ShardFile(path, channel, lock);
        } catch (OverlappingFileLockException e) {
            channel.close();
            LOG.error("Cannot lock shard file {}: lock already held in this JVM", path);
            throw new StorageException(StorageException.Kind.IO,
                    "Cannot acquire exclusive lock on " + path + ": lock already held in this JVM", e);
        }
    }

    public Path path() {
        return path;
    }

    public FileChannel channel() {
        return channel;
    }

    public long size() throws IOException {
        return channel.size();
    }

    public boolean isOpen() {
        return channel.isOpen();
    }

    /**
     * Releases the lock and closes the channel. Failures are logged, not thrown.
     */
    @Override
    public void close() {
        try {
            if (lock.isValid()) {
                lock.release();
            }
        } catch (IOException e) {
            LOG.warn("Could not release lock on {}: {}", path, e.getMessage());
        }
        try {
            if (channel.isOpen()) {
                channel.close();
            }
        } catch (IOException e) {
            LOG.warn("Could not close shard file {}: {}", path, e.getMessage());
        }
    }
}
