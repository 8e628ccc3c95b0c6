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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Whole-file replacement helpers.
 * <p>
 * Every small file the store owns (shard metadata, map index, collection
 * descriptor, database header) is written with the same sequence:
 * write temp → fsync → rename → fsync dir. A reader therefore sees either
 * the previous file or the new one, never a torn write.
 */
public final class AtomicFiles {

    private static final Logger LOG = LoggerFactory.getLogger(AtomicFiles.class);

    private static final String TMP_SUFFIX = ".tmp";

    private AtomicFiles() {
    }

    /**
     * Atomically replaces {@code target} with {@code data}.
     *
     * @param target      the file to replace
     * @param data        the complete new contents
     * @param syncEnabled whether to fsync the temp file and the parent directory
     */
    public static void write(Path target, byte[] data, boolean syncEnabled) throws IOException {
        Path tmpPath = target.resolveSibling(target.getFileName() + TMP_SUFFIX);

        try (FileChannel ch = FileChannel.open(tmpPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            ByteBuffer buf = ByteBuffer.wrap(data);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            if (syncEnabled) {
                ch.force(true);
            }
        }

        replace(tmpPath, target);
        LOG.trace("Atomic write: {} ({} bytes)", target, data.length);

        if (syncEnabled) {
            syncDirectory(target.toAbsolutePath().getParent());
        }
    }

    /**
     * Moves {@code source} over {@code target}, atomically where the filesystem
     * allows it. A staging directory on another filesystem falls back to a plain
     * replacing move.
     */
    public static void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.warn("Atomic move not supported from {} to {}, falling back to replace", source, target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Fsyncs a directory to ensure metadata changes (renames, creates) are durable.
     * <p>
     * On Windows, this may fail or be a no-op. That's acceptable for development.
     * On Linux (ext4/xfs), this is critical for durability.
     */
    public static void syncDirectory(Path dir) {
        if (dir == null || System.getProperty("os.name").toLowerCase().contains("win")) {
            return;
        }

        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
            LOG.trace("Directory synced: {}", dir);
        } catch (IOException e) {
            // Some systems don't support directory fsync
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }
}
