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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * Contents of a collection's {@code map.index} file.
 * <pre>
 * line 1: allocation counter (unsigned decimal)
 * line 2: sync destination, relative to the database root
 * </pre>
 *
 * @param counter         the highest identifier issued so far
 * @param syncDestination where compaction stages rewritten shard files, relative to the root
 */
public record MapIndex(long counter, String syncDestination) {

    public static final String FILE_NAME = "map.index";

    /**
     * Reads and validates {@code map.index}.
     *
     * @throws StorageException with {@code CORRUPTED_COLLECTION} if the file is
     *                          missing, short, or the counter is not a number
     */
    public static MapIndex read(Path path) throws IOException {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw StorageException.corrupted("Map index file " + path + " is missing", e);
        }
        if (lines.size() < 2) {
            throw StorageException.corrupted("Map index file " + path + " has " + lines.size()
                    + " lines, expected 2");
        }

        long counter;
        try {
            counter = Long.parseUnsignedLong(lines.get(0).trim());
        } catch (NumberFormatException e) {
            throw StorageException.corrupted("Map index file " + path + " has a non-numeric counter: '"
                    + lines.get(0) + "'", e);
        }
        return new MapIndex(counter, lines.get(1).trim());
    }

    public void write(Path path, boolean syncEnabled) throws IOException {
        String content = Long.toUnsignedString(counter) + "\n" + syncDestination + "\n";
        AtomicFiles.write(path, content.getBytes(StandardCharsets.UTF_8), syncEnabled);
    }
}
