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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ShardedMap} and {@link MapIndex}.
 * <p>
 * These tests verify:
 * <ul>
 *   <li>Routing is stable and spreads keys across shards</li>
 *   <li>The counter never goes backwards</li>
 *   <li>Sync writes every metadata package and the map index</li>
 *   <li>Structural checks used while reattaching shards</li>
 *   <li>Map index parsing failures</li>
 * </ul>
 */
class ShardedMapTest {

    private static final int SHARDS = 4;

    @TempDir
    Path tempDir;

    private Path collectionDir;
    private ShardedMap map;

    @BeforeEach
    void setUp() throws Exception {
        collectionDir = tempDir.resolve("collections").resolve("things");
        Files.createDirectories(collectionDir);
        List<ShardFile> files = new ArrayList<>();
        for (int i = 0; i < SHARDS; i++) {
            files.add(ShardFile.create(collectionDir.resolve(ShardedMap.dataFileName(i))));
        }
        map = ShardedMap.create(tempDir, collectionDir, files, false);
    }

    @AfterEach
    void tearDown() {
        if (map != null) {
            map.close();
        }
    }

    // ========================================================================
    // Routing
    // ========================================================================

    @Nested
    @DisplayName("Routing")
    class RoutingTests {

        @Test
        @DisplayName("A key always routes to the same shard")
        void testStableRouting() {
            int first = map.shardFor("user:42");
            for (int i = 0; i < 100; i++) {
                assertEquals(first, map.shardFor("user:42"));
            }
        }

        @Test
        @DisplayName("Keys spread over every shard and stay in range")
        void testSpread() {
            Set<Integer> used = new HashSet<>();
            for (int i = 0; i < 1000; i++) {
                int ordinal = map.shardFor(Integer.toString(i));
                assertTrue(ordinal >= 0 && ordinal < SHARDS);
                used.add(ordinal);
            }
            assertEquals(SHARDS, used.size());
        }

        @Test
        @DisplayName("Values land in the routed shard only")
        void testValuesLandInRoutedShard() throws Exception {
            for (int i = 0; i < 50; i++) {
                map.put("k" + i, ("v" + i).getBytes(StandardCharsets.UTF_8));
            }

            for (int i = 0; i < 50; i++) {
                String key = "k" + i;
                int owner = map.shardFor(key);
                for (int s = 0; s < SHARDS; s++) {
                    assertEquals(s == owner, map.shard(s).contains(key));
                }
                assertEquals("v" + i, new String(map.get(key).orElseThrow(), StandardCharsets.UTF_8));
            }
            assertEquals(50, map.size());
            assertEquals(50, map.keys().size());
        }
    }

    // ========================================================================
    // Counter
    // ========================================================================

    @Nested
    @DisplayName("Counter")
    class CounterTests {

        @Test
        @DisplayName("nextId allocates increasing identifiers")
        void testNextId() {
            assertEquals(1, map.nextId());
            assertEquals(2, map.nextId());
            assertEquals(2, map.counterIndex());
        }

        @Test
        @DisplayName("setCounterIndex resumes numbering")
        void testSetCounterIndex() {
            map.setCounterIndex(41);
            assertEquals(42, map.nextId());
        }

        @Test
        @DisplayName("setCounterIndex never moves the counter backwards")
        void testCounterMonotonic() {
            map.setCounterIndex(10);
            map.setCounterIndex(3);
            assertEquals(10, map.counterIndex());
        }
    }

    // ========================================================================
    // Sync
    // ========================================================================

    @Nested
    @DisplayName("Sync")
    class SyncTests {

        @Test
        @DisplayName("Sync writes one metadata package per shard and the map index")
        void testSyncWritesFiles() throws Exception {
            map.put("a", new byte[]{1, 2, 3});
            map.setCounterIndex(7);

            map.sync();

            for (int i = 0; i < SHARDS; i++) {
                assertTrue(Files.exists(collectionDir.resolve(ShardedMap.metaFileName(i))));
            }
            List<String> lines = Files.readAllLines(collectionDir.resolve(MapIndex.FILE_NAME));
            assertEquals(List.of("7", "collections/things"), lines);
        }

        @Test
        @DisplayName("Optimize reclaims stale bytes across shards")
        void testOptimize() throws Exception {
            for (int i = 0; i < 20; i++) {
                map.put("k" + i, new byte[10]);
            }
            for (int i = 0; i < 20; i += 2) {
                map.remove("k" + i);
            }

            assertEquals(100, map.staleBytes());
            assertEquals(100, map.optimize());
            assertEquals(0, map.staleBytes());
            assertEquals(10, map.size());
        }
    }

    // ========================================================================
    // Reattach
    // ========================================================================

    @Nested
    @DisplayName("Reattach")
    class ReattachTests {

        @Test
        @DisplayName("Shard ids outside the shard count are rejected")
        void testAttachOutOfRange() throws Exception {
            ShardedMap empty = ShardedMap.reattach(tempDir, collectionDir, 2, false);
            Path extra = tempDir.resolve("extra.gobs");
            try (ShardFile file = ShardFile.create(extra)) {
                Shard shard = Shard.create(5, file, false);
                StorageException e = assertThrows(StorageException.class, () -> empty.attach(shard));
                assertEquals(StorageException.Kind.CORRUPTED_COLLECTION, e.kind());
            }
        }

        @Test
        @DisplayName("Duplicate shard ids are rejected")
        void testAttachDuplicate() throws Exception {
            ShardedMap empty = ShardedMap.reattach(tempDir, collectionDir, 2, false);
            try (ShardFile f1 = ShardFile.create(tempDir.resolve("one.gobs"));
                 ShardFile f2 = ShardFile.create(tempDir.resolve("two.gobs"))) {
                empty.attach(Shard.create(1, f1, false));
                StorageException e = assertThrows(StorageException.class,
                        () -> empty.attach(Shard.create(1, f2, false)));
                assertEquals(StorageException.Kind.CORRUPTED_COLLECTION, e.kind());
            }
        }

        @Test
        @DisplayName("An incomplete map fails verification")
        void testVerifyIncomplete() {
            ShardedMap empty = ShardedMap.reattach(tempDir, collectionDir, 2, false);
            StorageException e = assertThrows(StorageException.class, empty::verifyComplete);
            assertEquals(StorageException.Kind.CORRUPTED_COLLECTION, e.kind());
        }
    }

    // ========================================================================
    // Map Index
    // ========================================================================

    @Nested
    @DisplayName("Map index")
    class MapIndexTests {

        @Test
        @DisplayName("Missing map index is corruption")
        void testMissing() {
            StorageException e = assertThrows(StorageException.class,
                    () -> MapIndex.read(tempDir.resolve("map.index")));
            assertEquals(StorageException.Kind.CORRUPTED_COLLECTION, e.kind());
        }

        @Test
        @DisplayName("Non-numeric counter is corruption")
        void testNonNumericCounter() throws Exception {
            Path path = tempDir.resolve("map.index");
            Files.writeString(path, "twelve\ncollections/things\n");

            StorageException e = assertThrows(StorageException.class, () -> MapIndex.read(path));
            assertEquals(StorageException.Kind.CORRUPTED_COLLECTION, e.kind());
        }

        @Test
        @DisplayName("Single-line map index is corruption")
        void testShort() throws Exception {
            Path path = tempDir.resolve("map.index");
            Files.writeString(path, "12\n");

            assertThrows(StorageException.class, () -> MapIndex.read(path));
        }

        @Test
        @DisplayName("Counter above Long.MAX_VALUE is read as unsigned")
        void testUnsignedCounter() throws Exception {
            Path path = tempDir.resolve("map.index");
            new MapIndex(-2L, "collections/things").write(path, false);

            assertEquals("18446744073709551614", Files.readAllLines(path).get(0));
            assertEquals(-2L, MapIndex.read(path).counter());
        }
    }
}
