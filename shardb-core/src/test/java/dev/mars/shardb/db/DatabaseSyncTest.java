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

import dev.mars.shardb.storage.ShardbConfig;
import dev.mars.shardb.storage.StorageException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Database#sync()}: idempotence, parallel fan-out across
 * collections, and failure isolation.
 */
class DatabaseSyncTest {

    private static final int COLLECTIONS = 8;

    @TempDir
    Path tempDir;

    private Database db;

    @BeforeEach
    void setUp() {
        db = new Database("shop", config());
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private ShardbConfig config() {
        return ShardbConfig.builder()
                .rootDir(tempDir)
                .shardCount(4)
                .syncEnabled(false)
                .build();
    }

    private static String value(int collection, int element) {
        return "c" + collection + "-e" + element;
    }

    private void populate() {
        for (int c = 0; c < COLLECTIONS; c++) {
            Collection collection = db.addCollection("col" + c);
            for (int e = 0; e <= c; e++) {
                collection.insert(value(c, e).getBytes(StandardCharsets.UTF_8));
            }
        }
    }

    private Map<String, byte[]> snapshotFiles() throws Exception {
        Map<String, byte[]> files = new HashMap<>();
        try (Stream<Path> paths = Files.walk(tempDir)) {
            for (Path p : paths.filter(Files::isRegularFile).collect(Collectors.toList())) {
                files.put(tempDir.relativize(p).toString(), Files.readAllBytes(p));
            }
        }
        return files;
    }

    @Test
    void testSyncIsIdempotent() throws Exception {
        populate();
        db.sync();
        Map<String, byte[]> first = snapshotFiles();

        db.sync();
        Map<String, byte[]> second = snapshotFiles();

        assertEquals(first.keySet(), second.keySet());
        for (Map.Entry<String, byte[]> e : first.entrySet()) {
            assertArrayEquals(e.getValue(), second.get(e.getKey()), e.getKey());
        }
    }

    @Test
    void testParallelSyncKeepsCollectionsApart() {
        populate();

        SyncReport report = db.sync();

        assertTrue(report.isClean());
        assertEquals(COLLECTIONS, report.synced().size());

        db.close();
        db = new Database("shop", config());
        db.load();

        assertEquals(COLLECTIONS, db.getCollectionsCount());
        for (int c = 0; c < COLLECTIONS; c++) {
            Collection collection = db.getCollection("col" + c).orElseThrow();
            assertEquals(c + 1, collection.size(), "col" + c);
            assertEquals(c + 1, collection.descriptor().objects());
            for (int e = 0; e <= c; e++) {
                String stored = new String(collection.get(Long.toString(e + 1)).orElseThrow(), StandardCharsets.UTF_8);
                assertEquals(value(c, e), stored);
            }
        }
    }

    @Test
    void testFailingCollectionDoesNotStopSiblings() throws Exception {
        populate();
        Path doomed = db.getCollection("col3").orElseThrow().directory();
        try (Stream<Path> paths = Files.walk(doomed)) {
            for (Path p : paths.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.delete(p);
            }
        }

        SyncReport report = db.sync();

        assertFalse(report.isClean());
        assertEquals(1, report.failures().size());
        assertInstanceOf(StorageException.class, report.failures().get("col3"));
        assertEquals(COLLECTIONS - 1, report.synced().size());
        assertFalse(report.synced().contains("col3"));
        assertTrue(Files.exists(tempDir.resolve("shop.shardb")));
    }

    @Test
    void testSyncConcurrentWithWriters() throws Exception {
        Collection hot = db.addCollection("hot");
        ExecutorService writers = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                futures.add(writers.submit(() -> {
                    start.await();
                    for (int i = 0; i < 250; i++) {
                        hot.insert(new byte[]{(byte) i});
                    }
                    return null;
                }));
            }
            start.countDown();
            for (int i = 0; i < 5; i++) {
                assertTrue(db.sync().isClean());
            }
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            writers.shutdownNow();
        }
        assertTrue(db.sync().isClean());

        db.close();
        db = new Database("shop", config());
        db.load();

        Collection loaded = db.getCollection("hot").orElseThrow();
        assertEquals(1000, loaded.size());
        assertEquals(1001, loaded.insert(new byte[]{1}));
    }

    @Test
    void testSyncOfEmptyDatabaseWritesHeader() {
        SyncReport report = db.sync();

        assertTrue(report.isClean());
        assertTrue(report.synced().isEmpty());
        assertTrue(Files.exists(tempDir.resolve("shop.shardb")));
    }
}
