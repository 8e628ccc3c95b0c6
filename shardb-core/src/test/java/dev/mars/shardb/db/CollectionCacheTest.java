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

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link CollectionCache}: the LRU bound, copy semantics and the
 * fill token that keeps a read racing a write from caching stale bytes.
 */
class CollectionCacheTest {

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testFillWithCurrentToken() {
        CollectionCache cache = CollectionCache.empty(4);

        assertTrue(cache.fill("k", bytes("v"), cache.fillToken()));

        assertArrayEquals(bytes("v"), cache.get("k").orElseThrow());
    }

    @Test
    void testFillAfterInvalidate_IsDropped() {
        CollectionCache cache = CollectionCache.empty(4);
        long token = cache.fillToken();

        // a write lands between the reader's store read and its fill
        cache.invalidate("k");

        assertFalse(cache.fill("k", bytes("old"), token));
        assertTrue(cache.get("k").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void testFillAfterClear_IsDropped() {
        CollectionCache cache = CollectionCache.empty(4);
        long token = cache.fillToken();

        cache.clear();

        assertFalse(cache.fill("k", bytes("old"), token));
        assertTrue(cache.fill("k", bytes("new"), cache.fillToken()));
        assertArrayEquals(bytes("new"), cache.get("k").orElseThrow());
    }

    @Test
    void testEvictsLeastRecentlyUsed() {
        CollectionCache cache = CollectionCache.empty(2);
        cache.fill("a", bytes("1"), cache.fillToken());
        cache.fill("b", bytes("2"), cache.fillToken());
        cache.get("a");

        cache.fill("c", bytes("3"), cache.fillToken());

        assertEquals(2, cache.size());
        assertTrue(cache.get("b").isEmpty());
        assertTrue(cache.get("a").isPresent());
        assertTrue(cache.get("c").isPresent());
    }

    @Test
    void testStoredBytesAreCopies() {
        CollectionCache cache = CollectionCache.empty(2);
        byte[] payload = bytes("abc");
        cache.fill("k", payload, cache.fillToken());
        payload[0] = 'X';

        byte[] out = cache.get("k").orElseThrow();
        out[1] = 'Y';

        assertArrayEquals(bytes("abc"), cache.get("k").orElseThrow());
    }

    @Test
    void testNonPositiveCapacityRejected() {
        assertThrows(IllegalArgumentException.class, () -> CollectionCache.empty(0));
    }
}
