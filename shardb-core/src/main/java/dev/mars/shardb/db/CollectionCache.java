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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded LRU cache of element payloads, one per collection.
 * <p>
 * Created empty and attached to a collection after it is created or loaded.
 * Entries are copied on the way in and out so callers cannot mutate cached bytes.
 * <p>
 * <b>Fill protocol:</b> a reader takes a {@link #fillToken()} before reading the
 * backing store and hands it to {@link #fill}. Every invalidation advances the
 * token, so a value read before a concurrent write is dropped instead of
 * cached over the newer state.
 */
public final class CollectionCache {

    private final int capacity;
    private final LinkedHashMap<String, byte[]> entries;
    private long generation;

    private CollectionCache(int capacity) {
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, byte[]> eldest) {
                return size() > CollectionCache.this.capacity;
            }
        };
    }

    public static CollectionCache empty(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive: " + capacity);
        }
        return new CollectionCache(capacity);
    }

    public synchronized Optional<byte[]> get(String key) {
        byte[] value = entries.get(key);
        return value == null ? Optional.empty() : Optional.of(value.clone());
    }

    public synchronized long fillToken() {
        return generation;
    }

    /**
     * Caches {@code payload} unless an invalidation happened since {@code token}
     * was taken.
     *
     * @return true if the value was cached
     */
    public synchronized boolean fill(String key, byte[] payload, long token) {
        if (token != generation) {
            return false;
        }
        entries.put(key, payload.clone());
        return true;
    }

    public synchronized void invalidate(String key) {
        generation++;
        entries.remove(key);
    }

    public synchronized void clear() {
        generation++;
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }
}
