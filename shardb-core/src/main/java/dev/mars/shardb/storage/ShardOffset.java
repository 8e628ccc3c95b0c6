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

/**
 * Location of one stored value inside its shard's data file.
 *
 * @param position byte offset of the first payload byte
 * @param length   payload length in bytes
 */
public record ShardOffset(long position, int length) {

    public ShardOffset {
        if (position < 0 || length < 0) {
            throw new IllegalArgumentException("Invalid offset: position=" + position + ", length=" + length);
        }
    }

    /** Exclusive end of the byte range. */
    public long end() {
        return position + length;
    }
}
