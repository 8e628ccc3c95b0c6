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

import java.io.DataInputStream;
import java.io.DataOutput;
import java.io.IOException;

/**
 * Binary encoder/decoder for one value type stored in an
 * {@link EncodedCompressedPackage}.
 *
 * @param <T> the value type
 */
public interface PackageCodec<T> {

    /**
     * Writes {@code value} to {@code out}. Must be deterministic: equal values
     * produce equal bytes.
     */
    void encode(T value, DataOutput out) throws IOException;

    /**
     * Reads one value previously written by {@link #encode}. The stream is
     * backed by the fully inflated package, so {@code in.available()} is the
     * exact number of bytes left.
     *
     * @throws StorageException with {@code CORRUPTED_COLLECTION} if the bytes are malformed
     */
    T decode(DataInputStream in) throws IOException;
}
