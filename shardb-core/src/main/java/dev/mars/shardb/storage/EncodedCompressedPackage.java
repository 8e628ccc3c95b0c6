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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.CRC32C;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * A single-file package holding one binary-encoded, GZIP-compressed value.
 * <p>
 * <b>Format</b> (before compression):
 * <pre>
 * ┌──────────────────────────┬──────────┐
 * │ codec-encoded value      │ CRC32C(4)│
 * └──────────────────────────┴──────────┘
 * </pre>
 * The CRC covers the encoded value, so a file that inflates cleanly but was
 * damaged before compression is still rejected.
 * <p>
 * Saves go through {@link AtomicFiles#write}: a package on disk is either the
 * previous complete value or the new complete value.
 *
 * @param <T> the packaged value type
 */
public final class EncodedCompressedPackage<T> {

    private static final Logger LOG = LoggerFactory.getLogger(EncodedCompressedPackage.class);

    private static final int CRC_SIZE = 4;

    private final Path path;
    private final PackageCodec<T> codec;
    private final boolean syncEnabled;

    public EncodedCompressedPackage(Path path, PackageCodec<T> codec, boolean syncEnabled) {
        this.path = path;
        this.codec = codec;
        this.syncEnabled = syncEnabled;
    }

    public Path path() {
        return path;
    }

    /**
     * Encodes, checksums, compresses and atomically writes {@code value}.
     */
    public void save(T value) throws IOException {
        ByteArrayOutputStream raw = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(raw);
        codec.encode(value, out);
        out.flush();

        byte[] body = raw.toByteArray();
        CRC32C crc = new CRC32C();
        crc.update(body, 0, body.length);

        ByteArrayOutputStream compressed = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(compressed)) {
            gzip.write(body);
            gzip.write(ByteBuffer.allocate(CRC_SIZE).putInt((int) crc.getValue()).array());
        }

        AtomicFiles.write(path, compressed.toByteArray(), syncEnabled);
        LOG.trace("Package saved: {} ({} bytes encoded)", path, body.length);
    }

    /**
     * Opens the package, inflates it, verifies the checksum and returns a decoder
     * positioned at the start of the encoded value.
     *
     * @throws java.nio.file.NoSuchFileException if the package does not exist
     * @throws StorageException                  if the checksum does not match
     */
    public DataInputStream openDecoder() throws IOException {
        byte[] body;
        try (InputStream in = new GZIPInputStream(Files.newInputStream(path))) {
            body = in.readAllBytes();
        }

        if (body.length < CRC_SIZE) {
            LOG.error("Package too short: {} ({} bytes)", path, body.length);
            throw StorageException.corrupted("Package " + path + " is truncated");
        }

        int valueLen = body.length - CRC_SIZE;
        int expectedCrc = ByteBuffer.wrap(body, valueLen, CRC_SIZE).getInt();
        CRC32C crc = new CRC32C();
        crc.update(body, 0, valueLen);
        if ((int) crc.getValue() != expectedCrc) {
            LOG.error("Package CRC mismatch: {} (expected={}, computed={})",
                    path, expectedCrc, (int) crc.getValue());
            throw StorageException.corrupted("Package " + path + " failed checksum");
        }

        return new DataInputStream(new ByteArrayInputStream(body, 0, valueLen));
    }

    /**
     * Loads and decodes the packaged value.
     */
    public T load() throws IOException {
        try (DataInputStream in = openDecoder()) {
            return codec.decode(in);
        }
    }
}
