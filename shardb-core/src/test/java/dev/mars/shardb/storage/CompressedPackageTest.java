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

import com.google.gson.Gson;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutput;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.TreeMap;
import java.util.stream.Stream;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link EncodedCompressedPackage} and {@link JsonCompressedPackage}.
 * <p>
 * These tests verify:
 * <ul>
 *   <li>Shard metadata survives a save/load cycle</li>
 *   <li>Saving equal values produces identical files</li>
 *   <li>Missing, non-GZIP, checksum-failing and wrongly-typed packages are rejected</li>
 *   <li>JSON packages map documents through Gson</li>
 * </ul>
 */
class CompressedPackageTest {

    @TempDir
    Path tempDir;

    private static ShardMetadata sampleMetadata() {
        TreeMap<String, ShardOffset> offsets = new TreeMap<>();
        offsets.put("1", new ShardOffset(0, 12));
        offsets.put("alpha", new ShardOffset(12, 5));
        offsets.put("ünïcødé", new ShardOffset(17, 0));
        return new ShardMetadata(3, 40L, 17L, false, offsets);
    }

    /** Writes bytes as they are, so tests can hand-craft checksummed package bodies. */
    private static final PackageCodec<byte[]> RAW = new PackageCodec<>() {
        @Override
        public void encode(byte[] value, DataOutput out) throws IOException {
            out.write(value);
        }

        @Override
        public byte[] decode(DataInputStream in) throws IOException {
            return in.readAllBytes();
        }
    };

    /** Valid shard metadata header for shard 0 announcing {@code count} entries, room left for 16 more bytes. */
    private static ByteBuffer metadataPrefix(int count) {
        return ByteBuffer.allocate(4 + 2 + 4 + 8 + 8 + 1 + 4 + 16)
                .putInt(0x53485244)
                .putShort((short) 1)
                .putInt(0)
                .putLong(0L)
                .putLong(0L)
                .put((byte) 0)
                .putInt(count);
    }

    private static byte[] gzip(byte[] data) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gz = new GZIPOutputStream(out)) {
            gz.write(data);
        }
        return out.toByteArray();
    }

    // ========================================================================
    // Encoded Package
    // ========================================================================

    @Nested
    @DisplayName("Encoded package")
    class EncodedPackageTests {

        @Test
        @DisplayName("Shard metadata survives save and load")
        void testSaveAndLoad() throws Exception {
            Path path = tempDir.resolve("shard_3_meta.gob.gzip");
            ShardMetadata meta = sampleMetadata();

            new EncodedCompressedPackage<>(path, ShardMetadata.CODEC, true).save(meta);
            ShardMetadata loaded = new EncodedCompressedPackage<>(path, ShardMetadata.CODEC, true).load();

            assertEquals(meta, loaded);
            assertEquals(3, loaded.id());
            assertEquals(40L, loaded.staleBytes());
            assertEquals(new ShardOffset(12, 5), loaded.offsets().get("alpha"));
        }

        @Test
        @DisplayName("Saving the same value twice produces identical bytes")
        void testDeterministicBytes() throws Exception {
            Path path = tempDir.resolve("meta.gob.gzip");
            EncodedCompressedPackage<ShardMetadata> pkg =
                    new EncodedCompressedPackage<>(path, ShardMetadata.CODEC, false);

            pkg.save(sampleMetadata());
            byte[] first = Files.readAllBytes(path);
            pkg.save(sampleMetadata());
            byte[] second = Files.readAllBytes(path);

            assertArrayEquals(first, second);
        }

        @Test
        @DisplayName("Save leaves no temp file behind")
        void testNoTempFileLeft() throws Exception {
            Path path = tempDir.resolve("meta.gob.gzip");
            new EncodedCompressedPackage<>(path, ShardMetadata.CODEC, false).save(sampleMetadata());

            try (Stream<Path> files = Files.list(tempDir)) {
                assertEquals(1, files.count());
            }
        }

        @Test
        @DisplayName("Missing package throws NoSuchFileException")
        void testMissing() {
            Path path = tempDir.resolve("absent.gob.gzip");
            assertThrows(NoSuchFileException.class,
                    () -> new EncodedCompressedPackage<>(path, ShardMetadata.CODEC, false).load());
        }

        @Test
        @DisplayName("A file that is not GZIP fails to inflate")
        void testNotGzip() throws Exception {
            Path path = tempDir.resolve("garbage.gob.gzip");
            Files.write(path, "definitely not gzip".getBytes(StandardCharsets.UTF_8));

            assertThrows(IOException.class,
                    () -> new EncodedCompressedPackage<>(path, ShardMetadata.CODEC, false).load());
        }

        @Test
        @DisplayName("Checksum mismatch is reported as corruption")
        void testChecksumMismatch() throws Exception {
            Path path = tempDir.resolve("bad-crc.gob.gzip");
            byte[] body = ByteBuffer.allocate(8).putInt(0x53485244).putInt(0xDEADBEEF).array();
            Files.write(path, gzip(body));

            StorageException e = assertThrows(StorageException.class,
                    () -> new EncodedCompressedPackage<>(path, ShardMetadata.CODEC, false).load());
            assertEquals(StorageException.Kind.CORRUPTED_COLLECTION, e.kind());
        }

        @Test
        @DisplayName("Valid package of another type fails the magic check")
        void testWrongMagic() throws Exception {
            Path path = tempDir.resolve("other.gob.gzip");
            PackageCodec<Integer> intCodec = new PackageCodec<>() {
                @Override
                public void encode(Integer value, DataOutput out) throws IOException {
                    out.writeInt(value);
                    out.writeShort(1);
                }

                @Override
                public Integer decode(DataInputStream in) throws IOException {
                    return in.readInt();
                }
            };
            new EncodedCompressedPackage<>(path, intCodec, false).save(7);

            StorageException e = assertThrows(StorageException.class,
                    () -> new EncodedCompressedPackage<>(path, ShardMetadata.CODEC, false).load());
            assertEquals(StorageException.Kind.CORRUPTED_COLLECTION, e.kind());
        }

        @Test
        @DisplayName("Key length larger than the package is rejected before allocating")
        void testOversizedKeyLength() throws Exception {
            Path path = tempDir.resolve("huge-key.gob.gzip");
            byte[] body = metadataPrefix(1)
                    .putInt(Integer.MAX_VALUE)
                    .put(new byte[12])
                    .array();
            new EncodedCompressedPackage<>(path, RAW, false).save(body);

            StorageException e = assertThrows(StorageException.class,
                    () -> new EncodedCompressedPackage<>(path, ShardMetadata.CODEC, false).load());
            assertEquals(StorageException.Kind.CORRUPTED_COLLECTION, e.kind());
        }

        @Test
        @DisplayName("Entry count larger than the package is rejected")
        void testOversizedCount() throws Exception {
            Path path = tempDir.resolve("huge-count.gob.gzip");
            new EncodedCompressedPackage<>(path, RAW, false).save(metadataPrefix(Integer.MAX_VALUE).array());

            StorageException e = assertThrows(StorageException.class,
                    () -> new EncodedCompressedPackage<>(path, ShardMetadata.CODEC, false).load());
            assertEquals(StorageException.Kind.CORRUPTED_COLLECTION, e.kind());
        }
    }

    // ========================================================================
    // JSON Package
    // ========================================================================

    static final class Doc {
        String title;
        long count;

        Doc() {
        }

        Doc(String title, long count) {
            this.title = title;
            this.count = count;
        }
    }

    @Nested
    @DisplayName("JSON package")
    class JsonPackageTests {

        @Test
        @DisplayName("Document survives save and load")
        void testSaveAndLoad() throws Exception {
            Path path = tempDir.resolve("doc.json.gzip");
            JsonCompressedPackage<Doc> pkg = new JsonCompressedPackage<>(path, Doc.class, new Gson(), true);

            pkg.save(new Doc("users", 3));
            Doc loaded = pkg.load();

            assertEquals("users", loaded.title);
            assertEquals(3, loaded.count);
        }

        @Test
        @DisplayName("Malformed JSON is reported as corruption")
        void testMalformed() throws Exception {
            Path path = tempDir.resolve("doc.json.gzip");
            Files.write(path, gzip("{\"title\": ".getBytes(StandardCharsets.UTF_8)));

            StorageException e = assertThrows(StorageException.class,
                    () -> new JsonCompressedPackage<>(path, Doc.class, new Gson(), false).load());
            assertEquals(StorageException.Kind.CORRUPTED_COLLECTION, e.kind());
        }

        @Test
        @DisplayName("Empty document is reported as corruption")
        void testEmpty() throws Exception {
            Path path = tempDir.resolve("doc.json.gzip");
            Files.write(path, gzip(new byte[0]));

            StorageException e = assertThrows(StorageException.class,
                    () -> new JsonCompressedPackage<>(path, Doc.class, new Gson(), false).load());
            assertEquals(StorageException.Kind.CORRUPTED_COLLECTION, e.kind());
        }
    }
}
