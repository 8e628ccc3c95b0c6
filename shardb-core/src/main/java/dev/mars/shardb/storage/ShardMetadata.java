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
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The serializable half of a shard: its id, its offset index and the number of
 * stale bytes in its data file.
 * <p>
 * The live file handle is never part of this value; it is attached after
 * decoding (see {@link Shard#attach}).
 * <p>
 * {@code dataSize} is the data file length the offsets were written against.
 * A synced data file is never shorter than that; appends made after the sync
 * may make it longer. {@code compactionPending} marks metadata written for a
 * compacted data file that may still be waiting in the staging directory.
 *
 * @param id                shard ordinal within its collection
 * @param staleBytes        bytes in the data file no longer referenced by any key
 * @param dataSize          data file length these offsets address
 * @param compactionPending whether the staged compacted file may not have replaced the data file yet
 * @param offsets           key to value location, sorted by key
 */
public record ShardMetadata(int id, long staleBytes, long dataSize, boolean compactionPending,
                            SortedMap<String, ShardOffset> offsets) {

    /** Codec used for {@code shard_<i>_meta.gob.gzip}. */
    public static final PackageCodec<ShardMetadata> CODEC = new Codec();

    public ShardMetadata {
        offsets = Collections.unmodifiableSortedMap(new TreeMap<>(offsets));
    }

    public static ShardMetadata empty(int id) {
        return new ShardMetadata(id, 0L, 0L, false, new TreeMap<>());
    }

    /**
     * Binary layout:
     * <pre>
     * MAGIC(4) VERSION(2) ID(4) STALE(8) DATA_SIZE(8) PENDING(1) COUNT(4)
     * COUNT × [ KEY_LEN(4) KEY(utf-8) POSITION(8) LENGTH(4) ]
     * </pre>
     * Entries are written in key order so equal metadata encodes to equal bytes.
     */
    private static final class Codec implements PackageCodec<ShardMetadata> {

        /** Magic number: 'SHRD' in ASCII */
        private static final int MAGIC = 0x53485244;

        /** Record format version */
        private static final short VERSION = 1;

        /** KEY_LEN + POSITION + LENGTH */
        private static final int MIN_ENTRY_SIZE = 16;

        @Override
        public void encode(ShardMetadata value, DataOutput out) throws IOException {
            out.writeInt(MAGIC);
            out.writeShort(VERSION);
            out.writeInt(value.id());
            out.writeLong(value.staleBytes());
            out.writeLong(value.dataSize());
            out.writeBoolean(value.compactionPending());
            out.writeInt(value.offsets().size());
            for (Map.Entry<String, ShardOffset> e : value.offsets().entrySet()) {
                byte[] key = e.getKey().getBytes(StandardCharsets.UTF_8);
                out.writeInt(key.length);
                out.write(key);
                out.writeLong(e.getValue().position());
                out.writeInt(e.getValue().length());
            }
        }

        @Override
        public ShardMetadata decode(DataInputStream in) throws IOException {
            int magic = in.readInt();
            short version = in.readShort();
            if (magic != MAGIC || version != VERSION) {
                throw StorageException.corrupted("Invalid shard metadata header: magic=0x"
                        + Integer.toHexString(magic) + ", version=" + version);
            }

            int id = in.readInt();
            long staleBytes = in.readLong();
            long dataSize = in.readLong();
            boolean pending = in.readBoolean();
            int count = in.readInt();
            if (id < 0 || staleBytes < 0 || dataSize < 0 || count < 0
                    || (long) count * MIN_ENTRY_SIZE > in.available()) {
                throw StorageException.corrupted("Invalid shard metadata: id=" + id
                        + ", staleBytes=" + staleBytes + ", dataSize=" + dataSize + ", count=" + count);
            }

            TreeMap<String, ShardOffset> offsets = new TreeMap<>();
            for (int i = 0; i < count; i++) {
                int keyLen = in.readInt();
                if (keyLen < 0 || keyLen > in.available()) {
                    throw StorageException.corrupted("Invalid key length " + keyLen + " in shard " + id);
                }
                byte[] key = new byte[keyLen];
                in.readFully(key);
                long position = in.readLong();
                int length = in.readInt();
                if (position < 0 || length < 0) {
                    throw StorageException.corrupted("Invalid offset in shard " + id
                            + ": position=" + position + ", length=" + length);
                }
                offsets.put(new String(key, StandardCharsets.UTF_8), new ShardOffset(position, length));
            }
            return new ShardMetadata(id, staleBytes, dataSize, pending, offsets);
        }
    }
}
