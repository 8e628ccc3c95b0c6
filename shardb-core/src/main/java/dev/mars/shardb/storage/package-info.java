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
/**
 * Shard storage layer.
 * <p>
 * This package provides the on-disk representation of one collection:
 * <ul>
 *   <li>{@link dev.mars.shardb.storage.ShardedMap} - Key space split across a fixed number of shards</li>
 *   <li>{@link dev.mars.shardb.storage.Shard} - One partition: locked data file + offset index</li>
 *   <li>{@link dev.mars.shardb.storage.EncodedCompressedPackage} - Binary + GZIP single-value files</li>
 *   <li>{@link dev.mars.shardb.storage.JsonCompressedPackage} - JSON + GZIP single-value files</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Data before metadata:</b> a shard's data file is forced before the metadata that references it</li>
 *   <li><b>Whole-file replacement:</b> metadata, index and descriptor files are replaced atomically</li>
 *   <li><b>Handles are not state:</b> file handles are attached after metadata is decoded, never serialized</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * collections/&lt;collection&gt;/
 *  ├─ &lt;collection&gt;.json.gzip     // descriptor
 *  ├─ map.index                  // counter + sync destination
 *  ├─ shard_&lt;i&gt;.gobs              // raw values, appended
 *  └─ shard_&lt;i&gt;_meta.gob.gzip     // offsets + stale byte count
 * </pre>
 *
 * @see dev.mars.shardb.storage.ShardedMap
 */
package dev.mars.shardb.storage;
