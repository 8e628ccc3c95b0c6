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

import com.google.gson.Gson;
import dev.mars.shardb.storage.EncodedCompressedPackage;
import dev.mars.shardb.storage.JsonCompressedPackage;
import dev.mars.shardb.storage.MapIndex;
import dev.mars.shardb.storage.Shard;
import dev.mars.shardb.storage.ShardFile;
import dev.mars.shardb.storage.ShardMetadata;
import dev.mars.shardb.storage.ShardbConfig;
import dev.mars.shardb.storage.ShardedMap;
import dev.mars.shardb.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Rebuilds a {@link Collection} from its directory.
 * <p>
 * <b>Protocol:</b>
 * <ol>
 *   <li>{@code map.index} supplies the counter and sync destination.</li>
 *   <li>Every {@code shard_<i>.gobs} is opened and locked, its
 *       {@code shard_<i>_meta.gob.gzip} decoded, and the two attached into the
 *       slot named by the decoded shard id. A compaction interrupted after its
 *       metadata was written is finished from the sync destination.</li>
 *   <li>{@code <name>.json.gzip} supplies the descriptor.</li>
 *   <li>Only then are the map and a fresh cache wired into the collection.</li>
 * </ol>
 * Any missing or undecodable piece fails the whole collection with
 * {@code CORRUPTED_COLLECTION}; every file opened so far is closed again.
 */
final class CollectionLoader {

    private static final Logger LOG = LoggerFactory.getLogger(CollectionLoader.class);

    private static final Pattern DATA_FILE = Pattern.compile("shard_(\\d+)\\.gobs");

    private final Path rootDir;
    private final ShardbConfig config;
    private final TypeRegistry types;
    private final Gson gson;

    CollectionLoader(Path rootDir, ShardbConfig config, TypeRegistry types, Gson gson) {
        this.rootDir = rootDir;
        this.config = config;
        this.types = types;
        this.gson = gson;
    }

    Collection load(Path directory) {
        String name = directory.getFileName().toString();
        int shardCount = config.shardCount();
        LOG.debug("Loading collection {} from {}", name, directory);

        List<Path> dataFiles = listDataFiles(directory);
        if (dataFiles.size() < shardCount) {
            LOG.error("Collection {} has {} shard files, expected {}", name, dataFiles.size(), shardCount);
            throw StorageException.corrupted("Collection " + name + " has invalid amount of shards "
                    + dataFiles.size() + ". Expected " + shardCount);
        }

        ShardedMap map = ShardedMap.reattach(rootDir, directory, shardCount, config.syncEnabled());
        try {
            // 1. map index, which also names the staging directory of interrupted compactions
            MapIndex index = MapIndex.read(directory.resolve(MapIndex.FILE_NAME));
            Path stagingDir = rootDir.resolve(index.syncDestination()).normalize();
            map.setCounterIndex(index.counter());
            map.setSyncDestination(stagingDir);

            // 2. shards
            for (Path dataFile : dataFiles) {
                Shard shard = attachShard(name, dataFile, stagingDir);
                try {
                    map.attach(shard);
                } catch (RuntimeException e) {
                    shard.close();
                    throw e;
                }
            }
            map.verifyComplete();

            // 3. descriptor
            CollectionDescriptor descriptor = loadDescriptor(name, directory, shardCount);

            // 4. wire
            Collection collection = new Collection(descriptor, directory, map,
                    CollectionCache.empty(config.cacheCapacity()), types, gson, config.syncEnabled());
            LOG.info("Collection {} loaded: {} objects, counter={}", name, collection.size(), index.counter());
            return collection;
        } catch (IOException e) {
            map.close();
            LOG.error("Failed to load collection {}: {}", name, e.getMessage(), e);
            throw StorageException.corrupted("Failed to load collection " + name + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            map.close();
            throw e;
        }
    }

    private List<Path> listDataFiles(Path directory) {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> DATA_FILE.matcher(p.getFileName().toString()).matches())
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw StorageException.io("Cannot list collection directory " + directory, e);
        }
    }

    /**
     * Opens one data file and attaches its decoded metadata to it.
     */
    private Shard attachShard(String collection, Path dataFile, Path stagingDir) throws IOException {
        Matcher m = DATA_FILE.matcher(dataFile.getFileName().toString());
        if (!m.matches()) {
            throw new IllegalStateException("Not a shard data file: " + dataFile);
        }
        int ordinal = Integer.parseInt(m.group(1));
        Path metaFile = dataFile.resolveSibling(ShardedMap.metaFileName(ordinal));

        ShardFile file = ShardFile.open(dataFile);
        try {
            ShardMetadata meta;
            try {
                meta = new EncodedCompressedPackage<>(metaFile, ShardMetadata.CODEC, config.syncEnabled()).load();
            } catch (NoSuchFileException e) {
                throw StorageException.corrupted("Collection " + collection + " shard metadata "
                        + metaFile.getFileName() + " is missing", e);
            }
            if (meta.id() != ordinal) {
                throw StorageException.corrupted("Shard metadata " + metaFile.getFileName()
                        + " carries id " + meta.id());
            }
            return Shard.attach(meta, file, stagingDir, config.syncEnabled());
        } catch (IOException | RuntimeException e) {
            file.close();
            throw e;
        }
    }

    private CollectionDescriptor loadDescriptor(String name, Path directory, int shardCount) throws IOException {
        Path path = Collection.descriptorPath(directory, name);
        CollectionDescriptor descriptor;
        try {
            descriptor = new JsonCompressedPackage<>(path, CollectionDescriptor.class, gson, config.syncEnabled())
                    .load();
        } catch (NoSuchFileException e) {
            throw StorageException.corrupted("Collection " + name + " description file is missing", e);
        }
        if (!name.equals(descriptor.name())) {
            throw StorageException.corrupted("Collection directory " + name
                    + " holds a descriptor for '" + descriptor.name() + "'");
        }
        Long recordedShards = descriptor.metadata().get(CollectionDescriptor.SHARDS);
        if (recordedShards != null && recordedShards != shardCount) {
            throw StorageException.corrupted("Collection " + name + " was created with "
                    + recordedShards + " shards, configured shard count is " + shardCount);
        }
        return descriptor;
    }
}
