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
import com.google.gson.JsonParseException;
import dev.mars.shardb.storage.AtomicFiles;
import dev.mars.shardb.storage.ShardFile;
import dev.mars.shardb.storage.ShardbConfig;
import dev.mars.shardb.storage.ShardedMap;
import dev.mars.shardb.storage.StorageException;
import dev.mars.shardb.storage.StorageException.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The top-level registry: owns every {@link Collection} of one database root
 * and drives load, sync and optimize across them.
 * <p>
 * <b>Files:</b>
 * <pre>
 * root/
 *  ├─ &lt;name&gt;.shardb              // header: {name, version} as JSON
 *  └─ collections/
 *      └─ &lt;collection&gt;/          // see {@link Collection}
 * </pre>
 * <p>
 * <b>Thread Safety:</b>
 * The registry is guarded by one read/write lock. Lookups and counts take the
 * read lock; add, drop and load-time inserts take the write lock;
 * {@link #optimize()} holds the write lock for its whole run.
 * {@link #sync()} snapshots the registry under the read lock and releases it
 * before fanning out, so collections added mid-sync are not part of that pass.
 */
public final class Database implements Closeable {

    // ========================================================================
    // Logger
    // ========================================================================

    private static final Logger LOG = LoggerFactory.getLogger(Database.class);

    // ========================================================================
    // Constants
    // ========================================================================

    /** Running format version. */
    public static final int VERSION = 1;

    /** Version distance at which a header is rejected instead of warned about. */
    public static final int MAJOR_VERSION_GAP = 10;

    /** Header file suffix, the discovery key for {@link #locateHeader}. */
    public static final String HEADER_SUFFIX = ".shardb";

    /** Directory under the root holding one directory per collection. */
    public static final String COLLECTIONS_DIR = "collections";

    // ========================================================================
    // State
    // ========================================================================

    private final ShardbConfig config;
    private final TypeRegistry types = new TypeRegistry();
    private final Gson gson = new Gson();
    private final Random random;
    private final ReentrantReadWriteLock registryLock = new ReentrantReadWriteLock();
    private final Map<String, Collection> collections = new TreeMap<>();
    private final ExecutorService syncExecutor;

    private volatile String name;
    private volatile Path rootDir;
    private volatile boolean closed = false;

    // ========================================================================
    // Constructor
    // ========================================================================

    /**
     * Creates an empty database.
     * <p>
     * This is the one-time setup step: the random source is seeded, the type
     * registry is created with the built-in names reserved, and a memory
     * profile sample is logged.
     *
     * @param name   database name, also the header file name
     * @param config root directory, shard count and the other settings
     */
    public Database(String name, ShardbConfig config) {
        this.name = requireValidName(name, "Database");
        this.config = config;
        this.rootDir = config.rootDir().toAbsolutePath().normalize();
        this.random = config.randomSeed().map(Random::new).orElseGet(() -> new Random(System.nanoTime()));

        AtomicInteger threadCount = new AtomicInteger();
        this.syncExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "shardb-sync-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        LOG.info("Database {} initialized: root={}, shardCount={}, syncEnabled={}",
                name, rootDir, config.shardCount(), config.syncEnabled());
        if (!config.syncEnabled()) {
            LOG.warn("Database {} created with fsync DISABLED. Do NOT use in production!", name);
        }
        profileMemory();
    }

    public String name() {
        return name;
    }

    public int version() {
        return VERSION;
    }

    public Path rootDir() {
        return rootDir;
    }

    public ShardbConfig config() {
        return config;
    }

    // ========================================================================
    // Type Registration
    // ========================================================================

    public TypeRegistry types() {
        return types;
    }

    /**
     * Registers a custom structure under its fully qualified class name.
     */
    public void registerType(Class<? extends CustomStructure> type) {
        types.registerType(type);
    }

    /**
     * Registers a custom structure under an explicit short name.
     */
    public void registerTypeName(String typeName, Class<? extends CustomStructure> type) {
        types.registerTypeName(typeName, type);
    }

    // ========================================================================
    // Load
    // ========================================================================

    /**
     * Finds the header file in {@code dir}.
     * <p>
     * Exactly one {@code *.shardb} file is expected. If there are several, the
     * lexicographically first is used and a warning is logged.
     *
     * @throws StorageException with {@code NOT_FOUND} if there is none
     */
    public static Path locateHeader(Path dir) {
        List<Path> headers;
        try (Stream<Path> files = Files.list(dir)) {
            headers = files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(HEADER_SUFFIX))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageException(Kind.NOT_FOUND, "Cannot scan " + dir + " for a database header", e);
        }

        if (headers.isEmpty()) {
            throw new StorageException(Kind.NOT_FOUND, "Database header not found in " + dir);
        }
        if (headers.size() > 1) {
            LOG.warn("Found {} database headers in {}, using {}", headers.size(), dir, headers.get(0).getFileName());
        }
        return headers.get(0);
    }

    /**
     * Loads the database stored at the configured root.
     */
    public void load() {
        load(config.rootDir());
    }

    /**
     * Loads the database stored at {@code root}: validates the header version,
     * then rebuilds every collection under {@code collections/}.
     * <p>
     * Once every collection has loaded, the database adopts the header's name
     * and {@code root} becomes its root. Loading is fail-fast: the first broken
     * collection aborts the call, every collection loaded by it is closed and
     * unregistered again, and the name and root stay as they were.
     *
     * @throws IllegalStateException if collections are already registered
     * @throws StorageException      {@code NOT_FOUND} (no header or no collections
     *                               directory), {@code VERSION_INCOMPATIBLE} or
     *                               {@code CORRUPTED_COLLECTION}
     */
    public void load(Path root) {
        ensureOpen();
        Path normalizedRoot = root.toAbsolutePath().normalize();

        registryLock.readLock().lock();
        try {
            if (!collections.isEmpty()) {
                throw new IllegalStateException("Database " + name + " already has "
                        + collections.size() + " collections registered");
            }
        } finally {
            registryLock.readLock().unlock();
        }

        LOG.info("Loading database from: {}", normalizedRoot);
        long startTime = System.currentTimeMillis();

        DatabaseHeader header = readHeader(locateHeader(normalizedRoot));
        checkVersion(header);

        Path collectionsDir = normalizedRoot.resolve(COLLECTIONS_DIR);
        if (!Files.isDirectory(collectionsDir)) {
            LOG.error("Collections directory does not exist: {}", collectionsDir);
            throw new StorageException(Kind.NOT_FOUND, "Collections folder does not exist: " + collectionsDir);
        }

        CollectionLoader loader = new CollectionLoader(normalizedRoot, config, types, gson);
        List<String> loaded = new ArrayList<>();
        try {
            for (Path dir : listCollectionDirs(collectionsDir)) {
                Collection collection = loader.load(dir);
                String collectionName = dir.getFileName().toString();
                registryLock.writeLock().lock();
                try {
                    collections.put(collectionName, collection);
                } finally {
                    registryLock.writeLock().unlock();
                }
                loaded.add(collectionName);
            }
        } catch (RuntimeException e) {
            LOG.error("Database load aborted after {} collections: {}", loaded.size(), e.getMessage());
            unregisterAndClose(loaded);
            throw e;
        }

        this.name = header.name();
        this.rootDir = normalizedRoot;

        LOG.info("Database {} loaded: {} collections, {} objects, {} ms",
                name, loaded.size(), getTotalObjectsCount(), System.currentTimeMillis() - startTime);
    }

    private DatabaseHeader readHeader(Path headerFile) {
        try {
            DatabaseHeader header = gson.fromJson(Files.readString(headerFile, StandardCharsets.UTF_8),
                    DatabaseHeader.class);
            if (header == null || header.name() == null) {
                throw StorageException.corrupted("Database header " + headerFile + " is empty");
            }
            return header;
        } catch (JsonParseException e) {
            throw StorageException.corrupted("Failed to parse the header " + headerFile, e);
        } catch (IOException e) {
            throw StorageException.io("Failed to read the header " + headerFile, e);
        }
    }

    private void checkVersion(DatabaseHeader header) {
        int diff = Math.abs(VERSION - header.version());
        if (diff == 0) {
            return;
        }
        if (diff >= MAJOR_VERSION_GAP) {
            LOG.error("Incompatible database version {} (current {})", header.version(), VERSION);
            throw new StorageException(Kind.VERSION_INCOMPATIBLE, "Database version " + header.version()
                    + " is incompatible with " + VERSION);
        }
        LOG.warn("Loading database {} written with a different version {} (current {})",
                header.name(), header.version(), VERSION);
    }

    private static List<Path> listCollectionDirs(Path collectionsDir) {
        try (Stream<Path> dirs = Files.list(collectionsDir)) {
            return dirs.filter(Files::isDirectory).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw StorageException.io("Cannot list " + collectionsDir, e);
        }
    }

    private void unregisterAndClose(List<String> names) {
        registryLock.writeLock().lock();
        try {
            for (String n : names) {
                Collection c = collections.remove(n);
                if (c != null) {
                    c.close();
                }
            }
        } finally {
            registryLock.writeLock().unlock();
        }
    }

    // ========================================================================
    // Sync / Optimize
    // ========================================================================

    /**
     * Syncs every registered collection in parallel, then writes the header.
     * <p>
     * A collection that fails is logged and reported; it does not stop the
     * others and does not fail the call.
     *
     * @return which collections synced and which failed
     * @throws StorageException if the header cannot be written
     */
    public SyncReport sync() {
        ensureOpen();
        List<Collection> snapshot;
        registryLock.readLock().lock();
        try {
            snapshot = new ArrayList<>(collections.values());
        } finally {
            registryLock.readLock().unlock();
        }

        Map<String, CompletableFuture<Void>> tasks = new LinkedHashMap<>();
        for (Collection c : snapshot) {
            tasks.put(c.name(), CompletableFuture.runAsync(() -> {
                LOG.info("Synchronizing {}", c.name());
                try {
                    c.sync();
                } catch (RuntimeException e) {
                    LOG.warn("Collection {} synchronization failed: {}", c.name(), e.getMessage());
                    throw e;
                }
            }, syncExecutor));
        }

        Set<String> synced = new HashSet<>();
        Map<String, Throwable> failures = new HashMap<>();
        for (Map.Entry<String, CompletableFuture<Void>> task : tasks.entrySet()) {
            try {
                task.getValue().join();
                synced.add(task.getKey());
            } catch (CompletionException e) {
                failures.put(task.getKey(), e.getCause() != null ? e.getCause() : e);
            }
        }

        writeHeader();
        LOG.info("Database {} synced: {} collections, {} failed", name, synced.size(), failures.size());
        return new SyncReport(synced, failures);
    }

    private void writeHeader() {
        Path headerFile = rootDir.resolve(name + HEADER_SUFFIX);
        try {
            Files.createDirectories(rootDir);
            byte[] json = gson.toJson(new DatabaseHeader(name, VERSION)).getBytes(StandardCharsets.UTF_8);
            AtomicFiles.write(headerFile, json, config.syncEnabled());
        } catch (IOException e) {
            LOG.error("Failed to write header {}: {}", headerFile, e.getMessage(), e);
            throw StorageException.io("Failed to write header " + headerFile, e);
        }
    }

    /**
     * Compacts every collection, one after another, under the registry write lock.
     * <p>
     * The first failure is thrown and the partial total is discarded. Shards
     * compacted before the failure stay compacted.
     *
     * @return total bytes reclaimed
     */
    public long optimize() {
        ensureOpen();
        registryLock.writeLock().lock();
        try {
            long reclaimed = 0;
            for (Collection c : collections.values()) {
                reclaimed += c.optimize();
            }
            LOG.info("Database {} optimized: {} bytes reclaimed", name, reclaimed);
            return reclaimed;
        } finally {
            registryLock.writeLock().unlock();
        }
    }

    // ========================================================================
    // Registry
    // ========================================================================

    /**
     * Creates a collection with a fresh set of empty shard files and registers it.
     * <p>
     * The new collection is synced once before it is returned, so its directory
     * is loadable even if the database is never synced afterwards.
     *
     * @throws StorageException with {@code ALREADY_EXISTS} if the name is taken
     */
    public Collection addCollection(String collectionName) {
        ensureOpen();
        requireValidName(collectionName, "Collection");

        registryLock.writeLock().lock();
        try {
            if (collections.containsKey(collectionName)) {
                throw new StorageException(Kind.ALREADY_EXISTS,
                        "Collection " + collectionName + " already exists");
            }

            Path dir = rootDir.resolve(COLLECTIONS_DIR).resolve(collectionName);
            List<ShardFile> files = new ArrayList<>(config.shardCount());
            ShardedMap map;
            try {
                Files.createDirectories(dir);
                for (int i = 0; i < config.shardCount(); i++) {
                    files.add(ShardFile.create(dir.resolve(ShardedMap.dataFileName(i))));
                }
                map = ShardedMap.create(rootDir, dir, files, config.syncEnabled());
            } catch (IOException | RuntimeException e) {
                files.forEach(ShardFile::close);
                LOG.error("Failed to create collection {}: {}", collectionName, e.getMessage());
                if (e instanceof StorageException) {
                    throw (StorageException) e;
                }
                throw StorageException.io("Failed to create a shard for collection " + collectionName, e);
            }

            String relative = rootDir.relativize(dir).toString().replace('\\', '/');
            Collection collection = new Collection(
                    CollectionDescriptor.create(collectionName, relative, config.shardCount()),
                    dir, map, CollectionCache.empty(config.cacheCapacity()), types, gson, config.syncEnabled());
            try {
                collection.sync();
            } catch (RuntimeException e) {
                collection.close();
                throw e;
            }

            collections.put(collectionName, collection);
            LOG.info("Collection {} added: {} shards at {}", collectionName, config.shardCount(), dir);
            return collection;
        } finally {
            registryLock.writeLock().unlock();
        }
    }

    public Optional<Collection> getCollection(String collectionName) {
        registryLock.readLock().lock();
        try {
            return Optional.ofNullable(collections.get(collectionName));
        } finally {
            registryLock.readLock().unlock();
        }
    }

    /**
     * Unregisters the collection, releases its files and deletes its directory.
     *
     * @return true if a collection was dropped
     */
    public boolean dropCollection(String collectionName) {
        ensureOpen();
        Collection collection;
        registryLock.writeLock().lock();
        try {
            collection = collections.remove(collectionName);
        } finally {
            registryLock.writeLock().unlock();
        }
        if (collection == null) {
            return false;
        }

        collection.close();
        try (Stream<Path> paths = Files.walk(collection.directory())) {
            for (Path p : paths.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            LOG.error("Collection {} dropped but its directory could not be deleted: {}",
                    collectionName, e.getMessage());
            throw StorageException.io("Failed to delete collection directory " + collection.directory(), e);
        }
        LOG.info("Collection {} dropped", collectionName);
        return true;
    }

    public int getCollectionsCount() {
        registryLock.readLock().lock();
        try {
            return collections.size();
        } finally {
            registryLock.readLock().unlock();
        }
    }

    public Set<String> getCollectionNames() {
        registryLock.readLock().lock();
        try {
            return new TreeSet<>(collections.keySet());
        } finally {
            registryLock.readLock().unlock();
        }
    }

    /**
     * Sum of the live element counts of all collections.
     */
    public long getTotalObjectsCount() {
        registryLock.readLock().lock();
        try {
            long total = 0;
            for (Collection c : collections.values()) {
                total += c.size();
            }
            return total;
        } finally {
            registryLock.readLock().unlock();
        }
    }

    /**
     * Picks a registered collection uniformly at random.
     *
     * @throws StorageException with {@code EMPTY_REGISTRY} if there are no collections
     */
    public Collection getRandomCollection() {
        registryLock.readLock().lock();
        try {
            if (collections.isEmpty()) {
                throw new StorageException(Kind.EMPTY_REGISTRY, "Database " + name + " has no collections");
            }
            List<Collection> snapshot = new ArrayList<>(collections.values());
            return snapshot.get(random.nextInt(snapshot.size()));
        } finally {
            registryLock.readLock().unlock();
        }
    }

    // ========================================================================
    // Close
    // ========================================================================

    /**
     * Releases every collection's files and stops the sync workers. Does not
     * sync; call {@link #sync()} first to persist the latest state.
     */
    @Override
    public void close() {
        if (closed) {
            LOG.debug("Database already closed, ignoring duplicate close()");
            return;
        }
        closed = true;

        registryLock.writeLock().lock();
        try {
            collections.values().forEach(Collection::close);
            collections.clear();
        } finally {
            registryLock.writeLock().unlock();
        }
        syncExecutor.shutdown();
        LOG.info("Database {} closed", name);
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Database " + name + " is closed");
        }
    }

    private static String requireValidName(String value, String what) {
        if (value == null || value.isBlank() || value.equals(".") || value.equals("..")
                || value.contains("/") || value.contains("\\")) {
            throw new IllegalArgumentException(what + " name is not a valid file name: '" + value + "'");
        }
        return value;
    }

    /**
     * Logs one heap usage sample.
     */
    private void profileMemory() {
        Runtime rt = Runtime.getRuntime();
        long usedMb = (rt.totalMemory() - rt.freeMemory()) / 1024 / 1024;
        LOG.info("Memory profile: used={} MB, committed={} MB, max={} MB",
                usedMb, rt.totalMemory() / 1024 / 1024, rt.maxMemory() / 1024 / 1024);
    }
}
