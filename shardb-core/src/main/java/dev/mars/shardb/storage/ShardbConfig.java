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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

/**
 * Configuration for a shardb database.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dshardb.rootDir=/path})</li>
 *   <li>Environment variables (e.g., {@code SHARDB_ROOT_DIR})</li>
 *   <li>Properties file ({@code shardb.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>rootDir</td><td>shardb.rootDir</td><td>SHARDB_ROOT_DIR</td><td>~/.shardb/data</td></tr>
 *   <tr><td>shardCount</td><td>shardb.shardCount</td><td>SHARDB_SHARD_COUNT</td><td>16</td></tr>
 *   <tr><td>syncEnabled</td><td>shardb.syncEnabled</td><td>SHARDB_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>cacheCapacity</td><td>shardb.cacheCapacity</td><td>SHARDB_CACHE_CAPACITY</td><td>1024</td></tr>
 *   <tr><td>randomSeed</td><td>shardb.randomSeed</td><td>SHARDB_RANDOM_SEED</td><td>(clock)</td></tr>
 * </table>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * ShardbConfig config = ShardbConfig.builder()
 *     .rootDir(Path.of("/var/lib/shardb"))
 *     .shardCount(8)
 *     .build();
 *
 * Database db = new Database("shop", config);
 * </pre>
 */
public final class ShardbConfig {

    private static final String PROPERTIES_FILE = "shardb.properties";

    // Property keys
    private static final String PROP_ROOT_DIR = "shardb.rootDir";
    private static final String PROP_SHARD_COUNT = "shardb.shardCount";
    private static final String PROP_SYNC_ENABLED = "shardb.syncEnabled";
    private static final String PROP_CACHE_CAPACITY = "shardb.cacheCapacity";
    private static final String PROP_RANDOM_SEED = "shardb.randomSeed";

    // Environment variable keys
    private static final String ENV_ROOT_DIR = "SHARDB_ROOT_DIR";
    private static final String ENV_SHARD_COUNT = "SHARDB_SHARD_COUNT";
    private static final String ENV_SYNC_ENABLED = "SHARDB_SYNC_ENABLED";
    private static final String ENV_CACHE_CAPACITY = "SHARDB_CACHE_CAPACITY";
    private static final String ENV_RANDOM_SEED = "SHARDB_RANDOM_SEED";

    // Defaults
    private static final Path DEFAULT_ROOT_DIR = Path.of(System.getProperty("user.home"), ".shardb", "data");
    private static final int DEFAULT_SHARD_COUNT = 16;
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final int DEFAULT_CACHE_CAPACITY = 1024;

    private final Path rootDir;
    private final int shardCount;
    private final boolean syncEnabled;
    private final int cacheCapacity;
    private final Long randomSeed;

    private ShardbConfig(Builder builder) {
        this.rootDir = builder.rootDir;
        this.shardCount = builder.shardCount;
        this.syncEnabled = builder.syncEnabled;
        this.cacheCapacity = builder.cacheCapacity;
        this.randomSeed = builder.randomSeed;
    }

    /** Database root directory holding the header and the collections directory. */
    public Path rootDir() {
        return rootDir;
    }

    /** Number of shards per collection. */
    public int shardCount() {
        return shardCount;
    }

    /** Whether fsync is enabled (should be true in production). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Entries held by each collection cache. */
    public int cacheCapacity() {
        return cacheCapacity;
    }

    /** Seed for the database random source; empty means seeded from the clock. */
    public Optional<Long> randomSeed() {
        return Optional.ofNullable(randomSeed);
    }

    /**
     * Returns a copy of this configuration bound to another root directory.
     */
    public ShardbConfig withRootDir(Path rootDir) {
        Builder b = builder()
                .rootDir(rootDir)
                .shardCount(shardCount)
                .syncEnabled(syncEnabled)
                .cacheCapacity(cacheCapacity);
        if (randomSeed != null) {
            b.randomSeed(randomSeed);
        }
        return b.build();
    }

    @Override
    public String toString() {
        return "ShardbConfig{" +
                "rootDir=" + rootDir +
                ", shardCount=" + shardCount +
                ", syncEnabled=" + syncEnabled +
                ", cacheCapacity=" + cacheCapacity +
                ", randomSeed=" + randomSeed +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code ShardbConfig.builder().build()}.
     */
    public static ShardbConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link ShardbConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path rootDir;
        private Integer shardCount;
        private Boolean syncEnabled;
        private Integer cacheCapacity;
        private Long randomSeed;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the root directory. */
        public Builder rootDir(Path rootDir) {
            this.rootDir = rootDir;
            return this;
        }

        /** Sets the root directory from a string path. */
        public Builder rootDir(String rootDir) {
            this.rootDir = Path.of(rootDir);
            return this;
        }

        /** Sets the number of shards per collection (default: 16). */
        public Builder shardCount(int shardCount) {
            this.shardCount = shardCount;
            return this;
        }

        /** Enables or disables fsync (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Sets the per-collection cache capacity (default: 1024). */
        public Builder cacheCapacity(int cacheCapacity) {
            this.cacheCapacity = cacheCapacity;
            return this;
        }

        /** Fixes the random seed, mostly for tests. */
        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         *
         * @throws IllegalArgumentException if shard count or cache capacity is not positive
         */
        public ShardbConfig build() {
            if (rootDir == null) {
                rootDir = resolve(PROP_ROOT_DIR, ENV_ROOT_DIR, value -> Path.of(value), DEFAULT_ROOT_DIR);
            }
            if (shardCount == null) {
                shardCount = resolve(PROP_SHARD_COUNT, ENV_SHARD_COUNT, Integer::parseInt, DEFAULT_SHARD_COUNT);
            }
            if (syncEnabled == null) {
                syncEnabled = resolve(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, Boolean::parseBoolean, DEFAULT_SYNC_ENABLED);
            }
            if (cacheCapacity == null) {
                cacheCapacity = resolve(PROP_CACHE_CAPACITY, ENV_CACHE_CAPACITY, Integer::parseInt, DEFAULT_CACHE_CAPACITY);
            }
            if (randomSeed == null) {
                randomSeed = resolve(PROP_RANDOM_SEED, ENV_RANDOM_SEED, Long::parseLong, null);
            }

            if (shardCount <= 0) {
                throw new IllegalArgumentException("shardCount must be positive: " + shardCount);
            }
            if (cacheCapacity <= 0) {
                throw new IllegalArgumentException("cacheCapacity must be positive: " + cacheCapacity);
            }
            return new ShardbConfig(this);
        }

        /**
         * Resolves one value: system property, then environment variable, then
         * properties file. Unparseable values fall through to the next source.
         */
        private <T> T resolve(String sysProp, String envVar, Function<String, T> parser, T defaultValue) {
            String[] candidates = {
                    System.getProperty(sysProp),
                    System.getenv(envVar),
                    fileProperties.getProperty(sysProp)
            };
            for (String value : candidates) {
                if (value != null && !value.isBlank()) {
                    try {
                        return parser.apply(value.trim());
                    } catch (RuntimeException ignored) {}
                }
            }
            return defaultValue;
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = ShardbConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException ignored) {}

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException ignored) {}
            }

            return props;
        }
    }
}
