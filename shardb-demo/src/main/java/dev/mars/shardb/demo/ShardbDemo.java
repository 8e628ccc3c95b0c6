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
package dev.mars.shardb.demo;

import dev.mars.shardb.db.Collection;
import dev.mars.shardb.db.Database;
import dev.mars.shardb.storage.ShardbConfig;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Demo entry point for the shardb store.
 * <p>
 * This demonstrates the storage cycle:
 * <ul>
 *   <li>Loading an existing database, or creating one</li>
 *   <li>Adding a collection and inserting elements</li>
 *   <li>Parallel sync of all collections</li>
 *   <li>Overwriting elements and reclaiming space with optimize</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link ShardbConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (root directory only)</li>
 *   <li>System properties: {@code -Dshardb.rootDir=/path -Dshardb.shardCount=8 ...}</li>
 *   <li>Environment variables: {@code SHARDB_ROOT_DIR, SHARDB_SHARD_COUNT, ...}</li>
 *   <li>Properties file: {@code shardb.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl shardb-demo -am
 *
 * # Run with a root directory
 * java -cp ... dev.mars.shardb.demo.ShardbDemo /path/to/root
 * </pre>
 *
 * @see ShardbConfig
 */
public class ShardbDemo {

    private static final String DATABASE = "demo";
    private static final String COLLECTION = "users";

    public static void main(String[] args) {
        System.out.println("+---------------------------------------+");
        System.out.println("|             shardb Demo               |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        ShardbConfig config = args.length > 0 && !args[0].isBlank()
                ? ShardbConfig.builder().rootDir(args[0]).build()
                : ShardbConfig.load();

        System.out.println("Configuration: " + config);
        System.out.println();

        try (Database db = new Database(DATABASE, config)) {
            if (Files.exists(config.rootDir().resolve(DATABASE + Database.HEADER_SUFFIX))) {
                db.load();
                System.out.println("[OK] Loaded database '" + db.name() + "': "
                        + db.getCollectionsCount() + " collections, "
                        + db.getTotalObjectsCount() + " objects");
            } else {
                System.out.println("[OK] New database at: " + db.rootDir());
            }

            Collection users = db.getCollection(COLLECTION).orElseGet(() -> db.addCollection(COLLECTION));
            long before = users.size();

            for (String user : new String[]{"ada", "grace", "linus"}) {
                long id = users.insert(user.getBytes(StandardCharsets.UTF_8));
                System.out.printf("    inserted [%d] %s%n", id, user);
            }

            db.sync();
            System.out.println("\n[OK] Synced: " + COLLECTION + " " + before + " -> " + users.size() + " objects");

            // Overwrite every element once so optimize has something to reclaim
            for (String key : users.keys()) {
                users.get(key).ifPresent(v -> users.put(key, v));
            }
            long reclaimed = db.optimize();
            System.out.println("[OK] Optimized: " + reclaimed + " bytes reclaimed, "
                    + users.size() + " objects kept");

            Path header = db.rootDir().resolve(db.name() + Database.HEADER_SUFFIX);
            System.out.println("\n+---------------------------------------+");
            System.out.println("|  Demo complete!                       |");
            System.out.println("|  Run again to see the data reloaded.  |");
            System.out.println("+---------------------------------------+");
            System.out.println("Header: " + header);
        }
    }
}
