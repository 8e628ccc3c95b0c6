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

import java.util.Map;
import java.util.Set;

/**
 * Outcome of one {@link Database#sync()} pass.
 * <p>
 * A failing collection does not stop its siblings; its failure is recorded
 * here and logged.
 *
 * @param synced   collections synced successfully
 * @param failures collection name to the failure that stopped its sync
 */
public record SyncReport(Set<String> synced, Map<String, Throwable> failures) {

    public SyncReport {
        synced = Set.copyOf(synced);
        failures = Map.copyOf(failures);
    }

    /** True if every collection in the pass synced. */
    public boolean isClean() {
        return failures.isEmpty();
    }
}
