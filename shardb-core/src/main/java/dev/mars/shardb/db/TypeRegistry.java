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

import dev.mars.shardb.storage.ShardMetadata;
import dev.mars.shardb.storage.ShardOffset;
import dev.mars.shardb.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Name ↔ class registry for structures stored inside elements.
 * <p>
 * Each {@link Database} owns one registry; nothing is process-wide, so two
 * databases in one JVM can register different types under the same name.
 * The short names of the built-in persisted structures are reserved.
 */
public final class TypeRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(TypeRegistry.class);

    private final Map<String, Class<?>> byName = new HashMap<>();
    private final Map<Class<?>, String> byClass = new HashMap<>();

    public TypeRegistry() {
        reserve("so", ShardOffset.class);
        reserve("sh", ShardMetadata.class);
        reserve("cl", CollectionDescriptor.class);
        reserve("el", Element.class);
    }

    private void reserve(String name, Class<?> type) {
        byName.put(name, type);
        byClass.put(type, name);
    }

    /**
     * Registers {@code type} under its fully qualified class name.
     */
    public void registerType(Class<? extends CustomStructure> type) {
        registerTypeName(type.getName(), type);
    }

    /**
     * Registers {@code type} under {@code name}. Registering the same pair
     * twice is a no-op.
     *
     * @throws StorageException with {@code ALREADY_EXISTS} if the name or the
     *                          class is already bound to something else
     */
    public synchronized void registerTypeName(String name, Class<? extends CustomStructure> type) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Type name must not be blank");
        }
        Class<?> boundClass = byName.get(name);
        String boundName = byClass.get(type);
        if (type.equals(boundClass) && name.equals(boundName)) {
            return;
        }
        if (boundClass != null) {
            throw new StorageException(StorageException.Kind.ALREADY_EXISTS,
                    "Type name '" + name + "' is already bound to " + boundClass.getName());
        }
        if (boundName != null) {
            throw new StorageException(StorageException.Kind.ALREADY_EXISTS,
                    type.getName() + " is already registered as '" + boundName + "'");
        }
        byName.put(name, type);
        byClass.put(type, name);
        LOG.debug("Registered type {} as '{}'", type.getName(), name);
    }

    public synchronized Optional<String> nameOf(Class<?> type) {
        return Optional.ofNullable(byClass.get(type));
    }

    /**
     * The custom structure class registered under {@code name}; empty for
     * unknown and reserved names.
     */
    public synchronized Optional<Class<? extends CustomStructure>> customType(String name) {
        Class<?> type = byName.get(name);
        if (type == null || !CustomStructure.class.isAssignableFrom(type)) {
            return Optional.empty();
        }
        return Optional.of(type.asSubclass(CustomStructure.class));
    }

    public synchronized boolean isRegistered(String name) {
        return byName.containsKey(name);
    }
}
