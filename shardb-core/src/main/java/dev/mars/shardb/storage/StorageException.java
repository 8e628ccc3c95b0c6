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

/**
 * Exception thrown when storage operations fail.
 * <p>
 * Every failure carries a {@link Kind} so callers can tell a missing header
 * from a corrupted collection without parsing messages.
 */
public class StorageException extends RuntimeException {

    /**
     * Failure categories surfaced by the store.
     */
    public enum Kind {
        /** Header, collection or registered type is missing. */
        NOT_FOUND,
        /** On-disk version is a major version away from the running version. */
        VERSION_INCOMPATIBLE,
        /** Shard count mismatch, undecodable metadata, missing index or descriptor. */
        CORRUPTED_COLLECTION,
        /** A collection or type name is already taken. */
        ALREADY_EXISTS,
        /** The registry holds no collections. */
        EMPTY_REGISTRY,
        /** Filesystem failure passed through. */
        IO
    }

    private final Kind kind;

    public StorageException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StorageException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Wraps a filesystem failure.
     */
    public static StorageException io(String message, Throwable cause) {
        return new StorageException(Kind.IO, message, cause);
    }

    public static StorageException corrupted(String message) {
        return new StorageException(Kind.CORRUPTED_COLLECTION, message);
    }

    public static StorageException corrupted(String message, Throwable cause) {
        return new StorageException(Kind.CORRUPTED_COLLECTION, message, cause);
    }

    public Kind kind() {
        return kind;
    }
}
