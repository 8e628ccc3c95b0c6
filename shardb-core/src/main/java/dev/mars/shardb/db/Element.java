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
import dev.mars.shardb.storage.StorageException;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * A stored custom structure: the registered type name plus the structure's
 * JSON form.
 * <p>
 * Layout inside a shard data file:
 * <pre>
 * NAME_LEN(2) NAME(utf-8) JSON(utf-8, rest of the value)
 * </pre>
 *
 * @param typeName the name the structure's class is registered under
 * @param json     the structure mapped by Gson
 */
public record Element(String typeName, String json) {

    /**
     * Encodes {@code value} using the name it is registered under.
     *
     * @throws StorageException with {@code NOT_FOUND} if the class is not registered
     */
    public static Element of(CustomStructure value, TypeRegistry types, Gson gson) {
        String typeName = types.nameOf(value.getClass())
                .orElseThrow(() -> new StorageException(StorageException.Kind.NOT_FOUND,
                        "Type " + value.getClass().getName() + " is not registered"));
        return new Element(typeName, gson.toJson(value));
    }

    /**
     * Decodes the structure through the class registered under {@link #typeName}.
     *
     * @throws StorageException with {@code NOT_FOUND} if the name is not registered
     */
    public CustomStructure toStructure(TypeRegistry types, Gson gson) {
        Class<? extends CustomStructure> type = types.customType(typeName)
                .orElseThrow(() -> new StorageException(StorageException.Kind.NOT_FOUND,
                        "No type registered as '" + typeName + "'"));
        try {
            return gson.fromJson(json, type);
        } catch (JsonParseException e) {
            throw StorageException.corrupted("Element of type '" + typeName + "' is not valid JSON", e);
        }
    }

    public byte[] toBytes() {
        byte[] name = typeName.getBytes(StandardCharsets.UTF_8);
        byte[] body = json.getBytes(StandardCharsets.UTF_8);
        if (name.length > 0xFFFF) {
            throw new IllegalArgumentException("Type name too long: " + name.length + " bytes");
        }
        return ByteBuffer.allocate(2 + name.length + body.length)
                .putShort((short) name.length)
                .put(name)
                .put(body)
                .array();
    }

    /**
     * @throws StorageException if the bytes are too short to hold a type name
     */
    public static Element fromBytes(byte[] bytes) {
        if (bytes.length < 2) {
            throw StorageException.corrupted("Element is " + bytes.length + " bytes, too short for a type name");
        }
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        int nameLen = Short.toUnsignedInt(buf.getShort());
        if (nameLen > buf.remaining()) {
            throw StorageException.corrupted("Element type name length " + nameLen + " exceeds element size");
        }
        String name = new String(bytes, 2, nameLen, StandardCharsets.UTF_8);
        String json = new String(bytes, 2 + nameLen, bytes.length - 2 - nameLen, StandardCharsets.UTF_8);
        return new Element(name, json);
    }
}
