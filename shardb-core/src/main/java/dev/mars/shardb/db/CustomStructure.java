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

import java.util.List;

/**
 * A user-defined structure that can be stored inside a collection element.
 * <p>
 * Implementations must be registered with the database's {@link TypeRegistry}
 * before they are written, and must be mappable by Gson.
 */
public interface CustomStructure {

    /**
     * Flat index of this structure's fields.
     */
    List<FieldIndex> dataIndex();

    /**
     * One indexed field of a {@link CustomStructure}.
     *
     * @param field the field name
     * @param value the field value, rendered as text
     */
    record FieldIndex(String field, String value) {
    }
}
