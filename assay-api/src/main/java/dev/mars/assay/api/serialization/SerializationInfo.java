/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
package dev.mars.assay.api.serialization;

import dev.mars.assay.api.error.MissingFieldException;

/**
 * Key/value bag used to flatten and rebuild serializable objects.
 *
 * <p>Supports strings, integers, booleans, their nullable variants, lists and maps of
 * those, and arrays of simple test method arguments.</p>
 */
public interface SerializationInfo {

    /**
     * Stores a value. A {@code null} value is stored as an explicit null.
     */
    void addValue(String key, Object value);

    /**
     * Reads an optional value.
     *
     * @return the value, or null when the key is absent or holds null
     */
    <T> T getValue(String key, Class<T> type);

    /**
     * Reads a value that must be present.
     *
     * @throws MissingFieldException when the key is absent or holds null
     */
    <T> T getRequiredValue(String key, Class<T> type);

    boolean hasValue(String key);

    /**
     * @return the name of the type whose state this bag carries, used in error messages
     */
    String getOwnerTypeName();
}
