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
package dev.mars.assay.api.introspection;

import java.util.List;

/**
 * Read-only view of one attribute (annotation) instance.
 */
public interface AttributeInfo {

    /**
     * @return the fully qualified type name of this attribute
     */
    String getAttributeTypeName();

    /**
     * @return the positional arguments the attribute was declared with, never null
     */
    List<Object> getConstructorArguments();

    /**
     * Reads a named argument.
     *
     * @param argumentName the argument name
     * @param type the expected value type
     * @return the value, or null when the argument was not supplied
     */
    <T> T getNamedArgument(String argumentName, Class<T> type);
}
