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
 * Something that carries custom attributes (annotations): an assembly, a type or a method.
 */
public interface AttributeProvider {

    /**
     * Gets the attributes of the given attribute type, including attributes whose type
     * declares itself as a specialization of that type.
     *
     * @param attributeTypeName the fully qualified attribute type name
     * @return the matching attributes in declaration order, never null
     */
    List<AttributeInfo> getCustomAttributes(String attributeTypeName);
}
